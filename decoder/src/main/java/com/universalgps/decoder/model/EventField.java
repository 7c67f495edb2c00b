package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Auxiliary data attached to an event, e.g. {@code ["x", -0.4531]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"key", "value"})
public record EventField(String key, TelemetryValue value) {
    public EventField {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}

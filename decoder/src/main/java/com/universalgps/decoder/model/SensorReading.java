package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A named sensor value, encoded on the wire as {@code [name, value]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"name", "value"})
public record SensorReading(String name, TelemetryValue value) {
    public SensorReading {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}

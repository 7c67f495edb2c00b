package com.universalgps.decoder.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.List;
import java.util.Objects;

/**
 * Event reported with a GPS message.
 * <p>
 * On the wire an event is an array whose first element is the event code and whose
 * remaining elements are {@code [key, value]} pairs, for example
 * {@code ["HARSH_DRIVING:BRAKING", ["x", -0.4531], ["y", 0.00312]]}. Field order is
 * preserved.
 */
@JsonSerialize(using = TelemetryEventSerializer.class)
public record TelemetryEvent(String code, List<EventField> fields) {
    public TelemetryEvent {
        Objects.requireNonNull(code, "code");
        fields = List.copyOf(fields);
    }

    public static TelemetryEvent of(String code) {
        return new TelemetryEvent(code, List.of());
    }
}

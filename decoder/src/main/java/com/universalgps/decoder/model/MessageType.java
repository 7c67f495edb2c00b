package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Gateway message types. Only {@link #GPS} messages are decoded into telemetry records;
 * the rest are filtered out by the envelope classifier.
 */
public enum MessageType implements WireEnum {
    REGISTER("register"),
    HEARTBEAT("heartbeat"),
    GPS("gps"),
    HISTORY("history"),
    STATUS("status"),
    EVENT("event");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String wireName() {
        return wireName;
    }
}

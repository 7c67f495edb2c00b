package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Activity reported by the device or derived by the gateway.
 */
public enum Activity implements WireEnum {
    UNKNOWN("unknown"),
    STILL("still"),
    WALKING("walking"),
    RUNNING("running"),
    DRIVING("driving"),
    PARKED("parked"),
    IDLING("idling");

    private final String wireName;

    Activity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String wireName() {
        return wireName;
    }
}

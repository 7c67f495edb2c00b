package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Transport the unit used to reach the gateway.
 */
public enum Transmission implements WireEnum {
    TCP("tcp"),
    UDP("udp"),
    HTTP("http"),
    HTTPS("https"),
    SMS("sms");

    private final String wireName;

    Transmission(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String wireName() {
        return wireName;
    }
}

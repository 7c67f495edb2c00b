package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the device identifies itself: by IMEI or by a vendor serial/code.
 */
public enum DeviceIdentifier implements WireEnum {
    IMEI("imei"),
    CODE("code");

    private final String wireName;

    DeviceIdentifier(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String wireName() {
        return wireName;
    }
}

package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * GSM status flags; a message may carry any combination of them.
 */
public enum GsmStatus implements WireEnum {
    ENGINE("engine"),
    NETWORK("network"),
    DATA("data"),
    CONNECTED("connected"),
    VOICE_CALL("voice_call"),
    ROAMING("roaming");

    private final String wireName;

    GsmStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String wireName() {
        return wireName;
    }
}

package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * GSM data/roaming mode of the device modem.
 */
public enum DataMode implements WireEnum {
    HOME_STOP("home_stop"),
    HOME_MOVE("home_move"),
    ROAM_STOP("roam_stop"),
    ROAM_MOVE("roam_move"),
    UNKNOWN_STOP("unknown_stop"),
    UNKNOWN_MOVE("unknown_move");

    private final String wireName;

    DataMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String wireName() {
        return wireName;
    }
}

package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * GPS fix status flags.
 */
public enum FixFlag implements WireEnum {
    FIXED("fixed"),
    PREDICTED("predicted"),
    DIFF_CORRECTED("diff_corrected"),
    LAST_KNOWN("last_known"),
    INVALID_FIX("invalid_fix"),
    TWO_D("2d"),
    LOGGED("logged"),
    INVALID_TIME("invalid_time");

    private final String wireName;

    FixFlag(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String wireName() {
        return wireName;
    }
}

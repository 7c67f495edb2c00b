package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * SIM card identifiers. Any of them may be null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimInfo(
    @JsonProperty("msisdn") String msisdn,
    @JsonProperty("iccid") String iccid,
    @JsonProperty("imsi") String imsi
) {
}

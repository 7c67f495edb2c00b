package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of the reporting unit. Every component may be null.
 *
 * @param identifier whether the unit is identified by {@link #imei} or {@link #serialNo}
 * @param imei the unit IMEI, when identified by IMEI
 * @param serialNo serial number or identification code, when identified by code
 * @param firmwareVersion firmware version, e.g. {@code "1.04"}
 * @param type device vendor/type, e.g. {@code "teltonika"}
 * @param model device model, only reported by some units
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Device(
    @JsonProperty("identifier") DeviceIdentifier identifier,
    @JsonProperty("imei") String imei,
    @JsonProperty("serial_no") String serialNo,
    @JsonProperty("firm_ver") String firmwareVersion,
    @JsonProperty("type") String type,
    @JsonProperty("model") String model
) {
}

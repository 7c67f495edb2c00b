package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * Cellular network state reported with a message.
 * <p>
 * List components are never null; they are empty when the gateway did not report them.
 *
 * @param cid cell ids of the serving base stations
 * @param lcid UTRAN cell ids
 * @param lac location area codes
 * @param carrier carrier code, null when unknown
 * @param rssi received signal strength indications in dBm
 * @param mcc mobile country codes
 * @param mnc mobile network codes
 * @param rcpi received channel power indicators in dBm
 * @param ssValue raw, unit dependent signal strength value
 * @param signalStrength signal strength percentage derived from {@code ssValue}
 * @param dataMode data/roaming mode, null when not reported
 * @param status status flags
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GsmInfo(
    @JsonProperty("cid") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Integer> cid,
    @JsonProperty("lcid") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Integer> lcid,
    @JsonProperty("lac") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Integer> lac,
    @JsonProperty("carrier") Integer carrier,
    @JsonProperty("rssi") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Integer> rssi,
    @JsonProperty("mcc") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> mcc,
    @JsonProperty("mnc") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> mnc,
    @JsonProperty("rcpi") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Integer> rcpi,
    @JsonProperty("ss_value") Integer ssValue,
    @JsonProperty("signal_str") Integer signalStrength,
    @JsonProperty("data_mode") DataMode dataMode,
    @JsonProperty("status") @JsonInclude(JsonInclude.Include.NON_EMPTY) Set<GsmStatus> status
) {
    public GsmInfo {
        cid = List.copyOf(cid);
        lcid = List.copyOf(lcid);
        lac = List.copyOf(lac);
        rssi = List.copyOf(rssi);
        mcc = List.copyOf(mcc);
        mnc = List.copyOf(mnc);
        rcpi = List.copyOf(rcpi);
        status = ModelCollections.enumSet(GsmStatus.class, status);
    }
}

package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Set;

/**
 * A single position reading.
 * <p>
 * A null {@code timestamp} means the unit had no time sync when the position was taken;
 * it is never replaced by a default instant. Odometers and the dilution of precision
 * values are likewise null when not reported, which is different from zero.
 *
 * @param timestamp GPS time of the fix, or null when the unit has no time sync yet
 * @param latitude decimal degrees, -90 to +90
 * @param longitude decimal degrees, -180 to +180
 * @param altitude meters
 * @param speed km/h
 * @param heading compass heading in degrees, 0 to 360
 * @param satellites number of satellites used
 * @param activity activity at the time of the fix
 * @param odometer GPS odometer
 * @param tripOdometer GPS trip odometer
 * @param gnss whether GNSS is enabled, when the unit reports it
 * @param hdop horizontal dilution of precision
 * @param vdop vertical dilution of precision
 * @param pdop position (3D) dilution of precision
 * @param tdop time dilution of precision
 * @param fix fix status flags
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GpsFix(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("latitude") double latitude,
    @JsonProperty("longitude") double longitude,
    @JsonProperty("altitude") double altitude,
    @JsonProperty("speed") double speed,
    @JsonProperty("heading") double heading,
    @JsonProperty("satellites") int satellites,
    @JsonProperty("activity") Activity activity,
    @JsonProperty("odometer") Integer odometer,
    @JsonProperty("trip_odo") Integer tripOdometer,
    @JsonProperty("gnss") Boolean gnss,
    @JsonProperty("hdop") Double hdop,
    @JsonProperty("vdop") Double vdop,
    @JsonProperty("pdop") Double pdop,
    @JsonProperty("tdop") Double tdop,
    @JsonProperty("fix") @JsonInclude(JsonInclude.Include.NON_EMPTY) Set<FixFlag> fix
) {
    public GpsFix {
        fix = ModelCollections.enumSet(FixFlag.class, fix);
    }

    public boolean hasTimeSync() {
        return timestamp != null;
    }
}

package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Fully decoded GPS v1 gateway message.
 * <p>
 * Instances are immutable. {@code device}, {@code gps}, {@code gsm} and {@code sims} are
 * always present; every other scalar component is null when the message did not carry
 * it, and every other list is empty.
 *
 * @param messageVer message structure version
 * @param messageType message type, {@link MessageType#GPS} for decoded messages
 * @param gateway domain of the gateway that received the message
 * @param port TCP/UDP port the unit connected to
 * @param transmission transport used by the unit
 * @param timestamp time the gateway received the message (not the GPS time)
 * @param source message source, e.g. {@code device} or {@code 3rd_party_service}
 * @param seqNo sequence number, usually provided by the unit
 * @param valid whether the gateway validated the message as a usable position
 * @param activity activity reported at message level
 * @param device reporting unit
 * @param network network endpoint of the unit
 * @param gsm cellular state, one entry per modem
 * @param sims SIM cards
 * @param gps position reading
 * @param events events in reported order
 * @param sensors sensor readings in reported order
 * @param inputs digital input states, one {@code 0}/{@code 1} per input
 * @param outputs digital output states, one {@code 0}/{@code 1} per output
 * @param auxInputs banks of auxiliary inputs from external I/O devices
 * @param analogInputs analog input values
 * @param obdPids OBD-II mode 01 parameters in reported order
 * @param canBus CAN bus entries in reported order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TelemetryRecord(
    @JsonProperty("message_ver") Integer messageVer,
    @JsonProperty("message_type") MessageType messageType,
    @JsonProperty("gateway") String gateway,
    @JsonProperty("port") Integer port,
    @JsonProperty("transmission") Transmission transmission,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("source") String source,
    @JsonProperty("seq_no") Integer seqNo,
    @JsonProperty("valid") Boolean valid,
    @JsonProperty("activity") Activity activity,
    @JsonProperty("device") Device device,
    @JsonProperty("network") Network network,
    @JsonProperty("gsm") List<GsmInfo> gsm,
    @JsonProperty("sims") List<SimInfo> sims,
    @JsonProperty("gps") GpsFix gps,
    @JsonProperty("events") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<TelemetryEvent> events,
    @JsonProperty("sensors") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<SensorReading> sensors,
    @JsonProperty("inputs") String inputs,
    @JsonProperty("outputs") String outputs,
    @JsonProperty("aux_inputs") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> auxInputs,
    @JsonProperty("an_inputs") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Double> analogInputs,
    @JsonProperty("obd_ii") @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonSerialize(using = ObdSectionSerializer.class) List<ObdPid> obdPids,
    @JsonProperty("can_bus") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<CanEntry> canBus
) {
    public TelemetryRecord {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(gps, "gps");
        gsm = List.copyOf(gsm);
        sims = List.copyOf(sims);
        events = List.copyOf(events);
        sensors = List.copyOf(sensors);
        auxInputs = List.copyOf(auxInputs);
        analogInputs = List.copyOf(analogInputs);
        obdPids = List.copyOf(obdPids);
        canBus = List.copyOf(canBus);
    }
}

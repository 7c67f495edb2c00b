package com.universalgps.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalgps.decoder.model.Activity;
import com.universalgps.decoder.model.CanEntry;
import com.universalgps.decoder.model.DataMode;
import com.universalgps.decoder.model.Device;
import com.universalgps.decoder.model.DeviceIdentifier;
import com.universalgps.decoder.model.EventField;
import com.universalgps.decoder.model.FixFlag;
import com.universalgps.decoder.model.GpsFix;
import com.universalgps.decoder.model.GsmInfo;
import com.universalgps.decoder.model.GsmStatus;
import com.universalgps.decoder.model.MessageType;
import com.universalgps.decoder.model.Network;
import com.universalgps.decoder.model.ObdPid;
import com.universalgps.decoder.model.SensorReading;
import com.universalgps.decoder.model.SimInfo;
import com.universalgps.decoder.model.TelemetryEvent;
import com.universalgps.decoder.model.TelemetryRecord;
import com.universalgps.decoder.model.Transmission;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Second decoding stage: turns a GPS v1 payload into a {@link TelemetryRecord}.
 * <p>
 * Callers are expected to have classified the payload as {@link Decision#DECODABLE};
 * the decoder only checks structure, not message type or validity. {@code device},
 * {@code gps}, {@code gsm} and {@code sims} are required, everything else is optional.
 * A missing or malformed required field fails the whole decode. Enum values outside the
 * known vocabulary are read as absent and unknown flags are dropped.
 * <p>
 * Stateless and safe for concurrent use.
 */
public class TelemetryDecoder {

    private final ObjectMapper mapper;

    public TelemetryDecoder() {
        this(TelemetryJson.getObjectMapper());
    }

    public TelemetryDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Decode a complete GPS message.
     *
     * @param payload UTF-8 JSON message
     * @return the decoded record
     * @throws TelemetryDecodeException if the payload is not a JSON object or a field has the wrong shape
     */
    public TelemetryRecord decode(byte[] payload) throws TelemetryDecodeException {
        if (payload == null || payload.length == 0) {
            throw new TelemetryDecodeException("$", "empty payload");
        }

        JsonNode tree;
        try {
            tree = mapper.readTree(payload);
        } catch (IOException e) {
            throw new TelemetryDecodeException("$", "payload is not valid JSON", e);
        }
        if (tree == null || !tree.isObject()) {
            throw new TelemetryDecodeException("$", "payload is not a JSON object");
        }

        return decodeRecord(NodeReader.root(tree));
    }

    private TelemetryRecord decodeRecord(NodeReader root) throws TelemetryDecodeException {
        // Required sub-structures are read first; a missing one is reported before any optional field.
        Device device = decodeDevice(root.requiredObject("device"));
        GpsFix gps = decodeGps(root.requiredObject("gps"));
        List<GsmInfo> gsm = decodeGsm(root.requiredArray("gsm"));
        List<SimInfo> sims = decodeSims(root.requiredArray("sims"));

        NodeReader network = root.optionalObject("network");
        NodeReader obd = root.optionalObject("obd_ii");

        return new TelemetryRecord(
            root.optionalInt("message_ver"),
            root.optionalEnum(MessageType.class, "message_type"),
            root.optionalText("gateway"),
            root.optionalInt("port"),
            root.optionalEnum(Transmission.class, "transmission"),
            root.optionalInstant("timestamp"),
            root.optionalText("source"),
            root.optionalInt("seq_no"),
            root.optionalBoolean("valid"),
            root.optionalEnum(Activity.class, "activity"),
            device,
            network == null ? null : decodeNetwork(network),
            gsm,
            sims,
            gps,
            decodeEvents(root.optionalArray("events")),
            decodeSensors(root.optionalArray("sensors")),
            root.optionalText("inputs"),
            root.optionalText("outputs"),
            root.textList("aux_inputs"),
            root.doubleList("an_inputs"),
            obd == null ? List.of() : decodeObdPids(obd.optionalArray("mode_01")),
            decodeCanBus(root.optionalArray("can_bus"))
        );
    }

    private Device decodeDevice(NodeReader device) throws TelemetryDecodeException {
        return new Device(
            device.optionalEnum(DeviceIdentifier.class, "identifier"),
            device.optionalText("imei"),
            device.optionalText("serial_no"),
            device.optionalText("firm_ver"),
            device.optionalText("type"),
            device.optionalText("model")
        );
    }

    private Network decodeNetwork(NodeReader network) throws TelemetryDecodeException {
        return new Network(
            network.optionalText("remote_ipv4"),
            network.optionalText("remote_ipv6"),
            network.optionalInt("remote_port"),
            network.optionalText("mac")
        );
    }

    private List<GsmInfo> decodeGsm(List<NodeReader> entries) throws TelemetryDecodeException {
        List<GsmInfo> gsm = new ArrayList<>(entries.size());
        for (NodeReader entry : entries) {
            NodeReader item = expectObject(entry);
            gsm.add(new GsmInfo(
                item.intList("cid"),
                item.intList("lcid"),
                item.intList("lac"),
                item.optionalInt("carrier"),
                item.intList("rssi"),
                item.textList("mcc"),
                item.textList("mnc"),
                item.intList("rcpi"),
                item.optionalInt("ss_value"),
                item.optionalInt("signal_str"),
                item.optionalEnum(DataMode.class, "data_mode"),
                item.enumSet(GsmStatus.class, "status")
            ));
        }
        return gsm;
    }

    private List<SimInfo> decodeSims(List<NodeReader> entries) throws TelemetryDecodeException {
        List<SimInfo> sims = new ArrayList<>(entries.size());
        for (NodeReader entry : entries) {
            NodeReader item = expectObject(entry);
            sims.add(new SimInfo(
                item.optionalText("msisdn"),
                item.optionalText("iccid"),
                item.optionalText("imsi")
            ));
        }
        return sims;
    }

    private GpsFix decodeGps(NodeReader gps) throws TelemetryDecodeException {
        return new GpsFix(
            gps.optionalInstant("timestamp"),
            gps.requiredDouble("latitude"),
            gps.requiredDouble("longitude"),
            gps.requiredDouble("altitude"),
            gps.requiredDouble("speed"),
            gps.requiredDouble("heading"),
            gps.requiredInt("satellites"),
            gps.optionalEnum(Activity.class, "activity"),
            gps.optionalInt("odometer"),
            gps.optionalInt("trip_odo"),
            gps.optionalBoolean("gnss"),
            gps.optionalDouble("hdop"),
            gps.optionalDouble("vdop"),
            gps.optionalDouble("pdop"),
            gps.optionalDouble("tdop"),
            gps.enumSet(FixFlag.class, "fix")
        );
    }

    /**
     * Each event is {@code [code, [key, value], [key, value], ...]}. Elements after the
     * code that are not two-element arrays of scalars carry no field data and are skipped.
     * A key that is not a string is kept in its textual form, e.g. {@code "null"} or {@code "1"}.
     */
    private List<TelemetryEvent> decodeEvents(List<NodeReader> entries) throws TelemetryDecodeException {
        List<TelemetryEvent> events = new ArrayList<>(entries.size());
        for (NodeReader entry : entries) {
            List<NodeReader> elements = entry.elements();
            if (elements.isEmpty()) {
                throw entry.error("event has no code");
            }

            String code = elements.get(0).asText();
            List<EventField> fields = new ArrayList<>();
            for (NodeReader element : elements.subList(1, elements.size())) {
                if (isScalarPair(element)) {
                    fields.add(new EventField(element.element(0).asValue().asText(), element.element(1).asValue()));
                }
            }
            events.add(new TelemetryEvent(code, fields));
        }
        return events;
    }

    private List<SensorReading> decodeSensors(List<NodeReader> entries) throws TelemetryDecodeException {
        List<SensorReading> sensors = new ArrayList<>(entries.size());
        for (NodeReader entry : entries) {
            requirePair(entry);
            sensors.add(new SensorReading(entry.element(0).asText(), entry.element(1).asValue()));
        }
        return sensors;
    }

    private List<ObdPid> decodeObdPids(List<NodeReader> entries) throws TelemetryDecodeException {
        List<ObdPid> pids = new ArrayList<>(entries.size());
        for (NodeReader entry : entries) {
            requirePair(entry);
            pids.add(new ObdPid(entry.element(0).asInt(), entry.element(1).asInt()));
        }
        return pids;
    }

    private List<CanEntry> decodeCanBus(List<NodeReader> entries) throws TelemetryDecodeException {
        List<CanEntry> canBus = new ArrayList<>(entries.size());
        for (NodeReader entry : entries) {
            requirePair(entry);
            canBus.add(new CanEntry(entry.element(0).asInt(), entry.element(1).asInt()));
        }
        return canBus;
    }

    private static boolean isPair(NodeReader element) {
        return element.isArray() && element.size() == 2;
    }

    private static boolean isScalarPair(NodeReader element) {
        return isPair(element) && element.element(0).isScalar() && element.element(1).isScalar();
    }

    private static void requirePair(NodeReader entry) throws TelemetryDecodeException {
        if (!isPair(entry)) {
            throw entry.error("expected a two-element [key, value] array");
        }
    }

    private static NodeReader expectObject(NodeReader entry) throws TelemetryDecodeException {
        if (!entry.node().isObject()) {
            throw entry.error("expected an object but found " + entry.node().getNodeType());
        }
        return entry;
    }
}

package com.universalgps.generators;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.universalgps.decoder.TelemetryEncoder;
import com.universalgps.decoder.TelemetryJson;
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
import com.universalgps.decoder.model.TelemetryValue;
import com.universalgps.decoder.model.Transmission;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Builds the messages a gateway would publish for a simulated device.
 * <p>
 * Most messages are valid GPS v1 fixes. Some are heartbeats and some are fixes the gateway
 * flagged as invalid, so that consumers see traffic they have to skip.
 */
public class GpsMessageFactory {

    static final String GATEWAY = "gw1.universalgps.example";
    static final int GATEWAY_PORT = 5027;

    // 80% valid GPS, 10% heartbeat, 10% invalid GPS
    private static final double HEARTBEAT_PROBABILITY = 0.10;
    private static final double INVALID_PROBABILITY = 0.10;
    private static final double NO_TIME_SYNC_PROBABILITY = 0.05;
    private static final double HARSH_EVENT_PROBABILITY = 0.05;

    private final Random random;
    private final Clock clock;
    private final TelemetryEncoder encoder;
    private final ObjectMapper mapper;

    public GpsMessageFactory(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
        this.mapper = TelemetryJson.getObjectMapper();
        this.encoder = new TelemetryEncoder(mapper);
    }

    /**
     * Advance the device by one interval and build the next message it reports.
     */
    GatewayMessage next(SimulatedDevice device, double intervalSeconds) {
        device.advance(random, intervalSeconds);
        double rand = random.nextDouble();
        if (rand < HEARTBEAT_PROBABILITY) {
            return heartbeat(device);
        }
        boolean valid = rand >= HEARTBEAT_PROBABILITY + INVALID_PROBABILITY;
        return new GatewayMessage(routingKey(device), encoder.encode(gpsRecord(device, valid)));
    }

    static String routingKey(SimulatedDevice device) {
        return "gps." + device.imei();
    }

    TelemetryRecord gpsRecord(SimulatedDevice device, boolean valid) {
        Instant received = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        boolean timeSync = valid && random.nextDouble() >= NO_TIME_SYNC_PROBABILITY;
        Activity activity = activity(device);

        Set<FixFlag> fix = EnumSet.noneOf(FixFlag.class);
        if (!valid) {
            fix.add(FixFlag.INVALID_FIX);
            fix.add(FixFlag.LAST_KNOWN);
        } else {
            fix.add(FixFlag.FIXED);
        }
        if (!timeSync) {
            fix.add(FixFlag.INVALID_TIME);
        }

        GpsFix gps = new GpsFix(
            timeSync ? received.minusSeconds(random.nextInt(5)) : null,
            round(device.latitude(), 6),
            round(device.longitude(), 6),
            round(20 + random.nextDouble() * 200, 1),
            round(device.speed(), 1),
            round(device.heading(), 1),
            valid ? 6 + random.nextInt(8) : random.nextInt(3),
            activity,
            device.odometerMeters(),
            device.tripMeters(),
            Boolean.TRUE,
            round(0.6 + random.nextDouble() * 1.4, 1),
            round(0.8 + random.nextDouble() * 1.6, 1),
            round(1.0 + random.nextDouble() * 2.0, 1),
            null,
            fix
        );

        return new TelemetryRecord(
            1,
            MessageType.GPS,
            GATEWAY,
            GATEWAY_PORT,
            Transmission.TCP,
            received,
            "device",
            device.seqNo(),
            valid,
            activity,
            new Device(DeviceIdentifier.IMEI, device.imei(), null, "1.04", "teltonika", "FMB920"),
            new Network("41.13.22." + (1 + random.nextInt(254)), null, 40000 + random.nextInt(20000), null),
            List.of(gsm(device)),
            List.of(new SimInfo(null, "89270000" + device.imei().substring(4), null)),
            gps,
            events(device),
            sensors(device),
            device.driving() ? "11000000" : "00000000",
            "000",
            List.of(),
            List.of(round(11.8 + random.nextDouble() * 2.6, 2)),
            obdPids(device),
            List.of()
        );
    }

    GatewayMessage heartbeat(SimulatedDevice device) {
        ObjectNode root = mapper.createObjectNode();
        root.put("message_ver", 1);
        root.put("message_type", MessageType.HEARTBEAT.wireName());
        root.put("gateway", GATEWAY);
        root.put("timestamp", clock.instant().truncatedTo(ChronoUnit.SECONDS).toString());
        root.put("valid", true);
        ObjectNode unit = root.putObject("device");
        unit.put("identifier", DeviceIdentifier.IMEI.wireName());
        unit.put("imei", device.imei());
        try {
            return new GatewayMessage(routingKey(device), mapper.writeValueAsBytes(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize heartbeat", e);
        }
    }

    private GsmInfo gsm(SimulatedDevice device) {
        int signal = 40 + random.nextInt(61);
        Set<GsmStatus> status = EnumSet.of(GsmStatus.NETWORK, GsmStatus.DATA, GsmStatus.CONNECTED);
        if (!device.parked()) {
            status.add(GsmStatus.ENGINE);
        }
        return new GsmInfo(
            List.of(28000 + random.nextInt(1000)),
            List.of(),
            List.of(1204),
            65510,
            List.of(-110 + signal / 2),
            List.of("655"),
            List.of("10"),
            List.of(),
            signal / 20,
            signal,
            device.driving() ? DataMode.HOME_MOVE : DataMode.HOME_STOP,
            status
        );
    }

    private List<TelemetryEvent> events(SimulatedDevice device) {
        if (!device.driving() || random.nextDouble() >= HARSH_EVENT_PROBABILITY) {
            return List.of();
        }
        String code = random.nextBoolean() ? "HARSH_DRIVING:BRAKING" : "HARSH_DRIVING:ACCELERATION";
        return List.of(new TelemetryEvent(code, List.of(
            new EventField("x", TelemetryValue.of(round(random.nextDouble() - 0.5, 4))),
            new EventField("y", TelemetryValue.of(round((random.nextDouble() - 0.5) / 10, 5)))
        )));
    }

    private List<SensorReading> sensors(SimulatedDevice device) {
        List<SensorReading> sensors = new ArrayList<>();
        sensors.add(new SensorReading("charging", TelemetryValue.of(!device.parked())));
        sensors.add(new SensorReading("fuel_level", TelemetryValue.of(round(device.fuelLevel(), 1))));
        return sensors;
    }

    private List<ObdPid> obdPids(SimulatedDevice device) {
        if (!device.driving()) {
            return List.of();
        }
        // 0x0C engine RPM (quarter revolutions), 0x0D vehicle speed
        int rpm = (int) (1500 + device.speed() * 20);
        return List.of(new ObdPid(0x0C, rpm * 4), new ObdPid(0x0D, (int) device.speed()));
    }

    private static Activity activity(SimulatedDevice device) {
        if (device.driving()) {
            return Activity.DRIVING;
        }
        return device.parked() ? Activity.PARKED : Activity.IDLING;
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}

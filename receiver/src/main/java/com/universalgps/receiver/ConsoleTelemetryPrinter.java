package com.universalgps.receiver;

import com.universalgps.decoder.model.CanEntry;
import com.universalgps.decoder.model.EventField;
import com.universalgps.decoder.model.GpsFix;
import com.universalgps.decoder.model.GsmInfo;
import com.universalgps.decoder.model.ObdPid;
import com.universalgps.decoder.model.SensorReading;
import com.universalgps.decoder.model.SimInfo;
import com.universalgps.decoder.model.TelemetryEvent;
import com.universalgps.decoder.model.TelemetryRecord;
import com.universalgps.decoder.model.WireEnum;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Prints selected fields of each decoded GPS message as a block of aligned lines.
 * Absent values are shown as {@code -}; a fix without time sync says so explicitly.
 */
public class ConsoleTelemetryPrinter implements TelemetryRecordHandler {

    static final String SEPARATOR = "=".repeat(78);
    static final String ABSENT = "-";
    static final String NO_TIME_SYNC = "no time sync";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final PrintStream out;

    public ConsoleTelemetryPrinter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void handle(TelemetryRecord record) {
        out.print(format(record));
        out.flush();
    }

    public String format(TelemetryRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append(SEPARATOR).append('\n');

        line(sb, "imei", record.device().imei());
        line(sb, "message_type", record.messageType());
        line(sb, "gateway", record.gateway());
        line(sb, "port", record.port());
        line(sb, "transmission", record.transmission());

        GsmInfo gsm = record.gsm().isEmpty() ? null : record.gsm().get(0);
        line(sb, "gsm.signal_str", gsm == null ? null : gsm.signalStrength());
        line(sb, "gsm.status", gsm == null ? null : join(gsm.status()));

        SimInfo sim = record.sims().isEmpty() ? null : record.sims().get(0);
        line(sb, "sims.msisdn", sim == null ? null : sim.msisdn());
        line(sb, "sims.iccid", sim == null ? null : sim.iccid());

        GpsFix gps = record.gps();
        line(sb, "gps.timestamp", formatFixTime(gps.timestamp()));
        line(sb, "gps.latitude", gps.latitude());
        line(sb, "gps.longitude", gps.longitude());
        line(sb, "gps.altitude", gps.altitude());
        line(sb, "gps.speed", gps.speed());
        line(sb, "gps.heading", gps.heading());
        line(sb, "gps.satellites", gps.satellites());
        line(sb, "gps.activity", gps.activity());
        line(sb, "gps.odometer", gps.odometer());
        line(sb, "gps.trip_odo", gps.tripOdometer());
        line(sb, "gps.fix", join(gps.fix()));
        line(sb, "gps.dop", String.format("hdop: %s vdop: %s pdop: %s tdop: %s",
            orAbsent(gps.hdop()), orAbsent(gps.vdop()), orAbsent(gps.pdop()), orAbsent(gps.tdop())));

        for (TelemetryEvent event : record.events()) {
            line(sb, "event", event.code());
            for (EventField field : event.fields()) {
                sb.append("         field: ").append(field.key()).append('=').append(field.value().asText()).append('\n');
            }
        }
        for (SensorReading sensor : record.sensors()) {
            line(sb, "sensor", sensor.name() + " = " + sensor.value().asText());
        }
        for (ObdPid pid : record.obdPids()) {
            line(sb, "OBD PID", pid.pid() + " = " + pid.value());
        }
        for (CanEntry entry : record.canBus()) {
            line(sb, "CAN bus", entry.id() + " = " + entry.value());
        }

        sb.append(SEPARATOR).append('\n');
        return sb.toString();
    }

    static String formatFixTime(Instant timestamp) {
        return timestamp == null ? NO_TIME_SYNC : TIMESTAMP_FORMAT.format(timestamp);
    }

    private static void line(StringBuilder sb, String label, Object value) {
        sb.append(String.format("%-16s%s", label + ":", orAbsent(value))).append('\n');
    }

    private static String orAbsent(Object value) {
        if (value == null) {
            return ABSENT;
        }
        if (value instanceof WireEnum wireEnum) {
            return wireEnum.wireName();
        }
        return value.toString();
    }

    private static String join(Collection<? extends WireEnum> values) {
        if (values.isEmpty()) {
            return null;
        }
        return values.stream().map(WireEnum::wireName).collect(Collectors.joining(", "));
    }
}

package com.universalgps.generators;

import com.universalgps.decoder.Decision;
import com.universalgps.decoder.EnvelopeClassifier;
import com.universalgps.decoder.TelemetryDecoder;
import com.universalgps.decoder.model.FixFlag;
import com.universalgps.decoder.model.MessageType;
import com.universalgps.decoder.model.TelemetryRecord;
import com.universalgps.decoder.TelemetryEncoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Generated traffic must be understood by the receiver side.
 */
class GpsMessageFactoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:30:00Z");

    private final EnvelopeClassifier classifier = new EnvelopeClassifier();
    private final TelemetryDecoder decoder = new TelemetryDecoder();
    private final TelemetryEncoder encoder = new TelemetryEncoder();

    private GpsMessageFactory factory;
    private SimulatedDevice device;

    @BeforeEach
    void setUp() {
        Random random = new Random(42);
        factory = new GpsMessageFactory(random, Clock.fixed(NOW, ZoneOffset.UTC));
        device = new SimulatedDevice("356307042400001", -33.9249, 18.4241, random);
    }

    @Test
    void testGpsRecord_ValidDecodesToSameRecord() throws Exception {
        device.advance(new Random(7), 2.0);
        TelemetryRecord record = factory.gpsRecord(device, true);

        byte[] payload = encoder.encode(record);

        assertEquals(Decision.DECODABLE, classifier.classify(payload));
        assertEquals(record, decoder.decode(payload));
        assertEquals(NOW, record.timestamp());
        assertEquals("356307042400001", record.device().imei());
    }

    @Test
    void testGpsRecord_InvalidIsIgnored() {
        TelemetryRecord record = factory.gpsRecord(device, false);

        assertFalse(record.valid());
        assertNull(record.gps().timestamp());
        assertTrue(record.gps().fix().contains(FixFlag.INVALID_FIX));
        assertEquals(Decision.IGNORED, classifier.classify(encoder.encode(record)));
    }

    @Test
    void testHeartbeat_IsIgnored() {
        GatewayMessage message = factory.heartbeat(device);

        assertEquals("gps.356307042400001", message.routingKey());
        assertEquals(Decision.IGNORED, classifier.classify(message.payload()));
        assertEquals(MessageType.HEARTBEAT.wireName(), classifier.inspect(message.payload()).envelope().messageType());
    }

    @Test
    void testNext_EveryMessageIsClassifiedAndGpsDecodes() throws Exception {
        int decodable = 0;
        int ignored = 0;
        for (int i = 0; i < 500; i++) {
            GatewayMessage message = factory.next(device, 2.0);
            assertEquals("gps.356307042400001", message.routingKey());

            Decision decision = classifier.classify(message.payload());
            assertNotEquals(Decision.MALFORMED, decision);
            if (decision == Decision.DECODABLE) {
                TelemetryRecord record = decoder.decode(message.payload());
                assertTrue(record.gps().latitude() >= -90 && record.gps().latitude() <= 90);
                decodable++;
            } else {
                ignored++;
            }
        }

        // Mostly valid GPS, with some traffic to skip
        assertTrue(decodable > 300, "decodable=" + decodable);
        assertTrue(ignored > 30, "ignored=" + ignored);
    }

    @Test
    void testAdvance_SequenceNumberIncrements() {
        Random random = new Random(1);
        device.advance(random, 2.0);
        int first = device.seqNo();
        device.advance(random, 2.0);

        assertEquals(first + 1, device.seqNo());
    }
}

package com.universalgps.receiver;

import com.universalgps.common.KafkaConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReceiverConfig.
 */
class ReceiverConfigTest {

    @Test
    void testFromEnvironment_Defaults() {
        ReceiverConfig config = ReceiverConfig.fromEnvironment(Map.of());

        assertEquals(KafkaConfig.getBootstrapServers(), config.bootstrapServers());
        assertEquals(KafkaConfig.DEFAULT_GPS_TOPIC_PATTERN, config.topicPattern());
        assertEquals("gps-receiver", config.groupId());
        assertEquals("gps-receiver-1", config.clientId());
        assertEquals(Duration.ofMillis(500), config.pollTimeout());
    }

    @Test
    void testFromEnvironment_Overrides() {
        ReceiverConfig config = ReceiverConfig.fromEnvironment(Map.of(
            "KAFKA_BOOTSTRAP_SERVERS", "broker:29092",
            "GPS_TOPIC_PATTERN", "gateway\\..*",
            "RECEIVER_GROUP_ID", "printers",
            "RECEIVER_CLIENT_ID", "printer-7",
            "RECEIVER_POLL_TIMEOUT_MS", "250"
        ));

        assertEquals("broker:29092", config.bootstrapServers());
        assertEquals("gateway\\..*", config.topicPattern());
        assertEquals("printers", config.groupId());
        assertEquals("printer-7", config.clientId());
        assertEquals(Duration.ofMillis(250), config.pollTimeout());
    }

    @Test
    void testFromEnvironment_BlankValuesFallBack() {
        ReceiverConfig config = ReceiverConfig.fromEnvironment(Map.of(
            "RECEIVER_GROUP_ID", "  ",
            "RECEIVER_POLL_TIMEOUT_MS", ""
        ));

        assertEquals("gps-receiver", config.groupId());
        assertEquals(Duration.ofMillis(500), config.pollTimeout());
    }

    @Test
    void testFromEnvironment_InvalidPollTimeout() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ReceiverConfig.fromEnvironment(Map.of("RECEIVER_POLL_TIMEOUT_MS", "soon")));

        assertTrue(e.getMessage().contains("RECEIVER_POLL_TIMEOUT_MS"));
    }

    @Test
    void testConstructor_NonPositivePollTimeoutUsesDefault() {
        ReceiverConfig config = new ReceiverConfig(null, null, null, null, Duration.ZERO);

        assertEquals(Duration.ofMillis(500), config.pollTimeout());
    }

    @Test
    void testConstructor_InvalidTopicPattern() {
        assertThrows(PatternSyntaxException.class,
            () -> new ReceiverConfig(null, "gps.(", null, null, null));
    }

    @Test
    void testTopicRegex_MatchesRoutingKeys() {
        ReceiverConfig config = ReceiverConfig.fromEnvironment(Map.of());

        assertTrue(config.topicRegex().matcher("gps.messages").matches());
        assertTrue(config.topicRegex().matcher("gps.356307042441013").matches());
        assertFalse(config.topicRegex().matcher("vehicle.telemetry").matches());
    }
}

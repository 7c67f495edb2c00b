package com.universalgps.receiver;

import com.universalgps.common.KafkaConfig;

import java.time.Duration;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Settings for the broker side of the receiver, passed to {@link TelemetryReceiver} at construction.
 * Blank values fall back to the defaults.
 *
 * @param bootstrapServers Kafka bootstrap servers
 * @param topicPattern regular expression selecting the topics to consume
 * @param groupId consumer group; receivers sharing it split the partitions between them
 * @param clientId client identifier reported to the broker
 * @param pollTimeout maximum time a single poll blocks waiting for messages
 */
public record ReceiverConfig(
    String bootstrapServers,
    String topicPattern,
    String groupId,
    String clientId,
    Duration pollTimeout
) {
    static final String DEFAULT_GROUP_ID = "gps-receiver";
    static final String DEFAULT_CLIENT_ID = "gps-receiver-1";
    static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);

    public ReceiverConfig {
        if (bootstrapServers == null || bootstrapServers.isBlank()) {
            bootstrapServers = KafkaConfig.getBootstrapServers();
        }
        if (topicPattern == null || topicPattern.isBlank()) {
            topicPattern = KafkaConfig.DEFAULT_GPS_TOPIC_PATTERN;
        }
        if (groupId == null || groupId.isBlank()) {
            groupId = DEFAULT_GROUP_ID;
        }
        if (clientId == null || clientId.isBlank()) {
            clientId = DEFAULT_CLIENT_ID;
        }
        if (pollTimeout == null || pollTimeout.isNegative() || pollTimeout.isZero()) {
            pollTimeout = DEFAULT_POLL_TIMEOUT;
        }
        // Throws PatternSyntaxException for an invalid pattern
        Pattern.compile(topicPattern);
    }

    public static ReceiverConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static ReceiverConfig fromEnvironment(Map<String, String> env) {
        return new ReceiverConfig(
            env.get("KAFKA_BOOTSTRAP_SERVERS"),
            env.get("GPS_TOPIC_PATTERN"),
            env.get("RECEIVER_GROUP_ID"),
            env.get("RECEIVER_CLIENT_ID"),
            parseMillis(env.get("RECEIVER_POLL_TIMEOUT_MS"))
        );
    }

    public Pattern topicRegex() {
        return Pattern.compile(topicPattern);
    }

    private static Duration parseMillis(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("RECEIVER_POLL_TIMEOUT_MS must be a number of milliseconds: " + value, e);
        }
    }
}

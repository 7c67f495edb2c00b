package com.universalgps.common;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.util.Properties;

/**
 * Centralized Kafka configuration for the receiver and the data generators.
 * Message values are raw UTF-8 JSON bytes; keys are the gateway routing key, e.g. {@code gps.<imei>}.
 */
public class KafkaConfig {

    private static final String BOOTSTRAP_SERVERS =
        System.getenv().getOrDefault("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092");

    /** Topic the gateway publishes GPS JSON messages to. */
    public static final String DEFAULT_GPS_TOPIC = "gps.messages";

    /** Subscription pattern matching every gateway GPS topic. */
    public static final String DEFAULT_GPS_TOPIC_PATTERN = "gps\\..*";

    private static final String GPS_TOPIC =
        System.getenv().getOrDefault("GPS_TOPIC", DEFAULT_GPS_TOPIC);

    /**
     * Create Kafka producer configuration for JSON message bytes.
     *
     * @param clientId Unique client identifier
     * @return Producer properties
     */
    public static Properties createProducerConfig(String clientId) {
        return createProducerConfig(BOOTSTRAP_SERVERS, clientId);
    }

    /**
     * Create Kafka producer configuration for JSON message bytes.
     *
     * @param bootstrapServers Kafka bootstrap servers
     * @param clientId Unique client identifier
     * @return Producer properties
     */
    public static Properties createProducerConfig(String bootstrapServers, String clientId) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());

        // Producer reliability settings
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, "3");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "1");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");

        return props;
    }

    /**
     * Create Kafka consumer configuration for JSON message bytes.
     *
     * @param groupId Consumer group identifier
     * @param clientId Unique client identifier
     * @return Consumer properties
     */
    public static Properties createConsumerConfig(String groupId, String clientId) {
        return createConsumerConfig(BOOTSTRAP_SERVERS, groupId, clientId);
    }

    /**
     * Create Kafka consumer configuration for JSON message bytes.
     * Offsets are committed by the application once messages have been handled,
     * so a crash before that point redelivers them.
     *
     * @param bootstrapServers Kafka bootstrap servers
     * @param groupId Consumer group identifier
     * @param clientId Unique client identifier
     * @return Consumer properties
     */
    public static Properties createConsumerConfig(String bootstrapServers, String groupId, String clientId) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.CLIENT_ID_CONFIG, clientId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());

        // Consumer settings
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        // Pick up new gps.* topics quickly when subscribed by pattern
        props.put(ConsumerConfig.METADATA_MAX_AGE_CONFIG, "30000");

        return props;
    }

    /**
     * Get the configured Kafka bootstrap servers.
     *
     * @return Bootstrap servers string
     */
    public static String getBootstrapServers() {
        return BOOTSTRAP_SERVERS;
    }

    /**
     * Get the topic GPS messages are published to.
     *
     * @return Topic name
     */
    public static String getGpsTopic() {
        return GPS_TOPIC;
    }
}

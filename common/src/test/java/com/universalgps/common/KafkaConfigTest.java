package com.universalgps.common;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.junit.jupiter.api.Test;

import java.util.Properties;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class KafkaConfigTest {

    @Test
    void testConsumerConfig_UsesManualCommitAndByteValues() {
        Properties props = KafkaConfig.createConsumerConfig("broker:9092", "gps-receiver", "receiver-1");

        assertEquals("broker:9092", props.get(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals("gps-receiver", props.get(ConsumerConfig.GROUP_ID_CONFIG));
        assertEquals("receiver-1", props.get(ConsumerConfig.CLIENT_ID_CONFIG));
        assertEquals("false", props.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
        assertEquals(ByteArrayDeserializer.class.getName(), props.get(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG));
    }

    @Test
    void testConsumerConfig_DefaultsToEnvironmentBootstrap() {
        Properties props = KafkaConfig.createConsumerConfig("gps-receiver", "receiver-1");

        assertEquals(KafkaConfig.getBootstrapServers(), props.get(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG));
    }

    @Test
    void testProducerConfig_IsIdempotentWithByteValues() {
        Properties props = KafkaConfig.createProducerConfig("broker:9092", "generator");

        assertEquals("broker:9092", props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals("all", props.get(ProducerConfig.ACKS_CONFIG));
        assertEquals("true", props.get(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG));
        assertEquals(ByteArraySerializer.class.getName(), props.get(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG));
    }

    @Test
    void testDefaultTopicMatchesDefaultPattern() {
        assertTrue(Pattern.compile(KafkaConfig.DEFAULT_GPS_TOPIC_PATTERN).matcher(KafkaConfig.DEFAULT_GPS_TOPIC).matches());
        assertFalse(Pattern.compile(KafkaConfig.DEFAULT_GPS_TOPIC_PATTERN).matcher("status.messages").matches());
    }
}

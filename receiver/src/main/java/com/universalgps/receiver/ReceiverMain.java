package com.universalgps.receiver;

import com.universalgps.common.KafkaConfig;
import com.universalgps.decoder.EnvelopeClassifier;
import com.universalgps.decoder.TelemetryDecoder;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Main entry point for the GPS receiver.
 * Consumes gateway messages from Kafka and prints every valid GPS v1 message to the console.
 */
public class ReceiverMain {

    private static final Logger LOG = LoggerFactory.getLogger(ReceiverMain.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    public static void main(String[] args) {
        ReceiverConfig config;
        try {
            config = ReceiverConfig.fromEnvironment();
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid receiver configuration", e);
            System.exit(1);
            return;
        }

        LOG.info("=".repeat(60));
        LOG.info("Universal GPS JSON Receiver");
        LOG.info("=".repeat(60));
        LOG.info("Receiver configuration:");
        LOG.info("  Bootstrap Servers: {}", config.bootstrapServers());
        LOG.info("  Topic Pattern: {}", config.topicPattern());
        LOG.info("  Consumer Group: {}", config.groupId());
        LOG.info("  Client ID: {}", config.clientId());

        KafkaConsumer<String, byte[]> consumer = new KafkaConsumer<>(
            KafkaConfig.createConsumerConfig(config.bootstrapServers(), config.groupId(), config.clientId()));

        TelemetryMessageProcessor processor = new TelemetryMessageProcessor(
            new EnvelopeClassifier(),
            new TelemetryDecoder(),
            new ConsoleTelemetryPrinter(System.out));
        TelemetryReceiver receiver = new TelemetryReceiver(consumer, config, processor);

        Runtime.getRuntime().addShutdownHook(new Thread("receiver-shutdown-hook") {
            @Override
            public void run() {
                LOG.info("Shutting down GPS receiver");
                receiver.stop();
                try {
                    if (!receiver.awaitShutdown(SHUTDOWN_TIMEOUT)) {
                        LOG.warn("Receiver did not stop within {}", SHUTDOWN_TIMEOUT);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });

        try {
            LOG.info("Waiting for messages, press Ctrl+C to exit...");
            receiver.run();
        } catch (Exception e) {
            LOG.error("Unexpected error", e);
            System.exit(1);
        }
    }
}

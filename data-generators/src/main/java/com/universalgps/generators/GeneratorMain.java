package com.universalgps.generators;

import com.universalgps.common.KafkaConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the GPS traffic generator.
 */
public class GeneratorMain {

    private static final Logger LOG = LoggerFactory.getLogger(GeneratorMain.class);
    private static final int DEFAULT_DEVICE_COUNT = 20;

    public static void main(String[] args) {
        int deviceCount;
        try {
            deviceCount = deviceCount(System.getenv("GENERATOR_DEVICE_COUNT"));
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid generator configuration", e);
            System.exit(1);
            return;
        }

        LOG.info("=".repeat(60));
        LOG.info("Universal GPS - Gateway Traffic Generator");
        LOG.info("=".repeat(60));
        LOG.info("  Bootstrap Servers: {}", KafkaConfig.getBootstrapServers());
        LOG.info("  Topic: {}", KafkaConfig.getGpsTopic());
        LOG.info("  Devices: {}", deviceCount);

        GpsMessageGenerator generator = new GpsMessageGenerator(deviceCount);
        Runtime.getRuntime().addShutdownHook(new Thread(generator::stop, "generator-shutdown-hook"));
        generator.start();

        // Keep main thread alive
        try {
            Thread.sleep(Long.MAX_VALUE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Generator main thread interrupted, shutting down...");
        }
    }

    static int deviceCount(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_DEVICE_COUNT;
        }
        try {
            int count = Integer.parseInt(value.trim());
            if (count <= 0) {
                throw new IllegalArgumentException("GENERATOR_DEVICE_COUNT must be positive: " + value);
            }
            return count;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("GENERATOR_DEVICE_COUNT must be a number: " + value, e);
        }
    }
}

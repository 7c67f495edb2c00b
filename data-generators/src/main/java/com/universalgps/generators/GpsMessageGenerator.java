package com.universalgps.generators;

import com.universalgps.common.KafkaConfig;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * GPS gateway traffic generator.
 * Each simulated device reports every 2-4 seconds; devices start around a handful of cities.
 */
public class GpsMessageGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(GpsMessageGenerator.class);

    // Cape Town, Johannesburg, Durban, Nairobi, Lagos
    private static final double[][] START_POSITIONS = {
        {-33.9249, 18.4241},
        {-26.2041, 28.0473},
        {-29.8587, 31.0218},
        {-1.2921, 36.8219},
        {6.5244, 3.3792}
    };

    private final Producer<String, byte[]> producer;
    private final String topic;
    private final GpsMessageFactory factory;
    private final List<SimulatedDevice> devices;
    private final ScheduledExecutorService scheduler;

    public GpsMessageGenerator(int deviceCount) {
        this(new KafkaProducer<>(KafkaConfig.createProducerConfig("gps-message-generator")),
            KafkaConfig.getGpsTopic(), deviceCount, new Random());
    }

    GpsMessageGenerator(Producer<String, byte[]> producer, String topic, int deviceCount, Random random) {
        if (deviceCount <= 0) {
            throw new IllegalArgumentException("deviceCount must be positive: " + deviceCount);
        }
        this.producer = producer;
        this.topic = topic;
        this.factory = new GpsMessageFactory(random, Clock.systemUTC());
        this.devices = createDevices(deviceCount, random);
        this.scheduler = Executors.newScheduledThreadPool(Math.min(deviceCount, 10));
        LOG.info("GpsMessageGenerator initialized with {} devices", devices.size());
    }

    private static List<SimulatedDevice> createDevices(int count, Random random) {
        List<SimulatedDevice> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double[] start = START_POSITIONS[i % START_POSITIONS.length];
            String imei = String.format(Locale.ROOT, "3563070424%05d", i);
            result.add(new SimulatedDevice(imei,
                start[0] + (random.nextDouble() - 0.5) * 0.2,
                start[1] + (random.nextDouble() - 0.5) * 0.2,
                random));
        }
        return result;
    }

    public void start() {
        LOG.info("Starting GpsMessageGenerator, publishing to '{}'", topic);

        int index = 0;
        for (SimulatedDevice device : devices) {
            long initialDelay = index * 200L;
            long interval = 2000 + ThreadLocalRandom.current().nextLong(2000);
            double intervalSeconds = interval / 1000.0;

            scheduler.scheduleAtFixedRate(() -> {
                try {
                    publish(device, intervalSeconds);
                } catch (Exception e) {
                    LOG.error("Error generating message for device {}", device.imei(), e);
                }
            }, initialDelay, interval, TimeUnit.MILLISECONDS);

            index++;
        }
    }

    void publish(SimulatedDevice device, double intervalSeconds) {
        GatewayMessage message = factory.next(device, intervalSeconds);

        producer.send(new ProducerRecord<>(topic, message.routingKey(), message.payload()), (metadata, exception) -> {
            if (exception != null) {
                LOG.error("Failed to send message for device {}", device.imei(), exception);
            } else {
                LOG.debug("Sent message for {} to {}-{}@{}",
                    device.imei(), metadata.topic(), metadata.partition(), metadata.offset());
            }
        });
    }

    List<SimulatedDevice> devices() {
        return devices;
    }

    public void stop() {
        LOG.info("Shutting down GpsMessageGenerator");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        producer.close();
    }
}

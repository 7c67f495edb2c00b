package com.universalgps.decoder;

import com.universalgps.decoder.model.TelemetryRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.universalgps.decoder.TestMessages.utf8;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Classifier and decoder instances shared between threads give the same results as
 * sequential use.
 */
class ConcurrentDecodeTest {

    private static final int THREADS = 8;
    private static final int MESSAGES = 400;

    private static byte[] messageFor(int i) {
        return utf8("{\"message_ver\":1,\"message_type\":\"gps\",\"valid\":true,"
            + "\"device\":{\"imei\":\"IMEI-" + i + "\"},\"gsm\":[],\"sims\":[],"
            + "\"gps\":{\"latitude\":" + i + ".25,\"longitude\":-" + i + ".5,\"altitude\":0,\"speed\":" + (i % 120)
            + ",\"heading\":0,\"satellites\":" + (i % 12) + "},"
            + "\"events\":[[\"EV-" + i + "\",[\"n\"," + i + "]]],"
            + "\"sensors\":[[\"s\"," + (i % 2 == 0 ? "true" : "\"odd\"") + "]]}");
    }

    @Test
    void testConcurrentDecodes_AreIndependent() throws Exception {
        EnvelopeClassifier classifier = new EnvelopeClassifier();
        TelemetryDecoder decoder = new TelemetryDecoder();
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<TelemetryRecord>> results = new ArrayList<>();
            for (int i = 0; i < MESSAGES; i++) {
                byte[] payload = messageFor(i);
                Callable<TelemetryRecord> task = () -> {
                    start.await();
                    assertEquals(Decision.DECODABLE, classifier.classify(payload));
                    return decoder.decode(payload);
                };
                results.add(executor.submit(task));
            }
            start.countDown();

            for (int i = 0; i < MESSAGES; i++) {
                TelemetryRecord record = results.get(i).get(30, TimeUnit.SECONDS);
                assertEquals(decoder.decode(messageFor(i)), record);
                assertEquals("IMEI-" + i, record.device().imei());
                assertEquals("EV-" + i, record.events().get(0).code());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}

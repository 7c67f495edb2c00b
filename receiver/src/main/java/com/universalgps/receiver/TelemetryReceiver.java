package com.universalgps.receiver;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Poll loop that feeds gateway messages to a {@link TelemetryMessageProcessor}.
 * <p>
 * Messages are handled one at a time on the polling thread. Offsets are committed after
 * each batch up to the last message that did not ask for redelivery; when a handler fails
 * the partition is rewound to that message so the next poll delivers it again.
 */
public class TelemetryReceiver implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetryReceiver.class);

    private final Consumer<String, byte[]> consumer;
    private final ReceiverConfig config;
    private final TelemetryMessageProcessor processor;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final CountDownLatch stopped = new CountDownLatch(1);

    public TelemetryReceiver(Consumer<String, byte[]> consumer,
                             ReceiverConfig config,
                             TelemetryMessageProcessor processor) {
        this.consumer = consumer;
        this.config = config;
        this.processor = processor;
    }

    @Override
    public void run() {
        try {
            consumer.subscribe(config.topicRegex());
            LOG.info("Subscribed to topics matching '{}' as group '{}'", config.topicPattern(), config.groupId());

            while (running.get()) {
                pollOnce();
            }
        } catch (WakeupException e) {
            // Expected when stop() interrupts a poll
            if (running.get()) {
                throw e;
            }
        } finally {
            consumer.close();
            stopped.countDown();
            LOG.info("Receiver stopped");
        }
    }

    /**
     * Poll once and handle everything returned.
     *
     * @return number of messages that were handled and committed
     */
    int pollOnce() {
        ConsumerRecords<String, byte[]> records = consumer.poll(config.pollTimeout());
        if (records.isEmpty()) {
            return 0;
        }

        Map<TopicPartition, OffsetAndMetadata> commits = new HashMap<>();
        int handled = 0;
        for (TopicPartition partition : records.partitions()) {
            for (ConsumerRecord<String, byte[]> record : records.records(partition)) {
                ProcessingOutcome outcome = processor.process(record.key(), record.value());
                if (outcome.shouldRedeliver()) {
                    LOG.warn("Rewinding {} to offset {} for redelivery", partition, record.offset());
                    consumer.seek(partition, record.offset());
                    break;
                }
                commits.put(partition, new OffsetAndMetadata(record.offset() + 1));
                handled++;
            }
        }

        if (!commits.isEmpty()) {
            consumer.commitSync(commits);
            LOG.debug("Committed offsets: {}", commits);
        }
        return handled;
    }

    /**
     * Ask the poll loop to finish. Safe to call from any thread.
     */
    public void stop() {
        running.set(false);
        consumer.wakeup();
    }

    public boolean awaitShutdown(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}

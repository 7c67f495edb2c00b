package com.universalgps.receiver;

import com.universalgps.decoder.Classification;
import com.universalgps.decoder.EnvelopeClassifier;
import com.universalgps.decoder.TelemetryDecodeException;
import com.universalgps.decoder.TelemetryDecoder;
import com.universalgps.decoder.model.TelemetryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Runs one inbound message through classification, decoding and the record handler.
 * <p>
 * Malformed messages are logged and dropped: redelivering a corrupt payload cannot fix it.
 * Only a failing handler asks for redelivery.
 */
public class TelemetryMessageProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetryMessageProcessor.class);

    private final EnvelopeClassifier classifier;
    private final TelemetryDecoder decoder;
    private final TelemetryRecordHandler handler;

    public TelemetryMessageProcessor(EnvelopeClassifier classifier,
                                     TelemetryDecoder decoder,
                                     TelemetryRecordHandler handler) {
        this.classifier = classifier;
        this.decoder = decoder;
        this.handler = handler;
    }

    /**
     * Process a single message.
     *
     * @param key routing key of the message, used for logging only
     * @param payload raw message bytes, may be null
     * @return outcome of the processing
     */
    public ProcessingOutcome process(String key, byte[] payload) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Received message: key={}, payload={}", key,
                payload != null ? new String(payload, StandardCharsets.UTF_8) : null);
        }

        Classification classification = classifier.inspect(payload);
        switch (classification.decision()) {
            case MALFORMED:
                LOG.warn("Dropping message with unparseable envelope: key={}", key);
                return ProcessingOutcome.MALFORMED_ENVELOPE;
            case IGNORED:
                LOG.debug("Ignoring message: key={}, envelope={}", key, classification.envelope());
                return ProcessingOutcome.IGNORED;
            default:
                break;
        }

        TelemetryRecord record;
        try {
            record = decoder.decode(payload);
        } catch (TelemetryDecodeException e) {
            LOG.warn("Dropping GPS message that does not match the v1 schema: key={}, field={}",
                key, e.getFieldPath(), e);
            return ProcessingOutcome.MALFORMED_PAYLOAD;
        }

        try {
            handler.handle(record);
        } catch (RuntimeException e) {
            LOG.error("Handler failed for GPS message: key={}, imei={}", key, record.device().imei(), e);
            return ProcessingOutcome.HANDLER_FAILED;
        }
        return ProcessingOutcome.PROCESSED;
    }
}

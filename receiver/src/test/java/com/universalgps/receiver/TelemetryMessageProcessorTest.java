package com.universalgps.receiver;

import com.universalgps.decoder.EnvelopeClassifier;
import com.universalgps.decoder.TelemetryDecoder;
import com.universalgps.decoder.TestMessages;
import com.universalgps.decoder.model.TelemetryRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static com.universalgps.decoder.TestMessages.utf8;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TelemetryMessageProcessor with a mocked record handler.
 */
class TelemetryMessageProcessorTest {

    private TelemetryRecordHandler handler;
    private TelemetryMessageProcessor processor;

    @BeforeEach
    void setUp() {
        handler = mock(TelemetryRecordHandler.class);
        processor = new TelemetryMessageProcessor(new EnvelopeClassifier(), new TelemetryDecoder(), handler);
    }

    // ==========================================
    // Delivered to the handler
    // ==========================================

    @Test
    void testProcess_ValidGpsMessage() {
        // When a valid GPS v1 message arrives
        ProcessingOutcome outcome = processor.process("gps.356307042441013", TestMessages.load("gps-full.json"));

        // Then it is decoded and handed over once
        assertEquals(ProcessingOutcome.PROCESSED, outcome);
        ArgumentCaptor<TelemetryRecord> captor = ArgumentCaptor.forClass(TelemetryRecord.class);
        verify(handler).handle(captor.capture());
        assertEquals("356307042441013", captor.getValue().device().imei());
    }

    @Test
    void testProcess_NoTimeSyncStillDelivered() {
        ProcessingOutcome outcome = processor.process("gps.code", TestMessages.load("gps-no-time-sync.json"));

        assertEquals(ProcessingOutcome.PROCESSED, outcome);
        verify(handler).handle(any(TelemetryRecord.class));
    }

    // ==========================================
    // Skipped or dropped
    // ==========================================

    @Test
    void testProcess_HeartbeatIgnored() {
        ProcessingOutcome outcome = processor.process("gps.356307042441013", TestMessages.load("heartbeat.json"));

        assertEquals(ProcessingOutcome.IGNORED, outcome);
        verifyNoInteractions(handler);
    }

    @Test
    void testProcess_InvalidFlagIgnored() {
        byte[] payload = utf8("{\"message_ver\":1,\"message_type\":\"gps\",\"valid\":false}");

        assertEquals(ProcessingOutcome.IGNORED, processor.process("k", payload));
        verifyNoInteractions(handler);
    }

    @Test
    void testProcess_UnsupportedVersionIgnored() {
        byte[] payload = utf8("{\"message_ver\":2,\"message_type\":\"gps\",\"valid\":true}");

        assertEquals(ProcessingOutcome.IGNORED, processor.process("k", payload));
        verifyNoInteractions(handler);
    }

    @Test
    void testProcess_NotJson() {
        assertEquals(ProcessingOutcome.MALFORMED_ENVELOPE, processor.process("k", utf8("not json at all")));
        assertEquals(ProcessingOutcome.MALFORMED_ENVELOPE, processor.process("k", null));
        verifyNoInteractions(handler);
    }

    @Test
    void testProcess_GpsMessageMissingDevice() {
        // Given a message that claims to be valid GPS v1 but lacks its device section
        byte[] payload = utf8("{\"message_ver\":1,\"message_type\":\"gps\",\"valid\":true,"
            + "\"gsm\":[],\"sims\":[],\"gps\":{}}");

        // Then it is dropped without reaching the handler
        assertEquals(ProcessingOutcome.MALFORMED_PAYLOAD, processor.process("k", payload));
        verifyNoInteractions(handler);
    }

    // ==========================================
    // Handler failures
    // ==========================================

    @Test
    void testProcess_HandlerFailureRequestsRedelivery() {
        doThrow(new IllegalStateException("console closed")).when(handler).handle(any(TelemetryRecord.class));

        ProcessingOutcome outcome = processor.process("k", TestMessages.load("gps-full.json"));

        assertEquals(ProcessingOutcome.HANDLER_FAILED, outcome);
        assertTrue(outcome.shouldRedeliver());
    }

    @Test
    void testShouldRedeliver_OnlyForHandlerFailure() {
        for (ProcessingOutcome outcome : ProcessingOutcome.values()) {
            assertEquals(outcome == ProcessingOutcome.HANDLER_FAILED, outcome.shouldRedeliver(), outcome.name());
        }
    }
}

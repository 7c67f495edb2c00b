package com.universalgps.receiver;

/**
 * What happened to a single inbound message.
 */
public enum ProcessingOutcome {
    /** Decoded and handed to the handler. */
    PROCESSED,
    /** Not a valid GPS v1 message; skipped on purpose. */
    IGNORED,
    /** Payload is not a JSON object. Dropped. */
    MALFORMED_ENVELOPE,
    /** Claims to be a valid GPS v1 message but does not match its schema. Dropped. */
    MALFORMED_PAYLOAD,
    /** The handler threw; the message should be delivered again. */
    HANDLER_FAILED;

    public boolean shouldRedeliver() {
        return this == HANDLER_FAILED;
    }
}

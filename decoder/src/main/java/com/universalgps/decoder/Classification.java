package com.universalgps.decoder;

import com.universalgps.decoder.model.Envelope;

/**
 * Classification decision together with the envelope fields it was based on.
 *
 * @param decision what to do with the message
 * @param envelope envelope fields, null when the payload is {@link Decision#MALFORMED}
 */
public record Classification(Decision decision, Envelope envelope) {

    static Classification malformed() {
        return new Classification(Decision.MALFORMED, null);
    }

    static Classification of(Envelope envelope) {
        Decision decision = envelope.isValidGpsV1() ? Decision.DECODABLE : Decision.IGNORED;
        return new Classification(decision, envelope);
    }
}

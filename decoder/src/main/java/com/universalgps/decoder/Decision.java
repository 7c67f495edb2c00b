package com.universalgps.decoder;

/**
 * Outcome of envelope classification.
 */
public enum Decision {
    /** Valid GPS v1 message; worth a full decode. */
    DECODABLE,
    /** Well-formed message of another type or version, or rejected by the gateway. Not an error. */
    IGNORED,
    /** Not a JSON object at all. Retrying will not help. */
    MALFORMED
}

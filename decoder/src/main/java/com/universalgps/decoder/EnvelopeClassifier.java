package com.universalgps.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalgps.decoder.model.Envelope;

import java.io.IOException;

/**
 * First decoding stage: reads only {@code message_ver}, {@code message_type} and
 * {@code valid} and decides whether the message should be fully decoded.
 * <p>
 * Unknown fields are ignored and a missing or wrongly typed envelope field counts as
 * absent, which makes the message {@link Decision#IGNORED} rather than an error. Only a
 * payload that is not a JSON object is {@link Decision#MALFORMED}.
 * <p>
 * Stateless and safe for concurrent use.
 */
public class EnvelopeClassifier {

    private final ObjectMapper mapper;

    public EnvelopeClassifier() {
        this(TelemetryJson.getObjectMapper());
    }

    public EnvelopeClassifier(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Decision classify(byte[] payload) {
        return inspect(payload).decision();
    }

    public Classification inspect(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Classification.malformed();
        }

        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            return Classification.malformed();
        }
        if (root == null || !root.isObject()) {
            return Classification.malformed();
        }

        return Classification.of(readEnvelope(root));
    }

    private static Envelope readEnvelope(JsonNode root) {
        JsonNode version = root.path("message_ver");
        JsonNode type = root.path("message_type");
        JsonNode valid = root.path("valid");

        Integer messageVer = NodeReader.isExactInt(version) ? version.intValue() : null;
        String messageType = type.isTextual() ? type.textValue() : null;
        Boolean isValid = valid.isBoolean() ? valid.booleanValue() : null;

        return new Envelope(messageVer, messageType, isValid);
    }
}

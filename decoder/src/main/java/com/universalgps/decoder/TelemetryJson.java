package com.universalgps.decoder;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for gateway messages.
 * The mapper is fully configured before publication and is safe to share between threads.
 */
public final class TelemetryJson {

    private static final ObjectMapper MAPPER = createObjectMapper();

    private TelemetryJson() {
    }

    private static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        // "{...} garbage" is a corrupt payload, not a message followed by noise
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    public static ObjectMapper getObjectMapper() {
        return MAPPER;
    }
}

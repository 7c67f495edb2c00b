package com.universalgps.decoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.universalgps.decoder.model.TelemetryRecord;

/**
 * Writes a {@link TelemetryRecord} back into the gateway's JSON message format.
 * <p>
 * The field names and omission rules live on the model's Jackson annotations. Absent
 * values are omitted rather than written as {@code null}, so decoding the output gives
 * back an equal record.
 */
public class TelemetryEncoder {

    private final ObjectMapper mapper;

    public TelemetryEncoder() {
        this(TelemetryJson.getObjectMapper());
    }

    /**
     * @param mapper must have the Java time module registered, as {@link TelemetryJson}'s does
     */
    public TelemetryEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(TelemetryRecord record) {
        try {
            return mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize telemetry record", e);
        }
    }

    public ObjectNode toTree(TelemetryRecord record) {
        return mapper.valueToTree(record);
    }
}

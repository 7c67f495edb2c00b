package com.universalgps.decoder.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes an event as {@code [code, [key, value], ...]}.
 */
public class TelemetryEventSerializer extends StdSerializer<TelemetryEvent> {

    public TelemetryEventSerializer() {
        super(TelemetryEvent.class);
    }

    @Override
    public void serialize(TelemetryEvent event, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartArray();
        gen.writeString(event.code());
        for (EventField field : event.fields()) {
            provider.defaultSerializeValue(field, gen);
        }
        gen.writeEndArray();
    }
}

package com.universalgps.decoder.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes a {@link TelemetryValue} as the bare JSON scalar it was read from.
 */
public class TelemetryValueSerializer extends StdSerializer<TelemetryValue> {

    public TelemetryValueSerializer() {
        super(TelemetryValue.class);
    }

    @Override
    public void serialize(TelemetryValue value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (value instanceof TelemetryValue.StringValue text) {
            gen.writeString(text.value());
        } else if (value instanceof TelemetryValue.BooleanValue bool) {
            gen.writeBoolean(bool.value());
        } else if (value instanceof TelemetryValue.NumberValue number) {
            // Integer stays 5, Double stays 5.0
            provider.defaultSerializeValue(number.value(), gen);
        } else {
            gen.writeNull();
        }
    }
}

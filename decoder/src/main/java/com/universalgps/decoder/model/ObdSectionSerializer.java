package com.universalgps.decoder.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.List;

/**
 * Writes the OBD-II PID list nested under its mode, as {@code {"mode_01": [[pid, value], ...]}}.
 */
public class ObdSectionSerializer extends StdSerializer<List<ObdPid>> {

    private static final String MODE_01 = "mode_01";

    @SuppressWarnings("unchecked")
    public ObdSectionSerializer() {
        super((Class<List<ObdPid>>) (Class<?>) List.class);
    }

    @Override
    public boolean isEmpty(SerializerProvider provider, List<ObdPid> pids) {
        return pids == null || pids.isEmpty();
    }

    @Override
    public void serialize(List<ObdPid> pids, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeArrayFieldStart(MODE_01);
        for (ObdPid pid : pids) {
            provider.defaultSerializeValue(pid, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}

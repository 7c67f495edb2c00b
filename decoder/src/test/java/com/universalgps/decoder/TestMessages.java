package com.universalgps.decoder;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads JSON message fixtures from {@code src/test/resources/messages}.
 * Published in this module's test jar for the receiver tests.
 */
public final class TestMessages {

    private TestMessages() {
    }

    public static byte[] load(String name) {
        try (InputStream input = TestMessages.class.getResourceAsStream("/messages/" + name)) {
            if (input == null) {
                throw new IllegalArgumentException("No such fixture: " + name);
            }
            return input.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] utf8(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}

package com.universalgps.decoder;

/**
 * A message that passed envelope classification could not be decoded because a field
 * is missing or has the wrong structure.
 * <p>
 * The failing field is identified by a JSON path such as {@code device},
 * {@code gps.timestamp} or {@code events[1][0]}. No partial record is produced.
 */
public class TelemetryDecodeException extends Exception {

    private final String fieldPath;

    public TelemetryDecodeException(String fieldPath, String message) {
        super(formatMessage(fieldPath, message));
        this.fieldPath = fieldPath;
    }

    public TelemetryDecodeException(String fieldPath, String message, Throwable cause) {
        super(formatMessage(fieldPath, message), cause);
        this.fieldPath = fieldPath;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    private static String formatMessage(String fieldPath, String message) {
        return "Malformed payload at '" + fieldPath + "': " + message;
    }
}

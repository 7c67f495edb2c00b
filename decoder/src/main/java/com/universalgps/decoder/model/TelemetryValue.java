package com.universalgps.decoder.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Objects;

/**
 * Loosely-typed value found in event fields and sensor readings.
 * <p>
 * The same array position may hold a string in one message and a number or boolean in
 * the next, so the value is modelled as a closed set of cases that consumers must
 * handle explicitly.
 */
@JsonSerialize(using = TelemetryValueSerializer.class)
public sealed interface TelemetryValue
    permits TelemetryValue.StringValue, TelemetryValue.NumberValue,
            TelemetryValue.BooleanValue, TelemetryValue.NullValue {

    static TelemetryValue of(String value) {
        return new StringValue(value);
    }

    static TelemetryValue of(Number value) {
        return new NumberValue(value);
    }

    static TelemetryValue of(boolean value) {
        return new BooleanValue(value);
    }

    static TelemetryValue nullValue() {
        return NullValue.INSTANCE;
    }

    /**
     * Render the value the way it appears in a JSON document, without quotes for strings.
     */
    String asText();

    record StringValue(String value) implements TelemetryValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String asText() {
            return value;
        }
    }

    /**
     * Numeric value. Integral JSON numbers are kept as {@link Integer}/{@link Long},
     * fractional ones as {@link Double}.
     */
    record NumberValue(Number value) implements TelemetryValue {
        public NumberValue {
            Objects.requireNonNull(value, "value");
        }

        public double doubleValue() {
            return value.doubleValue();
        }

        @Override
        public String asText() {
            return value.toString();
        }
    }

    record BooleanValue(boolean value) implements TelemetryValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    /**
     * Explicit JSON {@code null} in a value position.
     */
    record NullValue() implements TelemetryValue {
        static final NullValue INSTANCE = new NullValue();

        @Override
        public String asText() {
            return "null";
        }
    }
}

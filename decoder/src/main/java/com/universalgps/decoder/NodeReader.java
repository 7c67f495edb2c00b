package com.universalgps.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.universalgps.decoder.model.TelemetryValue;
import com.universalgps.decoder.model.WireEnum;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A JSON node together with its path from the document root.
 * <p>
 * "Absent" means the field is missing or JSON {@code null}. Accessors for optional
 * fields return null (or an empty list) when absent and throw when the field is present
 * with the wrong shape. Every failure is reported with the path of the offending field.
 */
final class NodeReader {

    // ISO_DATE_TIME only accepts a [zone] after an offset; here both parts are optional on their own
    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .optionalStart()
        .appendLiteral('[')
        .parseCaseSensitive()
        .appendZoneRegionId()
        .appendLiteral(']')
        .optionalEnd()
        .toFormatter();

    private final JsonNode node;
    private final String path;

    private NodeReader(JsonNode node, String path) {
        this.node = node;
        this.path = path;
    }

    static NodeReader root(JsonNode node) {
        return new NodeReader(node, "$");
    }

    String path() {
        return path;
    }

    JsonNode node() {
        return node;
    }

    // ------------------------------------------------------------------
    // Navigation
    // ------------------------------------------------------------------

    NodeReader field(String name) {
        String childPath = "$".equals(path) ? name : path + "." + name;
        return new NodeReader(node.path(name), childPath);
    }

    NodeReader element(int index) {
        return new NodeReader(node.path(index), path + "[" + index + "]");
    }

    boolean isAbsent() {
        return node.isMissingNode() || node.isNull();
    }

    boolean isArray() {
        return node.isArray();
    }

    int size() {
        return node.size();
    }

    NodeReader requiredObject(String name) throws TelemetryDecodeException {
        NodeReader child = field(name);
        if (child.isAbsent()) {
            throw child.error("required object is missing");
        }
        return child.expectObject();
    }

    NodeReader optionalObject(String name) throws TelemetryDecodeException {
        NodeReader child = field(name);
        return child.isAbsent() ? null : child.expectObject();
    }

    List<NodeReader> requiredArray(String name) throws TelemetryDecodeException {
        NodeReader child = field(name);
        if (child.isAbsent()) {
            throw child.error("required array is missing");
        }
        return child.elements();
    }

    List<NodeReader> optionalArray(String name) throws TelemetryDecodeException {
        NodeReader child = field(name);
        return child.isAbsent() ? Collections.emptyList() : child.elements();
    }

    List<NodeReader> elements() throws TelemetryDecodeException {
        if (!node.isArray()) {
            throw error("expected an array but found " + node.getNodeType());
        }
        List<NodeReader> elements = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            elements.add(element(i));
        }
        return elements;
    }

    private NodeReader expectObject() throws TelemetryDecodeException {
        if (!node.isObject()) {
            throw error("expected an object but found " + node.getNodeType());
        }
        return this;
    }

    // ------------------------------------------------------------------
    // Scalars
    // ------------------------------------------------------------------

    String optionalText(String name) throws TelemetryDecodeException {
        NodeReader child = field(name);
        return child.isAbsent() ? null : child.asText();
    }

    Integer optionalInt(String name) throws TelemetryDecodeException {
        NodeReader child = field(name);
        return child.isAbsent() ? null : child.asInt();
    }

    int requiredInt(String name) throws TelemetryDecodeException {
        NodeReader child = field(name);
        if (child.isAbsent()) {
            throw child.error("required number is missing");
        }
        return child.asInt();
    }

    Double optionalDouble(String name) throws TelemetryDecodeException {
        NodeReader child = field(name);
        return child.isAbsent() ? null : child.asDouble();
    }

    double requiredDouble(String name) throws TelemetryDecodeException {
        NodeReader child = field(name);
        if (child.isAbsent()) {
            throw child.error("required number is missing");
        }
        return child.asDouble();
    }

    Boolean optionalBoolean(String name) throws TelemetryDecodeException {
        NodeReader child = field(name);
        if (child.isAbsent()) {
            return null;
        }
        if (!child.node.isBoolean()) {
            throw child.error("expected a boolean but found " + child.node.getNodeType());
        }
        return child.node.booleanValue();
    }

    /**
     * ISO 8601 date-time, optionally followed by a {@code [region]} zone id. A value with
     * neither an offset nor a zone is taken as UTC.
     */
    Instant optionalInstant(String name) throws TelemetryDecodeException {
        NodeReader child = field(name);
        if (child.isAbsent()) {
            return null;
        }
        String text = child.asText();
        try {
            TemporalAccessor parsed = TIMESTAMP_FORMAT.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw child.error("not an ISO 8601 timestamp: " + text, e);
        }
    }

    /**
     * Enum field. A string outside the known vocabulary is read as absent.
     */
    <E extends Enum<E> & WireEnum> E optionalEnum(Class<E> type, String name) throws TelemetryDecodeException {
        NodeReader child = field(name);
        return child.isAbsent() ? null : child.asKnownEnum(type);
    }

    /**
     * Text node. Numbers are accepted as their textual form, since some units report
     * identifiers such as the MSISDN as bare numbers. The JSON kind is not kept: the
     * value is a string from here on and re-encodes as one.
     */
    String asText() throws TelemetryDecodeException {
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return node.asText();
        }
        throw error("expected a string but found " + node.getNodeType());
    }

    int asInt() throws TelemetryDecodeException {
        if (!isExactInt(node)) {
            throw error("expected an integer but found " + describe());
        }
        return node.intValue();
    }

    /**
     * Whether the node is a number with an exact {@code int} value. Whole-valued floats
     * such as {@code 5027.0} count.
     */
    static boolean isExactInt(JsonNode node) {
        boolean integral = node.isIntegralNumber()
            || (node.isFloatingPointNumber() && node.canConvertToExactIntegral());
        return integral && node.canConvertToInt();
    }

    double asDouble() throws TelemetryDecodeException {
        if (!node.isNumber()) {
            throw error("expected a number but found " + describe());
        }
        return node.doubleValue();
    }

    /**
     * @return the matching constant, or null when the string is not part of the vocabulary
     */
    <E extends Enum<E> & WireEnum> E asKnownEnum(Class<E> type) throws TelemetryDecodeException {
        return WireEnum.fromWire(type, asText());
    }

    /**
     * Whether the node is a scalar (string, number, boolean or null) rather than an array or object.
     */
    boolean isScalar() {
        return !node.isContainerNode();
    }

    /**
     * Value of a union-typed position, decided by the JSON kind found at runtime.
     */
    TelemetryValue asValue() throws TelemetryDecodeException {
        if (isAbsent()) {
            return TelemetryValue.nullValue();
        }
        if (node.isTextual()) {
            return TelemetryValue.of(node.textValue());
        }
        if (node.isBoolean()) {
            return TelemetryValue.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return TelemetryValue.of(node.numberValue());
        }
        throw error("expected a string, number, boolean or null but found " + node.getNodeType());
    }

    // ------------------------------------------------------------------
    // Lists
    // ------------------------------------------------------------------

    List<Integer> intList(String name) throws TelemetryDecodeException {
        List<Integer> values = new ArrayList<>();
        for (NodeReader element : optionalArray(name)) {
            values.add(element.asInt());
        }
        return values;
    }

    List<Double> doubleList(String name) throws TelemetryDecodeException {
        List<Double> values = new ArrayList<>();
        for (NodeReader element : optionalArray(name)) {
            values.add(element.asDouble());
        }
        return values;
    }

    List<String> textList(String name) throws TelemetryDecodeException {
        List<String> values = new ArrayList<>();
        for (NodeReader element : optionalArray(name)) {
            values.add(element.asText());
        }
        return values;
    }

    /**
     * Flag set. Flags outside the known vocabulary are dropped.
     */
    <E extends Enum<E> & WireEnum> Set<E> enumSet(Class<E> type, String name) throws TelemetryDecodeException {
        List<E> values = new ArrayList<>();
        for (NodeReader element : optionalArray(name)) {
            E value = element.asKnownEnum(type);
            if (value != null) {
                values.add(value);
            }
        }
        return Set.copyOf(values);
    }

    // ------------------------------------------------------------------
    // Errors
    // ------------------------------------------------------------------

    TelemetryDecodeException error(String message) {
        return new TelemetryDecodeException(path, message);
    }

    TelemetryDecodeException error(String message, Throwable cause) {
        return new TelemetryDecodeException(path, message, cause);
    }

    private String describe() {
        return node.isValueNode() ? node.getNodeType() + " " + node.asText() : node.getNodeType().toString();
    }
}

package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * CAN bus identifier and value, encoded as {@code [id, value]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"id", "value"})
public record CanEntry(int id, int value) {
}

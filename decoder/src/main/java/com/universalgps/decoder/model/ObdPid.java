package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * OBD-II mode 01 parameter and its raw value, encoded as {@code [pid, value]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"pid", "value"})
public record ObdPid(int pid, int value) {
}

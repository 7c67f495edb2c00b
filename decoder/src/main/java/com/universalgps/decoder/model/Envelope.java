package com.universalgps.decoder.model;

/**
 * The three top-level fields that decide whether a message is worth decoding.
 * Each component is null when the field is missing or has an unexpected JSON type.
 *
 * @param messageVer value of {@code message_ver}
 * @param messageType raw value of {@code message_type}
 * @param valid value of {@code valid}
 */
public record Envelope(Integer messageVer, String messageType, Boolean valid) {

    public static final int SUPPORTED_VERSION = 1;

    /**
     * @return the message type, or null when absent or not one of the known types
     */
    public MessageType knownType() {
        return messageType == null ? null : WireEnum.fromWire(MessageType.class, messageType);
    }

    public boolean isValidGpsV1() {
        return messageVer != null && messageVer == SUPPORTED_VERSION
            && MessageType.GPS.wireName().equals(messageType)
            && Boolean.TRUE.equals(valid);
    }
}

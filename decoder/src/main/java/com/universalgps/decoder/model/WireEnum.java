package com.universalgps.decoder.model;

/**
 * An enumeration whose constants are carried on the wire as lower-case strings.
 */
public interface WireEnum {

    /**
     * @return the exact string used for this constant in gateway JSON messages
     */
    String wireName();

    /**
     * Look up a constant by its wire name.
     *
     * @param type enum class to search
     * @param wireName string found in the message
     * @return the matching constant, or null if the string is not part of the vocabulary
     */
    static <E extends Enum<E> & WireEnum> E fromWire(Class<E> type, String wireName) {
        for (E constant : type.getEnumConstants()) {
            if (constant.wireName().equals(wireName)) {
                return constant;
            }
        }
        return null;
    }
}

package com.universalgps.decoder.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

final class ModelCollections {

    private ModelCollections() {
    }

    /**
     * Immutable copy that iterates in declaration order of the enum.
     */
    static <E extends Enum<E>> Set<E> enumSet(Class<E> type, Collection<E> values) {
        EnumSet<E> copy = EnumSet.noneOf(type);
        copy.addAll(values);
        return Collections.unmodifiableSet(copy);
    }
}

package com.geons.common;

import java.util.List;

/**
 * Source of randomness for selection and tie-breaking. Production uses {@link ThreadLocalRandomSource};
 * tests substitute a scripted sequence.
 */
public interface RandomSource {

    /**
     * Uniform index in [0, bound). {@code bound} is always positive.
     */
    int nextIndex(int bound);

    /**
     * Uniformly chosen element of a non-empty list.
     */
    default <T> T choose(List<T> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("cannot choose from an empty list");
        }
        return items.get(nextIndex(items.size()));
    }
}

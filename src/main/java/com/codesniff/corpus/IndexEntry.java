package com.codesniff.corpus;

import java.util.Map;

/**
 * Derived artifacts of one symbol. Owned by exactly one symbol and replaced, never mutated, when
 * the symbol changes.
 */
public record IndexEntry(String symbolId, float[] embedding, Map<String, Integer> termVector) {
    public IndexEntry {
        termVector = Map.copyOf(termVector);
    }
}

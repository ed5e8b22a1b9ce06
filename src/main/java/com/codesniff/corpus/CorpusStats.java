package com.codesniff.corpus;

import java.util.Map;

import com.codesniff.ingest.SymbolKind;

/**
 * Corpus-level counters. {@code version} increases with every committed write and every clear.
 */
public record CorpusStats(
        int totalSymbols,
        int totalFiles,
        Map<SymbolKind, Integer> countsByKind,
        int vectorCount,
        int uniqueTerms,
        double averageDocumentLength,
        int dimension,
        long version) {

    public boolean ready() {
        return totalSymbols > 0;
    }
}

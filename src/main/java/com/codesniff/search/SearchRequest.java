package com.codesniff.search;

import java.util.Optional;

import com.codesniff.ingest.SymbolKind;

public record SearchRequest(
        String query,
        int limit,
        double minScore,
        Optional<SymbolKind> kind,
        Optional<String> filePathFilter) {

    public SearchRequest {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        kind = kind == null ? Optional.empty() : kind;
        filePathFilter = filePathFilter == null ? Optional.empty() : filePathFilter;
    }

    public static SearchRequest of(String query, int limit, double minScore) {
        return new SearchRequest(query, limit, minScore, Optional.empty(), Optional.empty());
    }

    public SearchRequest withKind(SymbolKind symbolKind) {
        return new SearchRequest(query, limit, minScore, Optional.ofNullable(symbolKind), filePathFilter);
    }

    public SearchRequest withFilePathFilter(String filter) {
        return new SearchRequest(query, limit, minScore, kind,
                filter == null || filter.isBlank() ? Optional.empty() : Optional.of(filter));
    }
}

package com.codesniff.context;

import com.codesniff.ingest.SymbolKind;
import com.codesniff.search.SearchResult;

public record Citation(
        String symbolId,
        String symbol,
        SymbolKind kind,
        String filePath,
        int startLine,
        int endLine,
        double score,
        double similarity) {

    static Citation of(SearchResult result) {
        return new Citation(
                result.symbol().id(),
                result.symbol().name(),
                result.symbol().kind(),
                result.symbol().filePath(),
                result.symbol().startLine(),
                result.symbol().endLine(),
                result.score(),
                result.similarity());
    }

    public String location() {
        return "%s:%d-%d".formatted(filePath, startLine, endLine);
    }
}

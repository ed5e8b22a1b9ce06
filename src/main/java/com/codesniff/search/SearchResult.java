package com.codesniff.search;

import java.util.Set;

import com.codesniff.ingest.Symbol;

/**
 * A ranked symbol. {@code score} is the fused score; {@code similarity} the clamped cosine and
 * {@code lexical} the min-max normalized lexical score it was fused from.
 */
public record SearchResult(Symbol symbol, double score, double similarity, double lexical, Set<String> matchedTerms) {
}

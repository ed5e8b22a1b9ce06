package com.codesniff.context;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesniff.runtime.AppConfig;
import com.codesniff.search.HybridRanker;
import com.codesniff.search.SearchRequest;
import com.codesniff.search.SearchResult;

/**
 * Builds the code context handed to the assistant. Each result becomes one block with a citation
 * header; blocks are dropped from the lowest-ranked end until the text fits the character budget,
 * so no symbol is ever cut in half.
 */
public class ContextAssembler {
    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);
    static final String SEPARATOR = "\n---\n";

    private final HybridRanker ranker;
    private final int limit;
    private final double minScore;
    private final int maxChars;

    public ContextAssembler(HybridRanker ranker, AppConfig.ContextConfig config) {
        this(ranker, config.getLimit(), config.getMinScore(), config.getMaxChars());
    }

    public ContextAssembler(HybridRanker ranker, int limit, double minScore, int maxChars) {
        if (limit < 1 || maxChars < 1) {
            throw new IllegalArgumentException("limit and maxChars must be positive");
        }
        this.ranker = ranker;
        this.limit = limit;
        this.minScore = minScore;
        this.maxChars = maxChars;
    }

    /**
     * @throws com.codesniff.search.SearchException when retrieval itself fails
     */
    public AssembledContext assemble(String query) {
        List<SearchResult> results = ranker.search(SearchRequest.of(query, limit, minScore));
        List<String> blocks = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            blocks.add(block(i + 1, results.get(i)));
        }
        int kept = blocks.size();
        while (kept > 0 && joinedLength(blocks, kept) > maxChars) {
            kept--;
        }
        if (kept == 0) {
            log.debug("context.empty query=\"{}\" results={}", query, results.size());
            return AssembledContext.empty();
        }
        List<Citation> citations = new ArrayList<>();
        for (int i = 0; i < kept; i++) {
            citations.add(Citation.of(results.get(i)));
        }
        if (kept < results.size()) {
            log.debug("context.truncated kept={} dropped={} maxChars={}", kept, results.size() - kept, maxChars);
        }
        return new AssembledContext(String.join(SEPARATOR, blocks.subList(0, kept)), citations, true);
    }

    static String block(int rank, SearchResult result) {
        StringBuilder block = new StringBuilder()
                .append('[').append(rank).append("] File: ")
                .append(result.symbol().filePath()).append(':')
                .append(result.symbol().startLine()).append('-').append(result.symbol().endLine()).append('\n')
                .append("Function/Class: ").append(result.symbol().name())
                .append(" (").append(result.symbol().kind().label()).append(")\n")
                .append("Code:\n").append(result.symbol().codeText());
        if (!result.symbol().docText().isEmpty()) {
            block.append("\nDescription: ").append(result.symbol().docText());
        }
        return block.toString();
    }

    private static int joinedLength(List<String> blocks, int count) {
        int length = SEPARATOR.length() * Math.max(0, count - 1);
        for (int i = 0; i < count; i++) {
            length += blocks.get(i).length();
        }
        return length;
    }
}

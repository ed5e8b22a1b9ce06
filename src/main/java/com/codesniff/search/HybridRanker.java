package com.codesniff.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesniff.corpus.Corpus;
import com.codesniff.corpus.CorpusView;
import com.codesniff.error.DimensionMismatchException;
import com.codesniff.error.ProviderException;
import com.codesniff.index.CodeTokenizer;
import com.codesniff.index.LexicalIndex.LexicalHit;
import com.codesniff.index.VectorHit;
import com.codesniff.ingest.EmbeddingService;
import com.codesniff.ingest.Symbol;
import com.codesniff.runtime.AppConfig;

/**
 * Fuses vector and lexical evidence into one ranking.
 *
 * <p>Candidates are the top {@code max(limit * oversampleFactor, minVectorCandidates)} vector
 * neighbours plus as many of the best lexical hits. Lexical scores are min-max normalized over the
 * candidate set, so they are relative to the query. When every candidate has the same positive
 * score they all normalize to 1. The one exception to that rule is a candidate set with no lexical
 * evidence at all: an all-zero set stays at 0, so a query without term matches ranks purely by
 * {@code alpha * cosine} instead of receiving a flat {@code 1 - alpha} bonus.
 * The fused score is {@code alpha * max(0, cosine) + (1 - alpha) * lexical}. Ties are broken by
 * ascending symbol id.
 */
public class HybridRanker {
    private static final Logger log = LoggerFactory.getLogger(HybridRanker.class);
    private static final double EPSILON = 1e-12;

    static final Comparator<SearchResult> RANKING = Comparator
            .comparingDouble(SearchResult::score).reversed()
            .thenComparing(result -> result.symbol().id());

    private final Corpus corpus;
    private final EmbeddingService embeddingService;
    private final QueryExpander expander;
    private final double alpha;
    private final int oversampleFactor;
    private final int minVectorCandidates;

    public HybridRanker(Corpus corpus, EmbeddingService embeddingService, AppConfig.SearchConfig config) {
        this(corpus, embeddingService, config.getAlpha(), config.getOversampleFactor(), config.getMinVectorCandidates());
    }

    public HybridRanker(Corpus corpus,
                        EmbeddingService embeddingService,
                        double alpha,
                        int oversampleFactor,
                        int minVectorCandidates) {
        if (alpha < 0d || alpha > 1d) {
            throw new IllegalArgumentException("alpha must be within [0, 1]");
        }
        this.corpus = corpus;
        this.embeddingService = embeddingService;
        this.expander = new QueryExpander(new CodeTokenizer());
        this.alpha = alpha;
        this.oversampleFactor = Math.max(1, oversampleFactor);
        this.minVectorCandidates = Math.max(0, minVectorCandidates);
    }

    /**
     * @throws SearchException when the query embedding cannot be obtained
     */
    public List<SearchResult> search(SearchRequest request) {
        if (request.query() == null || request.query().isBlank() || request.limit() == 0) {
            return List.of();
        }
        if (corpus.read(CorpusView::isEmpty)) {
            return List.of();
        }
        Map<String, Double> terms = expander.expand(request.query());
        float[] queryEmbedding = embedQuery(request.query());
        List<SearchResult> results = corpus.read(view -> rank(view, queryEmbedding, terms, request));
        log.debug("search query=\"{}\" terms={} results={}", request.query(), terms.size(), results.size());
        return results;
    }

    private List<SearchResult> rank(CorpusView view, float[] queryEmbedding, Map<String, Double> terms, SearchRequest request) {
        int oversampled = (int) Math.min((long) request.limit() * oversampleFactor, Integer.MAX_VALUE);
        int vectorCandidates = Math.max(oversampled, minVectorCandidates);

        Map<String, Double> similarities = new LinkedHashMap<>();
        for (VectorHit hit : view.nearest(queryEmbedding, vectorCandidates)) {
            similarities.put(hit.id(), hit.similarity());
        }
        Map<String, LexicalHit> lexical = terms.isEmpty() ? Map.of() : view.lexicalMatch(terms);
        List<LexicalHit> lexicalOnly = new ArrayList<>(lexical.values());
        lexicalOnly.sort(Comparator.comparingDouble(LexicalHit::score).reversed().thenComparing(LexicalHit::id));
        for (LexicalHit hit : lexicalOnly.subList(0, Math.min(vectorCandidates, lexicalOnly.size()))) {
            if (!similarities.containsKey(hit.id())) {
                similarities.put(hit.id(), view.similarity(hit.id(), queryEmbedding).orElse(0d));
            }
        }

        List<Symbol> candidates = new ArrayList<>();
        for (String id : similarities.keySet()) {
            view.symbol(id).filter(symbol -> matchesFilters(symbol, request)).ifPresent(candidates::add);
        }
        if (candidates.isEmpty()) {
            return List.of();
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Symbol symbol : candidates) {
            double raw = rawLexical(lexical, symbol.id());
            min = Math.min(min, raw);
            max = Math.max(max, raw);
        }

        List<SearchResult> results = new ArrayList<>();
        for (Symbol symbol : candidates) {
            double similarity = Math.max(0d, similarities.get(symbol.id()));
            double normalized = normalize(rawLexical(lexical, symbol.id()), min, max);
            double score = alpha * similarity + (1 - alpha) * normalized;
            if (score < request.minScore()) {
                continue;
            }
            LexicalHit hit = lexical.get(symbol.id());
            results.add(new SearchResult(symbol, score, similarity, normalized, hit == null ? Set.of() : hit.matchedTerms()));
        }
        results.sort(RANKING);
        return List.copyOf(results.subList(0, Math.min(request.limit(), results.size())));
    }

    /**
     * Min-max normalization. A degenerate range maps to 1 when the shared score is positive and
     * to 0 when it is zero.
     */
    static double normalize(double raw, double min, double max) {
        if (max - min <= EPSILON) {
            return max > 0d ? 1d : 0d;
        }
        return (raw - min) / (max - min);
    }

    private static double rawLexical(Map<String, LexicalHit> lexical, String id) {
        LexicalHit hit = lexical.get(id);
        return hit == null ? 0d : hit.score();
    }

    private static boolean matchesFilters(Symbol symbol, SearchRequest request) {
        if (request.kind().isPresent() && symbol.kind() != request.kind().get()) {
            return false;
        }
        return request.filePathFilter()
                .map(filter -> symbol.filePath().toLowerCase(Locale.ROOT).contains(filter.replace('\\', '/').toLowerCase(Locale.ROOT)))
                .orElse(true);
    }

    /**
     * Vector-only neighbours of a code snippet; {@code score} equals the clamped similarity.
     */
    public List<SearchResult> findSimilar(String code, int limit, double minSimilarity) {
        if (code == null || code.isBlank() || limit <= 0 || corpus.read(CorpusView::isEmpty)) {
            return List.of();
        }
        float[] embedding = embedQuery(code);
        return corpus.read(view -> {
            List<SearchResult> results = new ArrayList<>();
            for (VectorHit hit : view.nearest(embedding, limit)) {
                double similarity = Math.max(0d, hit.similarity());
                if (similarity < minSimilarity) {
                    continue;
                }
                view.symbol(hit.id()).ifPresent(symbol ->
                        results.add(new SearchResult(symbol, similarity, similarity, 0d, Set.of())));
            }
            return List.copyOf(results);
        });
    }

    /**
     * Symbols whose name equals {@code name} ignoring case, in id order.
     */
    public List<Symbol> findByName(String name, Optional<String> filePath) {
        if (name == null || name.isBlank()) {
            return List.of();
        }
        String wanted = name.strip();
        Optional<String> normalizedPath = filePath.map(path -> path.replace('\\', '/'));
        return corpus.read(view -> view.symbols().stream()
                .filter(symbol -> symbol.name().equalsIgnoreCase(wanted))
                .filter(symbol -> normalizedPath.map(symbol.filePath()::equals).orElse(true))
                .toList());
    }

    public List<String> autocomplete(String prefix, int limit) {
        return corpus.read(view -> view.autocomplete(prefix, limit));
    }

    public List<String> popularTerms(int limit) {
        return corpus.read(view -> view.popularTerms(limit));
    }

    private float[] embedQuery(String text) {
        float[] embedding;
        try {
            embedding = embeddingService.embed(text);
        } catch (ProviderException e) {
            throw new SearchException("Query embedding failed: " + e.getMessage(), e);
        }
        if (embedding == null || embedding.length != corpus.dimension()) {
            throw new SearchException("Query embedding has the wrong dimensionality",
                    new DimensionMismatchException(corpus.dimension(), embedding == null ? 0 : embedding.length));
        }
        return embedding;
    }
}

package com.codesniff.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * BM25 inverted index over symbol term vectors.
 *
 * <p>Document frequency is the size of a term's posting map, so it cannot go negative: removing
 * the last document of a term drops the term. Query terms of at least
 * {@value #MIN_PREFIX_LENGTH} characters also match indexed terms they prefix, at
 * {@value #PREFIX_WEIGHT} of the exact-match weight. Not thread-safe; the owning corpus serializes
 * access.
 */
public class LexicalIndex {
    static final int MIN_PREFIX_LENGTH = 3;
    static final double PREFIX_WEIGHT = 0.6;
    private static final int MAX_PREFIX_EXPANSIONS = 64;

    private final double k1;
    private final double b;
    private final TreeMap<String, Map<String, Integer>> postings = new TreeMap<>();
    private final Map<String, Map<String, Integer>> documents = new HashMap<>();
    private long totalLength;

    public LexicalIndex() {
        this(1.5, 0.75);
    }

    public LexicalIndex(double k1, double b) {
        if (k1 < 0 || b < 0 || b > 1) {
            throw new IllegalArgumentException("BM25 parameters out of range k1=" + k1 + " b=" + b);
        }
        this.k1 = k1;
        this.b = b;
    }

    public record LexicalHit(String id, double score, Set<String> matchedTerms) {
    }

    /**
     * Adds or replaces the document {@code id}.
     */
    public void index(String id, Map<String, Integer> termVector) {
        remove(id);
        Map<String, Integer> terms = new HashMap<>();
        int length = 0;
        for (Map.Entry<String, Integer> entry : termVector.entrySet()) {
            int frequency = entry.getValue() == null ? 0 : entry.getValue();
            if (frequency <= 0) {
                continue;
            }
            terms.put(entry.getKey(), frequency);
            postings.computeIfAbsent(entry.getKey(), unused -> new HashMap<>()).put(id, frequency);
            length += frequency;
        }
        documents.put(id, terms);
        totalLength += length;
    }

    public void remove(String id) {
        Map<String, Integer> terms = documents.remove(id);
        if (terms == null) {
            return;
        }
        for (Map.Entry<String, Integer> entry : terms.entrySet()) {
            Map<String, Integer> posting = postings.get(entry.getKey());
            if (posting == null) {
                continue;
            }
            posting.remove(id);
            if (posting.isEmpty()) {
                postings.remove(entry.getKey());
            }
            totalLength -= entry.getValue();
        }
    }

    /**
     * BM25 score per document for equally weighted query terms. Documents matching none of the
     * terms are absent from the result.
     */
    public Map<String, Double> score(Collection<String> queryTerms) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (String term : queryTerms) {
            weights.merge(term, 1.0, Math::max);
        }
        Map<String, Double> scores = new HashMap<>();
        match(weights).forEach((id, hit) -> scores.put(id, hit.score()));
        return scores;
    }

    /**
     * Weighted variant of {@link #score(Collection)} that also reports which indexed terms matched.
     */
    public Map<String, LexicalHit> match(Map<String, Double> weightedQueryTerms) {
        Map<String, Double> scores = new HashMap<>();
        Map<String, Set<String>> matched = new HashMap<>();
        if (documents.isEmpty()) {
            return Map.of();
        }
        double averageLength = averageDocumentLength();
        for (Map.Entry<String, Double> query : weightedQueryTerms.entrySet()) {
            double weight = query.getValue();
            if (weight <= 0) {
                continue;
            }
            // best contribution of this query term per document, across exact and prefix matches
            Map<String, Double> best = new HashMap<>();
            Map<String, String> bestTerm = new HashMap<>();
            for (Map.Entry<String, Double> expansion : expansions(query.getKey()).entrySet()) {
                Map<String, Integer> posting = postings.get(expansion.getKey());
                double idf = idf(posting.size());
                for (Map.Entry<String, Integer> doc : posting.entrySet()) {
                    double tf = doc.getValue();
                    int length = documentLength(doc.getKey());
                    double norm = k1 * (1 - b + b * length / averageLength);
                    double contribution = weight * expansion.getValue() * idf * (tf * (k1 + 1)) / (tf + norm);
                    if (contribution > best.getOrDefault(doc.getKey(), 0d)) {
                        best.put(doc.getKey(), contribution);
                        bestTerm.put(doc.getKey(), expansion.getKey());
                    }
                }
            }
            best.forEach((id, contribution) -> {
                scores.merge(id, contribution, Double::sum);
                matched.computeIfAbsent(id, unused -> new TreeSet<>()).add(bestTerm.get(id));
            });
        }
        Map<String, LexicalHit> hits = new HashMap<>();
        scores.forEach((id, score) -> {
            if (score > 0) {
                hits.put(id, new LexicalHit(id, score, Set.copyOf(matched.get(id))));
            }
        });
        return hits;
    }

    private Map<String, Double> expansions(String queryTerm) {
        Map<String, Double> expansions = new LinkedHashMap<>();
        if (postings.containsKey(queryTerm)) {
            expansions.put(queryTerm, 1.0);
        }
        if (queryTerm.length() >= MIN_PREFIX_LENGTH) {
            NavigableMap<String, Map<String, Integer>> prefixed =
                    postings.subMap(queryTerm, false, queryTerm + Character.MAX_VALUE, false);
            int added = 0;
            for (String term : prefixed.keySet()) {
                if (added++ >= MAX_PREFIX_EXPANSIONS) {
                    break;
                }
                expansions.putIfAbsent(term, PREFIX_WEIGHT);
            }
        }
        return expansions;
    }

    private double idf(int documentFrequency) {
        int n = documents.size();
        return Math.log((n - documentFrequency + 0.5) / (documentFrequency + 0.5) + 1);
    }

    public int documentFrequency(String term) {
        Map<String, Integer> posting = postings.get(term);
        return posting == null ? 0 : posting.size();
    }

    int documentCount() {
        return documents.size();
    }

    public int termCount() {
        return postings.size();
    }

    public int documentLength(String id) {
        Map<String, Integer> terms = documents.get(id);
        if (terms == null) {
            return 0;
        }
        int length = 0;
        for (int frequency : terms.values()) {
            length += frequency;
        }
        return length;
    }

    public double averageDocumentLength() {
        if (documents.isEmpty()) {
            return 0d;
        }
        return Math.max(1d, (double) totalLength / documents.size());
    }

    public boolean contains(String id) {
        return documents.containsKey(id);
    }

    /**
     * Indexed terms starting with {@code prefix}, most frequent first.
     */
    public List<String> autocomplete(String prefix, int limit) {
        if (prefix == null || prefix.length() < 2 || limit <= 0) {
            return List.of();
        }
        String normalized = prefix.toLowerCase(java.util.Locale.ROOT);
        List<String> terms = new ArrayList<>(
                postings.subMap(normalized, true, normalized + Character.MAX_VALUE, false).keySet());
        return byFrequency(terms, limit);
    }

    public List<String> popularTerms(int limit) {
        return byFrequency(new ArrayList<>(postings.keySet()), limit);
    }

    private List<String> byFrequency(List<String> terms, int limit) {
        terms.sort(Comparator.comparingInt(this::documentFrequency).reversed().thenComparing(Comparator.naturalOrder()));
        return List.copyOf(terms.subList(0, Math.min(limit, terms.size())));
    }

    public void clear() {
        postings.clear();
        documents.clear();
        totalLength = 0;
    }
}

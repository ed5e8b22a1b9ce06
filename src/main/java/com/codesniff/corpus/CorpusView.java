package com.codesniff.corpus;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import com.codesniff.index.LexicalIndex.LexicalHit;
import com.codesniff.index.VectorHit;
import com.codesniff.ingest.Symbol;

/**
 * Read-only access to a corpus, valid only inside {@link Corpus#read}.
 */
public interface CorpusView {
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    Optional<Symbol> symbol(String id);

    Optional<IndexEntry> entry(String id);

    /**
     * All symbols in id order.
     */
    Collection<Symbol> symbols();

    Map<String, LexicalHit> lexicalMatch(Map<String, Double> weightedTerms);

    List<VectorHit> nearest(float[] queryEmbedding, int k);

    OptionalDouble similarity(String id, float[] queryEmbedding);

    List<String> autocomplete(String prefix, int limit);

    List<String> popularTerms(int limit);
}

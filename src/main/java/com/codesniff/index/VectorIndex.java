package com.codesniff.index;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Nearest-neighbour index over fixed-dimension embeddings keyed by symbol id. Not thread-safe;
 * the owning corpus serializes access.
 */
public interface VectorIndex {
    int dimension();

    /**
     * @throws com.codesniff.error.DimensionMismatchException when the vector length differs from {@link #dimension()}
     */
    void insert(String id, float[] embedding);

    /**
     * Up to {@code k} hits by descending cosine similarity, ties broken by ascending id.
     */
    List<VectorHit> search(float[] queryEmbedding, int k);

    /**
     * Missing ids are ignored.
     */
    void delete(String id);

    boolean contains(String id);

    OptionalDouble similarity(String id, float[] queryEmbedding);

    int size();

    Set<String> ids();

    /**
     * Drops the current structure and re-inserts the given vectors.
     */
    void rebuild(Map<String, float[]> vectors);

    void persist(Path path) throws IOException;

    void clear();
}

package com.codesniff.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns text into fixed-length vectors. Implementations fail with
 * {@link com.codesniff.error.ProviderException} rather than returning vectors of another size.
 */
public interface EmbeddingService {
    float[] embed(String text);

    default List<float[]> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    int dimension();

    default String version() {
        return "unversioned";
    }
}

package com.codesniff.index;

import java.util.Comparator;

public record VectorHit(String id, double similarity) {
    /**
     * Descending similarity, ties by ascending id.
     */
    public static final Comparator<VectorHit> RANKING = Comparator
            .comparingDouble(VectorHit::similarity).reversed()
            .thenComparing(VectorHit::id);
}

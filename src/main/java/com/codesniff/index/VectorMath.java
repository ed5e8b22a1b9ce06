package com.codesniff.index;

import com.codesniff.error.DimensionMismatchException;

public final class VectorMath {
    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector has zero norm.
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            aNorm += (double) a[i] * a[i];
            bNorm += (double) b[i] * b[i];
        }
        if (aNorm == 0d || bNorm == 0d) {
            return 0d;
        }
        return clamp(dot / (Math.sqrt(aNorm) * Math.sqrt(bNorm)));
    }

    static double norm(float[] data, int offset, int length) {
        double sum = 0d;
        for (int i = 0; i < length; i++) {
            double value = data[offset + i];
            sum += value * value;
        }
        return Math.sqrt(sum);
    }

    static double clamp(double similarity) {
        return Math.max(-1d, Math.min(1d, similarity));
    }
}

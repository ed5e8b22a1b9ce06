package com.codesniff.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.codesniff.error.DimensionMismatchException;

class VectorMathTest {

    @Test
    void shouldScoreVectorAgainstItselfAsOne() {
        float[] vector = {0.3f, -1.2f, 4.5f, 0.01f};

        assertEquals(1.0, VectorMath.cosine(vector, vector), 1e-9);
    }

    @Test
    void shouldBeSymmetric() {
        float[] a = {1f, 2f, 3f};
        float[] b = {-2f, 0.5f, 7f};

        assertEquals(VectorMath.cosine(a, b), VectorMath.cosine(b, a), 1e-12);
    }

    @Test
    void shouldReturnZeroForZeroNormInsteadOfDividing() {
        float[] zero = new float[3];

        assertEquals(0.0, VectorMath.cosine(zero, new float[] {1f, 1f, 1f}));
        assertEquals(0.0, VectorMath.cosine(zero, zero));
    }

    @Test
    void shouldStayWithinUnitRange() {
        float[] a = {1e-20f, 3e-20f};
        float[] b = {-1e-20f, -3e-20f};

        assertEquals(-1.0, VectorMath.cosine(a, b), 1e-6);
    }

    @Test
    void shouldRejectVectorsOfDifferentLength() {
        DimensionMismatchException error = assertThrows(DimensionMismatchException.class,
                () -> VectorMath.cosine(new float[2], new float[3]));

        assertEquals(2, error.expected());
        assertEquals(3, error.actual());
    }
}

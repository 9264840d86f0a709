package com.hybridrag.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HashingTextEncoderTest {

    @Test
    void shouldProduceNormalizedDeterministicVectors() {
        HashingTextEncoder encoder = new HashingTextEncoder(64, ContentCategory.DOC);

        float[] first = encoder.encode("Incremental indexing keeps stable point ids");
        float[] second = encoder.encode("Incremental indexing keeps stable point ids");

        assertArrayEquals(first, second);
        assertEquals(1.0, norm(first), 1e-5);
    }

    @Test
    void shouldReturnZeroVectorForBlankInput() {
        float[] vector = new HashingTextEncoder(16, ContentCategory.DOC).encode("   ");

        assertEquals(16, vector.length);
        assertEquals(0.0, norm(vector), 0.0);
    }

    @Test
    void shouldMatchSplitIdentifiersForCode() {
        HashingTextEncoder code = new HashingTextEncoder(128, ContentCategory.CODE);

        float[] camel = code.encode("retryPolicy");
        float[] snake = code.encode("retry_policy");
        float[] other = code.encode("renderWidget");

        assertTrue(dot(camel, snake) > dot(camel, other));
        assertEquals("hashing-code-v1", code.version());
    }

    @Test
    void shouldRejectNonPositiveDimension() {
        assertThrows(IllegalArgumentException.class, () -> new HashingTextEncoder(0, ContentCategory.DOC));
    }

    private static double norm(float[] vector) {
        return Math.sqrt(dot(vector, vector));
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}

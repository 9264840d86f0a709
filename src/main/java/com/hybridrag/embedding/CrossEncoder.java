package com.hybridrag.embedding;

import java.util.List;

/**
 * Scores (query, candidate) pairs. The returned array is aligned with {@code candidates}.
 */
public interface CrossEncoder {
    float[] score(String query, List<String> candidates);
}

package com.hybridrag.embedding;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Offline pairwise scorer: blends query-term coverage with hashed cosine similarity.
 */
public class LexicalCrossEncoder implements CrossEncoder {
    private final HashingTextEncoder encoder;

    public LexicalCrossEncoder(int dimension) {
        this.encoder = new HashingTextEncoder(dimension, ContentCategory.DOC);
    }

    @Override
    public float[] score(String query, List<String> candidates) {
        Set<String> queryTerms = terms(query);
        float[] queryVector = encoder.encode(query);
        float[] scores = new float[candidates.size()];
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i) == null ? "" : candidates.get(i);
            float coverage = coverage(queryTerms, terms(candidate));
            float cosine = dot(queryVector, encoder.encode(candidate));
            scores[i] = (coverage * 0.6f) + (cosine * 0.4f);
        }
        return scores;
    }

    private static Set<String> terms(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(token -> !token.isBlank())
                .collect(Collectors.toSet());
    }

    private static float coverage(Set<String> queryTerms, Set<String> words) {
        if (queryTerms.isEmpty() || words.isEmpty()) {
            return 0f;
        }
        long matches = queryTerms.stream().filter(words::contains).count();
        return (float) matches / queryTerms.size();
    }

    private static float dot(float[] a, float[] b) {
        float sum = 0f;
        for (int i = 0; i < Math.min(a.length, b.length); i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}

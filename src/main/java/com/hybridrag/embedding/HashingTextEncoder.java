package com.hybridrag.embedding;

import java.util.Locale;

/**
 * Deterministic feature-hashing encoder used when no remote embedding endpoint is
 * configured. Tokens, character trigrams and (for code) camelCase/snake_case parts
 * are hashed into a fixed-width, L2-normalised vector.
 */
public class HashingTextEncoder implements TextEncoder {
    private final int dimension;
    private final ContentCategory category;

    public HashingTextEncoder(int dimension, ContentCategory category) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        this.category = category;
    }

    @Override
    public float[] encode(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        if (category == ContentCategory.CODE) {
            for (String identifier : text.split("[^A-Za-z0-9_]+")) {
                for (String part : identifier.split("_|(?<=[a-z0-9])(?=[A-Z])")) {
                    if (part.length() > 1) {
                        addHashed(vector, "ident:" + part.toLowerCase(Locale.ROOT), 0.5f);
                    }
                }
            }
        }

        String[] tokens = text.toLowerCase(Locale.ROOT).split("\\W+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
                }
            }
        }

        normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "hashing-" + category.label() + "-v1";
    }

    private void addHashed(float[] vector, String key, float weight) {
        // String.hashCode is specified by the JLS, so vectors are stable across runs
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }

    static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}

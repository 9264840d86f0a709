package com.hybridrag.store;

import java.util.Map;

/**
 * Persisted (id, vector, payload) record. {@code vector} is null when the point was
 * read without vectors.
 */
public record Point(long id, float[] vector, Map<String, Object> payload) {
    public Point {
        payload = payload == null ? Map.of() : payload;
    }

    public boolean isDeleted() {
        return PayloadFields.isDeleted(payload);
    }

    public String filePath() {
        return PayloadFields.normalizePath(PayloadFields.string(payload, PayloadFields.FILE_PATH));
    }
}

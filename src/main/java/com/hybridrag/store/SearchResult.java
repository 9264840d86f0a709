package com.hybridrag.store;

import java.util.LinkedHashMap;
import java.util.Map;

public record SearchResult(
        long id,
        String content,
        String filePath,
        int lineNumber,
        float score,
        BackendRole origin,
        Map<String, Object> metadata) {

    public SearchResult {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static SearchResult from(Point point, float score, BackendRole origin) {
        Map<String, Object> payload = point.payload();
        return new SearchResult(
                point.id(),
                PayloadFields.string(payload, PayloadFields.CONTENT),
                point.filePath(),
                PayloadFields.integer(payload, PayloadFields.LINE_START),
                score,
                origin,
                payload);
    }

    public boolean isDeleted() {
        return PayloadFields.isDeleted(metadata);
    }

    public String section() {
        String section = PayloadFields.string(metadata, PayloadFields.SECTION);
        return section.isBlank() ? null : section;
    }

    public String mergeKey() {
        return PayloadFields.mergeKey(id, metadata);
    }

    public SearchResult withScore(float newScore) {
        return new SearchResult(id, content, filePath, lineNumber, newScore, origin, metadata);
    }

    public SearchResult withMetadataValue(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new SearchResult(id, content, filePath, lineNumber, score, origin, copy);
    }
}

package com.hybridrag.store;

import java.util.Map;

/**
 * Result of a direct CRUD operation. Soft-deleted points are returned as-is so the
 * {@code is_deleted} flag stays visible.
 */
public record StoredPoint(long id, Map<String, Object> payload, float[] vector) {
    public boolean isDeleted() {
        return PayloadFields.isDeleted(payload);
    }
}

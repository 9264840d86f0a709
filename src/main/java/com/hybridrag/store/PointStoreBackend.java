package com.hybridrag.store;

import java.util.List;
import java.util.Map;

/**
 * Minimal contract of a vector collection. Implementations translate transport failures
 * into {@link com.hybridrag.error.BackendUnavailableException} and unsupported filters into
 * {@link UnsupportedFilterException}.
 */
public interface PointStoreBackend {
    String name();

    void ensureCollection(int dimension);

    void upsert(List<Point> points);

    List<Point> retrieve(List<Long> ids, boolean withVectors);

    List<ScoredPoint> nearest(float[] vector, int limit, PointFilter filter);

    ScanPage scan(PointFilter filter, int limit, Long offset);

    void setPayload(List<Long> ids, Map<String, Object> payload);

    void delete(List<Long> ids);

    long count();

    default boolean isEnabled() {
        return true;
    }
}

package com.hybridrag.store;

import java.util.List;
import java.util.Map;

/**
 * Stands in for a switched-off secondary: reads are empty, writes are no-ops.
 */
public final class DisabledPointStoreBackend implements PointStoreBackend {
    private final String name;

    public DisabledPointStoreBackend(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void ensureCollection(int dimension) {
    }

    @Override
    public void upsert(List<Point> points) {
    }

    @Override
    public List<Point> retrieve(List<Long> ids, boolean withVectors) {
        return List.of();
    }

    @Override
    public List<ScoredPoint> nearest(float[] vector, int limit, PointFilter filter) {
        return List.of();
    }

    @Override
    public ScanPage scan(PointFilter filter, int limit, Long offset) {
        return new ScanPage(List.of(), null);
    }

    @Override
    public void setPayload(List<Long> ids, Map<String, Object> payload) {
    }

    @Override
    public void delete(List<Long> ids) {
    }

    @Override
    public long count() {
        return 0;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}

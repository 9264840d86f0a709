package com.hybridrag.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hybridrag.error.BackendUnavailableException;
import com.hybridrag.error.DimensionMismatchException;

/**
 * Embedded collection kept in a sorted map and optionally persisted as JSON after every
 * mutation. Scan cursors are point ids. When {@code indexedFields} is non-null, filters on
 * any other field are rejected with {@link UnsupportedFilterException}, the way a remote
 * collection rejects predicates on unindexed payload fields.
 */
public class InMemoryPointStoreBackend implements PointStoreBackend {
    private static final Logger log = LoggerFactory.getLogger(InMemoryPointStoreBackend.class);

    private final String name;
    private final Path storagePath;
    private final Set<String> indexedFields;
    private final NavigableMap<Long, StoredEntry> points = new TreeMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private int dimension;

    public InMemoryPointStoreBackend(String name) {
        this(name, null, null);
    }

    public InMemoryPointStoreBackend(String name, Path storagePath, Set<String> indexedFields) {
        this.name = name;
        this.storagePath = storagePath;
        this.indexedFields = indexedFields == null ? null : Set.copyOf(indexedFields);
        if (storagePath != null) {
            load();
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized void ensureCollection(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public synchronized void upsert(List<Point> batch) {
        for (Point point : batch) {
            if (point.vector() == null) {
                throw new IllegalArgumentException("Point " + point.id() + " has no vector");
            }
            if (dimension > 0 && point.vector().length != dimension) {
                throw new DimensionMismatchException("Vector dimension mismatch: expected " + dimension
                        + ", got " + point.vector().length);
            }
        }
        for (Point point : batch) {
            points.put(point.id(), new StoredEntry(point.id(), point.vector().clone(),
                    new LinkedHashMap<>(point.payload())));
        }
        persist();
    }

    @Override
    public synchronized List<Point> retrieve(List<Long> ids, boolean withVectors) {
        List<Point> out = new ArrayList<>();
        for (Long id : ids) {
            StoredEntry entry = points.get(id);
            if (entry != null) {
                out.add(entry.toPoint(withVectors));
            }
        }
        return out;
    }

    @Override
    public synchronized List<ScoredPoint> nearest(float[] vector, int limit, PointFilter filter) {
        checkFilter(filter);
        return points.values().stream()
                .filter(entry -> filter == null || filter.matches(entry.payload()))
                .map(entry -> new ScoredPoint(entry.toPoint(false), cosine(vector, entry.vector())))
                .sorted(Comparator.comparing(ScoredPoint::score).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public synchronized ScanPage scan(PointFilter filter, int limit, Long offset) {
        checkFilter(filter);
        Map<Long, StoredEntry> tail = offset == null ? points : points.tailMap(offset, true);
        List<Point> page = new ArrayList<>();
        Long next = null;
        for (StoredEntry entry : tail.values()) {
            if (filter != null && !filter.matches(entry.payload())) {
                continue;
            }
            if (page.size() == limit) {
                next = entry.id();
                break;
            }
            page.add(entry.toPoint(false));
        }
        return new ScanPage(page, next);
    }

    @Override
    public synchronized void setPayload(List<Long> ids, Map<String, Object> payload) {
        for (Long id : ids) {
            StoredEntry entry = points.get(id);
            if (entry != null) {
                entry.payload().putAll(payload);
            }
        }
        persist();
    }

    @Override
    public synchronized void delete(List<Long> ids) {
        ids.forEach(points::remove);
        persist();
    }

    @Override
    public synchronized long count() {
        return points.size();
    }

    private void checkFilter(PointFilter filter) {
        if (indexedFields == null || filter == null) {
            return;
        }
        for (String key : filter.keys()) {
            if (!indexedFields.contains(key)) {
                throw new UnsupportedFilterException("Index required but not found for \"" + key + "\"");
            }
        }
    }

    private void load() {
        if (!Files.exists(storagePath)) {
            return;
        }
        try {
            List<StoredEntry> loaded = objectMapper.readValue(storagePath.toFile(),
                    new TypeReference<List<StoredEntry>>() {
                    });
            for (StoredEntry entry : loaded) {
                points.put(entry.id(), new StoredEntry(entry.id(), entry.vector(), new LinkedHashMap<>(entry.payload())));
            }
            log.info("Loaded {} points into {} from {}", points.size(), name, storagePath);
        } catch (IOException e) {
            throw new BackendUnavailableException("Cannot read local store " + storagePath, e);
        }
    }

    private void persist() {
        if (storagePath == null) {
            return;
        }
        try {
            if (storagePath.getParent() != null) {
                Files.createDirectories(storagePath.getParent());
            }
            objectMapper.writeValue(storagePath.toFile(), points.values());
        } catch (IOException e) {
            throw new BackendUnavailableException("Cannot write local store " + storagePath, e);
        }
    }

    static float cosine(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }

    public record StoredEntry(long id, float[] vector, Map<String, Object> payload) {
        Point toPoint(boolean withVector) {
            return new Point(id, withVector ? vector.clone() : null, new LinkedHashMap<>(payload));
        }
    }
}

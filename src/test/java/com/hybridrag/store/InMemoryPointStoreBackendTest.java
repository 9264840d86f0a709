package com.hybridrag.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.hybridrag.error.DimensionMismatchException;

class InMemoryPointStoreBackendTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistPointsAndReloadThem() {
        Path storage = tempDir.resolve("store/local.json");
        InMemoryPointStoreBackend backend = new InMemoryPointStoreBackend("local", storage, null);
        backend.ensureCollection(2);
        backend.upsert(List.of(point(1, new float[] { 1f, 0f }, "docs/a.md")));
        backend.setPayload(List.of(1L), Map.of("is_deleted", true));

        assertTrue(Files.exists(storage));

        InMemoryPointStoreBackend reloaded = new InMemoryPointStoreBackend("local", storage, null);
        List<Point> points = reloaded.retrieve(List.of(1L), true);
        assertEquals(1, points.size());
        assertTrue(points.get(0).isDeleted());
        assertEquals(2, points.get(0).vector().length);
        assertEquals("docs/a.md", points.get(0).filePath());
    }

    @Test
    void shouldRankByCosineSimilarity() {
        InMemoryPointStoreBackend backend = new InMemoryPointStoreBackend("cloud");
        backend.upsert(List.of(
                point(1, new float[] { 1f, 0f }, "a.md"),
                point(2, new float[] { 0.6f, 0.8f }, "b.md"),
                point(3, new float[] { 0f, 1f }, "c.md")));

        List<ScoredPoint> hits = backend.nearest(new float[] { 1f, 0.1f }, 2, null);

        assertEquals(2, hits.size());
        assertEquals(1L, hits.get(0).point().id());
        assertEquals(2L, hits.get(1).point().id());
        assertNull(hits.get(0).point().vector());
    }

    @Test
    void shouldPageScansWithIdCursor() {
        InMemoryPointStoreBackend backend = new InMemoryPointStoreBackend("cloud");
        List<Point> points = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            points.add(point(i, new float[] { 1f }, "f" + i + ".md"));
        }
        backend.upsert(points);

        ScanPage first = backend.scan(null, 2, null);
        ScanPage second = backend.scan(null, 2, first.nextOffset());
        ScanPage third = backend.scan(null, 2, second.nextOffset());

        assertEquals(List.of(1L, 2L), first.points().stream().map(Point::id).toList());
        assertEquals(List.of(3L, 4L), second.points().stream().map(Point::id).toList());
        assertEquals(List.of(5L), third.points().stream().map(Point::id).toList());
        assertNull(third.nextOffset());
    }

    @Test
    void shouldRejectFiltersOnUnindexedFields() {
        InMemoryPointStoreBackend backend = new InMemoryPointStoreBackend("cloud", null, Set.of("file_path"));
        backend.upsert(List.of(point(1, new float[] { 1f }, "a.md")));

        assertEquals(1, backend.scan(PointFilter.fileEquals("a.md"), 10, null).points().size());
        assertThrows(UnsupportedFilterException.class,
                () -> backend.scan(PointFilter.builder().must("doc_type", "policy").build(), 10, null));
    }

    @Test
    void shouldEnforceCollectionDimension() {
        InMemoryPointStoreBackend backend = new InMemoryPointStoreBackend("cloud");
        backend.ensureCollection(3);

        assertThrows(DimensionMismatchException.class,
                () -> backend.upsert(List.of(point(1, new float[] { 1f, 2f }, "a.md"))));
        assertEquals(0, backend.count());
    }

    static Point point(long id, float[] vector, String filePath) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("content", "content " + id);
        payload.put("file_path", filePath);
        payload.put("line_start", 1);
        payload.put("is_deleted", false);
        return new Point(id, vector, payload);
    }
}

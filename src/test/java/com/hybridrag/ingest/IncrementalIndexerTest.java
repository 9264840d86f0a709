package com.hybridrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.hybridrag.embedding.EmbeddingProvider;
import com.hybridrag.embedding.EmbeddingProviders;
import com.hybridrag.store.BackendRole;
import com.hybridrag.store.Chunk;
import com.hybridrag.store.ContentType;
import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.HybridStoreSettings;
import com.hybridrag.store.Point;
import com.hybridrag.store.PointFilter;
import com.hybridrag.store.RecordingPointStoreBackend;

class IncrementalIndexerTest {
    private final EmbeddingProvider embeddings = EmbeddingProviders.local(32);
    private RecordingPointStoreBackend primary;
    private HybridPointStore store;
    private IncrementalIndexer indexer;

    @BeforeEach
    void setUp() {
        primary = new RecordingPointStoreBackend("cloud");
        store = new HybridPointStore(primary, null, embeddings, HybridStoreSettings.defaults());
        indexer = new IncrementalIndexer(store);
    }

    @Test
    void shouldWriteNothingWhenFileIsReindexedUnchanged() {
        List<Chunk> chunks = List.of(chunk(1, "alpha"), chunk(4, "beta"), chunk(8, "gamma"));

        assertTrue(indexer.indexFile("docs/a.md", BackendRole.PRIMARY, chunks));
        assertEquals(1, primary.upsertCalls);
        assertEquals(3, primary.upsertedPoints);

        primary.resetCounters();
        assertTrue(indexer.indexFile("docs/a.md", BackendRole.PRIMARY, chunks));
        assertEquals(0, primary.upsertCalls);
        assertEquals(0, primary.deleteCalls);
        assertEquals(3, primary.count());
    }

    @Test
    void shouldApplyOnlyTheDifference() {
        indexer.indexFile("docs/a.md", BackendRole.PRIMARY, List.of(chunk(1, "alpha"), chunk(4, "beta"), chunk(8, "gamma")));
        primary.resetCounters();

        indexer.indexFile("docs/a.md", BackendRole.PRIMARY, List.of(chunk(1, "alpha"), chunk(4, "beta v2"), chunk(12, "delta")));

        assertEquals(1, primary.upsertCalls);
        assertEquals(2, primary.upsertedPoints);
        assertEquals(1, primary.deleteCalls);
        List<Point> stored = store.scanAll(BackendRole.PRIMARY, PointFilter.fileEquals("docs/a.md"));
        assertEquals(List.of("alpha", "beta v2", "delta"),
                stored.stream().sorted((x, y) -> Integer.compare(line(x), line(y)))
                        .map(point -> point.payload().get("content")).toList());
    }

    @Test
    void shouldAnchorChunksToTheIndexedPath() {
        Chunk elsewhere = Chunk.doc("other.md", 1, 2, "S", ContentType.TEXT, "text");

        indexer.indexFile("docs\\a.md", BackendRole.PRIMARY, List.of(elsewhere));

        assertEquals(1, store.scanAll(BackendRole.PRIMARY, PointFilter.fileEquals("docs/a.md")).size());
    }

    @Test
    void shouldTreatDisabledBackendAsSuccess() {
        assertTrue(indexer.indexFile("docs/a.md", BackendRole.SECONDARY, List.of(chunk(1, "alpha"))));
    }

    @Test
    void shouldReportFailureWhenBackendIsUnreachable() {
        primary.failScan = true;

        assertFalse(indexer.indexFile("docs/a.md", BackendRole.PRIMARY, List.of(chunk(1, "alpha"))));
    }

    @Test
    void shouldSkipChunksThatCannotBeEmbedded() {
        indexer.indexFile("docs/a.md", BackendRole.PRIMARY, List.of(chunk(1, "alpha"), chunk(3, "   ")));

        assertEquals(1, primary.count());
    }

    private static Chunk chunk(int line, String content) {
        return Chunk.doc("docs/a.md", line, line + 2, "S", ContentType.TEXT, content);
    }

    private static int line(Point point) {
        return ((Number) point.payload().get("line_start")).intValue();
    }
}

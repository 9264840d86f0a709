package com.hybridrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.hybridrag.embedding.EmbeddingProviders;
import com.hybridrag.store.BackendRole;
import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.HybridStoreSettings;
import com.hybridrag.store.Point;
import com.hybridrag.store.PointFilter;
import com.hybridrag.store.RecordingPointStoreBackend;

class IngestionServiceTest {

    @TempDir
    Path tempDir;

    private RecordingPointStoreBackend primary;
    private RecordingPointStoreBackend secondary;
    private HybridPointStore store;
    private IngestionService service;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("README.md"), "# Project\nhello world\n## Setup\nrun the installer\n");
        Files.createDirectories(tempDir.resolve("docs"));
        Files.writeString(tempDir.resolve("docs/guide.md"), "## Usage\nstart the service\n## Limits\nnone\n");
        Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(tempDir.resolve("src/Example.java"), "public class Example {\n    void go() {}\n}\n");

        primary = new RecordingPointStoreBackend("cloud");
        secondary = new RecordingPointStoreBackend("local");
        store = new HybridPointStore(primary, secondary, EmbeddingProviders.local(64), HybridStoreSettings.defaults());
        CorpusScanner scanner = new CorpusScanner(tempDir, List.of("**/*.md"), List.of("**/*.java"), List.of());
        service = new IngestionService(scanner, new MarkdownChunker(1000, 5), new CodeChunker(80, 12), store);
    }

    @Test
    void shouldIngestAndIncrementallySkipUnchangedFiles() throws IOException {
        IngestionReport first = service.ingest(EnumSet.of(BackendRole.PRIMARY), IngestionService.Scope.ALL, true);

        assertEquals(3, first.total());
        assertEquals(3, first.indexed());
        assertEquals(5, first.chunks());
        assertEquals(5, primary.count());
        assertEquals(0, secondary.count());

        primary.resetCounters();
        IngestionReport second = service.ingest(EnumSet.of(BackendRole.PRIMARY), IngestionService.Scope.ALL, true);

        assertEquals(3, second.indexed());
        assertEquals(0, primary.upsertCalls);
        assertEquals(0, primary.deleteCalls);
        assertEquals(0, second.softDeleted());
    }

    @Test
    void shouldSoftDeleteChunksOfRemovedFiles() throws IOException {
        service.ingest(EnumSet.of(BackendRole.PRIMARY), IngestionService.Scope.ALL, true);
        Files.delete(tempDir.resolve("docs/guide.md"));

        IngestionReport report = service.ingest(EnumSet.of(BackendRole.PRIMARY), IngestionService.Scope.ALL, true);

        assertEquals(2, report.softDeleted());
        List<Point> guide = store.scanAll(BackendRole.PRIMARY, PointFilter.fileEquals("docs/guide.md"));
        assertEquals(2, guide.size());
        assertTrue(guide.stream().allMatch(Point::isDeleted));
    }

    @Test
    void shouldOnlyCountChunksOfRemovedFilesWithoutPrune() throws IOException {
        service.ingest(EnumSet.of(BackendRole.PRIMARY), IngestionService.Scope.ALL, false);
        Files.delete(tempDir.resolve("docs/guide.md"));
        primary.resetCounters();

        IngestionReport report = service.ingest(EnumSet.of(BackendRole.PRIMARY), IngestionService.Scope.ALL, false);

        assertEquals(2, report.staleChunks());
        assertEquals(0, report.softDeleted());
        assertEquals(0, primary.setPayloadCalls);
        assertTrue(store.scanAll(BackendRole.PRIMARY, PointFilter.fileEquals("docs/guide.md")).stream()
                .noneMatch(Point::isDeleted));
    }

    @Test
    void shouldResurrectChunksWhenFileReturns() throws IOException {
        Path guide = tempDir.resolve("docs/guide.md");
        String original = Files.readString(guide);
        service.ingest(EnumSet.of(BackendRole.PRIMARY), IngestionService.Scope.ALL, true);
        Files.delete(guide);
        service.ingest(EnumSet.of(BackendRole.PRIMARY), IngestionService.Scope.ALL, true);
        Files.writeString(guide, original);

        service.ingest(EnumSet.of(BackendRole.PRIMARY), IngestionService.Scope.ALL, true);

        assertTrue(store.scanAll(BackendRole.PRIMARY, PointFilter.fileEquals("docs/guide.md")).stream()
                .noneMatch(Point::isDeleted));
    }

    @Test
    void shouldRestrictToScopeAndWriteEveryTarget() throws IOException {
        IngestionReport report = service.ingest(EnumSet.allOf(BackendRole.class), IngestionService.Scope.DOCS, false);

        assertEquals(2, report.total());
        assertEquals(4, primary.count());
        assertEquals(4, secondary.count());
        assertTrue(store.scanAll(BackendRole.PRIMARY, PointFilter.fileEquals("src/Example.java")).isEmpty());
    }

    @Test
    void shouldSkipFilesThatAreNotUtf8() throws IOException {
        Files.write(tempDir.resolve("broken.md"), new byte[] { (byte) 0xC3, (byte) 0x28, (byte) 0xFF });

        IngestionReport report = service.ingest(Set.of(BackendRole.PRIMARY), IngestionService.Scope.DOCS, false);

        assertEquals(1, report.skipped());
        assertEquals(2, report.indexed());
    }

    @Test
    void shouldCountFailedFilesWhenBackendIsDown() throws IOException {
        primary.failScan = true;

        IngestionReport report = service.ingest(Set.of(BackendRole.PRIMARY), IngestionService.Scope.CODE, true);

        assertEquals(1, report.failed());
        assertEquals(0, report.indexed());
    }
}

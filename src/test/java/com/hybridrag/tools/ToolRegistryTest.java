package com.hybridrag.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hybridrag.embedding.EmbeddingProvider;
import com.hybridrag.embedding.EmbeddingProviders;
import com.hybridrag.ingest.CodeChunker;
import com.hybridrag.ingest.CorpusScanner;
import com.hybridrag.ingest.IngestionService;
import com.hybridrag.ingest.MarkdownChunker;
import com.hybridrag.pipeline.AskPipeline;
import com.hybridrag.retrieval.AnswerSynthesizer;
import com.hybridrag.retrieval.QueryAnalyzer;
import com.hybridrag.retrieval.Reranker;
import com.hybridrag.runtime.AppConfig;
import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.HybridStoreSettings;
import com.hybridrag.store.InMemoryPointStoreBackend;

class ToolRegistryTest {

    @TempDir
    Path tempDir;

    private ToolRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("README.md"), "# Demo\n## Setup\ninstall the cli\n");
        EmbeddingProvider embeddings = EmbeddingProviders.local(16);
        HybridPointStore store = new HybridPointStore(new InMemoryPointStoreBackend("cloud"), null, embeddings,
                HybridStoreSettings.defaults());
        CorpusScanner scanner = new CorpusScanner(tempDir, List.of("**/*.md"), List.of("**/*.java"), List.of());
        IngestionService ingestion = new IngestionService(scanner, new MarkdownChunker(1000, 5),
                new CodeChunker(80, 12), store);
        AskPipeline pipeline = new AskPipeline(store, new QueryAnalyzer(), new Reranker(embeddings),
                new AnswerSynthesizer(), new AppConfig.RetrievalConfig());
        registry = ToolRegistry.create(store, pipeline, ingestion, scanner, 5);
    }

    @Test
    void shouldRegisterEveryTool() {
        List<String> names = registry.tools().stream().map(Tool::name).toList();

        assertEquals(List.of("add_vector", "get_vector", "update_vector", "delete_vector", "delete_all",
                "search_similar", "search_by_metadata", "search", "ask", "index_repository", "cleanup_deleted",
                "recover_deleted", "permanent_delete", "collection_stats"), names);
        assertThrows(IllegalArgumentException.class, () -> registry.register(registry.tools().get(0)));
    }

    @Test
    void shouldRoundTripPointsWithStringIds() {
        ToolResponse added = registry.call("add_vector", Map.of("content", "hello tools",
                "metadata", Map.of("file_path", "notes.md", "line_start", 1)));
        assertTrue(added.success());
        Object id = data(added).get("vector_id");
        assertInstanceOf(String.class, id);

        ToolResponse fetched = registry.call("get_vector", Map.of("vector_id", id, "include_vector", true));
        assertTrue(fetched.success());
        assertEquals(16, ((List<?>) data(fetched).get("vector")).size());
        assertEquals("get_vector", fetched.metadata().get("operation"));

        ToolResponse updated = registry.call("update_vector", Map.of("vector_id", id, "metadata", Map.of("owner", "me")));
        assertEquals("me", ((Map<?, ?>) data(updated).get("metadata")).get("owner"));

        ToolResponse softDeleted = registry.call("delete_vector", Map.of("vector_id", id, "soft_delete", true));
        assertEquals(true, data(softDeleted).get("soft_delete"));
        assertEquals(true, data(registry.call("get_vector", Map.of("vector_id", id))).get("is_deleted"));
    }

    @Test
    void shouldReportStructuredErrors() {
        ToolResponse unknown = registry.call("no_such_tool", Map.of());
        assertFalse(unknown.success());
        assertEquals("VALIDATION_ERROR", unknown.errors().get(0).code());
        assertTrue(unknown.errors().get(0).details().containsKey("available"));

        ToolResponse missing = registry.call("get_vector", Map.of("vector_id", "42"));
        assertEquals("POINT_NOT_FOUND", missing.errors().get(0).code());
        assertFalse(missing.errors().get(0).suggestions().isEmpty());

        ToolResponse badId = registry.call("get_vector", Map.of("vector_id", "forty-two"));
        assertEquals("VALIDATION_ERROR", badId.errors().get(0).code());

        ToolResponse unconfirmed = registry.call("delete_all", Map.of());
        assertEquals("VALIDATION_ERROR", unconfirmed.errors().get(0).code());

        ToolResponse disabledLocal = registry.call("index_repository", Map.of("target", "local"));
        assertEquals("VALIDATION_ERROR", disabledLocal.errors().get(0).code());
    }

    @Test
    void shouldMapUnexpectedExceptionsToUnknownError() {
        registry.register(new AbstractTool("explode", "Always fails") {
            @Override
            Object execute(ToolArguments arguments) {
                throw new IllegalStateException("boom");
            }
        });

        ToolResponse response = registry.call("explode", null);

        assertFalse(response.success());
        assertEquals("UNKNOWN_ERROR", response.errors().get(0).code());
        assertEquals("boom", response.errors().get(0).message());
    }

    @Test
    void shouldIndexSearchAndAskThroughTools() {
        ToolResponse indexed = registry.call("index_repository", Map.of("target", "cloud", "scope", "docs"));
        assertTrue(indexed.success());
        assertEquals(1, data(indexed).get("files_indexed"));

        ToolResponse search = registry.call("search", Map.of("query", "install the cli"));
        List<?> results = (List<?>) data(search).get("results");
        assertFalse(results.isEmpty());
        assertEquals("README.md (line 2)", ((Map<?, ?>) results.get(0)).get("citation"));
        assertEquals("cloud", ((Map<?, ?>) results.get(0)).get("origin"));

        ToolResponse byMetadata = registry.call("search_by_metadata",
                Map.of("filter", Map.of("file_path", "README.md"), "limit", 5));
        assertEquals(2, data(byMetadata).get("count"));

        ToolResponse similar = registry.call("search_similar", Map.of("query", "install", "top_k", 1));
        assertEquals(1, data(similar).get("count"));

        ToolResponse ask = registry.call("ask", Map.of("question", "How do I install the cli?"));
        assertTrue(ask.success());
        assertTrue(((String) data(ask).get("answer")).contains("README.md"));

        ToolResponse stats = registry.call("collection_stats", Map.of());
        assertEquals(2L, data(stats).get("cloud"));
        assertEquals(0L, data(stats).get("local"));
    }

    @Test
    void shouldRunSoftDeleteLifecycleThroughTools() throws IOException {
        registry.call("index_repository", Map.of("target", "cloud"));
        Files.delete(tempDir.resolve("README.md"));

        ToolResponse preview = registry.call("cleanup_deleted", Map.of());
        assertEquals(true, data(preview).get("dry_run"));
        assertEquals(2, data(preview).get("would_mark_deleted"));
        assertEquals(2, data(registry.call("search_by_metadata",
                Map.of("filter", Map.of("file_path", "README.md")))).get("count"));

        ToolResponse marked = registry.call("cleanup_deleted", Map.of("dry_run", false));
        assertEquals(2, data(marked).get("marked_deleted"));
        assertEquals(0, data(registry.call("search_by_metadata",
                Map.of("filter", Map.of("file_path", "README.md")))).get("count"));

        ToolResponse recoverPreview = registry.call("recover_deleted", Map.of("file_path", "README.md", "dry_run", true));
        assertEquals(2, data(recoverPreview).get("matched"));
        assertEquals(0, data(recoverPreview).get("recovered"));

        ToolResponse purgePreview = registry.call("permanent_delete", Map.of());
        assertEquals(2, data(purgePreview).get("matched"));
        assertEquals(0, data(purgePreview).get("deleted"));

        ToolResponse purged = registry.call("permanent_delete", Map.of("confirm", true));
        assertEquals(2, data(purged).get("deleted"));
        assertEquals(0L, data(registry.call("collection_stats", Map.of())).get("cloud"));
    }

    @Test
    void shouldPruneRemovedFilesOnlyWhenAsked() throws IOException {
        registry.call("index_repository", Map.of("target", "cloud"));
        Files.delete(tempDir.resolve("README.md"));

        Map<String, Object> reindexed = data(registry.call("index_repository", Map.of("target", "cloud")));
        assertEquals(false, reindexed.get("prune"));
        assertEquals(2, reindexed.get("stale_chunks"));
        assertEquals(0, reindexed.get("soft_deleted"));

        Map<String, Object> pruned = data(registry.call("index_repository", Map.of("target", "cloud", "prune", true)));
        assertEquals(2, pruned.get("soft_deleted"));
        assertEquals(0, data(registry.call("search_by_metadata",
                Map.of("filter", Map.of("file_path", "README.md")))).get("count"));
    }

    @Test
    void shouldSerialiseEnvelopeAsJson() throws IOException {
        Map<String, Object> args = new HashMap<>();
        args.put("content", "json check");
        String json = registry.toJson(registry.call("add_vector", args));

        JsonNode root = new ObjectMapper().readTree(json);
        assertTrue(root.path("success").asBoolean());
        assertTrue(root.path("data").path("vector_id").isTextual());
        assertEquals("add_vector", root.path("metadata").path("operation").asText());
        assertTrue(root.path("errors").isArray());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ToolResponse response) {
        assertTrue(response.success(), () -> "expected success but got " + response.errors());
        return (Map<String, Object>) response.data();
    }
}

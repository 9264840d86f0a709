package com.hybridrag.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.hybridrag.embedding.EmbeddingProvider;
import com.hybridrag.embedding.EmbeddingProviders;
import com.hybridrag.retrieval.AnswerSynthesizer;
import com.hybridrag.retrieval.QueryAnalyzer;
import com.hybridrag.retrieval.QueryIntent;
import com.hybridrag.retrieval.Reranker;
import com.hybridrag.runtime.AppConfig;
import com.hybridrag.store.BackendRole;
import com.hybridrag.store.Chunk;
import com.hybridrag.store.ContentType;
import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.HybridStoreSettings;
import com.hybridrag.store.RecordingPointStoreBackend;

class AskPipelineTest {
    private final EmbeddingProvider embeddings = EmbeddingProviders.local(64);
    private RecordingPointStoreBackend primary;
    private HybridPointStore store;
    private AskPipeline pipeline;

    @BeforeEach
    void setUp() {
        primary = new RecordingPointStoreBackend("cloud");
        store = new HybridPointStore(primary, null, embeddings, HybridStoreSettings.defaults());
        pipeline = new AskPipeline(store, new QueryAnalyzer(), new Reranker(embeddings), new AnswerSynthesizer(),
                new AppConfig.RetrievalConfig());
    }

    @Test
    void shouldAnswerEnumerationWithMergedListAndSources() {
        store.upsert(Chunk.doc("docs/release.md", 3, 6, "Steps", ContentType.LIST,
                "## Steps\n1. Freeze the branch\n2. Tag the release\n3. Publish artifacts"), BackendRole.PRIMARY);
        store.upsert(Chunk.doc("docs/other.md", 1, 2, "Misc", ContentType.TEXT, "unrelated notes"), BackendRole.PRIMARY);

        AskResult result = pipeline.ask("List all release steps", null);

        assertFalse(result.failed());
        assertEquals(QueryIntent.ENUMERATION, result.analysis().intent());
        assertTrue(result.answer().startsWith("**Answer to: List all release steps**\n\n"));
        assertTrue(result.answer().contains("1. Freeze the branch\n2. Tag the release\n3. Publish artifacts"));
        assertTrue(result.answer().contains("**Sources:**\n- docs/release.md (line 3)\n"));
        assertTrue(result.sources().contains("docs/release.md (line 3)"));
    }

    @Test
    void shouldAppendContextToTheSearchQuery() {
        store.upsert(Chunk.doc("docs/db.md", 1, 2, "Db", ContentType.TEXT, "postgres connection pooling"),
                BackendRole.PRIMARY);

        AskResult result = pipeline.ask("pooling", "postgres");

        assertFalse(result.failed());
        assertEquals("pooling", result.question());
        assertEquals(QueryIntent.FACTUAL, result.analysis().intent());
        assertTrue(result.answer().contains("postgres connection pooling"));
    }

    @Test
    void shouldExplainWhenNothingMatches() {
        AskResult result = pipeline.ask("Explain the release process", "");

        assertFalse(result.failed());
        assertEquals("I couldn't find relevant information to answer: 'Explain the release process'. "
                + "Please try rephrasing your question.", result.answer());
        assertTrue(result.results().isEmpty());
    }

    @Test
    void shouldReturnErrorAnswerInsteadOfThrowing() {
        primary.failNearest = true;

        AskResult result = pipeline.ask("Explain the release process", null);

        assertTrue(result.failed());
        assertTrue(result.answer().startsWith("Error answering question: "));
    }

    @Test
    void shouldReportEmptyQuestionAsFailure() {
        AskResult result = pipeline.ask("  ", null);

        assertTrue(result.failed());
        assertNull(result.analysis());
    }

    @Test
    void shouldRerankDownToConfiguredTopK() {
        for (int line = 1; line <= 15; line++) {
            store.upsert(Chunk.doc("docs/f" + line + ".md", line, line, "S", ContentType.TEXT,
                    "cache eviction note " + line), BackendRole.PRIMARY);
        }

        AskResult result = pipeline.ask("cache eviction", null);

        assertEquals(10, result.results().size());
        assertEquals(5, result.sources().size());
        assertTrue(result.results().stream().allMatch(r -> r.metadata().containsKey("rerank_score")));
    }
}

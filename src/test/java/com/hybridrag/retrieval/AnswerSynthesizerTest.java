package com.hybridrag.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.hybridrag.error.ValidationException;
import com.hybridrag.store.BackendRole;
import com.hybridrag.store.SearchResult;

class AnswerSynthesizerTest {
    private final AnswerSynthesizer synthesizer = new AnswerSynthesizer();

    @Test
    void shouldMergeNumberedItemsInOrderAcrossChunks() {
        List<SearchResult> chunks = List.of(
                chunk("b.md", 10, null, "3. Third step\n4. Fourth step"),
                chunk("a.md", 1, null, "Intro\n1. First step\n2. Second step"));

        String answer = synthesizer.synthesize(chunks, QueryIntent.ENUMERATION, "list all steps");

        assertEquals("1. First step\n2. Second step\n3. Third step\n4. Fourth step", answer);
    }

    @Test
    void shouldJoinContentWhenNoNumberedItemsFound() {
        List<SearchResult> chunks = List.of(chunk("a.md", 1, null, "alpha"), chunk("a.md", 5, null, "beta"));

        assertEquals("alpha\n\nbeta", synthesizer.synthesize(chunks, QueryIntent.ENUMERATION, "q"));
    }

    @Test
    void shouldOrderExplanationByLocation() {
        List<SearchResult> chunks = List.of(
                chunk("b.md", 1, null, "second file"),
                chunk("a.md", 20, null, "later part"),
                chunk("a.md", 2, null, "  early part  "));

        assertEquals("early part\n\nlater part\n\nsecond file",
                synthesizer.synthesize(chunks, QueryIntent.EXPLANATION, "q"));
    }

    @Test
    void shouldGroupCodeByFile() {
        List<SearchResult> chunks = List.of(
                chunk("src/B.java", 40, null, "class B {}"),
                chunk("src/A.java", 1, null, "class A {}"));

        String answer = synthesizer.synthesize(chunks, QueryIntent.CODE_SEARCH, "q");

        assertTrue(answer.indexOf("**File: src/A.java**") < answer.indexOf("**File: src/B.java**"));
        assertTrue(answer.contains("Lines 40:\n```\nclass B {}\n```"));
    }

    @Test
    void shouldGroupComparisonBySection() {
        List<SearchResult> chunks = List.of(
                chunk("a.md", 1, "Postgres", "row store"),
                chunk("a.md", 9, null, "misc"),
                chunk("a.md", 5, "MySQL", "also row store"));

        String answer = synthesizer.synthesize(chunks, QueryIntent.COMPARISON, "q");

        assertTrue(answer.startsWith("## MySQL\n"));
        assertTrue(answer.indexOf("## Other") < answer.indexOf("## Postgres"));
    }

    @Test
    void shouldAnswerFactualWithTopChunk() {
        List<SearchResult> chunks = List.of(chunk("a.md", 1, null, "top"), chunk("a.md", 2, null, "next"));

        assertEquals("top", synthesizer.synthesize(chunks, QueryIntent.FACTUAL, "q"));
        assertThrows(ValidationException.class, () -> synthesizer.synthesize(List.of(), QueryIntent.FACTUAL, "q"));
    }

    private static SearchResult chunk(String path, int line, String section, String content) {
        Map<String, Object> metadata = section == null ? Map.of() : Map.of("section", section);
        return new SearchResult(line, content, path, line, 0.5f, BackendRole.PRIMARY, metadata);
    }
}

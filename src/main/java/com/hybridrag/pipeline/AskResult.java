package com.hybridrag.pipeline;

import java.util.List;

import com.hybridrag.retrieval.QueryAnalysis;
import com.hybridrag.store.SearchResult;

/**
 * Outcome of one question. {@code answer} is always present; {@code analysis} is null when
 * the pipeline failed before intent analysis completed.
 */
public record AskResult(
        String question,
        String answer,
        QueryAnalysis analysis,
        List<SearchResult> results,
        List<String> sources,
        boolean failed,
        long elapsedMs) {
}

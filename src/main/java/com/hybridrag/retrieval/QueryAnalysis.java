package com.hybridrag.retrieval;

import java.util.List;

import com.hybridrag.embedding.ContentCategory;

public record QueryAnalysis(
        QueryIntent intent,
        double confidence,
        List<String> keywords,
        List<ContentCategory> contentTypes,
        boolean needsExpansion,
        boolean needsReranking) {

    public QueryAnalysis {
        confidence = Math.min(1.0, Math.max(0.0, confidence));
        keywords = List.copyOf(keywords);
        contentTypes = List.copyOf(contentTypes);
    }
}

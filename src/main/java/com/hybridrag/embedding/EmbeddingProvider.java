package com.hybridrag.embedding;

import java.util.List;

/**
 * Embedding and pairwise relevance capability. Both operations may raise
 * {@link CapabilityUnavailableException}.
 */
public interface EmbeddingProvider {
    float[] embed(String text, ContentCategory category);

    float[] rerankScores(String query, List<String> candidates);

    int dimension();

    void clear();
}

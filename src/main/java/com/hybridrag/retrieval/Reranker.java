package com.hybridrag.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.embedding.EmbeddingProvider;
import com.hybridrag.embedding.ModelEmbeddingProvider;
import com.hybridrag.error.RerankException;
import com.hybridrag.error.ValidationException;
import com.hybridrag.store.PayloadFields;
import com.hybridrag.store.SearchResult;

/**
 * Reorders search results with the provider's pairwise relevance scorer. Scoring failures
 * degrade to vector-score order.
 */
public class Reranker {
    private static final Logger log = LoggerFactory.getLogger(Reranker.class);

    private final EmbeddingProvider embeddings;

    public Reranker(EmbeddingProvider embeddings) {
        this.embeddings = embeddings;
    }

    public List<SearchResult> rerank(String query, List<SearchResult> results, int topK) {
        if (results == null || results.isEmpty()) {
            throw new ValidationException("Cannot rerank empty results list");
        }
        if (results.size() <= topK) {
            log.debug("Results count ({}) <= top_k ({}), no reranking needed", results.size(), topK);
            return results;
        }
        try {
            List<String> candidates = results.stream().map(SearchResult::content).toList();
            float[] scores = embeddings.rerankScores(query, candidates);
            if (scores == null || scores.length != results.size()) {
                throw new RerankException("Scorer returned " + (scores == null ? 0 : scores.length)
                        + " scores for " + results.size() + " candidates");
            }
            List<SearchResult> scored = new ArrayList<>();
            for (int i = 0; i < results.size(); i++) {
                scored.add(results.get(i).withMetadataValue(PayloadFields.RERANK_SCORE, scores[i]));
            }
            return scored.stream()
                    .sorted(Comparator.comparingDouble(Reranker::rerankScore).reversed())
                    .limit(topK)
                    .toList();
        } catch (RuntimeException e) {
            log.warn("Reranking failed, falling back to vector scores: {}", e.getMessage());
            return results.stream()
                    .sorted(Comparator.comparing(SearchResult::score).reversed())
                    .limit(topK)
                    .toList();
        }
    }

    public List<List<SearchResult>> batchRerank(String query, List<List<SearchResult>> resultLists, int topK) {
        if (resultLists == null || resultLists.isEmpty()) {
            throw new ValidationException("Cannot rerank empty results list");
        }
        List<List<SearchResult>> out = new ArrayList<>();
        for (List<SearchResult> results : resultLists) {
            out.add(results == null || results.isEmpty() ? List.of() : rerank(query, results, topK));
        }
        return out;
    }

    public void clearCache() {
        if (embeddings instanceof ModelEmbeddingProvider provider) {
            provider.clearCrossEncoder();
        } else {
            embeddings.clear();
        }
        log.info("Reranker model cache cleared");
    }

    private static double rerankScore(SearchResult result) {
        Object score = result.metadata().get(PayloadFields.RERANK_SCORE);
        return score instanceof Number number ? number.doubleValue() : Double.NEGATIVE_INFINITY;
    }
}

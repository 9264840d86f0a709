package com.hybridrag.pipeline;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.retrieval.AnswerSynthesizer;
import com.hybridrag.retrieval.QueryAnalysis;
import com.hybridrag.retrieval.QueryAnalyzer;
import com.hybridrag.retrieval.Reranker;
import com.hybridrag.runtime.AppConfig;
import com.hybridrag.store.HybridPointStore;
import com.hybridrag.store.SearchResult;

/**
 * Question answering: analyse, retrieve (with section expansion when the intent asks for
 * it), rerank, synthesise, cite. Every stage failure degrades; {@link #ask} never throws.
 */
public class AskPipeline {
    private static final Logger log = LoggerFactory.getLogger(AskPipeline.class);

    private final HybridPointStore store;
    private final QueryAnalyzer analyzer;
    private final Reranker reranker;
    private final AnswerSynthesizer synthesizer;
    private final AppConfig.RetrievalConfig retrieval;

    public AskPipeline(HybridPointStore store,
            QueryAnalyzer analyzer,
            Reranker reranker,
            AnswerSynthesizer synthesizer,
            AppConfig.RetrievalConfig retrieval) {
        this.store = store;
        this.analyzer = analyzer;
        this.reranker = reranker;
        this.synthesizer = synthesizer;
        this.retrieval = retrieval;
    }

    public AskResult ask(String question, String context) {
        long start = System.nanoTime();
        QueryAnalysis analysis = null;
        try {
            String searchQuery = ((question == null ? "" : question) + " " + (context == null ? "" : context)).strip();
            analysis = analyzer.analyze(searchQuery);
            log.info("Query intent: {} (confidence: {})", analysis.intent().label(),
                    String.format(Locale.ROOT, "%.2f", analysis.confidence()));

            List<SearchResult> results = analysis.needsExpansion()
                    ? store.searchWithExpansion(searchQuery, retrieval.getSearchTopK(), retrieval.getMaxResults())
                    : store.search(searchQuery, retrieval.getSearchTopK());
            if (results.isEmpty()) {
                String answer = "I couldn't find relevant information to answer: '" + question
                        + "'. Please try rephrasing your question.";
                return new AskResult(question, answer, analysis, List.of(), List.of(), false, elapsed(start));
            }

            if (analysis.needsReranking() && results.size() > retrieval.getRerankTopK()) {
                try {
                    results = reranker.rerank(searchQuery, results, retrieval.getRerankTopK());
                } catch (RuntimeException e) {
                    log.warn("Reranking failed, using initial results: {}", e.getMessage());
                }
            }

            String body;
            try {
                body = synthesizer.synthesize(results, analysis.intent(), question);
            } catch (RuntimeException e) {
                log.warn("Synthesis failed, using concatenation: {}", e.getMessage());
                body = results.stream()
                        .limit(retrieval.getMaxResults())
                        .map(SearchResult::content)
                        .collect(Collectors.joining("\n\n"));
            }

            List<String> sources = Citations.sources(results);
            StringBuilder answer = new StringBuilder()
                    .append("**Answer to: ").append(question).append("**\n\n")
                    .append(body)
                    .append("\n\n---\n\n")
                    .append("**Sources:**\n");
            sources.forEach(source -> answer.append("- ").append(source).append('\n'));

            long elapsedMs = elapsed(start);
            log.info("ask completed in {} ms: {} results, intent={}", elapsedMs, results.size(), analysis.intent().label());
            return new AskResult(question, answer.toString(), analysis, results, sources, false, elapsedMs);
        } catch (RuntimeException e) {
            long elapsedMs = elapsed(start);
            log.error("ask failed in {} ms", elapsedMs, e);
            return new AskResult(question, "Error answering question: " + e.getMessage(), analysis, List.of(),
                    List.of(), true, elapsedMs);
        }
    }

    private static long elapsed(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}

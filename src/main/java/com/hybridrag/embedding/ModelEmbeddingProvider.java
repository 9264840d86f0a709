package com.hybridrag.embedding;

import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.error.ValidationException;

/**
 * Routes embedding requests to a per-category encoder and reranking to a cross-encoder.
 * Every model handle is loaded on first use and kept until {@link #clear()}.
 */
public class ModelEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(ModelEmbeddingProvider.class);

    private final int dimension;
    private final LazyResource<TextEncoder> docEncoder;
    private final LazyResource<TextEncoder> codeEncoder;
    private final LazyResource<CrossEncoder> crossEncoder;

    public ModelEmbeddingProvider(int dimension,
            Supplier<TextEncoder> docLoader,
            Supplier<TextEncoder> codeLoader,
            Supplier<CrossEncoder> crossEncoderLoader) {
        this.dimension = dimension;
        this.docEncoder = new LazyResource<>("doc-encoder", docLoader);
        this.codeEncoder = new LazyResource<>("code-encoder", codeLoader);
        this.crossEncoder = new LazyResource<>("cross-encoder", crossEncoderLoader);
    }

    @Override
    public float[] embed(String text, ContentCategory category) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Cannot embed empty content");
        }
        LazyResource<TextEncoder> handle = category == ContentCategory.CODE ? codeEncoder : docEncoder;
        try {
            float[] vector = handle.get().encode(text);
            if (vector.length != dimension) {
                throw new CapabilityUnavailableException("Encoder " + handle.name() + " produced "
                        + vector.length + " dimensions, expected " + dimension);
            }
            return vector;
        } catch (CapabilityUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to embed {} content", category.label(), e);
            throw new CapabilityUnavailableException("Failed to embed " + category.label() + " content: "
                    + e.getMessage(), e);
        }
    }

    @Override
    public float[] rerankScores(String query, List<String> candidates) {
        try {
            return crossEncoder.get().score(query, candidates);
        } catch (CapabilityUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CapabilityUnavailableException("Cross-encoder scoring failed: " + e.getMessage(), e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void clear() {
        docEncoder.clear();
        codeEncoder.clear();
        crossEncoder.clear();
    }

    public void clearCrossEncoder() {
        crossEncoder.clear();
    }
}

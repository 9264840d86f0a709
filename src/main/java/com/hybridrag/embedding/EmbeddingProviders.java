package com.hybridrag.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingProviders.class);

    private EmbeddingProviders() {
    }

    public static EmbeddingProvider fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        int dimension = config.getDimension();
        if (!"remote".equalsIgnoreCase(config.getProvider())) {
            log.info("Using local hashing embeddings (dimension={})", dimension);
            return local(dimension);
        }
        log.info("Using remote embeddings endpoint={} docModel={} codeModel={} rerankModel={}",
                config.getEndpoint(), config.getDocModel(), config.getCodeModel(), config.getRerankModel());
        String rerankEndpoint = config.getRerankEndpoint();
        return new ModelEmbeddingProvider(dimension,
                () -> new RemoteTextEncoder(httpClient, config.getEndpoint(), config.getDocModel(), config.getApiKey(), dimension),
                () -> new RemoteTextEncoder(httpClient, config.getEndpoint(), config.getCodeModel(), config.getApiKey(), dimension),
                () -> rerankEndpoint == null || rerankEndpoint.isBlank()
                        ? new LexicalCrossEncoder(dimension)
                        : new RemoteCrossEncoder(httpClient, rerankEndpoint, config.getRerankModel(), config.getApiKey()));
    }

    public static EmbeddingProvider local(int dimension) {
        return new ModelEmbeddingProvider(dimension,
                () -> new HashingTextEncoder(dimension, ContentCategory.DOC),
                () -> new HashingTextEncoder(dimension, ContentCategory.CODE),
                () -> new LexicalCrossEncoder(dimension));
    }
}

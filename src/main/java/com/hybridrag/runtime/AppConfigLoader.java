package com.hybridrag.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.hybridrag.error.ValidationException;

public class AppConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(AppConfigLoader.class);

    static final String ENV_QDRANT_URL = "HYBRIDRAG_QDRANT_URL";
    static final String ENV_QDRANT_API_KEY = "HYBRIDRAG_QDRANT_API_KEY";
    static final String ENV_QDRANT_COLLECTION = "HYBRIDRAG_QDRANT_COLLECTION";
    static final String ENV_EMBEDDING_URL = "HYBRIDRAG_EMBEDDING_URL";
    static final String ENV_EMBEDDING_API_KEY = "HYBRIDRAG_EMBEDDING_API_KEY";
    static final String ENV_PROJECT_ROOT = "HYBRIDRAG_PROJECT_ROOT";

    private final Map<String, String> environment;
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public AppConfigLoader() {
        this(System.getenv());
    }

    public AppConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    public AppConfig load(Path config) throws IOException {
        AppConfig appConfig;
        if (config == null || !Files.exists(config)) {
            log.info("Config file {} not found, using defaults", config);
            appConfig = new AppConfig();
        } else {
            appConfig = mapper.readValue(config.toFile(), AppConfig.class);
        }
        applyEnvironment(appConfig);
        validate(appConfig);
        return appConfig;
    }

    void applyEnvironment(AppConfig config) {
        String url = environment.get(ENV_QDRANT_URL);
        if (url != null && !url.isBlank()) {
            config.getPrimary().setUrl(url);
        }
        String apiKey = environment.get(ENV_QDRANT_API_KEY);
        if (apiKey != null && !apiKey.isBlank()) {
            config.getPrimary().setApiKey(apiKey);
        }
        String collection = environment.get(ENV_QDRANT_COLLECTION);
        if (collection != null && !collection.isBlank()) {
            config.getPrimary().setCollection(collection);
        }
        String embeddingUrl = environment.get(ENV_EMBEDDING_URL);
        if (embeddingUrl != null && !embeddingUrl.isBlank()) {
            config.getEmbedding().setEndpoint(embeddingUrl);
            config.getEmbedding().setProvider("remote");
        }
        String embeddingKey = environment.get(ENV_EMBEDDING_API_KEY);
        if (embeddingKey != null && !embeddingKey.isBlank()) {
            config.getEmbedding().setApiKey(embeddingKey);
        }
        String projectRoot = environment.get(ENV_PROJECT_ROOT);
        if (projectRoot != null && !projectRoot.isBlank()) {
            config.getIndexing().setProjectRoot(projectRoot);
        }
    }

    public static void validate(AppConfig config) {
        AppConfig.RetrievalConfig retrieval = config.getRetrieval();
        double weightSum = retrieval.getKeywordWeight() + retrieval.getVectorWeight();
        if (Math.abs(weightSum - 1.0) > 0.01) {
            throw new ValidationException("retrieval.keywordWeight + retrieval.vectorWeight must sum to 1.0, got "
                    + weightSum, Map.of("keywordWeight", retrieval.getKeywordWeight(),
                            "vectorWeight", retrieval.getVectorWeight()));
        }
        if (retrieval.getKeywordWeight() < 0 || retrieval.getVectorWeight() < 0) {
            throw new ValidationException("retrieval weights must not be negative");
        }
        requirePositive("retrieval.searchTopK", retrieval.getSearchTopK());
        requirePositive("retrieval.rerankTopK", retrieval.getRerankTopK());
        requirePositive("retrieval.maxResults", retrieval.getMaxResults());
        requirePositive("retrieval.maxSearchTopK", retrieval.getMaxSearchTopK());
        requirePositive("retrieval.maxScanLimit", retrieval.getMaxScanLimit());
        requirePositive("embedding.dimension", config.getEmbedding().getDimension());
        requirePositive("indexing.docChunkSize", config.getIndexing().getDocChunkSize());
        requirePositive("indexing.codeChunkLines", config.getIndexing().getCodeChunkLines());
        requirePositive("indexing.cleanupBatchSize", config.getIndexing().getCleanupBatchSize());
        if (config.getIndexing().getCodeChunkOverlap() >= config.getIndexing().getCodeChunkLines()) {
            throw new ValidationException("indexing.codeChunkOverlap must be smaller than indexing.codeChunkLines");
        }
        if ("remote".equalsIgnoreCase(config.getEmbedding().getProvider())
                && (config.getEmbedding().getEndpoint() == null || config.getEmbedding().getEndpoint().isBlank())) {
            throw new ValidationException("embedding.endpoint is required when embedding.provider is remote");
        }
        if (config.getPrimary().getCollection() == null || config.getPrimary().getCollection().isBlank()) {
            throw new ValidationException("primary.collection is required");
        }
    }

    private static void requirePositive(String field, int value) {
        if (value <= 0) {
            throw new ValidationException(field + " must be positive, got " + value, Map.of("field", field));
        }
    }
}

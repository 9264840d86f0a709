package com.hybridrag.store;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class PointStoreBackends {
    private static final Logger log = LoggerFactory.getLogger(PointStoreBackends.class);

    private PointStoreBackends() {
    }

    public static PointStoreBackend fromConfig(AppConfig.BackendConfig config, BackendRole role, OkHttpClient httpClient) {
        if (!config.isEnabled()) {
            log.info("{} backend disabled", role.label());
            return new DisabledPointStoreBackend(role.label());
        }
        String type = config.getType() == null ? "qdrant" : config.getType().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "memory":
                Path storage = config.getStoragePath() == null || config.getStoragePath().isBlank()
                        ? null
                        : Path.of(config.getStoragePath());
                log.info("{} backend: embedded collection {} (storage={})", role.label(), config.getCollection(), storage);
                return new InMemoryPointStoreBackend(config.getCollection(), storage, null);
            case "qdrant":
                log.info("{} backend: Qdrant {} collection {}", role.label(), config.getUrl(), config.getCollection());
                OkHttpClient client = httpClient.newBuilder()
                        .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                        .build();
                return new QdrantRestBackend(client, config.getUrl(), config.getCollection(), config.getApiKey());
            default:
                throw new IllegalArgumentException("Unsupported backend type: " + config.getType());
        }
    }
}

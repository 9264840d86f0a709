package com.hybridrag.store;

import com.hybridrag.runtime.AppConfig;

public record HybridStoreSettings(
        int maxSearchTopK,
        int maxScanLimit,
        int sectionExpansionThreshold,
        double vectorWeight,
        double keywordWeight,
        int mutationBatchSize) {

    public static HybridStoreSettings defaults() {
        return new HybridStoreSettings(100, 1000, 10, 0.7, 0.3, 1000);
    }

    public static HybridStoreSettings fromConfig(AppConfig config) {
        AppConfig.RetrievalConfig retrieval = config.getRetrieval();
        return new HybridStoreSettings(
                retrieval.getMaxSearchTopK(),
                retrieval.getMaxScanLimit(),
                retrieval.getSectionExpansionThreshold(),
                retrieval.getVectorWeight(),
                retrieval.getKeywordWeight(),
                config.getIndexing().getCleanupBatchSize());
    }
}

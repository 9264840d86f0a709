package com.hybridrag.runtime;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private BackendConfig primary = new BackendConfig();
    private BackendConfig secondary = BackendConfig.localDefaults();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private IndexingConfig indexing = new IndexingConfig();

    public BackendConfig getPrimary() {
        return primary;
    }

    public void setPrimary(BackendConfig primary) {
        this.primary = primary == null ? new BackendConfig() : primary;
    }

    public BackendConfig getSecondary() {
        return secondary;
    }

    public void setSecondary(BackendConfig secondary) {
        this.secondary = secondary == null ? BackendConfig.localDefaults() : secondary;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public IndexingConfig getIndexing() {
        return indexing;
    }

    public void setIndexing(IndexingConfig indexing) {
        this.indexing = indexing == null ? new IndexingConfig() : indexing;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BackendConfig {
        private boolean enabled = true;
        private String type = "qdrant";
        private String url = "http://localhost:6333";
        private String apiKey;
        private String collection = "hybrid-rag";
        private int timeoutMs = 30000;
        private String storagePath;

        static BackendConfig localDefaults() {
            BackendConfig local = new BackendConfig();
            local.setType("memory");
            local.setUrl(null);
            local.setCollection("hybrid-rag-local");
            local.setStoragePath(".hybridrag/local-store.json");
            return local;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public String getStoragePath() {
            return storagePath;
        }

        public void setStoragePath(String storagePath) {
            this.storagePath = storagePath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "local";
        private String endpoint;
        private String rerankEndpoint;
        private String apiKey;
        private int dimension = 384;
        private String docModel = "sentence-transformers/all-MiniLM-L6-v2";
        private String codeModel = "microsoft/codebert-base";
        private String rerankModel = "cross-encoder/ms-marco-MiniLM-L-6-v2";

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getRerankEndpoint() {
            return rerankEndpoint;
        }

        public void setRerankEndpoint(String rerankEndpoint) {
            this.rerankEndpoint = rerankEndpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public String getDocModel() {
            return docModel;
        }

        public void setDocModel(String docModel) {
            this.docModel = docModel;
        }

        public String getCodeModel() {
            return codeModel;
        }

        public void setCodeModel(String codeModel) {
            this.codeModel = codeModel;
        }

        public String getRerankModel() {
            return rerankModel;
        }

        public void setRerankModel(String rerankModel) {
            this.rerankModel = rerankModel;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int searchTopK = 20;
        private int rerankTopK = 10;
        private int maxResults = 25;
        private double keywordWeight = 0.3;
        private double vectorWeight = 0.7;
        private int sectionExpansionThreshold = 10;
        private int maxSearchTopK = 100;
        private int maxScanLimit = 1000;

        public int getSearchTopK() {
            return searchTopK;
        }

        public void setSearchTopK(int searchTopK) {
            this.searchTopK = searchTopK;
        }

        public int getRerankTopK() {
            return rerankTopK;
        }

        public void setRerankTopK(int rerankTopK) {
            this.rerankTopK = rerankTopK;
        }

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }

        public double getKeywordWeight() {
            return keywordWeight;
        }

        public void setKeywordWeight(double keywordWeight) {
            this.keywordWeight = keywordWeight;
        }

        public double getVectorWeight() {
            return vectorWeight;
        }

        public void setVectorWeight(double vectorWeight) {
            this.vectorWeight = vectorWeight;
        }

        public int getSectionExpansionThreshold() {
            return sectionExpansionThreshold;
        }

        public void setSectionExpansionThreshold(int sectionExpansionThreshold) {
            this.sectionExpansionThreshold = sectionExpansionThreshold;
        }

        public int getMaxSearchTopK() {
            return maxSearchTopK;
        }

        public void setMaxSearchTopK(int maxSearchTopK) {
            this.maxSearchTopK = maxSearchTopK;
        }

        public int getMaxScanLimit() {
            return maxScanLimit;
        }

        public void setMaxScanLimit(int maxScanLimit) {
            this.maxScanLimit = maxScanLimit;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexingConfig {
        private String projectRoot = ".";
        private List<String> docPatterns = List.of("**/*.md");
        private List<String> codePatterns = List.of("**/*.java", "**/*.py", "**/*.ts", "**/*.js");
        private List<String> excludePatterns = List.of("**/node_modules/**", "**/target/**", "**/build/**", "**/dist/**", "**/.git/**");
        private int docChunkSize = 1000;
        private int docChunkOverlap = 5;
        private int codeChunkLines = 80;
        private int codeChunkOverlap = 12;
        private int cleanupBatchSize = 1000;
        private List<String> targets = List.of("cloud");

        public String getProjectRoot() {
            return projectRoot;
        }

        public void setProjectRoot(String projectRoot) {
            this.projectRoot = projectRoot;
        }

        public List<String> getDocPatterns() {
            return docPatterns;
        }

        public void setDocPatterns(List<String> docPatterns) {
            this.docPatterns = docPatterns == null ? List.of("**/*.md") : docPatterns;
        }

        public List<String> getCodePatterns() {
            return codePatterns;
        }

        public void setCodePatterns(List<String> codePatterns) {
            this.codePatterns = codePatterns == null ? List.of("**/*.java", "**/*.py", "**/*.ts", "**/*.js") : codePatterns;
        }

        public List<String> getExcludePatterns() {
            return excludePatterns;
        }

        public void setExcludePatterns(List<String> excludePatterns) {
            this.excludePatterns = excludePatterns == null ? List.of("**/node_modules/**", "**/target/**", "**/build/**", "**/dist/**", "**/.git/**") : excludePatterns;
        }

        public int getDocChunkSize() {
            return docChunkSize;
        }

        public void setDocChunkSize(int docChunkSize) {
            this.docChunkSize = docChunkSize;
        }

        public int getDocChunkOverlap() {
            return docChunkOverlap;
        }

        public void setDocChunkOverlap(int docChunkOverlap) {
            this.docChunkOverlap = docChunkOverlap;
        }

        public int getCodeChunkLines() {
            return codeChunkLines;
        }

        public void setCodeChunkLines(int codeChunkLines) {
            this.codeChunkLines = codeChunkLines;
        }

        public int getCodeChunkOverlap() {
            return codeChunkOverlap;
        }

        public void setCodeChunkOverlap(int codeChunkOverlap) {
            this.codeChunkOverlap = codeChunkOverlap;
        }

        public int getCleanupBatchSize() {
            return cleanupBatchSize;
        }

        public void setCleanupBatchSize(int cleanupBatchSize) {
            this.cleanupBatchSize = cleanupBatchSize;
        }

        public List<String> getTargets() {
            return targets;
        }

        public void setTargets(List<String> targets) {
            this.targets = targets == null ? List.of("cloud") : targets;
        }
    }
}

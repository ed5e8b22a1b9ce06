package com.codesniff.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private CorpusConfig corpus = new CorpusConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private LexicalConfig lexical = new LexicalConfig();
    private VectorIndexConfig vectorIndex = new VectorIndexConfig();
    private SearchConfig search = new SearchConfig();
    private ContextConfig context = new ContextConfig();
    private CompletionConfig completion = new CompletionConfig();

    /**
     * Reads a YAML config file; a missing file yields the defaults.
     */
    public static AppConfig load(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    public CorpusConfig getCorpus() {
        return corpus;
    }

    public void setCorpus(CorpusConfig corpus) {
        this.corpus = corpus == null ? new CorpusConfig() : corpus;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public LexicalConfig getLexical() {
        return lexical;
    }

    public void setLexical(LexicalConfig lexical) {
        this.lexical = lexical == null ? new LexicalConfig() : lexical;
    }

    public VectorIndexConfig getVectorIndex() {
        return vectorIndex;
    }

    public void setVectorIndex(VectorIndexConfig vectorIndex) {
        this.vectorIndex = vectorIndex == null ? new VectorIndexConfig() : vectorIndex;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    public ContextConfig getContext() {
        return context;
    }

    public void setContext(ContextConfig context) {
        this.context = context == null ? new ContextConfig() : context;
    }

    public CompletionConfig getCompletion() {
        return completion;
    }

    public void setCompletion(CompletionConfig completion) {
        this.completion = completion == null ? new CompletionConfig() : completion;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CorpusConfig {
        private String dataDir = ".codesniff/corpus";
        private int dimension = 384;

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "local";
        private String url = "";
        private String model = "";
        private String apiKeyEnv = "CODESNIFF_EMBEDDING_API_KEY";
        private int batchSize = 32;
        private int minBatchSize = 4;
        private int maxConcurrentRequests = 2;
        private int timeoutMs = 30000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMinBatchSize() {
            return minBatchSize;
        }

        public void setMinBatchSize(int minBatchSize) {
            this.minBatchSize = minBatchSize;
        }

        public int getMaxConcurrentRequests() {
            return maxConcurrentRequests;
        }

        public void setMaxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LexicalConfig {
        private double k1 = 1.5;
        private double b = 0.75;

        public double getK1() {
            return k1;
        }

        public void setK1(double k1) {
            this.k1 = k1;
        }

        public double getB() {
            return b;
        }

        public void setB(double b) {
            this.b = b;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VectorIndexConfig {
        private boolean approximate = true;
        private int approximateMinSize = 5000;
        private double minCandidateFraction = 0.25;
        private int signatureBits = 12;
        private int persistBatchSize = 256;

        public boolean isApproximate() {
            return approximate;
        }

        public void setApproximate(boolean approximate) {
            this.approximate = approximate;
        }

        public int getApproximateMinSize() {
            return approximateMinSize;
        }

        public void setApproximateMinSize(int approximateMinSize) {
            this.approximateMinSize = approximateMinSize;
        }

        public double getMinCandidateFraction() {
            return minCandidateFraction;
        }

        public void setMinCandidateFraction(double minCandidateFraction) {
            this.minCandidateFraction = minCandidateFraction;
        }

        public int getSignatureBits() {
            return signatureBits;
        }

        public void setSignatureBits(int signatureBits) {
            this.signatureBits = signatureBits;
        }

        public int getPersistBatchSize() {
            return persistBatchSize;
        }

        public void setPersistBatchSize(int persistBatchSize) {
            this.persistBatchSize = persistBatchSize;
        }
    }

    /**
     * {@code alpha} weights semantic similarity against the normalized lexical score:
     * 1.0 ranks purely by embeddings, 0.0 purely by term matches.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private double alpha = 0.7;
        private int defaultLimit = 20;
        private double minScore = 0.3;
        private int oversampleFactor = 3;
        private int minVectorCandidates = 50;

        public double getAlpha() {
            return alpha;
        }

        public void setAlpha(double alpha) {
            this.alpha = alpha;
        }

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public double getMinScore() {
            return minScore;
        }

        public void setMinScore(double minScore) {
            this.minScore = minScore;
        }

        public int getOversampleFactor() {
            return oversampleFactor;
        }

        public void setOversampleFactor(int oversampleFactor) {
            this.oversampleFactor = oversampleFactor;
        }

        public int getMinVectorCandidates() {
            return minVectorCandidates;
        }

        public void setMinVectorCandidates(int minVectorCandidates) {
            this.minVectorCandidates = minVectorCandidates;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContextConfig {
        private int limit = 5;
        private double minScore = 0.2;
        private int maxChars = 6000;

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public double getMinScore() {
            return minScore;
        }

        public void setMinScore(double minScore) {
            this.minScore = minScore;
        }

        public int getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = maxChars;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CompletionConfig {
        private String url = "";
        private String model = "llama-3.3-70b-versatile";
        private String apiKeyEnv = "CODESNIFF_COMPLETION_API_KEY";
        private double temperature = 0.3;
        private int maxTokens = 1024;
        private int timeoutMs = 60000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}

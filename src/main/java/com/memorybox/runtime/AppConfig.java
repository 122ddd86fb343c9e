package com.memorybox.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private LibraryConfig library = new LibraryConfig();
    private RedisConfig redis = new RedisConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private RankerConfig ranker = new RankerConfig();

    public LibraryConfig getLibrary() {
        return library;
    }

    public void setLibrary(LibraryConfig library) {
        this.library = library == null ? new LibraryConfig() : library;
    }

    public RedisConfig getRedis() {
        return redis;
    }

    public void setRedis(RedisConfig redis) {
        this.redis = redis == null ? new RedisConfig() : redis;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public RankerConfig getRanker() {
        return ranker;
    }

    public void setRanker(RankerConfig ranker) {
        this.ranker = ranker == null ? new RankerConfig() : ranker;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LibraryConfig {
        public static final List<String> DEFAULT_EXCLUSIONS = List.of(
                "$RECYCLE.BIN",
                "System Volume Information",
                "Thumbs.db",
                "desktop.ini",
                ".DS_Store",
                ".localized",
                "__pycache__",
                "node_modules");

        private boolean localMode = true;
        private int batchSize = 200;
        private String dataFolder = ".memorybox";
        private List<String> exclusions = new ArrayList<>(DEFAULT_EXCLUSIONS);

        public boolean isLocalMode() {
            return localMode;
        }

        public void setLocalMode(boolean localMode) {
            this.localMode = localMode;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public String getDataFolder() {
            return dataFolder;
        }

        public void setDataFolder(String dataFolder) {
            this.dataFolder = dataFolder;
        }

        public List<String> getExclusions() {
            return exclusions;
        }

        public void setExclusions(List<String> exclusions) {
            this.exclusions = exclusions == null ? new ArrayList<>(DEFAULT_EXCLUSIONS) : exclusions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RedisConfig {
        private String host = "localhost";
        private int port = 6379;
        private String keyPrefix = "memorybox";

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int retrievalMultiplier = 20;
        private int clusters = 50;
        private int probes = 4;
        private int kmeansIterations = 20;
        private long seed = 42L;

        public int getRetrievalMultiplier() {
            return retrievalMultiplier;
        }

        public void setRetrievalMultiplier(int retrievalMultiplier) {
            this.retrievalMultiplier = retrievalMultiplier;
        }

        public int getClusters() {
            return clusters;
        }

        public void setClusters(int clusters) {
            this.clusters = clusters;
        }

        public int getProbes() {
            return probes;
        }

        public void setProbes(int probes) {
            this.probes = probes;
        }

        public int getKmeansIterations() {
            return kmeansIterations;
        }

        public void setKmeansIterations(int kmeansIterations) {
            this.kmeansIterations = kmeansIterations;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String endpoint;
        private String apiKey;
        private int dimension = 384;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
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
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RankerConfig {
        private String endpoint;
        private String apiKey;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }
}

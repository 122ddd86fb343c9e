package com.memorybox.embed;

import com.memorybox.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class ModelAdapters {
    private ModelAdapters() {
    }

    public static Embedder<String> textEmbedder(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        Embedder<String> local = new HashingTextEmbedder(config.getDimension());
        String endpoint = config.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            return local;
        }
        return new RemoteTextEmbedder(httpClient, endpoint, config.getApiKey(), local);
    }

    public static Ranker ranker(AppConfig.RankerConfig config, OkHttpClient httpClient) {
        Ranker local = new LexicalOverlapRanker();
        String endpoint = config.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            return local;
        }
        return new RemoteRanker(httpClient, endpoint, config.getApiKey(), local);
    }
}

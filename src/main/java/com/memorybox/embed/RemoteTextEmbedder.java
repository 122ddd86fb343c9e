package com.memorybox.embed;

import java.io.IOException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Calls an embedding endpoint that accepts {@code {"input": text}} and answers
 * {@code {"embedding": [..]}}. Falls back to a local embedder when the endpoint is unreachable
 * or answers with something unexpected.
 */
public class RemoteTextEmbedder implements Embedder<String> {
    private static final Logger log = LoggerFactory.getLogger(RemoteTextEmbedder.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;
    private final Embedder<String> fallback;

    public RemoteTextEmbedder(OkHttpClient httpClient, String endpoint, String apiKey, Embedder<String> fallback) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.fallback = fallback;
    }

    @Override
    public float[] embed(String text) {
        try {
            String payload = mapper.writeValueAsString(Map.of("input", text == null ? "" : text));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    log.warn("Embedding endpoint {} answered HTTP {}, using local fallback", endpoint, response.code());
                    return fallback.embed(text);
                }
                JsonNode vectorNode = mapper.readTree(response.body().string()).path("embedding");
                if (!vectorNode.isArray()) {
                    log.warn("Embedding endpoint {} returned no embedding array, using local fallback", endpoint);
                    return fallback.embed(text);
                }
                float[] out = new float[vectorNode.size()];
                for (int i = 0; i < vectorNode.size(); i++) {
                    out[i] = (float) vectorNode.get(i).asDouble();
                }
                return out;
            }
        } catch (IOException e) {
            log.warn("Embedding endpoint {} unreachable, using local fallback", endpoint, e);
            return fallback.embed(text);
        }
    }
}

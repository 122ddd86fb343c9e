package com.memorybox.embed;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
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
 * Cross-encoder style ranker behind an HTTP endpoint. One request scores every candidate:
 * {@code {"query": q, "candidates": [..]}} answered by {@code {"scores": [..]}}.
 */
public class RemoteRanker implements Ranker {
    private static final Logger log = LoggerFactory.getLogger(RemoteRanker.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;
    private final Ranker fallback;

    public RemoteRanker(OkHttpClient httpClient, String endpoint, String apiKey, Ranker fallback) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.fallback = fallback;
    }

    @Override
    public float score(String query, String candidate) {
        return scoreAll(query, List.of(candidate)).get(0);
    }

    @Override
    public List<Float> scoreAll(String query, List<String> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        try {
            String payload = mapper.writeValueAsString(Map.of("query", query, "candidates", candidates));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    log.warn("Ranker endpoint {} answered HTTP {}, using local fallback", endpoint, response.code());
                    return fallback.scoreAll(query, candidates);
                }
                JsonNode scoresNode = mapper.readTree(response.body().string()).path("scores");
                if (!scoresNode.isArray() || scoresNode.size() != candidates.size()) {
                    log.warn("Ranker endpoint {} returned {} scores for {} candidates, using local fallback",
                            endpoint, scoresNode.size(), candidates.size());
                    return fallback.scoreAll(query, candidates);
                }
                List<Float> scores = new ArrayList<>(scoresNode.size());
                for (JsonNode score : scoresNode) {
                    scores.add((float) score.asDouble());
                }
                return scores;
            }
        } catch (IOException e) {
            log.warn("Ranker endpoint {} unreachable, using local fallback", endpoint, e);
            return fallback.scoreAll(query, candidates);
        }
    }
}

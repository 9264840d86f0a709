package com.hybridrag.embedding;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Posts {@code {"query", "documents", "model"}} to a rerank endpoint and reads
 * {@code {"scores": [...]}} aligned with the documents.
 */
public class RemoteCrossEncoder implements CrossEncoder {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;
    private final String apiKey;

    public RemoteCrossEncoder(OkHttpClient httpClient, String endpoint, String model, String apiKey) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public float[] score(String query, List<String> candidates) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("query", query);
            body.put("documents", candidates);
            if (model != null && !model.isBlank()) {
                body.put("model", model);
            }
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(body), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    throw new CapabilityUnavailableException(
                            "Rerank endpoint " + endpoint + " returned HTTP " + response.code());
                }
                JsonNode scores = mapper.readTree(response.body().string()).path("scores");
                if (!scores.isArray() || scores.size() != candidates.size()) {
                    throw new CapabilityUnavailableException("Rerank endpoint returned "
                            + scores.size() + " scores for " + candidates.size() + " candidates");
                }
                float[] out = new float[scores.size()];
                for (int i = 0; i < scores.size(); i++) {
                    out[i] = (float) scores.get(i).asDouble();
                }
                return out;
            }
        } catch (IOException e) {
            throw new CapabilityUnavailableException("Rerank endpoint " + endpoint + " unreachable", e);
        }
    }
}

package com.hybridrag.embedding;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Calls an HTTP embedding endpoint. Accepts either {@code {"embedding": [...]}} or the
 * OpenAI-style {@code {"data": [{"embedding": [...]}]}} response shape.
 */
public class RemoteTextEncoder implements TextEncoder {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public RemoteTextEncoder(OkHttpClient httpClient, String endpoint, String model, String apiKey, int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] encode(String text) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("input", text);
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
                            "Embedding endpoint " + endpoint + " returned HTTP " + response.code());
                }
                JsonNode root = mapper.readTree(response.body().string());
                JsonNode vectorNode = root.path("embedding");
                if (!vectorNode.isArray()) {
                    vectorNode = root.path("data").path(0).path("embedding");
                }
                if (!vectorNode.isArray()) {
                    throw new CapabilityUnavailableException("Embedding endpoint response has no embedding array");
                }
                float[] out = new float[vectorNode.size()];
                for (int i = 0; i < vectorNode.size(); i++) {
                    out[i] = (float) vectorNode.get(i).asDouble();
                }
                return out;
            }
        } catch (IOException e) {
            throw new CapabilityUnavailableException("Embedding endpoint " + endpoint + " unreachable", e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "remote-" + (model == null ? "default" : model);
    }
}

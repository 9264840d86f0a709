package com.hybridrag.store;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hybridrag.error.BackendUnavailableException;
import com.hybridrag.error.ErrorCode;
import com.hybridrag.error.RagException;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Qdrant collection reached over its REST API.
 */
public class QdrantRestBackend implements PointStoreBackend {
    private static final Logger log = LoggerFactory.getLogger(QdrantRestBackend.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final String collection;
    private final String apiKey;

    public QdrantRestBackend(OkHttpClient httpClient, String url, String collection, String apiKey) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Qdrant url: " + url);
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.baseUrl = parsed;
        this.collection = collection;
        this.apiKey = apiKey;
    }

    @Override
    public String name() {
        return collection;
    }

    @Override
    public void ensureCollection(int dimension) {
        JsonNode existing = call("GET", url(), null, true);
        if (existing == null) {
            Map<String, Object> body = Map.of("vectors", Map.of("size", dimension, "distance", "Cosine"));
            call("PUT", url(), body, false);
            log.info("Created collection {} with dimension {}", collection, dimension);
        }
        for (String field : PayloadFields.INDEXED_FIELDS) {
            try {
                call("PUT", url("index").newBuilder().addQueryParameter("wait", "true").build(),
                        Map.of("field_name", field, "field_schema", "keyword"), false);
            } catch (RagException e) {
                log.warn("Could not create payload index on {}.{}: {}", collection, field, e.getMessage());
            }
        }
    }

    @Override
    public void upsert(List<Point> points) {
        if (points.isEmpty()) {
            return;
        }
        List<Map<String, Object>> body = new ArrayList<>();
        for (Point point : points) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", point.id());
            entry.put("vector", point.vector());
            entry.put("payload", point.payload());
            body.add(entry);
        }
        call("PUT", waitUrl("points"), Map.of("points", body), false);
    }

    @Override
    public List<Point> retrieve(List<Long> ids, boolean withVectors) {
        if (ids.isEmpty()) {
            return List.of();
        }
        Map<String, Object> body = Map.of("ids", ids, "with_payload", true, "with_vector", withVectors);
        JsonNode result = call("POST", url("points"), body, false).path("result");
        List<Point> out = new ArrayList<>();
        for (JsonNode node : result) {
            out.add(toPoint(node));
        }
        return out;
    }

    @Override
    public List<ScoredPoint> nearest(float[] vector, int limit, PointFilter filter) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", vector);
        body.put("limit", limit);
        body.put("with_payload", true);
        if (filter != null && !filter.isEmpty()) {
            body.put("filter", filter.toMap());
        }
        JsonNode result = call("POST", url("points", "query"), body, false).path("result").path("points");
        List<ScoredPoint> out = new ArrayList<>();
        for (JsonNode node : result) {
            out.add(new ScoredPoint(toPoint(node), (float) node.path("score").asDouble()));
        }
        return out;
    }

    @Override
    public ScanPage scan(PointFilter filter, int limit, Long offset) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("limit", limit);
        body.put("with_payload", true);
        body.put("with_vector", false);
        if (offset != null) {
            body.put("offset", offset);
        }
        if (filter != null && !filter.isEmpty()) {
            body.put("filter", filter.toMap());
        }
        JsonNode result = call("POST", url("points", "scroll"), body, false).path("result");
        List<Point> points = new ArrayList<>();
        for (JsonNode node : result.path("points")) {
            points.add(toPoint(node));
        }
        JsonNode next = result.path("next_page_offset");
        return new ScanPage(points, next.isIntegralNumber() ? next.asLong() : null);
    }

    @Override
    public void setPayload(List<Long> ids, Map<String, Object> payload) {
        if (ids.isEmpty()) {
            return;
        }
        call("POST", waitUrl("points", "payload"), Map.of("payload", payload, "points", ids), false);
    }

    @Override
    public void delete(List<Long> ids) {
        if (ids.isEmpty()) {
            return;
        }
        call("POST", waitUrl("points", "delete"), Map.of("points", ids), false);
    }

    @Override
    public long count() {
        JsonNode root = call("POST", url("points", "count"), Map.of("exact", true), false);
        return root.path("result").path("count").asLong();
    }

    private Point toPoint(JsonNode node) {
        long id = node.path("id").asLong();
        Map<String, Object> payload = node.hasNonNull("payload")
                ? mapper.convertValue(node.get("payload"), PAYLOAD_TYPE)
                : new LinkedHashMap<>();
        float[] vector = null;
        JsonNode vectorNode = node.path("vector");
        if (vectorNode.isArray()) {
            vector = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                vector[i] = (float) vectorNode.get(i).asDouble();
            }
        }
        return new Point(id, vector, payload);
    }

    private JsonNode call(String method, HttpUrl target, Object body, boolean allowNotFound) {
        try {
            RequestBody requestBody = body == null ? null : RequestBody.create(mapper.writeValueAsString(body), JSON);
            Request.Builder requestBuilder = new Request.Builder().url(target).method(method, requestBody);
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("api-key", apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                String text = response.body() == null ? "" : response.body().string();
                if (response.code() == 404 && allowNotFound) {
                    return null;
                }
                if (!response.isSuccessful()) {
                    throw translate(response.code(), text);
                }
                return text.isBlank() ? mapper.createObjectNode() : mapper.readTree(text);
            }
        } catch (IOException e) {
            throw new BackendUnavailableException("Qdrant " + baseUrl + " unreachable", Map.of("collection", collection), e);
        }
    }

    private RagException translate(int status, String body) {
        String message = body;
        try {
            JsonNode error = mapper.readTree(body).path("status").path("error");
            if (error.isTextual()) {
                message = error.asText();
            }
        } catch (IOException e) {
            log.debug("Non-JSON error body from Qdrant: {}", body);
        }
        if (status == 400 && message.contains("Index required")) {
            return new UnsupportedFilterException(message);
        }
        if (status == 404) {
            return new RagException(ErrorCode.COLLECTION_ERROR, "Collection " + collection + " not found: " + message);
        }
        if (status >= 500) {
            return new BackendUnavailableException("Qdrant returned HTTP " + status + ": " + message);
        }
        return new RagException(ErrorCode.COLLECTION_ERROR, "Qdrant returned HTTP " + status + ": " + message);
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder().addPathSegment("collections").addPathSegment(collection);
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private HttpUrl waitUrl(String... segments) {
        return url(segments).newBuilder().addQueryParameter("wait", "true").build();
    }
}

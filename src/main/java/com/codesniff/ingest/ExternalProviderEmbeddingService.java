package com.codesniff.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.codesniff.error.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * HTTP embedding provider. Sends {@code {"model": ..., "input": [...]}} and accepts either
 * {@code {"embeddings": [[...]]}}, the OpenAI style {@code {"data": [{"embedding": [...]}]}} or a
 * single {@code {"embedding": [...]}}.
 */
public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String model,
            String apiKey,
            int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        JsonNode root = post(texts);
        List<JsonNode> vectorNodes = vectorNodes(root);
        if (vectorNodes.size() != texts.size()) {
            throw new ProviderException("Embedding provider returned " + vectorNodes.size()
                    + " vectors for " + texts.size() + " inputs");
        }
        List<float[]> vectors = new ArrayList<>(vectorNodes.size());
        for (JsonNode vectorNode : vectorNodes) {
            if (vectorNode.size() != dimension) {
                throw new ProviderException("Embedding provider returned dimension " + vectorNode.size()
                        + ", expected " + dimension);
            }
            float[] out = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                JsonNode value = vectorNode.get(i);
                if (!value.isNumber()) {
                    throw new ProviderException("Embedding provider returned a non-numeric component");
                }
                out[i] = (float) value.asDouble();
            }
            vectors.add(out);
        }
        return vectors;
    }

    private JsonNode post(List<String> texts) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            if (model != null && !model.isBlank()) {
                body.put("model", model);
            }
            body.put("input", texts);
            String payload = mapper.writeValueAsString(body);
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    throw new ProviderException("Embedding provider answered HTTP " + response.code());
                }
                return mapper.readTree(response.body().string());
            }
        } catch (IOException e) {
            throw new ProviderException("Embedding provider unreachable at " + endpoint, e);
        }
    }

    private static List<JsonNode> vectorNodes(JsonNode root) {
        List<JsonNode> nodes = new ArrayList<>();
        if (root.path("embeddings").isArray()) {
            root.path("embeddings").forEach(nodes::add);
        } else if (root.path("data").isArray()) {
            for (JsonNode item : root.path("data")) {
                nodes.add(item.path("embedding"));
            }
        } else if (root.path("embedding").isArray()) {
            nodes.add(root.path("embedding"));
        } else {
            throw new ProviderException("Embedding provider response carries no embeddings");
        }
        for (JsonNode node : nodes) {
            if (!node.isArray()) {
                throw new ProviderException("Embedding provider returned a malformed vector");
            }
        }
        return nodes;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "external-" + (model == null || model.isBlank() ? "default" : model) + "-v1";
    }
}

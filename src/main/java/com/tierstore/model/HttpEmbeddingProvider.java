package com.tierstore.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Embeddings endpoint in the common {@code {"model", "input": [...]}} shape. Images are sent as
 * data URLs; sparse endpoints answer with {@code sparse_embedding} term maps.
 */
public class HttpEmbeddingProvider implements EmbeddingProvider {
    private final HttpModelClient client;
    private final String model;
    private final EmbeddingKind kind;

    public HttpEmbeddingProvider(HttpModelClient client, String model, EmbeddingKind kind) {
        this.client = client;
        this.model = model;
        this.kind = kind;
    }

    @Override
    public String modelId() {
        return model;
    }

    @Override
    public EmbeddingKind kind() {
        return kind;
    }

    @Override
    public List<EmbeddingVector> embed(List<ModelInput> inputs) throws ProviderException {
        List<String> encoded = new ArrayList<>(inputs.size());
        for (ModelInput input : inputs) {
            encoded.add(input.isImage() ? input.dataUrl() : input.text());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("input", encoded);
        if (kind == EmbeddingKind.SPARSE) {
            body.put("encoding_format", "sparse");
        }
        JsonNode data = client.post(body).path("data");
        if (!data.isArray()) {
            throw new ProviderException(client.endpoint() + " response has no data array", false);
        }
        List<JsonNode> items = new ArrayList<>();
        data.forEach(items::add);
        items.sort(Comparator.comparingInt(item -> item.path("index").asInt()));

        List<EmbeddingVector> vectors = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            vectors.add(kind == EmbeddingKind.DENSE ? dense(item) : sparse(item));
        }
        return vectors;
    }

    private EmbeddingVector dense(JsonNode item) throws ProviderException {
        JsonNode values = item.path("embedding");
        if (!values.isArray()) {
            throw new ProviderException(client.endpoint() + " returned an item without embedding", false);
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < values.size(); i++) {
            vector[i] = (float) values.get(i).asDouble();
        }
        return EmbeddingVector.dense(vector, model);
    }

    private EmbeddingVector sparse(JsonNode item) throws ProviderException {
        JsonNode values = item.path("sparse_embedding");
        if (!values.isObject()) {
            throw new ProviderException(client.endpoint() + " returned an item without sparse_embedding", false);
        }
        Map<String, Float> weights = new LinkedHashMap<>();
        values.fields().forEachRemaining(entry -> weights.put(entry.getKey(), (float) entry.getValue().asDouble()));
        return EmbeddingVector.sparse(weights, model);
    }
}

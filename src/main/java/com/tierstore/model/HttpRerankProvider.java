package com.tierstore.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

public class HttpRerankProvider implements RerankProvider {
    private final HttpModelClient client;
    private final String model;

    public HttpRerankProvider(HttpModelClient client, String model) {
        this.client = client;
        this.model = model;
    }

    @Override
    public String modelId() {
        return model;
    }

    @Override
    public List<RerankScore> rerank(String query, List<String> documents) throws ProviderException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("query", query);
        body.put("documents", documents);
        JsonNode results = client.post(body).path("results");
        if (!results.isArray()) {
            throw new ProviderException(client.endpoint() + " response has no results array", false);
        }
        List<RerankScore> scores = new ArrayList<>(results.size());
        for (JsonNode result : results) {
            scores.add(new RerankScore(result.path("index").asInt(), (float) result.path("relevance_score").asDouble()));
        }
        return scores;
    }
}

package com.tierstore.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Chat-completions VLM asked to answer with a JSON object holding {@code abstract} and
 * {@code overview}.
 */
public class HttpSummarizationProvider implements SummarizationProvider {
    private static final String INSTRUCTIONS = "Summarize the content. Reply with a JSON object with two string fields: "
            + "\"abstract\" (at most %d tokens, one or two sentences) and \"overview\" (at most %d tokens, "
            + "structured with short headings so a reader can navigate the content).";

    private final HttpModelClient client;
    private final String model;

    public HttpSummarizationProvider(HttpModelClient client, String model) {
        this.client = client;
        this.model = model;
    }

    @Override
    public String modelId() {
        return model;
    }

    @Override
    public Summary summarize(SummaryRequest request) throws ProviderException {
        List<Map<String, Object>> content = new ArrayList<>();
        String text = request.title() == null ? request.text() : "Title: " + request.title() + "\n\n" + request.text();
        content.add(Map.of("type", "text", "text", text == null ? "" : text));
        if (request.hasImage()) {
            content.add(Map.of("type", "image_url",
                    "image_url", Map.of("url", ModelInput.image(request.image(), request.mimeType()).dataUrl())));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
                Map.of("role", "system", "content",
                        INSTRUCTIONS.formatted(request.maxAbstractTokens(), request.maxOverviewTokens())),
                Map.of("role", "user", "content", content)));
        body.put("response_format", Map.of("type", "json_object"));

        JsonNode root = client.post(body);
        String answer = root.path("choices").path(0).path("message").path("content").asText("");
        if (answer.isBlank()) {
            throw new ProviderException(client.endpoint() + " returned an empty completion", true);
        }
        try {
            JsonNode parsed = client.mapper().readTree(answer);
            String abstractText = parsed.path("abstract").asText("");
            String overview = parsed.path("overview").asText("");
            if (abstractText.isBlank()) {
                throw new ProviderException(client.endpoint() + " completion has no abstract", false);
            }
            return new Summary(abstractText.strip(), overview.strip(), model);
        } catch (JsonProcessingException e) {
            throw new ProviderException(client.endpoint() + " completion is not JSON", false, e);
        }
    }
}

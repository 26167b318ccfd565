package com.tierstore.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Offline reranker scoring the share of query terms a document contains.
 */
public class LexicalRerankProvider implements RerankProvider {

    @Override
    public String modelId() {
        return "lexical-overlap-v1";
    }

    @Override
    public List<RerankScore> rerank(String query, List<String> documents) {
        Set<String> queryTerms = terms(query);
        List<RerankScore> scores = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            scores.add(new RerankScore(i, lexicalScore(queryTerms, documents.get(i))));
        }
        return scores;
    }

    private float lexicalScore(Set<String> queryTerms, String text) {
        if (queryTerms.isEmpty() || text == null || text.isBlank()) {
            return 0f;
        }
        Set<String> words = terms(text);
        long matches = queryTerms.stream().filter(words::contains).count();
        return (float) matches / queryTerms.size();
    }

    private static Set<String> terms(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(token -> !token.isBlank())
                .collect(Collectors.toSet());
    }
}

package com.tierstore.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Offline sparse embeddings: log-scaled term frequencies, L2-normalised, common stop words
 * removed.
 */
public class TermWeightSparseProvider implements EmbeddingProvider {
    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "in", "is", "it", "of", "on", "or",
            "that", "the", "this", "to", "was", "were", "with");

    @Override
    public String modelId() {
        return "term-weight-v1";
    }

    @Override
    public EmbeddingKind kind() {
        return EmbeddingKind.SPARSE;
    }

    @Override
    public List<EmbeddingVector> embed(List<ModelInput> inputs) {
        List<EmbeddingVector> vectors = new ArrayList<>(inputs.size());
        for (ModelInput input : inputs) {
            vectors.add(EmbeddingVector.sparse(input.isImage() ? Map.of() : weights(input.text()), modelId()));
        }
        return vectors;
    }

    Map<String, Float> weights(String text) {
        if (text == null || text.isBlank()) {
            return Map.of();
        }
        Map<String, Integer> frequencies = new TreeMap<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.length() < 2 || STOP_WORDS.contains(token)) {
                continue;
            }
            frequencies.merge(token, 1, Integer::sum);
        }
        double norm = 0d;
        Map<String, Float> weights = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
            float weight = (float) (1d + Math.log(entry.getValue()));
            weights.put(entry.getKey(), weight);
            norm += weight * weight;
        }
        if (norm > 0d) {
            float scale = (float) (1d / Math.sqrt(norm));
            weights.replaceAll((term, weight) -> weight * scale);
        }
        return weights;
    }
}

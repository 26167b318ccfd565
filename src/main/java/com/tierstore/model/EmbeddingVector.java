package com.tierstore.model;

import java.util.Map;

/**
 * Output of one embedding call: a dense vector or sparse term weights, tagged with the model that
 * produced it.
 */
public record EmbeddingVector(float[] dense, Map<String, Float> sparse, String model) {

    public EmbeddingVector {
        sparse = sparse == null ? Map.of() : Map.copyOf(sparse);
    }

    public static EmbeddingVector dense(float[] values, String model) {
        return new EmbeddingVector(values, null, model);
    }

    public static EmbeddingVector sparse(Map<String, Float> weights, String model) {
        return new EmbeddingVector(null, weights, model);
    }

    public EmbeddingKind kind() {
        return dense != null ? EmbeddingKind.DENSE : EmbeddingKind.SPARSE;
    }

    public int dimension() {
        return dense == null ? 0 : dense.length;
    }
}

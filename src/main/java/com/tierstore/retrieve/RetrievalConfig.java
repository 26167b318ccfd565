package com.tierstore.retrieve;

/**
 * @param sparseWeight        weight of the sparse signal; {@code 0} disables sparse retrieval
 * @param candidateMultiplier per-kind candidate window is {@code topK * candidateMultiplier}
 * @param rerankWindow        number of fused candidates handed to the reranker
 */
public record RetrievalConfig(float sparseWeight, int candidateMultiplier, int rerankWindow, FusionStrategy fusion) {

    public RetrievalConfig {
        if (sparseWeight < 0f) {
            throw new IllegalArgumentException("sparseWeight must not be negative: " + sparseWeight);
        }
        if (candidateMultiplier < 1) {
            throw new IllegalArgumentException("candidateMultiplier must be at least 1: " + candidateMultiplier);
        }
        if (rerankWindow < 1) {
            throw new IllegalArgumentException("rerankWindow must be at least 1: " + rerankWindow);
        }
        fusion = fusion == null ? new LinearFusion() : fusion;
    }

    public static RetrievalConfig defaults() {
        return new RetrievalConfig(0f, 3, 20, new LinearFusion());
    }

    public RetrievalConfig withSparseWeight(float weight) {
        return new RetrievalConfig(weight, candidateMultiplier, rerankWindow, fusion);
    }

    public RetrievalConfig withFusion(FusionStrategy strategy) {
        return new RetrievalConfig(sparseWeight, candidateMultiplier, rerankWindow, strategy);
    }

    public RetrievalConfig withRerankWindow(int window) {
        return new RetrievalConfig(sparseWeight, candidateMultiplier, window, fusion);
    }
}

package com.tierstore.context;

/**
 * @param maxContextTokens content above this size is summarized chunk by chunk
 * @param chunkTokens      token budget of one chunk
 * @param overlapLines     lines repeated between neighbouring chunks
 * @param abstractTokens   L0 cap
 * @param overviewTokens   L1 cap
 */
public record ContextBuilderConfig(
        int maxContextTokens,
        int chunkTokens,
        int overlapLines,
        int abstractTokens,
        int overviewTokens) {

    public static ContextBuilderConfig defaults() {
        return new ContextBuilderConfig(6000, 1500, 2, 100, 2000);
    }
}

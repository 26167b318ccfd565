package com.tierstore.model;

import java.time.Duration;

/**
 * Immutable gateway settings. A {@code null} acquire timeout means callers wait for capacity
 * indefinitely.
 */
public record ModelGatewayConfig(
        int embeddingConcurrency,
        int vlmConcurrency,
        int rerankConcurrency,
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        Duration acquireTimeout,
        int denseDimension) {

    public static final int DEFAULT_EMBEDDING_CONCURRENCY = 10;
    public static final int DEFAULT_VLM_CONCURRENCY = 100;
    public static final int DEFAULT_RERANK_CONCURRENCY = 10;

    public ModelGatewayConfig {
        requirePositive(embeddingConcurrency, "embeddingConcurrency");
        requirePositive(vlmConcurrency, "vlmConcurrency");
        requirePositive(rerankConcurrency, "rerankConcurrency");
        requirePositive(maxAttempts, "maxAttempts");
        requirePositive(denseDimension, "denseDimension");
        initialBackoff = initialBackoff == null ? Duration.ZERO : initialBackoff;
        maxBackoff = maxBackoff == null ? initialBackoff : maxBackoff;
    }

    public static ModelGatewayConfig defaults(int denseDimension) {
        return new ModelGatewayConfig(
                DEFAULT_EMBEDDING_CONCURRENCY,
                DEFAULT_VLM_CONCURRENCY,
                DEFAULT_RERANK_CONCURRENCY,
                3,
                Duration.ofMillis(200),
                Duration.ofSeconds(2),
                null,
                denseDimension);
    }

    public ModelGatewayConfig withConcurrency(int embedding, int vlm, int rerank) {
        return new ModelGatewayConfig(embedding, vlm, rerank, maxAttempts, initialBackoff, maxBackoff,
                acquireTimeout, denseDimension);
    }

    public ModelGatewayConfig withRetry(int attempts, Duration initial, Duration max) {
        return new ModelGatewayConfig(embeddingConcurrency, vlmConcurrency, rerankConcurrency, attempts, initial, max,
                acquireTimeout, denseDimension);
    }

    public ModelGatewayConfig withAcquireTimeout(Duration timeout) {
        return new ModelGatewayConfig(embeddingConcurrency, vlmConcurrency, rerankConcurrency, maxAttempts,
                initialBackoff, maxBackoff, timeout, denseDimension);
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}

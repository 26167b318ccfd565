package com.tierstore.model;

/**
 * Failure reported by a model provider. Transient failures (timeouts, throttling, server errors,
 * I/O) are retried by the gateway.
 */
public class ProviderException extends Exception {
    private final boolean transientFailure;

    public ProviderException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public ProviderException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}

package com.tierstore.error;

import java.util.Map;

/** Failure reported by a vector-store backend. Transient failures are eligible for retry. */
public class BackendException extends TierStoreException {
    private final boolean transientFailure;

    public BackendException(String message, boolean transientFailure) {
        super(ErrorCode.BACKEND_ERROR, message, Map.of("transient", transientFailure));
        this.transientFailure = transientFailure;
    }

    public BackendException(String message, boolean transientFailure, Throwable cause) {
        super(ErrorCode.BACKEND_ERROR, message, Map.of("transient", transientFailure), cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}

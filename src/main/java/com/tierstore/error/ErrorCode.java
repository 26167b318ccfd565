package com.tierstore.error;

public enum ErrorCode {
    CONFIG_ERROR,
    MODEL_UNAVAILABLE,
    DIMENSION_MISMATCH,
    UNSUPPORTED_FILTER,
    UNSUPPORTED_BACKEND,
    PARTIAL_BATCH_FAILURE,
    TIMEOUT,
    COLLECTION_NOT_FOUND,
    NOT_FOUND,
    BACKEND_ERROR,
    INVALID_ARGUMENT
}

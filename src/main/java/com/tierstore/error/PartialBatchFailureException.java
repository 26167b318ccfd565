package com.tierstore.error;

import java.util.Map;

import com.tierstore.store.BatchResult;

public class PartialBatchFailureException extends TierStoreException {
    private final BatchResult result;

    public PartialBatchFailureException(String operation, BatchResult result) {
        super(ErrorCode.PARTIAL_BATCH_FAILURE,
                operation + " failed for " + result.failures().size() + " of " + result.attempted() + " record(s)",
                Map.of("operation", operation, "failedIds", result.failures().keySet()));
        this.result = result;
    }

    public BatchResult result() {
        return result;
    }
}

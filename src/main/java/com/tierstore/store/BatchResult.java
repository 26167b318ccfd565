package com.tierstore.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tierstore.error.PartialBatchFailureException;

/**
 * Per-id outcome of a best-effort batch write. Ids that succeeded stay written even when others
 * failed.
 */
public record BatchResult(List<String> succeeded, Map<String, String> failures) {

    public BatchResult {
        succeeded = List.copyOf(succeeded);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public static BatchResult empty() {
        return new BatchResult(List.of(), Map.of());
    }

    public static BatchResult allSucceeded(List<String> ids) {
        return new BatchResult(ids, Map.of());
    }

    public int attempted() {
        return succeeded.size() + failures.size();
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    public BatchResult merge(BatchResult other) {
        List<String> ids = new ArrayList<>(succeeded);
        ids.addAll(other.succeeded);
        Map<String, String> failed = new LinkedHashMap<>(failures);
        failed.putAll(other.failures);
        return new BatchResult(ids, failed);
    }

    public BatchResult throwIfFailed(String operation) {
        if (!failures.isEmpty()) {
            throw new PartialBatchFailureException(operation, this);
        }
        return this;
    }
}

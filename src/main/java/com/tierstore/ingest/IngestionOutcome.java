package com.tierstore.ingest;

import com.tierstore.context.ResourceId;
import com.tierstore.context.ResourceInput;

/**
 * Per-resource result of a batch ingestion: either the stored id or the failure.
 */
public record IngestionOutcome(ResourceInput input, ResourceId id, RuntimeException error) {

    public static IngestionOutcome success(ResourceInput input, ResourceId id) {
        return new IngestionOutcome(input, id, null);
    }

    public static IngestionOutcome failure(ResourceInput input, RuntimeException error) {
        return new IngestionOutcome(input, null, error);
    }

    public boolean succeeded() {
        return error == null;
    }

    @Override
    public String toString() {
        return "IngestionOutcome{uri=" + input.uri()
                + ", id=" + (id == null ? "" : id.value())
                + ", error=" + (error == null ? "" : error.getMessage()) + "}";
    }
}

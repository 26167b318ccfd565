package com.tierstore.context;

import java.util.List;

import com.tierstore.model.ModelInput;

/**
 * Derived layers of one resource. {@code l2Ref} is the payload reference, or empty when L2 is
 * kept inline in the chunk records; {@code image} is set for image resources only.
 */
public record ContextLayers(
        String l0,
        String l1,
        String l2Ref,
        List<ContentChunk> chunks,
        ModelInput image,
        String model,
        boolean chunkedSummaries) {

    public ContextLayers {
        chunks = List.copyOf(chunks);
        l2Ref = l2Ref == null ? "" : l2Ref;
    }
}

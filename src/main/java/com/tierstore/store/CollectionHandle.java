package com.tierstore.store;

import java.time.Instant;

/**
 * Transient reference to a bound backend collection.
 *
 * @param created {@code true} when this binding created the collection, {@code false} when an
 *                existing one was loaded
 */
public record CollectionHandle(
        String backend,
        String name,
        CollectionSchema schema,
        IndexMeta indexMeta,
        boolean created,
        Instant boundAt) {
}

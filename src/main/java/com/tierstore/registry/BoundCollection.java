package com.tierstore.registry;

import com.tierstore.store.CollectionAdapter;
import com.tierstore.store.CollectionHandle;

/**
 * A workspace's collection as handed out by the registry.
 */
public record BoundCollection(String workspace, CollectionAdapter adapter, CollectionHandle handle) {

    public String name() {
        return handle.name();
    }
}

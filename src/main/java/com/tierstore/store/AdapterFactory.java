package com.tierstore.store;

@FunctionalInterface
public interface AdapterFactory {
    CollectionAdapter create(BackendConfig config);
}

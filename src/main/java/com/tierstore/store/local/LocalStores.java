package com.tierstore.store.local;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link LocalStore} per root directory and a single in-memory store, so every
 * adapter naming a collection works on the same records.
 */
public final class LocalStores {
    private final LocalStore memory = LocalStore.inMemory();
    private final Map<Path, LocalStore> persistent = new ConcurrentHashMap<>();

    public LocalStore forPath(String path) {
        if (path == null || path.isBlank()) {
            return memory;
        }
        Path root = Path.of(path).resolve("vectordb").toAbsolutePath().normalize();
        return persistent.computeIfAbsent(root, LocalStore::open);
    }
}

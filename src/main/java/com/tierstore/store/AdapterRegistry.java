package com.tierstore.store;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tierstore.error.UnsupportedBackendException;
import com.tierstore.store.http.HttpCollectionAdapter;
import com.tierstore.store.local.LocalCollectionAdapter;
import com.tierstore.store.local.LocalStores;
import com.tierstore.store.managed.ManagedCollectionAdapter;

import okhttp3.OkHttpClient;

/**
 * Backend factories keyed by backend name. Keys are case-insensitive.
 */
public final class AdapterRegistry {
    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    public static final String LOCAL = "local";
    public static final String HTTP = "http";
    public static final String MANAGED = "managed";

    private final Map<String, AdapterFactory> factories = new ConcurrentHashMap<>();

    public static AdapterRegistry withDefaults(OkHttpClient httpClient) {
        AdapterRegistry registry = new AdapterRegistry();
        LocalStores localStores = new LocalStores();
        registry.register(LOCAL, config -> LocalCollectionAdapter.fromConfig(config, localStores));
        registry.register(HTTP, config -> HttpCollectionAdapter.fromConfig(config, httpClient));
        registry.register(MANAGED, config -> ManagedCollectionAdapter.fromConfig(config, httpClient));
        return registry;
    }

    public AdapterRegistry register(String key, AdapterFactory factory) {
        Objects.requireNonNull(factory, "factory");
        AdapterFactory previous = factories.put(normalize(key), factory);
        if (previous != null) {
            log.debug("Replaced adapter factory for backend={}", key);
        }
        return this;
    }

    public CollectionAdapter create(BackendConfig config) {
        AdapterFactory factory = factories.get(normalize(config.backend()));
        if (factory == null) {
            throw new UnsupportedBackendException(config.backend(), backends());
        }
        return factory.create(config);
    }

    public boolean supports(String key) {
        return key != null && factories.containsKey(normalize(key));
    }

    public Set<String> backends() {
        return new TreeSet<>(factories.keySet());
    }

    private static String normalize(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("backend key must not be blank");
        }
        return key.strip().toLowerCase(Locale.ROOT);
    }
}

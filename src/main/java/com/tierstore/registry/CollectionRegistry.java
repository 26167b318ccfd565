package com.tierstore.registry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tierstore.error.BackendException;
import com.tierstore.error.ConfigException;
import com.tierstore.filter.FilterExpression;
import com.tierstore.store.AdapterRegistry;
import com.tierstore.store.BackendConfig;
import com.tierstore.store.CollectionAdapter;
import com.tierstore.store.CollectionHandle;
import com.tierstore.store.CollectionSchema;
import com.tierstore.store.RecordFields;

/**
 * Owns one collection per workspace. Concurrent first access for a workspace shares one in-flight
 * bind; bound entries re-check backend existence after {@code existenceRecheck}.
 */
public class CollectionRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CollectionRegistry.class);

    public static final Duration DEFAULT_EXISTENCE_RECHECK = Duration.ofSeconds(30);

    private final AdapterRegistry adapters;
    private final BackendConfig baseConfig;
    private final Duration existenceRecheck;
    private final Clock clock;
    private final Map<String, CompletableFuture<Entry>> entries = new ConcurrentHashMap<>();

    public CollectionRegistry(AdapterRegistry adapters, BackendConfig baseConfig) {
        this(adapters, baseConfig, DEFAULT_EXISTENCE_RECHECK, Clock.systemUTC());
    }

    public CollectionRegistry(AdapterRegistry adapters, BackendConfig baseConfig, Duration existenceRecheck, Clock clock) {
        if (baseConfig.dimension() <= 0) {
            throw new ConfigException("backend dimension must be positive: " + baseConfig.dimension());
        }
        this.adapters = adapters;
        this.baseConfig = baseConfig;
        this.existenceRecheck = existenceRecheck;
        this.clock = clock;
    }

    public BoundCollection bind(TenantScope scope) {
        String workspace = scope.workspace();
        while (true) {
            CompletableFuture<Entry> candidate = new CompletableFuture<>();
            CompletableFuture<Entry> existing = entries.putIfAbsent(workspace, candidate);
            if (existing == null) {
                return open(workspace, candidate).current();
            }
            Entry entry = await(existing);
            if (entries.get(workspace) != existing) {
                continue;
            }
            return entry.verified();
        }
    }

    public Optional<BoundCollection> bound(TenantScope scope) {
        CompletableFuture<Entry> future = entries.get(scope.workspace());
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join().current());
    }

    /**
     * Administrative removal of a workspace's collection.
     */
    public boolean drop(TenantScope scope) {
        String workspace = scope.workspace();
        CompletableFuture<Entry> future = entries.remove(workspace);
        CollectionAdapter adapter;
        if (future != null && future.isDone() && !future.isCompletedExceptionally()) {
            adapter = future.join().adapter;
        } else {
            adapter = adapters.create(baseConfig.withName(collectionName(workspace)));
        }
        try {
            boolean dropped = adapter.dropCollection();
            log.info("Drop requested workspace={} collection={} dropped={}", workspace, adapter.collectionName(), dropped);
            return dropped;
        } finally {
            adapter.close();
        }
    }

    /**
     * {@code <name>_<workspace>} when the workspace is already a valid name part; otherwise the
     * sanitized form plus a digest of the raw workspace, so distinct workspaces never share a
     * collection.
     */
    public String collectionName(String workspace) {
        String sanitized = workspace.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        if (!sanitized.equals(workspace)) {
            sanitized = sanitized + "_" + digest(workspace);
        }
        return baseConfig.name() + "_" + sanitized;
    }

    public CollectionSchema schemaFor(String workspace) {
        return RecordFields.contextSchema(collectionName(workspace), baseConfig.dimension(), baseConfig.distance(),
                baseConfig.sparseWeight());
    }

    public BackendConfig baseConfig() {
        return baseConfig;
    }

    /**
     * Records visible to {@code scope}: its workspace, and either its own agent or workspace-shared
     * data.
     */
    public static FilterExpression tenantFilter(TenantScope scope) {
        FilterExpression workspace = FilterExpression.eq(RecordFields.WORKSPACE, scope.workspace());
        FilterExpression agent = scope.agent() == null
                ? FilterExpression.eq(RecordFields.AGENT, "")
                : FilterExpression.in(RecordFields.AGENT, scope.agent(), "");
        return FilterExpression.and(workspace, agent);
    }

    @Override
    public void close() {
        List<CompletableFuture<Entry>> open = new ArrayList<>(entries.values());
        entries.clear();
        for (CompletableFuture<Entry> future : open) {
            if (future.isDone() && !future.isCompletedExceptionally()) {
                future.join().adapter.close();
            }
        }
    }

    private Entry open(String workspace, CompletableFuture<Entry> future) {
        CollectionAdapter adapter = null;
        try {
            adapter = adapters.create(baseConfig.withName(collectionName(workspace)));
            CollectionHandle handle = adapter.ensureCollection(schemaFor(workspace));
            Entry entry = new Entry(workspace, adapter, handle, clock.instant());
            future.complete(entry);
            return entry;
        } catch (RuntimeException e) {
            entries.remove(workspace, future);
            if (adapter != null) {
                adapter.close();
            }
            future.completeExceptionally(e);
            throw e;
        }
    }

    private static String digest(String workspace) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha256.digest(workspace.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static Entry await(CompletableFuture<Entry> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("interrupted while waiting for collection binding");
            cancellation.initCause(e);
            throw cancellation;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new BackendException("collection binding failed", false, e.getCause());
        }
    }

    private final class Entry {
        private final String workspace;
        private final CollectionAdapter adapter;
        private final AtomicBoolean rechecking = new AtomicBoolean();
        private volatile CollectionHandle handle;
        private volatile Instant verifiedAt;

        private Entry(String workspace, CollectionAdapter adapter, CollectionHandle handle, Instant verifiedAt) {
            this.workspace = workspace;
            this.adapter = adapter;
            this.handle = handle;
            this.verifiedAt = verifiedAt;
        }

        BoundCollection current() {
            return new BoundCollection(workspace, adapter, handle);
        }

        BoundCollection verified() {
            Instant now = clock.instant();
            if (verifiedAt.plus(existenceRecheck).isAfter(now) || !rechecking.compareAndSet(false, true)) {
                return current();
            }
            try {
                if (!adapter.collectionExists()) {
                    log.warn("Collection vanished, rebinding workspace={} collection={}", workspace, adapter.collectionName());
                    adapter.invalidate();
                    handle = adapter.ensureCollection(schemaFor(workspace));
                }
                verifiedAt = now;
                return current();
            } finally {
                rechecking.set(false);
            }
        }
    }
}

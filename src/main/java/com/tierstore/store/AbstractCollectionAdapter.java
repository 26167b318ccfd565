package com.tierstore.store;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tierstore.error.BackendException;
import com.tierstore.error.CollectionNotFoundException;
import com.tierstore.error.ConfigException;
import com.tierstore.error.DimensionMismatchException;
import com.tierstore.filter.FilterCompiler;
import com.tierstore.filter.FilterExpression;

/**
 * Lifecycle and validation shared by every backend. Subclasses supply the backend calls and may
 * override the index hooks; every filter passes through {@link #compile(FilterExpression)}.
 *
 * @param <F> the backend's compiled filter form
 */
public abstract class AbstractCollectionAdapter<F> implements CollectionAdapter {
    private static final Logger log = LoggerFactory.getLogger(AbstractCollectionAdapter.class);

    public static final String DEFAULT_INDEX_NAME = "default";
    private static final int DEFAULT_WRITE_BATCH_SIZE = 64;

    private final String backend;
    private final String collectionName;
    protected final Clock clock;
    private final AtomicReference<AdapterState> state = new AtomicReference<>(AdapterState.UNBOUND);
    private final AtomicReference<CompletableFuture<CollectionHandle>> inFlightBind = new AtomicReference<>();
    private volatile CollectionHandle handle;

    protected AbstractCollectionAdapter(String backend, String collectionName, Clock clock) {
        if (collectionName == null || collectionName.isBlank()) {
            throw new ConfigException("collection name is required for backend " + backend);
        }
        this.backend = backend;
        this.collectionName = collectionName;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public final String backend() {
        return backend;
    }

    @Override
    public final String collectionName() {
        return collectionName;
    }

    @Override
    public final AdapterState state() {
        return state.get();
    }

    @Override
    public final Optional<CollectionHandle> handle() {
        return Optional.ofNullable(handle);
    }

    @Override
    public final CollectionHandle ensureCollection(CollectionSchema schema) {
        Objects.requireNonNull(schema, "schema");
        if (!schema.name().equals(collectionName)) {
            throw new IllegalArgumentException("schema " + schema.name() + " does not match adapter collection " + collectionName);
        }
        while (true) {
            CollectionHandle bound = handle;
            if (bound != null) {
                requireCompatible(bound, schema);
                return bound;
            }
            if (state.get() == AdapterState.CLOSED) {
                throw new IllegalStateException("adapter for " + collectionName + " is closed");
            }
            CompletableFuture<CollectionHandle> candidate = new CompletableFuture<>();
            if (inFlightBind.compareAndSet(null, candidate)) {
                bind(schema, candidate);
                return await(candidate);
            }
            CompletableFuture<CollectionHandle> winner = inFlightBind.get();
            if (winner != null) {
                CollectionHandle shared = await(winner);
                requireCompatible(shared, schema);
                return shared;
            }
        }
    }

    @Override
    public final boolean collectionExists() {
        return remoteCollectionExists();
    }

    @Override
    public final void invalidate() {
        if (handle != null) {
            log.debug("Invalidating binding backend={} collection={}", backend, collectionName);
        }
        handle = null;
        inFlightBind.set(null);
        state.compareAndSet(AdapterState.BOUND, AdapterState.UNBOUND);
    }

    @Override
    public final void upsert(VectorRecord record) {
        upsert(List.of(record)).throwIfFailed("upsert");
    }

    @Override
    public final BatchResult upsert(List<VectorRecord> records) {
        CollectionHandle bound = requireBound();
        int dimension = bound.schema().denseDimension();
        List<VectorRecord> prepared = new ArrayList<>(records.size());
        for (VectorRecord record : records) {
            VectorRecord withId = record.id() == null || record.id().isBlank()
                    ? record.withId(UUID.randomUUID().toString())
                    : record;
            if (withId.dense() != null && withId.dense().length != dimension) {
                throw new DimensionMismatchException(dimension, withId.dense().length, "record " + withId.id());
            }
            prepared.add(withId);
        }

        BatchResult result = BatchResult.empty();
        int batchSize = Math.max(1, writeBatchSize());
        for (int start = 0; start < prepared.size(); start += batchSize) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Upsert abandoned backend={} collection={} written={} remaining={}",
                        backend, collectionName, result.succeeded().size(), prepared.size() - start);
                throw new CancellationException("upsert cancelled after " + result.attempted() + " of "
                        + prepared.size() + " record(s)");
            }
            int end = Math.min(prepared.size(), start + batchSize);
            result = result.merge(writeRecords(bound, prepared.subList(start, end)));
        }
        if (!result.isComplete()) {
            log.warn("Partial upsert backend={} collection={} failed={} attempted={}",
                    backend, collectionName, result.failures().size(), result.attempted());
        }
        return result;
    }

    @Override
    public final Optional<VectorRecord> get(String id) {
        List<VectorRecord> found = get(List.of(id));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public final List<VectorRecord> get(List<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        CollectionHandle bound = requireBound();
        return fetchRecords(bound, List.copyOf(new LinkedHashSet<>(ids))).stream()
                .map(this::normalizeRecordForRead)
                .toList();
    }

    @Override
    public final void delete(String id) {
        delete(List.of(id)).throwIfFailed("delete");
    }

    @Override
    public final BatchResult delete(List<String> ids) {
        if (ids.isEmpty()) {
            return BatchResult.empty();
        }
        CollectionHandle bound = requireBound();
        BatchResult result = BatchResult.empty();
        int batchSize = Math.max(1, writeBatchSize());
        for (int start = 0; start < ids.size(); start += batchSize) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("delete cancelled after " + result.attempted() + " of "
                        + ids.size() + " id(s)");
            }
            int end = Math.min(ids.size(), start + batchSize);
            result = result.merge(deleteRecords(bound, ids.subList(start, end)));
        }
        return result;
    }

    @Override
    public final BatchResult deleteByFilter(FilterExpression filter) {
        CollectionHandle bound = requireBound();
        F compiled = compile(filter);
        long matching = (long) aggregateRecords(bound, compiled, AggregateSpec.count()).value();
        if (matching == 0) {
            return BatchResult.empty();
        }
        int limit = (int) Math.min(Integer.MAX_VALUE, matching);
        List<String> ids = search(bound, VectorQuery.scan(filter, limit), compiled).stream()
                .map(scored -> scored.record().id())
                .toList();
        return delete(ids);
    }

    @Override
    public final long count(FilterExpression filter) {
        return aggregate(filter, AggregateSpec.count()).count();
    }

    @Override
    public final List<ScoredRecord> query(VectorQuery query) {
        CollectionHandle bound = requireBound();
        if (query.isDense() && query.dense().length != bound.schema().denseDimension()) {
            throw new DimensionMismatchException(bound.schema().denseDimension(), query.dense().length, "query vector");
        }
        F compiled = compile(query.filter());
        return search(bound, query, compiled).stream()
                .map(scored -> new ScoredRecord(normalizeRecordForRead(scored.record()), scored.score()))
                .toList();
    }

    @Override
    public final AggregateResult aggregate(FilterExpression filter, AggregateSpec spec) {
        CollectionHandle bound = requireBound();
        return aggregateRecords(bound, compile(filter), spec);
    }

    @Override
    public final boolean dropCollection() {
        boolean exists = handle != null || remoteCollectionExists();
        if (!exists) {
            return false;
        }
        dropBackendCollection();
        invalidate();
        state.set(AdapterState.UNBOUND);
        log.info("Dropped collection backend={} name={}", backend, collectionName);
        return true;
    }

    @Override
    public final void close() {
        AdapterState previous = state.getAndSet(AdapterState.CLOSED);
        handle = null;
        if (previous != AdapterState.CLOSED) {
            closeBackend();
        }
    }

    private F compile(FilterExpression filter) {
        return filterCompiler().compile(filter);
    }

    private void bind(CollectionSchema schema, CompletableFuture<CollectionHandle> future) {
        try {
            state.set(AdapterState.BINDING);
            Optional<CollectionHandle> existing = loadExistingCollection(schema);
            CollectionHandle result;
            if (existing.isPresent()) {
                result = existing.get();
                requireCompatible(result, schema);
                log.info("Bound existing collection backend={} name={} dimension={}",
                        backend, collectionName, result.schema().denseDimension());
            } else {
                state.set(AdapterState.CREATING);
                List<String> scalarIndexFields = sanitizeScalarIndexFields(schema.scalarIndexFields(), schema);
                IndexMeta indexMeta = buildDefaultIndexMeta(DEFAULT_INDEX_NAME, schema, scalarIndexFields);
                result = createBackendCollection(schema, indexMeta);
                log.info("Created collection backend={} name={} dimension={} index={}",
                        backend, collectionName, schema.denseDimension(), indexMeta.indexType());
            }
            handle = result;
            state.set(AdapterState.BOUND);
            future.complete(result);
        } catch (RuntimeException e) {
            state.compareAndSet(AdapterState.BINDING, AdapterState.UNBOUND);
            state.compareAndSet(AdapterState.CREATING, AdapterState.UNBOUND);
            inFlightBind.set(null);
            log.warn("Binding failed backend={} collection={} reason={}", backend, collectionName, e.getMessage());
            future.completeExceptionally(e);
        }
    }

    private static CollectionHandle await(CompletableFuture<CollectionHandle> future) {
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

    private void requireCompatible(CollectionHandle bound, CollectionSchema requested) {
        int boundDimension = bound.schema().denseDimension();
        if (boundDimension != requested.denseDimension()) {
            throw new DimensionMismatchException(boundDimension, requested.denseDimension(), "collection " + collectionName);
        }
        if (bound.schema().distance() != requested.distance()) {
            throw new ConfigException("collection " + collectionName + " uses distance " + bound.schema().distance()
                    + " but " + requested.distance() + " was requested");
        }
    }

    protected final CollectionHandle requireBound() {
        CollectionHandle bound = handle;
        if (bound == null) {
            throw new CollectionNotFoundException(collectionName);
        }
        return bound;
    }

    protected final CollectionHandle newHandle(CollectionSchema schema, IndexMeta indexMeta, boolean created) {
        return new CollectionHandle(backend, collectionName, schema, indexMeta, created, clock.instant());
    }

    protected int writeBatchSize() {
        return DEFAULT_WRITE_BATCH_SIZE;
    }

    protected List<String> sanitizeScalarIndexFields(List<String> fields, CollectionSchema schema) {
        return fields;
    }

    protected IndexMeta buildDefaultIndexMeta(String indexName, CollectionSchema schema, List<String> scalarIndexFields) {
        boolean hybrid = schema.isHybrid();
        return new IndexMeta(
                indexName,
                hybrid ? "flat_hybrid" : "flat",
                schema.distance(),
                "int8",
                scalarIndexFields,
                hybrid,
                schema.sparseWeight());
    }

    protected VectorRecord normalizeRecordForRead(VectorRecord record) {
        return record;
    }

    protected void closeBackend() {
    }

    protected abstract FilterCompiler<F> filterCompiler();

    protected abstract Optional<CollectionHandle> loadExistingCollection(CollectionSchema requested);

    protected abstract CollectionHandle createBackendCollection(CollectionSchema schema, IndexMeta indexMeta);

    protected abstract boolean remoteCollectionExists();

    protected abstract BatchResult writeRecords(CollectionHandle bound, List<VectorRecord> records);

    protected abstract List<VectorRecord> fetchRecords(CollectionHandle bound, List<String> ids);

    protected abstract BatchResult deleteRecords(CollectionHandle bound, List<String> ids);

    protected abstract List<ScoredRecord> search(CollectionHandle bound, VectorQuery query, F compiledFilter);

    protected abstract AggregateResult aggregateRecords(CollectionHandle bound, F compiledFilter, AggregateSpec spec);

    protected abstract void dropBackendCollection();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "backend=" + backend +
                ", collection=" + collectionName +
                ", state=" + state.get() +
                '}';
    }
}

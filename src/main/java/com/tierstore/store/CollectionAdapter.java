package com.tierstore.store;

import java.util.List;
import java.util.Optional;

import com.tierstore.filter.FilterExpression;

/**
 * Capability set every vector backend implements. One adapter instance is bound to one named
 * collection; concurrent data operations need no external locking.
 */
public interface CollectionAdapter extends AutoCloseable {

    String backend();

    String collectionName();

    AdapterState state();

    Optional<CollectionHandle> handle();

    /**
     * Loads the collection when it already exists, creates it from {@code schema} otherwise.
     * Concurrent first calls share one existence check and at most one create.
     */
    CollectionHandle ensureCollection(CollectionSchema schema);

    /** Probes the backend; never answered from the cached handle. */
    boolean collectionExists();

    /** Forgets the bound handle so the next {@link #ensureCollection} checks the backend again. */
    void invalidate();

    void upsert(VectorRecord record);

    BatchResult upsert(List<VectorRecord> records);

    Optional<VectorRecord> get(String id);

    List<VectorRecord> get(List<String> ids);

    void delete(String id);

    BatchResult delete(List<String> ids);

    BatchResult deleteByFilter(FilterExpression filter);

    long count(FilterExpression filter);

    List<ScoredRecord> query(VectorQuery query);

    AggregateResult aggregate(FilterExpression filter, AggregateSpec spec);

    boolean dropCollection();

    @Override
    void close();
}

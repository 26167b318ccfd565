package com.tierstore.store.local;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import com.tierstore.error.BackendException;
import com.tierstore.error.CollectionNotFoundException;
import com.tierstore.filter.FilterCompiler;
import com.tierstore.filter.PredicateFilterCompiler;
import com.tierstore.store.AbstractCollectionAdapter;
import com.tierstore.store.AggregateResult;
import com.tierstore.store.AggregateSpec;
import com.tierstore.store.BackendConfig;
import com.tierstore.store.BatchResult;
import com.tierstore.store.CollectionHandle;
import com.tierstore.store.CollectionSchema;
import com.tierstore.store.IndexMeta;
import com.tierstore.store.ScoredRecord;
import com.tierstore.store.VectorQuery;
import com.tierstore.store.VectorRecord;

/**
 * In-process backend. With a configured path the project lives under {@code <path>/vectordb}.
 */
public class LocalCollectionAdapter extends AbstractCollectionAdapter<Predicate<Map<String, Object>>> {
    private final LocalStore store;
    private final PredicateFilterCompiler compiler = new PredicateFilterCompiler();

    public LocalCollectionAdapter(LocalStore store, String collectionName) {
        this(store, collectionName, Clock.systemUTC());
    }

    public LocalCollectionAdapter(LocalStore store, String collectionName, Clock clock) {
        super("local", collectionName, clock);
        this.store = store;
    }

    public static LocalCollectionAdapter fromConfig(BackendConfig config, LocalStores stores) {
        return new LocalCollectionAdapter(stores.forPath(config.path()), config.name());
    }

    @Override
    protected FilterCompiler<Predicate<Map<String, Object>>> filterCompiler() {
        return compiler;
    }

    @Override
    protected Optional<CollectionHandle> loadExistingCollection(CollectionSchema requested) {
        return store.find(collectionName())
                .map(collection -> newHandle(collection.schema(), collection.indexMeta(), false));
    }

    @Override
    protected CollectionHandle createBackendCollection(CollectionSchema schema, IndexMeta indexMeta) {
        LocalCollection collection = store.create(CollectionMeta.of(schema, indexMeta, clock.instant()));
        return newHandle(collection.schema(), collection.indexMeta(), true);
    }

    @Override
    protected boolean remoteCollectionExists() {
        return store.exists(collectionName());
    }

    @Override
    protected BatchResult writeRecords(CollectionHandle bound, List<VectorRecord> records) {
        LocalCollection collection = collection();
        List<String> written = new ArrayList<>(records.size());
        for (VectorRecord record : records) {
            collection.put(record);
            written.add(record.id());
        }
        persist(collection);
        return BatchResult.allSucceeded(written);
    }

    @Override
    protected List<VectorRecord> fetchRecords(CollectionHandle bound, List<String> ids) {
        LocalCollection collection = collection();
        List<VectorRecord> found = new ArrayList<>(ids.size());
        for (String id : ids) {
            VectorRecord record = collection.get(id);
            if (record != null) {
                found.add(record);
            }
        }
        return found;
    }

    @Override
    protected BatchResult deleteRecords(CollectionHandle bound, List<String> ids) {
        LocalCollection collection = collection();
        ids.forEach(collection::remove);
        persist(collection);
        return BatchResult.allSucceeded(ids);
    }

    @Override
    protected List<ScoredRecord> search(CollectionHandle bound, VectorQuery query,
            Predicate<Map<String, Object>> compiledFilter) {
        return collection().search(query, compiledFilter);
    }

    @Override
    protected AggregateResult aggregateRecords(CollectionHandle bound, Predicate<Map<String, Object>> compiledFilter,
            AggregateSpec spec) {
        return collection().aggregate(compiledFilter, spec);
    }

    @Override
    protected void dropBackendCollection() {
        store.drop(collectionName());
    }

    private LocalCollection collection() {
        return store.find(collectionName()).orElseThrow(() -> new CollectionNotFoundException(collectionName()));
    }

    private void persist(LocalCollection collection) {
        try {
            collection.flush();
        } catch (IOException e) {
            throw new BackendException("failed to persist local collection " + collectionName(), false, e);
        }
    }
}

package com.tierstore.store.http;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.tierstore.error.BackendException;
import com.tierstore.filter.DslDialect;
import com.tierstore.filter.DslFilterCompiler;
import com.tierstore.filter.FilterCompiler;
import com.tierstore.runtime.RetryPolicy;
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

import okhttp3.OkHttpClient;

/**
 * Adapter for a remote REST vector service. Filters are sent in the JSON filter DSL.
 */
public class HttpCollectionAdapter extends AbstractCollectionAdapter<Map<String, Object>> {
    private static final Logger log = LoggerFactory.getLogger(HttpCollectionAdapter.class);

    static final String LIST_COLLECTIONS = "/api/v1/collection/list";
    static final String COLLECTION_INFO = "/api/v1/collection/info";
    static final String CREATE_COLLECTION = "/api/v1/collection/create";
    static final String DROP_COLLECTION = "/api/v1/collection/drop";
    static final String CREATE_INDEX = "/api/v1/index/create";
    static final String UPSERT = "/api/v1/data/upsert";
    static final String FETCH = "/api/v1/data/fetch";
    static final String DELETE = "/api/v1/data/delete";
    static final String AGGREGATE = "/api/v1/data/aggregate";
    static final String SEARCH_VECTOR = "/api/v1/search/vector";
    static final String SEARCH_SCALAR = "/api/v1/search/scalar";

    private final VectorServiceClient client;
    private final WireCodec codec;
    private final DslFilterCompiler compiler;
    private final String project;

    public HttpCollectionAdapter(String backend, String collectionName, String project, VectorServiceClient client,
            DslDialect dialect, Clock clock) {
        super(backend, collectionName, clock);
        this.client = client;
        this.codec = new WireCodec(client.mapper());
        this.compiler = new DslFilterCompiler(dialect);
        this.project = project;
    }

    public static HttpCollectionAdapter fromConfig(BackendConfig config, OkHttpClient httpClient) {
        String endpoint = config.requireEndpoint();
        VectorServiceClient client = new VectorServiceClient(
                withTimeout(httpClient, config),
                endpoint,
                RequestAuthenticator.bearer(config.apiKey()),
                RetryPolicy.defaults());
        return new HttpCollectionAdapter("http", config.name(), config.project(), client,
                DslDialect.full("http"), Clock.systemUTC());
    }

    protected static OkHttpClient withTimeout(OkHttpClient httpClient, BackendConfig config) {
        return httpClient.newBuilder().callTimeout(config.timeout()).build();
    }

    @Override
    protected FilterCompiler<Map<String, Object>> filterCompiler() {
        return compiler;
    }

    @Override
    protected Optional<CollectionHandle> loadExistingCollection(CollectionSchema requested) {
        return client.callOptional(COLLECTION_INFO, target())
                .filter(info -> !info.isMissingNode() && !info.isNull())
                .map(info -> {
                    CollectionSchema schema = codec.decodeSchema(collectionName(), info, requested);
                    IndexMeta fallback = buildDefaultIndexMeta(DEFAULT_INDEX_NAME, schema,
                            sanitizeScalarIndexFields(schema.scalarIndexFields(), schema));
                    return newHandle(schema, codec.decodeIndex(info, fallback), false);
                });
    }

    @Override
    protected CollectionHandle createBackendCollection(CollectionSchema schema, IndexMeta indexMeta) {
        Map<String, Object> create = target();
        create.put("description", schema.description());
        create.put("fields", codec.encodeFields(schema));
        create.put("distance", schema.distance().wireName());
        create.put("sparse_weight", schema.sparseWeight());
        client.call(CREATE_COLLECTION, create);

        Map<String, Object> index = target();
        index.put("index", indexMeta.toWire());
        client.call(CREATE_INDEX, index);
        return newHandle(schema, indexMeta, true);
    }

    @Override
    protected boolean remoteCollectionExists() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("project", project);
        return client.callOptional(LIST_COLLECTIONS, body)
                .map(codec::decodeCollectionNames)
                .orElse(List.of())
                .contains(collectionName());
    }

    @Override
    protected BatchResult writeRecords(CollectionHandle bound, List<VectorRecord> records) {
        List<String> ids = records.stream().map(VectorRecord::id).toList();
        Map<String, Object> body = target();
        body.put("data", records.stream().map(codec::encodeRecord).toList());
        return batchOutcome(UPSERT, body, ids);
    }

    @Override
    protected List<VectorRecord> fetchRecords(CollectionHandle bound, List<String> ids) {
        Map<String, Object> body = target();
        body.put("ids", ids);
        JsonNode data = client.call(FETCH, body);
        List<VectorRecord> records = new ArrayList<>();
        data.forEach(node -> records.add(codec.decodeRecord(node)));
        return records;
    }

    @Override
    protected BatchResult deleteRecords(CollectionHandle bound, List<String> ids) {
        Map<String, Object> body = target();
        body.put("ids", ids);
        return batchOutcome(DELETE, body, ids);
    }

    @Override
    protected List<ScoredRecord> search(CollectionHandle bound, VectorQuery query, Map<String, Object> compiledFilter) {
        Map<String, Object> body = target();
        body.put("index_name", bound.indexMeta().indexName());
        if (!compiledFilter.isEmpty()) {
            body.put("filter", compiledFilter);
        }
        body.put("limit", query.limit());
        body.put("offset", query.offset());
        body.put("output_vectors", query.withVectors());
        String path;
        if (query.isScan()) {
            path = SEARCH_SCALAR;
            if (query.orderBy() != null) {
                body.put("order_by", query.orderBy());
                body.put("order", query.orderDescending() ? "desc" : "asc");
            }
        } else {
            path = SEARCH_VECTOR;
            if (query.isDense()) {
                body.put("dense_vector", query.dense());
            } else {
                body.put("sparse_vector", query.sparse());
            }
        }
        return codec.decodeScoredList(client.call(path, body));
    }

    @Override
    protected AggregateResult aggregateRecords(CollectionHandle bound, Map<String, Object> compiledFilter,
            AggregateSpec spec) {
        Map<String, Object> body = target();
        body.put("index_name", bound.indexMeta().indexName());
        body.put("op", spec.op().name().toLowerCase(Locale.ROOT));
        if (spec.field() != null) {
            body.put("field", spec.field());
        }
        if (spec.groupBy() != null) {
            body.put("group_by", spec.groupBy());
        }
        if (!compiledFilter.isEmpty()) {
            body.put("filter", compiledFilter);
        }
        JsonNode data = client.call(AGGREGATE, body);
        Map<String, Double> groups = new LinkedHashMap<>();
        data.path("groups").fields().forEachRemaining(entry -> groups.put(entry.getKey(), entry.getValue().asDouble()));
        double value = data.path("_total").asDouble(spec.op() == AggregateSpec.Op.COUNT ? 0d : Double.NaN);
        return new AggregateResult(spec, value, groups);
    }

    @Override
    protected void dropBackendCollection() {
        client.callOptional(DROP_COLLECTION, target());
    }

    protected final Map<String, Object> target() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("project", project);
        body.put("collection_name", collectionName());
        return body;
    }

    /**
     * A request that fails as a whole after retries marks every id of its sub-batch as failed;
     * later sub-batches still run.
     */
    private BatchResult batchOutcome(String path, Map<String, Object> body, List<String> ids) {
        Map<String, String> failures;
        try {
            failures = codec.decodeFailures(client.call(path, body));
        } catch (BackendException e) {
            log.warn("Batch request failed path={} collection={} ids={} reason={}",
                    path, collectionName(), ids.size(), e.getMessage());
            failures = new LinkedHashMap<>();
            for (String id : ids) {
                failures.put(id, e.getMessage());
            }
        }
        Set<String> failed = new LinkedHashSet<>(failures.keySet());
        List<String> succeeded = ids.stream().filter(id -> !failed.contains(id)).toList();
        return new BatchResult(succeeded, failures);
    }
}

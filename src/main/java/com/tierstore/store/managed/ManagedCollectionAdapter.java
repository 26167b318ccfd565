package com.tierstore.store.managed;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tierstore.filter.DslDialect;
import com.tierstore.runtime.RetryPolicy;
import com.tierstore.store.BackendConfig;
import com.tierstore.store.CollectionSchema;
import com.tierstore.store.FieldSpec;
import com.tierstore.store.FieldType;
import com.tierstore.store.IndexMeta;
import com.tierstore.store.VectorRecord;
import com.tierstore.store.http.HttpCollectionAdapter;
import com.tierstore.store.http.VectorServiceClient;

import okhttp3.OkHttpClient;

/**
 * Hosted vector service: signed requests, HNSW indexes, no date-time scalar indexes and no
 * negated filters.
 */
public class ManagedCollectionAdapter extends HttpCollectionAdapter {
    static final DslDialect DIALECT = new DslDialect("managed", true, false, false);

    public ManagedCollectionAdapter(String collectionName, String project, VectorServiceClient client, Clock clock) {
        super("managed", collectionName, project, client, DIALECT, clock);
    }

    public static ManagedCollectionAdapter fromConfig(BackendConfig config, OkHttpClient httpClient) {
        String endpoint = config.requireEndpoint();
        String accessKey = config.require(config.accessKey(), "accessKey");
        String secretKey = config.require(config.secretKey(), "secretKey");
        String region = config.require(config.region(), "region");
        Clock clock = Clock.systemUTC();
        VectorServiceClient client = new VectorServiceClient(
                withTimeout(httpClient, config),
                endpoint,
                new SigningAuthenticator(accessKey, secretKey, region, clock),
                RetryPolicy.defaults());
        return new ManagedCollectionAdapter(config.name(), config.project(), client, clock);
    }

    @Override
    protected List<String> sanitizeScalarIndexFields(List<String> fields, CollectionSchema schema) {
        return fields.stream()
                .filter(name -> schema.field(name).map(spec -> spec.type() != FieldType.DATE_TIME).orElse(true))
                .toList();
    }

    @Override
    protected IndexMeta buildDefaultIndexMeta(String indexName, CollectionSchema schema, List<String> scalarIndexFields) {
        boolean hybrid = schema.isHybrid();
        return new IndexMeta(
                indexName,
                hybrid ? "hnsw_hybrid" : "hnsw",
                schema.distance(),
                "int8",
                scalarIndexFields,
                hybrid,
                schema.sparseWeight());
    }

    /**
     * The service returns date-time fields as ISO-8601 strings and paths with a trailing slash.
     */
    @Override
    protected VectorRecord normalizeRecordForRead(VectorRecord record) {
        CollectionSchema schema = handle().map(bound -> bound.schema()).orElse(null);
        if (schema == null) {
            return record;
        }
        Map<String, Object> fields = new LinkedHashMap<>(record.fields());
        for (FieldSpec field : schema.fields()) {
            Object value = fields.get(field.name());
            if (value instanceof String text) {
                fields.put(field.name(), normalize(field.type(), text));
            }
        }
        return record.withFields(fields);
    }

    static Object normalize(FieldType type, String value) {
        switch (type) {
            case DATE_TIME:
                try {
                    return Instant.parse(value).toEpochMilli();
                } catch (DateTimeParseException e) {
                    return value;
                }
            case INT64:
                try {
                    return Long.parseLong(value.strip());
                } catch (NumberFormatException e) {
                    return value;
                }
            case PATH:
                if (value.length() > 1 && value.endsWith("/") && !value.endsWith("://")) {
                    return value.substring(0, value.length() - 1);
                }
                return value;
            default:
                return value;
        }
    }
}

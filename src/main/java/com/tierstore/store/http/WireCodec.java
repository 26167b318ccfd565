package com.tierstore.store.http;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tierstore.store.CollectionSchema;
import com.tierstore.store.DistanceMetric;
import com.tierstore.store.FieldSpec;
import com.tierstore.store.FieldType;
import com.tierstore.store.IndexMeta;
import com.tierstore.store.ScoredRecord;
import com.tierstore.store.VectorRecord;

/**
 * JSON shapes exchanged with the remote vector service.
 */
final class WireCodec {
    private final ObjectMapper mapper;

    WireCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    Map<String, Object> encodeRecord(VectorRecord record) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("id", record.id());
        if (record.dense() != null) {
            wire.put("vector", record.dense());
        }
        if (!record.sparse().isEmpty()) {
            wire.put("sparse_vector", record.sparse());
        }
        wire.put("fields", record.fields());
        return wire;
    }

    VectorRecord decodeRecord(JsonNode node) {
        String id = node.path("id").asText();
        float[] dense = null;
        JsonNode vector = node.path("vector");
        if (vector.isArray()) {
            dense = new float[vector.size()];
            for (int i = 0; i < vector.size(); i++) {
                dense[i] = (float) vector.get(i).asDouble();
            }
        }
        Map<String, Float> sparse = new LinkedHashMap<>();
        JsonNode sparseNode = node.path("sparse_vector");
        if (sparseNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> entries = sparseNode.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                sparse.put(entry.getKey(), (float) entry.getValue().asDouble());
            }
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        JsonNode fieldsNode = node.path("fields");
        if (fieldsNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> entries = fieldsNode.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                Object value = scalar(entry.getValue());
                if (value != null) {
                    fields.put(entry.getKey(), value);
                }
            }
        }
        fields.putIfAbsent("id", id);
        return new VectorRecord(id, dense, sparse, fields);
    }

    ScoredRecord decodeScored(JsonNode node) {
        return new ScoredRecord(decodeRecord(node), (float) node.path("score").asDouble());
    }

    List<ScoredRecord> decodeScoredList(JsonNode data) {
        List<ScoredRecord> results = new ArrayList<>();
        if (data.isArray()) {
            data.forEach(node -> results.add(decodeScored(node)));
        }
        return results;
    }

    List<Map<String, Object>> encodeFields(CollectionSchema schema) {
        List<Map<String, Object>> fields = new ArrayList<>();
        for (FieldSpec field : schema.fields()) {
            Map<String, Object> wire = new LinkedHashMap<>();
            wire.put("name", field.name());
            wire.put("type", field.type().wireName());
            if (field.type() == FieldType.VECTOR) {
                wire.put("dim", field.dimension());
            }
            if (field.primaryKey()) {
                wire.put("primary_key", true);
            }
            fields.add(wire);
        }
        return fields;
    }

    CollectionSchema decodeSchema(String name, JsonNode info, CollectionSchema requested) {
        JsonNode fieldsNode = info.path("fields");
        if (!fieldsNode.isArray() || fieldsNode.isEmpty()) {
            return requested;
        }
        List<FieldSpec> fields = new ArrayList<>();
        for (JsonNode field : fieldsNode) {
            FieldType type = FieldType.valueOf(field.path("type").asText("string").toUpperCase(Locale.ROOT));
            fields.add(new FieldSpec(
                    field.path("name").asText(),
                    type,
                    field.path("dim").asInt(0),
                    field.path("primary_key").asBoolean(false)));
        }
        List<String> scalarIndex = new ArrayList<>();
        info.path("scalar_index").forEach(node -> scalarIndex.add(node.asText()));
        DistanceMetric distance = info.hasNonNull("distance")
                ? DistanceMetric.parse(info.path("distance").asText())
                : requested.distance();
        float sparseWeight = info.hasNonNull("sparse_weight")
                ? (float) info.path("sparse_weight").asDouble()
                : requested.sparseWeight();
        return new CollectionSchema(name, info.path("description").asText(requested.description()), fields,
                scalarIndex.isEmpty() ? requested.scalarIndexFields() : scalarIndex, distance, sparseWeight);
    }

    IndexMeta decodeIndex(JsonNode info, IndexMeta fallback) {
        JsonNode index = info.path("index");
        if (!index.isObject()) {
            return fallback;
        }
        JsonNode vectorIndex = index.path("vector_index");
        List<String> scalarIndex = new ArrayList<>();
        index.path("scalar_index").forEach(node -> scalarIndex.add(node.asText()));
        return new IndexMeta(
                index.path("index_name").asText(fallback.indexName()),
                vectorIndex.path("index_type").asText(fallback.indexType()),
                vectorIndex.hasNonNull("distance") ? DistanceMetric.parse(vectorIndex.path("distance").asText()) : fallback.distance(),
                vectorIndex.path("quant").asText(fallback.quantization()),
                scalarIndex,
                vectorIndex.path("enable_sparse").asBoolean(false),
                (float) vectorIndex.path("sparse_logit_alpha").asDouble(0d));
    }

    /** Accepts either plain names or objects carrying the name under one of the common keys. */
    List<String> decodeCollectionNames(JsonNode data) {
        List<String> names = new ArrayList<>();
        if (!data.isArray()) {
            return names;
        }
        for (JsonNode item : data) {
            if (item.isTextual()) {
                names.add(item.asText());
                continue;
            }
            for (String key : List.of("collection_name", "CollectionName", "name")) {
                if (item.hasNonNull(key)) {
                    names.add(item.path(key).asText());
                    break;
                }
            }
        }
        return names;
    }

    Map<String, String> decodeFailures(JsonNode data) {
        Map<String, String> failures = new LinkedHashMap<>();
        data.path("failed").forEach(node -> failures.put(node.path("id").asText(), node.path("reason").asText("rejected")));
        return failures;
    }

    private Object scalar(JsonNode value) {
        if (value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.asLong();
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isTextual()) {
            return value.asText();
        }
        return mapper.convertValue(value, Object.class);
    }
}

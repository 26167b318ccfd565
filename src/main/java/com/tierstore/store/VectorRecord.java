package com.tierstore.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One stored record: primary key, optional dense and sparse vectors, scalar fields. Fields with a
 * null value are dropped; a missing field reads the same as a null one.
 */
public record VectorRecord(String id, float[] dense, Map<String, Float> sparse, Map<String, Object> fields) {

    public VectorRecord {
        sparse = sparse == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sparse));
        fields = fields == null ? Map.of() : withoutNulls(fields);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((name, value) -> {
            if (value != null) {
                copy.put(name, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    public String stringField(String name) {
        Object value = fields.get(name);
        return value == null ? "" : value.toString();
    }

    public long longField(String name) {
        Object value = fields.get(name);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.strip());
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        return 0L;
    }

    public VectorRecord withId(String newId) {
        return new VectorRecord(newId, dense, sparse, fields);
    }

    public VectorRecord withFields(Map<String, Object> newFields) {
        return new VectorRecord(id, dense, sparse, newFields);
    }

    public VectorRecord withoutVectors() {
        return new VectorRecord(id, null, Map.of(), fields);
    }
}

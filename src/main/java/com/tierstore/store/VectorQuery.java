package com.tierstore.store;

import java.util.Map;

import com.tierstore.filter.FilterExpression;

/**
 * A single backend query. With a dense or sparse vector it is a similarity search; with neither it
 * scans records matching the filter, optionally ordered by a scalar field.
 */
public record VectorQuery(
        float[] dense,
        Map<String, Float> sparse,
        FilterExpression filter,
        int limit,
        int offset,
        String orderBy,
        boolean orderDescending,
        boolean withVectors) {

    public VectorQuery {
        if (dense != null && sparse != null && !sparse.isEmpty()) {
            throw new IllegalArgumentException("a query carries either a dense or a sparse vector, not both");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        sparse = sparse == null ? Map.of() : Map.copyOf(sparse);
    }

    public static VectorQuery dense(float[] vector, FilterExpression filter, int limit) {
        return new VectorQuery(vector, null, filter, limit, 0, null, false, false);
    }

    public static VectorQuery sparse(Map<String, Float> vector, FilterExpression filter, int limit) {
        return new VectorQuery(null, vector, filter, limit, 0, null, false, false);
    }

    public static VectorQuery scan(FilterExpression filter, int limit) {
        return new VectorQuery(null, null, filter, limit, 0, null, false, false);
    }

    public VectorQuery orderedBy(String field, boolean descending) {
        return new VectorQuery(dense, sparse, filter, limit, offset, field, descending, withVectors);
    }

    public VectorQuery withOffset(int newOffset) {
        return new VectorQuery(dense, sparse, filter, limit, newOffset, orderBy, orderDescending, withVectors);
    }

    public VectorQuery includingVectors() {
        return new VectorQuery(dense, sparse, filter, limit, offset, orderBy, orderDescending, true);
    }

    public boolean isDense() {
        return dense != null;
    }

    public boolean isSparse() {
        return !sparse.isEmpty();
    }

    public boolean isScan() {
        return !isDense() && !isSparse();
    }
}

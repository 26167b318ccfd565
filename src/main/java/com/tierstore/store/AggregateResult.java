package com.tierstore.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param value  aggregate over all matching records ({@code NaN} for MIN/MAX over nothing)
 * @param groups per-group aggregate when a group-by field was requested, keyed by the group value
 */
public record AggregateResult(AggregateSpec spec, double value, Map<String, Double> groups) {

    public AggregateResult {
        groups = groups == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    }

    public long count() {
        return (long) value;
    }
}

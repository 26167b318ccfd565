package com.tierstore.store;

import java.util.Locale;

public enum DistanceMetric {
    COSINE,
    IP,
    L2;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DistanceMetric parse(String value) {
        if (value == null || value.isBlank()) {
            return COSINE;
        }
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}

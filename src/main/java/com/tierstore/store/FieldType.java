package com.tierstore.store;

import java.util.Locale;

public enum FieldType {
    STRING,
    INT64,
    FLOAT,
    BOOL,
    DATE_TIME,
    PATH,
    VECTOR,
    SPARSE_VECTOR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isVector() {
        return this == VECTOR || this == SPARSE_VECTOR;
    }
}

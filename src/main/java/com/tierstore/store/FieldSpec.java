package com.tierstore.store;

public record FieldSpec(String name, FieldType type, int dimension, boolean primaryKey) {

    public static FieldSpec scalar(String name, FieldType type) {
        return new FieldSpec(name, type, 0, false);
    }

    public static FieldSpec primaryKey(String name) {
        return new FieldSpec(name, FieldType.STRING, 0, true);
    }

    public static FieldSpec denseVector(String name, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dense vector dimension must be positive: " + dimension);
        }
        return new FieldSpec(name, FieldType.VECTOR, dimension, false);
    }

    public static FieldSpec sparseVector(String name) {
        return new FieldSpec(name, FieldType.SPARSE_VECTOR, 0, false);
    }
}

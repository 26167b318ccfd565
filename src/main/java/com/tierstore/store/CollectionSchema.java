package com.tierstore.store;

import java.util.List;
import java.util.Optional;

/**
 * Scalar and vector layout of a collection plus its index parameters. Hybrid weighting only takes
 * effect when both a dense and a sparse vector field are declared.
 */
public record CollectionSchema(
        String name,
        String description,
        List<FieldSpec> fields,
        List<String> scalarIndexFields,
        DistanceMetric distance,
        float sparseWeight) {

    public CollectionSchema {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("collection name must not be blank");
        }
        fields = List.copyOf(fields);
        scalarIndexFields = List.copyOf(scalarIndexFields);
        distance = distance == null ? DistanceMetric.COSINE : distance;
        if (sparseWeight < 0f) {
            throw new IllegalArgumentException("sparseWeight must not be negative: " + sparseWeight);
        }
        if (fields.stream().filter(field -> field.type() == FieldType.VECTOR).count() != 1) {
            throw new IllegalArgumentException("collection " + name + " must declare exactly one dense vector field");
        }
    }

    public FieldSpec denseField() {
        return fields.stream()
                .filter(field -> field.type() == FieldType.VECTOR)
                .findFirst()
                .orElseThrow();
    }

    public int denseDimension() {
        return denseField().dimension();
    }

    public Optional<FieldSpec> sparseField() {
        return fields.stream().filter(field -> field.type() == FieldType.SPARSE_VECTOR).findFirst();
    }

    public boolean isHybrid() {
        return sparseField().isPresent() && sparseWeight > 0f;
    }

    public Optional<FieldSpec> field(String fieldName) {
        return fields.stream().filter(field -> field.name().equals(fieldName)).findFirst();
    }

    public CollectionSchema withName(String newName) {
        return new CollectionSchema(newName, description, fields, scalarIndexFields, distance, sparseWeight);
    }
}

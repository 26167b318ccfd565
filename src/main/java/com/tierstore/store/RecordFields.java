package com.tierstore.store;

import java.util.List;

/**
 * Scalar layout shared by every context collection.
 */
public final class RecordFields {
    public static final String ID = "id";
    public static final String RESOURCE_ID = "resource_id";
    public static final String URI = "uri";
    public static final String PARENT_URI = "parent_uri";
    public static final String WORKSPACE = "workspace";
    public static final String AGENT = "agent";
    public static final String LEVEL = "level";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String CONTENT_TYPE = "content_type";
    public static final String NAME = "name";
    public static final String ABSTRACT = "abstract";
    public static final String TEXT = "text";
    public static final String L2_REF = "l2_ref";
    public static final String ANCHOR = "anchor";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String MODEL = "model";
    public static final String VECTOR = "vector";
    public static final String SPARSE_VECTOR = "sparse_vector";

    private static final List<String> SCALAR_INDEX_FIELDS = List.of(
            URI, PARENT_URI, RESOURCE_ID, WORKSPACE, AGENT, LEVEL, CHUNK_INDEX, CONTENT_TYPE, NAME,
            CREATED_AT, UPDATED_AT);

    private RecordFields() {
    }

    public static CollectionSchema contextSchema(String name, int dimension, DistanceMetric distance, float sparseWeight) {
        List<FieldSpec> fields = List.of(
                FieldSpec.primaryKey(ID),
                FieldSpec.scalar(RESOURCE_ID, FieldType.STRING),
                FieldSpec.scalar(URI, FieldType.PATH),
                FieldSpec.scalar(PARENT_URI, FieldType.PATH),
                FieldSpec.scalar(WORKSPACE, FieldType.STRING),
                FieldSpec.scalar(AGENT, FieldType.STRING),
                FieldSpec.scalar(LEVEL, FieldType.INT64),
                FieldSpec.scalar(CHUNK_INDEX, FieldType.INT64),
                FieldSpec.scalar(CONTENT_TYPE, FieldType.STRING),
                FieldSpec.scalar(NAME, FieldType.STRING),
                FieldSpec.scalar(ABSTRACT, FieldType.STRING),
                FieldSpec.scalar(TEXT, FieldType.STRING),
                FieldSpec.scalar(L2_REF, FieldType.STRING),
                FieldSpec.scalar(ANCHOR, FieldType.STRING),
                FieldSpec.scalar(CREATED_AT, FieldType.DATE_TIME),
                FieldSpec.scalar(UPDATED_AT, FieldType.DATE_TIME),
                FieldSpec.scalar(MODEL, FieldType.STRING),
                FieldSpec.denseVector(VECTOR, dimension),
                FieldSpec.sparseVector(SPARSE_VECTOR));
        return new CollectionSchema(name, "Layered context records", fields, SCALAR_INDEX_FIELDS, distance, sparseWeight);
    }
}

package com.tierstore.store.local;

import java.time.Instant;
import java.util.List;

import com.tierstore.store.CollectionSchema;
import com.tierstore.store.DistanceMetric;
import com.tierstore.store.FieldSpec;
import com.tierstore.store.IndexMeta;

/**
 * On-disk form of {@code collection_meta.json}.
 */
record CollectionMeta(
        String name,
        String description,
        List<FieldSpec> fields,
        List<String> scalarIndexFields,
        DistanceMetric distance,
        float sparseWeight,
        IndexMeta index,
        Instant createdAt) {

    static CollectionMeta of(CollectionSchema schema, IndexMeta index, Instant createdAt) {
        return new CollectionMeta(schema.name(), schema.description(), schema.fields(), schema.scalarIndexFields(),
                schema.distance(), schema.sparseWeight(), index, createdAt);
    }

    CollectionSchema toSchema() {
        return new CollectionSchema(name, description, fields, scalarIndexFields, distance, sparseWeight);
    }
}

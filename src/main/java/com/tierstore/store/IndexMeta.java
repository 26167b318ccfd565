package com.tierstore.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record IndexMeta(
        String indexName,
        String indexType,
        DistanceMetric distance,
        String quantization,
        List<String> scalarIndexFields,
        boolean sparseEnabled,
        float sparseWeight) {

    public IndexMeta {
        scalarIndexFields = List.copyOf(scalarIndexFields);
    }

    public Map<String, Object> toWire() {
        Map<String, Object> vectorIndex = new LinkedHashMap<>();
        vectorIndex.put("index_type", indexType);
        vectorIndex.put("distance", distance.wireName());
        vectorIndex.put("quant", quantization);
        if (sparseEnabled) {
            vectorIndex.put("enable_sparse", true);
            vectorIndex.put("sparse_logit_alpha", sparseWeight);
        }
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("index_name", indexName);
        wire.put("vector_index", vectorIndex);
        wire.put("scalar_index", scalarIndexFields);
        return wire;
    }
}

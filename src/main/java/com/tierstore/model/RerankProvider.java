package com.tierstore.model;

import java.util.List;

public interface RerankProvider {

    String modelId();

    /** Scores each document against the query; indices refer to {@code documents}. */
    List<RerankScore> rerank(String query, List<String> documents) throws ProviderException;
}

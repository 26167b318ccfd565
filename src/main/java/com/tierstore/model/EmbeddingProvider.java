package com.tierstore.model;

import java.util.List;

public interface EmbeddingProvider {

    String modelId();

    EmbeddingKind kind();

    /** Returns one vector per input, in input order. */
    List<EmbeddingVector> embed(List<ModelInput> inputs) throws ProviderException;
}

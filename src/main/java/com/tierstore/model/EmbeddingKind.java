package com.tierstore.model;

public enum EmbeddingKind {
    DENSE,
    SPARSE
}

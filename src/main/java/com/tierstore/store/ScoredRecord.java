package com.tierstore.store;

public record ScoredRecord(VectorRecord record, float score) {
}

package com.tierstore.retrieve;

import com.tierstore.store.VectorRecord;

public record FusedCandidate(VectorRecord record, float score, float denseScore, float sparseScore) {
}

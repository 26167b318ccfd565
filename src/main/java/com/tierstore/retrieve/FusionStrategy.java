package com.tierstore.retrieve;

import java.util.List;

import com.tierstore.store.ScoredRecord;

/**
 * Combines dense and sparse hit lists into one candidate list keyed by record id.
 */
public interface FusionStrategy {

    String name();

    List<FusedCandidate> fuse(List<ScoredRecord> dense, List<ScoredRecord> sparse, float sparseWeight);
}

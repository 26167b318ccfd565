package com.tierstore.retrieve;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tierstore.store.ScoredRecord;
import com.tierstore.store.VectorRecord;

/**
 * {@code dense + sparseWeight * sparse}; a record missing from one list scores zero there.
 */
public class LinearFusion implements FusionStrategy {

    @Override
    public String name() {
        return "linear";
    }

    @Override
    public List<FusedCandidate> fuse(List<ScoredRecord> dense, List<ScoredRecord> sparse, float sparseWeight) {
        Map<String, VectorRecord> records = new LinkedHashMap<>();
        Map<String, Float> denseScores = new LinkedHashMap<>();
        Map<String, Float> sparseScores = new LinkedHashMap<>();
        for (ScoredRecord hit : dense) {
            records.putIfAbsent(hit.record().id(), hit.record());
            denseScores.merge(hit.record().id(), hit.score(), Math::max);
        }
        for (ScoredRecord hit : sparse) {
            records.putIfAbsent(hit.record().id(), hit.record());
            sparseScores.merge(hit.record().id(), hit.score(), Math::max);
        }
        List<FusedCandidate> fused = new ArrayList<>(records.size());
        for (Map.Entry<String, VectorRecord> entry : records.entrySet()) {
            float denseScore = denseScores.getOrDefault(entry.getKey(), 0f);
            float sparseScore = sparseScores.getOrDefault(entry.getKey(), 0f);
            fused.add(new FusedCandidate(entry.getValue(), denseScore + sparseWeight * sparseScore, denseScore, sparseScore));
        }
        return fused;
    }
}

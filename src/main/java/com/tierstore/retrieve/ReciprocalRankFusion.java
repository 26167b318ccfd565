package com.tierstore.retrieve;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tierstore.store.ScoredRecord;
import com.tierstore.store.VectorRecord;

/**
 * {@code 1/(k + rank_dense) + sparseWeight/(k + rank_sparse)} with 1-based ranks; a record absent
 * from a list contributes nothing for it.
 */
public class ReciprocalRankFusion implements FusionStrategy {
    public static final int DEFAULT_K = 60;

    private final int k;

    public ReciprocalRankFusion() {
        this(DEFAULT_K);
    }

    public ReciprocalRankFusion(int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        this.k = k;
    }

    @Override
    public String name() {
        return "rrf";
    }

    @Override
    public List<FusedCandidate> fuse(List<ScoredRecord> dense, List<ScoredRecord> sparse, float sparseWeight) {
        Map<String, VectorRecord> records = new LinkedHashMap<>();
        Map<String, Integer> denseRanks = ranks(dense, records);
        Map<String, Integer> sparseRanks = ranks(sparse, records);
        Map<String, Float> denseScores = scores(dense);
        Map<String, Float> sparseScores = scores(sparse);

        List<FusedCandidate> fused = new ArrayList<>(records.size());
        for (Map.Entry<String, VectorRecord> entry : records.entrySet()) {
            String id = entry.getKey();
            float score = 0f;
            if (denseRanks.containsKey(id)) {
                score += 1f / (k + denseRanks.get(id));
            }
            if (sparseRanks.containsKey(id)) {
                score += sparseWeight / (k + sparseRanks.get(id));
            }
            fused.add(new FusedCandidate(entry.getValue(), score,
                    denseScores.getOrDefault(id, 0f), sparseScores.getOrDefault(id, 0f)));
        }
        return fused;
    }

    private static Map<String, Integer> ranks(List<ScoredRecord> hits, Map<String, VectorRecord> records) {
        Map<String, Integer> ranks = new LinkedHashMap<>();
        int rank = 1;
        for (ScoredRecord hit : hits) {
            records.putIfAbsent(hit.record().id(), hit.record());
            ranks.putIfAbsent(hit.record().id(), rank++);
        }
        return ranks;
    }

    private static Map<String, Float> scores(List<ScoredRecord> hits) {
        Map<String, Float> scores = new LinkedHashMap<>();
        for (ScoredRecord hit : hits) {
            scores.putIfAbsent(hit.record().id(), hit.score());
        }
        return scores;
    }
}

package com.tierstore.retrieve;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tierstore.context.ContextLayer;
import com.tierstore.filter.FilterExpression;
import com.tierstore.model.EmbeddingKind;
import com.tierstore.model.ModelGateway;
import com.tierstore.model.ModelInput;
import com.tierstore.model.RerankScore;
import com.tierstore.registry.CollectionRegistry;
import com.tierstore.store.CollectionAdapter;
import com.tierstore.store.RecordFields;
import com.tierstore.store.ScoredRecord;
import com.tierstore.store.VectorQuery;
import com.tierstore.store.VectorRecord;

/**
 * Runs one search: embeds the query per kind, queries the tenant's collection, fuses, collapses
 * hits to one result per URI, applies the threshold and the rerank window, then truncates.
 */
public class HybridRetriever {
    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

    private static final Comparator<FusedCandidate> BEST_FIRST = Comparator
            .comparing(FusedCandidate::score, Comparator.reverseOrder())
            .thenComparing(candidate -> candidate.record().longField(RecordFields.LEVEL))
            .thenComparing(candidate -> candidate.record().id());

    private final CollectionRegistry registry;
    private final ModelGateway gateway;
    private final RetrievalConfig config;

    public HybridRetriever(CollectionRegistry registry, ModelGateway gateway, RetrievalConfig config) {
        this.registry = registry;
        this.gateway = gateway;
        this.config = config;
    }

    public RetrievalConfig config() {
        return config;
    }

    public List<SearchResult> search(SearchRequest request) {
        ModelInput queryInput = request.queryInput();
        float[] denseQuery = gateway.embed(queryInput, EmbeddingKind.DENSE).dense();
        Map<String, Float> sparseQuery = null;
        if (useSparse(request)) {
            sparseQuery = gateway.embed(ModelInput.text(request.text()), EmbeddingKind.SPARSE).sparse();
        }

        FilterExpression filter = FilterExpression.allOf(request.filter(), request.directoryFilter(),
                CollectionRegistry.tenantFilter(request.scope()));
        CollectionAdapter adapter = registry.bind(request.scope()).adapter();
        int window = Math.max(request.topK() * config.candidateMultiplier(), config.rerankWindow());

        List<ScoredRecord> denseHits = adapter.query(VectorQuery.dense(denseQuery, filter, window));
        List<FusedCandidate> candidates;
        if (sparseQuery == null || sparseQuery.isEmpty()) {
            candidates = passThrough(denseHits);
        } else {
            List<ScoredRecord> sparseHits = adapter.query(VectorQuery.sparse(sparseQuery, filter, window));
            candidates = config.fusion().fuse(denseHits, sparseHits, config.sparseWeight());
            log.debug("Fused dense={} sparse={} strategy={}", denseHits.size(), sparseHits.size(), config.fusion().name());
        }

        List<SearchResult> results = collapse(candidates);
        if (request.scoreThreshold() != null) {
            float threshold = request.scoreThreshold();
            results.removeIf(result -> result.score() < threshold);
        }
        if (gateway.hasReranker() && request.hasText() && !results.isEmpty()) {
            results = rerank(request.text(), results);
        }
        if (results.size() > request.topK()) {
            results = new ArrayList<>(results.subList(0, request.topK()));
        }
        log.debug("Search workspace={} candidates={} results={}", request.scope().workspace(), candidates.size(), results.size());
        return results;
    }

    private boolean useSparse(SearchRequest request) {
        return config.sparseWeight() > 0f && gateway.hasSparse() && request.hasText();
    }

    private static List<FusedCandidate> passThrough(List<ScoredRecord> hits) {
        List<FusedCandidate> candidates = new ArrayList<>(hits.size());
        for (ScoredRecord hit : hits) {
            candidates.add(new FusedCandidate(hit.record(), hit.score(), hit.score(), 0f));
        }
        return candidates;
    }

    static List<SearchResult> collapse(List<FusedCandidate> candidates) {
        List<FusedCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(BEST_FIRST);
        Map<String, SearchResult> byUri = new LinkedHashMap<>();
        for (FusedCandidate candidate : ordered) {
            VectorRecord record = candidate.record();
            String uri = record.stringField(RecordFields.URI);
            if (!byUri.containsKey(uri)) {
                byUri.put(uri, toResult(candidate));
            }
        }
        List<SearchResult> results = new ArrayList<>(byUri.values());
        results.sort(SearchResult.ORDER);
        return results;
    }

    private static SearchResult toResult(FusedCandidate candidate) {
        VectorRecord record = candidate.record();
        return new SearchResult(
                record.stringField(RecordFields.URI),
                record.stringField(RecordFields.RESOURCE_ID),
                candidate.score(),
                candidate.denseScore(),
                candidate.sparseScore(),
                ContextLayer.ofLevel(record.longField(RecordFields.LEVEL)),
                record.longField(RecordFields.CREATED_AT),
                record.fields());
    }

    /**
     * Reranks the leading window. Results past the window keep their order with scores capped at
     * the lowest reranked score, so the list stays non-increasing.
     */
    private List<SearchResult> rerank(String query, List<SearchResult> results) {
        int size = Math.min(config.rerankWindow(), results.size());
        List<SearchResult> head = results.subList(0, size);
        List<String> documents = new ArrayList<>(size);
        for (SearchResult result : head) {
            documents.add(result.text().isBlank() ? result.abstractText() : result.text());
        }
        List<RerankScore> scores = gateway.rerank(query, documents);

        List<SearchResult> reranked = new ArrayList<>(results.size());
        boolean[] scored = new boolean[size];
        float floor = Float.MAX_VALUE;
        for (RerankScore score : scores) {
            if (scored[score.index()]) {
                continue;
            }
            scored[score.index()] = true;
            reranked.add(head.get(score.index()).withScore(score.score()));
            floor = Math.min(floor, score.score());
        }
        reranked.sort(SearchResult.ORDER);
        List<SearchResult> rest = new ArrayList<>(results.size() - reranked.size());
        for (int i = 0; i < size; i++) {
            if (!scored[i]) {
                rest.add(head.get(i));
            }
        }
        rest.addAll(results.subList(size, results.size()));
        for (SearchResult result : rest) {
            reranked.add(result.score() > floor ? result.withScore(floor) : result);
        }
        return reranked;
    }
}

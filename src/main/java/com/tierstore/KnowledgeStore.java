package com.tierstore;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tierstore.context.ContentChunk;
import com.tierstore.context.ContentFetcher;
import com.tierstore.context.ContentType;
import com.tierstore.context.ContextBuilder;
import com.tierstore.context.ContextBuilderConfig;
import com.tierstore.context.ContextLayer;
import com.tierstore.context.LayerPayload;
import com.tierstore.context.ResourceId;
import com.tierstore.context.ResourceInput;
import com.tierstore.error.ResourceNotFoundException;
import com.tierstore.filter.FilterExpression;
import com.tierstore.ingest.IngestionOutcome;
import com.tierstore.ingest.IngestionService;
import com.tierstore.model.ModelGateway;
import com.tierstore.registry.CollectionRegistry;
import com.tierstore.registry.TenantScope;
import com.tierstore.retrieve.HybridRetriever;
import com.tierstore.retrieve.RetrievalConfig;
import com.tierstore.retrieve.SearchRequest;
import com.tierstore.retrieve.SearchResult;
import com.tierstore.store.AggregateResult;
import com.tierstore.store.AggregateSpec;
import com.tierstore.store.BatchResult;
import com.tierstore.store.CollectionAdapter;
import com.tierstore.store.RecordFields;
import com.tierstore.store.ScoredRecord;
import com.tierstore.store.VectorQuery;
import com.tierstore.store.VectorRecord;

/**
 * Entry point of the store: ingestion, hybrid search, layer access and removal over tenant-scoped
 * collections.
 */
public class KnowledgeStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeStore.class);

    private final CollectionRegistry registry;
    private final ModelGateway gateway;
    private final ContentFetcher fetcher;
    private final IngestionService ingestion;
    private final HybridRetriever retriever;

    public KnowledgeStore(CollectionRegistry registry, ModelGateway gateway, ContentFetcher fetcher,
            ContextBuilderConfig contextConfig, RetrievalConfig retrievalConfig, Clock clock) {
        this.registry = registry;
        this.gateway = gateway;
        this.fetcher = fetcher;
        this.ingestion = new IngestionService(registry, gateway, new ContextBuilder(gateway, fetcher, contextConfig), clock);
        this.retriever = new HybridRetriever(registry, gateway, retrievalConfig);
    }

    public ResourceId ingest(ResourceInput input) {
        return ingestion.ingest(input);
    }

    /**
     * Ingests resources concurrently on {@code executor}. Each outcome carries the id or the error
     * of its resource, in input order. Interruption cancels the outstanding resources.
     */
    public List<IngestionOutcome> ingestBatch(List<ResourceInput> inputs, ExecutorService executor) {
        List<Future<ResourceId>> futures = new ArrayList<>(inputs.size());
        for (ResourceInput input : inputs) {
            futures.add(executor.submit(() -> ingestion.ingest(input)));
        }
        List<IngestionOutcome> outcomes = new ArrayList<>(inputs.size());
        int failed = 0;
        for (int i = 0; i < inputs.size(); i++) {
            ResourceInput input = inputs.get(i);
            try {
                outcomes.add(IngestionOutcome.success(input, futures.get(i).get()));
            } catch (InterruptedException e) {
                for (Future<ResourceId> future : futures) {
                    future.cancel(true);
                }
                Thread.currentThread().interrupt();
                CancellationException cancelled = new CancellationException("batch ingestion interrupted");
                cancelled.initCause(e);
                throw cancelled;
            } catch (ExecutionException e) {
                failed++;
                outcomes.add(IngestionOutcome.failure(input, asRuntime(e.getCause())));
                log.warn("Ingestion failed uri={} reason={}", input.uri(), e.getCause().getMessage());
            } catch (CancellationException e) {
                failed++;
                outcomes.add(IngestionOutcome.failure(input, e));
            }
        }
        log.info("Batch ingestion finished resources={} failed={}", inputs.size(), failed);
        return outcomes;
    }

    public List<SearchResult> search(SearchRequest request) {
        return retriever.search(request);
    }

    public LayerPayload getLayer(ResourceId id, ContextLayer layer) {
        CollectionAdapter adapter = registry.bind(id.scope()).adapter();
        FilterExpression filter = FilterExpression.and(
                IngestionService.resourceFilter(id),
                FilterExpression.eq(RecordFields.LEVEL, (long) layer.level()));
        List<VectorRecord> records = scanAll(adapter, filter);
        if (records.isEmpty()) {
            throw new ResourceNotFoundException(id.uri(), "no " + layer + " record for " + id.scope());
        }
        VectorRecord first = records.get(0);
        ContentType type = contentType(first);
        if (layer != ContextLayer.L2) {
            return LayerPayload.text(id, layer, type, first.stringField(RecordFields.TEXT));
        }
        String l2Ref = first.stringField(RecordFields.L2_REF);
        if (!l2Ref.isEmpty()) {
            try {
                return LayerPayload.fetched(id, type, fetcher.fetchBytes(l2Ref), l2Ref);
            } catch (IOException e) {
                throw new ResourceNotFoundException(l2Ref, "payload unavailable: " + e.getMessage(), e);
            }
        }
        return LayerPayload.text(id, ContextLayer.L2, type, reassemble(records));
    }

    /**
     * @return number of records removed
     */
    public int remove(ResourceId id) {
        CollectionAdapter adapter = registry.bind(id.scope()).adapter();
        BatchResult result = adapter.deleteByFilter(IngestionService.resourceFilter(id)).throwIfFailed("remove");
        log.info("Removed uri={} workspace={} records={}", id.uri(), id.scope().workspace(), result.succeeded().size());
        return result.succeeded().size();
    }

    /**
     * Removes every resource {@code scope} owns beneath {@code directory}. Resources shared by the
     * workspace are not touched by an agent scope, nor agent copies by the workspace scope.
     *
     * @return number of records removed
     */
    public int removeTree(TenantScope scope, String directory) {
        CollectionAdapter adapter = registry.bind(scope).adapter();
        FilterExpression owned = FilterExpression.and(
                FilterExpression.eq(RecordFields.WORKSPACE, scope.workspace()),
                FilterExpression.eq(RecordFields.AGENT, scope.agentKey()),
                FilterExpression.under(RecordFields.URI, directory));
        BatchResult result = adapter.deleteByFilter(owned).throwIfFailed("remove tree");
        log.info("Removed tree={} workspace={} records={}", directory, scope.workspace(), result.succeeded().size());
        return result.succeeded().size();
    }

    /**
     * Record counts per layer visible to {@code scope}.
     */
    public Map<ContextLayer, Long> stats(TenantScope scope) {
        CollectionAdapter adapter = registry.bind(scope).adapter();
        AggregateResult result = adapter.aggregate(CollectionRegistry.tenantFilter(scope), AggregateSpec.countBy(RecordFields.LEVEL));
        Map<ContextLayer, Long> counts = new EnumMap<>(ContextLayer.class);
        for (ContextLayer layer : ContextLayer.values()) {
            counts.put(layer, 0L);
        }
        result.groups().forEach((key, value) -> {
            try {
                counts.put(ContextLayer.ofLevel(Long.parseLong(key.strip())), value.longValue());
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring unknown level group={}", key);
            }
        });
        return counts;
    }

    public ModelGateway gateway() {
        return gateway;
    }

    public CollectionRegistry registry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }

    private static List<VectorRecord> scanAll(CollectionAdapter adapter, FilterExpression filter) {
        long count = adapter.count(filter);
        if (count == 0) {
            return List.of();
        }
        List<ScoredRecord> hits = adapter.query(VectorQuery.scan(filter, (int) Math.min(count, Integer.MAX_VALUE)));
        List<VectorRecord> records = new ArrayList<>(hits.size());
        for (ScoredRecord hit : hits) {
            records.add(hit.record());
        }
        return records;
    }

    // Chunks repeat overlap lines from their predecessor; each line is emitted once. Parts of a long
    // line are joined back without a separator.
    static String reassemble(List<VectorRecord> chunks) {
        List<VectorRecord> ordered = new ArrayList<>(chunks);
        ordered.sort(Comparator.comparingLong(record -> record.longField(RecordFields.CHUNK_INDEX)));
        StringBuilder content = new StringBuilder();
        int emittedThrough = 0;
        for (VectorRecord chunk : ordered) {
            String anchor = chunk.stringField(RecordFields.ANCHOR);
            int start = ContentChunk.startLineOf(anchor);
            if (ContentChunk.partOf(anchor) > 1 && start == emittedThrough) {
                content.append(chunk.stringField(RecordFields.TEXT));
                continue;
            }
            String[] lines = chunk.stringField(RecordFields.TEXT).split("\\R", -1);
            int lineNumber = start > 0 ? start : emittedThrough + 1;
            for (String line : lines) {
                if (lineNumber > emittedThrough) {
                    if (emittedThrough > 0) {
                        content.append('\n');
                    }
                    content.append(line);
                    emittedThrough = lineNumber;
                }
                lineNumber++;
            }
        }
        return content.toString();
    }

    private static ContentType contentType(VectorRecord record) {
        String value = record.stringField(RecordFields.CONTENT_TYPE);
        try {
            return value.isEmpty() ? ContentType.TEXT : ContentType.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ContentType.TEXT;
        }
    }

    private static RuntimeException asRuntime(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException(cause.getMessage(), cause);
    }
}

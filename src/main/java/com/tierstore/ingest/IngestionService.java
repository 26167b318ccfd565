package com.tierstore.ingest;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tierstore.context.ContentChunk;
import com.tierstore.context.ContextBuilder;
import com.tierstore.context.ContextLayer;
import com.tierstore.context.ContextLayers;
import com.tierstore.context.ResourceId;
import com.tierstore.context.ResourceInput;
import com.tierstore.filter.FilterExpression;
import com.tierstore.model.EmbeddingKind;
import com.tierstore.model.EmbeddingVector;
import com.tierstore.model.ModelGateway;
import com.tierstore.model.ModelInput;
import com.tierstore.registry.BoundCollection;
import com.tierstore.registry.CollectionRegistry;
import com.tierstore.store.CollectionAdapter;
import com.tierstore.store.RecordFields;
import com.tierstore.store.ScoredRecord;
import com.tierstore.store.VectorQuery;
import com.tierstore.store.VectorRecord;

/**
 * Turns one resource into its record set (L0, L1 and one L2 record per chunk) and writes it to
 * the workspace collection. Re-ingesting a URI overwrites in place, keeps the first
 * {@code created_at} and removes chunk records the new content no longer produces.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final CollectionRegistry registry;
    private final ModelGateway gateway;
    private final ContextBuilder contextBuilder;
    private final Clock clock;

    public IngestionService(CollectionRegistry registry, ModelGateway gateway, ContextBuilder contextBuilder, Clock clock) {
        this.registry = registry;
        this.gateway = gateway;
        this.contextBuilder = contextBuilder;
        this.clock = clock;
    }

    public ResourceId ingest(ResourceInput input) {
        ResourceId id = input.id();
        ContextLayers layers = contextBuilder.build(input);

        List<Slot> slots = slotsFor(id, input, layers);
        List<ModelInput> embeddingInputs = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            embeddingInputs.add(slot.embeddingInput());
        }
        List<EmbeddingVector> dense = gateway.embed(embeddingInputs, EmbeddingKind.DENSE);
        List<EmbeddingVector> sparse = gateway.hasSparse() ? gateway.embed(sparseInputs(slots), EmbeddingKind.SPARSE) : null;

        BoundCollection bound = registry.bind(input.scope());
        CollectionAdapter adapter = bound.adapter();
        List<VectorRecord> existing = existingRecords(adapter, id);
        long now = clock.millis();
        long createdAt = earliestCreatedAt(existing, now);

        List<VectorRecord> records = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            Slot slot = slots.get(i);
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put(RecordFields.RESOURCE_ID, id.value());
            fields.put(RecordFields.URI, input.uri());
            fields.put(RecordFields.PARENT_URI, input.parentUri());
            fields.put(RecordFields.WORKSPACE, input.scope().workspace());
            fields.put(RecordFields.AGENT, input.scope().agentKey());
            fields.put(RecordFields.LEVEL, (long) slot.layer().level());
            fields.put(RecordFields.CHUNK_INDEX, (long) slot.chunkIndex());
            fields.put(RecordFields.CONTENT_TYPE, input.contentType().name().toLowerCase(Locale.ROOT));
            fields.put(RecordFields.NAME, input.name());
            fields.put(RecordFields.ABSTRACT, layers.l0());
            fields.put(RecordFields.TEXT, slot.text());
            fields.put(RecordFields.L2_REF, layers.l2Ref());
            fields.put(RecordFields.ANCHOR, slot.anchor());
            fields.put(RecordFields.CREATED_AT, createdAt);
            fields.put(RecordFields.UPDATED_AT, now);
            fields.put(RecordFields.MODEL, dense.get(i).model());
            Map<String, Float> sparseVector = sparse == null ? null : sparse.get(i).sparse();
            records.add(new VectorRecord(slot.recordId(), dense.get(i).dense(), sparseVector, fields));
        }
        adapter.upsert(records).throwIfFailed("ingest");

        Set<String> stale = new LinkedHashSet<>();
        for (VectorRecord record : existing) {
            stale.add(record.id());
        }
        for (VectorRecord record : records) {
            stale.remove(record.id());
        }
        if (!stale.isEmpty()) {
            adapter.delete(new ArrayList<>(stale)).throwIfFailed("ingest");
        }
        log.info("Ingested uri={} workspace={} records={} stale={} chunked={}",
                input.uri(), input.scope().workspace(), records.size(), stale.size(), layers.chunkedSummaries());
        return id;
    }

    /** Filter selecting every record of {@code id}. */
    public static FilterExpression resourceFilter(ResourceId id) {
        return FilterExpression.and(
                CollectionRegistry.tenantFilter(id.scope()),
                FilterExpression.eq(RecordFields.RESOURCE_ID, id.value()));
    }

    private static List<VectorRecord> existingRecords(CollectionAdapter adapter, ResourceId id) {
        FilterExpression filter = resourceFilter(id);
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

    private static long earliestCreatedAt(List<VectorRecord> existing, long now) {
        long earliest = now;
        for (VectorRecord record : existing) {
            long createdAt = record.longField(RecordFields.CREATED_AT);
            if (createdAt > 0 && createdAt < earliest) {
                earliest = createdAt;
            }
        }
        return earliest;
    }

    private static List<Slot> slotsFor(ResourceId id, ResourceInput input, ContextLayers layers) {
        List<Slot> slots = new ArrayList<>();
        slots.add(new Slot(id.recordId(ContextLayer.L0, 0), ContextLayer.L0, 0, layers.l0(), "", ModelInput.text(layers.l0())));
        slots.add(new Slot(id.recordId(ContextLayer.L1, 0), ContextLayer.L1, 0, layers.l1(), "", ModelInput.text(layers.l1())));
        if (layers.image() != null) {
            slots.add(new Slot(id.recordId(ContextLayer.L2, 0), ContextLayer.L2, 0, "", "", layers.image()));
            return slots;
        }
        for (ContentChunk chunk : layers.chunks()) {
            String stored = input.isInline() ? chunk.text() : "";
            slots.add(new Slot(id.recordId(ContextLayer.L2, chunk.index()), ContextLayer.L2, chunk.index(),
                    stored, chunk.anchor(), ModelInput.text(chunk.text())));
        }
        return slots;
    }

    // The sparse model sees the image's L0 text in place of the image.
    private static List<ModelInput> sparseInputs(List<Slot> slots) {
        List<ModelInput> inputs = new ArrayList<>(slots.size());
        String abstractText = slots.get(0).text();
        for (Slot slot : slots) {
            ModelInput input = slot.embeddingInput();
            inputs.add(input.isImage() ? ModelInput.text(abstractText) : input);
        }
        return inputs;
    }

    private record Slot(String recordId, ContextLayer layer, int chunkIndex, String text, String anchor,
            ModelInput embeddingInput) {
    }
}

package com.tierstore;

import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.tierstore.context.ContentFetcher;
import com.tierstore.context.ContentType;
import com.tierstore.context.ContextBuilderConfig;
import com.tierstore.context.ContextLayer;
import com.tierstore.context.LayerPayload;
import com.tierstore.context.ResourceId;
import com.tierstore.context.ResourceInput;
import com.tierstore.error.ResourceNotFoundException;
import com.tierstore.ingest.IngestionOutcome;
import com.tierstore.ingest.IngestionService;
import com.tierstore.model.HashingEmbeddingProvider;
import com.tierstore.model.LexicalRerankProvider;
import com.tierstore.model.ModelGateway;
import com.tierstore.model.ModelGatewayConfig;
import com.tierstore.model.TermWeightSparseProvider;
import com.tierstore.model.TokenEstimator;
import com.tierstore.registry.CollectionRegistry;
import com.tierstore.registry.TenantScope;
import com.tierstore.retrieve.RetrievalConfig;
import com.tierstore.retrieve.SearchRequest;
import com.tierstore.retrieve.SearchResult;
import com.tierstore.store.AdapterRegistry;
import com.tierstore.store.BackendConfig;
import com.tierstore.store.RecordFields;
import com.tierstore.store.ScoredRecord;
import com.tierstore.store.VectorQuery;
import com.tierstore.store.VectorRecord;

import okhttp3.OkHttpClient;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KnowledgeStoreTest {
    private static final int DIMENSION = 64;
    private static final TenantScope ACME = TenantScope.workspace("acme");
    private static final String KICKOFF_URI = "resource://notes/kickoff.md";

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
    private final Map<String, byte[]> payloads = new ConcurrentHashMap<>();
    private final ContentFetcher fetcher = uri -> {
        byte[] bytes = payloads.get(uri);
        if (bytes == null) {
            throw new FileNotFoundException(uri);
        }
        return bytes;
    };
    private final KnowledgeStore store = newStore();

    @AfterEach
    void closeStore() {
        store.close();
    }

    @Test
    void shouldRankKickoffNotesFirstForKickoffQuery() {
        ingestNotes(ACME);

        List<SearchResult> results = store.search(SearchRequest.of(ACME, "kickoff meeting", 3));

        assertFalse(results.isEmpty());
        assertEquals(KICKOFF_URI, results.get(0).uri());
        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i - 1).score() >= results.get(i).score());
        }
    }

    @Test
    void shouldExposeBoundedAbstractAndOverview() {
        ResourceId id = store.ingest(ResourceInput.text(ACME, KICKOFF_URI, kickoffNotes()));

        LayerPayload abstractLayer = store.getLayer(id, ContextLayer.L0);
        LayerPayload overview = store.getLayer(id, ContextLayer.L1);

        assertFalse(abstractLayer.text().isBlank());
        assertTrue(TokenEstimator.estimate(abstractLayer.text()) <= 100);
        assertFalse(overview.text().isBlank());
        assertTrue(overview.text().contains("# Kickoff meeting"));
        assertEquals(ContentType.TEXT, overview.contentType());
    }

    @Test
    void shouldKeepAgentDataPrivateWithinWorkspace() {
        TenantScope planner = TenantScope.of("acme", "planner");
        store.ingest(ResourceInput.text(planner, "resource://planner/secret.md", "Kickoff meeting plan kept by the planner."));
        store.ingest(ResourceInput.text(ACME, "resource://shared/board.md", "Kickoff meeting board shared with everyone."));

        List<String> plannerView = uris(store.search(SearchRequest.of(planner, "kickoff meeting", 10)));
        List<String> coderView = uris(store.search(SearchRequest.of(TenantScope.of("acme", "coder"), "kickoff meeting", 10)));
        List<String> otherWorkspace = uris(store.search(SearchRequest.of(TenantScope.workspace("globex"), "kickoff meeting", 10)));

        assertTrue(plannerView.contains("resource://planner/secret.md"));
        assertTrue(plannerView.contains("resource://shared/board.md"));
        assertEquals(List.of("resource://shared/board.md"), coderView);
        assertTrue(otherWorkspace.isEmpty());
    }

    @Test
    void shouldOverwriteOnReingestAndKeepCreationTime() {
        ResourceInput input = ResourceInput.text(ACME, KICKOFF_URI, kickoffNotes());
        ResourceId id = store.ingest(input);
        List<VectorRecord> first = records(id);

        clock.advance(Duration.ofMinutes(5));
        store.ingest(input);
        List<VectorRecord> second = records(id);

        assertEquals(first.size(), second.size());
        assertEquals(first.stream().map(VectorRecord::id).toList(), second.stream().map(VectorRecord::id).toList());
        for (VectorRecord record : second) {
            assertEquals(Instant.parse("2024-03-01T09:00:00Z").toEpochMilli(), record.longField(RecordFields.CREATED_AT));
            assertEquals(Instant.parse("2024-03-01T09:05:00Z").toEpochMilli(), record.longField(RecordFields.UPDATED_AT));
        }
    }

    @Test
    void shouldRemoveChunksThatShrunkContentNoLongerProduces() {
        ResourceId id = store.ingest(ResourceInput.text(ACME, "resource://long.md", longText(12)));
        long before = store.stats(ACME).get(ContextLayer.L2);

        store.ingest(ResourceInput.text(ACME, "resource://long.md", longText(1)));

        assertTrue(before > 1);
        assertEquals(1L, store.stats(ACME).get(ContextLayer.L2));
        assertEquals(longText(1), store.getLayer(id, ContextLayer.L2).text());
    }

    @Test
    void shouldReassembleInlineContentFromOverlappingChunks() {
        String text = longText(12);
        ResourceId id = store.ingest(ResourceInput.text(ACME, "resource://long.md", text));

        LayerPayload full = store.getLayer(id, ContextLayer.L2);

        assertEquals(text, full.text());
        assertFalse(full.hasBytes());
    }

    @Test
    void shouldServeSingleLineLongerThanChunkBudget() {
        String text = "Intro line\n" + "token ".repeat(100).strip() + "\nClosing line";
        ResourceId id = store.ingest(ResourceInput.text(ACME, "resource://wide.md", text));

        List<VectorRecord> chunks = records(id).stream()
                .filter(record -> record.longField(RecordFields.LEVEL) == 2L)
                .toList();

        assertTrue(chunks.size() > 4);
        assertTrue(chunks.stream().allMatch(record -> TokenEstimator.estimate(record.stringField(RecordFields.TEXT)) <= 24));
        assertEquals(text, store.getLayer(id, ContextLayer.L2).text());
    }

    @Test
    void shouldFetchStoredPayloadForFullContent() {
        byte[] report = "Quarterly report\nRevenue grew.".getBytes(StandardCharsets.UTF_8);
        payloads.put("mem://report.txt", report);
        ResourceId id = store.ingest(ResourceInput.stored(ACME, "resource://report.txt", ContentType.TEXT,
                "mem://report.txt", "text/plain"));

        LayerPayload full = store.getLayer(id, ContextLayer.L2);

        assertArrayEquals(report, full.bytes());
        assertEquals("Quarterly report\nRevenue grew.", full.text());
        assertEquals("mem://report.txt", full.l2Ref());
        assertTrue(records(id).stream()
                .filter(record -> record.longField(RecordFields.LEVEL) == 2)
                .allMatch(record -> record.stringField(RecordFields.TEXT).isEmpty()));

        payloads.remove("mem://report.txt");
        assertThrows(ResourceNotFoundException.class, () -> store.getLayer(id, ContextLayer.L2));
    }

    @Test
    void shouldIngestAndFindImagesByImageQuery() {
        byte[] chart = new byte[256];
        for (int i = 0; i < chart.length; i++) {
            chart[i] = (byte) (i * 7);
        }
        payloads.put("mem://chart.png", chart);
        ingestNotes(ACME);
        ResourceId id = store.ingest(ResourceInput.stored(ACME, "resource://chart.png", ContentType.IMAGE,
                "mem://chart.png", "image/png"));

        List<SearchResult> results = store.search(SearchRequest.ofImage(ACME, chart, "image/png", 1));

        assertEquals("resource://chart.png", results.get(0).uri());
        assertEquals(ContextLayer.L2, results.get(0).layer());
        assertTrue(store.getLayer(id, ContextLayer.L2).hasBytes());
        assertEquals(ContentType.IMAGE, store.getLayer(id, ContextLayer.L0).contentType());
    }

    @Test
    void shouldReportMissingResourceLayers() {
        ResourceId unknown = new ResourceId(ACME, "resource://missing.md");

        assertThrows(ResourceNotFoundException.class, () -> store.getLayer(unknown, ContextLayer.L0));
    }

    @Test
    void shouldRemoveEveryRecordOfAResource() {
        ResourceId id = store.ingest(ResourceInput.text(ACME, "resource://long.md", longText(12)));
        store.ingest(ResourceInput.text(ACME, KICKOFF_URI, kickoffNotes()));
        int expected = records(id).size();

        int removed = store.remove(id);

        assertEquals(expected, removed);
        assertTrue(records(id).isEmpty());
        assertThrows(ResourceNotFoundException.class, () -> store.getLayer(id, ContextLayer.L1));
        assertEquals(1L, store.stats(ACME).get(ContextLayer.L0));
        assertEquals(0, store.remove(id));
    }

    @Test
    void shouldScopeSearchAndRemovalToDirectories() {
        TenantScope planner = TenantScope.of("acme", "planner");
        store.ingest(ResourceInput.text(ACME, "resource://docs/kickoff.md", kickoffNotes()));
        store.ingest(ResourceInput.text(ACME, "resource://docs/sub/agenda.md", "Kickoff agenda and goals."));
        store.ingest(ResourceInput.text(ACME, "resource://docs-old/kickoff.md", "Old kickoff meeting notes."));
        store.ingest(ResourceInput.text(planner, "resource://docs/private.md", "Private kickoff notes."));

        List<SearchResult> scoped = store.search(SearchRequest.of(ACME, "kickoff meeting", 10)
                .withTargetDirectories(List.of("resource://docs")));
        int removed = store.removeTree(ACME, "resource://docs/");

        assertEquals(Set.of("resource://docs/kickoff.md", "resource://docs/sub/agenda.md"), Set.copyOf(uris(scoped)));
        assertEquals(6, removed);
        assertEquals(List.of("resource://docs-old/kickoff.md"), uris(store.search(SearchRequest.of(ACME, "kickoff", 10))));
        assertEquals(List.of("resource://docs/private.md"), uris(store.search(SearchRequest.of(planner, "kickoff", 10)
                .withTargetDirectories(List.of("resource://docs")))));
    }

    @Test
    void shouldCountRecordsPerLayer() {
        ingestNotes(ACME);

        Map<ContextLayer, Long> stats = store.stats(ACME);

        assertEquals(3L, stats.get(ContextLayer.L0));
        assertEquals(3L, stats.get(ContextLayer.L1));
        assertEquals(3L, stats.get(ContextLayer.L2));
        assertEquals(Map.of(ContextLayer.L0, 0L, ContextLayer.L1, 0L, ContextLayer.L2, 0L),
                store.stats(TenantScope.workspace("empty")));
    }

    @Test
    void shouldReportPerResourceOutcomesForBatches() {
        List<ResourceInput> inputs = new ArrayList<>();
        inputs.add(ResourceInput.text(ACME, "resource://a.md", "Alpha notes."));
        inputs.add(ResourceInput.stored(ACME, "resource://gone.txt", ContentType.TEXT, "mem://gone.txt", "text/plain"));
        inputs.add(ResourceInput.text(ACME, "resource://b.md", "Beta notes."));
        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<IngestionOutcome> outcomes;
        try {
            outcomes = store.ingestBatch(inputs, executor);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(3, outcomes.size());
        assertTrue(outcomes.get(0).succeeded());
        assertFalse(outcomes.get(1).succeeded());
        assertTrue(outcomes.get(1).error() instanceof ResourceNotFoundException);
        assertTrue(outcomes.get(2).succeeded());
        assertEquals("resource://b.md", outcomes.get(2).id().uri());
        assertEquals(2L, store.stats(ACME).get(ContextLayer.L0));
    }

    @Test
    void shouldReassembleChunksInIndexOrderRegardlessOfInputOrder() {
        VectorRecord second = chunk(1, "[section 2 | lines 2-3]", "two\nthree");
        VectorRecord first = chunk(0, "[section 1 | lines 1-2]", "one\ntwo");

        assertEquals("one\ntwo\nthree", KnowledgeStore.reassemble(List.of(second, first)));
    }

    @Test
    void shouldJoinLinePartsWithoutSeparator() {
        VectorRecord head = chunk(0, "[section 1 | lines 1-1]", "head");
        VectorRecord partOne = chunk(1, "[section 2 | lines 2-2 | part 1]", "long line ");
        VectorRecord partTwo = chunk(2, "[section 3 | lines 2-2 | part 2]", "keeps going");
        VectorRecord tail = chunk(3, "[section 4 | lines 3-3]", "tail");

        assertEquals("head\nlong line keeps going\ntail",
                KnowledgeStore.reassemble(List.of(tail, partTwo, head, partOne)));
    }

    private KnowledgeStore newStore() {
        CollectionRegistry registry = new CollectionRegistry(AdapterRegistry.withDefaults(new OkHttpClient()),
                BackendConfig.builder("local").dimension(DIMENSION).sparseWeight(0.3f).build());
        ModelGateway gateway = ModelGateway.builder(ModelGatewayConfig.defaults(DIMENSION).withRetry(1, Duration.ZERO, Duration.ZERO))
                .denseEmbedding(new HashingEmbeddingProvider(DIMENSION))
                .sparseEmbedding(new TermWeightSparseProvider())
                .reranker(new LexicalRerankProvider())
                .build();
        ContextBuilderConfig context = new ContextBuilderConfig(6000, 24, 1, 100, 2000);
        return new KnowledgeStore(registry, gateway, fetcher, context, RetrievalConfig.defaults().withSparseWeight(0.3f), clock);
    }

    private void ingestNotes(TenantScope scope) {
        store.ingest(ResourceInput.text(scope, KICKOFF_URI, kickoffNotes()));
        store.ingest(ResourceInput.text(scope, "resource://notes/budget.md",
                "Quarterly budget review. Spending forecasts were revised downward."));
        store.ingest(ResourceInput.text(scope, "resource://notes/recipes.md",
                "Pasta with tomato and basil. Boil water first."));
    }

    private List<VectorRecord> records(ResourceId id) {
        List<ScoredRecord> hits = store.registry().bind(id.scope()).adapter()
                .query(VectorQuery.scan(IngestionService.resourceFilter(id), 1_000));
        return hits.stream().map(ScoredRecord::record).toList();
    }

    private static String kickoffNotes() {
        return "# Kickoff meeting\nThe kickoff meeting is on Monday. Agenda covers goals and roles.";
    }

    private static String longText(int lines) {
        List<String> out = new ArrayList<>();
        for (int i = 1; i <= lines; i++) {
            out.add("Line " + i + " describes step " + i + " of the rollout");
        }
        return String.join("\n", out);
    }

    private static VectorRecord chunk(int index, String anchor, String text) {
        return new VectorRecord("c" + index, null, null, Map.of(
                RecordFields.CHUNK_INDEX, (long) index,
                RecordFields.ANCHOR, anchor,
                RecordFields.TEXT, text));
    }

    private static List<String> uris(List<SearchResult> results) {
        return results.stream().map(SearchResult::uri).toList();
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

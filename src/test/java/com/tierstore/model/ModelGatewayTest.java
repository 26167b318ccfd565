package com.tierstore.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.Test;

import com.tierstore.error.DimensionMismatchException;
import com.tierstore.error.GatewayTimeoutException;
import com.tierstore.error.ModelUnavailableException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelGatewayTest {
    private static final ModelGatewayConfig FAST = ModelGatewayConfig.defaults(4)
            .withRetry(3, Duration.ZERO, Duration.ZERO);

    @Test
    void shouldQueueCallsBeyondTheConcurrencyLimitWithoutFailingThem() throws Exception {
        BlockingProvider provider = new BlockingProvider(4);
        ModelGateway gateway = ModelGateway.builder(FAST.withConcurrency(2, 1, 1))
                .denseEmbedding(provider)
                .build();
        CapabilityLimiter limiter = gateway.limiter(ModelGateway.EMBEDDING);
        ExecutorService executor = Executors.newFixedThreadPool(5);
        try {
            List<Future<EmbeddingVector>> futures = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                String text = "doc " + i;
                futures.add(executor.submit(() -> gateway.embed(ModelInput.text(text), EmbeddingKind.DENSE)));
            }

            awaitTrue(() -> limiter.inFlight() == 2 && limiter.queued() == 3);
            provider.release.countDown();

            for (Future<EmbeddingVector> future : futures) {
                assertEquals(4, future.get(5, TimeUnit.SECONDS).dimension());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(2, provider.maxConcurrent.get());
        assertEquals(5, provider.calls.get());
        assertEquals(0, limiter.inFlight());
        assertEquals(0, limiter.queued());
    }

    @Test
    void shouldFailFastWhenAcquireTimeoutElapses() throws Exception {
        BlockingProvider provider = new BlockingProvider(4);
        ModelGateway gateway = ModelGateway.builder(FAST.withConcurrency(1, 1, 1).withAcquireTimeout(Duration.ofMillis(50)))
                .denseEmbedding(provider)
                .build();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<EmbeddingVector> holder = executor.submit(() -> gateway.embed(ModelInput.text("a"), EmbeddingKind.DENSE));
            awaitTrue(() -> gateway.limiter(ModelGateway.EMBEDDING).inFlight() == 1);

            assertThrows(GatewayTimeoutException.class, () -> gateway.embed(ModelInput.text("b"), EmbeddingKind.DENSE));

            provider.release.countDown();
            assertEquals(4, holder.get(5, TimeUnit.SECONDS).dimension());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldHonourPerCallAcquireTimeoutWhenNoneIsConfigured() throws Exception {
        BlockingProvider provider = new BlockingProvider(4);
        ModelGateway gateway = ModelGateway.builder(FAST.withConcurrency(1, 1, 1))
                .denseEmbedding(provider)
                .build();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<EmbeddingVector> holder = executor.submit(() -> gateway.embed(ModelInput.text("a"), EmbeddingKind.DENSE));
            awaitTrue(() -> gateway.limiter(ModelGateway.EMBEDDING).inFlight() == 1);

            GatewayTimeoutException timeout = assertThrows(GatewayTimeoutException.class,
                    () -> gateway.embed(List.of(ModelInput.text("b")), EmbeddingKind.DENSE, Duration.ofMillis(50)));

            assertEquals(0, gateway.limiter(ModelGateway.EMBEDDING).queued());
            provider.release.countDown();
            assertEquals(4, holder.get(5, TimeUnit.SECONDS).dimension());
            assertTrue(timeout.getMessage().contains(ModelGateway.EMBEDDING));
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, provider.calls.get());
    }

    @Test
    void shouldRetryTransientFailuresUntilSuccess() {
        FlakyProvider provider = new FlakyProvider(2, true);
        ModelGateway gateway = ModelGateway.builder(FAST).denseEmbedding(provider).build();

        EmbeddingVector vector = gateway.embed(ModelInput.text("hello"), EmbeddingKind.DENSE);

        assertEquals(4, vector.dimension());
        assertEquals(3, provider.calls.get());
    }

    @Test
    void shouldReportModelUnavailableAfterRetriesAreExhausted() {
        FlakyProvider provider = new FlakyProvider(10, true);
        ModelGateway gateway = ModelGateway.builder(FAST).denseEmbedding(provider).build();

        ModelUnavailableException error = assertThrows(ModelUnavailableException.class,
                () -> gateway.embed(ModelInput.text("hello"), EmbeddingKind.DENSE));

        assertEquals(3, provider.calls.get());
        assertTrue(error.getMessage().contains("embedding"));
    }

    @Test
    void shouldNotRetryPermanentFailures() {
        FlakyProvider provider = new FlakyProvider(10, false);
        ModelGateway gateway = ModelGateway.builder(FAST).denseEmbedding(provider).build();

        assertThrows(ModelUnavailableException.class, () -> gateway.embed(ModelInput.text("hello"), EmbeddingKind.DENSE));
        assertEquals(1, provider.calls.get());
    }

    @Test
    void shouldRejectVectorsOfTheWrongDimension() {
        ModelGateway gateway = ModelGateway.builder(FAST)
                .denseEmbedding(new HashingEmbeddingProvider(8))
                .build();

        DimensionMismatchException error = assertThrows(DimensionMismatchException.class,
                () -> gateway.embed(ModelInput.text("hello"), EmbeddingKind.DENSE));

        assertEquals(4, error.expected());
        assertEquals(8, error.actual());
    }

    @Test
    void shouldRequireSparseProviderForSparseEmbeddings() {
        ModelGateway gateway = ModelGateway.builder(FAST).denseEmbedding(new HashingEmbeddingProvider(4)).build();

        assertFalse(gateway.hasSparse());
        assertThrows(ModelUnavailableException.class, () -> gateway.embed(ModelInput.text("x"), EmbeddingKind.SPARSE));
        assertThrows(IllegalArgumentException.class,
                () -> ModelGateway.builder(FAST).denseEmbedding(new TermWeightSparseProvider()).build());
    }

    @Test
    void shouldOrderRerankScoresBestFirstWithStableTies() {
        ModelGateway gateway = ModelGateway.builder(FAST)
                .denseEmbedding(new HashingEmbeddingProvider(4))
                .reranker(new LexicalRerankProvider())
                .build();

        List<RerankScore> scores = gateway.rerank("kickoff meeting", List.of(
                "budget review",
                "meeting notes",
                "Kickoff meeting agenda",
                "weekly meeting"));

        assertEquals(List.of(2, 1, 3, 0), scores.stream().map(RerankScore::index).toList());
        assertEquals(1f, scores.get(0).score());
    }

    @Test
    void shouldRejectRerankIndicesOutsideTheDocumentList() {
        RerankProvider broken = new RerankProvider() {
            @Override
            public String modelId() {
                return "broken";
            }

            @Override
            public List<RerankScore> rerank(String query, List<String> documents) {
                return List.of(new RerankScore(documents.size(), 1f));
            }
        };
        ModelGateway gateway = ModelGateway.builder(FAST)
                .denseEmbedding(new HashingEmbeddingProvider(4))
                .reranker(broken)
                .build();

        assertThrows(ModelUnavailableException.class, () -> gateway.rerank("q", List.of("a", "b")));
        assertThrows(ModelUnavailableException.class, () -> ModelGateway.builder(FAST)
                .denseEmbedding(new HashingEmbeddingProvider(4))
                .build()
                .rerank("q", List.of("a")));
    }

    @Test
    void shouldFallBackToExtractiveSummariesWithoutVlm() {
        ModelGateway gateway = ModelGateway.builder(FAST).denseEmbedding(new HashingEmbeddingProvider(4)).build();

        Summary summary = gateway.summarize(SummaryRequest.text("notes.md",
                "# Kickoff\nThe project starts Monday. Everyone attends.", 20, 50));

        assertEquals(ExtractiveSummarizer.MODEL_ID, summary.model());
        assertEquals(ExtractiveSummarizer.MODEL_ID, gateway.summarizerModelId());
        assertTrue(summary.abstractText().startsWith("Kickoff."));
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not reached in time");
            }
            Thread.sleep(5);
        }
    }

    static class BlockingProvider implements EmbeddingProvider {
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger calls = new AtomicInteger();
        final AtomicInteger concurrent = new AtomicInteger();
        final AtomicInteger maxConcurrent = new AtomicInteger();
        private final int dimension;

        BlockingProvider(int dimension) {
            this.dimension = dimension;
        }

        @Override
        public String modelId() {
            return "blocking";
        }

        @Override
        public EmbeddingKind kind() {
            return EmbeddingKind.DENSE;
        }

        @Override
        public List<EmbeddingVector> embed(List<ModelInput> inputs) throws ProviderException {
            calls.incrementAndGet();
            maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
            try {
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new ProviderException("never released", false);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException("interrupted", false, e);
            } finally {
                concurrent.decrementAndGet();
            }
            List<EmbeddingVector> out = new ArrayList<>();
            for (int i = 0; i < inputs.size(); i++) {
                out.add(EmbeddingVector.dense(new float[dimension], modelId()));
            }
            return out;
        }
    }

    static class FlakyProvider implements EmbeddingProvider {
        final AtomicInteger calls = new AtomicInteger();
        private final int failures;
        private final boolean transientFailure;

        FlakyProvider(int failures, boolean transientFailure) {
            this.failures = failures;
            this.transientFailure = transientFailure;
        }

        @Override
        public String modelId() {
            return "flaky";
        }

        @Override
        public EmbeddingKind kind() {
            return EmbeddingKind.DENSE;
        }

        @Override
        public List<EmbeddingVector> embed(List<ModelInput> inputs) throws ProviderException {
            if (calls.incrementAndGet() <= failures) {
                throw new ProviderException("flaky failure " + calls.get(), transientFailure);
            }
            return List.of(EmbeddingVector.dense(new float[] { 1, 0, 0, 0 }, modelId()));
        }
    }
}

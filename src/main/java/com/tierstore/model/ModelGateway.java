package com.tierstore.model;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tierstore.error.DimensionMismatchException;
import com.tierstore.error.ModelUnavailableException;
import com.tierstore.error.TierStoreException;
import com.tierstore.runtime.RetryExhaustedException;
import com.tierstore.runtime.RetryPolicy;

/**
 * Bounded, retrying access to embedding, summarization and rerank providers. Each capability has
 * its own {@link CapabilityLimiter}; a slot is held per attempt, not across backoff.
 */
public class ModelGateway {
    private static final Logger log = LoggerFactory.getLogger(ModelGateway.class);

    public static final String EMBEDDING = "embedding";
    public static final String VLM = "vlm";
    public static final String RERANK = "rerank";

    private final ModelGatewayConfig config;
    private final EmbeddingProvider denseProvider;
    private final EmbeddingProvider sparseProvider;
    private final SummarizationProvider summarizer;
    private final RerankProvider reranker;
    private final ExtractiveSummarizer fallbackSummarizer = new ExtractiveSummarizer();
    private final RetryPolicy retryPolicy;
    private final CapabilityLimiter embeddingLimiter;
    private final CapabilityLimiter vlmLimiter;
    private final CapabilityLimiter rerankLimiter;

    private ModelGateway(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config");
        this.denseProvider = Objects.requireNonNull(builder.denseProvider, "dense embedding provider");
        if (denseProvider.kind() != EmbeddingKind.DENSE) {
            throw new IllegalArgumentException("dense provider " + denseProvider.modelId() + " produces " + denseProvider.kind());
        }
        if (builder.sparseProvider != null && builder.sparseProvider.kind() != EmbeddingKind.SPARSE) {
            throw new IllegalArgumentException("sparse provider " + builder.sparseProvider.modelId() + " produces "
                    + builder.sparseProvider.kind());
        }
        this.sparseProvider = builder.sparseProvider;
        this.summarizer = builder.summarizer;
        this.reranker = builder.reranker;
        this.retryPolicy = new RetryPolicy(config.maxAttempts(), config.initialBackoff(), config.maxBackoff());
        this.embeddingLimiter = new CapabilityLimiter(EMBEDDING, config.embeddingConcurrency());
        this.vlmLimiter = new CapabilityLimiter(VLM, config.vlmConcurrency());
        this.rerankLimiter = new CapabilityLimiter(RERANK, config.rerankConcurrency());
        if (summarizer == null) {
            log.info("No VLM configured; summaries use the extractive fallback");
        }
    }

    public static Builder builder(ModelGatewayConfig config) {
        return new Builder(config);
    }

    public List<EmbeddingVector> embed(List<ModelInput> inputs, EmbeddingKind kind) {
        return embed(inputs, kind, config.acquireTimeout());
    }

    /**
     * Embeds with a caller-chosen bound on the wait for a concurrency permit, overriding the
     * configured one for this call. A {@code null} timeout waits indefinitely.
     */
    public List<EmbeddingVector> embed(List<ModelInput> inputs, EmbeddingKind kind, Duration acquireTimeout) {
        if (inputs.isEmpty()) {
            return List.of();
        }
        EmbeddingProvider provider = kind == EmbeddingKind.DENSE ? denseProvider : sparseProvider;
        if (provider == null) {
            throw new ModelUnavailableException("no " + kind.name().toLowerCase(Locale.ROOT) + " embedding provider configured");
        }
        List<EmbeddingVector> vectors = call(EMBEDDING, embeddingLimiter, acquireTimeout, () -> {
            List<EmbeddingVector> out = provider.embed(inputs);
            if (out.size() != inputs.size()) {
                throw new ProviderException(provider.modelId() + " returned " + out.size() + " vectors for "
                        + inputs.size() + " inputs", false);
            }
            return out;
        });
        if (kind == EmbeddingKind.DENSE) {
            for (EmbeddingVector vector : vectors) {
                if (vector.dimension() != config.denseDimension()) {
                    throw new DimensionMismatchException(config.denseDimension(), vector.dimension(),
                            "embedding model " + provider.modelId());
                }
            }
        }
        log.debug("Embedded inputs={} kind={} model={}", inputs.size(), kind, provider.modelId());
        return vectors;
    }

    public EmbeddingVector embed(ModelInput input, EmbeddingKind kind) {
        return embed(List.of(input), kind).get(0);
    }

    public Summary summarize(SummaryRequest request) {
        return summarize(request, config.acquireTimeout());
    }

    public Summary summarize(SummaryRequest request, Duration acquireTimeout) {
        if (summarizer == null) {
            return fallbackSummarizer.summarize(request);
        }
        return call(VLM, vlmLimiter, acquireTimeout, () -> summarizer.summarize(request));
    }

    /**
     * @return scores ordered best first, ties by original index
     */
    public List<RerankScore> rerank(String query, List<String> documents) {
        return rerank(query, documents, config.acquireTimeout());
    }

    public List<RerankScore> rerank(String query, List<String> documents, Duration acquireTimeout) {
        if (reranker == null) {
            throw new ModelUnavailableException("no rerank provider configured");
        }
        if (documents.isEmpty()) {
            return List.of();
        }
        List<RerankScore> scores = call(RERANK, rerankLimiter, acquireTimeout, () -> {
            List<RerankScore> out = reranker.rerank(query, documents);
            for (RerankScore score : out) {
                if (score.index() < 0 || score.index() >= documents.size()) {
                    throw new ProviderException(reranker.modelId() + " returned out-of-range index " + score.index(), false);
                }
            }
            return out;
        });
        return scores.stream()
                .sorted(Comparator.comparing(RerankScore::score, Comparator.reverseOrder())
                        .thenComparing(RerankScore::index))
                .toList();
    }

    private <T> T call(String capability, CapabilityLimiter limiter, Duration acquireTimeout, Callable<T> providerCall) {
        try {
            return retryPolicy.execute(capability,
                    () -> limiter.run(acquireTimeout, providerCall),
                    ModelGateway::isTransient);
        } catch (RetryExhaustedException e) {
            if (e.last() instanceof TierStoreException typed) {
                throw typed;
            }
            log.warn("Model capability unavailable capability={} attempts={} reason={}",
                    capability, e.attempts(), e.last().getMessage());
            throw new ModelUnavailableException(capability, e.attempts(), e.last());
        }
    }

    private static boolean isTransient(Exception e) {
        return e instanceof ProviderException provider && provider.isTransient();
    }

    public ModelGatewayConfig config() {
        return config;
    }

    public int denseDimension() {
        return config.denseDimension();
    }

    public boolean hasSparse() {
        return sparseProvider != null;
    }

    public boolean hasSummarizer() {
        return summarizer != null;
    }

    public boolean hasReranker() {
        return reranker != null;
    }

    public String denseModelId() {
        return denseProvider.modelId();
    }

    public String summarizerModelId() {
        return summarizer == null ? ExtractiveSummarizer.MODEL_ID : summarizer.modelId();
    }

    public CapabilityLimiter limiter(String capability) {
        return switch (capability) {
            case EMBEDDING -> embeddingLimiter;
            case VLM -> vlmLimiter;
            case RERANK -> rerankLimiter;
            default -> throw new IllegalArgumentException("unknown capability " + capability);
        };
    }

    public static final class Builder {
        private final ModelGatewayConfig config;
        private EmbeddingProvider denseProvider;
        private EmbeddingProvider sparseProvider;
        private SummarizationProvider summarizer;
        private RerankProvider reranker;

        private Builder(ModelGatewayConfig config) {
            this.config = config;
        }

        public Builder denseEmbedding(EmbeddingProvider provider) {
            this.denseProvider = provider;
            return this;
        }

        public Builder sparseEmbedding(EmbeddingProvider provider) {
            this.sparseProvider = provider;
            return this;
        }

        public Builder summarizer(SummarizationProvider provider) {
            this.summarizer = provider;
            return this;
        }

        public Builder reranker(RerankProvider provider) {
            this.reranker = provider;
            return this;
        }

        public ModelGateway build() {
            return new ModelGateway(this);
        }
    }
}

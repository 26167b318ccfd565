package com.tierstore.runtime;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tierstore.KnowledgeStore;
import com.tierstore.context.ContentFetcher;
import com.tierstore.context.ContextBuilderConfig;
import com.tierstore.error.ConfigException;
import com.tierstore.model.EmbeddingKind;
import com.tierstore.model.HashingEmbeddingProvider;
import com.tierstore.model.HttpEmbeddingProvider;
import com.tierstore.model.HttpModelClient;
import com.tierstore.model.HttpRerankProvider;
import com.tierstore.model.HttpSummarizationProvider;
import com.tierstore.model.LexicalRerankProvider;
import com.tierstore.model.ModelGateway;
import com.tierstore.model.ModelGatewayConfig;
import com.tierstore.model.TermWeightSparseProvider;
import com.tierstore.registry.CollectionRegistry;
import com.tierstore.retrieve.LinearFusion;
import com.tierstore.retrieve.ReciprocalRankFusion;
import com.tierstore.retrieve.RetrievalConfig;
import com.tierstore.store.AdapterRegistry;
import com.tierstore.store.BackendConfig;
import com.tierstore.store.DistanceMetric;

import okhttp3.OkHttpClient;

/**
 * Turns an {@link AppConfig} into immutable core settings and a wired {@link KnowledgeStore}.
 * Secrets from the environment override the file.
 */
public final class KnowledgeStoreFactory {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeStoreFactory.class);

    public static final String ENV_EMBEDDING_API_KEY = "TIERSTORE_EMBEDDING_API_KEY";
    public static final String ENV_SPARSE_API_KEY = "TIERSTORE_SPARSE_API_KEY";
    public static final String ENV_VLM_API_KEY = "TIERSTORE_VLM_API_KEY";
    public static final String ENV_RERANK_API_KEY = "TIERSTORE_RERANK_API_KEY";
    public static final String ENV_BACKEND_API_KEY = "TIERSTORE_BACKEND_API_KEY";
    public static final String ENV_BACKEND_ACCESS_KEY = "TIERSTORE_BACKEND_ACCESS_KEY";
    public static final String ENV_BACKEND_SECRET_KEY = "TIERSTORE_BACKEND_SECRET_KEY";

    private KnowledgeStoreFactory() {
    }

    public static KnowledgeStore create(AppConfig config, OkHttpClient httpClient, ContentFetcher fetcher) {
        return create(config, httpClient, fetcher, System.getenv(), Clock.systemUTC());
    }

    public static KnowledgeStore create(AppConfig config, OkHttpClient httpClient, ContentFetcher fetcher,
            Map<String, String> environment, Clock clock) {
        applyEnvironment(config, environment);
        BackendConfig backendConfig = backendConfig(config);
        ModelGateway gateway = gateway(config, httpClient);
        CollectionRegistry registry = new CollectionRegistry(
                AdapterRegistry.withDefaults(httpClient),
                backendConfig,
                Duration.ofMillis(config.getBackend().getExistenceRecheckMs()),
                clock);
        log.info("Knowledge store configured backend={} collection={} dimension={} embedding={} sparse={} vlm={} rerank={}",
                backendConfig.backend(),
                backendConfig.name(),
                backendConfig.dimension(),
                gateway.denseModelId(),
                gateway.hasSparse(),
                gateway.summarizerModelId(),
                gateway.hasReranker());
        return new KnowledgeStore(registry, gateway, fetcher, contextConfig(config), retrievalConfig(config), clock);
    }

    static void applyEnvironment(AppConfig config, Map<String, String> environment) {
        AppConfig.ModelsSection models = config.getModels();
        override(environment, ENV_EMBEDDING_API_KEY, models.getEmbedding()::setApiKey);
        override(environment, ENV_SPARSE_API_KEY, models.getSparse()::setApiKey);
        override(environment, ENV_VLM_API_KEY, models.getVlm()::setApiKey);
        override(environment, ENV_RERANK_API_KEY, models.getRerank()::setApiKey);
        AppConfig.BackendSection backend = config.getBackend();
        override(environment, ENV_BACKEND_API_KEY, backend::setApiKey);
        override(environment, ENV_BACKEND_ACCESS_KEY, backend::setAccessKey);
        override(environment, ENV_BACKEND_SECRET_KEY, backend::setSecretKey);
    }

    public static BackendConfig backendConfig(AppConfig config) {
        AppConfig.BackendSection backend = config.getBackend();
        return BackendConfig.builder(backend.getType())
                .endpoint(backend.getEndpoint())
                .accessKey(backend.getAccessKey())
                .secretKey(backend.getSecretKey())
                .apiKey(backend.getApiKey())
                .name(backend.getName())
                .project(backend.getProject())
                .path(backend.getPath())
                .region(backend.getRegion())
                .dimension(backend.getDimension())
                .distance(distance(backend.getDistance()))
                .sparseWeight(config.getRetrieval().getSparseWeight())
                .timeout(Duration.ofMillis(backend.getTimeoutMs()))
                .build();
    }

    public static ModelGatewayConfig gatewayConfig(AppConfig config) {
        AppConfig.GatewaySection gateway = config.getGateway();
        try {
            return new ModelGatewayConfig(
                    gateway.getEmbeddingConcurrency(),
                    gateway.getVlmConcurrency(),
                    gateway.getRerankConcurrency(),
                    gateway.getMaxAttempts(),
                    Duration.ofMillis(gateway.getInitialBackoffMs()),
                    Duration.ofMillis(gateway.getMaxBackoffMs()),
                    gateway.getAcquireTimeoutMs() > 0 ? Duration.ofMillis(gateway.getAcquireTimeoutMs()) : null,
                    config.getBackend().getDimension());
        } catch (IllegalArgumentException e) {
            throw new ConfigException("invalid gateway settings: " + e.getMessage(), e);
        }
    }

    public static ContextBuilderConfig contextConfig(AppConfig config) {
        AppConfig.ContextSection context = config.getContext();
        return new ContextBuilderConfig(
                context.getMaxContextTokens(),
                context.getChunkTokens(),
                context.getOverlapLines(),
                context.getAbstractTokens(),
                context.getOverviewTokens());
    }

    public static RetrievalConfig retrievalConfig(AppConfig config) {
        AppConfig.RetrievalSection retrieval = config.getRetrieval();
        String fusion = retrieval.getFusion() == null ? "linear" : retrieval.getFusion().strip().toLowerCase(Locale.ROOT);
        try {
            return switch (fusion) {
                case "linear" -> new RetrievalConfig(retrieval.getSparseWeight(), retrieval.getCandidateMultiplier(),
                        retrieval.getRerankWindow(), new LinearFusion());
                case "rrf" -> new RetrievalConfig(retrieval.getSparseWeight(), retrieval.getCandidateMultiplier(),
                        retrieval.getRerankWindow(), new ReciprocalRankFusion(retrieval.getRrfK()));
                default -> throw new ConfigException("unknown fusion strategy: " + retrieval.getFusion());
            };
        } catch (IllegalArgumentException e) {
            throw new ConfigException("invalid retrieval settings: " + e.getMessage(), e);
        }
    }

    public static ModelGateway gateway(AppConfig config, OkHttpClient httpClient) {
        ModelGatewayConfig gatewayConfig = gatewayConfig(config);
        AppConfig.ModelsSection models = config.getModels();
        int dimension = gatewayConfig.denseDimension();
        ModelGateway.Builder builder = ModelGateway.builder(gatewayConfig);

        AppConfig.ProviderSection embedding = models.getEmbedding();
        switch (provider(embedding)) {
            case "hashing" -> builder.denseEmbedding(new HashingEmbeddingProvider(dimension));
            case "http" -> builder.denseEmbedding(new HttpEmbeddingProvider(
                    client(httpClient, embedding, "models.embedding"), embedding.getModel(), EmbeddingKind.DENSE));
            default -> throw new ConfigException("unknown embedding provider: " + embedding.getProvider());
        }

        AppConfig.ProviderSection sparse = models.getSparse();
        if (sparse.isEnabled()) {
            switch (provider(sparse)) {
                case "term-weight" -> builder.sparseEmbedding(new TermWeightSparseProvider());
                case "http" -> builder.sparseEmbedding(new HttpEmbeddingProvider(
                        client(httpClient, sparse, "models.sparse"), sparse.getModel(), EmbeddingKind.SPARSE));
                default -> throw new ConfigException("unknown sparse provider: " + sparse.getProvider());
            }
        }

        AppConfig.ProviderSection vlm = models.getVlm();
        if (vlm.isEnabled()) {
            switch (provider(vlm)) {
                case "extractive" -> log.debug("Using extractive summaries");
                case "http" -> builder.summarizer(new HttpSummarizationProvider(
                        client(httpClient, vlm, "models.vlm"), vlm.getModel()));
                default -> throw new ConfigException("unknown vlm provider: " + vlm.getProvider());
            }
        }

        AppConfig.ProviderSection rerank = models.getRerank();
        if (rerank.isEnabled()) {
            switch (provider(rerank)) {
                case "lexical" -> builder.reranker(new LexicalRerankProvider());
                case "http" -> builder.reranker(new HttpRerankProvider(
                        client(httpClient, rerank, "models.rerank"), rerank.getModel()));
                default -> throw new ConfigException("unknown rerank provider: " + rerank.getProvider());
            }
        }
        return builder.build();
    }

    private static String provider(AppConfig.ProviderSection section) {
        return section.getProvider() == null ? "" : section.getProvider().strip().toLowerCase(Locale.ROOT);
    }

    private static HttpModelClient client(OkHttpClient httpClient, AppConfig.ProviderSection section, String path) {
        if (section.getEndpoint() == null || section.getEndpoint().isBlank()) {
            throw new ConfigException(path + ".endpoint is required for provider http");
        }
        if (section.getModel() == null || section.getModel().isBlank()) {
            throw new ConfigException(path + ".model is required for provider http");
        }
        return new HttpModelClient(httpClient, section.getEndpoint(), section.getApiKey());
    }

    private static DistanceMetric distance(String value) {
        try {
            return DistanceMetric.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("unknown distance metric: " + value, e);
        }
    }

    private static void override(Map<String, String> environment, String key, Consumer<String> setter) {
        String value = environment.get(key);
        if (value != null && !value.isBlank()) {
            setter.accept(value);
        }
    }
}

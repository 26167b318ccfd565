package com.tierstore.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * YAML-bound settings. Every section has working offline defaults: the local backend, hashing
 * embeddings, term-weight sparse vectors and the extractive summarizer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private BackendSection backend = new BackendSection();
    private ModelsSection models = new ModelsSection();
    private GatewaySection gateway = new GatewaySection();
    private ContextSection context = new ContextSection();
    private RetrievalSection retrieval = new RetrievalSection();

    public BackendSection getBackend() {
        return backend;
    }

    public void setBackend(BackendSection backend) {
        this.backend = backend == null ? new BackendSection() : backend;
    }

    public ModelsSection getModels() {
        return models;
    }

    public void setModels(ModelsSection models) {
        this.models = models == null ? new ModelsSection() : models;
    }

    public GatewaySection getGateway() {
        return gateway;
    }

    public void setGateway(GatewaySection gateway) {
        this.gateway = gateway == null ? new GatewaySection() : gateway;
    }

    public ContextSection getContext() {
        return context;
    }

    public void setContext(ContextSection context) {
        this.context = context == null ? new ContextSection() : context;
    }

    public RetrievalSection getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalSection retrieval) {
        this.retrieval = retrieval == null ? new RetrievalSection() : retrieval;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BackendSection {
        private String type = "local";
        private String endpoint;
        private String accessKey;
        private String secretKey;
        private String apiKey;
        private String name = "context";
        private String project = "default";
        private String path = ".tierstore";
        private String region;
        private int dimension = 384;
        private String distance = "cosine";
        private long timeoutMs = 30000;
        private long existenceRecheckMs = 30000;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getAccessKey() {
            return accessKey;
        }

        public void setAccessKey(String accessKey) {
            this.accessKey = accessKey;
        }

        public String getSecretKey() {
            return secretKey;
        }

        public void setSecretKey(String secretKey) {
            this.secretKey = secretKey;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getProject() {
            return project;
        }

        public void setProject(String project) {
            this.project = project;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public String getDistance() {
            return distance;
        }

        public void setDistance(String distance) {
            this.distance = distance;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getExistenceRecheckMs() {
            return existenceRecheckMs;
        }

        public void setExistenceRecheckMs(long existenceRecheckMs) {
            this.existenceRecheckMs = existenceRecheckMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelsSection {
        private ProviderSection embedding = new ProviderSection("hashing");
        private ProviderSection sparse = new ProviderSection("term-weight");
        private ProviderSection vlm = new ProviderSection("extractive");
        private ProviderSection rerank = new ProviderSection("none");

        public ProviderSection getEmbedding() {
            return embedding;
        }

        public void setEmbedding(ProviderSection embedding) {
            this.embedding = embedding == null ? new ProviderSection("hashing") : embedding;
        }

        public ProviderSection getSparse() {
            return sparse;
        }

        public void setSparse(ProviderSection sparse) {
            this.sparse = sparse == null ? new ProviderSection("none") : sparse;
        }

        public ProviderSection getVlm() {
            return vlm;
        }

        public void setVlm(ProviderSection vlm) {
            this.vlm = vlm == null ? new ProviderSection("extractive") : vlm;
        }

        public ProviderSection getRerank() {
            return rerank;
        }

        public void setRerank(ProviderSection rerank) {
            this.rerank = rerank == null ? new ProviderSection("none") : rerank;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderSection {
        private String provider;
        private String endpoint;
        private String model;
        private String apiKey;

        public ProviderSection() {
        }

        public ProviderSection(String provider) {
            this.provider = provider;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isEnabled() {
            return provider != null && !provider.isBlank() && !"none".equalsIgnoreCase(provider);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GatewaySection {
        private int embeddingConcurrency = 10;
        private int vlmConcurrency = 100;
        private int rerankConcurrency = 10;
        private int maxAttempts = 3;
        private long initialBackoffMs = 200;
        private long maxBackoffMs = 2000;
        private long acquireTimeoutMs = 0;

        public int getEmbeddingConcurrency() {
            return embeddingConcurrency;
        }

        public void setEmbeddingConcurrency(int embeddingConcurrency) {
            this.embeddingConcurrency = embeddingConcurrency;
        }

        public int getVlmConcurrency() {
            return vlmConcurrency;
        }

        public void setVlmConcurrency(int vlmConcurrency) {
            this.vlmConcurrency = vlmConcurrency;
        }

        public int getRerankConcurrency() {
            return rerankConcurrency;
        }

        public void setRerankConcurrency(int rerankConcurrency) {
            this.rerankConcurrency = rerankConcurrency;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public long getAcquireTimeoutMs() {
            return acquireTimeoutMs;
        }

        public void setAcquireTimeoutMs(long acquireTimeoutMs) {
            this.acquireTimeoutMs = acquireTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContextSection {
        private int maxContextTokens = 6000;
        private int chunkTokens = 1500;
        private int overlapLines = 2;
        private int abstractTokens = 100;
        private int overviewTokens = 2000;

        public int getMaxContextTokens() {
            return maxContextTokens;
        }

        public void setMaxContextTokens(int maxContextTokens) {
            this.maxContextTokens = maxContextTokens;
        }

        public int getChunkTokens() {
            return chunkTokens;
        }

        public void setChunkTokens(int chunkTokens) {
            this.chunkTokens = chunkTokens;
        }

        public int getOverlapLines() {
            return overlapLines;
        }

        public void setOverlapLines(int overlapLines) {
            this.overlapLines = overlapLines;
        }

        public int getAbstractTokens() {
            return abstractTokens;
        }

        public void setAbstractTokens(int abstractTokens) {
            this.abstractTokens = abstractTokens;
        }

        public int getOverviewTokens() {
            return overviewTokens;
        }

        public void setOverviewTokens(int overviewTokens) {
            this.overviewTokens = overviewTokens;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalSection {
        private float sparseWeight = 0f;
        private int candidateMultiplier = 3;
        private int rerankWindow = 20;
        private String fusion = "linear";
        private int rrfK = 60;

        public float getSparseWeight() {
            return sparseWeight;
        }

        public void setSparseWeight(float sparseWeight) {
            this.sparseWeight = sparseWeight;
        }

        public int getCandidateMultiplier() {
            return candidateMultiplier;
        }

        public void setCandidateMultiplier(int candidateMultiplier) {
            this.candidateMultiplier = candidateMultiplier;
        }

        public int getRerankWindow() {
            return rerankWindow;
        }

        public void setRerankWindow(int rerankWindow) {
            this.rerankWindow = rerankWindow;
        }

        public String getFusion() {
            return fusion;
        }

        public void setFusion(String fusion) {
            this.fusion = fusion;
        }

        public int getRrfK() {
            return rrfK;
        }

        public void setRrfK(int rrfK) {
            this.rrfK = rrfK;
        }
    }
}

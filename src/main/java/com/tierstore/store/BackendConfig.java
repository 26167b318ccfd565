package com.tierstore.store;

import java.time.Duration;

import com.tierstore.error.ConfigException;

/**
 * Resolved connection settings for one vector backend. Which fields are required depends on the
 * backend; each adapter's {@code fromConfig} checks its own.
 */
public record BackendConfig(
        String backend,
        String endpoint,
        String accessKey,
        String secretKey,
        String apiKey,
        String name,
        String project,
        String path,
        String region,
        int dimension,
        DistanceMetric distance,
        float sparseWeight,
        Duration timeout) {

    public static final String DEFAULT_COLLECTION_NAME = "context";
    public static final String DEFAULT_PROJECT = "default";

    public BackendConfig {
        backend = backend == null || backend.isBlank() ? "local" : backend.strip();
        name = name == null || name.isBlank() ? DEFAULT_COLLECTION_NAME : name.strip();
        project = project == null || project.isBlank() ? DEFAULT_PROJECT : project.strip();
        distance = distance == null ? DistanceMetric.COSINE : distance;
        timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        if (sparseWeight < 0f) {
            throw new ConfigException("sparse weight must not be negative: " + sparseWeight);
        }
    }

    public static Builder builder(String backend) {
        return new Builder().backend(backend);
    }

    public BackendConfig withName(String collectionName) {
        return new BackendConfig(backend, endpoint, accessKey, secretKey, apiKey, collectionName, project, path,
                region, dimension, distance, sparseWeight, timeout);
    }

    public String requireEndpoint() {
        return require(endpoint, "endpoint");
    }

    public String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("backend '" + backend + "' requires " + field);
        }
        return value.strip();
    }

    @Override
    public String toString() {
        return "BackendConfig{" +
                "backend=" + backend +
                ", endpoint=" + endpoint +
                ", name=" + name +
                ", project=" + project +
                ", path=" + path +
                ", region=" + region +
                ", dimension=" + dimension +
                ", distance=" + distance +
                ", sparseWeight=" + sparseWeight +
                ", timeout=" + timeout +
                ", credentials=" + (accessKey != null || apiKey != null ? "***" : "none") +
                '}';
    }

    public static final class Builder {
        private String backend;
        private String endpoint;
        private String accessKey;
        private String secretKey;
        private String apiKey;
        private String name;
        private String project;
        private String path;
        private String region;
        private int dimension;
        private DistanceMetric distance;
        private float sparseWeight;
        private Duration timeout;

        private Builder() {
        }

        public Builder backend(String backend) {
            this.backend = backend;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder accessKey(String accessKey) {
            this.accessKey = accessKey;
            return this;
        }

        public Builder secretKey(String secretKey) {
            this.secretKey = secretKey;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder dimension(int dimension) {
            this.dimension = dimension;
            return this;
        }

        public Builder distance(DistanceMetric distance) {
            this.distance = distance;
            return this;
        }

        public Builder sparseWeight(float sparseWeight) {
            this.sparseWeight = sparseWeight;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public BackendConfig build() {
            return new BackendConfig(backend, endpoint, accessKey, secretKey, apiKey, name, project, path, region,
                    dimension, distance, sparseWeight, timeout);
        }
    }
}

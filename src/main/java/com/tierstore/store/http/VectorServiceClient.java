package com.tierstore.store.http;

import java.io.IOException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tierstore.error.BackendException;
import com.tierstore.error.ConfigException;
import com.tierstore.runtime.InterruptibleCalls;
import com.tierstore.runtime.RetryExhaustedException;
import com.tierstore.runtime.RetryPolicy;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * JSON-over-HTTP client for a remote vector service. Responses carry their payload under
 * {@code data}; 429, 5xx and I/O failures are transient and retried.
 */
public class VectorServiceClient {
    private static final Logger log = LoggerFactory.getLogger(VectorServiceClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final RequestAuthenticator authenticator;
    private final RetryPolicy retryPolicy;

    public VectorServiceClient(OkHttpClient httpClient, String endpoint, RequestAuthenticator authenticator,
            RetryPolicy retryPolicy) {
        HttpUrl parsed = HttpUrl.parse(endpoint);
        if (parsed == null) {
            throw new ConfigException("invalid vector service endpoint: " + endpoint);
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.baseUrl = parsed;
        this.authenticator = authenticator;
        this.retryPolicy = retryPolicy;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonNode call(String path, Object body) {
        return callOptional(path, body)
                .orElseThrow(() -> new BackendException(path + " returned 404", false));
    }

    /**
     * @return the {@code data} node, or empty when the service answered 404
     */
    public Optional<JsonNode> callOptional(String path, Object body) {
        byte[] payload = encode(path, body);
        try {
            return retryPolicy.execute(path, () -> post(path, payload), VectorServiceClient::isTransient);
        } catch (RetryExhaustedException e) {
            if (e.last() instanceof BackendException backend) {
                throw backend;
            }
            throw new BackendException(path + " failed: " + e.last().getMessage(), false, e.last());
        }
    }

    private Optional<JsonNode> post(String path, byte[] payload) {
        HttpUrl url = resolve(path);
        Request.Builder request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(payload, JSON));
        authenticator.authenticate(request, url.encodedPath(), payload);
        try (Response response = InterruptibleCalls.execute(httpClient.newCall(request.build()))) {
            int status = response.code();
            ResponseBody responseBody = response.body();
            String text = responseBody == null ? "" : responseBody.string();
            if (status == 404) {
                return Optional.empty();
            }
            if (status == 429 || status >= 500) {
                throw new BackendException(path + " returned " + status + ": " + abbreviate(text), true);
            }
            if (!response.isSuccessful()) {
                throw new BackendException(path + " returned " + status + ": " + abbreviate(text), false);
            }
            log.debug("vector service call path={} status={}", path, status);
            JsonNode root = text.isBlank() ? mapper.createObjectNode() : mapper.readTree(text);
            return Optional.of(root.path("data"));
        } catch (JsonProcessingException e) {
            throw new BackendException(path + " returned malformed JSON", false, e);
        } catch (IOException e) {
            throw new BackendException(path + " I/O failure: " + e.getMessage(), true, e);
        }
    }

    private HttpUrl resolve(String path) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : path.split("/")) {
            if (!segment.isBlank()) {
                builder.addPathSegment(segment);
            }
        }
        return builder.build();
    }

    private byte[] encode(String path, Object body) {
        try {
            return mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new BackendException("cannot encode request for " + path, false, e);
        }
    }

    private static boolean isTransient(Exception e) {
        return e instanceof BackendException backend && backend.isTransient();
    }

    private static String abbreviate(String text) {
        return text.length() > 240 ? text.substring(0, 240) + "..." : text;
    }

    @Override
    public String toString() {
        return "VectorServiceClient{" +
                "baseUrl=" + baseUrl +
                ", retryPolicy=" + retryPolicy +
                '}';
    }
}

package com.tierstore.model;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tierstore.runtime.InterruptibleCalls;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Posts JSON to a model endpoint and maps HTTP failures onto {@link ProviderException}.
 */
public class HttpModelClient {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;

    public HttpModelClient(OkHttpClient httpClient, String endpoint, String apiKey) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String endpoint() {
        return endpoint;
    }

    public JsonNode post(Object body) throws ProviderException {
        String payload;
        try {
            payload = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException("cannot encode request for " + endpoint, false, e);
        }
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = InterruptibleCalls.execute(httpClient.newCall(requestBuilder.build()))) {
            ResponseBody responseBody = response.body();
            String text = responseBody == null ? "" : responseBody.string();
            int status = response.code();
            if (status == 408 || status == 429 || status >= 500) {
                throw new ProviderException(endpoint + " returned " + status, true);
            }
            if (!response.isSuccessful()) {
                throw new ProviderException(endpoint + " returned " + status + ": " + text, false);
            }
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProviderException(endpoint + " returned malformed JSON", false, e);
        } catch (IOException e) {
            throw new ProviderException(endpoint + " I/O failure: " + e.getMessage(), true, e);
        }
    }

    @Override
    public String toString() {
        return "HttpModelClient{endpoint=" + endpoint + '}';
    }
}

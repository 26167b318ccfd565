package com.tierstore.store.managed;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.tierstore.error.ConfigException;
import com.tierstore.error.UnsupportedFilterException;
import com.tierstore.filter.FilterExpression;
import com.tierstore.runtime.RetryPolicy;
import com.tierstore.store.AdapterRegistry;
import com.tierstore.store.BackendConfig;
import com.tierstore.store.CollectionHandle;
import com.tierstore.store.DistanceMetric;
import com.tierstore.store.FieldType;
import com.tierstore.store.RecordFields;
import com.tierstore.store.VectorRecord;
import com.tierstore.store.http.FakeVectorService;
import com.tierstore.store.http.VectorServiceClient;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okio.Buffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManagedCollectionAdapterTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC);

    private final FakeVectorService service = new FakeVectorService();

    @Test
    void shouldCreateHnswIndexWithoutDateTimeScalarIndexes() {
        CollectionHandle handle = bound().handle().orElseThrow();

        assertEquals("hnsw", handle.indexMeta().indexType());
        assertFalse(handle.indexMeta().scalarIndexFields().contains(RecordFields.CREATED_AT));
        assertFalse(handle.indexMeta().scalarIndexFields().contains(RecordFields.UPDATED_AT));
        assertTrue(handle.indexMeta().scalarIndexFields().contains(RecordFields.WORKSPACE));
    }

    @Test
    void shouldUseHybridIndexWhenSparseWeightIsSet() {
        ManagedCollectionAdapter adapter = adapter();
        CollectionHandle handle = adapter.ensureCollection(RecordFields.contextSchema("ctx", 3, DistanceMetric.IP, 0.5f));

        assertEquals("hnsw_hybrid", handle.indexMeta().indexType());
        assertTrue(handle.indexMeta().sparseEnabled());
    }

    @Test
    void shouldRejectNegationAndSubstringFilters() {
        ManagedCollectionAdapter adapter = bound();

        UnsupportedFilterException negation = assertThrows(UnsupportedFilterException.class,
                () -> adapter.count(FilterExpression.not(FilterExpression.eq(RecordFields.AGENT, "planner"))));
        assertThrows(UnsupportedFilterException.class,
                () -> adapter.count(FilterExpression.contains(RecordFields.NAME, "kick")));

        assertTrue(negation.getMessage().contains("managed"));
        assertEquals(0, adapter.count(FilterExpression.under(RecordFields.URI, "resource://docs")));
        assertEquals(0, adapter.count(FilterExpression.or(
                FilterExpression.eq(RecordFields.AGENT, "planner"),
                FilterExpression.eq(RecordFields.AGENT, ""))));
    }

    @Test
    void shouldSignEveryRequest() throws IOException {
        bound();
        SigningAuthenticator verifier = new SigningAuthenticator("AK", "SK", "eu-1", CLOCK);

        assertFalse(service.requests().isEmpty());
        for (Request request : service.requests()) {
            Buffer buffer = new Buffer();
            request.body().writeTo(buffer);
            String hash = SigningAuthenticator.sha256Hex(buffer.readByteArray());
            String expectedSignature = verifier.sign(SigningAuthenticator.stringToSign(
                    "POST", request.url().encodedPath(), "20240102T030405Z", hash));

            assertEquals("20240102T030405Z", request.header(SigningAuthenticator.DATE_HEADER));
            assertEquals("eu-1", request.header(SigningAuthenticator.REGION_HEADER));
            assertEquals(hash, request.header(SigningAuthenticator.CONTENT_HASH_HEADER));
            assertEquals("HMAC-SHA256 Credential=AK/20240102/eu-1, Signature=" + expectedSignature,
                    request.header("Authorization"));
        }
    }

    @Test
    void shouldNormalizeValuesReturnedByTheService() {
        ManagedCollectionAdapter adapter = bound();
        adapter.upsert(new VectorRecord("r1", new float[] { 1, 0, 0 }, null, Map.of(
                RecordFields.CREATED_AT, "2024-01-02T03:04:05Z",
                RecordFields.LEVEL, "2",
                RecordFields.URI, "resource://notes/")));

        VectorRecord read = adapter.get("r1").orElseThrow();

        assertEquals(CLOCK.millis(), read.field(RecordFields.CREATED_AT));
        assertEquals(2L, read.field(RecordFields.LEVEL));
        assertEquals("resource://notes", read.field(RecordFields.URI));
    }

    @Test
    void shouldLeaveUnparseableValuesUntouched() {
        assertEquals("yesterday", ManagedCollectionAdapter.normalize(FieldType.DATE_TIME, "yesterday"));
        assertEquals(42L, ManagedCollectionAdapter.normalize(FieldType.INT64, " 42 "));
        assertEquals("n/a", ManagedCollectionAdapter.normalize(FieldType.INT64, "n/a"));
        assertEquals("resource://", ManagedCollectionAdapter.normalize(FieldType.PATH, "resource://"));
        assertEquals("free text/", ManagedCollectionAdapter.normalize(FieldType.STRING, "free text/"));
    }

    @Test
    void shouldRequireCredentialsWhenBuiltFromConfig() {
        AdapterRegistry registry = AdapterRegistry.withDefaults(new OkHttpClient());
        BackendConfig missingSecret = BackendConfig.builder("managed")
                .endpoint("https://vectors.example")
                .accessKey("AK")
                .region("eu-1")
                .dimension(3)
                .build();

        ConfigException error = assertThrows(ConfigException.class, () -> registry.create(missingSecret));
        assertTrue(error.getMessage().contains("secretKey"));
    }

    private ManagedCollectionAdapter bound() {
        ManagedCollectionAdapter adapter = adapter();
        adapter.ensureCollection(RecordFields.contextSchema("ctx", 3, DistanceMetric.COSINE, 0f));
        return adapter;
    }

    private ManagedCollectionAdapter adapter() {
        VectorServiceClient client = new VectorServiceClient(service.client(), "http://vectors.test",
                new SigningAuthenticator("AK", "SK", "eu-1", CLOCK), RetryPolicy.noRetry());
        return new ManagedCollectionAdapter("ctx", "default", client, CLOCK);
    }
}

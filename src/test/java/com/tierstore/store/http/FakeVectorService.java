package com.tierstore.store.http;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tierstore.filter.FilterExpression;
import com.tierstore.filter.FilterValues;
import com.tierstore.store.DistanceMetric;
import com.tierstore.store.VectorMath;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

/**
 * In-memory stand-in for the remote vector service, speaking its JSON protocol and filter DSL.
 */
public class FakeVectorService implements Interceptor {
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {
    };
    private static final TypeReference<List<Object>> LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, Map<String, Object>> infos = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Map<String, Object>>> collections = new ConcurrentHashMap<>();
    private final AtomicInteger creates = new AtomicInteger();
    private final AtomicInteger transientUpsertFailures = new AtomicInteger();
    private final Set<String> rejectedIds = ConcurrentHashMap.newKeySet();
    private final List<Request> requests = new CopyOnWriteArrayList<>();

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public int creates() {
        return creates.get();
    }

    public List<Request> requests() {
        return requests;
    }

    public void rejectIds(String... ids) {
        rejectedIds.addAll(List.of(ids));
    }

    public void failNextUpserts(int count) {
        transientUpsertFailures.set(count);
    }

    /**
     * Stores a record exactly as given, bypassing the upsert path.
     */
    public void storeRaw(String collection, Map<String, Object> record) {
        collections.get(collection).put(String.valueOf(record.get("id")), record);
    }

    public int storedRecords(String collection) {
        return collections.getOrDefault(collection, Map.of()).size();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        requests.add(request);
        Map<String, Object> body = readBody(request);
        String path = request.url().encodedPath();
        String name = String.valueOf(body.get("collection_name"));
        switch (path) {
            case HttpCollectionAdapter.LIST_COLLECTIONS:
                return ok(request, new ArrayList<>(infos.keySet()));
            case HttpCollectionAdapter.COLLECTION_INFO:
                return infos.containsKey(name) ? ok(request, infos.get(name)) : respond(request, 404, Map.of());
            case HttpCollectionAdapter.CREATE_COLLECTION:
                creates.incrementAndGet();
                infos.put(name, new LinkedHashMap<>(body));
                collections.put(name, new ConcurrentHashMap<>());
                return ok(request, Map.of());
            case HttpCollectionAdapter.CREATE_INDEX:
                infos.get(name).put("index", body.get("index"));
                return ok(request, Map.of());
            case HttpCollectionAdapter.DROP_COLLECTION:
                if (infos.remove(name) == null) {
                    return respond(request, 404, Map.of());
                }
                collections.remove(name);
                return ok(request, Map.of());
            default:
                break;
        }
        Map<String, Map<String, Object>> records = collections.get(name);
        if (records == null) {
            return respond(request, 404, Map.of());
        }
        switch (path) {
            case HttpCollectionAdapter.UPSERT:
                if (transientUpsertFailures.getAndUpdate(left -> Math.max(0, left - 1)) > 0) {
                    return respond(request, 503, Map.of("message", "overloaded"));
                }
                return ok(request, upsert(records, castList(body.get("data"))));
            case HttpCollectionAdapter.FETCH:
                return ok(request, castList(body.get("ids")).stream()
                        .map(records::get)
                        .filter(record -> record != null)
                        .toList());
            case HttpCollectionAdapter.DELETE:
                return ok(request, delete(records, castList(body.get("ids"))));
            case HttpCollectionAdapter.AGGREGATE:
                return ok(request, aggregate(records, body));
            case HttpCollectionAdapter.SEARCH_VECTOR:
            case HttpCollectionAdapter.SEARCH_SCALAR:
                return ok(request, search(records, body, DistanceMetric.parse(String.valueOf(infos.get(name).get("distance")))));
            default:
                return respond(request, 400, Map.of("message", "unknown path " + path));
        }
    }

    private Map<String, Object> upsert(Map<String, Map<String, Object>> records, List<Object> data) {
        List<Map<String, Object>> failed = new ArrayList<>();
        for (Object item : data) {
            Map<String, Object> record = mapper.convertValue(item, MAP);
            String id = String.valueOf(record.get("id"));
            if (rejectedIds.contains(id)) {
                failed.add(Map.of("id", id, "reason", "rejected by test"));
            } else {
                records.put(id, record);
            }
        }
        return Map.of("failed", failed);
    }

    private Map<String, Object> delete(Map<String, Map<String, Object>> records, List<Object> ids) {
        List<Map<String, Object>> failed = new ArrayList<>();
        for (Object id : ids) {
            if (rejectedIds.contains(String.valueOf(id))) {
                failed.add(Map.of("id", String.valueOf(id), "reason", "rejected by test"));
            } else {
                records.remove(String.valueOf(id));
            }
        }
        return Map.of("failed", failed);
    }

    private Map<String, Object> aggregate(Map<String, Map<String, Object>> records, Map<String, Object> body) {
        List<Map<String, Object>> matching = matching(records, body.get("filter"));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("_total", matching.size());
        Object groupBy = body.get("group_by");
        if (groupBy != null) {
            Map<String, Integer> groups = new TreeMap<>();
            for (Map<String, Object> record : matching) {
                groups.merge(String.valueOf(fields(record).get(groupBy)), 1, Integer::sum);
            }
            data.put("groups", groups);
        }
        return data;
    }

    private List<Map<String, Object>> search(Map<String, Map<String, Object>> records, Map<String, Object> body,
            DistanceMetric distance) {
        float[] dense = floats(body.get("dense_vector"));
        Map<String, Float> sparse = sparse(body.get("sparse_vector"));
        List<Map<String, Object>> scored = new ArrayList<>();
        for (Map<String, Object> record : matching(records, body.get("filter"))) {
            Map<String, Object> hit = new LinkedHashMap<>(record);
            float score = 0f;
            if (dense != null) {
                score = VectorMath.similarity(distance, dense, floats(record.get("vector")));
            } else if (sparse != null) {
                score = VectorMath.sparseDot(sparse, sparse(record.get("sparse_vector")));
                if (score <= 0f) {
                    continue;
                }
            }
            hit.put("score", score);
            if (!Boolean.TRUE.equals(body.get("output_vectors"))) {
                hit.remove("vector");
                hit.remove("sparse_vector");
            }
            scored.add(hit);
        }
        Comparator<Map<String, Object>> order = Comparator.comparing(hit -> String.valueOf(hit.get("id")));
        if (dense != null || sparse != null) {
            order = Comparator.<Map<String, Object>, Double>comparing(hit -> ((Number) hit.get("score")).doubleValue())
                    .reversed()
                    .thenComparing(order);
        }
        scored.sort(order);
        int offset = ((Number) body.getOrDefault("offset", 0)).intValue();
        int limit = ((Number) body.getOrDefault("limit", 10)).intValue();
        return scored.stream().skip(offset).limit(limit).toList();
    }

    private List<Map<String, Object>> matching(Map<String, Map<String, Object>> records, Object filter) {
        List<Map<String, Object>> matching = new ArrayList<>();
        for (Map<String, Object> record : records.values()) {
            if (filter == null || matches(mapper.convertValue(filter, MAP), fields(record))) {
                matching.add(record);
            }
        }
        return matching;
    }

    private boolean matches(Map<String, Object> node, Map<String, Object> fields) {
        if (node.isEmpty()) {
            return true;
        }
        String op = String.valueOf(node.get("op"));
        Object value = fields.get(String.valueOf(node.get("field")));
        switch (op) {
            case "must":
                return castList(node.get("conds")).stream().anyMatch(expected -> FilterValues.matchesEq(value, expected));
            case "must_not":
                return castList(node.get("conds")).stream().noneMatch(expected -> FilterValues.matchesEq(value, expected));
            case "range":
                return FilterValues.inRange(value, new FilterExpression.Range(String.valueOf(node.get("field")),
                        node.get("gte"), node.get("gt"), node.get("lte"), node.get("lt")));
            case "contains":
                return value != null && value.toString().contains(String.valueOf(node.get("substring")));
            case "prefix":
                return value != null && value.toString().startsWith(String.valueOf(node.get("prefix")));
            case "and":
                return castList(node.get("conds")).stream()
                        .allMatch(child -> matches(mapper.convertValue(child, MAP), fields));
            case "or":
                return castList(node.get("conds")).stream()
                        .anyMatch(child -> matches(mapper.convertValue(child, MAP), fields));
            default:
                throw new IllegalArgumentException("unknown filter op " + op);
        }
    }

    private Map<String, Object> fields(Map<String, Object> record) {
        Object fields = record.get("fields");
        return fields instanceof Map<?, ?> ? mapper.convertValue(fields, MAP) : Map.of();
    }

    private List<Object> castList(Object value) {
        return value instanceof List<?> ? mapper.convertValue(value, LIST) : List.of();
    }

    private static float[] floats(Object value) {
        if (!(value instanceof List<?> list)) {
            return null;
        }
        float[] out = new float[list.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = ((Number) list.get(i)).floatValue();
        }
        return out;
    }

    private static Map<String, Float> sparse(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, Float> out = new LinkedHashMap<>();
        map.forEach((key, weight) -> out.put(String.valueOf(key), ((Number) weight).floatValue()));
        return out;
    }

    private Map<String, Object> readBody(Request request) throws IOException {
        if (request.body() == null) {
            return Map.of();
        }
        Buffer buffer = new Buffer();
        request.body().writeTo(buffer);
        String text = buffer.readUtf8();
        return text.isBlank() ? Map.of() : mapper.readValue(text, MAP);
    }

    private Response ok(Request request, Object data) throws IOException {
        return respond(request, 200, Map.of("data", data));
    }

    private Response respond(Request request, int code, Object payload) throws IOException {
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message(code == 200 ? "OK" : "Error")
                .body(ResponseBody.create(mapper.writeValueAsString(payload), JSON))
                .build();
    }

    Set<String> collectionNames() {
        return new HashSet<>(infos.keySet());
    }
}

package com.tierstore.store.local;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Stream;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tierstore.filter.FilterValues;
import com.tierstore.store.AggregateResult;
import com.tierstore.store.AggregateSpec;
import com.tierstore.store.CollectionSchema;
import com.tierstore.store.IndexMeta;
import com.tierstore.store.RecordFields;
import com.tierstore.store.ScoredRecord;
import com.tierstore.store.VectorMath;
import com.tierstore.store.VectorQuery;
import com.tierstore.store.VectorRecord;

/**
 * Brute-force in-memory collection. When it has a directory, every mutation rewrites
 * {@code records.json} next to {@code collection_meta.json}.
 */
class LocalCollection {
    static final String META_FILE = "collection_meta.json";
    static final String RECORDS_FILE = "records.json";

    private final CollectionMeta meta;
    private final Path directory;
    private final ObjectMapper mapper;
    private final Map<String, VectorRecord> records = new ConcurrentHashMap<>();
    private final Object persistLock = new Object();

    LocalCollection(CollectionMeta meta, Path directory, ObjectMapper mapper) {
        this.meta = meta;
        this.directory = directory;
        this.mapper = mapper;
    }

    static LocalCollection load(Path directory, ObjectMapper mapper) throws IOException {
        CollectionMeta meta = mapper.readValue(directory.resolve(META_FILE).toFile(), CollectionMeta.class);
        LocalCollection collection = new LocalCollection(meta, directory, mapper);
        Path recordsFile = directory.resolve(RECORDS_FILE);
        if (Files.exists(recordsFile)) {
            List<VectorRecord> loaded = mapper.readValue(recordsFile.toFile(), new TypeReference<List<VectorRecord>>() {
            });
            for (VectorRecord record : loaded) {
                collection.records.put(record.id(), record);
            }
        }
        return collection;
    }

    CollectionMeta meta() {
        return meta;
    }

    CollectionSchema schema() {
        return meta.toSchema();
    }

    IndexMeta indexMeta() {
        return meta.index();
    }

    int size() {
        return records.size();
    }

    void put(VectorRecord record) {
        Map<String, Object> fields = new LinkedHashMap<>(record.fields());
        fields.put(RecordFields.ID, record.id());
        records.put(record.id(), record.withFields(fields));
    }

    VectorRecord get(String id) {
        return records.get(id);
    }

    boolean remove(String id) {
        return records.remove(id) != null;
    }

    List<ScoredRecord> search(VectorQuery query, Predicate<Map<String, Object>> filter) {
        Stream<VectorRecord> matching = records.values().stream().filter(record -> filter.test(record.fields()));
        Stream<ScoredRecord> scored;
        Comparator<ScoredRecord> order;
        if (query.isDense()) {
            scored = matching
                    .filter(record -> record.dense() != null)
                    .map(record -> new ScoredRecord(record, VectorMath.similarity(meta.distance(), query.dense(), record.dense())));
            order = byScoreThenId();
        } else if (query.isSparse()) {
            scored = matching
                    .map(record -> new ScoredRecord(record, VectorMath.sparseDot(query.sparse(), record.sparse())))
                    .filter(result -> result.score() > 0f);
            order = byScoreThenId();
        } else {
            scored = matching.map(record -> new ScoredRecord(record, 0f));
            order = query.orderBy() == null
                    ? Comparator.comparing(result -> result.record().id())
                    : byField(query.orderBy(), query.orderDescending());
        }
        return scored
                .sorted(order)
                .skip(query.offset())
                .limit(query.limit())
                .map(result -> query.withVectors() ? result : new ScoredRecord(result.record().withoutVectors(), result.score()))
                .toList();
    }

    AggregateResult aggregate(Predicate<Map<String, Object>> filter, AggregateSpec spec) {
        List<VectorRecord> matching = records.values().stream()
                .filter(record -> filter.test(record.fields()))
                .toList();
        double total = reduce(matching, spec);
        Map<String, Double> groups = new TreeMap<>();
        if (spec.groupBy() != null) {
            Map<String, List<VectorRecord>> buckets = new TreeMap<>();
            for (VectorRecord record : matching) {
                Object key = record.field(spec.groupBy());
                buckets.computeIfAbsent(key == null ? "" : key.toString(), unused -> new ArrayList<>()).add(record);
            }
            buckets.forEach((key, bucket) -> groups.put(key, reduce(bucket, spec)));
        }
        return new AggregateResult(spec, total, groups);
    }

    void flush() throws IOException {
        if (directory == null) {
            return;
        }
        synchronized (persistLock) {
            Files.createDirectories(directory);
            Path target = directory.resolve(RECORDS_FILE);
            Path temp = directory.resolve(RECORDS_FILE + ".tmp");
            List<VectorRecord> snapshot = records.values().stream()
                    .sorted(Comparator.comparing(VectorRecord::id))
                    .toList();
            mapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
    }

    void writeMeta() throws IOException {
        if (directory == null) {
            return;
        }
        Files.createDirectories(directory);
        mapper.writerWithDefaultPrettyPrinter().writeValue(directory.resolve(META_FILE).toFile(), meta);
    }

    private static double reduce(List<VectorRecord> records, AggregateSpec spec) {
        if (spec.op() == AggregateSpec.Op.COUNT) {
            return records.size();
        }
        double[] values = records.stream()
                .map(record -> record.field(spec.field()))
                .filter(value -> value instanceof Number)
                .mapToDouble(value -> ((Number) value).doubleValue())
                .toArray();
        return switch (spec.op()) {
            case SUM -> Arrays.stream(values).sum();
            case MIN -> Arrays.stream(values).min().orElse(Double.NaN);
            case MAX -> Arrays.stream(values).max().orElse(Double.NaN);
            case COUNT -> records.size();
        };
    }

    private static Comparator<ScoredRecord> byScoreThenId() {
        return Comparator.comparing(ScoredRecord::score, Comparator.reverseOrder())
                .thenComparing(result -> result.record().id());
    }

    private static Comparator<ScoredRecord> byField(String field, boolean descending) {
        Comparator<ScoredRecord> byValue = (left, right) -> {
            Object a = left.record().field(field);
            Object b = right.record().field(field);
            if (a == null || b == null) {
                return a == null ? (b == null ? 0 : 1) : -1;
            }
            Integer comparison = FilterValues.compare(a, b);
            int result = comparison == null ? a.toString().compareTo(b.toString()) : comparison;
            return descending ? -result : result;
        };
        return byValue.thenComparing(result -> result.record().id());
    }
}

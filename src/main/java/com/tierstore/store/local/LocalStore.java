package com.tierstore.store.local;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tierstore.error.BackendException;

/**
 * In-process project holding named collections, optionally persisted under a root directory with
 * one sub-directory per collection.
 */
public final class LocalStore {
    private static final Logger log = LoggerFactory.getLogger(LocalStore.class);

    private final Path root;
    private final ObjectMapper mapper;
    private final Map<String, LocalCollection> collections = new ConcurrentHashMap<>();

    private LocalStore(Path root) {
        this.root = root;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static LocalStore inMemory() {
        return new LocalStore(null);
    }

    public static LocalStore open(Path root) {
        return new LocalStore(root);
    }

    public boolean isPersistent() {
        return root != null;
    }

    Optional<LocalCollection> find(String name) {
        LocalCollection cached = collections.get(name);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (root == null) {
            return Optional.empty();
        }
        Path directory = root.resolve(name);
        if (!Files.exists(directory.resolve(LocalCollection.META_FILE))) {
            return Optional.empty();
        }
        try {
            LocalCollection loaded = LocalCollection.load(directory, mapper);
            LocalCollection winner = collections.putIfAbsent(name, loaded);
            log.debug("Loaded local collection {} records={}", name, loaded.size());
            return Optional.of(winner == null ? loaded : winner);
        } catch (IOException e) {
            throw new BackendException("failed to load local collection " + name + " from " + directory, false, e);
        }
    }

    boolean exists(String name) {
        return collections.containsKey(name)
                || (root != null && Files.exists(root.resolve(name).resolve(LocalCollection.META_FILE)));
    }

    LocalCollection create(CollectionMeta meta) {
        Path directory = root == null ? null : root.resolve(meta.name());
        LocalCollection created = collections.computeIfAbsent(meta.name(), name -> new LocalCollection(meta, directory, mapper));
        try {
            created.writeMeta();
        } catch (IOException e) {
            collections.remove(meta.name(), created);
            throw new BackendException("failed to write collection meta for " + meta.name(), false, e);
        }
        return created;
    }

    boolean drop(String name) {
        boolean removed = collections.remove(name) != null;
        if (root == null) {
            return removed;
        }
        Path directory = root.resolve(name);
        if (!Files.exists(directory)) {
            return removed;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            throw new BackendException("failed to delete local collection directory " + directory, false, e);
        }
        return true;
    }

    @Override
    public String toString() {
        return "LocalStore{root=" + (root == null ? "memory" : root) + ", collections=" + collections.keySet() + '}';
    }
}

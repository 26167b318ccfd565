package com.tierstore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tierstore.context.ContentType;
import com.tierstore.context.ContextLayer;
import com.tierstore.context.FileSystemContentFetcher;
import com.tierstore.context.LayerPayload;
import com.tierstore.context.ResourceId;
import com.tierstore.context.ResourceInput;
import com.tierstore.error.TierStoreException;
import com.tierstore.ingest.IngestionOutcome;
import com.tierstore.registry.TenantScope;
import com.tierstore.retrieve.SearchRequest;
import com.tierstore.retrieve.SearchResult;
import com.tierstore.runtime.AppConfig;
import com.tierstore.runtime.KnowledgeStoreFactory;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "tierstore",
        mixinStandardHelpOptions = true,
        version = "tierstore 0.1.0",
        description = "Layered context store with hybrid retrieval.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final Map<String, String> MIME_TYPES = Map.of(
            "txt", "text/plain",
            "md", "text/markdown",
            "markdown", "text/markdown",
            "png", "image/png",
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "gif", "image/gif",
            "webp", "image/webp");

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "stats")
    Mode mode;

    @Option(names = "--workspace", description = "Workspace the command runs in", defaultValue = "default")
    String workspace;

    @Option(names = "--agent", description = "Agent within the workspace; omit for workspace-shared data")
    String agent;

    @Option(names = "--path", description = "File or directory to ingest")
    Path path;

    @Option(names = "--query", description = "Query text used in search mode")
    String query;

    @Option(names = "--top-k", description = "Top results to return", defaultValue = "5")
    int topK;

    @Option(names = "--uri", description = "Resource URI for layer and remove modes")
    String uri;

    @Option(names = "--dir", description = "Directory URI that scopes search mode, or whose resources remove mode deletes")
    List<String> directories;

    @Option(names = "--layer", description = "Layer to print in layer mode: ${COMPLETION-CANDIDATES}", defaultValue = "L1")
    ContextLayer layer;

    @Option(names = "--threads", description = "Concurrent ingestion workers", defaultValue = "4")
    int threads;

    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        ingest,
        search,
        layer,
        stats,
        remove
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        TenantScope scope = TenantScope.of(workspace, agent);
        log.info("Starting tierstore in {} mode", mode);
        log.info("Using config file: {}", configPath);

        try (KnowledgeStore store = KnowledgeStoreFactory.create(config, httpClient, new FileSystemContentFetcher())) {
            return switch (mode) {
                case ingest -> runIngest(store, scope);
                case search -> runSearch(store, scope);
                case layer -> runLayer(store, scope);
                case stats -> runStats(store, scope);
                case remove -> runRemove(store, scope);
            };
        } catch (TierStoreException e) {
            log.error("Command failed code={} message={}", e.code(), e.getMessage());
            return 1;
        } finally {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    private int runIngest(KnowledgeStore store, TenantScope scope) throws IOException {
        if (path == null || !Files.exists(path)) {
            log.error("--path must name an existing file or directory in ingest mode");
            return 2;
        }
        List<ResourceInput> inputs = collectInputs(path, scope);
        if (inputs.isEmpty()) {
            log.warn("No ingestible files under {}", path);
            return 0;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threads));
        try {
            List<IngestionOutcome> outcomes = store.ingestBatch(inputs, executor);
            long failed = outcomes.stream().filter(outcome -> !outcome.succeeded()).count();
            for (IngestionOutcome outcome : outcomes) {
                if (!outcome.succeeded()) {
                    log.warn("Failed uri={} reason={}", outcome.input().uri(), outcome.error().getMessage());
                }
            }
            log.info("Indexed resources: processed={}, failed={}, workspace={}", outcomes.size() - failed, failed, scope);
            return failed == 0 ? 0 : 1;
        } finally {
            executor.shutdownNow();
        }
    }

    private int runSearch(KnowledgeStore store, TenantScope scope) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in search mode");
            return 2;
        }
        List<SearchResult> results = store.search(SearchRequest.of(scope, query, topK).withTargetDirectories(directories));
        for (int i = 0; i < results.size(); i++) {
            SearchResult result = results.get(i);
            log.info("Result #{} score={} layer={} uri={} abstract={}",
                    i + 1,
                    String.format(Locale.ROOT, "%.4f", result.score()),
                    result.layer(),
                    result.uri(),
                    result.abstractText());
        }
        if (results.isEmpty()) {
            log.info("No results for query in workspace {}", scope);
        }
        return 0;
    }

    private int runLayer(KnowledgeStore store, TenantScope scope) {
        if (uri == null || uri.isBlank()) {
            log.error("--uri is required in layer mode");
            return 2;
        }
        LayerPayload payload = store.getLayer(new ResourceId(scope, uri), layer);
        log.info("{}", payload);
        if (!payload.text().isEmpty()) {
            log.info("{}:\n{}", layer, payload.text());
        }
        return 0;
    }

    private int runStats(KnowledgeStore store, TenantScope scope) {
        Map<ContextLayer, Long> counts = store.stats(scope);
        log.info("Records workspace={} l0={} l1={} l2={}",
                scope,
                counts.get(ContextLayer.L0),
                counts.get(ContextLayer.L1),
                counts.get(ContextLayer.L2));
        return 0;
    }

    private int runRemove(KnowledgeStore store, TenantScope scope) {
        if ((uri == null || uri.isBlank()) && directories != null && !directories.isEmpty()) {
            int removed = 0;
            for (String directory : directories) {
                removed += store.removeTree(scope, directory);
            }
            log.info("Removed {} records under {}", removed, directories);
            return 0;
        }
        if (uri == null || uri.isBlank()) {
            log.error("--uri or --dir is required in remove mode");
            return 2;
        }
        int removed = store.remove(new ResourceId(scope, uri));
        log.info("Removed {} records for {}", removed, uri);
        return 0;
    }

    static List<ResourceInput> collectInputs(Path root, TenantScope scope) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isRegularFile(root)) {
            files.add(root);
        } else {
            try (Stream<Path> walk = Files.walk(root)) {
                walk.filter(Files::isRegularFile).sorted().forEach(files::add);
            }
        }
        Path base = Files.isRegularFile(root) ? root.toAbsolutePath().getParent() : root.toAbsolutePath();
        List<ResourceInput> inputs = new ArrayList<>();
        for (Path file : files) {
            String mimeType = MIME_TYPES.get(extension(file));
            if (mimeType == null) {
                log.debug("Skipping unsupported file {}", file);
                continue;
            }
            String resourceUri = "resource://" + base.relativize(file.toAbsolutePath()).toString().replace('\\', '/');
            inputs.add(ResourceInput.stored(scope, resourceUri, ContentType.fromMimeType(mimeType),
                    file.toAbsolutePath().toUri().toString(), mimeType));
        }
        return inputs;
    }

    private static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}

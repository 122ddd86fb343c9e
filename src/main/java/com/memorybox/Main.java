package com.memorybox;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.memorybox.embed.Embedder;
import com.memorybox.embed.ModelAdapters;
import com.memorybox.embed.Ranker;
import com.memorybox.error.LibraryUsageException;
import com.memorybox.error.LockContentionException;
import com.memorybox.library.CancellationToken;
import com.memorybox.library.ImageContentReader;
import com.memorybox.library.Libraries;
import com.memorybox.library.Library;
import com.memorybox.library.LibraryMetadata;
import com.memorybox.library.ProgressReporter;
import com.memorybox.library.ScanReport;
import com.memorybox.retrieval.MessageHistoryCorpus;
import com.memorybox.retrieval.RetrievalPipeline;
import com.memorybox.runtime.AppConfig;
import com.memorybox.store.ItemRecord;
import com.memorybox.task.TaskHandle;
import com.memorybox.task.TaskRunner;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "memory-box",
        mixinStandardHelpOptions = true,
        version = "memory-box 0.1.0",
        description = "Indexes personal libraries and queries message history.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_USAGE_ERROR = 2;
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", required = true,
            converter = ModeConverter.class, completionCandidates = ModeCandidates.class)
    Mode mode;

    @Option(names = "--library-root", description = "Folder of the library to scan or search")
    Path libraryRoot;

    @Option(names = "--library-name", description = "Display name of the library")
    String libraryName;

    @Option(names = "--library-uuid", description = "Library id; read from the library metadata when omitted")
    String libraryUuid;

    @Option(names = "--library-type", description = "Library type: image or document", defaultValue = Libraries.DOCUMENT)
    String libraryType;

    @Option(names = "--force", description = "Purge and rebuild a library that is already initialized", defaultValue = "false")
    boolean force;

    @Option(names = "--query", description = "Query text, or an image path when searching an image library")
    String query;

    @Option(names = "--top-k", description = "Top results to return", defaultValue = "5")
    int topK;

    @Option(names = "--index-path", description = "Path of the retrieval index", defaultValue = ".memorybox/retrieval-index.json")
    Path indexPath;

    @Option(names = "--corpus-id", description = "Message history corpus to index")
    String corpusId;

    @Option(names = "--raw-source", description = "Message export to import before building the index")
    Path rawSource;

    @Parameters(arity = "0..*", description = "Relative paths for remove mode")
    List<String> paths = new ArrayList<>();

    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        SCAN("scan"),
        INCREMENTAL("incremental"),
        SEARCH("search"),
        REMOVE("remove"),
        BUILD_INDEX("build-index"),
        QUERY("query"),
        DEMOLISH("demolish");

        private final String label;

        Mode(String label) {
            this.label = label;
        }

        static Mode fromLabel(String label) {
            for (Mode mode : values()) {
                if (mode.label.equalsIgnoreCase(label)) {
                    return mode;
                }
            }
            throw new CommandLine.TypeConversionException("Unknown mode '" + label + "'");
        }

        @Override
        public String toString() {
            return label;
        }
    }

    static class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            return Mode.fromLabel(value);
        }
    }

    static class ModeCandidates implements Iterable<String> {
        @Override
        public Iterator<String> iterator() {
            return Arrays.stream(Mode.values()).map(Mode::toString).iterator();
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting memory-box in {} mode", mode);
        log.info("Using config file: {}", configPath);
        log.debug("HTTP client configured: {}", httpClient.connectionPool());

        try {
            return switch (mode) {
                case SCAN, INCREMENTAL -> runScan(config);
                case SEARCH -> runSearch(config);
                case REMOVE -> runRemove(config);
                case BUILD_INDEX, QUERY -> runRetrieval(config);
                case DEMOLISH -> runDemolish(config);
            };
        } catch (LibraryUsageException | LockContentionException e) {
            log.error("{}", e.getMessage());
            return EXIT_USAGE_ERROR;
        }
    }

    private int runScan(AppConfig config) throws Exception {
        Library<?> library = openLibrary(config);
        if (library == null) {
            return EXIT_USAGE_ERROR;
        }
        try (TaskRunner runner = new TaskRunner(1)) {
            TaskHandle<ScanReport> handle = runner.submit(mode.toString(), (reporter, token) -> mode == Mode.SCAN
                    ? library.initialize(force, reporter, token)
                    : library.incrementalInitialize(reporter, token));
            Thread cancelOnExit = new Thread(cancelAndWait(handle, SHUTDOWN_GRACE), "memory-box-cancel");
            Runtime.getRuntime().addShutdownHook(cancelOnExit);
            try {
                while (!handle.await(5, TimeUnit.SECONDS)) {
                    log.info("Scan of {} at {}%", library.root(), handle.progress());
                }
            } finally {
                removeShutdownHook(cancelOnExit);
            }
            if (handle.failure().isPresent()) {
                Throwable failure = handle.failure().get();
                if (failure instanceof Exception exception) {
                    throw exception;
                }
                throw new IllegalStateException(failure);
            }
            if (handle.result().isEmpty()) {
                log.warn("Scan of {} ended as {}", library.root(), handle.state());
                return 0;
            }
            ScanReport report = handle.result().get();
            log.info("Scan finished: mode={} status={} discovered={} embedded={} removed={} invalid={}",
                    report.mode(),
                    report.status(),
                    report.discoveredFiles(),
                    report.embeddedFiles(),
                    report.removedFiles(),
                    report.invalidFiles());
            return 0;
        }
    }

    private int runSearch(AppConfig config) throws Exception {
        if (query == null || query.isBlank()) {
            log.error("--query is required in search mode");
            return EXIT_USAGE_ERROR;
        }
        LibraryIdentity identity = resolveIdentity(config);
        if (identity == null) {
            return EXIT_USAGE_ERROR;
        }
        List<ItemRecord> results;
        if (Libraries.IMAGE.equals(identity.type())) {
            BufferedImage image = new ImageContentReader().read(Path.of(query));
            Library<BufferedImage> images = Libraries.imageLibrary(libraryRoot, identity.name(), identity.uuid(), config);
            images.initialize(false, ProgressReporter.NONE, CancellationToken.none());
            results = images.searchByContent(image, topK);
        } else if (Libraries.DOCUMENT.equals(identity.type())) {
            Library<String> documents = Libraries.documentLibrary(libraryRoot, identity.name(), identity.uuid(), config,
                    ModelAdapters.textEmbedder(config.getEmbedding(), httpClient));
            documents.initialize(false, ProgressReporter.NONE, CancellationToken.none());
            results = documents.searchByContent(query, topK);
        } else {
            log.error("Unknown library type '{}'", identity.type());
            return EXIT_USAGE_ERROR;
        }
        for (int i = 0; i < results.size(); i++) {
            ItemRecord record = results.get(i);
            log.info("Result #{} uuid={} path={}", i + 1, record.uuid(), record.relativePath());
        }
        return 0;
    }

    private int runRemove(AppConfig config) throws IOException {
        if (paths.isEmpty()) {
            log.error("At least one relative path is required in remove mode");
            return EXIT_USAGE_ERROR;
        }
        Library<?> library = openLibrary(config);
        if (library == null) {
            return EXIT_USAGE_ERROR;
        }
        library.initialize(false, ProgressReporter.NONE, CancellationToken.none());
        int removed = library.removeEmbeddings(paths);
        log.info("Removed {} of {} requested embeddings", removed, paths.size());
        return 0;
    }

    private int runDemolish(AppConfig config) throws IOException {
        Library<?> library = openLibrary(config);
        if (library == null) {
            return EXIT_USAGE_ERROR;
        }
        library.demolish();
        return 0;
    }

    private int runRetrieval(AppConfig config) throws IOException {
        if (mode == Mode.QUERY && (query == null || query.isBlank())) {
            log.error("--query is required in query mode");
            return EXIT_USAGE_ERROR;
        }
        Path corpusFolder = indexPath.toAbsolutePath().getParent();
        Embedder<String> embedder = ModelAdapters.textEmbedder(config.getEmbedding(), httpClient);
        Ranker ranker = ModelAdapters.ranker(config.getRanker(), httpClient);
        if (mode == Mode.BUILD_INDEX) {
            if (corpusId == null || corpusId.isBlank()) {
                log.error("--corpus-id is required in build-index mode");
                return EXIT_USAGE_ERROR;
            }
            Files.deleteIfExists(indexPath);
        }
        try (RetrievalPipeline pipeline = new RetrievalPipeline(embedder, ranker, config.getRetrieval(),
                (id, raw) -> MessageHistoryCorpus.open(corpusFolder, id, raw))) {
            pipeline.initialize(indexPath, corpusId, rawSource);
            if (mode == Mode.QUERY) {
                List<String> answers = pipeline.query(query, topK);
                for (int i = 0; i < answers.size(); i++) {
                    log.info("Result #{} {}", i + 1, answers.get(i));
                }
            }
        }
        return 0;
    }

    private Library<?> openLibrary(AppConfig config) throws IOException {
        LibraryIdentity identity = resolveIdentity(config);
        if (identity == null) {
            return null;
        }
        if (Libraries.IMAGE.equals(identity.type())) {
            return Libraries.imageLibrary(libraryRoot, identity.name(), identity.uuid(), config);
        }
        if (Libraries.DOCUMENT.equals(identity.type())) {
            return Libraries.documentLibrary(libraryRoot, identity.name(), identity.uuid(), config,
                    ModelAdapters.textEmbedder(config.getEmbedding(), httpClient));
        }
        log.error("Unknown library type '{}'", identity.type());
        return null;
    }

    /** Command-line values first, then the stored library metadata, then defaults. */
    private LibraryIdentity resolveIdentity(AppConfig config) throws IOException {
        if (libraryRoot == null) {
            log.error("--library-root is required in {} mode", mode);
            return null;
        }
        Path dataFolder = libraryRoot.resolve(config.getLibrary().getDataFolder());
        LibraryMetadata stored = LibraryMetadata.exists(dataFolder) ? LibraryMetadata.load(dataFolder) : null;
        String uuid = libraryUuid != null ? libraryUuid : stored != null ? stored.uuid() : UUID.randomUUID().toString();
        String name = libraryName != null ? libraryName
                : stored != null ? stored.name() : libraryRoot.toAbsolutePath().normalize().getFileName().toString();
        String type = stored != null ? stored.type() : libraryType;
        return new LibraryIdentity(uuid, name, type);
    }

    private record LibraryIdentity(String uuid, String name, String type) {
    }

    /**
     * Shutdown action for a running scan: cancels it, then waits up to {@code grace} so the scan
     * can roll back its writes before the JVM halts.
     */
    static Runnable cancelAndWait(TaskHandle<?> handle, Duration grace) {
        return () -> {
            handle.cancel();
            try {
                if (!handle.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Task {} did not finish its rollback within {}s", handle.id(), grace.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, keeping cancel hook");
        }
    }
}

package com.memorybox.library;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memorybox.embed.Embedder;
import com.memorybox.error.ItemValidationException;
import com.memorybox.error.LibraryUsageException;
import com.memorybox.error.ScanCancelledException;
import com.memorybox.runtime.AppConfig;
import com.memorybox.store.ItemRecord;
import com.memorybox.store.MetadataStore;
import com.memorybox.store.VectorMatch;
import com.memorybox.store.VectorStore;
import com.memorybox.store.VectorStoreFactory;

/**
 * A folder of files made similarity-searchable. The library keeps an item table, a vector index
 * and a scan profile in its data folder and keeps them consistent: for every path in the scan
 * profile there is exactly one item record and one vector, keyed by the same uuid.
 * <p>
 * {@link #initialize}, {@link #incrementalInitialize} and {@link #demolish} are serialized by a
 * non-blocking lock. Searches are not gated by it and may observe a scan in progress.
 */
public class Library<T> {
    private static final Logger log = LoggerFactory.getLogger(Library.class);

    private final Path root;
    private final Path dataFolder;
    private final ContentReader<T> contentReader;
    private final VectorStoreFactory vectorStoreFactory;
    private final LibraryWalker walker;
    private final int batchSize;
    private final Clock clock;
    private final ScanLock scanLock = new ScanLock();
    private final ScanProfile profile;

    private volatile LibraryMetadata metadata;
    private volatile Embedder<T> embedder;
    private volatile MetadataStore metadataStore;
    private volatile VectorStore vectorStore;
    private volatile boolean initialized;
    private volatile boolean demolished;

    public Library(Path root,
            String name,
            String uuid,
            String type,
            ContentReader<T> contentReader,
            VectorStoreFactory vectorStoreFactory,
            AppConfig.LibraryConfig settings) throws IOException {
        this(root, name, uuid, type, contentReader, vectorStoreFactory, settings, Clock.systemDefaultZone());
    }

    Library(Path root,
            String name,
            String uuid,
            String type,
            ContentReader<T> contentReader,
            VectorStoreFactory vectorStoreFactory,
            AppConfig.LibraryConfig settings,
            Clock clock) throws IOException {
        if (uuid == null || uuid.isBlank() || name == null || name.isBlank()) {
            throw new LibraryUsageException("A library needs a uuid and a name");
        }
        if (!Files.isDirectory(root)) {
            throw new LibraryUsageException("Library root is not a directory: " + root);
        }
        this.root = root.toAbsolutePath().normalize();
        this.dataFolder = this.root.resolve(settings.getDataFolder());
        this.contentReader = contentReader;
        this.vectorStoreFactory = vectorStoreFactory;
        this.batchSize = settings.getBatchSize();
        this.clock = clock;

        Set<String> exclusions = new TreeSet<>(settings.getExclusions());
        exclusions.add(dataFolder.getFileName().toString());
        this.walker = new LibraryWalker(exclusions);

        this.metadata = loadOrCreateMetadata(uuid, name, type);
        this.profile = ScanProfile.load(dataFolder);
        log.info("Library '{}' ({}) opened at {}, {} files embedded", metadata.name(), metadata.uuid(), this.root, profile.size());
    }

    public void setEmbedder(Embedder<T> embedder) {
        this.embedder = embedder;
    }

    public boolean isReady() {
        return !demolished
                && initialized
                && LibraryMetadata.exists(dataFolder)
                && metadataStore != null
                && vectorStore != null
                && embedder != null;
    }

    /**
     * Embeds every file of the library. A ready library is left untouched unless
     * {@code forceReInit} is set, in which case it is rebuilt and the previous items are
     * replaced once the new scan commits.
     *
     * @return the outcome; a cancelled scan returns a {@link ScanReport.ScanStatus#CANCELLED}
     *         report after its writes have been rolled back
     */
    public ScanReport initialize(boolean forceReInit, ProgressReporter progressReporter, CancellationToken cancelToken)
            throws IOException {
        try (ScanLock.Guard guard = scanLock.acquire("initialize")) {
            return initializeLocked(forceReInit, progressReporter, cancelToken);
        }
    }

    /**
     * Embeds the files added since the last scan and drops the ones that disappeared. Falls back
     * to a forced full scan when nothing has been embedded yet.
     */
    public ScanReport incrementalInitialize(ProgressReporter progressReporter, CancellationToken cancelToken)
            throws IOException {
        try (ScanLock.Guard guard = scanLock.acquire("run an incremental scan")) {
            if (profile.isEmpty()) {
                return initializeLocked(true, progressReporter, cancelToken);
            }
            openStores();
            return scan(ScanReport.ScanMode.INCREMENTAL, Map.of(), progressReporter, cancelToken);
        }
    }

    /**
     * Removes the item records and vectors of the given relative paths. Paths that are not
     * embedded are ignored.
     *
     * @return how many embedded paths were removed
     */
    public int removeEmbeddings(Collection<String> relativePaths) throws IOException {
        ensureReady();
        return removeEmbeddingsInternal(relativePaths);
    }

    /**
     * Deletes the files from the library folder, then their embeddings.
     */
    public int deleteFiles(Collection<String> relativePaths) throws IOException {
        ensureReady();
        if (relativePaths == null || relativePaths.isEmpty()) {
            return 0;
        }
        for (String relativePath : relativePaths) {
            if (relativePath == null || relativePath.isBlank()) {
                continue;
            }
            Path file = root.resolve(LibraryWalker.normalize(relativePath)).normalize();
            if (!file.startsWith(root) || file.startsWith(dataFolder)) {
                throw new LibraryUsageException("Refusing to delete a file outside the library: " + relativePath);
            }
            if (Files.isRegularFile(file)) {
                Files.delete(file);
                log.info("Deleted {}", file);
            }
        }
        return removeEmbeddingsInternal(relativePaths);
    }

    /**
     * Purges every trace of the library: vector index, item table, scan profile and metadata.
     * The instance cannot be used afterwards.
     */
    public void demolish() throws IOException {
        try (ScanLock.Guard guard = scanLock.acquire("demolish the library")) {
            VectorStore store = vectorStore != null ? vectorStore : vectorStoreFactory.create(metadata.uuid(), dataFolder);
            store.deleteStore();
            if (metadataStore != null) {
                metadataStore.close();
            }
            embedder = null;
            metadataStore = null;
            vectorStore = null;
            profile.clear();
            initialized = false;
            demolished = true;
            deleteRecursively(dataFolder);
            log.info("Library '{}' ({}) demolished", metadata.name(), metadata.uuid());
        }
    }

    public List<ItemRecord> searchByContent(T content, int topK) {
        ensureReady();
        if (content == null || topK <= 0) {
            return List.of();
        }
        long start = System.nanoTime();
        float[] vector = embedder.embed(content);
        List<ItemRecord> records = searchByVector(vector, topK);
        log.debug("Similarity search returned {} items in {} ms", records.size(), (System.nanoTime() - start) / 1_000_000);
        return records;
    }

    /**
     * Nearest items first. Keys whose item record has gone are skipped.
     */
    public List<ItemRecord> searchByVector(float[] vector, int topK) {
        ensureReady();
        if (vector == null || vector.length == 0 || topK <= 0) {
            return List.of();
        }
        List<ItemRecord> records = new ArrayList<>();
        for (VectorMatch match : vectorStore.query(vector, topK)) {
            metadataStore.selectByUuid(match.key()).ifPresent(records::add);
        }
        return records;
    }

    public Optional<String> uuidOf(String relativePath) {
        return profile.uuidOf(LibraryWalker.normalize(relativePath));
    }

    /** Whole days since the last successful scan. */
    public long scanGapDays() {
        return ChronoUnit.DAYS.between(metadata.lastScannedAt(), LocalDateTime.now(clock));
    }

    public LibraryMetadata metadata() {
        return metadata;
    }

    public ScanProfile scanProfile() {
        return profile;
    }

    public MetadataStore metadataStore() {
        return metadataStore;
    }

    public VectorStore vectorStore() {
        return vectorStore;
    }

    public boolean isScanning() {
        return scanLock.isHeld();
    }

    public Path root() {
        return root;
    }

    public Path dataFolder() {
        return dataFolder;
    }

    private ScanReport initializeLocked(boolean forceReInit, ProgressReporter progressReporter, CancellationToken cancelToken)
            throws IOException {
        if (isReady() && !forceReInit) {
            return ScanReport.upToDate();
        }
        openStores();
        if (!forceReInit && metadataStore.rowCount() > 0 && !vectorStore.dbIsEmpty()) {
            log.info("Library '{}' loaded from existing data, {} items", metadata.name(), metadataStore.rowCount());
            initialized = true;
            return ScanReport.upToDate();
        }

        Map<String, String> superseded = Map.of();
        boolean hasData = metadataStore.rowCount() > 0 || !vectorStore.dbIsEmpty() || !profile.isEmpty();
        if (hasData && storesMatchProfile()) {
            log.info("Re-initializing library {}, {} existing items are replaced when the scan commits", root, profile.size());
            superseded = profile.snapshot();
        } else if (hasData) {
            log.info("Re-initializing library {}, purging inconsistent library data", root);
            vectorStore.cleanAllData();
            metadataStore.cleanAllData();
            profile.clear();
            profile.save();
        } else {
            log.info("Initializing library data for new library {}", root);
        }
        return scan(ScanReport.ScanMode.FULL, superseded, progressReporter, cancelToken);
    }

    private boolean storesMatchProfile() {
        int items = profile.size();
        return items > 0 && metadataStore.rowCount() == items && vectorStore.size() == items;
    }

    private ScanReport scan(ScanReport.ScanMode mode,
            Map<String, String> superseded,
            ProgressReporter progressReporter,
            CancellationToken cancelToken) throws IOException {
        CancellationToken token = cancelToken == null ? CancellationToken.none() : cancelToken;
        Set<String> current = walker.walk(root);

        List<String> toEmbed = new ArrayList<>();
        int removed = 0;
        if (mode == ScanReport.ScanMode.INCREMENTAL) {
            List<String> toDelete = new ArrayList<>();
            for (String embedded : profile.paths()) {
                if (!current.contains(embedded)) {
                    toDelete.add(embedded);
                }
            }
            removed = removeEmbeddingsInternal(toDelete);
            for (String path : current) {
                if (!profile.contains(path)) {
                    toEmbed.add(path);
                }
            }
            log.info("Incremental scan of {}: {} new files, {} removed files", root, toEmbed.size(), removed);
        } else {
            toEmbed.addAll(current);
            log.info("Library scanned, found {} files in {}", toEmbed.size(), root);
        }

        ProgressThrottle progress = new ProgressThrottle(progressReporter);
        ScanTransaction transaction = new ScanTransaction(metadataStore, vectorStore, profile, superseded, batchSize, clock);
        int invalid = 0;
        try {
            for (int i = 0; i < toEmbed.size(); i++) {
                if (token.isCancelled()) {
                    throw new ScanCancelledException("Scan of " + root + " cancelled after " + i + " of " + toEmbed.size() + " files");
                }
                progress.update(i, toEmbed.size());

                String relativePath = toEmbed.get(i);
                T content;
                try {
                    content = contentReader.read(root.resolve(relativePath));
                } catch (ItemValidationException e) {
                    log.warn("Invalid item {}, skip: {}", relativePath, e.getMessage());
                    invalid++;
                    continue;
                }

                long start = System.nanoTime();
                float[] vector = embedder.embed(content);
                log.debug("Embedded {}, dimension {}, {} ms", relativePath, vector == null ? 0 : vector.length,
                        (System.nanoTime() - start) / 1_000_000);
                transaction.write(relativePath, vector);
            }
            transaction.commit();
        } catch (ScanCancelledException e) {
            transaction.rollback();
            log.warn("{}; the library is back to its state before the scan", e.getMessage());
            return new ScanReport(mode, ScanReport.ScanStatus.CANCELLED, current.size(), 0, removed, invalid);
        } catch (RuntimeException | IOException e) {
            log.error("Scan of {} failed, rolling back: {}", root, e.getMessage());
            try {
                transaction.rollback();
            } catch (RuntimeException | IOException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }

        metadata = metadata.withLastScanned(LocalDateTime.now(clock));
        metadata.save(dataFolder);
        initialized = true;
        progress.complete();
        log.info("Library {} {} scan completed: {} embedded, {} invalid, {} removed",
                metadata.name(), mode, transaction.writtenCount(), invalid, removed);
        return new ScanReport(mode, ScanReport.ScanStatus.COMPLETED, current.size(), transaction.writtenCount(), removed, invalid);
    }

    private int removeEmbeddingsInternal(Collection<String> relativePaths) throws IOException {
        if (relativePaths == null || relativePaths.isEmpty()) {
            return 0;
        }
        int removed = 0;
        for (String relativePath : relativePaths) {
            if (relativePath == null || relativePath.isBlank()) {
                continue;
            }
            String normalized = LibraryWalker.normalize(relativePath);
            Optional<String> uuid = profile.uuidOf(normalized);
            if (uuid.isEmpty()) {
                continue;
            }
            vectorStore.remove(uuid.get());
            metadataStore.deleteByUuid(uuid.get());
            profile.remove(normalized);
            removed++;
        }
        vectorStore.persist();
        profile.save();
        log.info("Removed {} embeddings from library {}", removed, metadata.name());
        return removed;
    }

    private void openStores() throws IOException {
        if (demolished) {
            throw new LibraryUsageException("Library " + metadata.uuid() + " has been demolished");
        }
        if (embedder == null) {
            throw new LibraryUsageException("Embedder not set for library " + metadata.uuid());
        }
        if (metadataStore == null) {
            metadataStore = new MetadataStore(dataFolder);
        }
        if (vectorStore == null) {
            vectorStore = vectorStoreFactory.create(metadata.uuid(), dataFolder);
        }
    }

    private void ensureReady() {
        if (!isReady()) {
            throw new LibraryUsageException("Library " + metadata.uuid() + " is not initialized");
        }
    }

    private LibraryMetadata loadOrCreateMetadata(String uuid, String name, String type) throws IOException {
        if (LibraryMetadata.exists(dataFolder)) {
            LibraryMetadata stored = LibraryMetadata.load(dataFolder);
            if (!uuid.equals(stored.uuid())) {
                throw new LibraryUsageException("Folder " + root + " belongs to library " + stored.uuid() + ", not " + uuid);
            }
            return stored;
        }
        LibraryMetadata created = new LibraryMetadata(type, uuid, name, LibraryMetadata.TIMESTAMP.format(LocalDateTime.now(clock)));
        created.save(dataFolder);
        return created;
    }

    private static void deleteRecursively(Path folder) throws IOException {
        if (!Files.exists(folder)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(folder)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }
}

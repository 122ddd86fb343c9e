package com.memorybox.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memorybox.embed.Vectors;
import com.memorybox.error.ConsistencyException;
import com.memorybox.error.LibraryUsageException;

/**
 * In-process exact (flat) index persisted as JSON in the library data folder. The index cannot
 * be created empty: {@link #initializeIndex(int)} has to run once the first embedding's
 * dimension is known.
 */
public class LocalVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(LocalVectorStore.class);
    public static final String INDEX_FILE = "vector-index.json";

    private static final Comparator<VectorMatch> NEAREST_FIRST = Comparator
            .comparing(VectorMatch::distance)
            .thenComparing(VectorMatch::key);

    private final Path indexPath;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, float[]> vectors = new LinkedHashMap<>();
    private int dimension = -1;

    public LocalVectorStore(Path dataFolder) throws IOException {
        this.indexPath = dataFolder.resolve(INDEX_FILE);
        load();
    }

    @Override
    public IndexBootstrap bootstrap() {
        return IndexBootstrap.BEFORE_FIRST_WRITE;
    }

    @Override
    public synchronized boolean isIndexInitialized() {
        return dimension > 0;
    }

    @Override
    public synchronized int dimension() {
        return dimension;
    }

    @Override
    public synchronized void initializeIndex(int dimension) {
        if (dimension <= 0) {
            throw new ConsistencyException("Index dimension must be positive, got " + dimension);
        }
        if (this.dimension == dimension) {
            return;
        }
        if (this.dimension > 0 && !vectors.isEmpty()) {
            throw new ConsistencyException("Index already holds vectors of dimension " + this.dimension
                    + ", cannot re-create it with dimension " + dimension);
        }
        this.dimension = dimension;
        log.info("Local index created with dimension {}", dimension);
    }

    @Override
    public synchronized void add(String key, float[] vector) {
        if (dimension <= 0) {
            throw new LibraryUsageException("Local index must be initialized before vectors are added");
        }
        if (Vectors.isEmpty(vector) || vector.length != dimension) {
            throw new ConsistencyException("Vector for " + key + " has dimension "
                    + (vector == null ? 0 : vector.length) + ", index dimension is " + dimension);
        }
        vectors.put(key, vector.clone());
    }

    @Override
    public synchronized boolean remove(String key) {
        return vectors.remove(key) != null;
    }

    @Override
    public synchronized List<VectorMatch> query(float[] vector, int topK) {
        if (topK <= 0 || vectors.isEmpty()) {
            return List.of();
        }
        if (vector == null || vector.length != dimension) {
            throw new ConsistencyException("Query vector has dimension "
                    + (vector == null ? 0 : vector.length) + ", index dimension is " + dimension);
        }
        List<VectorMatch> matches = new ArrayList<>(vectors.size());
        for (Map.Entry<String, float[]> entry : vectors.entrySet()) {
            matches.add(new VectorMatch(entry.getKey(), Vectors.l2Squared(vector, entry.getValue())));
        }
        matches.sort(NEAREST_FIRST);
        return List.copyOf(matches.subList(0, Math.min(topK, matches.size())));
    }

    @Override
    public synchronized void persist() throws IOException {
        if (indexPath.getParent() != null) {
            Files.createDirectories(indexPath.getParent());
        }
        List<StoredVector> entries = new ArrayList<>(vectors.size());
        vectors.forEach((key, vector) -> entries.add(new StoredVector(key, vector)));
        Path tmp = indexPath.resolveSibling(INDEX_FILE + ".tmp");
        objectMapper.writeValue(tmp.toFile(), new StoredIndex(dimension, entries));
        Files.move(tmp, indexPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public synchronized void cleanAllData() throws IOException {
        vectors.clear();
        dimension = -1;
        Files.deleteIfExists(indexPath);
        log.info("Local index {} purged", indexPath);
    }

    @Override
    public synchronized void deleteStore() throws IOException {
        cleanAllData();
    }

    @Override
    public synchronized boolean dbIsEmpty() {
        return vectors.isEmpty();
    }

    @Override
    public synchronized int size() {
        return vectors.size();
    }

    @Override
    public Optional<VectorBatch> batchWriter(int batchSize) {
        return Optional.empty();
    }

    private void load() throws IOException {
        if (!Files.exists(indexPath)) {
            return;
        }
        StoredIndex stored = objectMapper.readValue(indexPath.toFile(), StoredIndex.class);
        dimension = stored.dimension();
        for (StoredVector entry : stored.entries()) {
            vectors.put(entry.key(), entry.vector());
        }
        log.debug("Loaded {} vectors of dimension {} from {}", vectors.size(), dimension, indexPath);
    }

    public record StoredIndex(int dimension, List<StoredVector> entries) {
    }

    public record StoredVector(String key, float[] vector) {
    }
}

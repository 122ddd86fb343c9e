package com.memorybox.library;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memorybox.embed.Vectors;
import com.memorybox.error.ConsistencyException;
import com.memorybox.store.IndexBootstrap;
import com.memorybox.store.MetadataStore;
import com.memorybox.store.VectorBatch;
import com.memorybox.store.VectorStore;

/**
 * The writes of one scan. Each item is written as a pair (item record + vector, then the scan
 * profile entry) and remembered, so that {@link #rollback()} can undo exactly the writes of
 * this scan and nothing older.
 * <p>
 * A replacing scan is given the items that existed before it. They stay searchable while the
 * scan runs and are deleted by {@link #commit()} only; {@link #rollback()} restores their scan
 * profile entries.
 */
class ScanTransaction {
    private static final Logger log = LoggerFactory.getLogger(ScanTransaction.class);

    private final MetadataStore metadataStore;
    private final VectorStore vectorStore;
    private final ScanProfile profile;
    private final Clock clock;
    private final VectorBatch batch;
    private final int dimensionBefore;
    private final Map<String, String> superseded;
    private final Map<String, String> written = new LinkedHashMap<>();
    private int stagedDimension = -1;
    private boolean batchOpen;
    private boolean finished;

    ScanTransaction(MetadataStore metadataStore,
            VectorStore vectorStore,
            ScanProfile profile,
            Map<String, String> superseded,
            int batchSize,
            Clock clock) {
        this.metadataStore = metadataStore;
        this.superseded = Map.copyOf(superseded);
        this.vectorStore = vectorStore;
        this.profile = profile;
        this.clock = clock;
        this.dimensionBefore = vectorStore.dimension();
        Optional<VectorBatch> batchWriter = vectorStore.batchWriter(batchSize);
        this.batch = batchWriter.orElse(null);
        this.batchOpen = batch != null;
        log.debug("Scan writes {}", batch == null ? "one vector at a time" : "through a batch of " + batchSize);
    }

    void write(String relativePath, float[] vector) {
        if (Vectors.isEmpty(vector)) {
            throw new ConsistencyException("Invalid embedding for " + relativePath
                    + ": an item record cannot be written without its vector");
        }
        if (vectorStore.bootstrap() == IndexBootstrap.BEFORE_FIRST_WRITE && !vectorStore.isIndexInitialized()) {
            vectorStore.initializeIndex(vector.length);
        }
        if (stagedDimension > 0 && stagedDimension != vector.length) {
            throw new ConsistencyException("Embedding for " + relativePath + " has dimension " + vector.length
                    + ", earlier items of this scan have dimension " + stagedDimension);
        }

        String uuid = UUID.randomUUID().toString();
        int slash = relativePath.lastIndexOf('/');
        String parent = slash < 0 ? "" : relativePath.substring(0, slash);
        String filename = relativePath.substring(slash + 1);

        metadataStore.insertRow(clock.millis(), uuid, parent, filename);
        try {
            vectorStore.add(uuid, vector, batch);
        } catch (RuntimeException e) {
            metadataStore.deleteByUuid(uuid);
            throw e;
        }
        profile.put(relativePath, uuid);
        written.put(relativePath, uuid);
        stagedDimension = vector.length;
    }

    int writtenCount() {
        return written.size();
    }

    void commit() throws IOException {
        closeBatch();
        if (vectorStore.bootstrap() == IndexBootstrap.AFTER_ALL_WRITES) {
            int dimension = stagedDimension > 0 ? stagedDimension : vectorStore.dimension();
            if (dimension > 0 && !vectorStore.isIndexInitialized()) {
                vectorStore.initializeIndex(dimension);
            }
        }
        for (Map.Entry<String, String> entry : superseded.entrySet()) {
            vectorStore.remove(entry.getValue());
            metadataStore.deleteByUuid(entry.getValue());
            if (!written.containsKey(entry.getKey())) {
                profile.remove(entry.getKey());
            }
        }
        vectorStore.persist();
        profile.save();
        finished = true;
        if (!superseded.isEmpty()) {
            log.info("Replaced {} items of the previous scan", superseded.size());
        }
    }

    void rollback() throws IOException {
        if (finished) {
            return;
        }
        finished = true;
        if (batchOpen) {
            batch.discard();
        }
        closeBatch();
        for (Map.Entry<String, String> entry : written.entrySet()) {
            vectorStore.remove(entry.getValue());
            metadataStore.deleteByUuid(entry.getValue());
            String previous = superseded.get(entry.getKey());
            if (previous != null) {
                profile.put(entry.getKey(), previous);
            } else {
                profile.remove(entry.getKey());
            }
        }
        if (dimensionBefore < 0 && vectorStore.dbIsEmpty()) {
            // the index did not exist before this scan
            vectorStore.cleanAllData();
        } else {
            vectorStore.persist();
        }
        profile.save();
        log.warn("Rolled back {} items written by the interrupted scan", written.size());
    }

    private void closeBatch() {
        if (batchOpen) {
            batchOpen = false;
            batch.close();
        }
    }
}

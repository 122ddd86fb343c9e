package com.memorybox.store;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Nearest-neighbour index over item embeddings, keyed by item uuid.
 * <p>
 * {@link #query} returns matches nearest first by squared Euclidean distance; equal distances
 * are ordered by ascending key. The index dimension is fixed once the index exists, and a
 * vector of any other dimension is rejected without being written.
 */
public interface VectorStore {
    IndexBootstrap bootstrap();

    boolean isIndexInitialized();

    /** Dimension of the stored vectors, or -1 while it is not known yet. */
    int dimension();

    void initializeIndex(int dimension);

    void add(String key, float[] vector);

    default void add(String key, float[] vector, VectorBatch batch) {
        if (batch == null) {
            add(key, vector);
        } else {
            batch.add(key, vector);
        }
    }

    boolean remove(String key);

    List<VectorMatch> query(float[] vector, int topK);

    void persist() throws IOException;

    void cleanAllData() throws IOException;

    void deleteStore() throws IOException;

    boolean dbIsEmpty();

    int size();

    /** A pipelined writer, or empty when this backend writes one vector at a time. */
    Optional<VectorBatch> batchWriter(int batchSize);
}

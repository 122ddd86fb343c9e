package com.memorybox.store;

/**
 * Pipelined writer for a vector store. Writes are flushed in insertion order, every
 * {@code batchSize} entries and on {@link #close()}.
 */
public interface VectorBatch extends AutoCloseable {
    void add(String key, float[] vector);

    void flush();

    /**
     * Drops the writes staged since the last flush so none of them remains in the store.
     * Writes that were already flushed are left alone.
     */
    void discard();

    int pendingCount();

    @Override
    void close();
}

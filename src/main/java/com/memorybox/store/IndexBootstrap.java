package com.memorybox.store;

/**
 * When a vector store's index has to be created relative to the writes of a scan.
 */
public enum IndexBootstrap {
    /** The index must exist before the first vector is added; create it from the first embedding. */
    BEFORE_FIRST_WRITE,
    /** Vectors are staged first; the index is built once, in bulk, after the scan has staged everything. */
    AFTER_ALL_WRITES
}

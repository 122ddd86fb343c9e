package com.memorybox.retrieval;

import java.util.List;
import java.util.Optional;

/**
 * Ordered collection of documents addressed by a stable numeric id.
 */
public interface CorpusProvider extends AutoCloseable {
    String corpusId();

    /** Every record, in id order. */
    List<CorpusRecord> records();

    Optional<CorpusRecord> find(long id);

    @Override
    default void close() {
    }
}

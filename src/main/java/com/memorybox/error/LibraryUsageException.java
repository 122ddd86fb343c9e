package com.memorybox.error;

/**
 * An operation was invoked out of order, e.g. a query before the index was built or a scan
 * without an embedder.
 */
public class LibraryUsageException extends KnowledgeBaseException {
    public LibraryUsageException(String message) {
        super(message);
    }
}

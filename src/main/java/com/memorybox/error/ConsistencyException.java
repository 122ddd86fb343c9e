package com.memorybox.error;

/**
 * A write would leave the metadata store and the vector store disagreeing with each other,
 * e.g. an empty embedding or a vector whose dimension differs from the index.
 */
public class ConsistencyException extends KnowledgeBaseException {
    public ConsistencyException(String message) {
        super(message);
    }

    public ConsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.memorybox.error;

public class MetadataStoreException extends KnowledgeBaseException {
    public MetadataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

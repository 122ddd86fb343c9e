package com.memorybox.error;

public class LockContentionException extends KnowledgeBaseException {
    public LockContentionException(String message) {
        super(message);
    }
}

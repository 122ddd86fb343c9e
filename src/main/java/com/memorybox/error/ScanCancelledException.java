package com.memorybox.error;

public class ScanCancelledException extends KnowledgeBaseException {
    public ScanCancelledException(String message) {
        super(message);
    }
}

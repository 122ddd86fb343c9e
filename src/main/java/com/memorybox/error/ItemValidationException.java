package com.memorybox.error;

import java.nio.file.Path;

/**
 * A single library item could not be read as the expected content type. The scan skips it.
 */
public class ItemValidationException extends Exception {
    private final Path path;

    public ItemValidationException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public ItemValidationException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}

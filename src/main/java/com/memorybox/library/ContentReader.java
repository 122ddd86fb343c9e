package com.memorybox.library;

import java.nio.file.Path;

import com.memorybox.error.ItemValidationException;

/**
 * Reads a library file as the library's content type, rejecting files that are not a
 * well-formed instance of it.
 */
@FunctionalInterface
public interface ContentReader<T> {
    T read(Path file) throws ItemValidationException;
}

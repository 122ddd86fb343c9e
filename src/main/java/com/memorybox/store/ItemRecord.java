package com.memorybox.store;

/**
 * One indexed library file. {@code path} is the parent folder relative to the library root
 * ({@code ""} for the root itself).
 */
public record ItemRecord(long id, long timestamp, String uuid, String path, String filename) {

    public String relativePath() {
        return path == null || path.isEmpty() ? filename : path + "/" + filename;
    }
}

package com.memorybox.library;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Persisted relative-path to uuid mapping: the record of which files are already embedded.
 */
public class ScanProfile {
    public static final String FILE_NAME = "scan-profile.json";

    private final Path path;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, String> embedded = new TreeMap<>();

    private ScanProfile(Path path) {
        this.path = path;
    }

    public static ScanProfile load(Path dataFolder) throws IOException {
        ScanProfile profile = new ScanProfile(dataFolder.resolve(FILE_NAME));
        if (Files.exists(profile.path) && Files.size(profile.path) > 0) {
            profile.embedded.putAll(profile.mapper.readValue(profile.path.toFile(),
                    new TypeReference<Map<String, String>>() {
                    }));
        }
        return profile;
    }

    public synchronized void save() throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path tmp = path.resolveSibling(FILE_NAME + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), embedded);
        Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    public synchronized Optional<String> uuidOf(String relativePath) {
        return Optional.ofNullable(embedded.get(relativePath));
    }

    public synchronized boolean contains(String relativePath) {
        return embedded.containsKey(relativePath);
    }

    public synchronized void put(String relativePath, String uuid) {
        embedded.put(relativePath, uuid);
    }

    public synchronized String remove(String relativePath) {
        return embedded.remove(relativePath);
    }

    /** Embedded paths in lexical order. */
    public synchronized SortedSet<String> paths() {
        return new TreeSet<>(embedded.keySet());
    }

    public synchronized Map<String, String> snapshot() {
        return new TreeMap<>(embedded);
    }

    public synchronized int size() {
        return embedded.size();
    }

    public synchronized boolean isEmpty() {
        return embedded.isEmpty();
    }

    public synchronized void clear() {
        embedded.clear();
    }
}

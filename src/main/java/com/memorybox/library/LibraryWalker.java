package com.memorybox.library;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the regular files under a library root as {@code /}-separated relative paths,
 * skipping any file or folder whose name is on the exclusion list.
 */
class LibraryWalker {
    private static final Logger log = LoggerFactory.getLogger(LibraryWalker.class);

    private final Set<String> exclusions;

    LibraryWalker(Collection<String> exclusions) {
        this.exclusions = Set.copyOf(exclusions);
    }

    Set<String> walk(Path root) throws IOException {
        Set<String> files = new TreeSet<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isExcluded(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && !isExcluded(file)) {
                    files.add(toRelative(root, file));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Unable to visit {}, skip: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        return files;
    }

    static String toRelative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    /** Strips leading separators and unifies separators to {@code /}. */
    static String normalize(String relativePath) {
        String normalized = relativePath.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }

    private boolean isExcluded(Path path) {
        Path name = path.getFileName();
        return name != null && exclusions.contains(name.toString());
    }
}

package com.memorybox.store;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface VectorStoreFactory {
    VectorStore create(String libraryUuid, Path dataFolder) throws IOException;
}

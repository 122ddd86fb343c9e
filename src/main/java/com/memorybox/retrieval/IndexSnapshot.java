package com.memorybox.retrieval;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serialized form of a trained retrieval index. {@code ids[i]} is the corpus id of
 * {@code embeddingMatrix[i]}.
 */
public record IndexSnapshot(
        @JsonProperty("corpus_id") String corpusId,
        long[] ids,
        @JsonProperty("embedding_matrix") float[][] embeddingMatrix,
        @JsonProperty("trained_index") IvfFlatIndex.State trainedIndex) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static IndexSnapshot load(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), IndexSnapshot.class);
    }

    public void save(Path path) throws IOException {
        if (path.toAbsolutePath().getParent() != null) {
            Files.createDirectories(path.toAbsolutePath().getParent());
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        MAPPER.writeValue(tmp.toFile(), this);
        Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}

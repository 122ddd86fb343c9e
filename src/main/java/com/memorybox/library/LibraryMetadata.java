package com.memorybox.library;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LibraryMetadata(
        @JsonProperty("type") String type,
        @JsonProperty("uuid") String uuid,
        @JsonProperty("name") String name,
        @JsonProperty("last_scanned") String lastScanned) {

    public static final String FILE_NAME = "metadata.json";
    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public LibraryMetadata withLastScanned(LocalDateTime scannedAt) {
        return new LibraryMetadata(type, uuid, name, TIMESTAMP.format(scannedAt));
    }

    public LocalDateTime lastScannedAt() {
        return LocalDateTime.parse(lastScanned, TIMESTAMP);
    }

    public static boolean exists(Path dataFolder) {
        return Files.isRegularFile(dataFolder.resolve(FILE_NAME));
    }

    public static LibraryMetadata load(Path dataFolder) throws IOException {
        return MAPPER.readValue(dataFolder.resolve(FILE_NAME).toFile(), LibraryMetadata.class);
    }

    public void save(Path dataFolder) throws IOException {
        Files.createDirectories(dataFolder);
        Path tmp = dataFolder.resolve(FILE_NAME + ".tmp");
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), this);
        Files.move(tmp, dataFolder.resolve(FILE_NAME), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}

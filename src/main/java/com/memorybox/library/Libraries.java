package com.memorybox.library;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

import com.memorybox.embed.ColorHistogramEmbedder;
import com.memorybox.embed.Embedder;
import com.memorybox.runtime.AppConfig;
import com.memorybox.store.VectorStores;

public final class Libraries {
    public static final String IMAGE = "image";
    public static final String DOCUMENT = "document";

    private Libraries() {
    }

    public static Library<BufferedImage> imageLibrary(Path root, String name, String uuid, AppConfig config) throws IOException {
        Library<BufferedImage> library = new Library<>(root, name, uuid, IMAGE, new ImageContentReader(),
                (libraryUuid, dataFolder) -> VectorStores.create(config, libraryUuid, dataFolder),
                config.getLibrary());
        library.setEmbedder(new ColorHistogramEmbedder());
        return library;
    }

    public static Library<String> documentLibrary(Path root, String name, String uuid, AppConfig config,
            Embedder<String> embedder) throws IOException {
        Library<String> library = new Library<>(root, name, uuid, DOCUMENT, new TextContentReader(),
                (libraryUuid, dataFolder) -> VectorStores.create(config, libraryUuid, dataFolder),
                config.getLibrary());
        library.setEmbedder(embedder);
        return library;
    }
}

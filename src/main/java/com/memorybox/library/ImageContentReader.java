package com.memorybox.library;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import com.memorybox.error.ItemValidationException;

public class ImageContentReader implements ContentReader<BufferedImage> {

    @Override
    public BufferedImage read(Path file) throws ItemValidationException {
        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException | RuntimeException e) {
            throw new ItemValidationException(file, "Corrupt image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ItemValidationException(file, "Not a decodable image");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new ItemValidationException(file, "Image has no pixels");
        }
        return image;
    }
}

package com.memorybox.embed;

import java.awt.image.BufferedImage;

/**
 * Local image embedder: a normalized RGB histogram with {@code binsPerChannel}^3 buckets.
 */
public class ColorHistogramEmbedder implements Embedder<BufferedImage> {
    private final int binsPerChannel;

    public ColorHistogramEmbedder() {
        this(4);
    }

    public ColorHistogramEmbedder(int binsPerChannel) {
        if (binsPerChannel <= 0 || binsPerChannel > 256) {
            throw new IllegalArgumentException("binsPerChannel must be in 1..256: " + binsPerChannel);
        }
        this.binsPerChannel = binsPerChannel;
    }

    @Override
    public float[] embed(BufferedImage image) {
        float[] histogram = new float[dimension()];
        if (image == null) {
            return histogram;
        }
        int width = image.getWidth();
        int height = image.getHeight();
        // sample at most ~256x256 pixels
        int stepX = Math.max(1, width / 256);
        int stepY = Math.max(1, height / 256);
        for (int y = 0; y < height; y += stepY) {
            for (int x = 0; x < width; x += stepX) {
                int rgb = image.getRGB(x, y);
                int r = bin((rgb >> 16) & 0xFF);
                int g = bin((rgb >> 8) & 0xFF);
                int b = bin(rgb & 0xFF);
                histogram[(r * binsPerChannel + g) * binsPerChannel + b] += 1f;
            }
        }
        return Vectors.normalize(histogram);
    }

    public int dimension() {
        return binsPerChannel * binsPerChannel * binsPerChannel;
    }

    private int bin(int channel) {
        return channel * binsPerChannel / 256;
    }
}

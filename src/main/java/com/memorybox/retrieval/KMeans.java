package com.memorybox.retrieval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import com.memorybox.embed.Vectors;

/**
 * Lloyd's k-means with centroids seeded from distinct samples. The same seed and data always
 * produce the same centroids.
 */
final class KMeans {
    private KMeans() {
    }

    static float[][] train(float[][] data, int clusters, int iterations, long seed) {
        if (clusters <= 0 || clusters > data.length) {
            throw new IllegalArgumentException("clusters must be in [1, " + data.length + "], got " + clusters);
        }
        int dimension = data[0].length;
        List<Integer> order = new ArrayList<>(data.length);
        for (int i = 0; i < data.length; i++) {
            order.add(i);
        }
        Collections.shuffle(order, new Random(seed));

        float[][] centroids = new float[clusters][];
        for (int c = 0; c < clusters; c++) {
            centroids[c] = data[order.get(c)].clone();
        }

        int[] assignment = new int[data.length];
        for (int iteration = 0; iteration < iterations; iteration++) {
            boolean changed = false;
            for (int i = 0; i < data.length; i++) {
                int nearest = nearest(centroids, data[i]);
                if (iteration == 0 || nearest != assignment[i]) {
                    changed = true;
                    assignment[i] = nearest;
                }
            }
            if (!changed) {
                break;
            }
            float[][] sums = new float[clusters][dimension];
            int[] counts = new int[clusters];
            for (int i = 0; i < data.length; i++) {
                int c = assignment[i];
                counts[c]++;
                for (int d = 0; d < dimension; d++) {
                    sums[c][d] += data[i][d];
                }
            }
            for (int c = 0; c < clusters; c++) {
                // an emptied cluster keeps its previous centroid
                if (counts[c] == 0) {
                    continue;
                }
                for (int d = 0; d < dimension; d++) {
                    sums[c][d] /= counts[c];
                }
                centroids[c] = sums[c];
            }
        }
        return centroids;
    }

    static int nearest(float[][] centroids, float[] vector) {
        int best = 0;
        float bestDistance = Float.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.length; c++) {
            float distance = Vectors.l2Squared(centroids[c], vector);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = c;
            }
        }
        return best;
    }
}

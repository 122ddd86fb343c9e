package com.memorybox.retrieval;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import com.memorybox.embed.Vectors;
import com.memorybox.error.ConsistencyException;

/**
 * Inverted-file index with exact (flat) distances inside each list. Vectors are assigned to the
 * nearest k-means centroid; a search scans the {@code probes} lists closest to the query.
 */
public class IvfFlatIndex {
    private final int dimension;
    private final float[][] centroids;
    private final List<List<Long>> ids = new ArrayList<>();
    private final List<List<float[]>> vectors = new ArrayList<>();

    private IvfFlatIndex(int dimension, float[][] centroids) {
        this.dimension = dimension;
        this.centroids = centroids;
        for (int c = 0; c < centroids.length; c++) {
            ids.add(new ArrayList<>());
            vectors.add(new ArrayList<>());
        }
    }

    /**
     * Trains the coarse quantizer on {@code data}. The cluster count is clamped to the number of
     * training vectors so that small corpora still get an index.
     */
    public static IvfFlatIndex train(float[][] data, int clusters, int iterations, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an index without vectors");
        }
        int effective = Math.max(1, Math.min(clusters, data.length));
        return new IvfFlatIndex(data[0].length, KMeans.train(data, effective, iterations, seed));
    }

    public static IvfFlatIndex fromState(State state) {
        IvfFlatIndex index = new IvfFlatIndex(state.dimension(), state.centroids());
        if (state.lists().size() != state.centroids().length) {
            throw new ConsistencyException("Index state has " + state.lists().size()
                    + " inverted lists for " + state.centroids().length + " centroids");
        }
        for (int c = 0; c < state.centroids().length; c++) {
            InvertedList list = state.lists().get(c);
            for (int i = 0; i < list.ids().length; i++) {
                index.ids.get(c).add(list.ids()[i]);
                index.vectors.get(c).add(list.vectors()[i]);
            }
        }
        return index;
    }

    public void add(long id, float[] vector) {
        if (vector.length != dimension) {
            throw new ConsistencyException("Vector for id " + id + " has dimension " + vector.length
                    + ", index expects " + dimension);
        }
        int list = KMeans.nearest(centroids, vector);
        ids.get(list).add(id);
        vectors.get(list).add(vector);
    }

    /** Nearest ids by squared L2 distance, ascending; ties are ordered by id. */
    public List<Neighbor> search(float[] query, int k, int probes) {
        if (k <= 0) {
            return List.of();
        }
        if (query.length != dimension) {
            throw new ConsistencyException("Query has dimension " + query.length + ", index expects " + dimension);
        }
        Integer[] byCentroid = new Integer[centroids.length];
        for (int c = 0; c < centroids.length; c++) {
            byCentroid[c] = c;
        }
        Arrays.sort(byCentroid, Comparator.comparingDouble(c -> Vectors.l2Squared(centroids[c], query)));

        List<Neighbor> candidates = new ArrayList<>();
        int scanned = Math.max(1, Math.min(probes, centroids.length));
        for (int p = 0; p < scanned; p++) {
            int list = byCentroid[p];
            for (int i = 0; i < ids.get(list).size(); i++) {
                candidates.add(new Neighbor(ids.get(list).get(i), Vectors.l2Squared(vectors.get(list).get(i), query)));
            }
        }
        candidates.sort(Comparator.comparingDouble(Neighbor::distance).thenComparingLong(Neighbor::id));
        return candidates.size() > k ? new ArrayList<>(candidates.subList(0, k)) : candidates;
    }

    public int size() {
        return ids.stream().mapToInt(List::size).sum();
    }

    public int dimension() {
        return dimension;
    }

    public int clusterCount() {
        return centroids.length;
    }

    public State toState() {
        List<InvertedList> lists = new ArrayList<>();
        for (int c = 0; c < centroids.length; c++) {
            long[] listIds = ids.get(c).stream().mapToLong(Long::longValue).toArray();
            lists.add(new InvertedList(listIds, vectors.get(c).toArray(new float[0][])));
        }
        return new State(dimension, centroids, lists);
    }

    public record State(int dimension, float[][] centroids, List<InvertedList> lists) {
    }

    public record InvertedList(long[] ids, float[][] vectors) {
    }
}

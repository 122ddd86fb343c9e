package com.memorybox.embed;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores how relevant a candidate is to a query. Higher is more relevant.
 */
public interface Ranker {
    float score(String query, String candidate);

    default List<Float> scoreAll(String query, List<String> candidates) {
        List<Float> scores = new ArrayList<>(candidates.size());
        for (String candidate : candidates) {
            scores.add(score(query, candidate));
        }
        return scores;
    }
}

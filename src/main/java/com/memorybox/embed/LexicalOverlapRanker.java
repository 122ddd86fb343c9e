package com.memorybox.embed;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores a candidate by the fraction of query terms it contains.
 */
public class LexicalOverlapRanker implements Ranker {

    @Override
    public float score(String query, String candidate) {
        Set<String> queryTerms = terms(query);
        if (queryTerms.isEmpty() || candidate == null || candidate.isBlank()) {
            return 0f;
        }
        Set<String> words = terms(candidate);
        long matches = queryTerms.stream().filter(words::contains).count();
        return (float) matches / queryTerms.size();
    }

    private static Set<String> terms(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(token -> !token.isBlank())
                .collect(Collectors.toSet());
    }
}

package com.track.resolution.similarity;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Word-order-insensitive similarity: both strings have their words sorted before
 * the edit-distance comparison, so "sleep never again" equals "never sleep again"
 * while extra or missing words still lower the score.
 */
public class TokenSortSimilarity implements SimilarityAlgorithm {

    private final SimilarityAlgorithm base;

    public TokenSortSimilarity() {
        this(new LevenshteinSimilarity());
    }

    public TokenSortSimilarity(SimilarityAlgorithm base) {
        this.base = base;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return base.compute(sortTokens(s1), sortTokens(s2));
    }

    @Override
    public String getName() {
        return "TokenSort";
    }

    static String sortTokens(String s) {
        return Arrays.stream(s.trim().split("\\s+"))
                .filter(t -> !t.isEmpty())
                .sorted()
                .collect(Collectors.joining(" "));
    }
}

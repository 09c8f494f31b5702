package com.track.resolution.similarity;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Token-set similarity. Compares the shared words against each side's leftovers and
 * keeps the best of the three pairings; a string whose words are all contained in the
 * other scores 1.0. Suited to short labels and credits with partial overlap.
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    private final SimilarityAlgorithm base;

    public TokenSetSimilarity() {
        this(new LevenshteinSimilarity());
    }

    public TokenSetSimilarity(SimilarityAlgorithm base) {
        this.base = base;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }
        Set<String> tokens1 = tokens(s1);
        Set<String> tokens2 = tokens(s2);

        Set<String> common = new TreeSet<>(tokens1);
        common.retainAll(tokens2);
        Set<String> only1 = new TreeSet<>(tokens1);
        only1.removeAll(tokens2);
        Set<String> only2 = new TreeSet<>(tokens2);
        only2.removeAll(tokens1);

        if (!common.isEmpty() && (only1.isEmpty() || only2.isEmpty())) {
            return 1.0;
        }

        String intersection = String.join(" ", common);
        String combined1 = join(intersection, only1);
        String combined2 = join(intersection, only2);
        if (intersection.isEmpty()) {
            return base.compute(combined1, combined2);
        }
        return Math.max(
                Math.max(base.compute(intersection, combined1), base.compute(intersection, combined2)),
                base.compute(combined1, combined2));
    }

    @Override
    public String getName() {
        return "TokenSet";
    }

    private static Set<String> tokens(String s) {
        return Arrays.stream(s.trim().split("\\s+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private static String join(String prefix, Set<String> rest) {
        String tail = String.join(" ", rest);
        if (prefix.isEmpty()) {
            return tail;
        }
        return tail.isEmpty() ? prefix : prefix + " " + tail;
    }
}

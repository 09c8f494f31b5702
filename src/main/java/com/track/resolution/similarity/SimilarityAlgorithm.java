package com.track.resolution.similarity;

/**
 * String similarity measure. Implementations expect already-normalized input
 * and return a score between 0.0 (nothing in common) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();

    /**
     * The same similarity on the 0-100 scale used by track scoring.
     */
    default double percent(String s1, String s2) {
        return compute(s1, s2) * 100.0;
    }
}

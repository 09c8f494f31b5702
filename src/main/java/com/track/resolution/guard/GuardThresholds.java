package com.track.resolution.guard;

/**
 * Thresholds of the standard guards.
 *
 * @param titleSimilarityFloor    minimum title similarity (0-100)
 * @param titleTokenCoverage      minimum fraction (0-1) of significant source title words present in the candidate title
 * @param remixConflictSimilarity label similarity (0-100) under which two remix labels are considered different
 */
public record GuardThresholds(
        double titleSimilarityFloor,
        double titleTokenCoverage,
        double remixConflictSimilarity
) {
    public GuardThresholds {
        if (titleSimilarityFloor < 0 || titleSimilarityFloor > 100) {
            throw new IllegalArgumentException("titleSimilarityFloor must be between 0 and 100");
        }
        if (titleTokenCoverage < 0 || titleTokenCoverage > 1) {
            throw new IllegalArgumentException("titleTokenCoverage must be between 0.0 and 1.0");
        }
        if (remixConflictSimilarity < 0 || remixConflictSimilarity > 100) {
            throw new IllegalArgumentException("remixConflictSimilarity must be between 0 and 100");
        }
    }

    public static GuardThresholds defaults() {
        return new GuardThresholds(40.0, 0.5, 80.0);
    }
}

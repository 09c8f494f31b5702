package com.track.resolution.core.model;

/**
 * Components of a composite score. Similarities are on a 0-100 scale;
 * the remix and year adjustments are signed numbers of points.
 */
public record ScoreBreakdown(
        double titleSimilarity,
        double artistSimilarity,
        double remixAdjustment,
        double yearAdjustment
) {
    public ScoreBreakdown(double titleSimilarity, double artistSimilarity, double remixAdjustment) {
        this(titleSimilarity, artistSimilarity, remixAdjustment, 0.0);
    }

    @Override
    public String toString() {
        return String.format("ScoreBreakdown{title=%.1f, artist=%.1f, remix=%+.1f, year=%+.1f}",
                titleSimilarity, artistSimilarity, remixAdjustment, yearAdjustment);
    }
}

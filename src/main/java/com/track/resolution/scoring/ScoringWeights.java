package com.track.resolution.scoring;

/**
 * Weights of the composite track score.
 *
 * <p>Composite = {@code titleWeight * titleSimilarity + artistWeight * artistSimilarity + remixAdjustment},
 * where the remix adjustment lies in {@code [-remixAdjustmentLimit, +remixAdjustmentLimit]} points.
 * Title similarity must carry at least half of the composite.</p>
 *
 * @param titleWeight          weight of title similarity, 0.5 to 1.0
 * @param artistWeight         weight of artist similarity
 * @param remixAdjustmentLimit bound of the remix bonus/penalty in points, 0 to 15
 */
public record ScoringWeights(
        double titleWeight,
        double artistWeight,
        double remixAdjustmentLimit
) {
    public static final double MAX_REMIX_ADJUSTMENT = 15.0;

    public ScoringWeights {
        if (titleWeight < 0 || artistWeight < 0 || remixAdjustmentLimit < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        if (titleWeight < 0.5) {
            throw new IllegalArgumentException("titleWeight must be >= 0.5, got " + titleWeight);
        }
        double sum = titleWeight + artistWeight;
        if (sum > 1.0 + 0.001) {
            throw new IllegalArgumentException("titleWeight + artistWeight must be <= 1.0, got " + sum);
        }
        if (remixAdjustmentLimit > MAX_REMIX_ADJUSTMENT) {
            throw new IllegalArgumentException("remixAdjustmentLimit must be <= "
                    + MAX_REMIX_ADJUSTMENT + ", got " + remixAdjustmentLimit);
        }
    }

    /**
     * Title 50%, artist 35%, remix consistency up to 15 points either way.
     */
    public static ScoringWeights defaultWeights() {
        return new ScoringWeights(0.50, 0.35, 15.0);
    }

    /**
     * Highest composite a candidate can reach when neither side carries a mix label.
     */
    public double maxUnlabelledScore() {
        return 100.0 * (titleWeight + artistWeight);
    }
}

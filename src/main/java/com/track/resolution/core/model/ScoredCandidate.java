package com.track.resolution.core.model;

import java.util.Objects;

/**
 * A candidate with its composite score in [0,100].
 * The score depends only on the source track and the candidate.
 */
public record ScoredCandidate(Candidate candidate, double score, ScoreBreakdown breakdown) {

    public ScoredCandidate {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(breakdown, "breakdown is required");
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("Score must be between 0 and 100, got " + score);
        }
    }

    public int queryRank() {
        return candidate.queryRank();
    }
}

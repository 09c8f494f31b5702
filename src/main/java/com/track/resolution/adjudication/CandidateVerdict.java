package com.track.resolution.adjudication;

import com.track.resolution.core.model.ScoredCandidate;
import com.track.resolution.guard.GuardResult;

import java.util.Comparator;

/**
 * A scored candidate with its guard outcome and acceptance.
 *
 * @param scored    the scored candidate
 * @param guard     result of the guard chain
 * @param accepted  guards passed and score at or above the accept threshold
 * @param seenOrder position in which the candidate was first seen for the track
 */
record CandidateVerdict(ScoredCandidate scored, GuardResult guard, boolean accepted, int seenOrder) {

    /**
     * Score descending, then lower query rank, then first seen.
     */
    static final Comparator<CandidateVerdict> BEST_FIRST = Comparator
            .comparingDouble((CandidateVerdict v) -> v.scored().score()).reversed()
            .thenComparingInt(v -> v.scored().queryRank())
            .thenComparingInt(CandidateVerdict::seenOrder);

    double score() {
        return scored.score();
    }

    String catalogId() {
        return scored.candidate().catalogId();
    }
}

package com.track.resolution.audit;

import com.track.resolution.core.model.Candidate;
import com.track.resolution.core.model.ScoreBreakdown;
import com.track.resolution.core.model.ScoredCandidate;
import com.track.resolution.core.model.StrategyType;
import com.track.resolution.guard.GuardResult;

import java.util.List;

/**
 * A scored candidate linked to the source track it was evaluated for.
 *
 * @param guardOutcome "pass" or "guard_name: reason"
 */
public record CandidateRecord(
        String runId,
        String trackId,
        String catalogId,
        String title,
        String mixLabel,
        List<String> artists,
        double score,
        ScoreBreakdown breakdown,
        String guardOutcome,
        boolean accepted,
        int queryRank,
        StrategyType strategy,
        String sourceUrl
) {
    public CandidateRecord {
        artists = artists != null ? List.copyOf(artists) : List.of();
    }

    public static CandidateRecord of(String runId, String trackId, ScoredCandidate scored,
                                     GuardResult guardResult, boolean accepted) {
        Candidate c = scored.candidate();
        return new CandidateRecord(runId, trackId, c.catalogId(), c.title(), c.mixLabel(), c.artists(),
                scored.score(), scored.breakdown(), guardResult.describe(), accepted, c.queryRank(),
                c.strategy(), c.sourceUrl());
    }
}

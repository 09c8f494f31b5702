package com.track.resolution.guard;

import com.track.resolution.core.model.ScoredCandidate;
import com.track.resolution.core.model.SourceTrack;
import com.track.resolution.scoring.TrackScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered guards; the first veto wins.
 */
public class GuardChain {
    private static final Logger log = LoggerFactory.getLogger(GuardChain.class);

    private final List<Guard> guards;

    public GuardChain(List<Guard> guards) {
        this.guards = List.copyOf(guards);
    }

    /**
     * title_sim_floor, then title_token_coverage, then remix_identity_conflict.
     */
    public static GuardChain standard(GuardThresholds thresholds, TrackScorer scorer) {
        return new GuardChain(List.of(
                new TitleSimilarityFloorGuard(thresholds.titleSimilarityFloor()),
                new TitleTokenCoverageGuard(thresholds.titleTokenCoverage(), scorer.getNormalizer()),
                new RemixIdentityConflictGuard(scorer, thresholds.remixConflictSimilarity())
        ));
    }

    public GuardResult evaluate(SourceTrack track, ScoredCandidate candidate) {
        for (Guard guard : guards) {
            GuardResult result = guard.evaluate(track, candidate);
            if (result.vetoed()) {
                log.debug("Candidate {} vetoed for track {}: {}",
                        candidate.candidate().catalogId(), track.id(), result.describe());
                return result;
            }
        }
        return GuardResult.pass();
    }

    public List<Guard> getGuards() {
        return guards;
    }
}

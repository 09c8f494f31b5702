package com.track.resolution.guard;

import com.track.resolution.core.model.ScoredCandidate;
import com.track.resolution.core.model.SourceTrack;

/**
 * Vetoes candidates whose title similarity is under an absolute floor, however well the artists match.
 */
public class TitleSimilarityFloorGuard implements Guard {

    public static final String NAME = "title_sim_floor";

    private final double floor;

    public TitleSimilarityFloorGuard(double floor) {
        this.floor = floor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GuardResult evaluate(SourceTrack track, ScoredCandidate candidate) {
        double similarity = candidate.breakdown().titleSimilarity();
        if (similarity < floor) {
            return GuardResult.veto(NAME, String.format("title similarity %.1f below floor %.1f", similarity, floor));
        }
        return GuardResult.pass();
    }
}

package com.track.resolution.guard;

import com.track.resolution.core.model.ScoredCandidate;
import com.track.resolution.core.model.SourceTrack;
import com.track.resolution.scoring.TrackScorer;

import java.util.Optional;

/**
 * Vetoes a different remix of the right song: the source names a remix and the candidate
 * names another, non-empty one. Labels differ when the remixers differ or when the version
 * types differ ("Keinemusik Dub" is not "Keinemusik Remix").
 */
public class RemixIdentityConflictGuard implements Guard {

    public static final String NAME = "remix_identity_conflict";

    private final TrackScorer scorer;
    private final double minLabelSimilarity;

    public RemixIdentityConflictGuard(TrackScorer scorer, double minLabelSimilarity) {
        this.scorer = scorer;
        this.minLabelSimilarity = minLabelSimilarity;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GuardResult evaluate(SourceTrack track, ScoredCandidate candidate) {
        Optional<String> sourceLabel = scorer.getRemixDetector().significantLabel(track.remixLabel());
        Optional<String> candidateLabel = scorer.getRemixDetector().significantLabel(candidate.candidate().mixLabel());
        if (sourceLabel.isEmpty() || candidateLabel.isEmpty()) {
            return GuardResult.pass();
        }
        if (scorer.mixTypeConflict(sourceLabel.get(), candidateLabel.get())) {
            return GuardResult.veto(NAME, String.format("candidate is '%s', expected '%s' (different mix type)",
                    candidateLabel.get(), sourceLabel.get()));
        }
        double similarity = scorer.labelSimilarity(sourceLabel.get(), candidateLabel.get());
        if (similarity < minLabelSimilarity) {
            return GuardResult.veto(NAME, String.format("candidate is '%s', expected '%s' (label similarity %.1f)",
                    candidateLabel.get(), sourceLabel.get(), similarity));
        }
        return GuardResult.pass();
    }
}

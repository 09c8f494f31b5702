package com.track.resolution.guard;

import com.track.resolution.core.model.ScoredCandidate;
import com.track.resolution.core.model.SourceTrack;

/**
 * Hard veto predicate applied after scoring. A veto cannot be overridden by the score.
 */
public interface Guard {

    String name();

    GuardResult evaluate(SourceTrack track, ScoredCandidate candidate);
}

package com.track.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Final outcome for one source track. Exactly one disposition is produced per track.
 *
 * @param trackId          the source track identity
 * @param type             matched, flagged for review or unmatched
 * @param match            the selected candidate when {@link DispositionType#MATCHED}, otherwise null
 * @param reviewCandidates candidates retained for manual inspection when flagged
 * @param reasons          human-readable reasons; for unmatched tracks the first entry is the reason
 */
public record Disposition(
        String trackId,
        DispositionType type,
        ScoredCandidate match,
        List<ScoredCandidate> reviewCandidates,
        List<String> reasons
) {
    public static final String NO_RESULTS = "no results";
    public static final String CANCELLED = "cancelled";
    public static final String ALL_VETOED = "all candidates vetoed";
    public static final String BELOW_REVIEW_FLOOR = "no candidate above review floor";

    public Disposition {
        Objects.requireNonNull(trackId, "trackId is required");
        Objects.requireNonNull(type, "type is required");
        reviewCandidates = reviewCandidates != null ? List.copyOf(reviewCandidates) : List.of();
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
        if (type == DispositionType.MATCHED && match == null) {
            throw new IllegalArgumentException("A matched disposition requires a candidate");
        }
    }

    public static Disposition matched(String trackId, ScoredCandidate match) {
        return new Disposition(trackId, DispositionType.MATCHED, match, List.of(), List.of());
    }

    public static Disposition flaggedForReview(String trackId, List<ScoredCandidate> candidates,
                                               List<String> reasons) {
        return new Disposition(trackId, DispositionType.FLAGGED_FOR_REVIEW, null, candidates, reasons);
    }

    public static Disposition unmatched(String trackId, String reason) {
        return new Disposition(trackId, DispositionType.UNMATCHED, null, List.of(), List.of(reason));
    }

    public boolean isMatched() {
        return type == DispositionType.MATCHED;
    }

    public boolean isFlaggedForReview() {
        return type == DispositionType.FLAGGED_FOR_REVIEW;
    }

    public boolean isUnmatched() {
        return type == DispositionType.UNMATCHED;
    }

    /**
     * The primary reason, or null for a match.
     */
    public String reason() {
        return reasons.isEmpty() ? null : reasons.get(0);
    }
}

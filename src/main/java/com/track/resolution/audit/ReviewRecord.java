package com.track.resolution.audit;

import java.util.List;

/**
 * A track flagged for manual review, with the retained candidates and the reasons.
 *
 * @param candidates retained candidates as "catalogId score title"
 */
public record ReviewRecord(
        String runId,
        String trackId,
        String sourceTitle,
        List<String> candidates,
        List<String> reasons
) {
    public ReviewRecord {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }
}

package com.track.resolution.audit;

import com.track.resolution.core.model.Disposition;
import com.track.resolution.core.model.DispositionType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * The final outcome for one track within one run.
 */
public record DispositionRecord(
        String runId,
        String trackId,
        DispositionType type,
        String matchedCatalogId,
        Double matchedScore,
        List<String> reasons,
        Duration elapsed,
        Instant recordedAt
) {
    public DispositionRecord {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    public static DispositionRecord of(String runId, Disposition disposition, Duration elapsed) {
        String catalogId = disposition.isMatched() ? disposition.match().candidate().catalogId() : null;
        Double score = disposition.isMatched() ? disposition.match().score() : null;
        return new DispositionRecord(runId, disposition.trackId(), disposition.type(), catalogId, score,
                disposition.reasons(), elapsed, Instant.now());
    }
}

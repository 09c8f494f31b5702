package com.track.resolution.api;

import com.track.resolution.core.model.Disposition;
import com.track.resolution.core.model.DispositionType;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispositions of a completed run, keyed by track id in submission order.
 */
public record RunResult(String runId, Map<String, Disposition> dispositions, Duration elapsed) {

    public RunResult {
        dispositions = Collections.unmodifiableMap(new LinkedHashMap<>(dispositions));
    }

    public Disposition get(String trackId) {
        return dispositions.get(trackId);
    }

    public int size() {
        return dispositions.size();
    }

    public Map<DispositionType, Long> countsByType() {
        Map<DispositionType, Long> counts = new EnumMap<>(DispositionType.class);
        for (DispositionType type : DispositionType.values()) {
            counts.put(type, 0L);
        }
        dispositions.values().forEach(d -> counts.merge(d.type(), 1L, Long::sum));
        return counts;
    }

    public long matchedCount() {
        return countsByType().get(DispositionType.MATCHED);
    }

    public long flaggedCount() {
        return countsByType().get(DispositionType.FLAGGED_FOR_REVIEW);
    }

    public long unmatchedCount() {
        return countsByType().get(DispositionType.UNMATCHED);
    }

    public List<Disposition> ofType(DispositionType type) {
        return dispositions.values().stream()
                .filter(d -> d.type() == type)
                .toList();
    }

    @Override
    public String toString() {
        return "RunResult{" +
                "runId='" + runId + '\'' +
                ", tracks=" + dispositions.size() +
                ", matched=" + matchedCount() +
                ", flagged=" + flaggedCount() +
                ", unmatched=" + unmatchedCount() +
                ", elapsedMs=" + elapsed.toMillis() +
                '}';
    }
}

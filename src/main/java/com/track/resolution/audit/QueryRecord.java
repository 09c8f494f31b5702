package com.track.resolution.audit;

import com.track.resolution.core.model.RawResponse;
import com.track.resolution.core.model.StrategyType;

import java.time.Duration;
import java.time.Instant;

/**
 * One query issued against one strategy, with timing and outcome.
 */
public record QueryRecord(
        String runId,
        String trackId,
        String queryText,
        int rank,
        StrategyType strategy,
        boolean fromCache,
        boolean success,
        String failureReason,
        int candidateCount,
        Duration latency,
        Instant fetchedAt
) {
    public static QueryRecord of(String runId, String trackId, RawResponse response, int candidateCount) {
        return new QueryRecord(runId, trackId, response.query().text(), response.query().rank(),
                response.strategy(), response.fromCache(), response.success(), response.failureReason(),
                candidateCount, response.latency(), response.fetchedAt());
    }
}

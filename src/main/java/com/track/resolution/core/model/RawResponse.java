package com.track.resolution.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Payload returned by a retrieval strategy for one query, with fetch metadata.
 * A failed fetch is represented as a response with {@code success == false};
 * strategies never throw for ordinary network or format errors.
 */
public record RawResponse(
        Query query,
        StrategyType strategy,
        PayloadFormat format,
        String body,
        String sourceUrl,
        boolean success,
        String failureReason,
        Instant fetchedAt,
        Duration latency,
        boolean fromCache
) {
    public RawResponse {
        Objects.requireNonNull(query, "query is required");
        Objects.requireNonNull(strategy, "strategy is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        format = format != null ? format : PayloadFormat.EMPTY;
        body = body != null ? body : "";
        latency = latency != null ? latency : Duration.ZERO;
    }

    public static RawResponse success(Query query, StrategyType strategy, PayloadFormat format,
                                      String body, String sourceUrl, Duration latency) {
        return new RawResponse(query, strategy, format, body, sourceUrl, true, null,
                Instant.now(), latency, false);
    }

    public static RawResponse failure(Query query, StrategyType strategy, String reason, Duration latency) {
        return new RawResponse(query, strategy, PayloadFormat.EMPTY, "", null, false, reason,
                Instant.now(), latency, false);
    }

    /**
     * Rebinds a cached response to the query currently being served, marking it as a cache hit.
     * The original fetch timestamp is kept.
     */
    public RawResponse forQuery(Query current) {
        return new RawResponse(current, strategy, format, body, sourceUrl, success, failureReason,
                fetchedAt, latency, true);
    }

    public boolean isEmpty() {
        return format == PayloadFormat.EMPTY || body.isBlank();
    }
}

package com.track.resolution.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A search string produced by the query planner.
 *
 * @param text     the search text as sent to the retrieval strategy
 * @param strategy the retrieval strategy this query targets
 * @param rank     position in the planned sequence, 0 being the most specific
 */
public record Query(String text, StrategyType strategy, int rank) {

    public Query {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(strategy, "strategy is required");
        if (rank < 0) {
            throw new IllegalArgumentException("rank must be >= 0");
        }
    }

    /**
     * Case-folded, whitespace-collapsed form used as the cache key.
     */
    public String normalizedText() {
        return text.toLowerCase(Locale.ROOT)
                .replace("\"", "")
                .trim()
                .replaceAll("\\s+", " ");
    }

    public Query withStrategy(StrategyType other) {
        return other == strategy ? this : new Query(text, other, rank);
    }
}

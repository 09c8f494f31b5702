package com.track.resolution.cache;

import com.track.resolution.core.model.Query;
import com.track.resolution.core.model.StrategyType;

import java.util.Objects;

/**
 * Cache key combining the normalized query text and the strategy that fetched it.
 */
public record CacheKey(String normalizedQuery, StrategyType strategy) {

    public CacheKey {
        Objects.requireNonNull(normalizedQuery, "normalizedQuery is required");
        Objects.requireNonNull(strategy, "strategy is required");
    }

    public static CacheKey of(Query query) {
        return new CacheKey(query.normalizedText(), query.strategy());
    }

    /**
     * Stable string form, "strategy|query".
     */
    public String asString() {
        return strategy.tag() + "|" + normalizedQuery;
    }
}

package com.track.resolution.cache;

import com.track.resolution.core.model.RawResponse;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpResponseCache implements ResponseCache {

    @Override
    public Optional<RawResponse> get(CacheKey key) {
        return Optional.empty();
    }

    @Override
    public boolean putIfAbsent(CacheKey key, RawResponse response) {
        return false;
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}

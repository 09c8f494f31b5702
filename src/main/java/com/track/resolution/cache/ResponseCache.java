package com.track.resolution.cache;

import com.track.resolution.core.model.RawResponse;

import java.util.Optional;

/**
 * Read-through store of raw responses keyed by (normalized query, strategy).
 * Entries are written once: the first writer wins and later writes for the same key are dropped.
 */
public interface ResponseCache {

    /**
     * @return the cached response, or empty on a miss
     * @throws CacheException if the storage is unavailable
     */
    Optional<RawResponse> get(CacheKey key);

    /**
     * Stores a response unless the key is already present.
     *
     * @return true if this call stored the response
     * @throws CacheException if the storage is unavailable
     */
    boolean putIfAbsent(CacheKey key, RawResponse response);

    void invalidateAll();

    CacheStats getStats();
}

package com.track.resolution.cache;

/**
 * Configuration for the response cache.
 *
 * @param maxSize    maximum number of in-memory entries
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 * @param persistent whether entries are stored on disk and survive the run
 * @param directory  storage directory for the persistent cache, may be null when not persistent
 */
public record CacheConfig(int maxSize, long ttlSeconds, boolean enabled, boolean persistent, String directory) {

    public static final int DEFAULT_MAX_SIZE = 10_000;
    public static final long DEFAULT_TTL_SECONDS = 86_400;
    public static final long PERSISTENT_TTL_SECONDS = 7 * 86_400;

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
        if (persistent && (directory == null || directory.isBlank())) {
            throw new IllegalArgumentException("directory is required for a persistent cache");
        }
    }

    /**
     * Memory-only cache: 10,000 responses, 24h TTL.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_MAX_SIZE, DEFAULT_TTL_SECONDS, true, false, null);
    }

    /**
     * On-disk cache in the given directory: 7 day TTL.
     */
    public static CacheConfig persistent(String directory) {
        return new CacheConfig(DEFAULT_MAX_SIZE, PERSISTENT_TTL_SECONDS, true, true, directory);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false, false, null);
    }
}

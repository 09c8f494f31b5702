package com.track.resolution.cache;

/**
 * Cache counters.
 *
 * @param hitCount       number of cache hits
 * @param missCount      number of cache misses
 * @param evictionCount  number of evictions or expirations observed
 * @param size           current number of entries
 * @param rejectedWrites writes dropped because the key was already stored
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size, long rejectedWrites) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0);
    }
}

package com.track.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.track.resolution.core.model.RawResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory response cache for a single run, backed by Caffeine.
 */
public class CaffeineResponseCache implements ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResponseCache.class);

    private final Cache<CacheKey, RawResponse> cache;
    private final AtomicLong rejectedWrites = new AtomicLong();

    public CaffeineResponseCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineResponseCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<RawResponse> get(CacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public boolean putIfAbsent(CacheKey key, RawResponse response) {
        RawResponse existing = cache.asMap().putIfAbsent(key, response);
        if (existing != null) {
            rejectedWrites.incrementAndGet();
            log.debug("Cache entry for {} already present, keeping first write", key.asString());
            return false;
        }
        return true;
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount(),
                cache.estimatedSize(),
                rejectedWrites.get()
        );
    }
}

package com.track.resolution.cache;

import com.track.resolution.core.model.RawResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Wraps a cache so that storage failures switch it to bypass mode instead of failing the run.
 * After the first {@link CacheException} every read is a miss and every write is dropped.
 */
public class FailSafeResponseCache implements ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(FailSafeResponseCache.class);

    private final ResponseCache delegate;
    private final AtomicBoolean bypassed = new AtomicBoolean(false);
    private volatile Consumer<CacheException> errorListener = e -> { };

    public FailSafeResponseCache(ResponseCache delegate) {
        this.delegate = delegate;
    }

    /**
     * Registers a callback invoked once, when the cache switches to bypass mode.
     */
    public void onError(Consumer<CacheException> listener) {
        this.errorListener = listener != null ? listener : e -> { };
    }

    @Override
    public Optional<RawResponse> get(CacheKey key) {
        if (bypassed.get()) {
            return Optional.empty();
        }
        try {
            return delegate.get(key);
        } catch (CacheException e) {
            bypass(e);
            return Optional.empty();
        }
    }

    @Override
    public boolean putIfAbsent(CacheKey key, RawResponse response) {
        if (bypassed.get()) {
            return false;
        }
        try {
            return delegate.putIfAbsent(key, response);
        } catch (CacheException e) {
            bypass(e);
            return false;
        }
    }

    @Override
    public void invalidateAll() {
        try {
            delegate.invalidateAll();
        } catch (CacheException e) {
            bypass(e);
        }
    }

    @Override
    public CacheStats getStats() {
        if (bypassed.get()) {
            return CacheStats.empty();
        }
        try {
            return delegate.getStats();
        } catch (CacheException e) {
            bypass(e);
            return CacheStats.empty();
        }
    }

    public boolean isBypassed() {
        return bypassed.get();
    }

    private void bypass(CacheException e) {
        if (bypassed.compareAndSet(false, true)) {
            log.warn("Response cache unavailable, continuing without cache: {}", e.getMessage());
            errorListener.accept(e);
        }
    }
}

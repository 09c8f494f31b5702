package com.track.resolution.retrieval;

import com.track.resolution.core.model.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide throttle per retrieval strategy: a cap on concurrent requests plus a
 * token bucket limiting the request rate.
 *
 * <pre>
 * try (RateLimiter.Permit permit = rateLimiter.acquire(StrategyType.DIRECT_SEARCH)) {
 *     response = strategy.fetch(query);
 * }
 * </pre>
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    /**
     * Limits for one strategy.
     *
     * @param maxConcurrent     concurrent requests in flight
     * @param requestsPerSecond sustained request rate; also the burst size
     */
    public record Limit(int maxConcurrent, int requestsPerSecond) {
        public Limit {
            if (maxConcurrent <= 0) {
                throw new IllegalArgumentException("maxConcurrent must be > 0");
            }
            if (requestsPerSecond <= 0) {
                throw new IllegalArgumentException("requestsPerSecond must be > 0");
            }
        }
    }

    /**
     * Held while a request is in flight; closing returns the concurrency slot.
     */
    public interface Permit extends AutoCloseable {
        @Override
        void close();
    }

    private final Map<StrategyType, Semaphore> concurrency = new EnumMap<>(StrategyType.class);
    private final Map<StrategyType, TokenBucket> buckets = new EnumMap<>(StrategyType.class);

    public RateLimiter(Map<StrategyType, Limit> limits) {
        for (StrategyType type : StrategyType.values()) {
            Limit limit = limits.getOrDefault(type, defaultLimit(type));
            concurrency.put(type, new Semaphore(limit.maxConcurrent(), true));
            buckets.put(type, new TokenBucket(limit.requestsPerSecond(), limit.requestsPerSecond()));
        }
    }

    public static RateLimiter defaults() {
        return new RateLimiter(Map.of());
    }

    static Limit defaultLimit(StrategyType type) {
        return switch (type) {
            case DIRECT_SEARCH -> new Limit(8, 10);
            case ENGINE_FALLBACK -> new Limit(2, 2);
            case BROWSER_AUTOMATION -> new Limit(2, 1);
        };
    }

    /**
     * Blocks until both a concurrency slot and a rate token are available.
     */
    public Permit acquire(StrategyType type) throws InterruptedException {
        Semaphore semaphore = concurrency.get(type);
        semaphore.acquire();
        try {
            buckets.get(type).take();
        } catch (InterruptedException e) {
            semaphore.release();
            throw e;
        }
        return semaphore::release;
    }

    int availableSlots(StrategyType type) {
        return concurrency.get(type).availablePermits();
    }

    /**
     * Lock-free token bucket; tokens are stored in thousandths.
     */
    static class TokenBucket {
        private final int maxTokens;
        private final double refillPerNano;
        private final AtomicLong tokens;
        private final AtomicLong lastRefillNanos;

        TokenBucket(int maxTokens, int tokensPerSecond) {
            this.maxTokens = maxTokens;
            this.refillPerNano = tokensPerSecond / 1_000_000_000.0;
            this.tokens = new AtomicLong((long) maxTokens * 1000);
            this.lastRefillNanos = new AtomicLong(System.nanoTime());
        }

        void take() throws InterruptedException {
            while (!tryConsume()) {
                long waitMillis = Math.max(1L, (long) (1.0 / refillPerNano / 1_000_000.0));
                log.trace("Rate limit reached, waiting {}ms", waitMillis);
                Thread.sleep(Math.min(waitMillis, 250L));
            }
        }

        boolean tryConsume() {
            refill();
            while (true) {
                long current = tokens.get();
                if (current < 1000) {
                    return false;
                }
                if (tokens.compareAndSet(current, current - 1000)) {
                    return true;
                }
            }
        }

        private void refill() {
            long now = System.nanoTime();
            long last = lastRefillNanos.get();
            long elapsed = now - last;
            if (elapsed <= 0) {
                return;
            }
            long newTokens = (long) (elapsed * refillPerNano * 1000);
            if (newTokens <= 0) {
                return;
            }
            if (lastRefillNanos.compareAndSet(last, now)) {
                tokens.updateAndGet(current -> Math.min((long) maxTokens * 1000, current + newTokens));
            }
        }
    }
}

package com.track.resolution.adjudication;

import com.track.resolution.cache.CacheKey;
import com.track.resolution.cache.NoOpResponseCache;
import com.track.resolution.cache.ResponseCache;
import com.track.resolution.core.model.Query;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.core.model.StrategyType;
import com.track.resolution.metrics.MetricsService;
import com.track.resolution.metrics.NoOpMetricsService;
import com.track.resolution.retrieval.RateLimiter;
import com.track.resolution.retrieval.RetrievalStrategy;
import com.track.resolution.tracing.NoOpTracingService;
import com.track.resolution.tracing.Span;
import com.track.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Serves (query, strategy) pairs through the response cache, the rate limiter and
 * the retrieval strategy, retrying a failed fetch once after a backoff.
 *
 * <p>Fetches run on a separate I/O executor so a waiting adjudication can stop
 * waiting when its run is cancelled. An abandoned fetch is left to finish on its
 * own and its result is discarded.</p>
 *
 * <p>Only successful responses are cached; the first writer of a key wins.</p>
 */
public class RetrievalCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetrievalCoordinator.class);

    static final long POLL_INTERVAL_MS = 100;

    private final Map<StrategyType, RetrievalStrategy> strategies;
    private final ResponseCache cache;
    private final RateLimiter rateLimiter;
    private final ExecutorService ioExecutor;
    private final boolean ownsExecutor;
    private final Duration retryBackoff;
    private final MetricsService metrics;
    private final TracingService tracing;

    private RetrievalCoordinator(Builder builder) {
        this.strategies = new EnumMap<>(StrategyType.class);
        for (RetrievalStrategy strategy : builder.strategies) {
            this.strategies.put(strategy.type(), strategy);
        }
        this.cache = builder.cache;
        this.rateLimiter = builder.rateLimiter;
        this.ownsExecutor = builder.ioExecutor == null;
        this.ioExecutor = builder.ioExecutor != null ? builder.ioExecutor : Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "track-retrieval-io");
            t.setDaemon(true);
            return t;
        });
        this.retryBackoff = builder.retryBackoff;
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;
    }

    /**
     * True when a strategy of this type is configured and reports itself available.
     */
    public boolean isUsable(StrategyType type) {
        RetrievalStrategy strategy = strategies.get(type);
        if (strategy == null) {
            return false;
        }
        try {
            return strategy.isAvailable();
        } catch (RuntimeException e) {
            log.warn("Availability check of {} strategy failed: {}", type.tag(), e.toString());
            return false;
        }
    }

    /**
     * Serves the query with the strategy it is tagged with.
     *
     * @throws CancellationException if the token is cancelled while waiting
     * @throws IllegalArgumentException if no strategy of the query's type is configured
     */
    public RetrievalAttempt retrieve(Query query, CancellationToken token) {
        RetrievalStrategy strategy = strategies.get(query.strategy());
        if (strategy == null) {
            throw new IllegalArgumentException("No " + query.strategy().tag() + " strategy configured");
        }
        CacheKey key = CacheKey.of(query);

        Optional<RawResponse> cached = cache.get(key);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            log.debug("Cache hit for {}", key.asString());
            return new RetrievalAttempt(cached.get().forQuery(query), List.of());
        }
        metrics.recordCacheMiss();

        List<String> failures = new ArrayList<>();
        RawResponse response = fetch(strategy, query, token);
        if (!response.success()) {
            failures.add(response.failureReason());
            metrics.incrementRetrievalFailure(query.strategy());
            log.debug("{} fetch for '{}' failed ({}), retrying in {}ms", query.strategy().tag(),
                    query.text(), response.failureReason(), retryBackoff.toMillis());
            sleep(retryBackoff, token);
            response = fetch(strategy, query, token);
            if (!response.success()) {
                failures.add(response.failureReason());
                metrics.incrementRetrievalFailure(query.strategy());
            }
        }

        if (response.success()) {
            cache.putIfAbsent(key, response);
        }
        return new RetrievalAttempt(response, failures);
    }

    private RawResponse fetch(RetrievalStrategy strategy, Query query, CancellationToken token) {
        token.throwIfCancelled();
        metrics.incrementQueryIssued(query.strategy());
        Future<RawResponse> future = ioExecutor.submit(() -> {
            try (Span span = tracing.startSpan(TracingService.RETRIEVE_SPAN,
                    Map.of("strategy", query.strategy().tag(), "query.rank", String.valueOf(query.rank())));
                 RateLimiter.Permit ignored = rateLimiter.acquire(query.strategy())) {
                RawResponse response = strategy.fetch(query);
                span.setStatus(response.success() ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
                return response;
            }
        });
        return await(future, query, token);
    }

    private RawResponse await(Future<RawResponse> future, Query query, CancellationToken token) {
        long start = System.nanoTime();
        while (true) {
            if (token.isCancelled()) {
                log.debug("Abandoning {} fetch for '{}'", query.strategy().tag(), query.text());
                throw new CancellationException("Resolution run cancelled");
            }
            try {
                return future.get(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.trace("Still waiting on {} fetch for '{}'", query.strategy().tag(), query.text());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("{} strategy threw for '{}': {}", query.strategy().tag(), query.text(), cause.toString());
                return RawResponse.failure(query, query.strategy(), cause.toString(),
                        Duration.ofNanos(System.nanoTime() - start));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for retrieval");
            }
        }
    }

    private static void sleep(Duration backoff, CancellationToken token) {
        long deadline = System.nanoTime() + backoff.toNanos();
        try {
            while (System.nanoTime() < deadline) {
                token.throwIfCancelled();
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                Thread.sleep(Math.max(1, Math.min(remainingMs, POLL_INTERVAL_MS)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during retry backoff");
        }
    }

    public ResponseCache getCache() {
        return cache;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            ioExecutor.shutdownNow();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<RetrievalStrategy> strategies = new ArrayList<>();
        private ResponseCache cache = new NoOpResponseCache();
        private RateLimiter rateLimiter = RateLimiter.defaults();
        private ExecutorService ioExecutor;
        private Duration retryBackoff = Duration.ofMillis(500);
        private MetricsService metrics = new NoOpMetricsService();
        private TracingService tracing = new NoOpTracingService();

        public Builder strategy(RetrievalStrategy strategy) {
            this.strategies.add(strategy);
            return this;
        }

        public Builder strategies(List<RetrievalStrategy> strategies) {
            this.strategies.addAll(strategies);
            return this;
        }

        public Builder cache(ResponseCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        /**
         * Executor that runs the fetches; when not set a daemon cached pool is created
         * and shut down on {@link #close()}.
         */
        public Builder ioExecutor(ExecutorService ioExecutor) {
            this.ioExecutor = ioExecutor;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public RetrievalCoordinator build() {
            return new RetrievalCoordinator(this);
        }
    }
}

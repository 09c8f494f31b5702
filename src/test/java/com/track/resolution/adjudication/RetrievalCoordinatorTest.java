package com.track.resolution.adjudication;

import com.track.resolution.cache.CacheConfig;
import com.track.resolution.cache.CacheKey;
import com.track.resolution.cache.CaffeineResponseCache;
import com.track.resolution.core.model.Query;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.core.model.StrategyType;
import com.track.resolution.metrics.MetricsService;
import com.track.resolution.retrieval.FakeRetrievalStrategy;
import com.track.resolution.retrieval.RetrievalStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("RetrievalCoordinator Tests")
class RetrievalCoordinatorTest {

    private static final Query QUERY = new Query("Lost In Time Adam Port", StrategyType.DIRECT_SEARCH, 0);

    private RetrievalCoordinator coordinator;

    @AfterEach
    void tearDown() {
        if (coordinator != null) {
            coordinator.close();
        }
    }

    @Test
    @DisplayName("Should cache successful responses and serve them as cached")
    void cachesSuccess() {
        FakeRetrievalStrategy direct = FakeRetrievalStrategy.json(StrategyType.DIRECT_SEARCH, q -> "{\"results\":[]}");
        CaffeineResponseCache cache = new CaffeineResponseCache(CacheConfig.defaults());
        coordinator = RetrievalCoordinator.builder().strategy(direct).cache(cache).build();

        RetrievalAttempt first = coordinator.retrieve(QUERY, CancellationToken.none());
        Query laterRank = new Query("lost in time  adam port", StrategyType.DIRECT_SEARCH, 2);
        RetrievalAttempt second = coordinator.retrieve(laterRank, CancellationToken.none());

        assertTrue(first.succeeded());
        assertFalse(first.response().fromCache());
        assertTrue(second.response().fromCache());
        assertEquals(2, second.response().query().rank());
        assertEquals(1, direct.calls());
        assertTrue(cache.get(CacheKey.of(QUERY)).isPresent());
    }

    @Test
    @DisplayName("Should not cache failures")
    void doesNotCacheFailures() {
        FakeRetrievalStrategy direct = FakeRetrievalStrategy.failing(StrategyType.DIRECT_SEARCH, "HTTP 500");
        CaffeineResponseCache cache = new CaffeineResponseCache(CacheConfig.defaults());
        coordinator = RetrievalCoordinator.builder()
                .strategy(direct)
                .cache(cache)
                .retryBackoff(Duration.ZERO)
                .build();

        RetrievalAttempt attempt = coordinator.retrieve(QUERY, CancellationToken.none());

        assertFalse(attempt.succeeded());
        assertEquals(2, attempt.failures().size());
        assertEquals("HTTP 500", attempt.failures().get(0));
        assertTrue(cache.get(CacheKey.of(QUERY)).isEmpty());
    }

    @Test
    @DisplayName("Should retry once after the backoff")
    void retriesAfterBackoff() {
        AtomicInteger attempts = new AtomicInteger();
        FakeRetrievalStrategy direct = new FakeRetrievalStrategy(StrategyType.DIRECT_SEARCH, q ->
                attempts.incrementAndGet() == 1
                        ? RawResponse.failure(q, StrategyType.DIRECT_SEARCH, "timeout", Duration.ZERO)
                        : FakeRetrievalStrategy.ok(q, StrategyType.DIRECT_SEARCH, "application/json", "{}"));
        MetricsService metrics = mock(MetricsService.class);
        coordinator = RetrievalCoordinator.builder()
                .strategy(direct)
                .retryBackoff(Duration.ofMillis(50))
                .metrics(metrics)
                .build();

        long start = System.nanoTime();
        RetrievalAttempt attempt = coordinator.retrieve(QUERY, CancellationToken.none());
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(attempt.succeeded());
        assertEquals(1, attempt.failures().size());
        assertTrue(elapsedMs >= 50, "Backoff not honoured: " + elapsedMs + "ms");
        verify(metrics, times(2)).incrementQueryIssued(StrategyType.DIRECT_SEARCH);
        verify(metrics).incrementRetrievalFailure(StrategyType.DIRECT_SEARCH);
    }

    @Test
    @DisplayName("A strategy that throws should count as a failed fetch")
    void strategyExceptionIsFailure() {
        RetrievalStrategy broken = new FakeRetrievalStrategy(StrategyType.DIRECT_SEARCH, q -> {
            throw new IllegalStateException("parser exploded");
        });
        coordinator = RetrievalCoordinator.builder().strategy(broken).retryBackoff(Duration.ZERO).build();

        RetrievalAttempt attempt = coordinator.retrieve(QUERY, CancellationToken.none());

        assertFalse(attempt.succeeded());
        assertTrue(attempt.response().failureReason().contains("parser exploded"));
    }

    @Test
    @DisplayName("Should throw when the token is already cancelled")
    void cancelledToken() {
        FakeRetrievalStrategy direct = FakeRetrievalStrategy.json(StrategyType.DIRECT_SEARCH, q -> "{}");
        coordinator = RetrievalCoordinator.builder().strategy(direct).build();
        CancellationToken token = new CancellationToken();
        assertTrue(token.cancel());
        assertFalse(token.cancel());

        assertThrows(CancellationException.class, () -> coordinator.retrieve(QUERY, token));
        assertEquals(0, direct.calls());
    }

    @Test
    @DisplayName("Should report usability from configured strategies")
    void usability() {
        FakeRetrievalStrategy direct = FakeRetrievalStrategy.json(StrategyType.DIRECT_SEARCH, q -> "{}");
        FakeRetrievalStrategy engine = FakeRetrievalStrategy.json(StrategyType.ENGINE_FALLBACK, q -> "{}")
                .available(false);
        coordinator = RetrievalCoordinator.builder().strategy(direct).strategy(engine).build();

        assertTrue(coordinator.isUsable(StrategyType.DIRECT_SEARCH));
        assertFalse(coordinator.isUsable(StrategyType.ENGINE_FALLBACK));
        assertFalse(coordinator.isUsable(StrategyType.BROWSER_AUTOMATION));
        assertThrows(IllegalArgumentException.class, () -> coordinator.retrieve(
                QUERY.withStrategy(StrategyType.BROWSER_AUTOMATION), CancellationToken.none()));
    }

    @Test
    @DisplayName("A coordinator without strategies has nothing usable")
    void noStrategies() {
        coordinator = RetrievalCoordinator.builder().build();

        for (StrategyType type : StrategyType.values()) {
            assertFalse(coordinator.isUsable(type));
        }
        assertThrows(IllegalArgumentException.class, () -> coordinator.retrieve(QUERY, CancellationToken.none()));
    }
}

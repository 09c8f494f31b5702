package com.track.resolution.metrics;

import com.track.resolution.core.model.DispositionType;
import com.track.resolution.core.model.StrategyType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code track.resolution.duration} (Timer, tag: disposition)</li>
 *   <li>{@code track.query.issued} (Counter, tag: strategy)</li>
 *   <li>{@code track.retrieval.failure} (Counter, tag: strategy)</li>
 *   <li>{@code track.escalation} (Counter, tag: strategy)</li>
 *   <li>{@code track.candidate.score} (DistributionSummary)</li>
 *   <li>{@code track.guard.veto} (Counter, tag: guard)</li>
 *   <li>{@code track.cache.hit}, {@code track.cache.miss} (Counter)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary candidateScoreSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.candidateScoreSummary = DistributionSummary.builder("track.candidate.score")
                .description("Distribution of composite candidate scores")
                .register(registry);
        this.cacheHitCounter = Counter.builder("track.cache.hit")
                .description("Number of response cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("track.cache.miss")
                .description("Number of response cache misses")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(DispositionType disposition, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(disposition.name(), k ->
                Timer.builder("track.resolution.duration")
                        .description("Duration of track adjudication")
                        .tag("disposition", disposition.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementQueryIssued(StrategyType strategy) {
        strategyCounter("track.query.issued", "Number of queries sent to a retrieval strategy", strategy)
                .increment();
    }

    @Override
    public void incrementRetrievalFailure(StrategyType strategy) {
        strategyCounter("track.retrieval.failure", "Number of failed retrieval attempts", strategy)
                .increment();
    }

    @Override
    public void incrementEscalation(StrategyType target) {
        strategyCounter("track.escalation", "Number of escalations to a fallback strategy", target)
                .increment();
    }

    @Override
    public void recordCandidateScore(double score) {
        candidateScoreSummary.record(score);
    }

    @Override
    public void incrementGuardVeto(String guardName) {
        Counter counter = counterCache.computeIfAbsent("veto:" + guardName, k ->
                Counter.builder("track.guard.veto")
                        .description("Number of candidates vetoed by a guard")
                        .tag("guard", guardName)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter strategyCounter(String name, String description, StrategyType strategy) {
        return counterCache.computeIfAbsent(name + ":" + strategy.tag(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("strategy", strategy.tag())
                        .register(registry));
    }
}

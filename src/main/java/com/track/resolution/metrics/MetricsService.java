package com.track.resolution.metrics;

import com.track.resolution.core.model.DispositionType;
import com.track.resolution.core.model.StrategyType;

import java.time.Duration;

/**
 * Interface for recording track resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordResolutionDuration(DispositionType disposition, Duration duration);

    void incrementQueryIssued(StrategyType strategy);

    void incrementRetrievalFailure(StrategyType strategy);

    void incrementEscalation(StrategyType target);

    void recordCandidateScore(double score);

    void incrementGuardVeto(String guardName);

    void recordCacheHit();

    void recordCacheMiss();
}

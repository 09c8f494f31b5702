package com.track.resolution.metrics;

import com.track.resolution.core.model.DispositionType;
import com.track.resolution.core.model.StrategyType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(DispositionType disposition, Duration duration) {
    }

    @Override
    public void incrementQueryIssued(StrategyType strategy) {
    }

    @Override
    public void incrementRetrievalFailure(StrategyType strategy) {
    }

    @Override
    public void incrementEscalation(StrategyType target) {
    }

    @Override
    public void recordCandidateScore(double score) {
    }

    @Override
    public void incrementGuardVeto(String guardName) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}

package com.incident.dedup.metrics;

import com.incident.dedup.core.model.ConfidenceBand;
import com.incident.dedup.core.model.MatchState;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordPairScore(double score) {
    }

    @Override
    public void incrementMatch(ConfidenceBand band) {
    }

    @Override
    public void incrementMerge(MergeOutcome outcome) {
    }

    @Override
    public void incrementCandidateOutcome(MatchState state) {
    }

    @Override
    public void recordRunDuration(Duration duration, boolean dryRun) {
    }

    @Override
    public void recordWindowSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}

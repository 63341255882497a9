package com.incident.dedup.metrics;

import com.incident.dedup.core.model.ConfidenceBand;
import com.incident.dedup.core.model.MatchState;

import java.time.Duration;

/**
 * Interface for recording deduplication metrics.
 * The default {@link NoOpMetricsService} does nothing.
 */
public interface MetricsService {

    void recordPairScore(double score);

    void incrementMatch(ConfidenceBand band);

    void incrementMerge(MergeOutcome outcome);

    void incrementCandidateOutcome(MatchState state);

    void recordRunDuration(Duration duration, boolean dryRun);

    void recordWindowSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}

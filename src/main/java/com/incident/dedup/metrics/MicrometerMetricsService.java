package com.incident.dedup.metrics;

import com.incident.dedup.core.model.ConfidenceBand;
import com.incident.dedup.core.model.MatchState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dedup.pair.score}: DistributionSummary of non-rejected pair scores</li>
 *   <li>{@code dedup.match}: Counter (tag: band)</li>
 *   <li>{@code dedup.merge}: Counter (tag: outcome)</li>
 *   <li>{@code dedup.candidate.outcome}: Counter (tag: state)</li>
 *   <li>{@code dedup.run.duration}: Timer (tag: dryRun)</li>
 *   <li>{@code dedup.window.size}: DistributionSummary</li>
 *   <li>{@code dedup.cache.hit} / {@code dedup.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary pairScoreSummary;
    private final DistributionSummary windowSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.pairScoreSummary = DistributionSummary.builder("dedup.pair.score")
                .description("Composite scores of compared pairs")
                .register(registry);
        this.windowSizeSummary = DistributionSummary.builder("dedup.window.size")
                .description("Records loaded per deduplication run")
                .register(registry);
        this.cacheHitCounter = Counter.builder("dedup.cache.hit")
                .description("Reference cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("dedup.cache.miss")
                .description("Reference cache misses")
                .register(registry);
    }

    @Override
    public void recordPairScore(double score) {
        pairScoreSummary.record(score);
    }

    @Override
    public void incrementMatch(ConfidenceBand band) {
        counter("dedup.match", "band", band.name(), "Pairs at or above the merge threshold").increment();
    }

    @Override
    public void incrementMerge(MergeOutcome outcome) {
        counter("dedup.merge", "outcome", outcome.name(), "Merge attempts by outcome").increment();
    }

    @Override
    public void incrementCandidateOutcome(MatchState state) {
        counter("dedup.candidate.outcome", "state", state.name(), "Ingest-time matching outcomes").increment();
    }

    @Override
    public void recordRunDuration(Duration duration, boolean dryRun) {
        String key = "run:" + dryRun;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("dedup.run.duration")
                        .description("Duration of deduplication runs")
                        .tag("dryRun", Boolean.toString(dryRun))
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordWindowSize(int size) {
        windowSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String name, String tag, String value, String description) {
        return counterCache.computeIfAbsent(name + ":" + value, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tag, value)
                        .register(registry));
    }
}

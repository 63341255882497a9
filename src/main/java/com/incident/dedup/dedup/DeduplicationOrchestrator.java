package com.incident.dedup.dedup;

import com.incident.dedup.audit.AuditService;
import com.incident.dedup.audit.MergeIntegrityChecker;
import com.incident.dedup.audit.MergeLedger;
import com.incident.dedup.core.model.ConfidenceBand;
import com.incident.dedup.core.model.MergeStatus;
import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.core.model.SimilarityScore;
import com.incident.dedup.lock.DistributedLock;
import com.incident.dedup.lock.NoOpDistributedLock;
import com.incident.dedup.logging.LogContext;
import com.incident.dedup.merge.MergePlanner;
import com.incident.dedup.metrics.MergeOutcome;
import com.incident.dedup.metrics.MetricsService;
import com.incident.dedup.metrics.NoOpMetricsService;
import com.incident.dedup.quality.PrimarySelection;
import com.incident.dedup.quality.RecordQualityRanker;
import com.incident.dedup.scoring.CompositeScorer;
import com.incident.dedup.scoring.ScoringProfile;
import com.incident.dedup.store.IncidentStore;
import com.incident.dedup.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Batch deduplication pass over recently modified records.
 *
 * <p>Loads the newest records of the lookback window, compares every cross-source pair once,
 * and merges pairs at or above the confidence threshold. Each record takes part in at most one
 * merge per pass. Per-pair failures are counted in the summary and never abort the pass; only a
 * failure to load the window does.</p>
 *
 * <p>A record that has already absorbed others always stays primary, and two such records are
 * never paired, so merges stay one level deep.</p>
 */
public class DeduplicationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(DeduplicationOrchestrator.class);

    private final IncidentStore store;
    private final CompositeScorer scorer;
    private final RecordQualityRanker ranker;
    private final MergeExecutor executor;
    private final MetricsService metricsService;
    private final Clock clock;

    private DeduplicationOrchestrator(Builder builder) {
        this.store = builder.store;
        this.scorer = builder.scorer;
        this.ranker = builder.ranker;
        this.metricsService = builder.metricsService;
        this.clock = builder.clock;
        this.executor = new MergeExecutor(builder.store, builder.planner, builder.lock, builder.ledger,
                builder.auditService, new MergeIntegrityChecker(builder.auditService), builder.metricsService);
    }

    /**
     * Runs one pass.
     *
     * @throws DeduplicationRunException if the record window cannot be loaded
     */
    public DeduplicationSummary run(DeduplicationOptions options) {
        String runId = UUID.randomUUID().toString();
        Instant started = clock.instant();
        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("dedup.run.started lookback={} maxRecords={} threshold={} dryRun={}",
                    options.getLookback(), options.getMaxRecords(),
                    options.getConfidenceThreshold(), options.isDryRun());

            List<RawRecord> window = loadWindow(runId, started.minus(options.getLookback()), options.getMaxRecords());
            metricsService.recordWindowSize(window.size());

            Counters counters = new Counters();
            List<PlannedMerge> planned = new ArrayList<>();
            Set<String> consumed = new HashSet<>();

            for (int i = 0; i < window.size(); i++) {
                RawRecord first = window.get(i);
                for (int j = i + 1; j < window.size() && !consumed.contains(first.getId()); j++) {
                    RawRecord second = window.get(j);
                    if (consumed.contains(second.getId()) || !comparable(first, second)) {
                        continue;
                    }

                    SimilarityScore score = scorer.score(first, second);
                    counters.checked++;
                    if (!score.isRejected()) {
                        metricsService.recordPairScore(score.total());
                    }
                    if (score.total() < options.getConfidenceThreshold()) {
                        continue;
                    }

                    ConfidenceBand band = ConfidenceBand.of(score.total(), options.getHighConfidenceThreshold());
                    if (band == ConfidenceBand.HIGH) {
                        counters.high++;
                    } else {
                        counters.medium++;
                    }
                    metricsService.incrementMatch(band);
                    consumed.add(first.getId());
                    consumed.add(second.getId());

                    PrimarySelection selection = keepExistingPrimary(ranker.determinePrimary(first, second));
                    RawRecord primary = selection.primary();
                    RawRecord secondary = selection.secondary();
                    if (options.isDryRun()) {
                        planned.add(new PlannedMerge(primary.getId(), secondary.getId(),
                                primary.getSource(), secondary.getSource(), score.total(), band));
                        log.info("dedup.merge.planned primary={} secondary={} score={} band={}",
                                primary.getId(), secondary.getId(), score.total(), band);
                        continue;
                    }

                    counters.attempted++;
                    MergeOutcome outcome = executor.merge(runId, primary.getId(), secondary.getId(),
                            score, band, options.getTriggeredBy());
                    if (outcome == MergeOutcome.SUCCEEDED) {
                        counters.succeeded++;
                    } else {
                        counters.errors++;
                    }
                }
            }

            DeduplicationSummary summary = new DeduplicationSummary(runId, window.size(), countSources(window),
                    counters.checked, counters.high, counters.medium,
                    counters.attempted, counters.succeeded, counters.errors,
                    options.isDryRun(), planned);
            Duration elapsed = Duration.between(started, clock.instant());
            metricsService.recordRunDuration(elapsed, options.isDryRun());
            log.info("dedup.run.completed recordsAnalyzed={} sources={} pairsChecked={} high={} medium={} "
                            + "attempted={} succeeded={} errors={} dryRun={} durationMs={}",
                    summary.recordsAnalyzed(), summary.sourceCount(), summary.potentialMatchesChecked(),
                    summary.highConfidenceMatches(), summary.mediumConfidenceMatches(),
                    summary.mergesAttempted(), summary.mergesSucceeded(), summary.mergeErrors(),
                    summary.dryRun(), elapsed.toMillis());
            return summary;
        }
    }

    private List<RawRecord> loadWindow(String runId, Instant since, int limit) {
        List<RawRecord> loaded;
        try {
            loaded = store.queryRecent(since, limit);
        } catch (StoreException e) {
            log.error("dedup.run.failed reason=windowQuery error={}", e.getMessage(), e);
            throw new DeduplicationRunException(runId, "Failed to load records modified since " + since, e);
        }
        return loaded.stream().filter(r -> !r.isMergedInto()).toList();
    }

    /**
     * Pairs span sources, and two records that already absorbed others are never merged.
     */
    private static boolean comparable(RawRecord a, RawRecord b) {
        if (sourceKey(a).equals(sourceKey(b))) {
            return false;
        }
        return !(a.getMergeStatus() == MergeStatus.MERGED && b.getMergeStatus() == MergeStatus.MERGED);
    }

    private static PrimarySelection keepExistingPrimary(PrimarySelection selection) {
        if (selection.secondary().getMergeStatus() == MergeStatus.MERGED) {
            log.debug("dedup.primary.swapped primary={} secondary={}",
                    selection.secondary().getId(), selection.primary().getId());
            return new PrimarySelection(selection.secondary(), selection.primary(),
                    selection.secondaryScore(), selection.primaryScore());
        }
        return selection;
    }

    private static int countSources(List<RawRecord> window) {
        Set<String> sources = new HashSet<>();
        window.forEach(r -> sources.add(sourceKey(r)));
        return sources.size();
    }

    private static String sourceKey(RawRecord record) {
        return record.getSource().trim().toUpperCase(Locale.ROOT);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final class Counters {
        int checked;
        int high;
        int medium;
        int attempted;
        int succeeded;
        int errors;
    }

    public static class Builder {
        private IncidentStore store;
        private CompositeScorer scorer = new CompositeScorer(ScoringProfile.batch());
        private RecordQualityRanker ranker;
        private MergePlanner planner;
        private DistributedLock lock = new NoOpDistributedLock();
        private MergeLedger ledger = new MergeLedger();
        private AuditService auditService = new AuditService();
        private MetricsService metricsService = new NoOpMetricsService();
        private Clock clock = Clock.systemUTC();

        public Builder store(IncidentStore store) {
            this.store = store;
            return this;
        }

        public Builder scorer(CompositeScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder ranker(RecordQualityRanker ranker) {
            this.ranker = ranker;
            return this;
        }

        public Builder planner(MergePlanner planner) {
            this.planner = planner;
            return this;
        }

        public Builder lock(DistributedLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder ledger(MergeLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DeduplicationOrchestrator build() {
            Objects.requireNonNull(store, "store is required");
            if (ranker == null) {
                ranker = new RecordQualityRanker();
            }
            if (planner == null) {
                planner = new MergePlanner(clock);
            }
            return new DeduplicationOrchestrator(this);
        }
    }
}

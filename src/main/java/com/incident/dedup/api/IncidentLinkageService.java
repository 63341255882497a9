package com.incident.dedup.api;

import com.incident.dedup.audit.AuditService;
import com.incident.dedup.audit.IntegrityViolation;
import com.incident.dedup.audit.MergeIntegrityChecker;
import com.incident.dedup.audit.MergeLedger;
import com.incident.dedup.cache.CacheConfig;
import com.incident.dedup.config.ReferenceData;
import com.incident.dedup.config.ReferenceDataLoader;
import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.dedup.DeduplicationOptions;
import com.incident.dedup.dedup.DeduplicationOrchestrator;
import com.incident.dedup.dedup.DeduplicationSummary;
import com.incident.dedup.ingest.IngestService;
import com.incident.dedup.ingest.IngestSummary;
import com.incident.dedup.lock.DistributedLock;
import com.incident.dedup.lock.NoOpDistributedLock;
import com.incident.dedup.matching.CandidateFinder;
import com.incident.dedup.matching.KeywordSignatures;
import com.incident.dedup.matching.MatchOptions;
import com.incident.dedup.matching.MatchOutcome;
import com.incident.dedup.matching.OverrideRules;
import com.incident.dedup.metrics.MetricsService;
import com.incident.dedup.metrics.NoOpMetricsService;
import com.incident.dedup.quality.CompletenessScorer;
import com.incident.dedup.quality.RecordQualityRanker;
import com.incident.dedup.quality.SourcePriorityTable;
import com.incident.dedup.scoring.CompositeScorer;
import com.incident.dedup.scoring.ScoringProfile;
import com.incident.dedup.similarity.ImoSimilarity;
import com.incident.dedup.similarity.IncidentTypeSimilarity;
import com.incident.dedup.similarity.IncidentTypeSynonyms;
import com.incident.dedup.similarity.VesselNameSimilarity;
import com.incident.dedup.store.IncidentStore;
import com.incident.dedup.store.InMemoryVesselRegistry;
import com.incident.dedup.store.VesselRegistry;

import java.time.Clock;
import java.util.Collection;
import java.util.List;

/**
 * Entry point of the incident deduplication library.
 *
 * <pre>
 * IncidentLinkageService service = IncidentLinkageService.builder()
 *     .store(store)
 *     .build();
 *
 * // at ingest
 * MatchOutcome outcome = service.findMatch(record);
 *
 * // scheduled batch
 * DeduplicationSummary summary = service.runDeduplicationPass(DeduplicationOptions.defaults());
 * </pre>
 */
public class IncidentLinkageService {

    private final CandidateFinder candidateFinder;
    private final DeduplicationOrchestrator orchestrator;
    private final IngestService ingestService;
    private final MergeIntegrityChecker integrityChecker;
    private final MergeLedger mergeLedger;
    private final AuditService auditService;

    private IncidentLinkageService(Builder builder) {
        ReferenceData referenceData = builder.referenceData;
        IncidentTypeSimilarity typeSimilarity = new IncidentTypeSimilarity(
                new IncidentTypeSynonyms(referenceData.incidentTypeSynonymGroups()));
        VesselNameSimilarity vesselNames = new VesselNameSimilarity();
        ImoSimilarity imoSimilarity = new ImoSimilarity();

        this.mergeLedger = builder.mergeLedger;
        this.auditService = builder.auditService;
        this.integrityChecker = new MergeIntegrityChecker(auditService);

        MatchOptions matchOptions = builder.matchOptions;
        this.candidateFinder = new CandidateFinder(builder.store, matchOptions,
                new CompositeScorer(ScoringProfile.ingest()
                        .withWindows(matchOptions.getWindowHours(), matchOptions.getMaxDistanceKm()),
                        vesselNames, imoSimilarity, typeSimilarity),
                OverrideRules.defaults(),
                new KeywordSignatures(referenceData.keywordSignatures()),
                vesselNames, imoSimilarity, builder.metricsService, auditService);

        this.orchestrator = DeduplicationOrchestrator.builder()
                .store(builder.store)
                .scorer(new CompositeScorer(ScoringProfile.batch(), vesselNames, imoSimilarity, typeSimilarity))
                .ranker(new RecordQualityRanker(new CompletenessScorer(), SourcePriorityTable.from(referenceData)))
                .lock(builder.lock)
                .ledger(mergeLedger)
                .auditService(auditService)
                .metricsService(builder.metricsService)
                .clock(builder.clock)
                .build();

        this.ingestService = new IngestService(builder.store, candidateFinder, builder.vesselRegistry,
                builder.cacheConfig, builder.metricsService, auditService);
    }

    /**
     * Matches a new record against existing canonical incidents.
     */
    public MatchOutcome findMatch(RawRecord record) {
        return candidateFinder.findMatch(record);
    }

    /**
     * Runs one batch deduplication pass.
     *
     * @throws com.incident.dedup.dedup.DeduplicationRunException if the record window cannot be loaded
     */
    public DeduplicationSummary runDeduplicationPass(DeduplicationOptions options) {
        return orchestrator.run(options);
    }

    /**
     * Links a batch of newly stored records to canonical incidents.
     */
    public IngestSummary ingest(List<RawRecord> batch) {
        return ingestService.ingest(batch);
    }

    /**
     * Reports merge-linkage defects among the given records without repairing them.
     */
    public List<IntegrityViolation> checkIntegrity(Collection<RawRecord> records) {
        return integrityChecker.check(records);
    }

    public MergeLedger getMergeLedger() {
        return mergeLedger;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IncidentStore store;
        private VesselRegistry vesselRegistry = new InMemoryVesselRegistry();
        private ReferenceData referenceData;
        private MatchOptions matchOptions = MatchOptions.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private DistributedLock lock = new NoOpDistributedLock();
        private MergeLedger mergeLedger = new MergeLedger();
        private AuditService auditService = new AuditService();
        private MetricsService metricsService = new NoOpMetricsService();
        private Clock clock = Clock.systemUTC();

        public Builder store(IncidentStore store) {
            this.store = store;
            return this;
        }

        public Builder vesselRegistry(VesselRegistry vesselRegistry) {
            this.vesselRegistry = vesselRegistry;
            return this;
        }

        /**
         * Reference tables to use instead of the bundled defaults.
         */
        public Builder referenceData(ReferenceData referenceData) {
            this.referenceData = referenceData;
            return this;
        }

        public Builder matchOptions(MatchOptions matchOptions) {
            this.matchOptions = matchOptions;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder distributedLock(DistributedLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder mergeLedger(MergeLedger mergeLedger) {
            this.mergeLedger = mergeLedger;
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

        public IncidentLinkageService build() {
            if (store == null) {
                throw new IllegalStateException("IncidentStore is required");
            }
            if (referenceData == null) {
                referenceData = ReferenceDataLoader.loadDefaults();
            }
            return new IncidentLinkageService(this);
        }
    }
}

package com.incident.dedup.ingest;

import com.incident.dedup.audit.AuditAction;
import com.incident.dedup.audit.AuditService;
import com.incident.dedup.cache.CacheConfig;
import com.incident.dedup.cache.ReferenceCache;
import com.incident.dedup.core.model.CanonicalIncident;
import com.incident.dedup.core.model.ProcessingStatus;
import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.logging.LogContext;
import com.incident.dedup.matching.CandidateFinder;
import com.incident.dedup.matching.MatchOutcome;
import com.incident.dedup.metrics.MetricsService;
import com.incident.dedup.similarity.VesselNameSimilarity;
import com.incident.dedup.store.IncidentStore;
import com.incident.dedup.store.StoreException;
import com.incident.dedup.store.VesselRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Links newly ingested records to canonical incidents.
 *
 * <p>Each record is matched with {@link CandidateFinder}; a match links the record to the
 * existing incident, otherwise a new incident is created from it. A store failure marks that
 * record {@code ERROR} and processing continues with the next one. The vessel reference cache
 * lives for one {@link #ingest(List)} call.</p>
 */
public class IngestService {
    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    static final String ACTOR = "ingest";

    private final IncidentStore store;
    private final CandidateFinder candidateFinder;
    private final VesselRegistry vesselRegistry;
    private final CacheConfig cacheConfig;
    private final VesselNameSimilarity vesselNames;
    private final MetricsService metricsService;
    private final AuditService auditService;

    public IngestService(IncidentStore store, CandidateFinder candidateFinder, VesselRegistry vesselRegistry,
                         CacheConfig cacheConfig, MetricsService metricsService, AuditService auditService) {
        this.store = store;
        this.candidateFinder = candidateFinder;
        this.vesselRegistry = vesselRegistry;
        this.cacheConfig = cacheConfig;
        this.vesselNames = new VesselNameSimilarity();
        this.metricsService = metricsService;
        this.auditService = auditService;
    }

    public IngestSummary ingest(List<RawRecord> batch) {
        String batchId = LogContext.generateCorrelationId();
        ReferenceCache cache = ReferenceCache.create(cacheConfig);
        VesselReferenceResolver resolver = new VesselReferenceResolver(vesselRegistry, cache, vesselNames, metricsService);
        try (LogContext ctx = LogContext.forIngest(batchId)) {
            log.info("ingest.started records={}", batch.size());
            List<IngestResult> results = new ArrayList<>();
            for (RawRecord record : batch) {
                results.add(ingestOne(record, resolver));
            }
            IngestSummary summary = IngestSummary.of(batchId, results);
            log.info("ingest.completed processed={} matched={} created={} errors={} cacheHitRate={}",
                    summary.processed(), summary.matched(), summary.created(), summary.errors(),
                    cache.getStats().hitRate());
            return summary;
        } finally {
            cache.invalidateAll();
        }
    }

    private IngestResult ingestOne(RawRecord record, VesselReferenceResolver resolver) {
        try {
            String vesselReferenceId = resolver.resolve(record).orElse(null);
            MatchOutcome outcome = candidateFinder.findMatch(record);
            String canonicalId;
            if (outcome.isMatched()) {
                canonicalId = outcome.canonicalIncidentId();
            } else {
                CanonicalIncident incident = store.createCanonicalIncident(record);
                canonicalId = incident.getId();
                auditService.record(AuditAction.CANONICAL_INCIDENT_CREATED, record.getId(), ACTOR,
                        Map.of("canonicalIncidentId", canonicalId));
                log.info("ingest.incidentCreated recordId={} canonicalId={}", record.getId(), canonicalId);
            }
            store.linkRecord(record.getId(), canonicalId, vesselReferenceId, ProcessingStatus.COMPLETE);
            return new IngestResult(record.getId(), canonicalId, outcome.isMatched(), vesselReferenceId,
                    ProcessingStatus.COMPLETE, null);
        } catch (StoreException e) {
            log.error("ingest.recordFailed recordId={} error={}", record.getId(), e.getMessage(), e);
            markError(record.getId());
            return IngestResult.failed(record.getId(), e.getMessage());
        }
    }

    private void markError(String recordId) {
        try {
            store.updateProcessingStatus(recordId, ProcessingStatus.ERROR);
        } catch (StoreException e) {
            log.error("ingest.statusUpdateFailed recordId={} error={}", recordId, e.getMessage(), e);
        }
    }
}

package com.incident.dedup.dedup;

import com.incident.dedup.audit.AuditAction;
import com.incident.dedup.audit.AuditService;
import com.incident.dedup.audit.MergeIntegrityChecker;
import com.incident.dedup.audit.MergeLedger;
import com.incident.dedup.core.model.ConfidenceBand;
import com.incident.dedup.core.model.MergeState;
import com.incident.dedup.core.model.MergeStatus;
import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.core.model.SimilarityScore;
import com.incident.dedup.lock.DistributedLock;
import com.incident.dedup.lock.LockAcquisitionException;
import com.incident.dedup.lock.RecordLocks;
import com.incident.dedup.logging.LogContext;
import com.incident.dedup.merge.FieldUpdateSet;
import com.incident.dedup.merge.MergeConflict;
import com.incident.dedup.merge.MergeConflictException;
import com.incident.dedup.merge.MergePlanner;
import com.incident.dedup.merge.MergeTransaction;
import com.incident.dedup.metrics.MergeOutcome;
import com.incident.dedup.metrics.MetricsService;
import com.incident.dedup.store.IncidentStore;
import com.incident.dedup.store.MergeStateUpdateResult;
import com.incident.dedup.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Write phase of one merge: locks both records, re-reads them, plans the field update against
 * the fresh primary, then marks the secondary {@code merged_into} with a conditional write and
 * writes the primary's fields. A failed field write reverts the merge-state write.
 */
class MergeExecutor {
    private static final Logger log = LoggerFactory.getLogger(MergeExecutor.class);

    private final IncidentStore store;
    private final MergePlanner planner;
    private final DistributedLock lock;
    private final MergeLedger ledger;
    private final AuditService auditService;
    private final MergeIntegrityChecker integrityChecker;
    private final MetricsService metricsService;

    MergeExecutor(IncidentStore store, MergePlanner planner, DistributedLock lock, MergeLedger ledger,
                  AuditService auditService, MergeIntegrityChecker integrityChecker,
                  MetricsService metricsService) {
        this.store = store;
        this.planner = planner;
        this.lock = lock;
        this.ledger = ledger;
        this.auditService = auditService;
        this.integrityChecker = integrityChecker;
        this.metricsService = metricsService;
    }

    MergeOutcome merge(String runId, String primaryId, String secondaryId, SimilarityScore score,
                       ConfidenceBand band, String triggeredBy) {
        MergeOutcome outcome;
        try (LogContext ctx = LogContext.forMerge(runId, primaryId, secondaryId);
             RecordLocks held = RecordLocks.acquire(lock, primaryId, secondaryId)) {
            outcome = mergeLocked(primaryId, secondaryId, score, band, triggeredBy);
        } catch (LockAcquisitionException e) {
            log.warn("merge.lockFailed primary={} secondary={} error={}", primaryId, secondaryId, e.getMessage());
            outcome = MergeOutcome.FAILED;
        }
        metricsService.incrementMerge(outcome);
        return outcome;
    }

    private MergeOutcome mergeLocked(String primaryId, String secondaryId, SimilarityScore score,
                                     ConfidenceBand band, String triggeredBy) {
        RawRecord primary;
        RawRecord secondary;
        try {
            primary = require(primaryId);
            secondary = require(secondaryId);
        } catch (StoreException e) {
            log.error("merge.readFailed primary={} secondary={} error={}", primaryId, secondaryId, e.getMessage(), e);
            return MergeOutcome.FAILED;
        }
        if (integrityChecker.checkPrimary(primary) != null) {
            return MergeOutcome.FAILED;
        }

        FieldUpdateSet plan = planner.planMerge(primary, secondary);
        for (MergeConflict conflict : plan.getConflicts()) {
            auditService.record(AuditAction.CANONICAL_LINK_CONFLICT, primaryId, triggeredBy, Map.of(
                    "field", conflict.field(),
                    "primaryValue", String.valueOf(conflict.primaryValue()),
                    "secondaryRecordId", secondaryId,
                    "secondaryValue", String.valueOf(conflict.secondaryValue())));
        }

        MergeTransaction tx = new MergeTransaction(primaryId + "<-" + secondaryId);
        try (tx) {
            tx.step("mark secondary merged_into",
                    () -> markSecondary(secondaryId, primaryId),
                    () -> revertSecondary(secondaryId, primaryId));
            tx.step("write primary fields",
                    () -> store.updateFields(primaryId, plan),
                    null);
            tx.commit();
        } catch (MergeConflictException e) {
            log.warn("merge.conflict primary={} secondary={} reason={}", primaryId, secondaryId, e.getMessage());
            auditService.record(AuditAction.MERGE_CONFLICT, secondaryId, triggeredBy, Map.of(
                    "primaryRecordId", primaryId,
                    "reason", e.getMessage()));
            return MergeOutcome.CONFLICT;
        } catch (RuntimeException e) {
            log.error("merge.failed primary={} secondary={} rolledBack={} error={}",
                    primaryId, secondaryId, tx.isRolledBack(), e.getMessage(), e);
            if (!tx.getFailedCompensations().isEmpty()) {
                log.error("merge.halfApplied secondary={} primary={} failedUndo={}",
                        secondaryId, primaryId, tx.getFailedCompensations());
                return MergeOutcome.FAILED;
            }
            if (tx.isRolledBack()) {
                auditService.record(AuditAction.MERGE_ROLLED_BACK, secondaryId, triggeredBy, Map.of(
                        "primaryRecordId", primaryId,
                        "error", String.valueOf(e.getMessage())));
                return MergeOutcome.ROLLED_BACK;
            }
            return MergeOutcome.FAILED;
        }

        String reasoning = String.format("score=%.3f time=%.3f spatial=%.3f vessel=%.3f type=%.3f",
                score.total(), score.time(), score.spatial(), score.vessel(), score.incidentType());
        ledger.recordMerge(primaryId, secondaryId, primary.getSource(), secondary.getSource(),
                score.total(), band, triggeredBy, reasoning);
        auditService.record(AuditAction.RECORD_MERGED, secondaryId, triggeredBy, Map.of(
                "primaryRecordId", primaryId,
                "score", score.total(),
                "band", band.name(),
                "fields", plan.changedFields()));
        log.info("merge.succeeded primary={} primarySource={} secondary={} secondarySource={} score={} band={}",
                primaryId, primary.getSource(), secondaryId, secondary.getSource(), score.total(), band);
        return MergeOutcome.SUCCEEDED;
    }

    private void markSecondary(String secondaryId, String primaryId) {
        MergeStateUpdateResult result = store.updateMergeState(
                secondaryId, MergeState.mergedInto(primaryId), MergeStatus.NONE);
        if (result != MergeStateUpdateResult.APPLIED) {
            throw new MergeConflictException(secondaryId,
                    "Merge-state write on " + secondaryId + " returned " + result);
        }
    }

    private void revertSecondary(String secondaryId, String primaryId) {
        MergeStateUpdateResult result = store.updateMergeState(
                secondaryId, MergeState.none(), MergeStatus.MERGED_INTO);
        if (result != MergeStateUpdateResult.APPLIED) {
            throw new StoreException("Could not revert merge state of " + secondaryId
                    + " (merged into " + primaryId + "): " + result);
        }
        log.info("merge.reverted secondary={} primary={}", secondaryId, primaryId);
    }

    private RawRecord require(String recordId) {
        return store.findById(recordId)
                .orElseThrow(() -> new StoreException("Record not found: " + recordId));
    }
}

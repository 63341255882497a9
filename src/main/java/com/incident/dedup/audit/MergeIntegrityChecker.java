package com.incident.dedup.audit;

import com.incident.dedup.core.model.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects broken merge linkage: chains deeper than one level, self-merges and dangling targets.
 * Findings are logged and audited for manual review; nothing is repaired.
 */
public class MergeIntegrityChecker {
    private static final Logger log = LoggerFactory.getLogger(MergeIntegrityChecker.class);

    static final String ACTOR = "integrity-check";

    private final AuditService auditService;

    public MergeIntegrityChecker(AuditService auditService) {
        this.auditService = auditService;
    }

    public List<IntegrityViolation> check(Collection<RawRecord> records) {
        Map<String, RawRecord> byId = new HashMap<>();
        records.forEach(r -> byId.put(r.getId(), r));

        List<IntegrityViolation> violations = new ArrayList<>();
        for (RawRecord record : records) {
            if (!record.isMergedInto()) {
                continue;
            }
            String targetId = record.getMergedIntoId();
            IntegrityViolation.Kind kind = null;
            if (record.getId().equals(targetId)) {
                kind = IntegrityViolation.Kind.SELF_MERGE;
            } else if (!byId.containsKey(targetId)) {
                kind = IntegrityViolation.Kind.DANGLING_TARGET;
            } else if (byId.get(targetId).isMergedInto()) {
                kind = IntegrityViolation.Kind.CHAINED_MERGE;
            }
            if (kind != null) {
                violations.add(report(new IntegrityViolation(record.getId(), targetId, kind)));
            }
        }
        return violations;
    }

    /**
     * Checks one prospective primary before a merge writes into it.
     *
     * @return the violation, or null if the record can act as a primary
     */
    public IntegrityViolation checkPrimary(RawRecord primary) {
        if (!primary.isMergedInto()) {
            return null;
        }
        return report(new IntegrityViolation(primary.getId(), primary.getMergedIntoId(),
                IntegrityViolation.Kind.CHAINED_MERGE));
    }

    private IntegrityViolation report(IntegrityViolation violation) {
        log.warn("integrity.violation recordId={} mergedIntoId={} kind={}",
                violation.recordId(), violation.mergedIntoId(), violation.kind());
        auditService.record(AuditAction.INTEGRITY_VIOLATION, violation.recordId(), ACTOR,
                Map.of("mergedIntoId", String.valueOf(violation.mergedIntoId()),
                        "kind", violation.kind().name()));
        return violation;
    }
}

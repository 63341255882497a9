package com.incident.dedup.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One audit-trail line about a raw record.
 *
 * @param id       entry id
 * @param action   what happened
 * @param recordId the raw record the action concerns
 * @param actorId  the pass or component that acted ("dedup-batch", "ingest", ...)
 * @param runId    the dedup run or ingest batch in progress, null outside both
 * @param details  action-specific values, never null
 * @param timestamp when the entry was written
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String recordId,
        String actorId,
        String runId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    static AuditEntry of(AuditAction action, String recordId, String actorId, String runId,
                         Map<String, Object> details, Instant timestamp) {
        return new AuditEntry(UUID.randomUUID().toString(), action, recordId, actorId, runId, details, timestamp);
    }
}

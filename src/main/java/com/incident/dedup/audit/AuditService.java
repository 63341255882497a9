package com.incident.dedup.audit;

import com.incident.dedup.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only audit trail of merges, conflicts and integrity findings.
 * Entries written inside a run or ingest batch carry its id.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public AuditService() {
        this(Clock.systemUTC());
    }

    public AuditService(Clock clock) {
        this.clock = clock;
    }

    public AuditEntry record(AuditAction action, String recordId, String actorId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.of(action, recordId, actorId, LogContext.currentRunId(),
                details, clock.instant());
        entries.add(entry);
        log.debug("audit.recorded action={} recordId={} actor={} runId={}",
                entry.action(), entry.recordId(), entry.actorId(), entry.runId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String recordId, String actorId) {
        return record(action, recordId, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return List.copyOf(entries);
    }

    public List<AuditEntry> getEntriesForRecord(String recordId) {
        return entries.stream()
                .filter(e -> recordId.equals(e.recordId()))
                .toList();
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    /**
     * Entries written during one dedup run or ingest batch.
     */
    public List<AuditEntry> getEntriesForRun(String runId) {
        return entries.stream()
                .filter(e -> Objects.equals(runId, e.runId()))
                .toList();
    }

    public int size() {
        return entries.size();
    }
}

package com.incident.dedup.store;

import com.incident.dedup.core.model.CanonicalIncident;
import com.incident.dedup.core.model.MergeState;
import com.incident.dedup.core.model.MergeStatus;
import com.incident.dedup.core.model.ProcessingStatus;
import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.geo.BoundingBox;
import com.incident.dedup.geo.GeoTimeMetrics;
import com.incident.dedup.geo.TimeWindow;
import com.incident.dedup.merge.FieldUpdateSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory incident store for single-JVM use and tests.
 * All operations are synchronized, so conditional merge-state writes are atomic.
 */
public class InMemoryIncidentStore implements IncidentStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryIncidentStore.class);

    private static final Comparator<RawRecord> NEWEST_FIRST = Comparator.comparing(
            RawRecord::getOccurredAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final Map<String, RawRecord> records = new LinkedHashMap<>();
    private final Map<String, CanonicalIncident> canonicalIncidents = new LinkedHashMap<>();

    public synchronized void save(RawRecord record) {
        records.put(record.getId(), record);
    }

    public synchronized void saveAll(List<RawRecord> batch) {
        batch.forEach(record -> records.put(record.getId(), record));
    }

    public synchronized void saveCanonicalIncident(CanonicalIncident incident) {
        canonicalIncidents.put(incident.getId(), incident);
    }

    public synchronized List<RawRecord> getAllRecords() {
        return List.copyOf(records.values());
    }

    public synchronized List<CanonicalIncident> getAllCanonicalIncidents() {
        return List.copyOf(canonicalIncidents.values());
    }

    @Override
    public synchronized List<RawRecord> queryRecent(Instant since, int limit) {
        return records.values().stream()
                .filter(r -> !r.isMergedInto())
                .filter(r -> since == null || !r.getModifiedAt().isBefore(since))
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized List<CanonicalIncident> queryCandidates(TimeWindow window, BoundingBox box) {
        List<CanonicalIncident> result = new ArrayList<>();
        for (CanonicalIncident incident : canonicalIncidents.values()) {
            if (incident.getOccurredAt() == null || !window.contains(incident.getOccurredAt())) {
                continue;
            }
            if (!GeoTimeMetrics.isValidCoordinate(incident.getLatitude(), incident.getLongitude())) {
                continue;
            }
            if (box.contains(incident.getLatitude(), incident.getLongitude())) {
                result.add(incident);
            }
        }
        return result;
    }

    @Override
    public synchronized MergeStateUpdateResult updateMergeState(String recordId, MergeState newState,
                                                               MergeStatus expectedPrior) {
        RawRecord current = records.get(recordId);
        if (current == null) {
            return MergeStateUpdateResult.NOT_FOUND;
        }
        if (current.getMergeStatus() != expectedPrior) {
            log.debug("store.mergeState.conflict recordId={} expected={} actual={}",
                    recordId, expectedPrior, current.getMergeStatus());
            return MergeStateUpdateResult.CONFLICT;
        }
        records.put(recordId, RawRecord.builder(current)
                .mergeState(newState)
                .modifiedAt(Instant.now())
                .build());
        return MergeStateUpdateResult.APPLIED;
    }

    @Override
    public synchronized RawRecord updateFields(String recordId, FieldUpdateSet updates) {
        RawRecord current = requireRecord(recordId);
        RawRecord updated = updates.applyTo(current);
        records.put(recordId, updated);
        return updated;
    }

    @Override
    public synchronized Optional<RawRecord> findById(String recordId) {
        return Optional.ofNullable(records.get(recordId));
    }

    @Override
    public synchronized CanonicalIncident createCanonicalIncident(RawRecord record) {
        CanonicalIncident incident = CanonicalIncident.fromRecord(UUID.randomUUID().toString(), record);
        canonicalIncidents.put(incident.getId(), incident);
        return incident;
    }

    @Override
    public synchronized RawRecord linkRecord(String recordId, String canonicalIncidentId,
                                             String vesselReferenceId, ProcessingStatus status) {
        RawRecord current = requireRecord(recordId);
        RawRecord.Builder builder = RawRecord.builder(current)
                .canonicalIncidentId(canonicalIncidentId)
                .processingStatus(status)
                .modifiedAt(Instant.now());
        if (vesselReferenceId != null) {
            builder.vesselReferenceId(vesselReferenceId);
        }
        RawRecord updated = builder.build();
        records.put(recordId, updated);
        return updated;
    }

    @Override
    public synchronized void updateProcessingStatus(String recordId, ProcessingStatus status) {
        RawRecord current = requireRecord(recordId);
        records.put(recordId, RawRecord.builder(current)
                .processingStatus(status)
                .modifiedAt(Instant.now())
                .build());
    }

    private RawRecord requireRecord(String recordId) {
        RawRecord current = records.get(recordId);
        if (current == null) {
            throw new StoreException("Record not found: " + recordId);
        }
        return current;
    }
}

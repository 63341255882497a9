package com.incident.dedup.store;

import com.incident.dedup.core.model.CanonicalIncident;
import com.incident.dedup.core.model.MergeState;
import com.incident.dedup.core.model.MergeStatus;
import com.incident.dedup.core.model.ProcessingStatus;
import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.geo.BoundingBox;
import com.incident.dedup.geo.TimeWindow;
import com.incident.dedup.merge.FieldUpdateSet;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary of the deduplication core.
 * Implementations signal infrastructure failures with {@link StoreException}.
 */
public interface IncidentStore {

    /**
     * Records modified at or after {@code since} that are not merged into another record,
     * ordered by event time descending (records without a date last), at most {@code limit}.
     */
    List<RawRecord> queryRecent(Instant since, int limit);

    /**
     * Canonical incidents whose event time lies in the window and whose position lies in the box.
     */
    List<CanonicalIncident> queryCandidates(TimeWindow window, BoundingBox box);

    /**
     * Writes the merge state only if the record's current status equals {@code expectedPrior}.
     */
    MergeStateUpdateResult updateMergeState(String recordId, MergeState newState, MergeStatus expectedPrior);

    /**
     * Applies a partial update to a record.
     *
     * @return the record after the update
     * @throws StoreException if the record does not exist or the write fails
     */
    RawRecord updateFields(String recordId, FieldUpdateSet updates);

    Optional<RawRecord> findById(String recordId);

    /**
     * Materializes a new canonical incident from the record that first reported it.
     */
    CanonicalIncident createCanonicalIncident(RawRecord record);

    /**
     * Links a record to a canonical incident and a reference vessel and sets its processing status.
     * A null vessel reference leaves the current one unchanged.
     */
    RawRecord linkRecord(String recordId, String canonicalIncidentId, String vesselReferenceId,
                         ProcessingStatus status);

    void updateProcessingStatus(String recordId, ProcessingStatus status);
}

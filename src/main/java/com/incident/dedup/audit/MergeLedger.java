package com.incident.dedup.audit;

import com.incident.dedup.core.model.ConfidenceBand;
import com.incident.dedup.core.model.MergeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only ledger of every successful cross-source merge.
 */
public class MergeLedger {
    private static final Logger log = LoggerFactory.getLogger(MergeLedger.class);

    private final List<MergeRecord> records = new CopyOnWriteArrayList<>();

    public MergeRecord record(MergeRecord mergeRecord) {
        records.add(mergeRecord);
        log.info("ledger.merge.recorded primary={} secondary={} score={} band={}",
                mergeRecord.primaryRecordId(),
                mergeRecord.secondaryRecordId(),
                mergeRecord.confidenceScore(),
                mergeRecord.band());
        return mergeRecord;
    }

    public MergeRecord recordMerge(String primaryRecordId, String secondaryRecordId,
                                   String primarySource, String secondarySource,
                                   double confidenceScore, ConfidenceBand band,
                                   String triggeredBy, String reasoning) {
        return record(MergeRecord.builder()
                .primaryRecordId(primaryRecordId)
                .secondaryRecordId(secondaryRecordId)
                .primarySource(primarySource)
                .secondarySource(secondarySource)
                .confidenceScore(confidenceScore)
                .band(band)
                .triggeredBy(triggeredBy)
                .reasoning(reasoning)
                .build());
    }

    public List<MergeRecord> getAllRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public List<MergeRecord> getRecordsForPrimary(String primaryRecordId) {
        return records.stream()
                .filter(r -> r.primaryRecordId().equals(primaryRecordId))
                .collect(Collectors.toList());
    }

    public List<MergeRecord> getRecordsForSecondary(String secondaryRecordId) {
        return records.stream()
                .filter(r -> r.secondaryRecordId().equals(secondaryRecordId))
                .collect(Collectors.toList());
    }

    public List<MergeRecord> getRecordsBetween(Instant start, Instant end) {
        return records.stream()
                .filter(r -> !r.timestamp().isBefore(start) && !r.timestamp().isAfter(end))
                .collect(Collectors.toList());
    }

    /**
     * Ids of all records folded into the given primary, in merge order.
     */
    public Set<String> getMergedRecordIds(String primaryRecordId) {
        Set<String> ids = new LinkedHashSet<>();
        for (MergeRecord record : getRecordsForPrimary(primaryRecordId)) {
            ids.add(record.secondaryRecordId());
        }
        return ids;
    }

    public int size() {
        return records.size();
    }
}

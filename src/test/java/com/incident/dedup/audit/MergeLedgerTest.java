package com.incident.dedup.audit;

import com.incident.dedup.core.model.ConfidenceBand;
import com.incident.dedup.core.model.MergeRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MergeLedgerTest {

    private MergeLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new MergeLedger();
    }

    @Test
    void recordMerge_storesProvenance() {
        MergeRecord record = ledger.recordMerge("p", "s", "RECAAP", "UKMTO",
                0.92, ConfidenceBand.HIGH, "dedup-batch", "score=0.920");

        assertNotNull(record.id());
        assertEquals("p", record.primaryRecordId());
        assertEquals("s", record.secondaryRecordId());
        assertEquals("RECAAP", record.primarySource());
        assertEquals("UKMTO", record.secondarySource());
        assertEquals(0.92, record.confidenceScore());
        assertEquals(ConfidenceBand.HIGH, record.band());
        assertEquals("dedup-batch", record.triggeredBy());
        assertEquals(1, ledger.size());
    }

    @Test
    void queriesByPrimaryAndSecondary() {
        ledger.recordMerge("p1", "s1", "A", "B", 0.9, ConfidenceBand.HIGH, "t", null);
        ledger.recordMerge("p1", "s2", "A", "C", 0.75, ConfidenceBand.MEDIUM, "t", null);
        ledger.recordMerge("p2", "s3", "B", "C", 0.8, ConfidenceBand.HIGH, "t", null);

        assertEquals(2, ledger.getRecordsForPrimary("p1").size());
        assertEquals(List.of("s1", "s2"), List.copyOf(ledger.getMergedRecordIds("p1")));
        assertEquals("p2", ledger.getRecordsForSecondary("s3").get(0).primaryRecordId());
        assertTrue(ledger.getRecordsForSecondary("p1").isEmpty());
    }

    @Test
    void queriesByTimeRange() {
        Instant t0 = Instant.parse("2024-05-10T00:00:00Z");
        ledger.record(MergeRecord.builder()
                .primaryRecordId("p").secondaryRecordId("s1").band(ConfidenceBand.HIGH)
                .timestamp(t0).build());
        ledger.record(MergeRecord.builder()
                .primaryRecordId("p").secondaryRecordId("s2").band(ConfidenceBand.HIGH)
                .timestamp(t0.plusSeconds(7200)).build());

        assertEquals(1, ledger.getRecordsBetween(t0, t0.plusSeconds(3600)).size());
        assertEquals(2, ledger.getRecordsBetween(t0, t0.plusSeconds(7200)).size());
    }

    @Test
    void returnedListIsUnmodifiable() {
        ledger.recordMerge("p", "s", "A", "B", 0.9, ConfidenceBand.HIGH, "t", null);

        assertThrows(UnsupportedOperationException.class, () -> ledger.getAllRecords().clear());
    }

    @Test
    void mergeRecordRequiresBothIds() {
        assertThrows(NullPointerException.class,
                () -> MergeRecord.builder().primaryRecordId("p").band(ConfidenceBand.HIGH).build());
    }
}

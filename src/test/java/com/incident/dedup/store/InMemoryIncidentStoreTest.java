package com.incident.dedup.store;

import com.incident.dedup.core.model.CanonicalIncident;
import com.incident.dedup.core.model.MergeState;
import com.incident.dedup.core.model.MergeStatus;
import com.incident.dedup.core.model.ProcessingStatus;
import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.geo.BoundingBox;
import com.incident.dedup.geo.TimeWindow;
import com.incident.dedup.merge.FieldUpdateSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryIncidentStoreTest {

    private static final Instant T = Instant.parse("2024-05-10T08:00:00Z");

    private InMemoryIncidentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryIncidentStore();
    }

    private static RawRecord.Builder record(String id) {
        return RawRecord.builder().id(id).source("UKMTO").occurredAt(T).coordinates(1.2, 103.8).modifiedAt(T);
    }

    @Nested
    @DisplayName("Window queries")
    class QueryTests {

        @Test
        @DisplayName("Recent query excludes merged-away records and orders newest first")
        void testQueryRecent() {
            store.saveAll(List.of(
                    record("old").occurredAt(T.minus(2, ChronoUnit.DAYS)).build(),
                    record("new").occurredAt(T).build(),
                    record("undated").occurredAt(null).build(),
                    record("gone").mergeState(MergeState.mergedInto("new")).build(),
                    record("stale").modifiedAt(T.minus(60, ChronoUnit.DAYS)).build()));

            List<RawRecord> recent = store.queryRecent(T.minus(30, ChronoUnit.DAYS), 10);

            assertEquals(List.of("new", "old", "undated"), recent.stream().map(RawRecord::getId).toList());
        }

        @Test
        @DisplayName("Recent query honours the limit")
        void testQueryRecentLimit() {
            store.saveAll(List.of(record("a").build(), record("b").build(), record("c").build()));

            assertEquals(2, store.queryRecent(T.minus(1, ChronoUnit.DAYS), 2).size());
        }

        @Test
        @DisplayName("Candidate query filters canonical incidents by window and box")
        void testQueryCandidates() {
            CanonicalIncident inside = store.createCanonicalIncident(record("a").build());
            store.createCanonicalIncident(record("far").coordinates(10.0, 103.8).build());
            store.createCanonicalIncident(record("late").occurredAt(T.plus(5, ChronoUnit.DAYS)).build());
            store.createCanonicalIncident(record("nowhere").coordinates(0.0, 0.0).build());

            List<CanonicalIncident> found = store.queryCandidates(
                    TimeWindow.around(T, 48), BoundingBox.around(1.2, 103.8, 50));

            assertEquals(List.of(inside), found);
            assertEquals("a", found.get(0).getPrimaryRecordId());
            assertEquals(4, store.getAllCanonicalIncidents().size());
        }
    }

    @Nested
    @DisplayName("Conditional merge-state writes")
    class MergeStateTests {

        @Test
        @DisplayName("Write applies only when the prior status matches")
        void testConditionalWrite() {
            store.save(record("s").build());

            assertEquals(MergeStateUpdateResult.APPLIED,
                    store.updateMergeState("s", MergeState.mergedInto("p"), MergeStatus.NONE));
            assertEquals(MergeStateUpdateResult.CONFLICT,
                    store.updateMergeState("s", MergeState.mergedInto("q"), MergeStatus.NONE));
            assertEquals("p", store.findById("s").orElseThrow().getMergedIntoId());
        }

        @Test
        @DisplayName("Missing record is reported, not thrown")
        void testNotFound() {
            assertEquals(MergeStateUpdateResult.NOT_FOUND,
                    store.updateMergeState("missing", MergeState.mergedInto("p"), MergeStatus.NONE));
        }

        @Test
        @DisplayName("Only one of two racing writes applies")
        void testRacingWrites() throws Exception {
            store.save(record("s").build());
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<MergeStateUpdateResult> first = executor.submit(() -> {
                    start.await();
                    return store.updateMergeState("s", MergeState.mergedInto("p1"), MergeStatus.NONE);
                });
                Future<MergeStateUpdateResult> second = executor.submit(() -> {
                    start.await();
                    return store.updateMergeState("s", MergeState.mergedInto("p2"), MergeStatus.NONE);
                });
                start.countDown();

                List<MergeStateUpdateResult> results = List.of(
                        first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));
                assertEquals(1, results.stream().filter(r -> r == MergeStateUpdateResult.APPLIED).count());
                assertEquals(1, results.stream().filter(r -> r == MergeStateUpdateResult.CONFLICT).count());
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Field updates and linking")
    class UpdateTests {

        @Test
        @DisplayName("Field update keeps unspecified fields")
        void testUpdateFields() {
            store.save(record("p").title("Boarding").build());

            RawRecord updated = store.updateFields("p", FieldUpdateSet.builder().vesselName("DELTA").build());

            assertEquals("Boarding", updated.getTitle());
            assertEquals("DELTA", updated.getVesselName());
            assertEquals(T, updated.getModifiedAt());
            assertEquals(updated, store.findById("p").orElseThrow());
        }

        @Test
        @DisplayName("Field update carries its own modification time")
        void testUpdateFieldsModifiedAt() {
            store.save(record("p").build());
            Instant at = T.plus(1, ChronoUnit.HOURS);

            RawRecord updated = store.updateFields("p",
                    FieldUpdateSet.builder().vesselName("DELTA").modifiedAt(at).build());

            assertEquals(at, updated.getModifiedAt());
        }

        @Test
        @DisplayName("Marking merged does not override a merged-into status")
        void testMarkMergedKeepsMergedInto() {
            store.save(record("s").mergeState(MergeState.mergedInto("p")).build());

            RawRecord updated = store.updateFields("s", FieldUpdateSet.builder().markMerged(true).build());

            assertEquals(MergeStatus.MERGED_INTO, updated.getMergeStatus());
        }

        @Test
        @DisplayName("Updating a missing record throws")
        void testUpdateMissing() {
            assertThrows(StoreException.class, () -> store.updateFields("missing", FieldUpdateSet.empty()));
            assertThrows(StoreException.class,
                    () -> store.updateProcessingStatus("missing", ProcessingStatus.ERROR));
        }

        @Test
        @DisplayName("Linking sets canonical id, vessel reference and status")
        void testLinkRecord() {
            store.save(record("r").vesselReferenceId("v-old").build());

            RawRecord linked = store.linkRecord("r", "inc-1", null, ProcessingStatus.COMPLETE);

            assertEquals("inc-1", linked.getCanonicalIncidentId());
            assertEquals("v-old", linked.getVesselReferenceId());
            assertEquals(ProcessingStatus.COMPLETE, linked.getProcessingStatus());

            store.updateProcessingStatus("r", ProcessingStatus.ERROR);
            assertEquals(ProcessingStatus.ERROR, store.findById("r").orElseThrow().getProcessingStatus());
        }
    }
}

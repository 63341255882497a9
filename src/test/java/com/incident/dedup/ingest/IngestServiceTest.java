package com.incident.dedup.ingest;

import com.incident.dedup.audit.AuditAction;
import com.incident.dedup.audit.AuditService;
import com.incident.dedup.cache.CacheConfig;
import com.incident.dedup.core.model.ProcessingStatus;
import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.geo.BoundingBox;
import com.incident.dedup.geo.TimeWindow;
import com.incident.dedup.matching.CandidateFinder;
import com.incident.dedup.metrics.NoOpMetricsService;
import com.incident.dedup.store.InMemoryIncidentStore;
import com.incident.dedup.store.InMemoryVesselRegistry;
import com.incident.dedup.store.IncidentStore;
import com.incident.dedup.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class IngestServiceTest {

    private static final Instant T = Instant.parse("2024-03-01T22:30:00Z");

    private InMemoryIncidentStore store;
    private InMemoryVesselRegistry vesselRegistry;
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        store = new InMemoryIncidentStore();
        vesselRegistry = new InMemoryVesselRegistry();
        auditService = new AuditService();
    }

    private IngestService service(IncidentStore incidentStore) {
        return new IngestService(incidentStore, new CandidateFinder(incidentStore), vesselRegistry,
                CacheConfig.defaults(), new NoOpMetricsService(), auditService);
    }

    private static RawRecord report(String id, String source, Instant at, double lat, double lon) {
        return RawRecord.builder()
                .id(id)
                .source(source)
                .occurredAt(at)
                .coordinates(lat, lon)
                .vesselName("MV OCEAN STAR")
                .incidentTypeName("Boarding")
                .build();
    }

    @Test
    @DisplayName("Second report of the same incident links to the incident created by the first")
    void testCreateThenMatch() {
        RawRecord first = report("r1", "UKMTO", T, 1.20, 103.80);
        RawRecord second = report("r2", "RECAAP", T.plus(2, ChronoUnit.HOURS), 1.21, 103.81);
        store.saveAll(List.of(first, second));

        IngestSummary summary = service(store).ingest(List.of(first, second));

        assertEquals(2, summary.processed());
        assertEquals(1, summary.created());
        assertEquals(1, summary.matched());
        assertEquals(0, summary.errors());
        assertEquals(1, store.getAllCanonicalIncidents().size());

        RawRecord linked1 = store.findById("r1").orElseThrow();
        RawRecord linked2 = store.findById("r2").orElseThrow();
        assertEquals(linked1.getCanonicalIncidentId(), linked2.getCanonicalIncidentId());
        assertEquals(ProcessingStatus.COMPLETE, linked2.getProcessingStatus());
        assertNotNull(linked1.getVesselReferenceId());
        assertEquals(linked1.getVesselReferenceId(), linked2.getVesselReferenceId());
        assertEquals(1, vesselRegistry.getRegisteredCount());
        assertEquals(1, auditService.getEntriesByAction(AuditAction.CANONICAL_INCIDENT_CREATED).size());
        assertEquals(1, auditService.getEntriesByAction(AuditAction.MATCH_FOUND).size());
    }

    @Test
    @DisplayName("Record without a date always starts a new incident")
    void testUndatedCreatesIncident() {
        RawRecord first = report("r1", "UKMTO", T, 1.20, 103.80);
        RawRecord undated = RawRecord.builder(report("r2", "RECAAP", T, 1.20, 103.80)).occurredAt(null).build();
        store.saveAll(List.of(first, undated));

        IngestSummary summary = service(store).ingest(List.of(first, undated));

        assertEquals(2, summary.created());
        assertEquals(2, store.getAllCanonicalIncidents().size());
    }

    @Test
    @DisplayName("A failing record is marked ERROR and the batch continues")
    void testRecordFailureIsolated() {
        RawRecord stored = report("r1", "UKMTO", T, 1.20, 103.80);
        RawRecord missing = report("ghost", "RECAAP", T, 12.0, 45.0);
        store.save(stored);

        IngestSummary summary = service(store).ingest(List.of(missing, stored));

        assertEquals(1, summary.errors());
        assertEquals(1, summary.created());
        IngestResult failed = summary.results().get(0);
        assertTrue(failed.isError());
        assertEquals("ghost", failed.recordId());
        assertNull(failed.canonicalIncidentId());
        assertEquals(ProcessingStatus.COMPLETE, store.findById("r1").orElseThrow().getProcessingStatus());
    }

    @Test
    @DisplayName("Candidate query failure is recorded on the record")
    void testCandidateQueryFailure() {
        IncidentStore failing = mock(IncidentStore.class);
        when(failing.queryCandidates(any(TimeWindow.class), any(BoundingBox.class)))
                .thenThrow(new StoreException("index offline"));
        RawRecord record = report("r1", "UKMTO", T, 1.20, 103.80);

        IngestSummary summary = service(failing).ingest(List.of(record));

        assertEquals(1, summary.errors());
        assertEquals("index offline", summary.results().get(0).error());
        verify(failing).updateProcessingStatus("r1", ProcessingStatus.ERROR);
        verify(failing, never()).createCanonicalIncident(any());
    }

    @Test
    @DisplayName("Empty batch yields an empty summary")
    void testEmptyBatch() {
        IngestSummary summary = service(store).ingest(List.of());

        assertEquals(0, summary.processed());
        assertNotNull(summary.batchId());
        assertTrue(summary.results().isEmpty());
    }
}

package com.incident.dedup.matching;

import com.incident.dedup.audit.AuditAction;
import com.incident.dedup.audit.AuditService;
import com.incident.dedup.core.model.CanonicalIncident;
import com.incident.dedup.core.model.MatchState;
import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.geo.BoundingBox;
import com.incident.dedup.geo.TimeWindow;
import com.incident.dedup.metrics.MicrometerMetricsService;
import com.incident.dedup.scoring.CompositeScorer;
import com.incident.dedup.scoring.ScoringProfile;
import com.incident.dedup.store.InMemoryIncidentStore;
import com.incident.dedup.store.IncidentStore;
import com.incident.dedup.store.StoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CandidateFinderTest {

    private static final Instant T = Instant.parse("2024-05-10T08:00:00Z");

    private static RawRecord.Builder incoming() {
        return RawRecord.builder().id("new-1").source("UKMTO").occurredAt(T).coordinates(4.0, 3.0);
    }

    private static CanonicalIncident incident(String id, Instant at, double lat, double lon,
                                              String vesselName, String type, String title) {
        return new CanonicalIncident(id, at, lat, lon, title, null, null, type, vesselName, null, "rec-" + id);
    }

    @Nested
    @DisplayName("With an in-memory store")
    class InMemoryTests {

        private InMemoryIncidentStore store;
        private AuditService auditService;
        private SimpleMeterRegistry registry;
        private CandidateFinder finder;

        @BeforeEach
        void setUp() {
            store = new InMemoryIncidentStore();
            auditService = new AuditService();
            registry = new SimpleMeterRegistry();
            finder = new CandidateFinder(store, MatchOptions.defaults(), OverrideRules.defaults(),
                    KeywordSignatures.defaults(), new MicrometerMetricsService(registry), auditService);
        }

        @Test
        @DisplayName("Near-identical report is matched through an override rule")
        void testForcedMatch() {
            store.saveCanonicalIncident(incident("inc-1", T.plus(1, ChronoUnit.HOURS), 4.01, 3.01,
                    "DELTA", "Theft", null));

            MatchOutcome outcome = finder.findMatch(incoming().vesselName("MV DELTA").incidentTypeName("Robbery").build());

            assertEquals(MatchState.MATCHED, outcome.state());
            assertEquals("inc-1", outcome.canonicalIncidentId());
            assertTrue(outcome.override().isForcedMatch());
            assertEquals(1, outcome.candidatesEvaluated());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.MATCH_FOUND).size());
            assertEquals(1.0, registry.find("dedup.candidate.outcome").tag("state", "MATCHED").counter().count());
        }

        @Test
        @DisplayName("Composite score alone can match without an override")
        void testThresholdMatch() {
            store.saveCanonicalIncident(incident("inc-1", T.plus(2, ChronoUnit.HOURS), 4.0899, 3.0,
                    null, null, null));

            MatchOutcome outcome = finder.findMatch(incoming().build());

            assertTrue(outcome.isMatched());
            assertEquals(OverrideOutcome.Kind.NO_OVERRIDE, outcome.override().kind());
            assertTrue(outcome.score().total() >= MatchOptions.DEFAULT_MATCH_THRESHOLD);
            assertTrue(outcome.reason().startsWith("Composite score"));
        }

        @Test
        @DisplayName("Distant or out-of-window incidents are not matched")
        void testNoMatch() {
            store.saveCanonicalIncident(incident("far", T, 5.0, 3.0, "DELTA", "Robbery", null));
            store.saveCanonicalIncident(incident("late", T.plus(4, ChronoUnit.DAYS), 4.0, 3.0, "DELTA", "Robbery", null));

            MatchOutcome outcome = finder.findMatch(incoming().vesselName("DELTA").build());

            assertEquals(MatchState.NO_MATCH, outcome.state());
            assertNull(outcome.canonicalIncidentId());
            assertEquals(0, outcome.candidatesEvaluated());
            assertEquals(1.0, registry.find("dedup.candidate.outcome").tag("state", "NO_MATCH").counter().count());
        }

        @Test
        @DisplayName("Highest scoring candidate wins")
        void testBestCandidate() {
            store.saveCanonicalIncident(incident("inc-a", T.plus(20, ChronoUnit.HOURS), 4.1, 3.1, "DELTA", null, null));
            store.saveCanonicalIncident(incident("inc-b", T, 4.0, 3.0, "DELTA", null, null));

            assertEquals("inc-b", finder.findMatch(incoming().vesselName("DELTA").build()).canonicalIncidentId());
        }

        @Test
        @DisplayName("Equal scores resolve to the lowest incident id")
        void testTieBreak() {
            store.saveCanonicalIncident(incident("inc-b", T, 4.0, 3.0, "DELTA", null, null));
            store.saveCanonicalIncident(incident("inc-a", T, 4.0, 3.0, "DELTA", null, null));

            MatchOutcome outcome = finder.findMatch(incoming().vesselName("DELTA").build());

            assertEquals("inc-a", outcome.canonicalIncidentId());
            assertEquals(2, outcome.candidatesEvaluated());
        }

        @Test
        @DisplayName("Vetoed candidate is never matched even when another rule forces it")
        void testVeto() {
            CandidateFinder vetoing = new CandidateFinder(store, MatchOptions.defaults(),
                    new OverrideRules(List.of(
                            OverrideRule.forceMatch("always", "always", s -> true),
                            OverrideRule.forceNonMatch("same-name-veto", "veto", s -> s.vesselSimilarity() == 1.0))),
                    KeywordSignatures.defaults(), new MicrometerMetricsService(registry), auditService);
            store.saveCanonicalIncident(incident("inc-1", T, 4.0, 3.0, "DELTA", null, null));

            assertFalse(vetoing.findMatch(incoming().vesselName("DELTA").build()).isMatched());
            assertTrue(vetoing.findMatch(incoming().vesselName("OCEAN STAR").build()).isMatched());
        }

        @Test
        @DisplayName("Vessel signal falls back to the candidate title")
        void testTitleFallback() {
            CanonicalIncident candidate = incident("inc-1", T, 4.0, 3.0, null, null, "Ocean Star");
            RawRecord record = incoming().vesselName("MV OCEAN STAR").build();

            MatchSignals signals = finder.signals(record, candidate,
                    new CompositeScorer(ScoringProfile.ingest()).score(record, candidate));

            assertEquals(1.0, signals.vesselSimilarity(), 1e-9);
        }
    }

    @Nested
    @DisplayName("With a mocked store")
    class MockedStoreTests {

        private IncidentStore store;

        @BeforeEach
        void setUp() {
            store = mock(IncidentStore.class);
        }

        @Test
        @DisplayName("Records without a date or with the (0,0) sentinel never query the store")
        void testInvalidInputShortCircuits() {
            CandidateFinder finder = new CandidateFinder(store);

            MatchOutcome undated = finder.findMatch(incoming().occurredAt(null).build());
            MatchOutcome nullIsland = finder.findMatch(incoming().coordinates(0.0, 0.0).build());

            assertEquals(MatchState.NO_MATCH, undated.state());
            assertEquals("Missing date", undated.reason());
            assertEquals(MatchState.NO_MATCH, nullIsland.state());
            verifyNoInteractions(store);
        }

        @Test
        @DisplayName("Store failures propagate")
        void testStoreFailure() {
            when(store.queryCandidates(any(TimeWindow.class), any(BoundingBox.class)))
                    .thenThrow(new StoreException("connection reset"));
            CandidateFinder finder = new CandidateFinder(store);

            assertThrows(StoreException.class, () -> finder.findMatch(incoming().build()));
        }
    }
}

package com.incident.dedup.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Run context sets run id and operation, and clears them on close")
    void testForRun() {
        try (LogContext ctx = LogContext.forRun("run-1")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("dedup", MDC.get("operation"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Nested merge context restores the run context on close")
    void testNestedRestore() {
        try (LogContext run = LogContext.forRun("run-1")) {
            try (LogContext merge = LogContext.forMerge("run-1", "p", "s")) {
                assertEquals("merge", MDC.get("operation"));
                assertEquals("p", MDC.get("primaryRecordId"));
                assertEquals("s", MDC.get("secondaryRecordId"));
            }
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("dedup", MDC.get("operation"));
            assertNull(MDC.get("primaryRecordId"));
        }
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("Match and ingest contexts carry their identifiers")
    void testMatchAndIngest() {
        try (LogContext ingest = LogContext.forIngest("batch-1");
             LogContext match = LogContext.forMatch("corr-1", "rec-1").with("source", "UKMTO")) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("corr-1", MDC.get("correlationId"));
            assertEquals("rec-1", MDC.get("recordId"));
            assertEquals("UKMTO", MDC.get("source"));
            assertEquals("match", MDC.get("operation"));
        }
        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("source"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Generated correlation ids are unique")
    void testCorrelationId() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}

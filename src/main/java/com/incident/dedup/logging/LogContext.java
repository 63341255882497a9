package com.incident.dedup.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. On close, each key added through this context is restored to
 * the value it had before, so a merge context nested in a run context leaves the run's keys intact.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId)) {
 *     log.info("dedup.run.started lookbackDays={}", days);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Context for one deduplication run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "dedup");
        return ctx;
    }

    /**
     * Context for the write phase of one merge within a run.
     */
    public static LogContext forMerge(String runId, String primaryRecordId, String secondaryRecordId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("primaryRecordId", primaryRecordId);
        ctx.put("secondaryRecordId", secondaryRecordId);
        ctx.put("operation", "merge");
        return ctx;
    }

    /**
     * Context for ingest-time matching of one record.
     */
    public static LogContext forMatch(String correlationId, String recordId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("recordId", recordId);
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Context for one ingest batch.
     */
    public static LogContext forIngest(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "ingest");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * The enclosing dedup run or ingest batch id, or null outside both.
     */
    public static String currentRunId() {
        String runId = MDC.get("runId");
        return runId != null ? runId : MDC.get("batchId");
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}

package com.unit.catalog.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forUnit(runId, "mechs/Atlas AS7-D.mtf")) {
 *     log.info("ingest.unit.stored slug={} status={}", slug, status);
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole ingestion run.
     */
    public static LogContext forIngestion(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "ingest");
        return ctx;
    }

    /**
     * Creates a log context for one archive entry within an ingestion run.
     */
    public static LogContext forUnit(String runId, String entry) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("entry", entry);
        ctx.put("operation", "ingest");
        return ctx;
    }

    /**
     * Creates a log context for one remote resource of a fetch run.
     */
    public static LogContext forFetch(String runId, String resource) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("resource", resource);
        ctx.put("operation", "fetch");
        return ctx;
    }

    /**
     * Creates a log context for matching one external catalog record.
     */
    public static LogContext forMatch(String runId, int externalId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("externalId", String.valueOf(externalId));
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}

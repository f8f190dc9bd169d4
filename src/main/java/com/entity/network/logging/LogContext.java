package com.entity.network.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Try-with-resources wrapper around the SLF4J MDC. Closing a context puts back whatever the
 * keys held before it was opened, so stage contexts nest inside a run context.
 * <pre>
 * try (LogContext ctx = LogContext.forStage(runId, "dedup")) {
 *     log.info("dedup.completed kind={} before={} after={}", kind, before, after);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String STAGE = "stage";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Context of a whole pipeline run.
     */
    public static LogContext forRun(String runId) {
        return new LogContext().with(RUN_ID, runId);
    }

    /**
     * Context of one pipeline stage within a run.
     */
    public static LogContext forStage(String runId, String stage) {
        return new LogContext().with(RUN_ID, runId).with(STAGE, stage);
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
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

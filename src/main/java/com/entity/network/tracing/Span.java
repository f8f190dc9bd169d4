package com.entity.network.tracing;

/**
 * One timed unit of pipeline work. Closing the span ends it, so stages wrap their work in
 * try-with-resources:
 * <pre>
 * try (Span span = tracing.startStage(runId, "dedup")) {
 *     span.setAttribute("records.in", records.size());
 *     ...
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void markFailed(Throwable cause);

    @Override
    void close();
}

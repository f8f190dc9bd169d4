package com.entity.network.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}. Spans of one run share
 * nothing but their {@code runId} attribute; each stage is a root span.
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final String INSTRUMENTATION_NAME = "com.entity.network";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new StageSpan(builder.startSpan());
    }

    private static final class StageSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;
        private boolean failed;

        StageSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void markFailed(Throwable cause) {
            failed = true;
            delegate.recordException(cause);
            delegate.setStatus(StatusCode.ERROR, cause.getClass().getSimpleName());
        }

        @Override
        public void close() {
            if (!failed) {
                delegate.setStatus(StatusCode.OK);
            }
            delegate.end();
        }
    }
}

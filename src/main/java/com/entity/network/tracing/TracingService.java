package com.entity.network.tracing;

import java.util.Map;

/**
 * Tracing seam of the pipeline. {@link NoOpTracingService} is the default, so no tracing
 * backend is needed on the classpath.
 */
public interface TracingService {

    String SPAN_PREFIX = "entity-network.";

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Starts the span of a pipeline stage, named {@code entity-network.<stage>}.
     */
    default Span startStage(String runId, String stage) {
        return startSpan(SPAN_PREFIX + stage, Map.of("runId", runId, "stage", stage));
    }
}

package com.entity.network.metrics;

import com.entity.network.core.model.EntityKind;

import java.time.Duration;

/**
 * Interface for recording pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so the pipeline runs without a metrics backend.
 */
public interface MetricsService {

    void recordStageDuration(String stage, Duration duration);

    void incrementMalformedRecord(String reason);

    void recordDeduplication(EntityKind kind, int recordsBefore, int recordsAfter);

    void incrementUnresolvedMention();

    void incrementUnresolvedSecondaryName();

    void recordDocumentCardinality(int distinctEntities);

    void recordConflationFindings(String check, int count);

    void recordEdgeCount(String source, long count);
}

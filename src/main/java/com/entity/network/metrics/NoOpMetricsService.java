package com.entity.network.metrics;

import com.entity.network.core.model.EntityKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(String stage, Duration duration) {
    }

    @Override
    public void incrementMalformedRecord(String reason) {
    }

    @Override
    public void recordDeduplication(EntityKind kind, int recordsBefore, int recordsAfter) {
    }

    @Override
    public void incrementUnresolvedMention() {
    }

    @Override
    public void incrementUnresolvedSecondaryName() {
    }

    @Override
    public void recordDocumentCardinality(int distinctEntities) {
    }

    @Override
    public void recordConflationFindings(String check, int count) {
    }

    @Override
    public void recordEdgeCount(String source, long count) {
    }
}

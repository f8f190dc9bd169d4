package com.entity.network.metrics;

import com.entity.network.core.model.EntityKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code entity.pipeline.stage.duration} Timer (tag: stage)</li>
 *   <li>{@code entity.ingest.malformed} Counter (tag: reason)</li>
 *   <li>{@code entity.dedup.absorbed} Counter (tag: entityKind)</li>
 *   <li>{@code entity.dedup.output} DistributionSummary (tag: entityKind)</li>
 *   <li>{@code entity.mention.unresolved} Counter</li>
 *   <li>{@code entity.secondary.unresolved} Counter</li>
 *   <li>{@code entity.document.cardinality} DistributionSummary</li>
 *   <li>{@code entity.conflation.findings} Counter (tag: check)</li>
 *   <li>{@code entity.graph.edges} DistributionSummary (tag: source)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final Counter unresolvedMentionCounter;
    private final Counter unresolvedSecondaryCounter;
    private final DistributionSummary cardinalitySummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.unresolvedMentionCounter = Counter.builder("entity.mention.unresolved")
                .description("Mentions that matched no deduplicated entity")
                .register(registry);
        this.unresolvedSecondaryCounter = Counter.builder("entity.secondary.unresolved")
                .description("Secondary-source names given a synthetic identifier")
                .register(registry);
        this.cardinalitySummary = DistributionSummary.builder("entity.document.cardinality")
                .description("Distinct resolved entities per document")
                .register(registry);
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage, k ->
                Timer.builder("entity.pipeline.stage.duration")
                        .description("Duration of a pipeline stage")
                        .tag("stage", stage)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementMalformedRecord(String reason) {
        counter("entity.ingest.malformed", "reason", reason,
                "Input records rejected at ingestion").increment();
    }

    @Override
    public void recordDeduplication(EntityKind kind, int recordsBefore, int recordsAfter) {
        counter("entity.dedup.absorbed", "entityKind", kind.name(),
                "Raw records absorbed into a canonical record").increment(recordsBefore - recordsAfter);
        summary("entity.dedup.output", "entityKind", kind.name(),
                "Canonical records produced per deduplication pass").record(recordsAfter);
    }

    @Override
    public void incrementUnresolvedMention() {
        unresolvedMentionCounter.increment();
    }

    @Override
    public void incrementUnresolvedSecondaryName() {
        unresolvedSecondaryCounter.increment();
    }

    @Override
    public void recordDocumentCardinality(int distinctEntities) {
        cardinalitySummary.record(distinctEntities);
    }

    @Override
    public void recordConflationFindings(String check, int count) {
        counter("entity.conflation.findings", "check", check,
                "Conflation findings reported for review").increment(count);
    }

    @Override
    public void recordEdgeCount(String source, long count) {
        summary("entity.graph.edges", "source", source,
                "Edges contributed per source").record(count);
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }

    private DistributionSummary summary(String name, String tagKey, String tagValue, String description) {
        return summaryCache.computeIfAbsent(name + ":" + tagValue, k ->
                DistributionSummary.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}

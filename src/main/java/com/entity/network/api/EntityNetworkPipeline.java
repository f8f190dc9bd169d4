package com.entity.network.api;

import com.entity.network.bulk.ArtifactWriter;
import com.entity.network.cache.CaffeineResolutionCache;
import com.entity.network.conflation.ConflationDetector;
import com.entity.network.conflation.ConflationReport;
import com.entity.network.conflation.DeduplicationInvariantViolationException;
import com.entity.network.cooccurrence.CooccurrenceAggregator;
import com.entity.network.cooccurrence.CooccurrenceGraph;
import com.entity.network.cooccurrence.DocumentMentions;
import com.entity.network.core.model.EntityRecord;
import com.entity.network.core.model.IngestIssue;
import com.entity.network.dedup.DedupResult;
import com.entity.network.dedup.Deduplicator;
import com.entity.network.dedup.CanonicalFormSelector;
import com.entity.network.dedup.MentionFolder;
import com.entity.network.graph.GraphMerger;
import com.entity.network.graph.MergedGraph;
import com.entity.network.graph.RelationshipGraph;
import com.entity.network.graph.SecondaryGraphResolver;
import com.entity.network.identity.IdentityAssigner;
import com.entity.network.identity.IdentityMap;
import com.entity.network.logging.LogContext;
import com.entity.network.metrics.MetricsService;
import com.entity.network.metrics.NoOpMetricsService;
import com.entity.network.rules.DefaultNormalizationRules;
import com.entity.network.rules.NormalizationEngine;
import com.entity.network.tracing.NoOpTracingService;
import com.entity.network.tracing.Span;
import com.entity.network.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Runs the whole batch: fold mentions into raw records, deduplicate, audit for conflation,
 * aggregate document co-occurrence, resolve the external relationship source and merge both
 * graphs.
 *
 * <p>Each stage runs inside a {@link LogContext} and a tracing span and reports its duration.
 * Malformed and unresolved input never stops a run; a residual duplicate after deduplication
 * does, unless {@link PipelineConfig#isFailOnResidualDuplicates()} is off.</p>
 */
public class EntityNetworkPipeline {
    private static final Logger log = LoggerFactory.getLogger(EntityNetworkPipeline.class);

    static final String STAGE_INGEST = "ingest";
    static final String STAGE_DEDUP = "dedup";
    static final String STAGE_CONFLATION = "conflation";
    static final String STAGE_COOCCURRENCE = "cooccurrence";
    static final String STAGE_SECONDARY = "secondary";
    static final String STAGE_MERGE = "merge";
    static final String STAGE_ARTIFACTS = "artifacts";

    private final PipelineConfig config;
    private final NormalizationEngine normalizer;
    private final IdentityAssigner assigner;
    private final CanonicalFormSelector canonicalFormSelector;
    private final MetricsService metrics;
    private final TracingService tracing;

    private EntityNetworkPipeline(Builder builder) {
        this.config = builder.config;
        this.normalizer = builder.normalizer;
        this.assigner = builder.assigner;
        this.canonicalFormSelector = builder.canonicalFormSelector;
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public PipelineResult run(PipelineInput input) {
        return run(input, LogContext.generateRunId());
    }

    /**
     * @throws DeduplicationInvariantViolationException if deduplication left residual duplicates
     *                                                  and the run is configured to fail on them
     */
    public PipelineResult run(PipelineInput input, String runId) {
        try (LogContext ignored = LogContext.forRun(runId)) {
            log.info("pipeline.started mentions={} secondaryEdges={} config={}",
                    input.mentions().size(), input.secondaryEdges().size(), config);
            List<IngestIssue> issues = new ArrayList<>(input.readIssues());

            MentionFolder.Result folded = stage(runId, STAGE_INGEST, span -> {
                MentionFolder.Result r = new MentionFolder(normalizer, metrics).fold(input.mentions());
                span.setAttribute("mentions.accepted", r.acceptedMentions());
                span.setAttribute("records.raw", r.records().size());
                return r;
            });
            issues.addAll(folded.issues());

            DedupResult dedup = stage(runId, STAGE_DEDUP, span -> {
                DedupResult r = new Deduplicator(normalizer, assigner, canonicalFormSelector, metrics)
                        .deduplicate(folded.records());
                span.setAttribute("records.in", r.inputCount());
                span.setAttribute("records.out", r.outputCount());
                return r;
            });
            issues.addAll(dedup.issues());

            ConflationReport report = stage(runId, STAGE_CONFLATION, span -> {
                ConflationReport r = new ConflationDetector(config.getConflationChecks(),
                        config.getMinPartialMatchLength(), metrics).detect(dedup.records());
                span.setAttribute("findings", r.totalFindings());
                if (config.isFailOnResidualDuplicates()) {
                    r.assertNoResidualDuplicates();
                }
                return r;
            });

            IdentityMap identityMap = IdentityMap.builder()
                    .normalizer(normalizer)
                    .cache(CaffeineResolutionCache.create(config.getCacheConfig()))
                    .kindPreference(config.getKindPreference())
                    .records(dedup.records())
                    .build();

            CooccurrenceGraph cooccurrence = stage(runId, STAGE_COOCCURRENCE, span -> {
                CooccurrenceGraph g = aggregate(identityMap, input);
                span.setAttribute("documents", g.getDocumentsProcessed());
                span.setAttribute("pairs", g.pairCount());
                return g;
            });
            RelationshipGraph documentGraph = cooccurrence.toRelationshipGraph(
                    config.getPrimarySource(), config.getMinCooccurrenceWeight());

            SecondaryGraphResolver.Result secondary = stage(runId, STAGE_SECONDARY, span -> {
                SecondaryGraphResolver.Result r = new SecondaryGraphResolver(identityMap, assigner, metrics)
                        .resolve(config.getSecondarySource(), input.secondaryEdges());
                span.setAttribute("edges", r.graph().edgeCount());
                span.setAttribute("unresolved", r.unresolvedNames().size());
                return r;
            });
            issues.addAll(secondary.issues());

            MergedGraph merged = stage(runId, STAGE_MERGE, span -> {
                MergedGraph g = new GraphMerger(identityMap, metrics).merge(documentGraph, secondary.graph());
                span.setAttribute("nodes", g.nodeCount());
                span.setAttribute("edges", g.edgeCount());
                return g;
            });

            PipelineSummary summary = summarize(input, folded, dedup, report, cooccurrence,
                    documentGraph, secondary, merged, issues);
            log.info("pipeline.completed entities={} edges={} issues={} cache={}",
                    dedup.outputCount(), merged.edgeCount(), issues.size(), identityMap.getCache().getStats());
            return new PipelineResult(runId, dedup, identityMap, report, cooccurrence,
                    secondary.graph(), merged, issues, summary);
        }
    }

    /**
     * Writes every artifact of a run into {@code outputDirectory}.
     */
    public List<Path> writeArtifacts(PipelineResult result, Path outputDirectory) {
        return writeArtifacts(result, new ArtifactWriter(outputDirectory));
    }

    public List<Path> writeArtifacts(PipelineResult result, ArtifactWriter writer) {
        try (LogContext ignored = LogContext.forRun(result.runId())) {
            return stage(result.runId(), STAGE_ARTIFACTS, span -> {
                List<Path> written = new ArrayList<>();
                written.add(writer.writeEntities(result.entities()));
                written.add(writer.writeConflationReport(result.conflationReport()));
                written.add(writer.writeConflationMarkdown(result.conflationReport()));
                written.addAll(writer.writeGraph(result.mergedGraph(), config.getPrimarySource()));
                written.add(writer.writeJson(ArtifactWriter.SUMMARY_JSON, result.summary()));
                span.setAttribute("files", written.size());
                log.info("artifacts.written directory={} files={}", writer.getOutputDirectory(), written.size());
                return written;
            });
        }
    }

    private CooccurrenceGraph aggregate(IdentityMap identityMap, PipelineInput input) {
        CooccurrenceAggregator aggregator = new CooccurrenceAggregator(identityMap,
                config.getDocumentTypeClassifier(), config.getHighCardinalityThreshold(),
                config.getProgressInterval(), metrics);
        List<DocumentMentions> documents = DocumentMentions.groupByDocument(input.mentions());
        if (config.getPartitions() <= 1 || documents.size() < 2) {
            return aggregator.aggregate(documents);
        }
        return aggregator.aggregatePartitioned(partition(documents, config.getPartitions()));
    }

    static <T> List<List<T>> partition(List<T> items, int partitions) {
        List<List<T>> result = new ArrayList<>(partitions);
        int size = (items.size() + partitions - 1) / partitions;
        for (int start = 0; start < items.size(); start += size) {
            result.add(items.subList(start, Math.min(items.size(), start + size)));
        }
        return result;
    }

    private PipelineSummary summarize(PipelineInput input,
                                      MentionFolder.Result folded,
                                      DedupResult dedup,
                                      ConflationReport report,
                                      CooccurrenceGraph cooccurrence,
                                      RelationshipGraph documentGraph,
                                      SecondaryGraphResolver.Result secondary,
                                      MergedGraph merged,
                                      List<IngestIssue> issues) {
        SortedMap<String, Integer> byKind = new TreeMap<>();
        for (EntityRecord record : dedup.records()) {
            byKind.merge(record.getKind().getLabel(), 1, Integer::sum);
        }
        int malformed = (int) issues.stream()
                .filter(i -> i.type() == IngestIssue.Type.MALFORMED_INPUT)
                .count();
        return new PipelineSummary(
                input.mentions().size(),
                folded.acceptedMentions(),
                malformed,
                folded.records().size(),
                dedup.inputCount(),
                dedup.outputCount(),
                byKind,
                dedup.mergedGroups(),
                dedup.absorbedRecords(),
                report.residualDuplicates().size(),
                report.typeConflicts().size(),
                report.partialMatches().size(),
                cooccurrence.getDocumentsProcessed(),
                cooccurrence.getDocumentTypeCounts(),
                cooccurrence.getHighCardinalityDocuments().size(),
                cooccurrence.getMentionsResolved(),
                cooccurrence.getUnresolvedMentions(),
                secondary.unresolvedNames().size(),
                secondary.selfLoops(),
                documentGraph.edgeCount(),
                secondary.graph().edgeCount(),
                merged.edgeCount(),
                merged.nodeCount(),
                issues.size());
    }

    private <T> T stage(String runId, String name, StageWork<T> work) {
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forStage(runId, name);
             Span span = tracing.startStage(runId, name)) {
            try {
                return work.run(span);
            } catch (RuntimeException e) {
                span.markFailed(e);
                log.error("stage.failed stage={} error={}", name, e.getMessage());
                throw e;
            } finally {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                metrics.recordStageDuration(name, elapsed);
                log.debug("stage.completed stage={} durationMs={}", name, elapsed.toMillis());
            }
        }
    }

    @FunctionalInterface
    private interface StageWork<T> {
        T run(Span span);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PipelineConfig config = PipelineConfig.defaults();
        private NormalizationEngine normalizer;
        private IdentityAssigner assigner = new IdentityAssigner();
        private CanonicalFormSelector canonicalFormSelector = CanonicalFormSelector.defaultSelector();
        private MetricsService metrics = new NoOpMetricsService();
        private TracingService tracing = new NoOpTracingService();

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        public Builder normalizer(NormalizationEngine normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder assigner(IdentityAssigner assigner) {
            this.assigner = assigner;
            return this;
        }

        public Builder canonicalFormSelector(CanonicalFormSelector canonicalFormSelector) {
            this.canonicalFormSelector = canonicalFormSelector;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public EntityNetworkPipeline build() {
            if (normalizer == null) {
                normalizer = DefaultNormalizationRules.createDefaultEngine();
            }
            Objects.requireNonNull(config, "config is required");
            Objects.requireNonNull(assigner, "assigner is required");
            Objects.requireNonNull(canonicalFormSelector, "canonicalFormSelector is required");
            Objects.requireNonNull(metrics, "metrics is required");
            Objects.requireNonNull(tracing, "tracing is required");
            return new EntityNetworkPipeline(this);
        }
    }
}

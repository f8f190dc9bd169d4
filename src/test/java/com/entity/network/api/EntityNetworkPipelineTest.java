package com.entity.network.api;

import com.entity.network.core.model.EntityKind;
import com.entity.network.core.model.EntityRecord;
import com.entity.network.core.model.IngestIssue;
import com.entity.network.core.model.RawMention;
import com.entity.network.dedup.CanonicalFormRule;
import com.entity.network.dedup.CanonicalFormSelector;
import com.entity.network.graph.SecondaryEdge;
import com.entity.network.graph.WeightedEdge;
import com.entity.network.identity.IdentityAssigner;
import com.entity.network.metrics.MetricsService;
import com.entity.network.tracing.Span;
import com.entity.network.tracing.TracingService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("EntityNetworkPipeline Tests")
@ExtendWith(MockitoExtension.class)
class EntityNetworkPipelineTest {

    private static final String EPSTEIN = "55313470-d17a-599d-96cc-6c7d3b09c0f4";
    private static final String FBI = "370cb10b-4a8c-5a89-bb53-52ef67770904";
    private static final String NEW_YORK_LOCATION = "ed7457cd-dc99-590b-9e1f-2418442d2930";
    private static final String NEW_YORK_ORGANIZATION = "54c3707b-8686-5f4a-a997-cf2ca1358cf0";

    private final IdentityAssigner assigner = new IdentityAssigner();
    private final String maxwell = assigner.assign("ghislaine maxwell", EntityKind.PERSON);
    private final String visoski = assigner.assignFallback("larry visoski");

    @Mock
    private MetricsService metrics;

    private PipelineInput input;

    @BeforeEach
    void setUp() {
        List<RawMention> mentions = List.of(
                new RawMention("Jeffrey Epstein", "person", "DOJ-OGR-1"),
                new RawMention("Ghislaine Maxwell", "person", "DOJ-OGR-1"),
                new RawMention("New York", "location", "DOJ-OGR-1"),
                new RawMention("JEFFREY EPSTEIN", "person", "EMAIL-1"),
                new RawMention("ghislaine maxwell", "person", "EMAIL-1"),
                new RawMention("New York", "organization", "COURT-1"),
                new RawMention("The FBI", "organization", "COURT-1"),
                new RawMention("THE FBI", "organization", "COURT-1"),
                new RawMention("X", "vehicle", "D4"));
        List<SecondaryEdge> edges = List.of(
                new SecondaryEdge("Jeffrey Epstein", "Ghislaine Maxwell", 5),
                new SecondaryEdge("Jeffrey Epstein", "Larry Visoski", 2));
        input = PipelineInput.of(mentions, edges);
    }

    @Nested
    @DisplayName("End-to-end run")
    class EndToEnd {

        @Test
        @DisplayName("Should fold, deduplicate and audit the mentions")
        void entitiesAndAudit() {
            PipelineResult result = EntityNetworkPipeline.builder().metrics(metrics).build().run(input, "run-1");

            assertEquals("run-1", result.runId());
            List<EntityRecord> entities = result.entities();
            assertEquals(5, entities.size());
            EntityRecord epstein = entities.stream()
                    .filter(r -> r.getIdentifier().equals(EPSTEIN)).findFirst().orElseThrow();
            assertEquals("Jeffrey Epstein", epstein.getSurfaceName());
            assertEquals(Set.of("JEFFREY EPSTEIN"), epstein.getAliases());
            assertEquals(Set.of("DOJ-OGR-1", "EMAIL-1"), epstein.getProvenance());
            assertEquals(2, epstein.getMentionCount());

            assertTrue(result.identityMap().contains(FBI));
            assertEquals(1, result.conflationReport().typeConflicts().size());
            assertTrue(result.conflationReport().residualDuplicates().isEmpty());
        }

        @Test
        @DisplayName("Should merge document co-occurrence with the external source")
        void mergedGraph() {
            PipelineResult result = EntityNetworkPipeline.builder().metrics(metrics).build().run(input, "run-2");

            assertEquals(2, result.cooccurrenceGraph().weight(EPSTEIN, maxwell));
            assertEquals(1, result.cooccurrenceGraph().weight(NEW_YORK_ORGANIZATION, FBI));
            assertEquals(0, result.cooccurrenceGraph().weight(NEW_YORK_LOCATION, NEW_YORK_ORGANIZATION));

            WeightedEdge core = result.mergedGraph().edge(EPSTEIN, maxwell).orElseThrow();
            assertEquals(7, core.weight());
            assertEquals(Set.of("document", "manifest"), core.sources());
            assertEquals(2, result.mergedGraph().weight(EPSTEIN, visoski));
            assertEquals(5, result.mergedGraph().edgeCount());
            assertEquals(6, result.mergedGraph().nodeCount());
        }

        @Test
        @DisplayName("Should report every count in the summary")
        void summary() {
            PipelineSummary summary = EntityNetworkPipeline.builder().metrics(metrics).build().run(input).summary();

            assertEquals(9, summary.mentionsRead());
            assertEquals(8, summary.mentionsAccepted());
            assertEquals(1, summary.malformedRecords());
            assertEquals(8, summary.rawRecords());
            assertEquals(5, summary.entitiesAfterDedup());
            assertEquals(2, summary.entitiesByKind().get("person"));
            assertEquals(2, summary.entitiesByKind().get("organization"));
            assertEquals(1, summary.typeConflicts());
            assertEquals(0, summary.residualDuplicates());
            assertEquals(4, summary.documentsProcessed());
            assertEquals(8, summary.mentionsResolved());
            assertEquals(1, summary.unresolvedMentions());
            assertEquals(1, summary.unresolvedSecondaryNames());
            assertEquals(4, summary.documentEdges());
            assertEquals(2, summary.secondaryEdges());
            assertEquals(5, summary.mergedEdges());
            assertEquals(6, summary.graphNodes());
            assertEquals(2, summary.issueTotal());
        }

        @Test
        @DisplayName("Should record issues and metrics without stopping the run")
        void issuesAndMetrics() {
            PipelineResult result = EntityNetworkPipeline.builder().metrics(metrics).build().run(input);

            assertEquals(1, result.issues().stream()
                    .filter(i -> i.type() == IngestIssue.Type.MALFORMED_INPUT).count());
            assertEquals(1, result.issues().stream()
                    .filter(i -> i.type() == IngestIssue.Type.UNRESOLVED_REFERENCE).count());

            for (String stage : List.of("ingest", "dedup", "conflation", "cooccurrence", "secondary", "merge")) {
                verify(metrics).recordStageDuration(eq(stage), any(Duration.class));
            }
            verify(metrics).recordDeduplication(EntityKind.PERSON, 4, 2);
            verify(metrics).incrementMalformedRecord("mention");
            verify(metrics).incrementUnresolvedSecondaryName();
            verify(metrics, never()).recordStageDuration(eq("artifacts"), any(Duration.class));
        }

        @Test
        @DisplayName("Partitioned aggregation gives the same graph")
        void partitionedRun() {
            PipelineResult sequential = EntityNetworkPipeline.builder().build().run(input);
            PipelineResult partitioned = EntityNetworkPipeline.builder()
                    .config(PipelineConfig.builder().partitions(2).build())
                    .build()
                    .run(input);

            assertEquals(sequential.cooccurrenceGraph().getWeights(), partitioned.cooccurrenceGraph().getWeights());
            assertEquals(sequential.mergedGraph().edges(), partitioned.mergedGraph().edges());
        }

        @Test
        @DisplayName("Writing artifacts produces the files of the run")
        void artifacts(@TempDir Path out) {
            EntityNetworkPipeline pipeline = EntityNetworkPipeline.builder().metrics(metrics).build();
            PipelineResult result = pipeline.run(input);

            List<Path> written = pipeline.writeArtifacts(result, out);

            assertTrue(written.contains(out.resolve("entities.csv")));
            assertTrue(written.contains(out.resolve("summary.json")));
            written.forEach(path -> assertTrue(Files.isRegularFile(path), path.toString()));
            verify(metrics).recordStageDuration(eq("artifacts"), any(Duration.class));
        }
    }

    @Test
    @DisplayName("Artifacts use the configured primary source for edge statistics")
    void renamedPrimarySource(@TempDir Path out) throws IOException {
        EntityNetworkPipeline pipeline = EntityNetworkPipeline.builder()
                .config(PipelineConfig.builder().primarySource("documents").build())
                .build();
        PipelineResult result = pipeline.run(PipelineInput.of(List.of(
                new RawMention("Jeffrey Epstein", "person", "DOJ-OGR-1"),
                new RawMention("Ghislaine Maxwell", "person", "DOJ-OGR-1"))));

        pipeline.writeArtifacts(result, out);

        JsonNode statistics = new ObjectMapper().readTree(out.resolve("graph.json").toFile()).path("statistics");
        assertEquals(1, statistics.path("document_only_edges").asInt());
        assertEquals(0, statistics.path("secondary_only_edges").asInt());
    }

    @Nested
    @DisplayName("Stage failures")
    class StageFailures {

        @Mock
        private TracingService tracing;

        @Mock
        private Span span;

        @Test
        @DisplayName("A failing stage marks its span, records its duration and propagates")
        void failingStage() {
            when(tracing.startStage(anyString(), anyString())).thenReturn(span);
            CanonicalFormRule broken = CanonicalFormRule.builder()
                    .name("broken")
                    .priority(1)
                    .preference((a, b) -> {
                        throw new IllegalStateException("comparator failed");
                    })
                    .build();
            EntityNetworkPipeline pipeline = EntityNetworkPipeline.builder()
                    .canonicalFormSelector(new CanonicalFormSelector(List.of(broken)))
                    .metrics(metrics)
                    .tracing(tracing)
                    .build();

            IllegalStateException e = assertThrows(IllegalStateException.class, () -> pipeline.run(input, "run-x"));

            assertEquals("comparator failed", e.getMessage());
            verify(tracing).startStage("run-x", "ingest");
            verify(tracing).startStage("run-x", "dedup");
            verify(tracing, never()).startStage("run-x", "conflation");
            verify(span).markFailed(e);
            verify(span, times(2)).close();
            verify(metrics).recordStageDuration(eq("dedup"), any(Duration.class));
        }
    }

    @Test
    @DisplayName("partition splits into contiguous slices")
    void partition() {
        List<List<Integer>> slices = EntityNetworkPipeline.partition(List.of(1, 2, 3, 4, 5), 2);
        assertEquals(List.of(List.of(1, 2, 3), List.of(4, 5)), slices);

        assertEquals(3, EntityNetworkPipeline.partition(List.of(1, 2, 3), 5).size());
    }
}

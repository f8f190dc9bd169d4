package com.entity.network.bulk;

import com.entity.network.conflation.ConflationDetector;
import com.entity.network.conflation.ConflationReport;
import com.entity.network.core.model.EntityKind;
import com.entity.network.core.model.EntityRecord;
import com.entity.network.graph.GraphMerger;
import com.entity.network.graph.MergedGraph;
import com.entity.network.graph.RelationshipGraph;
import com.entity.network.identity.IdentityAssigner;
import com.entity.network.identity.IdentityMap;
import com.entity.network.rules.DefaultNormalizationRules;
import com.entity.network.rules.NormalizationEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactWriterTest {

    private final NormalizationEngine normalizer = DefaultNormalizationRules.createDefaultEngine();
    private final IdentityAssigner assigner = new IdentityAssigner();

    private List<EntityRecord> entities;
    private ConflationReport report;
    private MergedGraph graph;

    @BeforeEach
    void setUp() {
        entities = List.of(
                canonical("The FBI", EntityKind.ORGANIZATION, List.of("THE FBI", "the FBI"), 6, "D1", "D2"),
                canonical("New York", EntityKind.LOCATION, List.of(), 2, "D1"),
                canonical("New York", EntityKind.ORGANIZATION, List.of(), 1, "D3"),
                canonical("Maxwell, Ghislaine", EntityKind.PERSON, List.of(), 4, "D2"));
        report = new ConflationDetector().detect(entities);

        String fbi = entities.get(0).getIdentifier();
        String city = entities.get(1).getIdentifier();
        String pilot = assigner.assignFallback("larry visoski");
        RelationshipGraph documents = RelationshipGraph.builder(RelationshipGraph.SOURCE_DOCUMENT)
                .addWeight(fbi, city, 3)
                .build();
        RelationshipGraph manifest = RelationshipGraph.builder(RelationshipGraph.SOURCE_MANIFEST)
                .addWeight(fbi, city, 5)
                .addWeight(city, pilot, 2)
                .label(pilot, "Larry Visoski")
                .build();
        graph = new GraphMerger(IdentityMap.from(entities, normalizer)).merge(documents, manifest);
    }

    private EntityRecord canonical(String surface, EntityKind kind, List<String> aliases, long mentions,
                                   String... documents) {
        String key = normalizer.normalize(surface);
        return EntityRecord.builder()
                .surfaceName(surface)
                .normalizedName(key)
                .kind(kind)
                .identifier(assigner.assign(key, kind))
                .aliases(aliases)
                .mentionCount(mentions)
                .provenance(List.of(documents))
                .build();
    }

    private void writeAll(ArtifactWriter writer, List<EntityRecord> records) {
        writer.writeEntities(records);
        writer.writeConflationReport(report);
        writer.writeConflationMarkdown(report);
        writer.writeGraph(graph);
        Map<String, Object> summary = new TreeMap<>();
        summary.put("entities", records.size());
        summary.put("edges", graph.edgeCount());
        writer.writeJson(ArtifactWriter.SUMMARY_JSON, summary);
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Entities are written sorted with joined aliases and escaped names")
    void testEntities(@TempDir Path dir) throws IOException {
        Path file = new ArtifactWriter(dir).writeEntities(entities);
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);

        assertEquals("identifier,canonical_name,aliases,kind,mention_count,provenance", lines.get(0));
        assertEquals(5, lines.size());
        assertTrue(lines.get(1).contains("\"Maxwell, Ghislaine\",,person,4,D2"));
        assertEquals("370cb10b-4a8c-5a89-bb53-52ef67770904,The FBI,THE FBI|the FBI,organization,6,D1|D2", lines.get(3));
        assertTrue(lines.get(2).endsWith(",New York,,organization,1,D3"));
        assertTrue(lines.get(4).endsWith(",location,2,D1"));
    }

    @Test
    @DisplayName("Conflation report lists findings by check with the advisory note")
    void testConflationReport(@TempDir Path dir) throws IOException {
        ArtifactWriter writer = new ArtifactWriter(dir);
        JsonNode json = new ObjectMapper().readTree(writer.writeConflationReport(report).toFile());

        assertEquals(4, json.path("statistics").path("entities_checked").asInt());
        assertEquals(1, json.path("statistics").path("type_conflict").asInt());
        assertEquals(3, json.path("checks_run").size());
        assertEquals("new york", json.path("type_conflict").get(0).path("normalized_name").asText());
        assertEquals(2, json.path("type_conflict").get(0).path("entities").size());
        assertEquals(ConflationReport.ADVISORY_NOTE, json.path("note").asText());

        String markdown = read(writer.writeConflationMarkdown(report));
        assertTrue(markdown.startsWith("# Entity Conflation Report\n"));
        assertTrue(markdown.contains("| type_conflict | REVIEW | 1 |"));
    }

    @Test
    @DisplayName("Graph files carry nodes, source-tagged edges and statistics")
    void testGraph(@TempDir Path dir) throws IOException {
        List<Path> files = new ArtifactWriter(dir).writeGraph(graph);
        assertEquals(3, files.size());

        List<String> edges = Files.readAllLines(dir.resolve(ArtifactWriter.GRAPH_EDGES_CSV), StandardCharsets.UTF_8);
        assertEquals("source,target,weight,sources", edges.get(0));
        assertEquals(3, edges.size());
        assertTrue(edges.stream().anyMatch(line -> line.endsWith(",8,document|manifest")));

        List<String> nodes = Files.readAllLines(dir.resolve(ArtifactWriter.GRAPH_NODES_CSV), StandardCharsets.UTF_8);
        assertEquals("identifier,label,kind,degree,mention_count,synthetic", nodes.get(0));
        assertTrue(nodes.stream().anyMatch(line -> line.endsWith(",Larry Visoski,,1,0,true")));

        JsonNode json = new ObjectMapper().readTree(dir.resolve(ArtifactWriter.GRAPH_JSON).toFile());
        assertEquals(3, json.path("nodes").size());
        assertEquals(2, json.path("statistics").path("total_edges").asInt());
        assertEquals(0.6667, json.path("statistics").path("density").asDouble(), 1e-9);
        assertEquals(1, json.path("statistics").path("corroborated_edges").asInt());
        assertEquals(1, json.path("statistics").path("secondary_only_edges").asInt());
    }

    @Test
    @DisplayName("Graph statistics classify edges against the configured primary source")
    void testGraphWithRenamedSources(@TempDir Path dir) throws IOException {
        String fbi = entities.get(0).getIdentifier();
        String city = entities.get(1).getIdentifier();
        RelationshipGraph documents = RelationshipGraph.builder("documents").addWeight(fbi, city, 1).build();
        RelationshipGraph flights = RelationshipGraph.builder("flights").build();
        MergedGraph renamed = new GraphMerger(IdentityMap.from(entities, normalizer)).merge(documents, flights);

        new ArtifactWriter(dir).writeGraph(renamed, "documents");

        JsonNode statistics = new ObjectMapper().readTree(dir.resolve(ArtifactWriter.GRAPH_JSON).toFile())
                .path("statistics");
        assertEquals(1, statistics.path("document_only_edges").asInt());
        assertEquals(0, statistics.path("secondary_only_edges").asInt());
    }

    @Test
    @DisplayName("Identical inputs produce byte-identical artifacts")
    void testDeterministic(@TempDir Path first, @TempDir Path second) throws IOException {
        List<EntityRecord> shuffled = new ArrayList<>(entities);
        Collections.reverse(shuffled);

        writeAll(new ArtifactWriter(first.resolve("run")), entities);
        writeAll(new ArtifactWriter(second.resolve("run")), shuffled);

        for (String name : List.of(ArtifactWriter.ENTITIES_CSV, ArtifactWriter.CONFLATION_JSON,
                ArtifactWriter.CONFLATION_MARKDOWN, ArtifactWriter.GRAPH_NODES_CSV, ArtifactWriter.GRAPH_EDGES_CSV,
                ArtifactWriter.GRAPH_JSON, ArtifactWriter.SUMMARY_JSON)) {
            assertArrayEquals(Files.readAllBytes(first.resolve("run").resolve(name)),
                    Files.readAllBytes(second.resolve("run").resolve(name)), name);
        }
        String summary = read(first.resolve("run").resolve(ArtifactWriter.SUMMARY_JSON));
        assertEquals("{\n  \"edges\": 2,\n  \"entities\": 4\n}\n", summary);
    }
}

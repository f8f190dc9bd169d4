package com.entity.network.bulk;

import com.entity.network.conflation.ConflationCheck;
import com.entity.network.conflation.ConflationReport;
import com.entity.network.conflation.EntitySummary;
import com.entity.network.conflation.PartialMatch;
import com.entity.network.conflation.ResidualDuplicate;
import com.entity.network.conflation.TypeConflict;
import com.entity.network.core.model.EntityKind;
import com.entity.network.core.model.EntityRecord;
import com.entity.network.graph.GraphNode;
import com.entity.network.graph.GraphStatistics;
import com.entity.network.graph.MergedGraph;
import com.entity.network.graph.RelationshipGraph;
import com.entity.network.graph.WeightedEdge;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Writes the run artifacts into an output directory. Output depends only on the data: rows are
 * sorted, JSON keys have a fixed order, no timestamps are written and lines end in {@code \n},
 * so identical inputs give byte-identical files.
 */
public class ArtifactWriter {
    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    public static final String ENTITIES_CSV = "entities.csv";
    public static final String CONFLATION_JSON = "conflation-report.json";
    public static final String CONFLATION_MARKDOWN = "conflation-report.md";
    public static final String GRAPH_NODES_CSV = "graph-nodes.csv";
    public static final String GRAPH_EDGES_CSV = "graph-edges.csv";
    public static final String GRAPH_JSON = "graph.json";
    public static final String SUMMARY_JSON = "summary.json";

    static final String LIST_SEPARATOR = "|";
    private static final int TOP_CONNECTED = 10;

    private static final Comparator<EntityRecord> ENTITY_ORDER = Comparator
            .comparing(EntityRecord::getKind)
            .thenComparing(EntityRecord::getNormalizedName)
            .thenComparing(EntityRecord::getIdentifier, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Path outputDirectory;
    private final ObjectMapper objectMapper;
    private final ObjectWriter jsonWriter;

    public ArtifactWriter(Path outputDirectory) {
        this(outputDirectory, createObjectMapper());
    }

    public ArtifactWriter(Path outputDirectory, ObjectMapper objectMapper) {
        this.outputDirectory = outputDirectory;
        this.objectMapper = objectMapper;
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER))
                .withObjectIndenter(new DefaultIndenter("  ", "\n"))
                .withArrayIndenter(new DefaultIndenter("  ", "\n"));
        this.jsonWriter = objectMapper.writer(printer);
    }

    /**
     * Mapper used for artifacts: snake_case property names, properties and map keys in sorted order.
     */
    public static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * {@code identifier,canonical_name,aliases,kind,mention_count,provenance}; aliases and
     * provenance are {@code |}-joined in sorted order.
     */
    public Path writeEntities(Collection<EntityRecord> records) {
        List<EntityRecord> ordered = new ArrayList<>(records);
        ordered.sort(ENTITY_ORDER);
        StringBuilder csv = new StringBuilder("identifier,canonical_name,aliases,kind,mention_count,provenance\n");
        for (EntityRecord record : ordered) {
            csv.append(CsvRecordParser.escape(record.getIdentifier())).append(',')
                    .append(CsvRecordParser.escape(record.getSurfaceName())).append(',')
                    .append(CsvRecordParser.escape(String.join(LIST_SEPARATOR, record.getAliases()))).append(',')
                    .append(record.getKind().getLabel()).append(',')
                    .append(record.getMentionCount()).append(',')
                    .append(CsvRecordParser.escape(String.join(LIST_SEPARATOR, record.getProvenance())))
                    .append('\n');
        }
        return write(ENTITIES_CSV, csv.toString(), ordered.size());
    }

    public Path writeConflationReport(ConflationReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode statistics = root.putObject("statistics");
        statistics.put("entities_checked", report.entitiesChecked());
        statistics.put(ConflationCheck.RESIDUAL_VARIATION.getLabel(), report.residualDuplicates().size());
        statistics.put(ConflationCheck.TYPE_CONFLICT.getLabel(), report.typeConflicts().size());
        statistics.put(ConflationCheck.PARTIAL_MATCH.getLabel(), report.partialMatches().size());
        statistics.put("cross_kind_partial_match", report.crossKindPartialMatches());
        ArrayNode checks = root.putArray("checks_run");
        for (ConflationCheck check : ConflationCheck.values()) {
            if (report.checksRun().contains(check)) {
                checks.add(check.getLabel());
            }
        }

        ArrayNode residual = root.putArray(ConflationCheck.RESIDUAL_VARIATION.getLabel());
        for (ResidualDuplicate duplicate : report.residualDuplicates()) {
            ObjectNode node = residual.addObject();
            node.put("severity", duplicate.severity().name());
            node.put("kind", duplicate.kind().getLabel());
            node.put("normalized_name", duplicate.normalizedName());
            ArrayNode variants = node.putArray("variants");
            duplicate.variants().forEach(v -> entityNode(variants.addObject(), v));
        }

        ArrayNode conflicts = root.putArray(ConflationCheck.TYPE_CONFLICT.getLabel());
        for (TypeConflict conflict : report.typeConflicts()) {
            ObjectNode node = conflicts.addObject();
            node.put("severity", conflict.severity().name());
            node.put("normalized_name", conflict.normalizedName());
            ArrayNode kinds = node.putArray("kinds");
            for (EntityKind kind : EntityKind.values()) {
                if (conflict.kinds().contains(kind)) {
                    kinds.add(kind.getLabel());
                }
            }
            ArrayNode entities = node.putArray("entities");
            conflict.entities().forEach(e -> entityNode(entities.addObject(), e));
        }

        ArrayNode partials = root.putArray(ConflationCheck.PARTIAL_MATCH.getLabel());
        for (PartialMatch match : report.partialMatches()) {
            ObjectNode node = partials.addObject();
            node.put("severity", match.severity().name());
            node.put("cross_kind", match.crossKind());
            entityNode(node.putObject("shorter"), match.shorter());
            entityNode(node.putObject("longer"), match.longer());
        }
        root.put("note", ConflationReport.ADVISORY_NOTE);
        return write(CONFLATION_JSON, toJson(root), report.totalFindings());
    }

    public Path writeConflationMarkdown(ConflationReport report) {
        StringBuilder md = new StringBuilder();
        md.append("# Entity Conflation Report\n\n");
        md.append("Entities checked: ").append(report.entitiesChecked()).append("\n\n");
        md.append("| Check | Severity | Findings |\n|---|---|---|\n");
        for (ConflationCheck check : ConflationCheck.values()) {
            String count = report.checksRun().contains(check) ? String.valueOf(countOf(report, check)) : "not run";
            md.append("| ").append(check.getLabel()).append(" | ").append(check.getSeverity())
                    .append(" | ").append(count).append(" |\n");
        }

        md.append("\n## Residual name variation\n\n");
        if (report.residualDuplicates().isEmpty()) {
            md.append("None.\n");
        }
        for (ResidualDuplicate duplicate : report.residualDuplicates()) {
            md.append("- **").append(duplicate.normalizedName()).append("** (").append(duplicate.kind().getLabel())
                    .append("): ");
            md.append(String.join(", ", duplicate.variants().stream().map(ArtifactWriter::describe).toList()))
                    .append('\n');
        }

        md.append("\n## Type conflicts\n\n");
        if (report.typeConflicts().isEmpty()) {
            md.append("None.\n");
        }
        for (TypeConflict conflict : report.typeConflicts()) {
            md.append("- **").append(conflict.normalizedName()).append("**: ");
            md.append(String.join(", ", conflict.entities().stream().map(ArtifactWriter::describe).toList()))
                    .append('\n');
        }

        md.append("\n## Partial matches\n\n");
        md.append("> ").append(ConflationReport.ADVISORY_NOTE).append("\n\n");
        if (report.partialMatches().isEmpty()) {
            md.append("None.\n");
        }
        for (PartialMatch match : report.partialMatches()) {
            md.append("- \"").append(match.shorterName()).append("\" in \"").append(match.longerName())
                    .append("\": ").append(describe(match.shorter())).append(" / ").append(describe(match.longer()))
                    .append('\n');
        }
        return write(CONFLATION_MARKDOWN, md.toString(), report.totalFindings());
    }

    public List<Path> writeGraph(MergedGraph graph) {
        return writeGraph(graph, RelationshipGraph.SOURCE_DOCUMENT);
    }

    /**
     * Writes {@code graph-nodes.csv}, {@code graph-edges.csv} and {@code graph.json}. Edge statistics
     * count an edge as document-only when {@code primarySource} is its only source.
     */
    public List<Path> writeGraph(MergedGraph graph, String primarySource) {
        StringBuilder nodes = new StringBuilder("identifier,label,kind,degree,mention_count,synthetic\n");
        for (GraphNode node : graph.nodes()) {
            nodes.append(CsvRecordParser.escape(node.identifier())).append(',')
                    .append(CsvRecordParser.escape(node.label())).append(',')
                    .append(node.kind() != null ? node.kind().getLabel() : "").append(',')
                    .append(node.degree()).append(',')
                    .append(node.mentionCount()).append(',')
                    .append(node.synthetic())
                    .append('\n');
        }
        StringBuilder edges = new StringBuilder("source,target,weight,sources\n");
        for (WeightedEdge edge : graph.edges()) {
            edges.append(edge.source()).append(',')
                    .append(edge.target()).append(',')
                    .append(edge.weight()).append(',')
                    .append(CsvRecordParser.escape(String.join(LIST_SEPARATOR, edge.sources())))
                    .append('\n');
        }
        List<Path> written = new ArrayList<>(3);
        written.add(write(GRAPH_NODES_CSV, nodes.toString(), graph.nodeCount()));
        written.add(write(GRAPH_EDGES_CSV, edges.toString(), graph.edgeCount()));
        written.add(write(GRAPH_JSON, toJson(graphNode(graph, primarySource)), graph.edgeCount()));
        return written;
    }

    /**
     * Serializes any value with the artifact mapper.
     */
    public Path writeJson(String fileName, Object value) {
        return write(fileName, toJson(objectMapper.valueToTree(value)), 1);
    }

    private ObjectNode graphNode(MergedGraph graph, String primarySource) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode nodes = root.putArray("nodes");
        for (GraphNode node : graph.nodes()) {
            ObjectNode n = nodes.addObject();
            n.put("id", node.identifier());
            n.put("name", node.label());
            if (node.kind() != null) {
                n.put("kind", node.kind().getLabel());
            } else {
                n.putNull("kind");
            }
            n.put("degree", node.degree());
            n.put("mention_count", node.mentionCount());
            n.put("synthetic", node.synthetic());
        }
        ArrayNode edges = root.putArray("edges");
        for (WeightedEdge edge : graph.edges()) {
            ObjectNode e = edges.addObject();
            e.put("source", edge.source());
            e.put("target", edge.target());
            e.put("weight", edge.weight());
            ObjectNode sources = e.putObject("sources");
            edge.sourceWeights().forEach(sources::put);
        }
        GraphStatistics stats = graph.statistics(TOP_CONNECTED, primarySource);
        ObjectNode statistics = root.putObject("statistics");
        statistics.put("total_nodes", stats.nodeCount());
        statistics.put("total_edges", stats.edgeCount());
        statistics.put("total_weight", stats.totalWeight());
        statistics.put("density", round(stats.density()));
        statistics.put("average_degree", round(stats.averageDegree()));
        statistics.put("document_only_edges", stats.primaryOnlyEdges());
        statistics.put("corroborated_edges", stats.corroboratedEdges());
        statistics.put("secondary_only_edges", stats.secondaryOnlyEdges());
        statistics.put("synthetic_nodes", stats.syntheticNodes());
        ArrayNode top = statistics.putArray("most_connected");
        for (GraphNode node : stats.topConnected()) {
            ObjectNode t = top.addObject();
            t.put("id", node.identifier());
            t.put("name", node.label());
            t.put("connections", node.degree());
        }
        return root;
    }

    private static void entityNode(ObjectNode node, EntitySummary entity) {
        node.put("identifier", entity.identifier());
        node.put("surface_name", entity.surfaceName());
        node.put("normalized_name", entity.normalizedName());
        node.put("kind", entity.kind().getLabel());
        node.put("mention_count", entity.mentionCount());
        node.put("document_count", entity.documentCount());
    }

    private static String describe(EntitySummary entity) {
        return entity.surfaceName() + " [" + entity.kind().getLabel() + ", " + entity.mentionCount()
                + " mentions, " + entity.identifier() + "]";
    }

    private static int countOf(ConflationReport report, ConflationCheck check) {
        return switch (check) {
            case RESIDUAL_VARIATION -> report.residualDuplicates().size();
            case TYPE_CONFLICT -> report.typeConflicts().size();
            case PARTIAL_MATCH -> report.partialMatches().size();
        };
    }

    // four decimals, as in the network statistics
    private static double round(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }

    private String toJson(Object tree) {
        try {
            return jsonWriter.writeValueAsString(tree) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize artifact", e);
        }
    }

    private Path write(String fileName, String content, long records) {
        Path target = outputDirectory.resolve(fileName);
        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write " + target, e);
        }
        log.debug("artifact.written file={} records={}", fileName, records);
        return target;
    }
}

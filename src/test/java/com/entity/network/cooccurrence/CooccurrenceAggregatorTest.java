package com.entity.network.cooccurrence;

import com.entity.network.core.model.EntityKind;
import com.entity.network.core.model.EntityRecord;
import com.entity.network.core.model.RawMention;
import com.entity.network.graph.RelationshipGraph;
import com.entity.network.identity.IdentityAssigner;
import com.entity.network.identity.IdentityMap;
import com.entity.network.metrics.MetricsService;
import com.entity.network.rules.DefaultNormalizationRules;
import com.entity.network.rules.NormalizationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CooccurrenceAggregatorTest {

    private final NormalizationEngine normalizer = DefaultNormalizationRules.createDefaultEngine();
    private final IdentityAssigner assigner = new IdentityAssigner();

    private IdentityMap identityMap;
    private String epstein;
    private String maxwell;
    private String palmBeach;

    @BeforeEach
    void setUp() {
        List<EntityRecord> records = List.of(
                canonical("Jeffrey Epstein", EntityKind.PERSON),
                canonical("Ghislaine Maxwell", EntityKind.PERSON),
                canonical("Palm Beach", EntityKind.LOCATION));
        identityMap = IdentityMap.from(records, normalizer);
        epstein = records.get(0).getIdentifier();
        maxwell = records.get(1).getIdentifier();
        palmBeach = records.get(2).getIdentifier();
    }

    private EntityRecord canonical(String surface, EntityKind kind) {
        String key = normalizer.normalize(surface);
        return EntityRecord.builder()
                .surfaceName(surface)
                .normalizedName(key)
                .kind(kind)
                .identifier(assigner.assign(key, kind))
                .mentionCount(1)
                .build();
    }

    private static DocumentMentions document(String id, String... surfaceAndKind) {
        List<RawMention> mentions = new ArrayList<>();
        for (int i = 0; i < surfaceAndKind.length; i += 2) {
            mentions.add(new RawMention(surfaceAndKind[i], surfaceAndKind[i + 1], id));
        }
        return new DocumentMentions(id, mentions);
    }

    private List<DocumentMentions> twoDocuments() {
        return List.of(
                document("DOJ-OGR-001",
                        "Jeffrey Epstein", "person",
                        "Ghislaine Maxwell", "person",
                        "Palm Beach", "location"),
                document("EMAIL-17",
                        "GHISLAINE MAXWELL", "person",
                        "Palm Beach", "location"));
    }

    @Nested
    @DisplayName("Weights")
    class WeightTests {

        @Test
        @DisplayName("Pairs gain one per shared document")
        void testWeights() {
            CooccurrenceGraph graph = new CooccurrenceAggregator(identityMap).aggregate(twoDocuments());

            assertEquals(1, graph.weight(epstein, maxwell));
            assertEquals(1, graph.weight(epstein, palmBeach));
            assertEquals(2, graph.weight(maxwell, palmBeach));
            assertEquals(3, graph.pairCount());
            assertEquals(2, graph.getDocumentsProcessed());
        }

        @Test
        @DisplayName("Weights are symmetric and zero for self pairs")
        void testSymmetry() {
            CooccurrenceGraph graph = new CooccurrenceAggregator(identityMap).aggregate(twoDocuments());
            assertEquals(graph.weight(maxwell, palmBeach), graph.weight(palmBeach, maxwell));
            assertEquals(0, graph.weight(maxwell, maxwell));
        }

        @Test
        @DisplayName("Repeated mentions inside one document count once")
        void testRepeatsInDocument() {
            CooccurrenceGraph graph = new CooccurrenceAggregator(identityMap).aggregate(List.of(
                    document("D1",
                            "Jeffrey Epstein", "person",
                            "Epstein", "person",
                            "Jeffrey Epstein", "person",
                            "Palm Beach", "location",
                            "Palm Beach", "location")));

            assertEquals(1, graph.weight(epstein, palmBeach));
            assertEquals(4, graph.getMentionsResolved());
            assertEquals(1, graph.getUnresolvedMentions());
        }

        @Test
        @DisplayName("Document types are counted per pair and overall")
        void testDocumentTypes() {
            CooccurrenceGraph graph = new CooccurrenceAggregator(identityMap).aggregate(twoDocuments());

            assertEquals(1L, graph.getDocumentTypeCounts().get("government_document"));
            assertEquals(1L, graph.getDocumentTypeCounts().get("email"));
            assertEquals(2, graph.documentTypes(maxwell, palmBeach).size());
            assertEquals(List.of("government_document"), List.copyOf(graph.documentTypes(epstein, maxwell).keySet()));
        }

        @Test
        @DisplayName("Converts to a document-sourced relationship graph")
        void testToRelationshipGraph() {
            CooccurrenceGraph graph = new CooccurrenceAggregator(identityMap).aggregate(twoDocuments());

            RelationshipGraph all = graph.toRelationshipGraph();
            assertEquals(RelationshipGraph.SOURCE_DOCUMENT, all.getSourceTag());
            assertEquals(3, all.edgeCount());

            RelationshipGraph strong = graph.toRelationshipGraph(RelationshipGraph.SOURCE_DOCUMENT, 2);
            assertEquals(1, strong.edgeCount());
            assertEquals(2, strong.weight(maxwell, palmBeach));
        }
    }

    @Nested
    @DisplayName("Unresolved and oversized documents")
    @ExtendWith(MockitoExtension.class)
    class EdgeCaseTests {

        @Mock
        private MetricsService metrics;

        @Test
        @DisplayName("Unresolved mentions are skipped and counted")
        void testUnresolved() {
            CooccurrenceAggregator aggregator = new CooccurrenceAggregator(identityMap,
                    DocumentTypeClassifier.defaults(), 100, 5000, metrics);

            CooccurrenceGraph graph = aggregator.aggregate(List.of(
                    document("D1",
                            "Jeffrey Epstein", "person",
                            "Bill Nobody", "person",
                            "Palm Beach", "vehicle")));

            assertEquals(0, graph.pairCount());
            assertEquals(1, graph.getMentionsResolved());
            assertEquals(2, graph.getUnresolvedMentions());
            verify(metrics, times(2)).incrementUnresolvedMention();
            verify(metrics).recordDocumentCardinality(1);
        }

        @Test
        @DisplayName("Documents above the cardinality threshold are flagged but still counted")
        void testHighCardinality() {
            CooccurrenceAggregator aggregator = new CooccurrenceAggregator(identityMap,
                    DocumentTypeClassifier.defaults(), 2, 5000, metrics);

            CooccurrenceGraph graph = aggregator.aggregate(twoDocuments());

            assertEquals(List.of("DOJ-OGR-001"), List.copyOf(graph.getHighCardinalityDocuments()));
            assertEquals(1, graph.weight(epstein, maxwell));
        }

        @Test
        @DisplayName("Rejects invalid thresholds")
        void testInvalidSettings() {
            DocumentTypeClassifier classifier = DocumentTypeClassifier.defaults();
            assertThrows(IllegalArgumentException.class,
                    () -> new CooccurrenceAggregator(identityMap, classifier, 1, 5000, metrics));
            assertThrows(IllegalArgumentException.class,
                    () -> new CooccurrenceAggregator(identityMap, classifier, 100, 0, metrics));
        }
    }

    @Nested
    @DisplayName("Partitioned folding")
    class PartitionTests {

        @Test
        @DisplayName("Partitioned aggregation equals the sequential fold")
        void testPartitionedEqualsSequential() {
            List<DocumentMentions> documents = new ArrayList<>(twoDocuments());
            documents.add(document("COURT-3", "Jeffrey Epstein", "person", "Ghislaine Maxwell", "person"));
            documents.add(document("X-4", "Palm Beach", "location", "Nobody", "person"));
            CooccurrenceAggregator aggregator = new CooccurrenceAggregator(identityMap);

            CooccurrenceGraph sequential = aggregator.aggregate(documents);
            CooccurrenceGraph partitioned = aggregator.aggregatePartitioned(List.of(
                    documents.subList(0, 1), documents.subList(1, 3), documents.subList(3, 4), List.of()));

            assertEquals(sequential.getWeights(), partitioned.getWeights());
            assertEquals(sequential.getDocumentTypeCounts(), partitioned.getDocumentTypeCounts());
            assertEquals(sequential.getDocumentsProcessed(), partitioned.getDocumentsProcessed());
            assertEquals(sequential.getMentionsResolved(), partitioned.getMentionsResolved());
            assertEquals(sequential.getUnresolvedMentions(), partitioned.getUnresolvedMentions());
            assertEquals(sequential.documentTypes(epstein, maxwell), partitioned.documentTypes(epstein, maxwell));
        }

        @Test
        @DisplayName("Combining accumulators is commutative and leaves inputs untouched")
        void testCombineCommutative() {
            CooccurrenceAggregator aggregator = new CooccurrenceAggregator(identityMap);
            List<DocumentMentions> documents = twoDocuments();
            CooccurrenceAccumulator left = aggregator.fold(documents.subList(0, 1), false);
            CooccurrenceAccumulator right = aggregator.fold(documents.subList(1, 2), false);

            CooccurrenceGraph ab = left.combine(right).toGraph();
            CooccurrenceGraph ba = right.combine(left).toGraph();

            assertEquals(ab.getWeights(), ba.getWeights());
            assertEquals(2, ab.getDocumentsProcessed());
            assertEquals(1, left.getDocumentsProcessed());
            assertEquals(1, right.getDocumentsProcessed());
        }
    }

    @Test
    @DisplayName("Groups a mention feed by document in first-seen order")
    void testGroupByDocument() {
        List<DocumentMentions> documents = DocumentMentions.groupByDocument(List.of(
                new RawMention("Jeffrey Epstein", "person", "D2"),
                new RawMention("Palm Beach", "location", "D1"),
                new RawMention("Ghislaine Maxwell", "person", " D2 "),
                new RawMention("Nobody", "person", "")));

        assertEquals(List.of("D2", "D1"), documents.stream().map(DocumentMentions::documentId).toList());
        assertEquals(2, documents.get(0).mentions().size());
    }
}

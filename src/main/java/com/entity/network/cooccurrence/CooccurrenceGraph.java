package com.entity.network.cooccurrence;

import com.entity.network.graph.EntityPair;
import com.entity.network.graph.RelationshipGraph;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Result of a co-occurrence fold: for each unordered identifier pair, the number of documents
 * mentioning both. Immutable.
 */
public final class CooccurrenceGraph {

    private final SortedMap<EntityPair, Long> weights;
    private final SortedMap<EntityPair, SortedMap<String, Long>> pairDocumentTypes;
    private final SortedMap<String, Long> documentTypes;
    private final long documentsProcessed;
    private final long mentionsResolved;
    private final long unresolvedMentions;
    private final SortedSet<String> highCardinalityDocuments;

    CooccurrenceGraph(Map<EntityPair, Long> weights,
                      Map<EntityPair, Map<String, Long>> pairDocumentTypes,
                      Map<String, Long> documentTypes,
                      long documentsProcessed,
                      long mentionsResolved,
                      long unresolvedMentions,
                      SortedSet<String> highCardinalityDocuments) {
        this.weights = Collections.unmodifiableSortedMap(new TreeMap<>(weights));
        SortedMap<EntityPair, SortedMap<String, Long>> types = new TreeMap<>();
        pairDocumentTypes.forEach((pair, byType) ->
                types.put(pair, Collections.unmodifiableSortedMap(new TreeMap<>(byType))));
        this.pairDocumentTypes = Collections.unmodifiableSortedMap(types);
        this.documentTypes = Collections.unmodifiableSortedMap(new TreeMap<>(documentTypes));
        this.documentsProcessed = documentsProcessed;
        this.mentionsResolved = mentionsResolved;
        this.unresolvedMentions = unresolvedMentions;
        this.highCardinalityDocuments = Collections.unmodifiableSortedSet(new TreeSet<>(highCardinalityDocuments));
    }

    /**
     * Co-occurrence count of two identifiers; symmetric, zero for unrelated or identical ids.
     */
    public long weight(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        return weights.getOrDefault(EntityPair.of(a, b), 0L);
    }

    public SortedMap<EntityPair, Long> getWeights() {
        return weights;
    }

    public int pairCount() {
        return weights.size();
    }

    /**
     * Document types contributing to a pair, with counts.
     */
    public SortedMap<String, Long> documentTypes(String a, String b) {
        SortedMap<String, Long> types = pairDocumentTypes.get(EntityPair.of(a, b));
        return types != null ? types : Collections.emptySortedMap();
    }

    /** Documents processed per document type. */
    public SortedMap<String, Long> getDocumentTypeCounts() {
        return documentTypes;
    }

    public long getDocumentsProcessed() {
        return documentsProcessed;
    }

    public long getMentionsResolved() {
        return mentionsResolved;
    }

    public long getUnresolvedMentions() {
        return unresolvedMentions;
    }

    public SortedSet<String> getHighCardinalityDocuments() {
        return highCardinalityDocuments;
    }

    /**
     * The pairs of at least {@code minWeight} documents as a single-source relationship graph.
     */
    public RelationshipGraph toRelationshipGraph(String sourceTag, long minWeight) {
        RelationshipGraph.Builder builder = RelationshipGraph.builder(sourceTag);
        weights.forEach((pair, weight) -> {
            if (weight >= minWeight) {
                builder.addWeight(pair, weight);
            }
        });
        return builder.build();
    }

    public RelationshipGraph toRelationshipGraph() {
        return toRelationshipGraph(RelationshipGraph.SOURCE_DOCUMENT, 1);
    }
}

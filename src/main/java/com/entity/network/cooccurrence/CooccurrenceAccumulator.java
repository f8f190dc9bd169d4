package com.entity.network.cooccurrence;

import com.entity.network.graph.EntityPair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Mutable partial state of a co-occurrence fold. Single writer per instance.
 *
 * <p>{@link #combine(CooccurrenceAccumulator)} is commutative and associative: counters and pair
 * weights add, flagged documents union. Partitions can therefore be folded independently and
 * combined in any order.</p>
 */
public class CooccurrenceAccumulator {

    private final Map<EntityPair, Long> weights = new HashMap<>();
    private final Map<EntityPair, Map<String, Long>> pairDocumentTypes = new HashMap<>();
    private final Map<String, Long> documentTypes = new HashMap<>();
    private final SortedSet<String> highCardinalityDocuments = new TreeSet<>();
    private long documentsProcessed;
    private long mentionsResolved;
    private long unresolvedMentions;

    /**
     * Records one document: every unordered pair of its distinct identifiers gains 1.
     */
    public void addDocument(String documentType, SortedSet<String> identifiers) {
        documentsProcessed++;
        documentTypes.merge(documentType, 1L, Long::sum);
        List<String> ids = new ArrayList<>(identifiers);
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                EntityPair pair = new EntityPair(ids.get(i), ids.get(j));
                weights.merge(pair, 1L, Long::sum);
                pairDocumentTypes.computeIfAbsent(pair, k -> new HashMap<>()).merge(documentType, 1L, Long::sum);
            }
        }
    }

    public void addResolvedMentions(long count) {
        mentionsResolved += count;
    }

    public void addUnresolvedMentions(long count) {
        unresolvedMentions += count;
    }

    public void flagHighCardinality(String documentId) {
        highCardinalityDocuments.add(documentId);
    }

    /**
     * A new accumulator holding the sum of this one and {@code other}. Neither input changes.
     */
    public CooccurrenceAccumulator combine(CooccurrenceAccumulator other) {
        CooccurrenceAccumulator result = new CooccurrenceAccumulator();
        result.absorb(this);
        result.absorb(other);
        return result;
    }

    private void absorb(CooccurrenceAccumulator other) {
        other.weights.forEach((pair, w) -> weights.merge(pair, w, Long::sum));
        other.pairDocumentTypes.forEach((pair, types) -> {
            Map<String, Long> target = pairDocumentTypes.computeIfAbsent(pair, k -> new HashMap<>());
            types.forEach((type, count) -> target.merge(type, count, Long::sum));
        });
        other.documentTypes.forEach((type, count) -> documentTypes.merge(type, count, Long::sum));
        highCardinalityDocuments.addAll(other.highCardinalityDocuments);
        documentsProcessed += other.documentsProcessed;
        mentionsResolved += other.mentionsResolved;
        unresolvedMentions += other.unresolvedMentions;
    }

    public long getDocumentsProcessed() {
        return documentsProcessed;
    }

    public CooccurrenceGraph toGraph() {
        return new CooccurrenceGraph(weights, pairDocumentTypes, documentTypes,
                documentsProcessed, mentionsResolved, unresolvedMentions,
                Collections.unmodifiableSortedSet(highCardinalityDocuments));
    }
}

package com.entity.network.cooccurrence;

import com.entity.network.core.model.RawMention;
import com.entity.network.identity.IdentityMap;
import com.entity.network.metrics.MetricsService;
import com.entity.network.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Builds the document co-occurrence graph: two entities are related once for every document that
 * mentions both. Mentions are resolved through the {@link IdentityMap}; unresolved mentions are
 * skipped and counted.
 *
 * <p>The fold is pure. {@link #aggregatePartitioned(List)} folds each partition on its own
 * accumulator in parallel and combines the partials.</p>
 */
public class CooccurrenceAggregator {
    private static final Logger log = LoggerFactory.getLogger(CooccurrenceAggregator.class);

    public static final int DEFAULT_HIGH_CARDINALITY_THRESHOLD = 100;
    public static final int DEFAULT_PROGRESS_INTERVAL = 5000;

    private final IdentityMap identityMap;
    private final DocumentTypeClassifier classifier;
    private final int highCardinalityThreshold;
    private final int progressInterval;
    private final MetricsService metrics;

    public CooccurrenceAggregator(IdentityMap identityMap) {
        this(identityMap, DocumentTypeClassifier.defaults(), DEFAULT_HIGH_CARDINALITY_THRESHOLD,
                DEFAULT_PROGRESS_INTERVAL, new NoOpMetricsService());
    }

    public CooccurrenceAggregator(IdentityMap identityMap,
                                  DocumentTypeClassifier classifier,
                                  int highCardinalityThreshold,
                                  int progressInterval,
                                  MetricsService metrics) {
        if (highCardinalityThreshold < 2) {
            throw new IllegalArgumentException("highCardinalityThreshold must be at least 2");
        }
        if (progressInterval < 1) {
            throw new IllegalArgumentException("progressInterval must be positive");
        }
        this.identityMap = identityMap;
        this.classifier = classifier;
        this.highCardinalityThreshold = highCardinalityThreshold;
        this.progressInterval = progressInterval;
        this.metrics = metrics;
    }

    public CooccurrenceGraph aggregate(Iterable<DocumentMentions> documents) {
        CooccurrenceAccumulator accumulator = fold(documents, true);
        CooccurrenceGraph graph = accumulator.toGraph();
        logCompleted(graph);
        return graph;
    }

    public CooccurrenceGraph aggregatePartitioned(List<List<DocumentMentions>> partitions) {
        CooccurrenceAccumulator combined = partitions.parallelStream()
                .map(partition -> fold(partition, false))
                .reduce(new CooccurrenceAccumulator(), CooccurrenceAccumulator::combine);
        CooccurrenceGraph graph = combined.toGraph();
        logCompleted(graph);
        return graph;
    }

    CooccurrenceAccumulator fold(Iterable<DocumentMentions> documents, boolean reportProgress) {
        CooccurrenceAccumulator accumulator = new CooccurrenceAccumulator();
        for (DocumentMentions document : documents) {
            accumulate(accumulator, document);
            if (reportProgress && accumulator.getDocumentsProcessed() % progressInterval == 0) {
                log.info("cooccurrence.progress documents={}", accumulator.getDocumentsProcessed());
            }
        }
        return accumulator;
    }

    private void accumulate(CooccurrenceAccumulator accumulator, DocumentMentions document) {
        SortedSet<String> identifiers = new TreeSet<>();
        long resolved = 0;
        long unresolved = 0;
        for (RawMention mention : document.mentions()) {
            Optional<String> id = identityMap.resolve(mention.surfaceName(), mention.kindLabel());
            if (id.isPresent()) {
                identifiers.add(id.get());
                resolved++;
            } else {
                unresolved++;
                metrics.incrementUnresolvedMention();
                log.trace("cooccurrence.unresolved documentId={} surfaceName='{}' kind='{}'",
                        document.documentId(), mention.surfaceName(), mention.kindLabel());
            }
        }
        if (identifiers.size() > highCardinalityThreshold) {
            accumulator.flagHighCardinality(document.documentId());
            log.warn("cooccurrence.high_cardinality documentId={} entities={} pairs={}",
                    document.documentId(), identifiers.size(),
                    (long) identifiers.size() * (identifiers.size() - 1) / 2);
        }
        metrics.recordDocumentCardinality(identifiers.size());
        accumulator.addResolvedMentions(resolved);
        accumulator.addUnresolvedMentions(unresolved);
        accumulator.addDocument(classifier.classify(document.documentId()), identifiers);
    }

    private void logCompleted(CooccurrenceGraph graph) {
        log.info("cooccurrence.completed documents={} pairs={} mentionsResolved={} unresolved={} highCardinality={}",
                graph.getDocumentsProcessed(), graph.pairCount(), graph.getMentionsResolved(),
                graph.getUnresolvedMentions(), graph.getHighCardinalityDocuments().size());
    }
}

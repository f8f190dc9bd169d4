package com.entity.network.graph;

import com.entity.network.core.model.EntityRecord;
import com.entity.network.identity.IdentityMap;
import com.entity.network.metrics.MetricsService;
import com.entity.network.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Unions relationship graphs from several sources into one {@link MergedGraph}.
 *
 * <p>Pairs are matched on canonical identifiers. An overlapping pair becomes one edge whose weight is
 * the sum of the source weights and whose {@code sourceWeights} name every contributor, so the merged
 * edge count never exceeds the sum of the input edge counts.</p>
 */
public class GraphMerger {
    private static final Logger log = LoggerFactory.getLogger(GraphMerger.class);

    private final IdentityMap identityMap;
    private final MetricsService metrics;

    public GraphMerger(IdentityMap identityMap) {
        this(identityMap, new NoOpMetricsService());
    }

    public GraphMerger(IdentityMap identityMap, MetricsService metrics) {
        this.identityMap = identityMap;
        this.metrics = metrics;
    }

    public MergedGraph merge(RelationshipGraph primary, RelationshipGraph secondary) {
        return merge(List.of(primary, secondary));
    }

    public MergedGraph merge(List<RelationshipGraph> graphs) {
        SortedMap<EntityPair, WeightedEdge> merged = new TreeMap<>();
        Map<String, String> syntheticLabels = new TreeMap<>();
        long inputEdges = 0;

        for (RelationshipGraph graph : graphs) {
            inputEdges += graph.edgeCount();
            metrics.recordEdgeCount(graph.getSourceTag(), graph.edgeCount());
            for (WeightedEdge edge : graph.edges()) {
                merged.merge(edge.pair(), edge, WeightedEdge::plus);
            }
            graph.getLabels().forEach(syntheticLabels::putIfAbsent);
        }

        MergedGraph result = MergedGraph.of(new ArrayList<>(merged.values()),
                id -> template(id, syntheticLabels));
        metrics.recordEdgeCount("merged", result.edgeCount());
        log.info("graph.merged sources={} inputEdges={} edges={} nodes={} overlapping={}",
                graphs.size(), inputEdges, result.edgeCount(), result.nodeCount(), inputEdges - result.edgeCount());
        return result;
    }

    private GraphNode template(String identifier, Map<String, String> syntheticLabels) {
        Optional<EntityRecord> record = identityMap.record(identifier);
        if (record.isPresent()) {
            EntityRecord r = record.get();
            return new GraphNode(identifier, r.getSurfaceName(), r.getKind(), 0, r.getMentionCount(), false);
        }
        return new GraphNode(identifier, syntheticLabels.getOrDefault(identifier, identifier), null, 0, 0, true);
    }
}

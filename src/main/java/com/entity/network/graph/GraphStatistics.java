package com.entity.network.graph;

import java.util.List;

/**
 * Summary figures of a merged network.
 *
 * @param density          edges over possible edges, {@code E / (N(N-1)/2)}
 * @param primaryOnlyEdges edges contributed only by the primary source
 * @param corroboratedEdges edges contributed by the primary source and at least one other
 * @param secondaryOnlyEdges edges without any primary contribution
 */
public record GraphStatistics(
        int nodeCount,
        int edgeCount,
        long totalWeight,
        double density,
        double averageDegree,
        int primaryOnlyEdges,
        int corroboratedEdges,
        int secondaryOnlyEdges,
        int syntheticNodes,
        List<GraphNode> topConnected
) {
    public GraphStatistics {
        topConnected = List.copyOf(topConnected);
    }
}

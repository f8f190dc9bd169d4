package com.entity.network.graph;

import java.util.List;

/**
 * A path through the merged network: node identifiers from start to end and the edges between them.
 */
public record GraphPath(List<String> nodes, List<WeightedEdge> edges) {

    public GraphPath {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public int distance() {
        return edges.size();
    }
}

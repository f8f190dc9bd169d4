package com.entity.network.graph;

import com.entity.network.core.model.EntityKind;

/**
 * A node of the merged network. {@code kind} is {@code null} and {@code mentionCount} zero
 * for synthetic nodes that exist only in an external source.
 */
public record GraphNode(
        String identifier,
        String label,
        EntityKind kind,
        int degree,
        long mentionCount,
        boolean synthetic
) {
    GraphNode withDegree(int newDegree) {
        return new GraphNode(identifier, label, kind, newDegree, mentionCount, synthetic);
    }
}

package com.entity.network.graph;

/**
 * A name-keyed edge from an external relationship source, before identifier resolution.
 */
public record SecondaryEdge(String sourceName, String targetName, long weight) {
}

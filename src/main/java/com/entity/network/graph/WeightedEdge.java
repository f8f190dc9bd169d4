package com.entity.network.graph;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * An undirected weighted edge. The weight is the sum of the per-source contributions.
 */
public record WeightedEdge(EntityPair pair, long weight, SortedMap<String, Long> sourceWeights) {

    public WeightedEdge {
        Objects.requireNonNull(pair, "pair is required");
        if (sourceWeights == null || sourceWeights.isEmpty()) {
            throw new IllegalArgumentException("an edge needs at least one source");
        }
        long total = 0;
        for (long w : sourceWeights.values()) {
            total += w;
        }
        if (total != weight) {
            throw new IllegalArgumentException("weight " + weight + " does not match source total " + total);
        }
        sourceWeights = Collections.unmodifiableSortedMap(new TreeMap<>(sourceWeights));
    }

    public static WeightedEdge of(EntityPair pair, String source, long weight) {
        SortedMap<String, Long> sources = new TreeMap<>();
        sources.put(source, weight);
        return new WeightedEdge(pair, weight, sources);
    }

    public SortedSet<String> sources() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(sourceWeights.keySet()));
    }

    public long weightFrom(String source) {
        return sourceWeights.getOrDefault(source, 0L);
    }

    public String source() {
        return pair.first();
    }

    public String target() {
        return pair.second();
    }

    /**
     * Adds another edge over the same pair, summing weights per source.
     */
    public WeightedEdge plus(WeightedEdge other) {
        if (!pair.equals(other.pair)) {
            throw new IllegalArgumentException("cannot combine edges over " + pair + " and " + other.pair);
        }
        SortedMap<String, Long> combined = new TreeMap<>(sourceWeights);
        for (Map.Entry<String, Long> entry : other.sourceWeights.entrySet()) {
            combined.merge(entry.getKey(), entry.getValue(), Long::sum);
        }
        return new WeightedEdge(pair, weight + other.weight, combined);
    }
}

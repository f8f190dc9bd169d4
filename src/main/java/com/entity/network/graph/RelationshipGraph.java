package com.entity.network.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A weighted graph from a single source, keyed by canonical identifier pairs.
 * Optionally carries display labels for identifiers the entity table does not know
 * (synthetic nodes of an external source).
 */
public final class RelationshipGraph {

    public static final String SOURCE_DOCUMENT = "document";
    public static final String SOURCE_MANIFEST = "manifest";

    private final String sourceTag;
    private final SortedMap<EntityPair, Long> weights;
    private final SortedMap<String, String> labels;

    private RelationshipGraph(Builder builder) {
        this.sourceTag = builder.sourceTag;
        this.weights = Collections.unmodifiableSortedMap(new TreeMap<>(builder.weights));
        this.labels = Collections.unmodifiableSortedMap(new TreeMap<>(builder.labels));
    }

    public String getSourceTag() {
        return sourceTag;
    }

    public SortedMap<EntityPair, Long> getWeights() {
        return weights;
    }

    public long weight(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        return weights.getOrDefault(EntityPair.of(a, b), 0L);
    }

    public int edgeCount() {
        return weights.size();
    }

    public SortedMap<String, String> getLabels() {
        return labels;
    }

    public List<WeightedEdge> edges() {
        List<WeightedEdge> edges = new ArrayList<>(weights.size());
        weights.forEach((pair, weight) -> edges.add(WeightedEdge.of(pair, sourceTag, weight)));
        return edges;
    }

    @Override
    public String toString() {
        return "RelationshipGraph{source=" + sourceTag + ", edges=" + weights.size() + '}';
    }

    public static Builder builder(String sourceTag) {
        return new Builder(sourceTag);
    }

    public static class Builder {
        private final String sourceTag;
        private final Map<EntityPair, Long> weights = new TreeMap<>();
        private final Map<String, String> labels = new TreeMap<>();

        private Builder(String sourceTag) {
            Objects.requireNonNull(sourceTag, "sourceTag is required");
            if (sourceTag.isBlank()) {
                throw new IllegalArgumentException("sourceTag cannot be blank");
            }
            this.sourceTag = sourceTag;
        }

        /**
         * Adds weight to a pair; repeated pairs accumulate.
         */
        public Builder addWeight(EntityPair pair, long weight) {
            if (weight <= 0) {
                throw new IllegalArgumentException("weight must be positive: " + weight);
            }
            weights.merge(pair, weight, Long::sum);
            return this;
        }

        public Builder addWeight(String a, String b, long weight) {
            return addWeight(EntityPair.of(a, b), weight);
        }

        public Builder label(String identifier, String label) {
            labels.put(identifier, label);
            return this;
        }

        public RelationshipGraph build() {
            return new RelationshipGraph(this);
        }
    }
}

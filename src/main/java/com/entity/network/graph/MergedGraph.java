package com.entity.network.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * The merged weighted network. Each undirected pair is stored once in canonical order and mirrored
 * in a bidirectional adjacency index, so lookups work from either endpoint.
 *
 * <p>Nodes are the endpoints of at least one edge; isolated entities are not part of the network.</p>
 */
public final class MergedGraph {

    private static final Comparator<GraphNode> MOST_CONNECTED = Comparator
            .comparingInt(GraphNode::degree).reversed()
            .thenComparing(Comparator.comparingLong(GraphNode::mentionCount).reversed())
            .thenComparing(GraphNode::identifier);

    private final SortedMap<EntityPair, WeightedEdge> edges;
    private final Map<String, SortedSet<String>> adjacency;
    private final SortedMap<String, GraphNode> nodes;

    private MergedGraph(SortedMap<EntityPair, WeightedEdge> edges, Function<String, GraphNode> nodeTemplate) {
        this.edges = Collections.unmodifiableSortedMap(edges);
        Map<String, SortedSet<String>> index = new HashMap<>();
        for (EntityPair pair : edges.keySet()) {
            index.computeIfAbsent(pair.first(), k -> new TreeSet<>()).add(pair.second());
            index.computeIfAbsent(pair.second(), k -> new TreeSet<>()).add(pair.first());
        }
        SortedMap<String, GraphNode> nodeMap = new TreeMap<>();
        index.forEach((id, neighbours) -> nodeMap.put(id, nodeTemplate.apply(id).withDegree(neighbours.size())));
        index.replaceAll((id, neighbours) -> Collections.unmodifiableSortedSet(neighbours));
        this.adjacency = index;
        this.nodes = Collections.unmodifiableSortedMap(nodeMap);
    }

    /**
     * @param edges        merged edges, at most one per pair
     * @param nodeTemplate node details by identifier; the degree is computed here
     */
    static MergedGraph of(Collection<WeightedEdge> edges, Function<String, GraphNode> nodeTemplate) {
        SortedMap<EntityPair, WeightedEdge> byPair = new TreeMap<>();
        for (WeightedEdge edge : edges) {
            if (byPair.putIfAbsent(edge.pair(), edge) != null) {
                throw new IllegalArgumentException("duplicate edge for " + edge.pair());
            }
        }
        return new MergedGraph(byPair, nodeTemplate);
    }

    public Optional<WeightedEdge> edge(String a, String b) {
        if (a == null || b == null || a.equals(b)) {
            return Optional.empty();
        }
        return Optional.ofNullable(edges.get(EntityPair.of(a, b)));
    }

    public long weight(String a, String b) {
        return edge(a, b).map(WeightedEdge::weight).orElse(0L);
    }

    /**
     * Neighbours of a node in identifier order; empty when the node is not in the network.
     */
    public SortedSet<String> neighbors(String identifier) {
        SortedSet<String> result = adjacency.get(identifier);
        return result != null ? result : Collections.emptySortedSet();
    }

    public Optional<GraphNode> node(String identifier) {
        return Optional.ofNullable(nodes.get(identifier));
    }

    public boolean containsNode(String identifier) {
        return nodes.containsKey(identifier);
    }

    /** Nodes in identifier order. */
    public List<GraphNode> nodes() {
        return new ArrayList<>(nodes.values());
    }

    /** Edges in canonical pair order. */
    public List<WeightedEdge> edges() {
        return new ArrayList<>(edges.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public long totalWeight() {
        long total = 0;
        for (WeightedEdge edge : edges.values()) {
            total += edge.weight();
        }
        return total;
    }

    public GraphStatistics statistics(int topN) {
        return statistics(topN, RelationshipGraph.SOURCE_DOCUMENT);
    }

    /**
     * Network statistics, classifying edges against {@code primarySource}.
     */
    public GraphStatistics statistics(int topN, String primarySource) {
        if (topN < 0) {
            throw new IllegalArgumentException("topN cannot be negative");
        }
        int n = nodes.size();
        int e = edges.size();
        double possible = n > 1 ? n * (n - 1L) / 2.0 : 0;
        double density = possible > 0 ? e / possible : 0;
        double averageDegree = n > 0 ? 2.0 * e / n : 0;

        int primaryOnly = 0;
        int corroborated = 0;
        int secondaryOnly = 0;
        for (WeightedEdge edge : edges.values()) {
            boolean fromPrimary = edge.sourceWeights().containsKey(primarySource);
            if (!fromPrimary) {
                secondaryOnly++;
            } else if (edge.sourceWeights().size() > 1) {
                corroborated++;
            } else {
                primaryOnly++;
            }
        }
        int synthetic = (int) nodes.values().stream().filter(GraphNode::synthetic).count();

        List<GraphNode> ranked = new ArrayList<>(nodes.values());
        ranked.sort(MOST_CONNECTED);
        List<GraphNode> top = ranked.subList(0, Math.min(topN, ranked.size()));

        return new GraphStatistics(n, e, totalWeight(), density, averageDegree,
                primaryOnly, corroborated, secondaryOnly, synthetic, top);
    }

    /**
     * Breadth-first shortest path by hop count. Neighbours are visited in identifier order,
     * so the same graph always yields the same path.
     */
    public Optional<GraphPath> shortestPath(String from, String to) {
        if (!nodes.containsKey(from) || !nodes.containsKey(to)) {
            return Optional.empty();
        }
        if (from.equals(to)) {
            return Optional.of(new GraphPath(List.of(from), List.of()));
        }
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        parent.put(from, from);
        queue.add(from);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : neighbors(current)) {
                if (parent.containsKey(next)) {
                    continue;
                }
                parent.put(next, current);
                if (next.equals(to)) {
                    return Optional.of(buildPath(parent, from, to));
                }
                queue.add(next);
            }
        }
        return Optional.empty();
    }

    private GraphPath buildPath(Map<String, String> parent, String from, String to) {
        List<String> path = new ArrayList<>();
        for (String step = to; !step.equals(from); step = parent.get(step)) {
            path.add(step);
        }
        path.add(from);
        Collections.reverse(path);
        List<WeightedEdge> pathEdges = new ArrayList<>(path.size() - 1);
        for (int i = 0; i + 1 < path.size(); i++) {
            pathEdges.add(edges.get(EntityPair.of(path.get(i), path.get(i + 1))));
        }
        return new GraphPath(path, pathEdges);
    }

    /**
     * The neighbourhood of {@code center}: nodes within {@code maxHops} over edges of at least
     * {@code minWeight}, and every such edge between them. Degrees are recomputed for the subgraph.
     * Empty when the center is not in the network.
     */
    public MergedGraph subgraph(String center, int maxHops, long minWeight) {
        if (maxHops < 0) {
            throw new IllegalArgumentException("maxHops cannot be negative");
        }
        if (!nodes.containsKey(center)) {
            return new MergedGraph(new TreeMap<>(), nodes::get);
        }
        Map<String, Integer> distance = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        distance.put(center, 0);
        queue.add(center);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int hops = distance.get(current);
            if (hops >= maxHops) {
                continue;
            }
            for (String next : neighbors(current)) {
                if (!distance.containsKey(next) && weight(current, next) >= minWeight) {
                    distance.put(next, hops + 1);
                    queue.add(next);
                }
            }
        }
        SortedMap<EntityPair, WeightedEdge> kept = new TreeMap<>();
        edges.forEach((pair, edge) -> {
            if (edge.weight() >= minWeight && distance.containsKey(pair.first())
                    && distance.containsKey(pair.second())) {
                kept.put(pair, edge);
            }
        });
        return new MergedGraph(kept, nodes::get);
    }

    @Override
    public String toString() {
        return "MergedGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + '}';
    }
}

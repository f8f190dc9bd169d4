package com.entity.network.graph;

import com.entity.network.core.model.IngestIssue;
import com.entity.network.identity.IdentityAssigner;
import com.entity.network.identity.IdentityMap;
import com.entity.network.metrics.MetricsService;
import com.entity.network.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Maps the name-keyed edges of an external relationship source onto canonical identifiers.
 *
 * <p>Names are resolved through the {@link IdentityMap} without a kind. A name that matches no
 * canonical entity keeps its edges under a synthetic identifier from
 * {@link IdentityAssigner#assignFallback(String)} and is reported once as an unresolved reference.
 * Blank names and non-positive weights skip the edge; so does an edge whose endpoints resolve to
 * the same entity.</p>
 */
public class SecondaryGraphResolver {
    private static final Logger log = LoggerFactory.getLogger(SecondaryGraphResolver.class);

    private final IdentityMap identityMap;
    private final IdentityAssigner assigner;
    private final MetricsService metrics;

    public SecondaryGraphResolver(IdentityMap identityMap, IdentityAssigner assigner) {
        this(identityMap, assigner, new NoOpMetricsService());
    }

    public SecondaryGraphResolver(IdentityMap identityMap, IdentityAssigner assigner, MetricsService metrics) {
        this.identityMap = identityMap;
        this.assigner = assigner;
        this.metrics = metrics;
    }

    public Result resolve(String sourceTag, Iterable<SecondaryEdge> secondaryEdges) {
        RelationshipGraph.Builder graph = RelationshipGraph.builder(sourceTag);
        List<IngestIssue> issues = new ArrayList<>();
        Map<String, String> fallbackLabels = new TreeMap<>();
        SortedSet<String> unresolvedNames = new TreeSet<>();
        int edgesRead = 0;
        int selfLoops = 0;
        int skipped = 0;

        for (SecondaryEdge edge : secondaryEdges) {
            edgesRead++;
            String location = sourceTag + "#" + edgesRead;
            if (edge.weight() <= 0) {
                issues.add(IngestIssue.malformed(location, String.valueOf(edge.weight()), "weight must be positive"));
                metrics.incrementMalformedRecord("weight");
                skipped++;
                continue;
            }
            Optional<String> source = endpoint(edge.sourceName(), location, issues, fallbackLabels, unresolvedNames);
            Optional<String> target = endpoint(edge.targetName(), location, issues, fallbackLabels, unresolvedNames);
            if (source.isEmpty() || target.isEmpty()) {
                skipped++;
                continue;
            }
            if (source.get().equals(target.get())) {
                selfLoops++;
                log.debug("secondary.self_loop source='{}' target='{}' identifier={}",
                        edge.sourceName(), edge.targetName(), source.get());
                continue;
            }
            graph.addWeight(source.get(), target.get(), edge.weight());
        }

        fallbackLabels.forEach(graph::label);
        RelationshipGraph built = graph.build();
        log.info("secondary.resolved source={} edgesRead={} edges={} unresolvedNames={} selfLoops={} skipped={}",
                sourceTag, edgesRead, built.edgeCount(), unresolvedNames.size(), selfLoops, skipped);
        return new Result(built, edgesRead, selfLoops, skipped, unresolvedNames, issues);
    }

    private Optional<String> endpoint(String name,
                                      String location,
                                      List<IngestIssue> issues,
                                      Map<String, String> fallbackLabels,
                                      SortedSet<String> unresolvedNames) {
        String normalized = identityMap.normalize(name);
        if (normalized.isEmpty()) {
            issues.add(IngestIssue.malformed(location, name, "relationship endpoint name is empty"));
            metrics.incrementMalformedRecord("empty-name");
            return Optional.empty();
        }
        Optional<String> resolved = identityMap.resolveAnyKind(name);
        if (resolved.isPresent()) {
            return resolved;
        }
        String fallback = assigner.assignFallback(normalized);
        if (unresolvedNames.add(normalized)) {
            fallbackLabels.put(fallback, name.trim());
            issues.add(IngestIssue.unresolved(location, name,
                    "no canonical entity; using synthetic identifier " + fallback));
            metrics.incrementUnresolvedSecondaryName();
            log.debug("secondary.unresolved name='{}' fallback={}", name, fallback);
        }
        return Optional.of(fallback);
    }

    /**
     * @param graph           resolved edges, repeated pairs summed
     * @param edgesRead       edges handed to the resolver
     * @param selfLoops       edges dropped because both ends resolved to one entity
     * @param skipped         edges dropped as malformed
     * @param unresolvedNames normalized names that received a synthetic identifier
     * @param issues          malformed and unresolved-reference issues
     */
    public record Result(
            RelationshipGraph graph,
            int edgesRead,
            int selfLoops,
            int skipped,
            SortedSet<String> unresolvedNames,
            List<IngestIssue> issues
    ) {
        public Result {
            unresolvedNames = new TreeSet<>(unresolvedNames);
            issues = List.copyOf(issues);
        }
    }
}

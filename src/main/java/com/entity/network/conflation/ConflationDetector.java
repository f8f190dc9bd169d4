package com.entity.network.conflation;

import com.entity.network.core.model.EntityKind;
import com.entity.network.core.model.EntityRecord;
import com.entity.network.metrics.MetricsService;
import com.entity.network.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only audit of the canonical entity set for signs that two records may refer to the
 * same real-world entity. Three independent checks, selectable per run:
 * <ul>
 *   <li>residual variation: same kind, same normalized name (a deduplication defect)</li>
 *   <li>type conflict: same normalized name under several kinds</li>
 *   <li>partial match: one normalized name contained, token-aligned, in a longer one</li>
 * </ul>
 * Nothing is merged or modified.
 */
public class ConflationDetector {
    private static final Logger log = LoggerFactory.getLogger(ConflationDetector.class);

    public static final int DEFAULT_MIN_PARTIAL_MATCH_LENGTH = 3;

    private static final Comparator<EntityRecord> RECORD_ORDER = Comparator
            .comparing(EntityRecord::getNormalizedName)
            .thenComparing(EntityRecord::getKind)
            .thenComparing(r -> r.getIdentifier() == null ? "" : r.getIdentifier())
            .thenComparing(EntityRecord::getSurfaceName);

    private final Set<ConflationCheck> checks;
    private final int minPartialMatchLength;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final MetricsService metrics;

    public ConflationDetector() {
        this(EnumSet.allOf(ConflationCheck.class), DEFAULT_MIN_PARTIAL_MATCH_LENGTH,
                new TokenBlockingKeyStrategy(), new NoOpMetricsService());
    }

    public ConflationDetector(Set<ConflationCheck> checks, int minPartialMatchLength, MetricsService metrics) {
        this(checks, minPartialMatchLength, new TokenBlockingKeyStrategy(), metrics);
    }

    public ConflationDetector(Set<ConflationCheck> checks,
                              int minPartialMatchLength,
                              BlockingKeyStrategy blockingKeyStrategy,
                              MetricsService metrics) {
        if (minPartialMatchLength < 1) {
            throw new IllegalArgumentException("minPartialMatchLength must be positive");
        }
        this.checks = checks.isEmpty() ? EnumSet.noneOf(ConflationCheck.class) : EnumSet.copyOf(checks);
        this.minPartialMatchLength = minPartialMatchLength;
        this.blockingKeyStrategy = blockingKeyStrategy;
        this.metrics = metrics;
    }

    public Set<ConflationCheck> getChecks() {
        return Set.copyOf(checks);
    }

    public ConflationReport detect(Collection<EntityRecord> records) {
        List<EntityRecord> ordered = new ArrayList<>(records);
        ordered.sort(RECORD_ORDER);

        List<ResidualDuplicate> residual = checks.contains(ConflationCheck.RESIDUAL_VARIATION)
                ? findResidualDuplicates(ordered) : List.of();
        List<TypeConflict> conflicts = checks.contains(ConflationCheck.TYPE_CONFLICT)
                ? findTypeConflicts(ordered) : List.of();
        List<PartialMatch> partials = checks.contains(ConflationCheck.PARTIAL_MATCH)
                ? findPartialMatches(ordered) : List.of();

        record(ConflationCheck.RESIDUAL_VARIATION, residual.size());
        record(ConflationCheck.TYPE_CONFLICT, conflicts.size());
        record(ConflationCheck.PARTIAL_MATCH, partials.size());

        if (!residual.isEmpty()) {
            log.error("conflation.residual_duplicates count={}", residual.size());
        }
        log.info("conflation.completed entities={} residual={} typeConflicts={} partialMatches={}",
                ordered.size(), residual.size(), conflicts.size(), partials.size());
        return new ConflationReport(ordered.size(), checks, residual, conflicts, partials);
    }

    private void record(ConflationCheck check, int count) {
        if (checks.contains(check)) {
            metrics.recordConflationFindings(check.getLabel(), count);
        }
    }

    List<ResidualDuplicate> findResidualDuplicates(List<EntityRecord> ordered) {
        Map<EntityKind, Map<String, List<EntityRecord>>> byKind = new TreeMap<>();
        for (EntityRecord record : ordered) {
            byKind.computeIfAbsent(record.getKind(), k -> new TreeMap<>())
                    .computeIfAbsent(record.getNormalizedName(), k -> new ArrayList<>())
                    .add(record);
        }
        List<ResidualDuplicate> result = new ArrayList<>();
        byKind.forEach((kind, byName) -> byName.forEach((name, group) -> {
            if (group.size() > 1) {
                result.add(new ResidualDuplicate(kind, name, summaries(group)));
            }
        }));
        return result;
    }

    List<TypeConflict> findTypeConflicts(List<EntityRecord> ordered) {
        Map<String, List<EntityRecord>> byName = new TreeMap<>();
        for (EntityRecord record : ordered) {
            byName.computeIfAbsent(record.getNormalizedName(), k -> new ArrayList<>()).add(record);
        }
        List<TypeConflict> result = new ArrayList<>();
        byName.forEach((name, group) -> {
            SortedSet<EntityKind> kinds = new TreeSet<>();
            group.forEach(r -> kinds.add(r.getKind()));
            if (kinds.size() > 1) {
                result.add(new TypeConflict(name, kinds, summaries(group)));
            }
        });
        return result;
    }

    List<PartialMatch> findPartialMatches(List<EntityRecord> ordered) {
        CandidateIndex index = new CandidateIndex(blockingKeyStrategy, ordered);
        List<PartialMatch> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (EntityRecord shorter : ordered) {
            String name = shorter.getNormalizedName();
            if (name.length() < minPartialMatchLength) {
                continue;
            }
            for (EntityRecord longer : index.candidates(name)) {
                String longerName = longer.getNormalizedName();
                if (longerName.length() <= name.length() || !containsAsTokens(longerName, name)) {
                    continue;
                }
                if (seen.add(pairKey(shorter, longer))) {
                    result.add(new PartialMatch(EntitySummary.of(shorter), EntitySummary.of(longer)));
                }
            }
        }
        result.sort(Comparator
                .comparing(PartialMatch::shorterName)
                .thenComparing(PartialMatch::longerName)
                .thenComparing(p -> p.shorter().kind())
                .thenComparing(p -> p.longer().kind()));
        log.debug("conflation.partial_match buckets={} matches={}", index.bucketCount(), result.size());
        return result;
    }

    /**
     * True when {@code needle} occurs in {@code haystack} bounded by whitespace or the string ends.
     */
    static boolean containsAsTokens(String haystack, String needle) {
        return (" " + haystack + " ").contains(" " + needle + " ");
    }

    private static String pairKey(EntityRecord shorter, EntityRecord longer) {
        return shorter.getKind() + "|" + shorter.getNormalizedName() + "|" + shorter.getIdentifier()
                + "->" + longer.getKind() + "|" + longer.getNormalizedName() + "|" + longer.getIdentifier();
    }

    private static List<EntitySummary> summaries(List<EntityRecord> group) {
        List<EntitySummary> result = new ArrayList<>(group.size());
        group.forEach(r -> result.add(EntitySummary.of(r)));
        return result;
    }
}

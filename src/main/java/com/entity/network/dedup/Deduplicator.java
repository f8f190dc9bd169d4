package com.entity.network.dedup;

import com.entity.network.core.model.EntityKind;
import com.entity.network.core.model.EntityRecord;
import com.entity.network.core.model.IngestIssue;
import com.entity.network.identity.IdentityAssigner;
import com.entity.network.metrics.MetricsService;
import com.entity.network.metrics.NoOpMetricsService;
import com.entity.network.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Collapses raw entity records that differ only superficially (case, spacing, punctuation) into one
 * canonical record per (kind, normalized name).
 *
 * <p>For each group the canonical surface form comes from the {@link CanonicalFormSelector};
 * provenance is the set union of the group's documents, mention counts are summed over the distinct
 * raw records, and every other spelling is kept as an alias. Running the pass on its own output
 * performs no further merges.</p>
 */
public class Deduplicator {
    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    private final NormalizationEngine normalizer;
    private final IdentityAssigner assigner;
    private final CanonicalFormSelector selector;
    private final MetricsService metrics;

    public Deduplicator(NormalizationEngine normalizer, IdentityAssigner assigner) {
        this(normalizer, assigner, CanonicalFormSelector.defaultSelector(), new NoOpMetricsService());
    }

    public Deduplicator(NormalizationEngine normalizer,
                        IdentityAssigner assigner,
                        CanonicalFormSelector selector,
                        MetricsService metrics) {
        this.normalizer = normalizer;
        this.assigner = assigner;
        this.selector = selector;
        this.metrics = metrics;
    }

    /**
     * Deduplicates the records of a single kind.
     *
     * @throws IllegalArgumentException if a record of another kind is present
     */
    public DedupResult deduplicate(EntityKind kind, Collection<EntityRecord> records) {
        for (EntityRecord record : records) {
            if (record.getKind() != kind) {
                throw new IllegalArgumentException("expected only " + kind + " records but found "
                        + record.getKind() + " '" + record.getSurfaceName() + "'");
            }
        }
        return deduplicate(records);
    }

    /**
     * Deduplicates records of any kinds; groups never span kinds.
     */
    public DedupResult deduplicate(Collection<EntityRecord> records) {
        List<IngestIssue> issues = new ArrayList<>();
        SortedMap<GroupKey, Set<EntityRecord>> groups = new TreeMap<>();
        int repeated = 0;

        for (EntityRecord record : records) {
            String key = normalizer.normalize(record.getSurfaceName());
            if (key.isEmpty()) {
                issues.add(IngestIssue.malformed(record.getKind().getLabel(), record.getSurfaceName(),
                        "surface name normalizes to an empty key"));
                metrics.incrementMalformedRecord("empty-name");
                log.warn("dedup.rejected kind={} surfaceName='{}' reason=empty-key",
                        record.getKind(), record.getSurfaceName());
                continue;
            }
            Set<EntityRecord> group = groups.computeIfAbsent(
                    new GroupKey(record.getKind(), key), k -> new LinkedHashSet<>());
            if (!group.add(record)) {
                repeated++;
            }
        }

        List<EntityRecord> output = new ArrayList<>(groups.size());
        Map<EntityKind, int[]> perKind = new EnumMap<>(EntityKind.class);
        int mergedGroups = 0;
        int singletonGroups = 0;
        int absorbed = 0;

        for (Map.Entry<GroupKey, Set<EntityRecord>> entry : groups.entrySet()) {
            GroupKey key = entry.getKey();
            Set<EntityRecord> group = entry.getValue();
            int[] counts = perKind.computeIfAbsent(key.kind(), k -> new int[2]);
            counts[0] += group.size();
            counts[1]++;

            if (group.size() == 1) {
                singletonGroups++;
                EntityRecord only = group.iterator().next();
                output.add(passThrough(only, key));
                log.debug("dedup.no_duplicates kind={} normalizedName='{}'", key.kind(), key.normalizedName());
            } else {
                mergedGroups++;
                absorbed += group.size() - 1;
                EntityRecord merged = merge(key, group);
                output.add(merged);
                log.debug("dedup.merged kind={} normalizedName='{}' variants={} canonical='{}'",
                        key.kind(), key.normalizedName(), group.size(), merged.getSurfaceName());
            }
        }

        perKind.forEach((kind, counts) -> {
            metrics.recordDeduplication(kind, counts[0], counts[1]);
            log.info("dedup.completed kind={} before={} after={}", kind, counts[0], counts[1]);
        });
        if (mergedGroups == 0) {
            log.info("dedup.no_duplicates_found records={}", output.size());
        }

        return new DedupResult(output, records.size(), mergedGroups, singletonGroups, absorbed, repeated, issues);
    }

    private EntityRecord passThrough(EntityRecord record, GroupKey key) {
        return EntityRecord.builder(record)
                .normalizedName(key.normalizedName())
                .identifier(assigner.assign(key.normalizedName(), key.kind()))
                .build();
    }

    private EntityRecord merge(GroupKey key, Set<EntityRecord> group) {
        Map<String, Long> mentionsBySurface = new TreeMap<>();
        SortedSet<String> surfaceNames = new TreeSet<>();
        SortedSet<String> provenance = new TreeSet<>();
        long mentionCount = 0;

        for (EntityRecord record : group) {
            mentionsBySurface.merge(record.getSurfaceName(), record.getMentionCount(), Long::sum);
            surfaceNames.addAll(record.allSurfaceNames());
            provenance.addAll(record.getProvenance());
            mentionCount += record.getMentionCount();
        }

        List<SurfaceCandidate> candidates = new ArrayList<>();
        mentionsBySurface.forEach((surface, count) -> candidates.add(new SurfaceCandidate(surface, count)));
        String canonical = selector.select(candidates).surfaceName();
        surfaceNames.remove(canonical);

        return EntityRecord.builder()
                .surfaceName(canonical)
                .normalizedName(key.normalizedName())
                .kind(key.kind())
                .identifier(assigner.assign(key.normalizedName(), key.kind()))
                .aliases(surfaceNames)
                .mentionCount(mentionCount)
                .provenance(provenance)
                .metadata(mergeMetadata(group, canonical))
                .build();
    }

    // canonical spelling's entries win, then the other records in surface-name order
    private static Map<String, String> mergeMetadata(Set<EntityRecord> group, String canonical) {
        List<EntityRecord> ordered = new ArrayList<>(group);
        ordered.sort(Comparator
                .comparing((EntityRecord r) -> !r.getSurfaceName().equals(canonical))
                .thenComparing(EntityRecord::getSurfaceName)
                .thenComparing(r -> r.getProvenance().toString()));
        Map<String, String> metadata = new TreeMap<>();
        for (EntityRecord record : ordered) {
            record.getMetadata().forEach(metadata::putIfAbsent);
        }
        return metadata;
    }

    record GroupKey(EntityKind kind, String normalizedName) implements Comparable<GroupKey> {
        private static final Comparator<GroupKey> ORDER = Comparator
                .comparing(GroupKey::kind)
                .thenComparing(GroupKey::normalizedName);

        @Override
        public int compareTo(GroupKey other) {
            return ORDER.compare(this, other);
        }
    }
}

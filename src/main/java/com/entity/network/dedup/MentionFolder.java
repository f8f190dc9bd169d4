package com.entity.network.dedup;

import com.entity.network.core.model.EntityKind;
import com.entity.network.core.model.EntityRecord;
import com.entity.network.core.model.IngestIssue;
import com.entity.network.core.model.MalformedInputException;
import com.entity.network.core.model.RawMention;
import com.entity.network.metrics.MetricsService;
import com.entity.network.metrics.NoOpMetricsService;
import com.entity.network.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds raw mentions from the extraction feed into raw entity records, one per
 * (kind, exact surface spelling). These are the records the {@link Deduplicator} groups.
 *
 * <p>A mention with an unknown kind, a blank name or no document id is rejected and recorded
 * as a {@link IngestIssue.Type#MALFORMED_INPUT} issue; the fold carries on.</p>
 */
public class MentionFolder {
    private static final Logger log = LoggerFactory.getLogger(MentionFolder.class);

    private final NormalizationEngine normalizer;
    private final MetricsService metrics;

    public MentionFolder(NormalizationEngine normalizer) {
        this(normalizer, new NoOpMetricsService());
    }

    public MentionFolder(NormalizationEngine normalizer, MetricsService metrics) {
        this.normalizer = normalizer;
        this.metrics = metrics;
    }

    public Result fold(Iterable<RawMention> mentions) {
        Map<SpellingKey, EntityRecord.Builder> builders = new TreeMap<>();
        Map<SpellingKey, Long> counts = new TreeMap<>();
        List<IngestIssue> issues = new ArrayList<>();
        long accepted = 0;

        for (RawMention mention : mentions) {
            EntityKind kind;
            String surface;
            try {
                kind = EntityKind.fromLabel(mention.kindLabel());
                surface = requireSurface(mention.surfaceName());
                if (mention.documentId() == null || mention.documentId().isBlank()) {
                    throw new MalformedInputException("document id is missing");
                }
            } catch (MalformedInputException e) {
                issues.add(IngestIssue.malformed(mention.documentId(), mention.surfaceName(), e.getMessage()));
                metrics.incrementMalformedRecord("mention");
                log.warn("mention.rejected documentId={} surfaceName='{}' kind='{}' error={}",
                        mention.documentId(), mention.surfaceName(), mention.kindLabel(), e.getMessage());
                continue;
            }

            // keyed on the exact spelling: variants stay separate until deduplication
            SpellingKey key = new SpellingKey(kind, surface);
            builders.computeIfAbsent(key, k -> EntityRecord.builder()
                            .surfaceName(k.surfaceName())
                            .normalizedName(normalizer.normalize(k.surfaceName()))
                            .kind(k.kind()))
                    .addDocument(mention.documentId().trim());
            counts.merge(key, 1L, Long::sum);
            accepted++;
        }

        List<EntityRecord> records = new ArrayList<>(builders.size());
        builders.forEach((key, builder) -> records.add(builder.mentionCount(counts.get(key)).build()));
        log.info("mentions.folded accepted={} rejected={} rawRecords={}", accepted, issues.size(), records.size());
        return new Result(records, accepted, issues);
    }

    private String requireSurface(String surfaceName) {
        if (surfaceName == null || surfaceName.isBlank()) {
            throw new MalformedInputException("surface name is empty");
        }
        String trimmed = surfaceName.trim();
        if (normalizer.normalize(trimmed).isEmpty()) {
            throw new MalformedInputException("surface name has no matchable characters");
        }
        return trimmed;
    }

    /**
     * @param records          raw records, one per (kind, spelling), sorted
     * @param acceptedMentions mentions folded into the records
     * @param issues           rejected mentions
     */
    public record Result(List<EntityRecord> records, long acceptedMentions, List<IngestIssue> issues) {
        public Result {
            records = List.copyOf(records);
            issues = List.copyOf(issues);
        }
    }

    private record SpellingKey(EntityKind kind, String surfaceName) implements Comparable<SpellingKey> {
        private static final Comparator<SpellingKey> ORDER = Comparator
                .comparing(SpellingKey::kind)
                .thenComparing(SpellingKey::surfaceName);

        @Override
        public int compareTo(SpellingKey other) {
            return ORDER.compare(this, other);
        }
    }
}

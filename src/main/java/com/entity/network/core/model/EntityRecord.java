package com.entity.network.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * An entity as seen by the pipeline: either a raw record folded from mentions,
 * or the canonical record produced by a deduplication pass.
 *
 * <p>Instances are immutable. Collections are kept sorted so that two records built
 * from the same data are equal and render identically.</p>
 */
public final class EntityRecord {
    private final String surfaceName;
    private final String normalizedName;
    private final EntityKind kind;
    private final String identifier;
    private final SortedSet<String> aliases;
    private final long mentionCount;
    private final SortedSet<String> provenance;
    private final SortedMap<String, String> metadata;

    private EntityRecord(Builder builder) {
        this.surfaceName = builder.surfaceName;
        this.normalizedName = builder.normalizedName;
        this.kind = builder.kind;
        this.identifier = builder.identifier;
        this.aliases = Collections.unmodifiableSortedSet(new TreeSet<>(builder.aliases));
        this.mentionCount = builder.mentionCount;
        this.provenance = Collections.unmodifiableSortedSet(new TreeSet<>(builder.provenance));
        this.metadata = Collections.unmodifiableSortedMap(new TreeMap<>(builder.metadata));
    }

    public String getSurfaceName() {
        return surfaceName;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public EntityKind getKind() {
        return kind;
    }

    /**
     * The deterministic identifier, or {@code null} for a raw record that has not been assigned one yet.
     */
    public String getIdentifier() {
        return identifier;
    }

    public SortedSet<String> getAliases() {
        return aliases;
    }

    public long getMentionCount() {
        return mentionCount;
    }

    public SortedSet<String> getProvenance() {
        return provenance;
    }

    public SortedMap<String, String> getMetadata() {
        return metadata;
    }

    /**
     * The canonical surface name plus every alias.
     */
    public SortedSet<String> allSurfaceNames() {
        SortedSet<String> names = new TreeSet<>(aliases);
        names.add(surfaceName);
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityRecord that = (EntityRecord) o;
        return mentionCount == that.mentionCount
                && Objects.equals(surfaceName, that.surfaceName)
                && Objects.equals(normalizedName, that.normalizedName)
                && kind == that.kind
                && Objects.equals(identifier, that.identifier)
                && aliases.equals(that.aliases)
                && provenance.equals(that.provenance)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(surfaceName, normalizedName, kind, identifier, aliases, mentionCount, provenance);
    }

    @Override
    public String toString() {
        return "EntityRecord{" +
                "identifier='" + identifier + '\'' +
                ", surfaceName='" + surfaceName + '\'' +
                ", normalizedName='" + normalizedName + '\'' +
                ", kind=" + kind +
                ", mentionCount=" + mentionCount +
                ", aliases=" + aliases.size() +
                ", provenance=" + provenance.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(EntityRecord record) {
        return new Builder()
                .surfaceName(record.surfaceName)
                .normalizedName(record.normalizedName)
                .kind(record.kind)
                .identifier(record.identifier)
                .aliases(record.aliases)
                .mentionCount(record.mentionCount)
                .provenance(record.provenance)
                .metadata(record.metadata);
    }

    public static class Builder {
        private String surfaceName;
        private String normalizedName;
        private EntityKind kind;
        private String identifier;
        private final SortedSet<String> aliases = new TreeSet<>();
        private long mentionCount;
        private final SortedSet<String> provenance = new TreeSet<>();
        private final SortedMap<String, String> metadata = new TreeMap<>();

        public Builder surfaceName(String surfaceName) {
            this.surfaceName = surfaceName;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder kind(EntityKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder aliases(Collection<String> aliases) {
            this.aliases.clear();
            this.aliases.addAll(aliases);
            return this;
        }

        public Builder addAlias(String alias) {
            this.aliases.add(alias);
            return this;
        }

        public Builder mentionCount(long mentionCount) {
            if (mentionCount < 0) {
                throw new IllegalArgumentException("mentionCount must be >= 0");
            }
            this.mentionCount = mentionCount;
            return this;
        }

        public Builder provenance(Collection<String> provenance) {
            this.provenance.clear();
            this.provenance.addAll(provenance);
            return this;
        }

        public Builder addDocument(String documentId) {
            this.provenance.add(documentId);
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata.clear();
            this.metadata.putAll(metadata);
            return this;
        }

        public Builder putMetadata(String key, String value) {
            this.metadata.put(key, value);
            return this;
        }

        public EntityRecord build() {
            Objects.requireNonNull(surfaceName, "surfaceName is required");
            Objects.requireNonNull(normalizedName, "normalizedName is required");
            Objects.requireNonNull(kind, "kind is required");
            aliases.remove(surfaceName);
            return new EntityRecord(this);
        }
    }
}

package com.entity.network.identity;

import com.entity.network.cache.NoOpResolutionCache;
import com.entity.network.cache.ResolutionCache;
import com.entity.network.cache.ResolvedName;
import com.entity.network.core.model.EntityKind;
import com.entity.network.core.model.EntityRecord;
import com.entity.network.core.model.MalformedInputException;
import com.entity.network.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Lookup from names to identifiers for one run, built from deduplicated entity records.
 *
 * <p>Constructed explicitly and passed to the stages that need it; nothing is held in static state,
 * so tests can build isolated instances. After construction the map is read-only and safe to share
 * between threads (the resolution cache is the only mutable part and is thread-safe when enabled).</p>
 *
 * <p>When two different records carry one identifier (residual duplicates let through with
 * {@code fail-on-residual-duplicates=false}) the first record wins and the others are kept aside
 * in {@link #shadowedRecords()}.</p>
 */
public final class IdentityMap {
    private static final Logger log = LoggerFactory.getLogger(IdentityMap.class);

    public static final List<EntityKind> DEFAULT_KIND_PREFERENCE =
            List.of(EntityKind.PERSON, EntityKind.ORGANIZATION, EntityKind.LOCATION);

    private final NormalizationEngine normalizer;
    private final ResolutionCache cache;
    private final List<EntityKind> kindPreference;
    private final SortedMap<String, EntityRecord> byIdentifier;
    private final Map<String, EnumMap<EntityKind, String>> byNormalizedName;
    private final List<EntityRecord> shadowed;

    private IdentityMap(Builder builder) {
        this.normalizer = builder.normalizer;
        this.cache = builder.cache;
        this.kindPreference = List.copyOf(builder.kindPreference);
        this.byIdentifier = new TreeMap<>();
        this.byNormalizedName = new HashMap<>();
        List<EntityRecord> aside = new ArrayList<>();

        for (EntityRecord record : builder.records) {
            String id = Objects.requireNonNull(record.getIdentifier(),
                    () -> "record has no identifier: " + record);
            EntityRecord previous = byIdentifier.putIfAbsent(id, record);
            if (previous != null && !previous.equals(record)) {
                aside.add(record);
                log.warn("identity.shadowed identifier={} kept='{}' shadowed='{}'",
                        id, previous.getSurfaceName(), record.getSurfaceName());
                continue;
            }
            byNormalizedName
                    .computeIfAbsent(record.getNormalizedName(), k -> new EnumMap<>(EntityKind.class))
                    .put(record.getKind(), id);
        }
        this.shadowed = List.copyOf(aside);
    }

    /**
     * Records dropped because an earlier, different record already held their identifier.
     */
    public List<EntityRecord> shadowedRecords() {
        return shadowed;
    }

    public static IdentityMap from(Collection<EntityRecord> records, NormalizationEngine normalizer) {
        return builder().normalizer(normalizer).records(records).build();
    }

    /**
     * Resolves a surface name of a known kind.
     */
    public Optional<String> resolve(String surfaceName, EntityKind kind) {
        if (kind == null) {
            return Optional.empty();
        }
        return lookup(surfaceName, kind.getLabel(), key -> {
            Map<EntityKind, String> ids = byNormalizedName.get(key);
            return ids != null ? ids.get(kind) : null;
        });
    }

    /**
     * Resolves a surface name whose kind is still textual. A label outside the closed set resolves to nothing.
     */
    public Optional<String> resolve(String surfaceName, String kindLabel) {
        EntityKind kind;
        try {
            kind = EntityKind.fromLabel(kindLabel);
        } catch (MalformedInputException e) {
            return Optional.empty();
        }
        return resolve(surfaceName, kind);
    }

    /**
     * Resolves a name that carries no kind. When the key exists under several kinds the first kind in
     * the configured preference order wins, so the choice is stable across runs.
     */
    public Optional<String> resolveAnyKind(String surfaceName) {
        return lookup(surfaceName, ResolutionCache.ANY_KIND, key -> {
            Map<EntityKind, String> ids = byNormalizedName.get(key);
            if (ids == null) {
                return null;
            }
            for (EntityKind kind : kindPreference) {
                String id = ids.get(kind);
                if (id != null) {
                    return id;
                }
            }
            return ids.values().iterator().next();
        });
    }

    public Optional<EntityRecord> record(String identifier) {
        return Optional.ofNullable(byIdentifier.get(identifier));
    }

    public boolean contains(String identifier) {
        return byIdentifier.containsKey(identifier);
    }

    public int size() {
        return byIdentifier.size();
    }

    /**
     * All records ordered by identifier.
     */
    public Collection<EntityRecord> records() {
        return Collections.unmodifiableCollection(byIdentifier.values());
    }

    public String normalize(String surfaceName) {
        return normalizer.normalize(surfaceName);
    }

    public ResolutionCache getCache() {
        return cache;
    }

    private Optional<String> lookup(String surfaceName, String kindLabel, KeyResolver resolver) {
        if (surfaceName == null) {
            return Optional.empty();
        }
        Optional<ResolvedName> cached = cache.get(surfaceName, kindLabel);
        if (cached.isPresent()) {
            return cached.get().identifierIfResolved();
        }
        String key = normalizer.normalize(surfaceName);
        String id = key.isEmpty() ? null : resolver.resolve(key);
        cache.put(surfaceName, kindLabel, new ResolvedName(key, id));
        return Optional.ofNullable(id);
    }

    @FunctionalInterface
    private interface KeyResolver {
        String resolve(String normalizedName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private NormalizationEngine normalizer;
        private ResolutionCache cache = new NoOpResolutionCache();
        private List<EntityKind> kindPreference = DEFAULT_KIND_PREFERENCE;
        private Collection<EntityRecord> records = List.of();

        public Builder normalizer(NormalizationEngine normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder cache(ResolutionCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder kindPreference(List<EntityKind> kindPreference) {
            this.kindPreference = kindPreference;
            return this;
        }

        public Builder records(Collection<EntityRecord> records) {
            this.records = records;
            return this;
        }

        public IdentityMap build() {
            Objects.requireNonNull(normalizer, "normalizer is required");
            Objects.requireNonNull(cache, "cache is required");
            Objects.requireNonNull(kindPreference, "kindPreference is required");
            Objects.requireNonNull(records, "records is required");
            return new IdentityMap(this);
        }
    }
}

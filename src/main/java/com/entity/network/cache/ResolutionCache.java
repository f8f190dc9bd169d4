package com.entity.network.cache;

import java.util.Optional;

/**
 * Cache of surface name resolutions during co-occurrence aggregation and graph merging.
 * Keyed by the raw surface name plus the kind label it was looked up under
 * ({@code "*"} for kind-less lookups).
 */
public interface ResolutionCache {

    String ANY_KIND = "*";

    Optional<ResolvedName> get(String surfaceName, String kindLabel);

    void put(String surfaceName, String kindLabel, ResolvedName resolution);

    void invalidateAll();

    CacheStats getStats();
}

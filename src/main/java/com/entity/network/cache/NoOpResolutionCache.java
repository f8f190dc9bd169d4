package com.entity.network.cache;

import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Stores nothing. Every lookup is reported as a miss so the run summary still shows how many
 * names went through the identity map.
 */
public class NoOpResolutionCache implements ResolutionCache {

    private final LongAdder lookups = new LongAdder();

    @Override
    public Optional<ResolvedName> get(String surfaceName, String kindLabel) {
        lookups.increment();
        return Optional.empty();
    }

    @Override
    public void put(String surfaceName, String kindLabel, ResolvedName resolution) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(0, lookups.sum(), 0, 0);
    }
}

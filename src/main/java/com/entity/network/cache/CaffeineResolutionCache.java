package com.entity.network.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed resolution cache. Size-bounded, no expiry: an identity map does not change
 * during a run, so entries never go stale.
 */
public class CaffeineResolutionCache implements ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<CacheKey, ResolvedName> cache;

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.debug("cache.initialized maxSize={}", config.maxSize());
    }

    /**
     * Creates the cache described by the config: Caffeine when enabled, no-op otherwise.
     */
    public static ResolutionCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineResolutionCache(config) : new NoOpResolutionCache();
    }

    @Override
    public Optional<ResolvedName> get(String surfaceName, String kindLabel) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(surfaceName, kindLabel)));
    }

    @Override
    public void put(String surfaceName, String kindLabel, ResolvedName resolution) {
        cache.put(new CacheKey(surfaceName, kindLabel), resolution);
    }

    @Override
    public void invalidateAll() {
        long dropped = cache.estimatedSize();
        cache.invalidateAll();
        log.debug("cache.invalidated entries={}", dropped);
    }

    @Override
    public CacheStats getStats() {
        var stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    record CacheKey(String surfaceName, String kindLabel) {}
}

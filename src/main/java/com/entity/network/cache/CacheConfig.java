package com.entity.network.cache;

/**
 * Configuration for the name resolution cache.
 *
 * @param maxSize maximum number of cached surface names
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default cache configuration: 50,000 entries, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, false);
    }
}

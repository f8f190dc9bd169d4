package com.entity.network.cache;

import java.util.Locale;

/**
 * Counters of a {@link ResolutionCache} over one run.
 *
 * @param hitCount      lookups answered from the cache
 * @param missCount     lookups that went to the identity map
 * @param evictionCount entries dropped by the size bound
 * @param size          entries currently held
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public long lookupCount() {
        return hitCount + missCount;
    }

    /**
     * Share of lookups answered from the cache; 0 when nothing was looked up.
     */
    public double hitRate() {
        long total = lookupCount();
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "lookups=%d hitRate=%.3f evictions=%d size=%d",
                lookupCount(), hitRate(), evictionCount, size);
    }
}

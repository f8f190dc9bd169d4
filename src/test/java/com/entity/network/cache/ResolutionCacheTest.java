package com.entity.network.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionCacheTest {

    private static final ResolvedName FBI = new ResolvedName("the fbi", "370cb10b-4a8c-5a89-bb53-52ef67770904");

    @Nested
    @DisplayName("NoOpResolutionCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always return empty on get")
        void testGetAlwaysEmpty() {
            NoOpResolutionCache cache = new NoOpResolutionCache();
            cache.put("The FBI", "organization", FBI);
            assertTrue(cache.get("The FBI", "organization").isEmpty());
        }

        @Test
        @DisplayName("Should return empty stats")
        void testEmptyStats() {
            CacheStats stats = new NoOpResolutionCache().getStats();
            assertEquals(0, stats.hitCount());
            assertEquals(0, stats.missCount());
            assertEquals(0, stats.size());
            assertEquals(0.0, stats.hitRate());
        }

        @Test
        @DisplayName("Should report every lookup as a miss")
        void testLookupsAreMisses() {
            NoOpResolutionCache cache = new NoOpResolutionCache();
            cache.get("The FBI", "organization");
            cache.get("The FBI", "organization");

            CacheStats stats = cache.getStats();
            assertEquals(2, stats.missCount());
            assertEquals(2, stats.lookupCount());
            assertEquals(0, stats.size());
        }
    }

    @Nested
    @DisplayName("CaffeineResolutionCache")
    class CaffeineTests {

        @Test
        @DisplayName("Should cache and retrieve resolutions")
        void testPutAndGet() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put("The FBI", "organization", FBI);

            Optional<ResolvedName> cached = cache.get("The FBI", "organization");
            assertTrue(cached.isPresent());
            assertEquals(FBI.identifier(), cached.get().identifierIfResolved().orElseThrow());
        }

        @Test
        @DisplayName("Entries are scoped by kind label")
        void testKindScoped() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put("New York", "location", new ResolvedName("new york", "loc"));
            assertTrue(cache.get("New York", "organization").isEmpty());
            assertTrue(cache.get("New York", ResolutionCache.ANY_KIND).isEmpty());
        }

        @Test
        @DisplayName("Misses are cached as unresolved names")
        void testCachedMiss() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put("Nobody", "person", new ResolvedName("nobody", null));
            ResolvedName cached = cache.get("Nobody", "person").orElseThrow();
            assertEquals("nobody", cached.normalizedName());
            assertTrue(cached.identifierIfResolved().isEmpty());
        }

        @Test
        @DisplayName("Should track hits and misses")
        void testStats() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put("The FBI", "organization", FBI);
            cache.get("The FBI", "organization");
            cache.get("The FBI", "organization");
            cache.get("CIA", "organization");

            CacheStats stats = cache.getStats();
            assertEquals(2, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
        }

        @Test
        @DisplayName("invalidateAll clears every entry")
        void testInvalidateAll() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put("The FBI", "organization", FBI);
            cache.invalidateAll();
            assertTrue(cache.get("The FBI", "organization").isEmpty());
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("create picks the implementation from the enabled flag")
        void testCreate() {
            assertInstanceOf(CaffeineResolutionCache.class, CaffeineResolutionCache.create(CacheConfig.defaults()));
            assertInstanceOf(NoOpResolutionCache.class, CaffeineResolutionCache.create(CacheConfig.disabled()));
        }

        @Test
        @DisplayName("Should reject non-positive sizes")
        void testInvalidSize() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, true));
        }
    }
}

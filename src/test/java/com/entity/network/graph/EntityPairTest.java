package com.entity.network.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class EntityPairTest {

    @Test
    @DisplayName("Pairs are stored in canonical order")
    void testCanonicalOrder() {
        EntityPair pair = EntityPair.of("b", "a");
        assertEquals("a", pair.first());
        assertEquals("b", pair.second());
        assertEquals(EntityPair.of("a", "b"), pair);
        assertEquals(EntityPair.of("a", "b").hashCode(), pair.hashCode());
    }

    @Test
    @DisplayName("An entity cannot pair with itself")
    void testSelfPair() {
        assertThrows(IllegalArgumentException.class, () -> EntityPair.of("a", "a"));
    }

    @Test
    @DisplayName("other returns the opposite endpoint")
    void testOther() {
        EntityPair pair = EntityPair.of("a", "b");
        assertEquals("b", pair.other("a"));
        assertEquals("a", pair.other("b"));
        assertTrue(pair.contains("a"));
        assertFalse(pair.contains("c"));
        assertThrows(IllegalArgumentException.class, () -> pair.other("c"));
    }

    @Test
    @DisplayName("Edges combine per source and check their totals")
    void testWeightedEdge() {
        EntityPair pair = EntityPair.of("x", "y");
        WeightedEdge combined = WeightedEdge.of(pair, "manifest", 5).plus(WeightedEdge.of(pair, "document", 3));

        assertEquals(8, combined.weight());
        assertEquals(List.of("document", "manifest"), List.copyOf(combined.sources()));
        assertEquals(3, combined.weightFrom("document"));
        assertEquals(0, combined.weightFrom("court"));
        assertEquals("x", combined.source());
        assertEquals("y", combined.target());

        Map<String, Long> wrongTotal = new TreeMap<>(Map.of("document", 2L));
        assertThrows(IllegalArgumentException.class, () -> new WeightedEdge(pair, 3, new TreeMap<>(wrongTotal)));
        assertThrows(IllegalArgumentException.class,
                () -> combined.plus(WeightedEdge.of(EntityPair.of("x", "z"), "document", 1)));
    }
}

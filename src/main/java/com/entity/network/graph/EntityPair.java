package com.entity.network.graph;

import java.util.Comparator;
import java.util.Objects;

/**
 * Unordered pair of entity identifiers, stored in canonical order ({@code first <= second}),
 * so (A, B) and (B, A) are the same pair.
 */
public record EntityPair(String first, String second) implements Comparable<EntityPair> {

    private static final Comparator<EntityPair> ORDER = Comparator
            .comparing(EntityPair::first)
            .thenComparing(EntityPair::second);

    public EntityPair {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        if (first.equals(second)) {
            throw new IllegalArgumentException("an entity cannot pair with itself: " + first);
        }
        if (first.compareTo(second) > 0) {
            String swap = first;
            first = second;
            second = swap;
        }
    }

    public static EntityPair of(String a, String b) {
        return new EntityPair(a, b);
    }

    public boolean contains(String identifier) {
        return first.equals(identifier) || second.equals(identifier);
    }

    /**
     * The endpoint that is not {@code identifier}.
     */
    public String other(String identifier) {
        if (first.equals(identifier)) {
            return second;
        }
        if (second.equals(identifier)) {
            return first;
        }
        throw new IllegalArgumentException(identifier + " is not an endpoint of " + this);
    }

    @Override
    public int compareTo(EntityPair other) {
        return ORDER.compare(this, other);
    }
}

package com.entity.network.dedup;

import java.util.Comparator;
import java.util.Objects;

/**
 * One link in the canonical-form tie-break chain. The comparator orders the preferred
 * candidate first; candidates it considers equal fall through to the next rule.
 * Rules run in priority order (lower number first).
 */
public class CanonicalFormRule {
    private final String name;
    private final int priority;
    private final Comparator<SurfaceCandidate> preference;

    private CanonicalFormRule(Builder builder) {
        this.name = builder.name;
        this.priority = builder.priority;
        this.preference = builder.preference;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    public Comparator<SurfaceCandidate> getPreference() {
        return preference;
    }

    /**
     * Title case over other casings, ALL CAPS last.
     */
    public static CanonicalFormRule capitalization() {
        return builder()
                .name("capitalization")
                .priority(10)
                .preference(Comparator.comparingInt(
                        (SurfaceCandidate c) -> CapitalizationStyle.classify(c.surfaceName()).getRank()).reversed())
                .build();
    }

    public static CanonicalFormRule mentionCount() {
        return builder()
                .name("mention-count")
                .priority(20)
                .preference(Comparator.comparingLong(SurfaceCandidate::mentionCount).reversed())
                .build();
    }

    /**
     * Final tie-break; surface names within a group are distinct, so this always decides.
     */
    public static CanonicalFormRule lexicographic() {
        return builder()
                .name("lexicographic")
                .priority(1000)
                .preference(Comparator.comparing(SurfaceCandidate::surfaceName))
                .build();
    }

    @Override
    public String toString() {
        return "CanonicalFormRule{name='" + name + "', priority=" + priority + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private int priority = 100;
        private Comparator<SurfaceCandidate> preference;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder preference(Comparator<SurfaceCandidate> preference) {
            this.preference = preference;
            return this;
        }

        public CanonicalFormRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(preference, "preference is required");
            return new CanonicalFormRule(this);
        }
    }
}

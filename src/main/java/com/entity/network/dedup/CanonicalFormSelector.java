package com.entity.network.dedup;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Chooses the canonical surface form of a duplicate group by walking an ordered list of
 * {@link CanonicalFormRule}s. New heuristics are added as rules rather than extra branches.
 */
public class CanonicalFormSelector {

    private final List<CanonicalFormRule> rules;

    public CanonicalFormSelector(List<CanonicalFormRule> rules) {
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("at least one rule is required");
        }
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparingInt(CanonicalFormRule::getPriority));
    }

    /**
     * capitalization, then mention count, then lexicographic order.
     */
    public static CanonicalFormSelector defaultSelector() {
        return new CanonicalFormSelector(List.of(
                CanonicalFormRule.capitalization(),
                CanonicalFormRule.mentionCount(),
                CanonicalFormRule.lexicographic()));
    }

    public List<CanonicalFormRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * The combined ordering; the first element under it is the canonical form.
     */
    public Comparator<SurfaceCandidate> ordering() {
        Comparator<SurfaceCandidate> chain = rules.get(0).getPreference();
        for (int i = 1; i < rules.size(); i++) {
            chain = chain.thenComparing(rules.get(i).getPreference());
        }
        return chain;
    }

    public SurfaceCandidate select(Collection<SurfaceCandidate> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("no candidates to select from");
        }
        Comparator<SurfaceCandidate> ordering = ordering();
        SurfaceCandidate best = null;
        for (SurfaceCandidate candidate : candidates) {
            if (best == null || ordering.compare(candidate, best) < 0) {
                best = candidate;
            }
        }
        return best;
    }
}

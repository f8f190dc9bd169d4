package com.entity.network.conflation;

import com.entity.network.core.model.EntityKind;

import java.util.List;

/**
 * Two or more canonical entities of one kind sharing a normalized name.
 * Only possible when deduplication is broken.
 */
public record ResidualDuplicate(EntityKind kind, String normalizedName, List<EntitySummary> variants) {

    public ResidualDuplicate {
        variants = List.copyOf(variants);
    }

    public Severity severity() {
        return Severity.INVARIANT_VIOLATION;
    }
}

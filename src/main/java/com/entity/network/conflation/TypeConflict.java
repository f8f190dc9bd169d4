package com.entity.network.conflation;

import com.entity.network.core.model.EntityKind;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One normalized name present as canonical entities under several kinds,
 * for example "New York" as a location and as an organization.
 */
public record TypeConflict(String normalizedName, Set<EntityKind> kinds, List<EntitySummary> entities) {

    public TypeConflict {
        kinds = Set.copyOf(kinds);
        entities = List.copyOf(entities);
    }

    public List<String> identifiers() {
        return entities.stream().map(EntitySummary::identifier).collect(Collectors.toList());
    }

    public Severity severity() {
        return Severity.REVIEW;
    }
}

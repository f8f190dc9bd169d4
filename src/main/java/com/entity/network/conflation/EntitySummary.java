package com.entity.network.conflation;

import com.entity.network.core.model.EntityKind;
import com.entity.network.core.model.EntityRecord;

/**
 * The parts of a canonical record a reviewer needs to judge a finding.
 */
public record EntitySummary(
        String identifier,
        String surfaceName,
        String normalizedName,
        EntityKind kind,
        long mentionCount,
        int documentCount
) {
    public static EntitySummary of(EntityRecord record) {
        return new EntitySummary(
                record.getIdentifier(),
                record.getSurfaceName(),
                record.getNormalizedName(),
                record.getKind(),
                record.getMentionCount(),
                record.getProvenance().size());
    }
}

package com.entity.network.conflation;

import com.entity.network.core.model.EntityRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Blocking-key index over canonical records: key to the records indexed under it.
 */
class CandidateIndex {

    private final BlockingKeyStrategy strategy;
    private final Map<String, List<EntityRecord>> buckets = new HashMap<>();

    CandidateIndex(BlockingKeyStrategy strategy, Collection<EntityRecord> records) {
        this.strategy = strategy;
        for (EntityRecord record : records) {
            for (String key : strategy.generateKeys(record.getNormalizedName())) {
                buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            }
        }
    }

    /**
     * Records sharing a probe key with the given name, in indexing order, each at most once.
     */
    Set<EntityRecord> candidates(String normalizedName) {
        Set<EntityRecord> result = new LinkedHashSet<>();
        for (String key : strategy.probeKeys(normalizedName)) {
            List<EntityRecord> bucket = buckets.get(key);
            if (bucket != null) {
                result.addAll(bucket);
            }
        }
        return result;
    }

    int bucketCount() {
        return buckets.size();
    }
}

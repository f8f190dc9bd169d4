package com.entity.network.dedup;

import com.entity.network.core.model.EntityRecord;
import com.entity.network.core.model.IngestIssue;

import java.util.List;

/**
 * Outcome of a deduplication pass.
 *
 * @param records          one canonical record per (kind, normalized name), sorted by kind then key
 * @param inputCount       records handed to the pass
 * @param mergedGroups     groups that held more than one raw record
 * @param singletonGroups  groups with a single record ("no duplicates found")
 * @param absorbedRecords  raw records folded into another record and discarded
 * @param repeatedRecords  exact repeats of a record already in the group, ignored
 * @param issues           records rejected as malformed
 */
public record DedupResult(
        List<EntityRecord> records,
        int inputCount,
        int mergedGroups,
        int singletonGroups,
        int absorbedRecords,
        int repeatedRecords,
        List<IngestIssue> issues
) {
    public DedupResult {
        records = records != null ? List.copyOf(records) : List.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public int outputCount() {
        return records.size();
    }

    public boolean hasMerges() {
        return mergedGroups > 0;
    }

    @Override
    public String toString() {
        return "DedupResult{input=" + inputCount +
                ", output=" + records.size() +
                ", mergedGroups=" + mergedGroups +
                ", singletons=" + singletonGroups +
                ", absorbed=" + absorbedRecords +
                ", repeated=" + repeatedRecords +
                ", issues=" + issues.size() + '}';
    }
}

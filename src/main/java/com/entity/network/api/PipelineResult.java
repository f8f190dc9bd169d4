package com.entity.network.api;

import com.entity.network.conflation.ConflationReport;
import com.entity.network.cooccurrence.CooccurrenceGraph;
import com.entity.network.core.model.EntityRecord;
import com.entity.network.core.model.IngestIssue;
import com.entity.network.dedup.DedupResult;
import com.entity.network.graph.MergedGraph;
import com.entity.network.graph.RelationshipGraph;
import com.entity.network.identity.IdentityMap;

import java.util.List;

/**
 * Everything a run produced.
 */
public record PipelineResult(
        String runId,
        DedupResult dedupResult,
        IdentityMap identityMap,
        ConflationReport conflationReport,
        CooccurrenceGraph cooccurrenceGraph,
        RelationshipGraph secondaryGraph,
        MergedGraph mergedGraph,
        List<IngestIssue> issues,
        PipelineSummary summary
) {
    public PipelineResult {
        issues = List.copyOf(issues);
    }

    /** Canonical entity records, one per (kind, normalized name). */
    public List<EntityRecord> entities() {
        return dedupResult.records();
    }
}

package com.entity.network.api;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Counts of a run, produced for every completed run and written as {@code summary.json}.
 */
public record PipelineSummary(
        long mentionsRead,
        long mentionsAccepted,
        int malformedRecords,
        int rawRecords,
        int entitiesBeforeDedup,
        int entitiesAfterDedup,
        SortedMap<String, Integer> entitiesByKind,
        int mergedGroups,
        int absorbedRecords,
        int residualDuplicates,
        int typeConflicts,
        int partialMatches,
        long documentsProcessed,
        SortedMap<String, Long> documentsByType,
        int highCardinalityDocuments,
        long mentionsResolved,
        long unresolvedMentions,
        int unresolvedSecondaryNames,
        int secondarySelfLoops,
        int documentEdges,
        int secondaryEdges,
        int mergedEdges,
        int graphNodes,
        int issueTotal
) {
    public PipelineSummary {
        entitiesByKind = new TreeMap<>(entitiesByKind);
        documentsByType = new TreeMap<>(documentsByType);
    }
}

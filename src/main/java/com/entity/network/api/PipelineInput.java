package com.entity.network.api;

import com.entity.network.core.model.IngestIssue;
import com.entity.network.core.model.RawMention;
import com.entity.network.graph.SecondaryEdge;

import java.util.List;

/**
 * The feeds of one run: raw mentions from extraction and, optionally, the name-keyed edges of an
 * external relationship source. {@code readIssues} carries problems met while reading the feeds so
 * they end up in the run's issue list.
 */
public record PipelineInput(List<RawMention> mentions, List<SecondaryEdge> secondaryEdges, List<IngestIssue> readIssues) {

    public PipelineInput {
        mentions = mentions != null ? List.copyOf(mentions) : List.of();
        secondaryEdges = secondaryEdges != null ? List.copyOf(secondaryEdges) : List.of();
        readIssues = readIssues != null ? List.copyOf(readIssues) : List.of();
    }

    public static PipelineInput of(List<RawMention> mentions) {
        return new PipelineInput(mentions, List.of(), List.of());
    }

    public static PipelineInput of(List<RawMention> mentions, List<SecondaryEdge> secondaryEdges) {
        return new PipelineInput(mentions, secondaryEdges, List.of());
    }
}

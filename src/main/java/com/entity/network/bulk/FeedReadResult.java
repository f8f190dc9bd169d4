package com.entity.network.bulk;

import com.entity.network.core.model.IngestIssue;

import java.util.List;

/**
 * Items read from a feed, with the records that could not be read.
 *
 * @param items       parsed items in feed order
 * @param recordsRead data records seen (header and blank lines excluded)
 * @param issues      malformed records and read failures
 */
public record FeedReadResult<T>(List<T> items, long recordsRead, List<IngestIssue> issues) {

    public FeedReadResult {
        items = items != null ? List.copyOf(items) : List.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    @Override
    public String toString() {
        return "FeedReadResult{read=" + recordsRead + ", items=" + items.size() + ", issues=" + issues.size() + '}';
    }
}

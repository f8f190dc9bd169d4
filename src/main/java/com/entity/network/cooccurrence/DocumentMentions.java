package com.entity.network.cooccurrence;

import com.entity.network.core.model.RawMention;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The entity mentions extracted from one document.
 */
public record DocumentMentions(String documentId, List<RawMention> mentions) {

    public DocumentMentions {
        mentions = mentions != null ? List.copyOf(mentions) : List.of();
    }

    /**
     * Groups a mention feed by document id, keeping first-seen document order.
     * Mentions without a document id are dropped.
     */
    public static List<DocumentMentions> groupByDocument(Iterable<RawMention> mentions) {
        Map<String, List<RawMention>> byDocument = new LinkedHashMap<>();
        for (RawMention mention : mentions) {
            if (mention.documentId() == null || mention.documentId().isBlank()) {
                continue;
            }
            byDocument.computeIfAbsent(mention.documentId().trim(), k -> new ArrayList<>()).add(mention);
        }
        List<DocumentMentions> documents = new ArrayList<>(byDocument.size());
        byDocument.forEach((id, list) -> documents.add(new DocumentMentions(id, list)));
        return documents;
    }
}

package com.entity.network.core.model;

/**
 * One entity mention as delivered by the extraction feed.
 * The kind stays textual until it is validated against {@link EntityKind}.
 *
 * @param surfaceName the name as written in the document
 * @param kindLabel   the entity kind label supplied by the extractor
 * @param documentId  the document the mention was found in
 */
public record RawMention(String surfaceName, String kindLabel, String documentId) {

    public static RawMention of(String surfaceName, EntityKind kind, String documentId) {
        return new RawMention(surfaceName, kind.getLabel(), documentId);
    }
}

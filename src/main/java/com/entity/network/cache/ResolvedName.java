package com.entity.network.cache;

import java.util.Optional;

/**
 * Outcome of resolving one surface name: its normalized key and, when known, the entity identifier.
 * Misses are cached too, so repeated unknown names are not normalized again.
 *
 * @param normalizedName the matching key
 * @param identifier     the resolved identifier, or {@code null} when unresolved
 */
public record ResolvedName(String normalizedName, String identifier) {

    public Optional<String> identifierIfResolved() {
        return Optional.ofNullable(identifier);
    }
}

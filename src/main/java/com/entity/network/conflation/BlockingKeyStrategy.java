package com.entity.network.conflation;

import java.util.Set;

/**
 * Strategy interface for generating blocking keys from normalized entity names.
 * Blocking keys narrow the candidate set for the partial-match pass so it avoids
 * comparing every pair of entities.
 *
 * <p>A name is indexed under its {@link #generateKeys index keys} and looked up by its
 * {@link #probeKeys probe keys}. Two names can only be compared when a probe key of one
 * is an index key of the other.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * Keys an entity is indexed under.
     *
     * @param normalizedName the normalized entity name
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(String normalizedName);

    /**
     * Keys used to look up candidates for a name. Defaults to the index keys.
     */
    default Set<String> probeKeys(String normalizedName) {
        return generateKeys(normalizedName);
    }
}

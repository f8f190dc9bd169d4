package com.entity.network.conflation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Blocking on whole tokens: a name is indexed under every distinct token it contains
 * (e.g. {@code tok:ghislaine}, {@code tok:maxwell}) and probed with its leading token only.
 *
 * <p>If a shorter name occurs token-aligned inside a longer one, the longer name contains the
 * shorter name's first token, so probing with that token alone never misses a match.</p>
 */
public class TokenBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final String PREFIX = "tok:";

    @Override
    public Set<String> generateKeys(String normalizedName) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedName == null || normalizedName.isBlank()) {
            return keys;
        }
        for (String token : normalizedName.trim().split("\\s+")) {
            keys.add(PREFIX + token);
        }
        return keys;
    }

    @Override
    public Set<String> probeKeys(String normalizedName) {
        if (normalizedName == null || normalizedName.isBlank()) {
            return Collections.emptySet();
        }
        String trimmed = normalizedName.trim();
        int space = trimmed.indexOf(' ');
        return Set.of(PREFIX + (space < 0 ? trimmed : trimmed.substring(0, space)));
    }
}

package com.entity.network.identity;

import com.entity.network.core.model.EntityKind;
import com.entity.network.core.model.MalformedInputException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Assigns deterministic identifiers to (normalized name, kind) pairs.
 *
 * <p>Identifiers are name-based UUIDs (version 5, SHA-1) computed over a fixed namespace and the
 * string {@code normalizedName + ":" + kind.getLabel()}. The same input gives the same identifier on
 * every run and every machine, and changing only the kind changes the identifier.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public class IdentityAssigner {

    /**
     * Namespace for entity identifiers. Changing it re-keys every entity.
     */
    public static final UUID NAMESPACE_V1 = UUID.fromString("a1234567-89ab-cdef-0123-456789abcdef");

    /**
     * Namespace for synthetic identifiers given to secondary-source names that match no entity.
     */
    public static final UUID FALLBACK_NAMESPACE_V1 = UUID.fromString("b7e15163-0f4a-5d2b-9c3e-6a1d8f2e4b70");

    private static final String FALLBACK_PREFIX = "unresolved:";

    private final UUID namespace;
    private final UUID fallbackNamespace;

    public IdentityAssigner() {
        this(NAMESPACE_V1, FALLBACK_NAMESPACE_V1);
    }

    public IdentityAssigner(UUID namespace, UUID fallbackNamespace) {
        this.namespace = namespace;
        this.fallbackNamespace = fallbackNamespace;
    }

    /**
     * Assigns the identifier for a normalized name of the given kind.
     *
     * @throws MalformedInputException if the name is empty or the kind is missing
     */
    public String assign(String normalizedName, EntityKind kind) {
        if (kind == null) {
            throw new MalformedInputException("entity kind is missing");
        }
        requireKey(normalizedName);
        return nameBasedUuid(namespace, normalizedName + ":" + kind.getLabel()).toString();
    }

    /**
     * Assigns the identifier for a textual kind, validated against the closed set.
     *
     * @throws MalformedInputException if the kind label is not a known kind
     */
    public String assign(String normalizedName, String kindLabel) {
        return assign(normalizedName, EntityKind.fromLabel(kindLabel));
    }

    /**
     * Synthetic identifier for a name that could not be resolved to an entity.
     * Lives in its own namespace so it never collides with a real entity identifier.
     */
    public String assignFallback(String normalizedName) {
        requireKey(normalizedName);
        return nameBasedUuid(fallbackNamespace, FALLBACK_PREFIX + normalizedName).toString();
    }

    public static boolean isValidIdentifier(String value) {
        if (value == null || value.length() != 36) {
            return false;
        }
        try {
            return UUID.fromString(value).toString().equals(value);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static void requireKey(String normalizedName) {
        if (normalizedName == null || normalizedName.isEmpty()) {
            throw new MalformedInputException("normalized name is empty");
        }
    }

    static UUID nameBasedUuid(UUID namespace, String name) {
        MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
        ByteBuffer ns = ByteBuffer.allocate(16);
        ns.putLong(namespace.getMostSignificantBits());
        ns.putLong(namespace.getLeastSignificantBits());
        sha1.update(ns.array());
        byte[] hash = sha1.digest(name.getBytes(StandardCharsets.UTF_8));

        hash[6] &= 0x0f;
        hash[6] |= 0x50; // version 5
        hash[8] &= 0x3f;
        hash[8] |= (byte) 0x80; // IETF variant

        ByteBuffer bits = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(bits.getLong(), bits.getLong());
    }
}

package com.entity.network.core.model;

import java.util.Locale;

/**
 * Closed set of entity kinds recognized by the pipeline.
 * The label is part of the hashed identity input and must never change for an existing kind.
 */
public enum EntityKind {
    PERSON("person"),
    ORGANIZATION("organization"),
    LOCATION("location");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses a kind from its label or enum name, ignoring case and surrounding whitespace.
     *
     * @throws MalformedInputException if the value is not one of the closed set
     */
    public static EntityKind fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new MalformedInputException("entity kind is missing");
        }
        String candidate = value.trim().toLowerCase(Locale.ROOT);
        for (EntityKind kind : values()) {
            if (kind.label.equals(candidate) || kind.name().toLowerCase(Locale.ROOT).equals(candidate)) {
                return kind;
            }
        }
        throw new MalformedInputException("unknown entity kind: '" + value + "'");
    }
}

package com.entity.network.conflation;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * The independent passes of the conflation detector.
 */
public enum ConflationCheck {
    RESIDUAL_VARIATION("residual_variation", Severity.INVARIANT_VIOLATION),
    TYPE_CONFLICT("type_conflict", Severity.REVIEW),
    PARTIAL_MATCH("partial_match", Severity.ADVISORY);

    private final String label;
    private final Severity severity;

    ConflationCheck(String label, Severity severity) {
        this.label = label;
        this.severity = severity;
    }

    public String getLabel() {
        return label;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * Parses a comma-separated list of check labels; {@code "all"} or blank selects every check.
     */
    public static Set<ConflationCheck> parseList(String value) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("all")) {
            return EnumSet.allOf(ConflationCheck.class);
        }
        Set<ConflationCheck> checks = EnumSet.noneOf(ConflationCheck.class);
        for (String part : value.split(",")) {
            String candidate = part.trim().toLowerCase(Locale.ROOT);
            if (candidate.isEmpty()) {
                continue;
            }
            ConflationCheck match = null;
            for (ConflationCheck check : values()) {
                if (check.label.equals(candidate) || check.name().toLowerCase(Locale.ROOT).equals(candidate)) {
                    match = check;
                }
            }
            if (match == null) {
                throw new IllegalArgumentException("unknown conflation check: '" + part.trim() + "'");
            }
            checks.add(match);
        }
        return checks;
    }
}

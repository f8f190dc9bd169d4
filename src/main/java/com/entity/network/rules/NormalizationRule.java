package com.entity.network.rules;

import com.entity.network.core.model.EntityKind;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One named regex rewrite of a surface name. Lower priorities run first; a rule built without
 * kinds applies to every {@link EntityKind}. Matching ignores case.
 */
public final class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Set<EntityKind> kinds;
    private final int priority;

    private NormalizationRule(String name, Pattern pattern, String replacement, Set<EntityKind> kinds, int priority) {
        this.name = name;
        this.pattern = pattern;
        this.replacement = replacement;
        this.kinds = kinds;
        this.priority = priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    public boolean appliesTo(EntityKind kind) {
        return kinds.isEmpty() || kinds.contains(kind);
    }

    /**
     * Rewrites every match in {@code input}; {@code null} passes through.
     */
    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return name + "(" + priority + ", /" + pattern.pattern() + "/" + (kinds.isEmpty() ? "" : " " + kinds) + ")";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String regex;
        private String replacement;
        private final Set<EntityKind> kinds = EnumSet.noneOf(EntityKind.class);
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String regex) {
            this.regex = regex;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder applicableKinds(EntityKind... kinds) {
            this.kinds.clear();
            this.kinds.addAll(Set.of(kinds));
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the pattern does not compile
         */
        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(regex, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            Pattern compiled;
            try {
                compiled = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("rule '" + name + "' has an invalid pattern: " + e.getDescription(), e);
            }
            return new NormalizationRule(name, compiled, replacement, Set.copyOf(kinds), priority);
        }
    }
}

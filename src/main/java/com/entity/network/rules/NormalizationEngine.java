package com.entity.network.rules;

import com.entity.network.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns an entity surface name into the key used for matching.
 * Rules run in priority order, then the result is lowercased, trimmed and whitespace-collapsed.
 *
 * <p>Normalization is total: {@code null}, empty and blank inputs give an empty key and no input
 * raises an exception. Rejecting empty keys is the caller's job.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes a name without kind scoping.
     */
    public String normalize(String name) {
        return normalize(name, null);
    }

    /**
     * Normalizes a name for a specific kind. A {@code null} kind applies every rule.
     */
    public String normalize(String name, EntityKind kind) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name;
        for (NormalizationRule rule : rules) {
            if (kind == null || rule.appliesTo(kind)) {
                String before = result;
                result = rule.apply(result);
                if (log.isTraceEnabled() && !before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }

        String lowered = result.toLowerCase(Locale.ROOT).trim();
        return WHITESPACE.matcher(lowered).replaceAll(" ");
    }

    public boolean areEquivalent(String name1, String name2, EntityKind kind) {
        return normalize(name1, kind).equals(normalize(name2, kind));
    }

    private void sortRules() {
        // stable sort: rules sharing a priority keep insertion order
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}

package com.entity.network.conflation;

/**
 * A name that appears, whitespace-bounded, inside a longer name, e.g. "maxwell" in
 * "ghislaine maxwell". Not an asserted duplicate.
 */
public record PartialMatch(EntitySummary shorter, EntitySummary longer) {

    public String shorterName() {
        return shorter.normalizedName();
    }

    public String longerName() {
        return longer.normalizedName();
    }

    public boolean crossKind() {
        return shorter.kind() != longer.kind();
    }

    public Severity severity() {
        return Severity.ADVISORY;
    }
}

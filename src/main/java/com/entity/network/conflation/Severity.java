package com.entity.network.conflation;

/**
 * How a conflation finding should be treated.
 */
public enum Severity {
    /** The pipeline itself is broken; verification must fail. */
    INVARIANT_VIOLATION,
    /** Needs a human decision; never resolved automatically. */
    REVIEW,
    /** Informational; most findings are legitimately distinct entities. */
    ADVISORY
}

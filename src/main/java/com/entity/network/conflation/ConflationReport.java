package com.entity.network.conflation;

import java.util.List;
import java.util.Set;

/**
 * Findings of a conflation run, grouped by check. Each list is sorted deterministically.
 *
 * <p>Type conflicts and partial matches are never acted on automatically.</p>
 */
public record ConflationReport(
        int entitiesChecked,
        Set<ConflationCheck> checksRun,
        List<ResidualDuplicate> residualDuplicates,
        List<TypeConflict> typeConflicts,
        List<PartialMatch> partialMatches
) {
    public static final String ADVISORY_NOTE =
            "Partial matches are candidates for human review. Most are legitimately distinct entities "
                    + "(a surname inside a full name, a city inside an organization name) and none are merged.";

    public ConflationReport {
        checksRun = Set.copyOf(checksRun);
        residualDuplicates = List.copyOf(residualDuplicates);
        typeConflicts = List.copyOf(typeConflicts);
        partialMatches = List.copyOf(partialMatches);
    }

    public boolean hasResidualDuplicates() {
        return !residualDuplicates.isEmpty();
    }

    public boolean hasAdvisoryFindings() {
        return !typeConflicts.isEmpty() || !partialMatches.isEmpty();
    }

    public int totalFindings() {
        return residualDuplicates.size() + typeConflicts.size() + partialMatches.size();
    }

    public long crossKindPartialMatches() {
        return partialMatches.stream().filter(PartialMatch::crossKind).count();
    }

    /**
     * @throws DeduplicationInvariantViolationException if any residual duplicate was found
     */
    public void assertNoResidualDuplicates() {
        if (hasResidualDuplicates()) {
            throw new DeduplicationInvariantViolationException(residualDuplicates);
        }
    }
}

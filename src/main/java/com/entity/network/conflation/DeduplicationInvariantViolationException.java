package com.entity.network.conflation;

import java.util.List;

/**
 * Raised when canonical entities of one kind still share a normalized name after deduplication.
 * This is a defect in the pipeline, not in the data, and aborts the run.
 */
public class DeduplicationInvariantViolationException extends RuntimeException {

    private final List<ResidualDuplicate> residualDuplicates;

    public DeduplicationInvariantViolationException(List<ResidualDuplicate> residualDuplicates) {
        super(buildMessage(residualDuplicates));
        this.residualDuplicates = List.copyOf(residualDuplicates);
    }

    public List<ResidualDuplicate> getResidualDuplicates() {
        return residualDuplicates;
    }

    private static String buildMessage(List<ResidualDuplicate> duplicates) {
        StringBuilder sb = new StringBuilder();
        sb.append(duplicates.size()).append(" residual duplicate group(s) after deduplication");
        if (!duplicates.isEmpty()) {
            ResidualDuplicate first = duplicates.get(0);
            sb.append(", first: ").append(first.kind()).append(" '").append(first.normalizedName())
                    .append("' x").append(first.variants().size());
        }
        return sb.toString();
    }
}

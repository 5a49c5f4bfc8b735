package com.vidnyan.rulecov.domain.coverage;

/**
 * One unit of proof, or disproof, of coverage.
 */
public record CoverageEvidence(
    String type,
    String description,
    int count,
    int required
) {

    public boolean satisfied() {
        return count >= required;
    }
}

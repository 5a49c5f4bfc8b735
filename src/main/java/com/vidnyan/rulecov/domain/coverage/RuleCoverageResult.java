package com.vidnyan.rulecov.domain.coverage;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Coverage verdict of a whole rule.
 */
public record RuleCoverageResult(
    List<CoverageResult> coverage,
    List<String> uncoveredBranches,
    List<RedundantBranch> redundantBranches,
    boolean overallSuccess
) {

    public RuleCoverageResult {
        coverage = List.copyOf(coverage);
        uncoveredBranches = List.copyOf(uncoveredBranches);
        redundantBranches = List.copyOf(redundantBranches);
    }

    public static RuleCoverageResult empty(String reason) {
        return new RuleCoverageResult(List.of(), List.of(reason), List.of(), false);
    }

    public long coveredCount() {
        return coverage.stream().filter(CoverageResult::success).count();
    }

    public List<CoverageResult> inconclusive() {
        return coverage.stream().filter(CoverageResult::inconclusive).toList();
    }

    /**
     * Uncovered branches without the ones whose result is inconclusive, so that each
     * undecidable subject is reported once through {@link #inconclusive()}.
     */
    public List<String> conclusiveUncoveredBranches() {
        Set<String> undecided = inconclusive().stream()
                .map(CoverageResult::subject)
                .collect(Collectors.toSet());
        return uncoveredBranches.stream()
                .filter(branch -> !undecided.contains(branch))
                .toList();
    }
}

package com.vidnyan.rulecov.domain.coverage.strategy;

import com.vidnyan.rulecov.domain.coverage.CoverageResult;
import com.vidnyan.rulecov.domain.query.Conditional;

/**
 * Placeholder for conditional kinds without a coverage heuristic.
 * Always answers "unknown", never a genuine negative.
 */
public record UnimplementedStrategy(String what) implements ConditionalCoverageStrategy {

    @Override
    public CoverageResult check(Conditional conditional, String exampleContent) {
        return CoverageResult.notImplemented(
                ConditionalCoverageStrategy.subjectOf(conditional),
                what + " coverage check not implemented");
    }
}

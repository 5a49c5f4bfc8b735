package com.vidnyan.rulecov.domain.coverage.strategy;

import com.vidnyan.rulecov.domain.coverage.CoverageResult;
import com.vidnyan.rulecov.domain.query.Conditional;
import com.vidnyan.rulecov.domain.query.ConditionalKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Dispatch from conditional kind to coverage strategy.
 */
@Slf4j
@Component
public class ConditionalCoverageStrategies {

    private final ConditionalCoverageStrategy andOperator;
    private final ConditionalCoverageStrategy notCondition;
    private final ConditionalCoverageStrategy orBranch = new UnimplementedStrategy("Or branch");
    private final ConditionalCoverageStrategy ifCondition = new UnimplementedStrategy("If condition");
    private final ConditionalCoverageStrategy quantified = new UnimplementedStrategy("Quantified condition");
    private final ConditionalCoverageStrategy booleanFunction = new UnimplementedStrategy("Boolean function");

    public ConditionalCoverageStrategies(AndOperatorStrategy andOperator, NotConditionStrategy notCondition) {
        this.andOperator = andOperator;
        this.notCondition = notCondition;
    }

    public ConditionalCoverageStrategy strategyFor(ConditionalKind kind) {
        return switch (kind) {
            case AND -> andOperator;
            case NOT -> notCondition;
            case OR -> orBranch;
            case IF -> ifCondition;
            case QUANTIFIED -> quantified;
            case BOOLEAN_FUNCTION -> booleanFunction;
        };
    }

    public CoverageResult check(Conditional conditional, String exampleContent) {
        try {
            return strategyFor(conditional.kind()).check(conditional, exampleContent);
        } catch (RuntimeException e) {
            log.warn("Coverage strategy for {} failed: {}", conditional.kind(), e.getMessage());
            return CoverageResult.notImplemented(
                    ConditionalCoverageStrategy.subjectOf(conditional),
                    "Coverage check failed: " + e.getMessage());
        }
    }
}

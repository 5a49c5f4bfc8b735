package com.vidnyan.rulecov.domain.coverage.strategy;

import com.vidnyan.rulecov.domain.coverage.AttributeCoverageChecker;
import com.vidnyan.rulecov.domain.coverage.CoverageResult;
import com.vidnyan.rulecov.domain.coverage.NodeCoverageChecker;
import com.vidnyan.rulecov.domain.query.Conditional;
import com.vidnyan.rulecov.domain.query.ConditionalKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class ConditionalCoverageStrategiesTest {

    private final NodeCoverageChecker nodeChecker = new NodeCoverageChecker();
    private final ConditionalCoverageStrategies strategies = new ConditionalCoverageStrategies(
            new AndOperatorStrategy(nodeChecker, new AttributeCoverageChecker()),
            new NotConditionStrategy(nodeChecker));

    @ParameterizedTest
    @EnumSource(ConditionalKind.class)
    void strategyFor_ShouldCoverEveryKind(ConditionalKind kind) {
        assertNotNull(strategies.strategyFor(kind));
    }

    @ParameterizedTest
    @EnumSource(value = ConditionalKind.class, names = {"OR", "IF", "QUANTIFIED", "BOOLEAN_FUNCTION"})
    void check_ShouldMarkUnimplementedKindsInconclusive(ConditionalKind kind) {
        CoverageResult result = strategies.check(new Conditional(kind, "@A = 'x'", 0), "anything");

        assertFalse(result.success());
        assertTrue(result.inconclusive());
        assertTrue(result.message().endsWith("coverage check not implemented"));
        assertTrue(result.evidence().isEmpty());
    }

    @Test
    void check_ShouldDispatchAndConditions() {
        CoverageResult result = strategies.check(
                new Conditional(ConditionalKind.AND, "@Final = true() and @Static = true()", 7),
                "private static final Integer MAX = 10;");

        assertTrue(result.success());
        assertFalse(result.inconclusive());
        assertEquals("and \"@Final = true() and @Static = true()\"", result.subject());
    }
}

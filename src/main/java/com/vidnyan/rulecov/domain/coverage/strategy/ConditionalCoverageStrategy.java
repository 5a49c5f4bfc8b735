package com.vidnyan.rulecov.domain.coverage.strategy;

import com.vidnyan.rulecov.domain.coverage.CoverageResult;
import com.vidnyan.rulecov.domain.query.Conditional;

/**
 * Decides whether example text exercises one classified conditional.
 * Implementations are pure and tolerate arbitrary text.
 */
@FunctionalInterface
public interface ConditionalCoverageStrategy {

    int MAX_SUBJECT_EXPRESSION = 80;

    CoverageResult check(Conditional conditional, String exampleContent);

    /**
     * Identifier of a conditional in coverage listings, e.g. {@code and "@Final = true() and @Static = true()"}.
     */
    static String subjectOf(Conditional conditional) {
        String expression = conditional.expression() == null ? "" : conditional.expression().trim();
        if (expression.length() > MAX_SUBJECT_EXPRESSION) {
            expression = expression.substring(0, MAX_SUBJECT_EXPRESSION - 3) + "...";
        }
        return conditional.kind().label() + " \"" + expression + "\"";
    }
}

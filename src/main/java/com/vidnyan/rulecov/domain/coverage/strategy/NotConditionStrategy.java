package com.vidnyan.rulecov.domain.coverage.strategy;

import com.vidnyan.rulecov.domain.coverage.CodePatterns;
import com.vidnyan.rulecov.domain.coverage.CoverageEvidence;
import com.vidnyan.rulecov.domain.coverage.CoverageResult;
import com.vidnyan.rulecov.domain.coverage.NodeCoverageChecker;
import com.vidnyan.rulecov.domain.query.Conditional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Coverage of a NOT predicate. The excluded shape has to appear somewhere in
 * the examples, otherwise the exclusion is never exercised.
 */
@Component
@RequiredArgsConstructor
public class NotConditionStrategy implements ConditionalCoverageStrategy {

    private static final Pattern FIELD_ANCESTOR = Pattern.compile(
            "FieldDeclarationStatements|\\bField\\s*\\[|ancestor::Field", Pattern.CASE_INSENSITIVE);
    private static final Pattern NOT_SPLIT = Pattern.compile("[=<>!()\\[\\]:]+");
    private static final Set<String> STOP_WORDS = Set.of("ancestor", "ancestor-or-self", "parent", "child", "descendant");

    private final NodeCoverageChecker nodeChecker;

    @Override
    public CoverageResult check(Conditional conditional, String exampleContent) {
        String subject = ConditionalCoverageStrategy.subjectOf(conditional);
        String expression = conditional.expression() == null ? "" : conditional.expression().trim();
        if (expression.isEmpty()) {
            return CoverageResult.uncovered(subject, AndOperatorStrategy.NOTHING_TO_CHECK, List.of(), List.of());
        }
        String content = exampleContent == null ? "" : exampleContent;

        if (FIELD_ANCESTOR.matcher(expression).find()) {
            return checkStaticFinalField(subject, expression, content);
        }

        List<String> keywords = CodePatterns.keywords(expression, NOT_SPLIT, STOP_WORDS);
        List<String> present = keywords.stream()
                .filter(keyword -> nodeChecker.isTokenPresent(keyword, content))
                .toList();
        CoverageEvidence evidence = new CoverageEvidence(
                "negated_vocabulary",
                present.size() + "/" + keywords.size() + " negated keywords present",
                present.isEmpty() ? 0 : 1,
                1);
        if (!present.isEmpty()) {
            return CoverageResult.covered(subject,
                    "NOT condition \"" + expression + "\" is covered (excluded shape appears: "
                            + String.join(", ", present) + ")",
                    List.of(evidence));
        }
        return CoverageResult.uncovered(subject,
                "NOT condition \"" + expression + "\" is not covered - excluded shape never appears",
                List.of(evidence), List.of(expression));
    }

    private CoverageResult checkStaticFinalField(String subject, String expression, String content) {
        boolean found = content.lines()
                .anyMatch(line -> CodePatterns.matches(CodePatterns.FIELD_DECLARATION, line)
                        && CodePatterns.containsWord(line, "static")
                        && CodePatterns.containsWord(line, "final"));
        CoverageEvidence evidence = new CoverageEvidence(
                "static_final_field",
                found ? "static final field declaration found" : "no static final field declaration",
                found ? 1 : 0,
                1);
        if (found) {
            return CoverageResult.covered(subject,
                    "NOT condition \"" + expression + "\" is covered (static final field present)",
                    List.of(evidence));
        }
        return CoverageResult.uncovered(subject,
                "NOT condition \"" + expression + "\" is not covered - missing a static final field declaration",
                List.of(evidence), List.of("static final field"));
    }
}

package com.vidnyan.rulecov.domain.coverage.strategy;

import com.vidnyan.rulecov.domain.coverage.AttributeCoverageChecker;
import com.vidnyan.rulecov.domain.coverage.CodePatterns;
import com.vidnyan.rulecov.domain.coverage.CoverageEvidence;
import com.vidnyan.rulecov.domain.coverage.CoverageResult;
import com.vidnyan.rulecov.domain.coverage.NodeCoverageChecker;
import com.vidnyan.rulecov.domain.query.Conditional;
import com.vidnyan.rulecov.domain.query.QueryText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coverage of an AND predicate: every top-level part must be exercised.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AndOperatorStrategy implements ConditionalCoverageStrategy {

    static final String NOTHING_TO_CHECK = "No expression to check";

    private static final Pattern MODIFIER_FLAG = Pattern.compile("^@(\\w+)(?:\\s*=\\s*true\\s*\\(\\s*\\))?$");
    private static final Pattern BARE_ATTRIBUTE = Pattern.compile("^@(\\w+)$");
    private static final Pattern ATTRIBUTE_COMPARISON = Pattern.compile(
            "^@(\\w+)\\s*(?:!=|=|eq|ne)\\s*(\\$[\\w-]+|'[^']*'|\"[^\"]*\")$");
    private static final Pattern NODE_STEP = Pattern.compile("^(?:\\.?//?|\\w+(?:-\\w+)*::)(\\w+)");

    private final NodeCoverageChecker nodeChecker;
    private final AttributeCoverageChecker attributeChecker;

    @Override
    public CoverageResult check(Conditional conditional, String exampleContent) {
        String subject = ConditionalCoverageStrategy.subjectOf(conditional);
        String expression = conditional.expression() == null ? "" : conditional.expression().trim();
        if (expression.isEmpty()) {
            return CoverageResult.uncovered(subject, NOTHING_TO_CHECK, List.of(), List.of());
        }
        String content = exampleContent == null ? "" : exampleContent;

        List<String> parts = QueryText.splitTopLevel(expression, "and").stream()
                .map(QueryText.Segment::text)
                .toList();

        if (parts.stream().allMatch(part -> modifierKeyword(part).isPresent())) {
            return checkModifiers(subject, expression, parts, content);
        }
        if (parts.size() >= 2) {
            return checkParts(subject, expression, parts, content);
        }
        return checkKeywords(subject, expression, content);
    }

    private CoverageResult checkModifiers(String subject, String expression, List<String> parts, String content) {
        List<String> missingParts = new ArrayList<>();
        List<String> missingKeywords = new ArrayList<>();
        for (String part : parts) {
            String keyword = modifierKeyword(part).orElseThrow();
            if (!CodePatterns.containsWord(content, keyword)) {
                missingParts.add(part);
                missingKeywords.add("'" + keyword + "'");
            }
        }
        int satisfied = parts.size() - missingParts.size();
        CoverageEvidence evidence = new CoverageEvidence(
                "modifier_keywords",
                satisfied + "/" + parts.size() + " parts covered",
                missingParts.isEmpty() ? 1 : 0,
                1);
        if (missingParts.isEmpty()) {
            return CoverageResult.covered(subject,
                    "AND condition \"" + expression + "\" is covered (all " + parts.size() + " modifier keywords present)",
                    List.of(evidence));
        }
        String noun = missingKeywords.size() == 1 ? " keyword" : " keywords";
        return CoverageResult.uncovered(subject,
                "AND condition \"" + expression + "\" not fully covered - missing "
                        + String.join(", ", missingKeywords) + noun,
                List.of(evidence), missingParts);
    }

    private CoverageResult checkParts(String subject, String expression, List<String> parts, String content) {
        List<String> missing = new ArrayList<>();
        for (String part : parts) {
            if (!isPartCovered(part, content)) {
                missing.add(part);
            }
        }
        int satisfied = parts.size() - missing.size();
        CoverageEvidence evidence = new CoverageEvidence(
                "and_parts",
                "AND condition \"" + expression + "\" coverage (" + satisfied + "/" + parts.size() + " parts covered)",
                missing.isEmpty() ? 1 : 0,
                1);
        log.debug("AND parts covered {}/{} for {}", satisfied, parts.size(), expression);
        if (missing.isEmpty()) {
            return CoverageResult.covered(subject,
                    "AND condition \"" + expression + "\" is covered (all " + parts.size() + " parts satisfied)",
                    List.of(evidence));
        }
        return CoverageResult.uncovered(subject,
                "AND condition \"" + expression + "\" not fully covered - missing: " + String.join(", ", missing),
                List.of(evidence), missing);
    }

    private CoverageResult checkKeywords(String subject, String expression, String content) {
        List<String> keywords = CodePatterns.keywords(expression);
        long found = keywords.stream().filter(keyword -> nodeChecker.isTokenPresent(keyword, content)).count();
        CoverageEvidence evidence = new CoverageEvidence(
                "keywords", found + "/" + keywords.size() + " keywords found", found > 0 ? 1 : 0, 1);
        if (found > 0) {
            return CoverageResult.covered(subject, "Condition \"" + expression + "\" is covered", List.of(evidence));
        }
        return CoverageResult.uncovered(subject,
                "Condition \"" + expression + "\" is not covered - no keyword found in examples",
                List.of(evidence), List.of(expression));
    }

    /**
     * Heuristic coverage of one AND part.
     */
    boolean isPartCovered(String part, String content) {
        Optional<String> modifier = modifierKeyword(part);
        if (modifier.isPresent()) {
            return CodePatterns.containsWord(content, modifier.get());
        }
        Matcher bare = BARE_ATTRIBUTE.matcher(part);
        if (bare.find()) {
            return attributeChecker.isCovered(bare.group(1), null, content);
        }
        Matcher comparison = ATTRIBUTE_COMPARISON.matcher(part);
        if (comparison.find()) {
            String attribute = comparison.group(1);
            String value = comparison.group(2);
            if (value.startsWith("$")) {
                return switch (attribute) {
                    case "FullMethodName" -> CodePatterns.matches(CodePatterns.DOTTED_CALL, content);
                    case "MethodName" -> CodePatterns.containsCall(content);
                    default -> true;
                };
            }
            String literal = value.substring(1, value.length() - 1);
            return literal.isEmpty() || CodePatterns.containsIgnoreCase(content, literal);
        }
        Matcher step = NODE_STEP.matcher(part);
        if (step.find()) {
            return nodeChecker.isTokenPresent(step.group(1), content);
        }
        if (QueryText.isSingleCall(part, "not")) {
            String inner = QueryText.callArguments(part, 0).text();
            return CodePatterns.keywords(inner).stream()
                    .anyMatch(keyword -> nodeChecker.isTokenPresent(keyword, content));
        }
        return CodePatterns.keywords(part).stream()
                .anyMatch(keyword -> nodeChecker.isTokenPresent(keyword, content));
    }

    private Optional<String> modifierKeyword(String part) {
        Matcher matcher = MODIFIER_FLAG.matcher(part.trim());
        if (!matcher.find()) {
            return Optional.empty();
        }
        return CodePatterns.modifierKeyword(matcher.group(1));
    }
}

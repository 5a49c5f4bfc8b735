package com.vidnyan.rulecov.domain.coverage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether example code plausibly exercises a queried node attribute.
 */
@Slf4j
@Component
public class AttributeCoverageChecker {

    public static final String SUBJECT = "Attributes";

    private static final Pattern DECLARATION_NAME = Pattern.compile("\\b[\\w<>\\[\\],.]+\\s+(\\w+)\\s*[=;(]");

    public boolean isCovered(String attribute, String query, String content) {
        Optional<String> modifier = CodePatterns.modifierKeyword(attribute);
        if (modifier.isPresent()) {
            return CodePatterns.containsWord(content, modifier.get());
        }
        return switch (attribute) {
            case "FullMethodName" -> CodePatterns.matches(CodePatterns.DOTTED_CALL, content);
            case "MethodName" -> CodePatterns.containsCall(content);
            case "String" -> CodePatterns.matches(CodePatterns.STRING_LITERAL, content);
            case "Null" -> CodePatterns.containsWord(content, "null");
            case "LiteralType" -> CodePatterns.matches(CodePatterns.STRING_LITERAL, content)
                    || CodePatterns.matches(CodePatterns.NUMBER_LITERAL, content);
            case "Image" -> CodePatterns.matches(CodePatterns.STRING_LITERAL, content)
                    || CodePatterns.containsCall(content)
                    || CodePatterns.matches(DECLARATION_NAME, content);
            case "Nested" -> CodePatterns.matches(CodePatterns.NESTED_CLASS, content);
            case "Name", "Value" -> CodePatterns.matches(CodePatterns.ANNOTATION_PARAMETER, content)
                    || comparedLiteralsPresent(attribute, query, content).orElse(true);
            default -> comparedLiteralsPresent(attribute, query, content)
                    .orElseGet(() -> CodePatterns.containsIgnoreCase(content, attribute));
        };
    }

    public CoverageResult check(Set<String> attributes, String query, String content) {
        List<String> uncovered = new ArrayList<>();
        for (String attribute : attributes) {
            if (!isCovered(attribute, query, content)) {
                uncovered.add("@" + attribute);
            }
        }
        int covered = attributes.size() - uncovered.size();
        String fraction = covered + "/" + attributes.size() + " attributes covered";
        CoverageEvidence evidence = new CoverageEvidence("attributes", fraction, covered, attributes.size());
        log.debug("Attribute coverage: {}", fraction);
        if (uncovered.isEmpty()) {
            return CoverageResult.covered(SUBJECT, fraction, List.of(evidence));
        }
        return CoverageResult.uncovered(SUBJECT, fraction + ", missing: " + String.join(", ", uncovered),
                List.of(evidence), uncovered);
    }

    /**
     * Literals the query compares the attribute against, e.g. {@code @Visibility = 'public'}.
     * Empty when the query holds no such literal; otherwise whether any of them occurs.
     */
    private Optional<Boolean> comparedLiteralsPresent(String attribute, String query, String content) {
        if (query == null) {
            return Optional.empty();
        }
        Pattern comparison = Pattern.compile(
                "@" + Pattern.quote(attribute) + "\\s*(?:!=|=|eq|ne)\\s*(['\"])([^'\"]*)\\1");
        Matcher matcher = comparison.matcher(query);
        List<String> literals = new ArrayList<>();
        while (matcher.find()) {
            if (!matcher.group(2).isEmpty()) {
                literals.add(matcher.group(2));
            }
        }
        if (literals.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(literals.stream().anyMatch(literal -> CodePatterns.containsIgnoreCase(content, literal)));
    }
}

package com.vidnyan.rulecov.domain.quality;

import com.vidnyan.rulecov.domain.marker.Example;
import com.vidnyan.rulecov.domain.marker.Marker;
import com.vidnyan.rulecov.domain.marker.MarkerKind;
import com.vidnyan.rulecov.domain.marker.MarkerSyntax;
import com.vidnyan.rulecov.domain.query.QueryAnalyzer;
import com.vidnyan.rulecov.domain.rule.RuleMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Publication checks of a rule file, stricter than {@link RuleQualityChecker}.
 * Every finding is an issue. The result is reported on its own and does not decide
 * whether the rule passed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StrictQualityChecker {

    static final int MAX_MESSAGE_LENGTH = 80;
    static final String VERSION_REQUIRED = "description must end with 'Version: X.Y.Z' (SemVer format)";
    static final String VIOLATION_MARKER_REQUIRED = "at least one violation marker (// Violation or // ❌) required";
    static final String FORBIDDEN_CALL = "testMethod(";

    private static final Pattern VERSION = Pattern.compile("^Version:\\s*(\\d+)\\.(\\d+)\\.(\\d+)$");
    private static final Pattern VARIABLE_DOC = Pattern.compile("^(?:[-*]\\s+)?(\\$[a-zA-Z_][a-zA-Z0-9_]*):\\s*.+$");
    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^['\"]|['\"]$");
    private static final Set<String> PLACEHOLDERS = Set.of("Inline violation marker", "Inline valid marker");

    private final QueryAnalyzer queryAnalyzer;
    private final RuleQualityChecker ruleQualityChecker;

    public QualityReport check(RuleMetadata metadata, List<Example> examples) {
        List<String> issues = new ArrayList<>();
        checkMessage(metadata.message(), issues);
        checkVersion(metadata.description(), issues);
        Map<String, String> letVariables = metadata.hasQuery()
                ? queryAnalyzer.analyze(metadata.query()).letVariables()
                : Map.of();
        checkHardcodedValues(metadata.query(), letVariables, issues);
        checkVariableDocumentation(letVariables, metadata.description(), issues);
        checkMarkerDescriptions(examples, issues);
        checkForbiddenCalls(examples, issues);
        if (examples.stream().allMatch(example -> example.violationMarkers().isEmpty())) {
            issues.add(VIOLATION_MARKER_REQUIRED);
        }
        ruleQualityChecker.checkDuplicates(examples, issues);
        if (!issues.isEmpty()) {
            log.debug("Strict quality issues: {}", issues);
        }
        return new QualityReport(issues, List.of());
    }

    void checkMessage(String message, List<String> issues) {
        if (message == null || message.isEmpty()) {
            issues.add("message attribute is missing");
        } else if (message.length() > MAX_MESSAGE_LENGTH) {
            issues.add("message attribute exceeds " + MAX_MESSAGE_LENGTH + " characters ("
                    + message.length() + " chars)");
        }
    }

    void checkVersion(String description, List<String> issues) {
        List<String> lines = MarkerSyntax.lines(description == null ? "" : description.strip());
        if (lines.isEmpty() || !VERSION.matcher(lines.get(lines.size() - 1).trim()).matches()) {
            issues.add(VERSION_REQUIRED);
        }
    }

    /**
     * Literals outside the initial {@code let} clause, unless a let variable binds the same value.
     */
    void checkHardcodedValues(String query, Map<String, String> letVariables, List<String> issues) {
        Set<String> bound = letVariables.values().stream()
                .map(this::normalizeLiteral)
                .collect(Collectors.toSet());
        for (HardcodedValueScanner.HardcodedValue value : HardcodedValueScanner.scan(query)) {
            if (!bound.contains(normalizeLiteral(value.value()))) {
                issues.add(value.value() + " outside initial let statement");
            }
        }
    }

    void checkVariableDocumentation(Map<String, String> letVariables, String description, List<String> issues) {
        Set<String> documented = MarkerSyntax.lines(description == null ? "" : description).stream()
                .map(line -> VARIABLE_DOC.matcher(line.trim()))
                .filter(Matcher::matches)
                .map(matcher -> matcher.group(1))
                .collect(Collectors.toSet());
        for (String name : letVariables.keySet()) {
            String variable = "$" + name;
            if (!documented.contains(variable)) {
                issues.add("variable " + variable + " undocumented");
            }
        }
    }

    /**
     * Every marker needs its own text. Descriptions are compared across both kinds and all examples.
     */
    void checkMarkerDescriptions(List<Example> examples, List<String> issues) {
        Map<String, List<String>> locations = new LinkedHashMap<>();
        for (Example example : examples) {
            List<Marker> markers = example.allMarkers()
                    .sorted(Comparator.comparingInt(Marker::lineNumber))
                    .toList();
            for (Marker marker : markers) {
                String location = "Example " + example.exampleIndex() + " line " + marker.lineNumber();
                String description = markerDescription(example, marker);
                if (description.isEmpty()) {
                    issues.add(location + ": " + marker.kind().displayName().toLowerCase(Locale.ROOT)
                            + " has no description");
                } else {
                    locations.computeIfAbsent(description, k -> new ArrayList<>()).add(location);
                }
            }
        }
        locations.forEach((description, where) -> {
            for (int i = 1; i < where.size(); i++) {
                issues.add(where.get(i) + ": duplicate description '" + description + "' (" + where.get(0) + ")");
            }
        });
    }

    void checkForbiddenCalls(List<Example> examples, List<String> issues) {
        for (Example example : examples) {
            if (example.content().contains(FORBIDDEN_CALL)) {
                issues.add("Example " + example.exampleIndex() + ": You can't call a method testMethod in examples");
            }
        }
    }

    private String markerDescription(Example example, Marker marker) {
        List<String> lines = example.lines();
        int index = marker.lineNumber() - 1;
        if (index >= 0 && index < lines.size()) {
            String line = lines.get(index);
            Optional<MarkerSyntax.InlineMatch> inline = MarkerSyntax.inline(line);
            if (inline.isPresent() && inline.get().kind() == marker.kind()) {
                return inline.get().description();
            }
            Optional<MarkerSyntax.HeaderMatch> header = MarkerSyntax.header(line);
            if (header.isPresent() && header.get().kind() == marker.kind()) {
                return header.get().description();
            }
        }
        String description = marker.description() == null ? "" : marker.description().trim();
        return PLACEHOLDERS.contains(description) || isKindName(description, marker.kind()) ? "" : description;
    }

    private boolean isKindName(String description, MarkerKind kind) {
        return description.equals(kind.displayName());
    }

    private String normalizeLiteral(String value) {
        return SURROUNDING_QUOTES.matcher(value).replaceAll("").toLowerCase(Locale.ROOT).trim();
    }
}

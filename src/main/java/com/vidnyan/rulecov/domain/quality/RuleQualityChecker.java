package com.vidnyan.rulecov.domain.quality;

import com.vidnyan.rulecov.domain.marker.Example;
import com.vidnyan.rulecov.domain.marker.MarkerSyntax;
import com.vidnyan.rulecov.domain.rule.RuleMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static quality checks of a rule: metadata, examples and duplicated example code.
 */
@Slf4j
@Component
public class RuleQualityChecker {

    public static final String VIOLATION_REQUIRED = "At least one violation example is required";

    private static final int MIN_NAME_LENGTH = 3;
    private static final int MIN_MESSAGE_LENGTH = 10;
    private static final int MIN_DESCRIPTION_LENGTH = 20;
    private static final int MIN_DUPLICATE_LENGTH = 10;

    public QualityReport check(RuleMetadata metadata, List<Example> examples) {
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        checkMetadata(metadata, issues, warnings);
        checkExamples(examples, issues, warnings);
        checkDuplicates(examples, warnings);
        if (!issues.isEmpty()) {
            log.debug("Quality issues: {}", issues);
        }
        return new QualityReport(issues, warnings);
    }

    void checkMetadata(RuleMetadata metadata, List<String> issues, List<String> warnings) {
        if (isBlank(metadata.ruleName())) {
            issues.add("Rule name is missing");
        } else if (metadata.ruleName().length() < MIN_NAME_LENGTH) {
            warnings.add("Rule name is very short (less than " + MIN_NAME_LENGTH + " characters)");
        }
        if (isBlank(metadata.message())) {
            issues.add("Rule message is missing");
        } else if (metadata.message().length() < MIN_MESSAGE_LENGTH) {
            warnings.add("Rule message is very short (less than " + MIN_MESSAGE_LENGTH + " characters)");
        }
        if (isBlank(metadata.description())) {
            warnings.add("Rule description is missing (recommended)");
        } else if (metadata.description().length() < MIN_DESCRIPTION_LENGTH) {
            warnings.add("Rule description is very short (less than " + MIN_DESCRIPTION_LENGTH + " characters)");
        }
        if (!metadata.hasQuery()) {
            issues.add("Rule query expression is missing");
            return;
        }
        List<HardcodedValueScanner.HardcodedValue> hardcoded = HardcodedValueScanner.scan(metadata.query());
        if (!hardcoded.isEmpty()) {
            warnings.add("Query contains hardcoded values that should be parameterized: "
                    + hardcoded.stream().map(HardcodedValueScanner.HardcodedValue::value)
                            .distinct()
                            .collect(Collectors.joining(", ")));
        }
    }

    void checkExamples(List<Example> examples, List<String> issues, List<String> warnings) {
        if (examples.isEmpty()) {
            issues.add("No examples found in rule");
            return;
        }
        boolean anyViolationMarker = examples.stream().anyMatch(e -> !e.violationMarkers().isEmpty());
        if (!anyViolationMarker) {
            issues.add(VIOLATION_REQUIRED);
        }
        for (Example example : examples) {
            int n = example.exampleIndex();
            boolean hasCode = !example.violations().isEmpty() || !example.valids().isEmpty();
            int markerCount = example.violationMarkers().size() + example.validMarkers().size();
            if (!hasCode && markerCount == 0) {
                issues.add("Example " + n + " contains no code");
                continue;
            }
            if (example.violationMarkers().isEmpty()) {
                warnings.add("Example " + n + " has no violation markers");
            }
            if (example.validMarkers().isEmpty()) {
                warnings.add("Example " + n + " has no valid markers");
            }
            if (!example.violations().isEmpty() && example.violationMarkers().isEmpty()) {
                warnings.add("Example " + n + " has violations but no violation markers");
            }
            if (!example.valids().isEmpty() && example.validMarkers().isEmpty()) {
                warnings.add("Example " + n + " has valid code but no valid markers");
            }
            if (markerCount == 0) {
                warnings.add("Example " + n + " has code but no markers");
            } else if (!hasCode) {
                warnings.add("Example " + n + " has markers but no code");
            }
        }
    }

    void checkDuplicates(List<Example> examples, List<String> warnings) {
        Map<String, Set<Integer>> seenIn = new LinkedHashMap<>();
        for (Example example : examples) {
            for (String line : example.lines()) {
                String normalized = normalize(line);
                if (normalized.length() > MIN_DUPLICATE_LENGTH) {
                    seenIn.computeIfAbsent(normalized, k -> new LinkedHashSet<>()).add(example.exampleIndex());
                }
            }
        }
        seenIn.forEach((line, indexes) -> {
            if (indexes.size() > 1) {
                warnings.add("Duplicate code in examples " + indexes.stream()
                        .map(String::valueOf)
                        .collect(Collectors.joining(", ")) + ": " + line);
            }
        });
    }

    private String normalize(String line) {
        if (MarkerSyntax.isComment(line) && MarkerSyntax.inline(line).isEmpty()) {
            return "";
        }
        return MarkerSyntax.codePart(line).replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.vidnyan.rulecov.domain.oracle;

import com.vidnyan.rulecov.domain.marker.Example;
import com.vidnyan.rulecov.domain.marker.LineRange;
import com.vidnyan.rulecov.domain.marker.Marker;
import com.vidnyan.rulecov.domain.marker.MarkerKind;
import com.vidnyan.rulecov.domain.marker.MarkerSpans;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Reconciles an example's markers with the violations the engine reported.
 * <p>
 * Fixtures keep example line positions, so a reported line is compared
 * directly with marker spans. A violation test passes when at least one
 * reported violation falls in a violation marker's span; a valid test passes
 * when none falls in a valid marker's span.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TestOracle {

    private final LineNumberRecovery lineNumberRecovery;

    public ExampleTestResult evaluate(Path ruleFile, Example example, MarkerKind testType, EngineOutcome outcome) {
        List<Marker> markers = example.markers(testType);
        if (markers.isEmpty()) {
            throw new IllegalArgumentException(
                    "Example " + example.exampleIndex() + " has no " + testType + " markers to test");
        }
        if (!outcome.success()) {
            log.warn("Example {} {} test: engine failed: {}", example.exampleIndex(), testType, outcome.error());
            return failed(ruleFile, example, testType, "Engine invocation failed: " + outcome.error());
        }
        return testType == MarkerKind.VIOLATION
                ? judgeViolations(ruleFile, example, markers, outcome.violations())
                : judgeValids(ruleFile, example, markers, outcome.violations());
    }

    /**
     * A failed result for a half that could not be run, with the line of its first marker.
     */
    public ExampleTestResult failed(Path ruleFile, Example example, MarkerKind testType, String reason) {
        Marker first = example.markers(testType).isEmpty() ? null : example.markers(testType).get(0);
        return new ExampleTestResult(example.exampleIndex(), testType, false,
                lineOf(ruleFile, example, first), reason);
    }

    private ExampleTestResult judgeViolations(Path ruleFile, Example example, List<Marker> markers,
                                              List<ToolViolation> violations) {
        long attributed = violations.stream()
                .filter(violation -> markers.stream().anyMatch(marker -> attributable(violation, marker, example)))
                .count();
        boolean passed = attributed > 0;
        Marker focus = passed
                ? markers.get(0)
                : markers.stream()
                        .filter(marker -> violations.stream().noneMatch(v -> attributable(v, marker, example)))
                        .findFirst()
                        .orElse(markers.get(0));
        String description = passed
                ? attributed + " violation(s) reported on marked lines"
                : "Expected a violation on marked lines but engine reported "
                        + (violations.isEmpty() ? "none" : "only " + lines(violations));
        return new ExampleTestResult(example.exampleIndex(), MarkerKind.VIOLATION, passed,
                lineOf(ruleFile, example, focus), description);
    }

    private ExampleTestResult judgeValids(Path ruleFile, Example example, List<Marker> markers,
                                          List<ToolViolation> violations) {
        Optional<Marker> hit = markers.stream()
                .filter(marker -> violations.stream().anyMatch(v -> attributable(v, marker, example)))
                .findFirst();
        boolean passed = hit.isEmpty();
        Marker focus = hit.orElse(markers.get(0));
        String description = passed
                ? "No violations reported on valid lines"
                : "Unexpected violation on valid lines: " + lines(violations.stream()
                        .filter(v -> attributable(v, focus, example))
                        .toList());
        return new ExampleTestResult(example.exampleIndex(), MarkerKind.VALID, passed,
                lineOf(ruleFile, example, focus), description);
    }

    static boolean attributable(ToolViolation violation, Marker marker, Example example) {
        LineRange span = MarkerSpans.of(marker, example);
        return span.contains(violation.line());
    }

    private Integer lineOf(Path ruleFile, Example example, Marker marker) {
        if (marker == null || ruleFile == null) {
            return null;
        }
        OptionalInt line = lineNumberRecovery.recover(ruleFile, example, marker);
        return line.isPresent() ? line.getAsInt() : null;
    }

    private String lines(List<ToolViolation> violations) {
        return violations.stream()
                .map(v -> "line " + v.line())
                .distinct()
                .reduce((a, b) -> a + ", " + b)
                .orElse("none");
    }
}

package com.vidnyan.rulecov.domain.coverage;

import com.vidnyan.rulecov.domain.marker.Example;
import com.vidnyan.rulecov.domain.marker.LineRange;
import com.vidnyan.rulecov.domain.marker.Marker;
import com.vidnyan.rulecov.domain.marker.MarkerKind;
import com.vidnyan.rulecov.domain.marker.MarkerSpans;
import com.vidnyan.rulecov.domain.marker.MarkerSyntax;
import com.vidnyan.rulecov.domain.oracle.ExampleTestResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Line coverage of example code within one rule run.
 * A code line is hit when it lies in the span of a marker whose test passed.
 * Not thread-safe; owned by the task running the rule.
 */
public class CoverageLineTracker {

    /**
     * Line coverage of a rule's examples.
     *
     * @param totalLines   executable example lines
     * @param coveredLines lines hit at least once
     * @param uncovered    uncovered lines as {@code "example N line L"}
     */
    public record Summary(int totalLines, int coveredLines, List<String> uncovered) {

        public double percentage() {
            return totalLines == 0 ? 0.0 : 100.0 * coveredLines / totalLines;
        }
    }

    private final Map<Integer, Map<Integer, Integer>> hitsByExample = new TreeMap<>();

    public void record(Example example, List<ExampleTestResult> results) {
        Map<Integer, Integer> hits = hitsByExample.computeIfAbsent(example.exampleIndex(), k -> new TreeMap<>());
        List<String> lines = example.lines();
        for (int i = 0; i < lines.size(); i++) {
            if (isCode(lines.get(i))) {
                hits.putIfAbsent(i + 1, 0);
            }
        }
        for (MarkerKind kind : MarkerKind.values()) {
            boolean passed = results.stream()
                    .anyMatch(r -> r.exampleIndex() == example.exampleIndex() && r.testType() == kind && r.passed());
            if (!passed) {
                continue;
            }
            for (Marker marker : example.markers(kind)) {
                LineRange span = MarkerSpans.of(marker, example);
                hits.replaceAll((line, count) -> span.contains(line) ? count + 1 : count);
            }
        }
    }

    public Summary summary() {
        int total = 0;
        int covered = 0;
        List<String> uncovered = new ArrayList<>();
        for (Map.Entry<Integer, Map<Integer, Integer>> example : hitsByExample.entrySet()) {
            for (Map.Entry<Integer, Integer> line : example.getValue().entrySet()) {
                total++;
                if (line.getValue() > 0) {
                    covered++;
                } else {
                    uncovered.add("example " + example.getKey() + " line " + line.getKey());
                }
            }
        }
        return new Summary(total, covered, uncovered);
    }

    private boolean isCode(String line) {
        if (MarkerSyntax.codePart(line).isEmpty()) {
            return false;
        }
        return MarkerSyntax.inline(line).isPresent() || !MarkerSyntax.isComment(line);
    }
}

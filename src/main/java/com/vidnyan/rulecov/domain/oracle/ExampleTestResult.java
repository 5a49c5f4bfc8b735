package com.vidnyan.rulecov.domain.oracle;

import com.vidnyan.rulecov.domain.marker.MarkerKind;

import java.util.Locale;

/**
 * Oracle verdict for one half (violation or valid) of one example.
 *
 * @param exampleIndex 1-based example index
 * @param testType     which half was tested
 * @param passed       whether the engine agreed with the markers
 * @param lineNumber   best-effort line in the rule file, null when unknown
 * @param description  what was observed
 */
public record ExampleTestResult(
    int exampleIndex,
    MarkerKind testType,
    boolean passed,
    Integer lineNumber,
    String description
) {

    public boolean hasLineNumber() {
        return lineNumber != null;
    }

    public String label() {
        return "Example " + exampleIndex + " " + testType.displayName().toLowerCase(Locale.ROOT) + " test";
    }
}

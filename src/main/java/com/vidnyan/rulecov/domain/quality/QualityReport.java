package com.vidnyan.rulecov.domain.quality;

import java.util.List;

/**
 * Findings of the rule quality checks.
 */
public record QualityReport(List<String> issues, List<String> warnings) {

    public QualityReport {
        issues = List.copyOf(issues);
        warnings = List.copyOf(warnings);
    }

    public boolean passed() {
        return issues.isEmpty();
    }
}

package com.vidnyan.rulecov.domain.rule;

import com.vidnyan.rulecov.domain.coverage.CoverageLineTracker;
import com.vidnyan.rulecov.domain.coverage.RuleCoverageResult;
import com.vidnyan.rulecov.domain.oracle.ExampleTestResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Final outcome of testing one rule file.
 *
 * @param ruleFile        tested file
 * @param metadata        rule metadata
 * @param exampleCount    number of examples found
 * @param exampleResults  oracle verdicts in example order
 * @param coverage        query coverage, reported next to but not gating {@code passed}
 * @param lineCoverage    example line coverage
 * @param qualityIssues   problems that fail the rule
 * @param qualityWarnings problems worth fixing that do not fail the rule
 * @param strictIssues    publication checks, reported next to but not gating {@code passed}
 * @param passed          true when examples exist, no quality issue was found and every test passed
 * @param durationMs      wall time of the run
 */
public record RuleTestReport(
    Path ruleFile,
    RuleMetadata metadata,
    int exampleCount,
    List<ExampleTestResult> exampleResults,
    RuleCoverageResult coverage,
    CoverageLineTracker.Summary lineCoverage,
    List<String> qualityIssues,
    List<String> qualityWarnings,
    List<String> strictIssues,
    boolean passed,
    long durationMs
) {

    public RuleTestReport {
        exampleResults = List.copyOf(exampleResults);
        qualityIssues = List.copyOf(qualityIssues);
        qualityWarnings = List.copyOf(qualityWarnings);
        strictIssues = List.copyOf(strictIssues);
    }

    /**
     * Report for a rule file that could not be read.
     */
    public static RuleTestReport unreadable(Path ruleFile, String reason, long durationMs) {
        return new RuleTestReport(ruleFile, RuleMetadata.empty(), 0, List.of(),
                RuleCoverageResult.empty("Rule file could not be read"),
                new CoverageLineTracker.Summary(0, 0, List.of()),
                List.of(reason), List.of(), List.of(), false, durationMs);
    }

    public long passedCount() {
        return exampleResults.stream().filter(ExampleTestResult::passed).count();
    }

    public List<ExampleTestResult> failures() {
        return exampleResults.stream().filter(r -> !r.passed()).toList();
    }
}

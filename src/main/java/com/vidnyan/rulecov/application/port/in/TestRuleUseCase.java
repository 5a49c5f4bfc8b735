package com.vidnyan.rulecov.application.port.in;

import com.vidnyan.rulecov.domain.rule.RuleTestReport;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: verify rule files against their annotated examples.
 */
public interface TestRuleUseCase {

    /**
     * Test one rule file.
     * @param request Rule file and example concurrency
     * @return Report with oracle verdicts and coverage
     * @throws com.vidnyan.rulecov.domain.rule.RuleValidationException when the file has no examples
     */
    RuleTestReport testRuleFile(RuleTestRequest request);

    /**
     * Test a batch of rule files. Never aborts; a file that fails is reported in its entry.
     */
    BatchReport testRuleFiles(List<Path> ruleFiles, int exampleConcurrency);

    /**
     * Rule test request parameters.
     */
    record RuleTestRequest(
        Path ruleFile,
        int exampleConcurrency
    ) {
        public static RuleTestRequest forFile(Path ruleFile) {
            return new RuleTestRequest(ruleFile, Runtime.getRuntime().availableProcessors());
        }
    }

    /**
     * Outcome for one file of a batch: a report, or the error that prevented one.
     */
    record BatchEntry(
        Path ruleFile,
        RuleTestReport report,
        String error
    ) {
        public boolean passed() {
            return report != null && report.passed();
        }
    }

    /**
     * Batch result, entries in input order.
     */
    record BatchReport(
        List<BatchEntry> entries,
        long totalDurationMs
    ) {
        public long passedCount() {
            return entries.stream().filter(BatchEntry::passed).count();
        }

        public boolean allPassed() {
            return entries.stream().allMatch(BatchEntry::passed);
        }
    }
}

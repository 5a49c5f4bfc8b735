package com.vidnyan.rulecov.adapter.in.cli;

import com.vidnyan.rulecov.RuleCovProperties;
import com.vidnyan.rulecov.application.port.in.TestRuleUseCase;
import com.vidnyan.rulecov.application.port.in.TestRuleUseCase.BatchEntry;
import com.vidnyan.rulecov.application.port.in.TestRuleUseCase.BatchReport;
import com.vidnyan.rulecov.application.port.out.ReportWriter;
import com.vidnyan.rulecov.domain.coverage.RedundantBranch;
import com.vidnyan.rulecov.domain.oracle.ExampleTestResult;
import com.vidnyan.rulecov.domain.rule.RuleTestReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI Runner for rule testing.
 * Runs when the rulecov.rule-files property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleTestCliRunner implements CommandLineRunner {

    private final TestRuleUseCase testRuleUseCase;
    private final ReportWriter reportWriter;
    private final RuleCovProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) throws Exception {
        if (properties.getRuleFiles().isEmpty()) {
            log.info("No rule files specified. Set rulecov.rule-files property.");
            return;
        }

        int exitCode = 1;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║              RuleCov - Rule Coverage Verifier                 ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Rule files: {}", properties.getRuleFiles().size());
            log.info("║ Engine:     {}", truncate(properties.getEngine().getCommand(), 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            List<Path> ruleFiles = properties.getRuleFiles().stream().map(Path::of).toList();
            BatchReport batch = testRuleUseCase.testRuleFiles(ruleFiles, properties.effectiveExampleConcurrency());

            batch.entries().forEach(this::printEntry);
            printSummary(batch);
            writeReport(batch);
            exitCode = batch.allPassed() ? 0 : 1;
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printEntry(BatchEntry entry) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" {}", entry.ruleFile());
        log.info("═══════════════════════════════════════════════════════════════");
        if (entry.report() == null) {
            log.info(" ❌ ERROR: {}", entry.error());
            return;
        }
        RuleTestReport report = entry.report();
        log.info(" Rule:      {}", report.metadata().ruleName() != null ? report.metadata().ruleName() : "(unnamed)");
        log.info(" Examples:  {}", report.exampleCount());
        log.info(" Tests:     {}/{} passed", report.passedCount(), report.exampleResults().size());
        log.info(" Duration:  {}ms", report.durationMs());
        log.info("───────────────────────────────────────────────────────────────");

        for (ExampleTestResult result : report.exampleResults()) {
            String line = result.hasLineNumber() ? " (line " + result.lineNumber() + ")" : "";
            log.info(" {} {}{}: {}", result.passed() ? "✅" : "❌", result.label(), line, result.description());
        }

        log.info("───────────────────────────────────────────────────────────────");
        log.info(" COVERAGE: {}/{} checks satisfied",
                report.coverage().coveredCount(), report.coverage().coverage().size());
        report.coverage().conclusiveUncoveredBranches().forEach(branch -> log.info("   ⚠️  Uncovered: {}", branch));
        report.coverage().inconclusive().forEach(result -> log.info("   ❔ {}", result.message()));
        for (RedundantBranch redundant : report.coverage().redundantBranches()) {
            log.info("   🔁 {}", redundant.describe());
        }
        log.info(" LINES:    {}/{} ({}%)", report.lineCoverage().coveredLines(),
                report.lineCoverage().totalLines(), String.format("%.1f", report.lineCoverage().percentage()));

        report.qualityIssues().forEach(issue -> log.info(" 🔴 Issue:   {}", issue));
        report.qualityWarnings().forEach(warning -> log.info(" 🟡 Warning: {}", warning));
        report.strictIssues().forEach(issue -> log.info(" 🔵 Strict:  {}", issue));
        log.info(" RESULT: {}", report.passed() ? "✅ PASSED" : "❌ FAILED");
    }

    private void printSummary(BatchReport batch) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" SUMMARY: {}/{} rule files passed in {}ms",
                batch.passedCount(), batch.entries().size(), batch.totalDurationMs());
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private void writeReport(BatchReport batch) {
        String output = properties.getReport().getOutput();
        if (output == null || output.isBlank()) {
            return;
        }
        try {
            reportWriter.write(batch, Path.of(output));
        } catch (IOException e) {
            log.error("Failed to write report to {}: {}", output, e.getMessage());
        }
    }

    private String truncate(String value, int maxLen) {
        if (value.length() <= maxLen) {
            return value;
        }
        return "..." + value.substring(value.length() - maxLen + 3);
    }
}

package com.vidnyan.rulecov.application.service;

import com.vidnyan.rulecov.RuleCovProperties;
import com.vidnyan.rulecov.application.port.in.TestRuleUseCase;
import com.vidnyan.rulecov.application.port.out.FixtureGenerator;
import com.vidnyan.rulecov.application.port.out.FixtureGenerator.FixtureRequest;
import com.vidnyan.rulecov.application.port.out.FixtureGenerator.FixtureResult;
import com.vidnyan.rulecov.application.port.out.RuleEngineGateway;
import com.vidnyan.rulecov.application.port.out.RuleFileReader;
import com.vidnyan.rulecov.application.port.out.SyntaxTreeParser;
import com.vidnyan.rulecov.domain.coverage.CoverageAggregator;
import com.vidnyan.rulecov.domain.coverage.CoverageLineTracker;
import com.vidnyan.rulecov.domain.coverage.RuleCoverageResult;
import com.vidnyan.rulecov.domain.marker.Example;
import com.vidnyan.rulecov.domain.marker.ExampleParser;
import com.vidnyan.rulecov.domain.marker.MarkerKind;
import com.vidnyan.rulecov.domain.oracle.EngineOutcome;
import com.vidnyan.rulecov.domain.oracle.ExampleTestResult;
import com.vidnyan.rulecov.domain.oracle.TestOracle;
import com.vidnyan.rulecov.domain.quality.QualityReport;
import com.vidnyan.rulecov.domain.quality.RuleQualityChecker;
import com.vidnyan.rulecov.domain.quality.StrictQualityChecker;
import com.vidnyan.rulecov.domain.rule.RuleDocument;
import com.vidnyan.rulecov.domain.rule.RuleFileReadException;
import com.vidnyan.rulecov.domain.rule.RuleTestReport;
import com.vidnyan.rulecov.domain.rule.RuleValidationException;
import com.vidnyan.rulecov.domain.syntax.SyntaxNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Orchestrates testing of rule files.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleTestService implements TestRuleUseCase {

    private final RuleFileReader ruleFileReader;
    private final FixtureGenerator fixtureGenerator;
    private final RuleEngineGateway ruleEngineGateway;
    private final SyntaxTreeParser syntaxTreeParser;
    private final ExampleParser exampleParser;
    private final RuleQualityChecker qualityChecker;
    private final StrictQualityChecker strictQualityChecker;
    private final CoverageAggregator coverageAggregator;
    private final TestOracle testOracle;
    private final RuleCovProperties properties;

    @Override
    public RuleTestReport testRuleFile(RuleTestRequest request) {
        Instant startTime = Instant.now();
        Path ruleFile = request.ruleFile();
        log.info("Testing rule file: {}", ruleFile);

        // Step 1: Read rule file
        log.info("Step 1: Reading rule file...");
        RuleDocument document;
        try {
            document = ruleFileReader.read(ruleFile);
        } catch (RuleFileReadException e) {
            log.warn("Cannot read rule file {}: {}", ruleFile, e.getMessage());
            return RuleTestReport.unreadable(ruleFile, "Rule file could not be read: " + e.getMessage(),
                    elapsed(startTime));
        }

        // Step 2: Validate
        if (document.examples().isEmpty()) {
            throw new RuleValidationException("Rule file " + ruleFile + " has no examples");
        }
        String query = document.metadata().query();

        // Step 3: Extract markers
        log.info("Step 2: Extracting markers from {} examples...", document.examples().size());
        List<Example> examples = new ArrayList<>();
        List<SyntaxNode> trees = new ArrayList<>();
        for (RuleDocument.ExampleBlock block : document.examples()) {
            Optional<SyntaxNode> tree = parseTree(block);
            tree.ifPresent(trees::add);
            examples.add(exampleParser.parse(block.content(), block.exampleIndex(), query, tree.orElse(null)));
        }

        // Step 4: Quality checks
        log.info("Step 3: Checking rule quality...");
        QualityReport quality = qualityChecker.check(document.metadata(), examples);
        QualityReport strict = strictQualityChecker.check(document.metadata(), examples);
        log.info("Quality: {} issues, {} warnings, {} strict issues", quality.issues().size(),
                quality.warnings().size(), strict.issues().size());

        // Step 5: Run examples through the engine
        log.info("Step 4: Running examples (concurrency {})...", request.exampleConcurrency());
        List<ExampleTestResult> results = runExamples(ruleFile, examples, request.exampleConcurrency());

        // Step 6: Coverage
        log.info("Step 5: Aggregating coverage...");
        RuleCoverageResult coverage = coverageAggregator.aggregate(query, examples, trees);
        CoverageLineTracker lineTracker = new CoverageLineTracker();
        examples.forEach(example -> lineTracker.record(example, results));

        boolean passed = quality.passed() && results.stream().allMatch(ExampleTestResult::passed);
        long durationMs = elapsed(startTime);
        log.info("Rule {} {} in {}ms ({}/{} tests passed)", document.metadata().ruleName(),
                passed ? "passed" : "failed", durationMs,
                results.stream().filter(ExampleTestResult::passed).count(), results.size());

        return new RuleTestReport(ruleFile, document.metadata(), examples.size(), results, coverage,
                lineTracker.summary(), quality.issues(), quality.warnings(), strict.issues(), passed, durationMs);
    }

    @Override
    public BatchReport testRuleFiles(List<Path> ruleFiles, int exampleConcurrency) {
        Instant startTime = Instant.now();
        log.info("Testing {} rule files", ruleFiles.size());
        List<Callable<RuleTestReport>> tasks = ruleFiles.stream()
                .<Callable<RuleTestReport>>map(file -> () -> testRuleFile(new RuleTestRequest(file, exampleConcurrency)))
                .toList();
        int limit = Math.min(ruleFiles.size(), Runtime.getRuntime().availableProcessors());
        List<TaskOutcome<RuleTestReport>> outcomes = BoundedExecutor.runAll(tasks, limit, "rulecov-file");

        List<BatchEntry> entries = new ArrayList<>();
        for (int i = 0; i < ruleFiles.size(); i++) {
            TaskOutcome<RuleTestReport> outcome = outcomes.get(i);
            if (outcome.succeeded()) {
                entries.add(new BatchEntry(ruleFiles.get(i), outcome.value(), null));
            } else {
                log.warn("Rule file {} failed: {}", ruleFiles.get(i), outcome.errorMessage());
                entries.add(new BatchEntry(ruleFiles.get(i), null, outcome.errorMessage()));
            }
        }
        return new BatchReport(entries, elapsed(startTime));
    }

    private Optional<SyntaxNode> parseTree(RuleDocument.ExampleBlock block) {
        if (!properties.getSyntaxTree().isEnabled()) {
            return Optional.empty();
        }
        try {
            return syntaxTreeParser.parse(block.content());
        } catch (RuntimeException e) {
            log.warn("Syntax tree parsing failed for example {}: {}", block.exampleIndex(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<ExampleTestResult> runExamples(Path ruleFile, List<Example> examples, int concurrency) {
        List<Callable<List<ExampleTestResult>>> tasks = examples.stream()
                .<Callable<List<ExampleTestResult>>>map(example -> () -> runExample(ruleFile, example))
                .toList();
        List<TaskOutcome<List<ExampleTestResult>>> outcomes =
                BoundedExecutor.runAll(tasks, concurrency, "rulecov-example");

        List<ExampleTestResult> results = new ArrayList<>();
        for (int i = 0; i < examples.size(); i++) {
            TaskOutcome<List<ExampleTestResult>> outcome = outcomes.get(i);
            if (outcome.succeeded()) {
                results.addAll(outcome.value());
                continue;
            }
            Example example = examples.get(i);
            for (MarkerKind kind : MarkerKind.values()) {
                if (example.hasMarkers(kind)) {
                    results.add(testOracle.failed(ruleFile, example, kind,
                            "Test execution failed: " + outcome.errorMessage()));
                }
            }
        }
        return results;
    }

    private List<ExampleTestResult> runExample(Path ruleFile, Example example) {
        List<ExampleTestResult> results = new ArrayList<>();
        for (MarkerKind kind : MarkerKind.values()) {
            if (example.hasMarkers(kind)) {
                results.add(runHalf(ruleFile, example, kind));
            } else {
                log.debug("Example {} has no {} markers, skipping that test", example.exampleIndex(), kind);
            }
        }
        return results;
    }

    private ExampleTestResult runHalf(Path ruleFile, Example example, MarkerKind kind) {
        FixtureResult fixture = null;
        try {
            fixture = fixtureGenerator.generate(new FixtureRequest(example.content(), example.exampleIndex(),
                    kind == MarkerKind.VIOLATION, kind == MarkerKind.VALID));
            EngineOutcome outcome = ruleEngineGateway.run(fixture.filePath(), ruleFile);
            ExampleTestResult result = testOracle.evaluate(ruleFile, example, kind, outcome);
            log.info("  {}: {}", result.label(), result.passed() ? "PASS" : "FAIL - " + result.description());
            return result;
        } catch (RuntimeException e) {
            log.warn("Example {} {} test failed to run: {}", example.exampleIndex(), kind, e.getMessage());
            return testOracle.failed(ruleFile, example, kind, "Test execution failed: " + e.getMessage());
        } finally {
            if (fixture != null) {
                fixtureGenerator.discard(fixture);
            }
        }
    }

    private long elapsed(Instant startTime) {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}

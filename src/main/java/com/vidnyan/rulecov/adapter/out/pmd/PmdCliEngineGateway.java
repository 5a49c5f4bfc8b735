package com.vidnyan.rulecov.adapter.out.pmd;

import com.vidnyan.rulecov.RuleCovProperties;
import com.vidnyan.rulecov.application.port.out.RuleEngineGateway;
import com.vidnyan.rulecov.domain.oracle.EngineOutcome;
import com.vidnyan.rulecov.domain.oracle.ToolViolation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the PMD command line on a fixture and parses its XML report.
 * <p>
 * PMD exits with 4 when violations were found, so any exit code counts as
 * success as long as stdout carries a report.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PmdCliEngineGateway implements RuleEngineGateway {

    private static final long PUMP_GRACE_SECONDS = 5;

    private final RuleCovProperties properties;
    private final PmdReportParser reportParser;

    /**
     * Captured output of one process run.
     *
     * @param exit     exit code, -1 when the process timed out
     * @param stdout   standard output
     * @param stderr   standard error
     * @param timedOut whether the timeout expired
     */
    record Result(int exit, String stdout, String stderr, boolean timedOut) {}

    @Override
    public EngineOutcome run(Path fixturePath, Path ruleFile) {
        List<String> command = command(fixturePath, ruleFile);
        Result result;
        try {
            result = execute(command, properties.getEngine().getTimeout());
        } catch (IOException e) {
            log.warn("Cannot start {}: {}", command.get(0), e.getMessage());
            return EngineOutcome.failure("PMD CLI not available: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EngineOutcome.failure("PMD execution failed: interrupted");
        }

        if (result.timedOut()) {
            return EngineOutcome.failure("PMD execution failed: timed out after "
                    + properties.getEngine().getTimeout().toSeconds() + "s");
        }
        String report = PmdReportParser.reportPart(result.stdout());
        if (report == null) {
            String detail = result.stderr().isBlank() ? "exit code " + result.exit() : result.stderr().trim();
            return EngineOutcome.failure("PMD execution failed: " + detail);
        }
        try {
            List<ToolViolation> violations = reportParser.parse(report);
            log.debug("PMD exit {} with {} violations for {}", result.exit(), violations.size(), fixturePath);
            return EngineOutcome.success(violations);
        } catch (IllegalArgumentException e) {
            return EngineOutcome.failure("PMD execution failed: " + e.getMessage());
        }
    }

    List<String> command(Path fixturePath, Path ruleFile) {
        return List.of(properties.getEngine().getCommand(), "check",
                "--no-cache", "--no-progress",
                "-d", fixturePath.toString(),
                "-R", ruleFile.toString(),
                "-f", "xml");
    }

    Result execute(List<String> command, Duration timeout) throws IOException, InterruptedException {
        ExecutorService ioPool = Executors.newFixedThreadPool(2);
        try {
            Process process = new ProcessBuilder(command).start();
            Future<String> stdout = ioPool.submit(() -> drain(process.getInputStream()));
            Future<String> stderr = ioPool.submit(() -> drain(process.getErrorStream()));

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("PMD did not finish within {}, destroying process tree", timeout);
                destroyProcessTree(process);
            }
            return new Result(finished ? process.exitValue() : -1,
                    collect(stdout), collect(stderr), !finished);
        } finally {
            ioPool.shutdownNow();
        }
    }

    private String drain(InputStream stream) throws IOException {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private String collect(Future<String> pump) throws InterruptedException {
        try {
            return pump.get(PUMP_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Output pump did not complete: {}", e.getMessage());
            return "";
        }
    }

    private void destroyProcessTree(Process process) {
        process.toHandle().descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}

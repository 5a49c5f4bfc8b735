package com.vidnyan.rulecov.adapter.out.pmd;

import com.vidnyan.rulecov.RuleCovProperties;
import com.vidnyan.rulecov.domain.oracle.EngineOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PmdCliEngineGatewayTest {

    @TempDir
    Path tempDir;

    private final RuleCovProperties properties = new RuleCovProperties();
    private final PmdCliEngineGateway gateway = new PmdCliEngineGateway(properties, new PmdReportParser());

    @Test
    void command_ShouldInvokePmdCheckWithXmlFormat() {
        properties.getEngine().setCommand("/opt/pmd/bin/pmd");

        List<String> command = gateway.command(Path.of("fixture.cls"), Path.of("rule.xml"));

        assertEquals(List.of("/opt/pmd/bin/pmd", "check", "--no-cache", "--no-progress",
                "-d", "fixture.cls", "-R", "rule.xml", "-f", "xml"), command);
    }

    @Test
    void run_ShouldReportMissingExecutable() {
        properties.getEngine().setCommand(tempDir.resolve("no-such-pmd").toString());

        EngineOutcome outcome = gateway.run(Path.of("fixture.cls"), Path.of("rule.xml"));

        assertFalse(outcome.success());
        assertTrue(outcome.error().startsWith("PMD CLI not available: "), outcome.error());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void run_ShouldAcceptReportEvenWithNonZeroExit() throws IOException {
        properties.getEngine().setCommand(script("""
                echo "[WARN] something noisy"
                echo '<?xml version="1.0" encoding="UTF-8"?>'
                echo '<pmd version="7.0.0"><file name="f.cls">'
                echo '<violation beginline="3" begincolumn="5" rule="R" priority="2">found</violation>'
                echo '</file></pmd>'
                exit 4
                """));

        EngineOutcome outcome = gateway.run(Path.of("fixture.cls"), Path.of("rule.xml"));

        assertTrue(outcome.success(), outcome.error());
        assertEquals(1, outcome.violations().size());
        assertEquals(3, outcome.violations().get(0).line());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void run_ShouldFailWithStderrWhenNoReportIsProduced() throws IOException {
        properties.getEngine().setCommand(script("""
                echo "Cannot load ruleset rule.xml" >&2
                exit 1
                """));

        EngineOutcome outcome = gateway.run(Path.of("fixture.cls"), Path.of("rule.xml"));

        assertFalse(outcome.success());
        assertEquals("PMD execution failed: Cannot load ruleset rule.xml", outcome.error());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void run_ShouldFailWithExitCodeWhenOutputIsEmpty() throws IOException {
        properties.getEngine().setCommand(script("exit 2\n"));

        EngineOutcome outcome = gateway.run(Path.of("fixture.cls"), Path.of("rule.xml"));

        assertEquals("PMD execution failed: exit code 2", outcome.error());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void run_ShouldTimeOutAndDestroyProcess() throws IOException {
        properties.getEngine().setCommand(script("exec sleep 30\n"));
        properties.getEngine().setTimeout(Duration.ofMillis(300));

        long start = System.nanoTime();
        EngineOutcome outcome = gateway.run(Path.of("fixture.cls"), Path.of("rule.xml"));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertFalse(outcome.success());
        assertTrue(outcome.error().startsWith("PMD execution failed: timed out"), outcome.error());
        assertTrue(elapsedMs < 10_000, "took " + elapsedMs + "ms");
    }

    private String script(String body) throws IOException {
        Path script = tempDir.resolve("fake-pmd.sh");
        Files.writeString(script, "#!/bin/sh\n" + body);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script.toString();
    }
}

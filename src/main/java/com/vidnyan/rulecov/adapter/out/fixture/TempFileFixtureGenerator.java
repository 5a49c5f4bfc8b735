package com.vidnyan.rulecov.adapter.out.fixture;

import com.vidnyan.rulecov.RuleCovProperties;
import com.vidnyan.rulecov.application.port.out.FixtureGenerator;
import com.vidnyan.rulecov.domain.coverage.CodePatterns;
import com.vidnyan.rulecov.domain.marker.Example;
import com.vidnyan.rulecov.domain.marker.ExampleParser;
import com.vidnyan.rulecov.domain.marker.LineRange;
import com.vidnyan.rulecov.domain.marker.Marker;
import com.vidnyan.rulecov.domain.marker.MarkerKind;
import com.vidnyan.rulecov.domain.marker.MarkerSpans;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Writes one example to a temporary Apex class file.
 * <p>
 * Every example line stays on its original line number: wrappers are put in
 * front of line 1 and after the last line, and excluded lines are blanked
 * rather than removed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TempFileFixtureGenerator implements FixtureGenerator {

    static final String FILE_PREFIX = "rule-test-example-";
    static final String FILE_SUFFIX = ".cls";

    private static final Pattern TYPE_DECLARATION = Pattern.compile(
            "\\b(class|interface|enum|trigger)\\s+\\w+", Pattern.CASE_INSENSITIVE);

    private final ExampleParser exampleParser;
    private final RuleCovProperties properties;

    @Override
    public FixtureResult generate(FixtureRequest request) {
        Example example = exampleParser.parse(request.exampleContent(), request.exampleIndex());
        String source = render(example, request.includeViolations(), request.includeValids());

        Path file;
        try {
            Path directory = fixtureDirectory();
            file = directory.resolve(FILE_PREFIX + request.exampleIndex() + "-" + UUID.randomUUID() + FILE_SUFFIX);
            Files.writeString(file, source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write fixture for example " + request.exampleIndex(), e);
        }
        log.debug("Generated fixture {} for example {}", file, request.exampleIndex());

        return new FixtureResult(file,
                request.includeViolations() && example.hasMarkers(MarkerKind.VIOLATION),
                request.includeValids() && example.hasMarkers(MarkerKind.VALID),
                request.includeViolations() ? example.violationMarkers().size() : 0,
                request.includeValids() ? example.validMarkers().size() : 0);
    }

    @Override
    public void discard(FixtureResult fixture) {
        try {
            Files.deleteIfExists(fixture.filePath());
        } catch (IOException e) {
            log.warn("Could not delete fixture {}: {}", fixture.filePath(), e.getMessage());
        }
    }

    /**
     * Source text of the fixture, line for line aligned with the example.
     */
    String render(Example example, boolean includeViolations, boolean includeValids) {
        List<String> lines = new ArrayList<>(example.lines());
        if (!includeViolations) {
            blank(lines, example, MarkerKind.VIOLATION);
        }
        if (!includeValids) {
            blank(lines, example, MarkerKind.VALID);
        }
        if (lines.isEmpty()) {
            lines.add("");
        }

        String content = String.join("\n", lines);
        String prefix = "";
        String suffix = "";
        if (!TYPE_DECLARATION.matcher(content).find()) {
            String className = "RuleTestExample" + example.exampleIndex();
            if (CodePatterns.METHOD_SIGNATURE.matcher(content).find()) {
                prefix = "public class " + className + " { ";
                suffix = "\n}";
            } else {
                prefix = "public class " + className + " { public void run() { ";
                suffix = "\n} }";
            }
        }
        lines.set(0, prefix + lines.get(0));
        return String.join("\n", lines) + suffix + "\n";
    }

    private void blank(List<String> lines, Example example, MarkerKind kind) {
        for (Marker marker : example.markers(kind)) {
            LineRange span = MarkerSpans.of(marker, example);
            for (int line = Math.max(1, span.start()); line <= Math.min(lines.size(), span.end()); line++) {
                if (braceBalance(lines.get(line - 1)) == 0) {
                    lines.set(line - 1, "");
                }
            }
        }
    }

    private int braceBalance(String line) {
        int balance = 0;
        for (char c : line.toCharArray()) {
            if (c == '{') {
                balance++;
            } else if (c == '}') {
                balance--;
            }
        }
        return balance;
    }

    private Path fixtureDirectory() throws IOException {
        String configured = properties.getFixture().getDirectory();
        Path directory = configured == null || configured.isBlank()
                ? Path.of(System.getProperty("java.io.tmpdir"))
                : Path.of(configured);
        Files.createDirectories(directory);
        return directory;
    }
}

package com.vidnyan.rulecov.domain.oracle;

import com.vidnyan.rulecov.domain.marker.Example;
import com.vidnyan.rulecov.domain.marker.Marker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Maps a marker back to a line of the rule file: the first executable line
 * at or after the marker, inside the marker's {@code <example>} element.
 * Every lookup failure yields an empty result.
 */
@Slf4j
@Component
public class LineNumberRecovery {

    private static final Pattern EXAMPLE_OPEN = Pattern.compile("<example(\\s[^>]*)?>");
    private static final String EXAMPLE_CLOSE = "</example>";
    private static final Pattern MARKUP = Pattern.compile("</?example(\\s[^>]*)?>|<!\\[CDATA\\[|]]>");

    public OptionalInt recover(Path ruleFile, Example example, Marker marker) {
        List<String> lines;
        try {
            lines = Files.readAllLines(ruleFile, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            log.debug("Rule file {} unreadable for line recovery: {}", ruleFile, e.getMessage());
            return OptionalInt.empty();
        }
        return recover(lines, example, marker);
    }

    /**
     * Line recovery over already loaded rule file lines.
     *
     * @return 1-based rule file line, or empty when it cannot be determined
     */
    public OptionalInt recover(List<String> ruleLines, Example example, Marker marker) {
        int start = findExampleStart(ruleLines, example.exampleIndex());
        if (start < 0) {
            log.debug("Example {} not found in rule file", example.exampleIndex());
            return OptionalInt.empty();
        }
        int end = findExampleEnd(ruleLines, start);
        if (end < 0) {
            log.debug("No closing tag for example {}", example.exampleIndex());
            return OptionalInt.empty();
        }
        int markerLine = locateMarker(ruleLines, start, end, example, marker);
        if (markerLine < 0) {
            log.debug("Marker at example line {} not located in example {}", marker.lineNumber(), example.exampleIndex());
            return OptionalInt.empty();
        }
        for (int i = markerLine; i <= end; i++) {
            if (isExecutable(ruleLines.get(i))) {
                return OptionalInt.of(i + 1);
            }
        }
        return OptionalInt.empty();
    }

    private int findExampleStart(List<String> lines, int exampleIndex) {
        int seen = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (EXAMPLE_OPEN.matcher(lines.get(i)).find()) {
                seen++;
                if (seen == exampleIndex) {
                    return i;
                }
            }
        }
        return -1;
    }

    private int findExampleEnd(List<String> lines, int start) {
        for (int i = start; i < lines.size(); i++) {
            if (lines.get(i).contains(EXAMPLE_CLOSE)) {
                return i;
            }
        }
        return -1;
    }

    private int locateMarker(List<String> ruleLines, int start, int end, Example example, Marker marker) {
        List<String> exampleLines = example.lines();
        int markerIndex = marker.lineNumber() - 1;
        if (markerIndex < 0 || markerIndex >= exampleLines.size()) {
            return -1;
        }
        String markerText = exampleLines.get(markerIndex).trim();
        int occurrence = 0;
        for (int j = 0; j < markerIndex; j++) {
            if (exampleLines.get(j).trim().equals(markerText)) {
                occurrence++;
            }
        }

        int exact = nthLine(ruleLines, start, end, occurrence, line -> line.equals(markerText));
        if (exact >= 0) {
            return exact;
        }
        int partial = nthLine(ruleLines, start, end, occurrence, line -> line.contains(markerText));
        if (partial >= 0) {
            return partial;
        }
        return offsetFromFirstContentLine(ruleLines, start, end, exampleLines, markerIndex);
    }

    private int nthLine(List<String> ruleLines, int start, int end, int occurrence, Predicate<String> matches) {
        int hits = 0;
        for (int i = start; i <= end; i++) {
            if (matches.test(plainText(ruleLines.get(i)))) {
                if (hits == occurrence) {
                    return i;
                }
                hits++;
            }
        }
        return -1;
    }

    private int offsetFromFirstContentLine(List<String> ruleLines, int start, int end,
                                           List<String> exampleLines, int markerIndex) {
        int firstContent = -1;
        for (int j = 0; j < exampleLines.size(); j++) {
            if (!exampleLines.get(j).isBlank()) {
                firstContent = j;
                break;
            }
        }
        if (firstContent < 0) {
            return -1;
        }
        String firstText = exampleLines.get(firstContent).trim();
        for (int i = start; i <= end; i++) {
            if (plainText(ruleLines.get(i)).contains(firstText)) {
                int candidate = i + (markerIndex - firstContent);
                return candidate <= end ? candidate : -1;
            }
        }
        return -1;
    }

    /**
     * Rule file line as the example text sees it: markup stripped, entities decoded, trimmed.
     */
    static String plainText(String line) {
        String text = MARKUP.matcher(line).replaceAll("");
        return text.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&")
                .trim();
    }

    static boolean isExecutable(String line) {
        String code = MARKUP.matcher(line).replaceAll("").trim();
        if (code.isEmpty() || code.startsWith("<")) {
            return false;
        }
        return !(code.startsWith("//") || code.startsWith("/*") || code.startsWith("*"));
    }
}

package com.vidnyan.rulecov.domain.marker;

import java.util.List;

/**
 * Lines a marker speaks for.
 * An inline marker covers its own line, widened by its code span when known.
 * A section marker covers its header up to the next header or the end of the example.
 */
public final class MarkerSpans {

    private MarkerSpans() {
    }

    public static LineRange of(Marker marker, Example example) {
        List<String> lines = example.lines();
        int line = marker.lineNumber();
        if (line < 1 || line > lines.size()) {
            return new LineRange(line, line);
        }
        if (MarkerSyntax.header(lines.get(line - 1)).isEmpty()) {
            if (marker.codeSpan() == null) {
                return new LineRange(line, line);
            }
            return new LineRange(
                    Math.min(line, marker.codeSpan().startLine()),
                    Math.max(line, marker.codeSpan().endLine()));
        }
        int end = lines.size();
        for (int i = line; i < lines.size(); i++) {
            if (MarkerSyntax.header(lines.get(i)).isPresent()) {
                end = i;
                break;
            }
        }
        return new LineRange(line, end);
    }

    /**
     * Code text inside a marker's span, with marker comments, comment lines and blanks dropped.
     */
    public static List<String> codeLines(Marker marker, Example example) {
        LineRange range = of(marker, example);
        List<String> lines = example.lines();
        return lines.subList(Math.max(0, range.start() - 1), Math.min(lines.size(), range.end())).stream()
                .filter(line -> !line.isBlank())
                .filter(line -> MarkerSyntax.inline(line).isPresent() || !MarkerSyntax.isComment(line))
                .map(MarkerSyntax::codePart)
                .filter(code -> !code.isEmpty())
                .toList();
    }
}

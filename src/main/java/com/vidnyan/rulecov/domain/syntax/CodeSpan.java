package com.vidnyan.rulecov.domain.syntax;

/**
 * Region of an example snippet, 1-based and inclusive.
 */
public record CodeSpan(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn
) {

    /**
     * Create a span covering a single line.
     */
    public static CodeSpan line(int line) {
        return new CodeSpan(line, 1, line, Integer.MAX_VALUE);
    }

    public boolean containsLine(int line) {
        return line >= startLine && line <= endLine;
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}

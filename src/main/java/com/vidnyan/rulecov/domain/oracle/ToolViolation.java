package com.vidnyan.rulecov.domain.oracle;

/**
 * A violation reported by the external rule engine.
 */
public record ToolViolation(
    int line,
    int column,
    String rule,
    String message,
    int priority
) {

    public static final int DEFAULT_PRIORITY = 5;

    public String format() {
        return line + ":" + column + " [" + rule + "] " + message;
    }
}

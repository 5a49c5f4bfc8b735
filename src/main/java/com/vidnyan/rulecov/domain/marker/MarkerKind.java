package com.vidnyan.rulecov.domain.marker;

/**
 * Whether annotated code is expected to trigger the rule.
 */
public enum MarkerKind {
    VIOLATION("Violation"),
    VALID("Valid");

    private final String displayName;

    MarkerKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}

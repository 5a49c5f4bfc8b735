package com.vidnyan.rulecov.domain.rule;

/**
 * Descriptive fields of a rule file. Any field may be null.
 */
public record RuleMetadata(
    String ruleName,
    String message,
    String description,
    String query
) {

    public static RuleMetadata empty() {
        return new RuleMetadata(null, null, null, null);
    }

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }
}

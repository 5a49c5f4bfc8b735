package com.vidnyan.rulecov.domain.query;

/**
 * Classification of a boolean sub-expression found in a query predicate.
 */
public enum ConditionalKind {
    AND("and"),
    NOT("not"),
    OR("or"),
    IF("if"),
    QUANTIFIED("quantified"),
    BOOLEAN_FUNCTION("boolean_function");

    private final String label;

    ConditionalKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

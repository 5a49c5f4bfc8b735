package com.vidnyan.rulecov.domain.rule;

/**
 * A rule file that cannot be tested at all, such as one without examples.
 */
public class RuleValidationException extends RuntimeException {

    public RuleValidationException(String message) {
        super(message);
    }
}

package com.vidnyan.rulecov.domain.rule;

/**
 * A rule file that could not be read or parsed.
 */
public class RuleFileReadException extends RuntimeException {

    public RuleFileReadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.vidnyan.rulecov.domain.oracle;

import java.util.List;

/**
 * Result of one engine invocation: either the reported violations or an error.
 */
public record EngineOutcome(
    boolean success,
    List<ToolViolation> violations,
    String error
) {

    public EngineOutcome {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static EngineOutcome success(List<ToolViolation> violations) {
        return new EngineOutcome(true, violations, null);
    }

    public static EngineOutcome failure(String error) {
        return new EngineOutcome(false, List.of(), error);
    }
}

package com.vidnyan.rulecov.application.port.out;

import java.nio.file.Path;

/**
 * Port for turning one example into a source file the rule engine can analyze.
 * Generated fixtures keep each example line at its original line number.
 */
public interface FixtureGenerator {

    FixtureResult generate(FixtureRequest request);

    /**
     * Remove a fixture once the engine is done with it.
     */
    default void discard(FixtureResult fixture) {
    }

    /**
     * Which parts of an example to include.
     */
    record FixtureRequest(
        String exampleContent,
        int exampleIndex,
        boolean includeViolations,
        boolean includeValids
    ) {}

    /**
     * A generated fixture. The path is opaque to the caller.
     */
    record FixtureResult(
        Path filePath,
        boolean hasViolations,
        boolean hasValids,
        int violationCount,
        int validCount
    ) {}
}

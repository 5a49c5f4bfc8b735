package com.vidnyan.rulecov.domain.coverage;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Branches already exercised during one rule run. Create one per run and
 * visit examples in index order.
 */
public class CoverageLedger {

    private final Map<BranchSignature, Integer> firstExercised = new LinkedHashMap<>();

    /**
     * Record that an example exercises a branch.
     *
     * @return the earlier example that already exercised it, if any
     */
    public OptionalInt record(BranchSignature signature, int exampleIndex) {
        Integer first = firstExercised.putIfAbsent(signature, exampleIndex);
        if (first == null || first == exampleIndex) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(first);
    }

    public int size() {
        return firstExercised.size();
    }
}

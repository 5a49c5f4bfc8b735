package com.vidnyan.rulecov.domain.coverage;

/**
 * A branch an example re-exercises after an earlier example already did.
 *
 * @param exampleIndex   example that repeats the branch
 * @param signature      the repeated branch
 * @param firstExercised example that exercised it first
 */
public record RedundantBranch(
    int exampleIndex,
    BranchSignature signature,
    int firstExercised
) {

    public String describe() {
        return "Example " + exampleIndex + ": " + signature.format()
                + " already covered by example " + firstExercised
                + (signature.isPrecise() ? "" : " (heuristic)");
    }
}

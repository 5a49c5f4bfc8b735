package com.vidnyan.rulecov.domain.coverage;

import java.util.List;

/**
 * Coverage verdict for one conditional, or for a rule's node types or attributes.
 *
 * @param subject      human-readable identifier used in uncovered-branch listings
 * @param success      whether the examples exercise the subject
 * @param message      explanation of the verdict
 * @param evidence     supporting evidence, empty when nothing could be checked
 * @param details      unsatisfied items, such as missing AND parts or uncovered node types
 * @param inconclusive true when no checker could decide, as opposed to a genuine negative
 */
public record CoverageResult(
    String subject,
    boolean success,
    String message,
    List<CoverageEvidence> evidence,
    List<String> details,
    boolean inconclusive
) {

    public CoverageResult {
        evidence = List.copyOf(evidence);
        details = List.copyOf(details);
    }

    public static CoverageResult covered(String subject, String message, List<CoverageEvidence> evidence) {
        return new CoverageResult(subject, true, message, evidence, List.of(), false);
    }

    public static CoverageResult uncovered(String subject, String message,
                                           List<CoverageEvidence> evidence, List<String> missing) {
        return new CoverageResult(subject, false, message, evidence, missing, false);
    }

    /**
     * A result for a subject that no checker can decide.
     */
    public static CoverageResult notImplemented(String subject, String message) {
        return new CoverageResult(subject, false, message, List.of(), List.of(), true);
    }
}

package com.vidnyan.rulecov.domain.marker;

import java.util.List;
import java.util.stream.Stream;

/**
 * One {@code <example>} block of a rule file with its derived ground truth.
 *
 * @param content          raw example text
 * @param exampleIndex     1-based position among the rule's examples
 * @param violations       code lines expected to trigger the rule
 * @param valids           code lines expected not to trigger the rule
 * @param violationMarkers markers of kind {@link MarkerKind#VIOLATION}
 * @param validMarkers     markers of kind {@link MarkerKind#VALID}
 */
public record Example(
    String content,
    int exampleIndex,
    List<String> violations,
    List<String> valids,
    List<Marker> violationMarkers,
    List<Marker> validMarkers
) {

    public Example {
        violations = List.copyOf(violations);
        valids = List.copyOf(valids);
        violationMarkers = List.copyOf(violationMarkers);
        validMarkers = List.copyOf(validMarkers);
    }

    public List<Marker> markers(MarkerKind kind) {
        return kind == MarkerKind.VIOLATION ? violationMarkers : validMarkers;
    }

    public List<String> codeLines(MarkerKind kind) {
        return kind == MarkerKind.VIOLATION ? violations : valids;
    }

    public boolean hasMarkers(MarkerKind kind) {
        return !markers(kind).isEmpty();
    }

    public Stream<Marker> allMarkers() {
        return Stream.concat(violationMarkers.stream(), validMarkers.stream());
    }

    public List<String> lines() {
        return MarkerSyntax.lines(content);
    }
}

package com.vidnyan.rulecov.domain.marker;

import com.vidnyan.rulecov.domain.syntax.CodeSpan;

/**
 * An annotation in example text declaring an expected violation or valid case.
 *
 * @param lineNumber         1-based line within the example text
 * @param description        free text after the marker, or a placeholder
 * @param kind               violation or valid
 * @param index              0-based ordinal among markers of the same kind
 * @param codeSpan           code region attributed by the syntax tree, may be null
 * @param associatedNodeType syntax node kind on the marked line, may be null
 */
public record Marker(
    int lineNumber,
    String description,
    MarkerKind kind,
    int index,
    CodeSpan codeSpan,
    String associatedNodeType
) {

    public static Marker of(int lineNumber, String description, MarkerKind kind, int index) {
        return new Marker(lineNumber, description, kind, index, null, null);
    }

    public boolean isViolation() {
        return kind == MarkerKind.VIOLATION;
    }

    public Marker withNode(CodeSpan span, String nodeType, String newDescription) {
        return new Marker(lineNumber, newDescription, kind, index, span, nodeType);
    }
}

package com.vidnyan.rulecov.domain.query;

/**
 * A classified predicate (or predicate part) of a query.
 *
 * @param kind       which coverage strategy applies
 * @param expression the predicate text, without the enclosing brackets
 * @param position   character offset of the expression inside the query
 */
public record Conditional(
    ConditionalKind kind,
    String expression,
    int position
) {

    public static Conditional of(ConditionalKind kind, QueryText.Segment segment) {
        return new Conditional(kind, segment.text(), segment.offset());
    }
}

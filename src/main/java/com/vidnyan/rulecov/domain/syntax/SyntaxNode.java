package com.vidnyan.rulecov.domain.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Stream;

/**
 * Parser-neutral syntax tree node. The kind uses Apex AST naming
 * ({@code UserClass}, {@code MethodCallExpression}, ...) and position data
 * lives in the attributes {@code BeginLine}, {@code BeginColumn},
 * {@code EndLine} and {@code EndColumn}.
 */
public record SyntaxNode(
    String kind,
    Map<String, String> attributes,
    List<SyntaxNode> children
) {

    public static final String BEGIN_LINE = "BeginLine";
    public static final String BEGIN_COLUMN = "BeginColumn";
    public static final String END_LINE = "EndLine";
    public static final String END_COLUMN = "EndColumn";

    public SyntaxNode {
        attributes = Map.copyOf(attributes);
        children = List.copyOf(children);
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public OptionalInt intAttribute(String name) {
        String value = attributes.get(name);
        if (value == null) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public OptionalInt beginLine() {
        return intAttribute(BEGIN_LINE);
    }

    /**
     * This node and all descendants in pre-order.
     */
    public Stream<SyntaxNode> stream() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(SyntaxNode::stream));
    }

    public boolean containsKind(String nodeKind) {
        return stream().anyMatch(node -> node.kind().equals(nodeKind));
    }

    /**
     * Nodes starting on the given line, outermost first.
     */
    public List<SyntaxNode> startingOn(int line) {
        List<SyntaxNode> nodes = new ArrayList<>();
        stream().filter(node -> node.beginLine().orElse(-1) == line).forEach(nodes::add);
        return nodes;
    }

    public Optional<CodeSpan> span() {
        OptionalInt begin = beginLine();
        if (begin.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CodeSpan(
                begin.getAsInt(),
                intAttribute(BEGIN_COLUMN).orElse(1),
                intAttribute(END_LINE).orElse(begin.getAsInt()),
                intAttribute(END_COLUMN).orElse(Integer.MAX_VALUE)));
    }
}

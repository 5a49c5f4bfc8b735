package com.vidnyan.rulecov.adapter.out.parser;

import com.vidnyan.rulecov.domain.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JavaParserSyntaxTreeParserTest {

    private final JavaParserSyntaxTreeParser parser = new JavaParserSyntaxTreeParser();

    @Test
    void parse_ShouldMapClassMembersToApexKinds() {
        // Arrange
        String snippet = """
                public with sharing class Foo {
                    public void bar() {
                        System.debug('it\\'s here');
                    }
                }""";

        // Act
        SyntaxNode root = parser.parse(snippet).orElseThrow();

        // Assert
        assertEquals(JavaParserSyntaxTreeParser.ROOT_KIND, root.kind());
        SyntaxNode type = root.children().get(0);
        assertEquals("UserClass", type.kind());
        assertEquals("Foo", type.attributes().get("Image"));
        assertEquals("true", type.attributes().get("Public"));
        assertEquals("false", type.attributes().get("Nested"));
        assertEquals(List.of(2), lines(root, "Method"));
        SyntaxNode call = first(root, "MethodCallExpression");
        assertEquals(3, call.beginLine().getAsInt());
        assertEquals("debug", call.attributes().get("MethodName"));
        assertEquals("System.debug", call.attributes().get("FullMethodName"));
        SyntaxNode literal = first(root, "LiteralExpression");
        assertEquals("String", literal.attributes().get("LiteralType"));
    }

    @Test
    void parse_ShouldWrapBareMembersWithoutShiftingLines() {
        SyntaxNode root = parser.parse("\npublic void m() {\n    Integer a = 1;\n}").orElseThrow();

        SyntaxNode method = first(root, "Method");
        assertEquals(2, method.beginLine().getAsInt());
        assertEquals(4, method.intAttribute(SyntaxNode.END_LINE).getAsInt());
        assertEquals(List.of(3), lines(root, "VariableDeclaration"));
    }

    @Test
    void parse_ShouldWrapStatementsAndRestoreDmlKinds() {
        SyntaxNode root = parser.parse("Account acc = new Account();\ninsert acc;\nundelete acc;").orElseThrow();

        assertEquals(List.of(1), lines(root, "NewObjectExpression"));
        assertEquals(List.of(2), lines(root, "DmlInsertStatement"));
        assertEquals(List.of(3), lines(root, "DmlUndeleteStatement"));
        assertTrue(root.stream().noneMatch(node -> node.kind().equals("MethodCallExpression")));
    }

    @Test
    void parse_ShouldRestoreSoqlExpression() {
        SyntaxNode root = parser.parse("for (Account a : [SELECT Id FROM Account]) {\n    update a;\n}")
                .orElseThrow();

        SyntaxNode soql = first(root, "SoqlExpression");
        assertEquals(1, soql.beginLine().getAsInt());
        assertFalse(soql.attributes().containsKey("LiteralType"));
        assertEquals(List.of(1), lines(root, "ForEachStatement"));
        assertEquals(List.of(2), lines(root, "DmlUpdateStatement"));
    }

    @Test
    void parse_ShouldMapGlobalToPublic() {
        SyntaxNode root = parser.parse("global class Api {\n    global static void call() {}\n}").orElseThrow();

        SyntaxNode method = first(root, "Method");
        assertEquals("true", method.attributes().get("Public"));
        assertEquals("true", method.attributes().get("Static"));
    }

    @Test
    void parse_ShouldIgnoreApostrophesInComments() {
        Optional<SyntaxNode> root = parser.parse("// don't do this ❌\nSystem.debug('x');");

        assertTrue(root.isPresent());
        assertEquals(List.of(2), lines(root.get(), "MethodCallExpression"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "this is { not code", "public class {"})
    void parse_ShouldReturnEmptyForUnparseableInput(String snippet) {
        assertTrue(parser.parse(snippet).isEmpty());
    }

    @Test
    void normalize_ShouldKeepEveryCharacterPosition() {
        String snippet = "public without sharing class X {\n  void m() { delete [SELECT Id FROM A]; }\n}";

        JavaParserSyntaxTreeParser.Normalized normalized = parser.normalize(snippet);

        assertEquals(snippet.length(), normalized.text().length());
        assertEquals(snippet.indexOf('\n'), normalized.text().indexOf('\n'));
        assertTrue(normalized.text().contains("assert null"));
        assertEquals(2, normalized.rewrittenKinds().size());
    }

    private static SyntaxNode first(SyntaxNode root, String kind) {
        return root.stream().filter(node -> node.kind().equals(kind)).findFirst().orElseThrow();
    }

    private static List<Integer> lines(SyntaxNode root, String kind) {
        return root.stream()
                .filter(node -> node.kind().equals(kind))
                .map(node -> node.beginLine().getAsInt())
                .toList();
    }
}

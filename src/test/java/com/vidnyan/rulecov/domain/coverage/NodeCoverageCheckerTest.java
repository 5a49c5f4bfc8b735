package com.vidnyan.rulecov.domain.coverage;

import com.vidnyan.rulecov.domain.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NodeCoverageCheckerTest {

    private final NodeCoverageChecker checker = new NodeCoverageChecker();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "IfBlockStatement       | if (x > 1) { return; }",
            "ForEachStatement       | for (Account a : accounts) { }",
            "MethodCallExpression   | System.debug(x);",
            "SoqlExpression         | List<Account> a = [SELECT Id FROM Account];",
            "DmlInsertStatement     | insert acc;",
            "NewObjectExpression    | Account a = new Account();",
            "UserClass              | public class Foo { }",
            "FieldDeclaration       | private static final Integer MAX = 10;"
    })
    void isCovered_ShouldRecognizeShapeOfNodeType(String nodeType, String content) {
        assertTrue(checker.isCovered(nodeType, content), nodeType);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "IfBlockStatement     | Integer x = 1;",
            "ForEachStatement     | for (Integer i = 0; i < 3; i++) { }",
            "SoqlExpression       | Integer x = 1;",
            "DmlInsertStatement   | Integer insertCount = 1;"
    })
    void isCovered_ShouldRejectMissingShape(String nodeType, String content) {
        assertFalse(checker.isCovered(nodeType, content), nodeType);
    }

    @Test
    void isCovered_ShouldTreatScaffoldingAsAlwaysCovered() {
        assertTrue(checker.isCovered("StandardCondition", ""));
    }

    @Test
    void isCovered_ShouldPreferSyntaxTreeOverText() {
        SyntaxNode tree = new SyntaxNode("ApexFile", Map.of(),
                List.of(new SyntaxNode("TernaryExpression", Map.of(SyntaxNode.BEGIN_LINE, "1"), List.of())));

        assertTrue(checker.isCovered("TernaryExpression", "no ternary here", List.of(tree)));
        assertFalse(checker.isCovered("TernaryExpression", "no ternary here", List.of()));
    }

    @Test
    void check_ShouldListMissingNodeTypes() {
        Set<String> nodeTypes = new LinkedHashSet<>(List.of("UserClass", "WhileLoopStatement"));

        CoverageResult result = checker.check(nodeTypes, "public class Foo { }", List.of());

        assertFalse(result.success());
        assertEquals(NodeCoverageChecker.SUBJECT, result.subject());
        assertEquals(List.of("WhileLoopStatement"), result.details());
        assertEquals("1/2 node types covered", result.evidence().get(0).description());
        assertFalse(result.inconclusive());
    }
}

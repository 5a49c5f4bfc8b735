package com.vidnyan.rulecov.domain.query;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QueryAnalyzerTest {

    private final QueryAnalyzer analyzer = new QueryAnalyzer();

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\n\t"})
    void analyze_ShouldReturnEmptyAnalysisForBlankQuery(String query) {
        QueryAnalysis analysis = analyzer.analyze(query);

        assertEquals(QueryAnalysis.empty(), analysis);
        assertFalse(analysis.hasLetExpressions());
        assertFalse(analysis.hasUnions());
        assertTrue(analysis.letVariables().isEmpty());
    }

    @Test
    void analyze_ShouldExtractNodeTypesAttributesAndOperators() {
        QueryAnalysis analysis = analyzer.analyze("//MethodCallExpression[@FullMethodName='System.debug']");

        assertEquals(Set.of("MethodCallExpression"), analysis.nodeTypes());
        assertEquals(Set.of("FullMethodName"), analysis.attributes());
        assertEquals(Set.of("="), analysis.operators());
        assertTrue(analysis.conditionals().isEmpty(), "a plain comparison is not a conditional");
    }

    @Test
    void analyze_ShouldFindNodeTypesAfterAxisSteps() {
        QueryAnalysis analysis = analyzer.analyze(
                "//Field[@Final = true() and not(ancestor::UserClass[@Nested = true()])]");

        assertEquals(List.of("Field", "UserClass"), List.copyOf(analysis.nodeTypes()));
        assertEquals(Set.of("Final", "Nested"), analysis.attributes());
        assertTrue(analysis.operators().containsAll(Set.of("=", "and", "not")));
    }

    @Test
    void analyze_ShouldClassifyAndConditionWithNestedNot() {
        String query = "//Field[@Final = true() and not(ancestor::UserClass[@Nested = true()])]";

        List<Conditional> conditionals = analyzer.analyze(query).conditionals();

        assertEquals(2, conditionals.size());
        Conditional and = conditionals.get(0);
        assertEquals(ConditionalKind.AND, and.kind());
        assertEquals("@Final = true() and not(ancestor::UserClass[@Nested = true()])", and.expression());
        assertEquals(query.indexOf('[') + 1, and.position());

        Conditional not = conditionals.get(1);
        assertEquals(ConditionalKind.NOT, not.kind());
        assertEquals("ancestor::UserClass[@Nested = true()]", not.expression());
        assertTrue(not.position() > and.position());
    }

    @Test
    void analyze_ShouldClassifyEachPredicateKind() {
        assertKind("//Method[not(@Name = 'run')]", ConditionalKind.NOT);
        assertKind("//Method[@Static = true() or @Final = true()]", ConditionalKind.OR);
        assertKind("//Method[if (@Static) then true() else false()]", ConditionalKind.IF);
        assertKind("//Method[every $p in Parameter satisfies $p/@Final]", ConditionalKind.QUANTIFIED);
        assertKind("//Method[starts-with(@Image, 'test')]", ConditionalKind.BOOLEAN_FUNCTION);
    }

    @Test
    void analyze_ShouldIgnoreKeywordsInsideStringLiterals() {
        QueryAnalysis analysis = analyzer.analyze("//Method[@Image = 'this and that']");

        assertTrue(analysis.conditionals().isEmpty());
        assertFalse(analysis.operators().contains("and"));
    }

    @Test
    void analyze_ShouldIgnoreXPathComments() {
        QueryAnalysis analysis = analyzer.analyze("(: //UserClass :) //Method");

        assertEquals(Set.of("Method"), analysis.nodeTypes());
    }

    @Test
    void analyze_ShouldDetectUnionsButNotLogicalOr() {
        assertTrue(analyzer.analyze("//Method | //Field").hasUnions());
        assertFalse(analyzer.analyze("//Method[@Image = 'a||b']").hasUnions());
    }

    @Test
    void analyze_ShouldExtractLetVariables() {
        QueryAnalysis analysis = analyzer.analyze(
                "let $limit := 5, $names := ('a', 'b') return //Method[count(Parameter) > $limit]");

        assertTrue(analysis.hasLetExpressions());
        assertEquals(Map.of("limit", "5", "names", "('a', 'b')"), analysis.letVariables());
    }

    @Test
    void extractLetVariables_ShouldAcceptPlainEqualsBinding() {
        Map<String, String> variables = analyzer.extractLetVariables("let $max = 10 return //Method");

        assertEquals(Map.of("max", "10"), variables);
    }

    @Test
    void analyze_ShouldBeDeterministic() {
        String query = "//Method[@Static = true() and not(@Final = true())]";

        assertEquals(analyzer.analyze(query), analyzer.analyze(query));
    }

    private void assertKind(String query, ConditionalKind expected) {
        List<Conditional> conditionals = analyzer.analyze(query).conditionals();
        assertEquals(1, conditionals.size(), "conditionals of " + query);
        assertEquals(expected, conditionals.get(0).kind(), query);
    }
}

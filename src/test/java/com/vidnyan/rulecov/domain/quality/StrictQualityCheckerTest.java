package com.vidnyan.rulecov.domain.quality;

import com.vidnyan.rulecov.domain.marker.Example;
import com.vidnyan.rulecov.domain.marker.ExampleParser;
import com.vidnyan.rulecov.domain.marker.MarkerExtractor;
import com.vidnyan.rulecov.domain.query.QueryAnalyzer;
import com.vidnyan.rulecov.domain.rule.RuleMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StrictQualityCheckerTest {

    private static final String QUERY =
            "let $names := ('debug', 'error') return //MethodCallExpression[@MethodName = $names]";
    private static final RuleMetadata PUBLISHABLE = new RuleMetadata(
            "AvoidSystemDebug",
            "Avoid System.debug in production code",
            "Debug statements slow down execution.\n- $names: method names to flag\nVersion: 1.0.0",
            QUERY);

    private final QueryAnalyzer queryAnalyzer = new QueryAnalyzer();
    private final StrictQualityChecker checker = new StrictQualityChecker(queryAnalyzer, new RuleQualityChecker());
    private final ExampleParser exampleParser = new ExampleParser(new MarkerExtractor(queryAnalyzer));

    private List<String> issues() {
        return new ArrayList<>();
    }

    @Test
    void check_ShouldPassPublishableRule() {
        // Arrange
        Example example = exampleParser.parse("System.debug(x); // ❌ debug call\nLogger.log(x); // ✅ logger call", 1);

        // Act
        QualityReport report = checker.check(PUBLISHABLE, List.of(example));

        // Assert
        assertTrue(report.passed(), report.issues()::toString);
        assertTrue(report.warnings().isEmpty());
    }

    @ParameterizedTest
    @NullAndEmptySource
    void checkMessage_ShouldRequireMessage(String message) {
        List<String> issues = issues();

        checker.checkMessage(message, issues);

        assertEquals(List.of("message attribute is missing"), issues);
    }

    @Test
    void checkMessage_ShouldLimitLength() {
        List<String> issues = issues();

        checker.checkMessage("x".repeat(StrictQualityChecker.MAX_MESSAGE_LENGTH), issues);
        assertTrue(issues.isEmpty());

        checker.checkMessage("x".repeat(81), issues);
        assertEquals(List.of("message attribute exceeds 80 characters (81 chars)"), issues);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "No version here", "Text\nVersion: 1.2", "Version: 1.0.0\nMore text", "Version: v1.0.0"})
    void checkVersion_ShouldRequireSemVerLastLine(String description) {
        List<String> issues = issues();

        checker.checkVersion(description, issues);

        assertEquals(List.of(StrictQualityChecker.VERSION_REQUIRED), issues);
    }

    @Test
    void checkVersion_ShouldAcceptTrailingVersionWithIndentation() {
        List<String> issues = issues();

        checker.checkVersion("\n    Flags debug calls.\n    Version: 2.10.3\n  ", issues);

        assertTrue(issues.isEmpty(), issues::toString);
    }

    @Test
    void checkHardcodedValues_ShouldReportLiteralsOutsideLet() {
        List<String> issues = issues();

        checker.checkHardcodedValues("//MethodCallExpression[@FullMethodName = 'System.debug']", Map.of(), issues);

        assertEquals(List.of("'System.debug' outside initial let statement"), issues);
    }

    @Test
    void checkHardcodedValues_ShouldAcceptLiteralAlsoBoundInLet() {
        String query = "let $method := 'System.debug' return //MethodCallExpression[@FullMethodName = 'System.debug']";
        List<String> issues = issues();

        checker.checkHardcodedValues(query, queryAnalyzer.analyze(query).letVariables(), issues);

        assertTrue(issues.isEmpty(), issues::toString);
    }

    @Test
    void checkVariableDocumentation_ShouldReportEachUndocumentedVariable() {
        Map<String, String> letVariables = queryAnalyzer.analyze(
                "let $names := ('debug'), $limit := 3 return //MethodCallExpression[@MethodName = $names]")
                .letVariables();
        List<String> issues = issues();

        checker.checkVariableDocumentation(letVariables, "Flags calls.\n* $limit: maximum count\nVersion: 1.0.0",
                issues);

        assertEquals(List.of("variable $names undocumented"), issues);
    }

    @Test
    void checkVariableDocumentation_ShouldReportAllVariablesWithoutDescription() {
        List<String> issues = issues();

        checker.checkVariableDocumentation(queryAnalyzer.analyze(QUERY).letVariables(), null, issues);

        assertEquals(List.of("variable $names undocumented"), issues);
    }

    @Test
    void checkMarkerDescriptions_ShouldRequireTextForEveryMarker() {
        Example example = exampleParser.parse("foo(); // ❌\nbar(); // ✅", 1);
        List<String> issues = issues();

        checker.checkMarkerDescriptions(List.of(example), issues);

        assertEquals(List.of(
                "Example 1 line 1: violation has no description",
                "Example 1 line 2: valid has no description"), issues);
    }

    @Test
    void checkMarkerDescriptions_ShouldAcceptSectionHeaderText() {
        Example example = exampleParser.parse("// Violation: direct call\nfoo();\n// Valid: wrapped call\nsafe(foo);", 1);
        List<String> issues = issues();

        checker.checkMarkerDescriptions(List.of(example), issues);

        assertTrue(issues.isEmpty(), issues::toString);
    }

    @Test
    void checkMarkerDescriptions_ShouldReportRepeatedDescriptionsAcrossExamples() {
        Example first = exampleParser.parse("foo(); // ❌ direct call", 1);
        Example second = exampleParser.parse("bar(); // ✅ ok\nbaz(); // ❌ direct call", 2);
        List<String> issues = issues();

        checker.checkMarkerDescriptions(List.of(first, second), issues);

        assertEquals(List.of("Example 2 line 2: duplicate description 'direct call' (Example 1 line 1)"), issues);
    }

    @Test
    void checkForbiddenCalls_ShouldRejectTestMethodCalls() {
        Example example = exampleParser.parse("testMethod(); // ❌ calls test helper", 3);
        List<String> issues = issues();

        checker.checkForbiddenCalls(List.of(example), issues);

        assertEquals(List.of("Example 3: You can't call a method testMethod in examples"), issues);
    }

    @Test
    void check_ShouldRequireViolationMarker() {
        Example example = exampleParser.parse("Logger.log(x); // ✅ logger call", 1);

        QualityReport report = checker.check(PUBLISHABLE, List.of(example));

        assertEquals(List.of(StrictQualityChecker.VIOLATION_MARKER_REQUIRED), report.issues());
    }

    @Test
    void check_ShouldTreatDuplicatedExampleCodeAsIssue() {
        Example first = exampleParser.parse("System.debug(account); // ❌ debug account", 1);
        Example second = exampleParser.parse("System.debug(account); // ❌ debug again", 2);

        QualityReport report = checker.check(PUBLISHABLE, List.of(first, second));

        assertFalse(report.passed());
        assertTrue(report.issues().stream().anyMatch(issue -> issue.startsWith("Duplicate code in examples 1, 2")),
                report.issues()::toString);
        assertTrue(report.warnings().isEmpty());
    }
}

package com.vidnyan.rulecov.domain.coverage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodePatternsTest {

    @Test
    void callNames_ShouldKeepCallsInOrderAndQualifiedNames() {
        List<String> names = CodePatterns.callNames("doWork();\nSystem.debug(x);\nInteger n = compute(1) + size();");

        assertEquals(List.of("System.debug", "doWork", "compute", "size"), names);
    }

    @Test
    void callNames_ShouldSkipConstructorsAndControlKeywords() {
        List<String> names = CodePatterns.callNames("Account a = new Account();\nif (ok()) { return new  Map<Id, Account>(); }");

        assertEquals(List.of("ok"), names);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "void m() { }",
            "public static void run() {}",
            "private Integer count() { }",
            "public List<Account> load() { }",
            "global String[] names() { }"
    })
    void callNames_ShouldNotCountMethodDeclarations(String declaration) {
        assertTrue(CodePatterns.callNames(declaration).isEmpty());
        assertFalse(CodePatterns.containsCall(declaration));
    }

    @Test
    void callNames_ShouldCountCallsInsideDeclaredMethodBody() {
        List<String> names = CodePatterns.callNames("public void run() {\n    return helper();\n}");

        assertEquals(List.of("helper"), names);
    }

    @Test
    void callNames_ShouldNotLookPastPreviousLine() {
        List<String> names = CodePatterns.callNames("// Violation: direct call\ndoWork();");

        assertEquals(List.of("doWork"), names);
    }

    @Test
    void callNames_ShouldHandleLongContent() {
        String content = "foo(x);\n".repeat(20_000) + "Account a = new Account();";

        assertTimeoutPreemptively(Duration.ofSeconds(2),
                () -> assertEquals(List.of("foo"), CodePatterns.callNames(content)));
    }

    @Test
    void previousToken_ShouldReturnWordOrTypeBracketOnSameLine() {
        assertEquals("new", CodePatterns.previousToken("x = new Foo(", 8));
        assertEquals(">", CodePatterns.previousToken("List<Id> ids(", 9));
        assertEquals("", CodePatterns.previousToken("a > b(", 4));
        assertEquals("", CodePatterns.previousToken("x = foo(", 4));
        assertEquals("", CodePatterns.previousToken("Integer\nfoo(", 8));
    }
}

package com.vidnyan.rulecov.domain.marker;

import com.vidnyan.rulecov.domain.query.QueryAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExampleParserTest {

    private final ExampleParser parser = new ExampleParser(new MarkerExtractor(new QueryAnalyzer()));

    @Test
    void parse_ShouldClassifyCodeLinesBySection() {
        String content = """
                // Violation: missing static
                public class Constants {
                    private final Integer MAX_SIZE = 10;
                }
                // Valid: static final constant
                public class GoodConstants {
                    private static final Integer MAX_SIZE = 10;
                }""";

        Example example = parser.parse(content, 1);

        assertEquals(1, example.exampleIndex());
        assertEquals(List.of("public class Constants {", "private final Integer MAX_SIZE = 10;", "}"),
                example.violations());
        assertEquals(3, example.valids().size());
        assertEquals(1, example.violationMarkers().size());
        assertEquals(1, example.validMarkers().size());
    }

    @Test
    void parse_ShouldLetInlineMarkerOverrideSectionForItsLine() {
        String content = """
                // Violation:
                foo();
                bar(); // ✅ allowed here""";

        Example example = parser.parse(content, 2);

        assertEquals(List.of("foo();"), example.violations());
        assertEquals(List.of("bar();"), example.valids());
    }

    @Test
    void parse_ShouldSkipCodeOutsideAnySection() {
        Example example = parser.parse("Integer x = 1;\n\n// plain comment", 3);

        assertTrue(example.violations().isEmpty());
        assertTrue(example.valids().isEmpty());
        assertFalse(example.hasMarkers(MarkerKind.VIOLATION));
    }

    @Test
    void markerSpans_ShouldRunFromHeaderToNextHeader() {
        Example example = parser.parse("// Violation:\nfoo();\nbar();\n// Valid:\nbaz();", 1);

        LineRange violationSpan = MarkerSpans.of(example.violationMarkers().get(0), example);
        LineRange validSpan = MarkerSpans.of(example.validMarkers().get(0), example);

        assertEquals(new LineRange(1, 3), violationSpan);
        assertEquals(new LineRange(4, 5), validSpan);
        assertEquals(List.of("foo();", "bar();"), MarkerSpans.codeLines(example.violationMarkers().get(0), example));
    }
}

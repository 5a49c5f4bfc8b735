package com.vidnyan.rulecov.adapter.out.pmd;

import com.vidnyan.rulecov.domain.oracle.ToolViolation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PmdReportParserTest {

    private static final String REPORT = """
            <?xml version="1.0" encoding="UTF-8"?>
            <pmd xmlns="http://pmd.sourceforge.net/report/2.0.0" version="7.0.0">
            <file name="/tmp/rule-test-example-1.cls">
            <violation beginline="4" endline="4" begincolumn="9" endcolumn="28" rule="AvoidSystemDebug" ruleset="Custom" priority="3">
            Avoid System.debug calls in production code
            </violation>
            <violation beginline="7" rule="AvoidSystemDebug">
            Second call
            </violation>
            </file>
            </pmd>
            """;

    private final PmdReportParser parser = new PmdReportParser();

    @Test
    void parse_ShouldReadViolationsWithDefaults() {
        List<ToolViolation> violations = parser.parse(REPORT);

        assertEquals(2, violations.size());
        assertEquals(new ToolViolation(4, 9, "AvoidSystemDebug", "Avoid System.debug calls in production code", 3),
                violations.get(0));
        ToolViolation second = violations.get(1);
        assertEquals(7, second.line());
        assertEquals(0, second.column());
        assertEquals(ToolViolation.DEFAULT_PRIORITY, second.priority());
        assertEquals("Second call", second.message());
    }

    @Test
    void parse_ShouldReturnEmptyListForCleanReport() {
        assertTrue(parser.parse("<pmd version=\"7.0.0\"></pmd>").isEmpty());
    }

    @Test
    void parse_ShouldRejectInvalidXml() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("<pmd><file>"));
    }

    @Test
    void reportPart_ShouldStripSurroundingLogLines() {
        String output = "[WARN] Progressbar rendering disabled\n" + REPORT + "Finished in 1s\n";

        String report = PmdReportParser.reportPart(output);

        assertTrue(report.startsWith("<?xml"));
        assertTrue(report.endsWith("</pmd>"));
    }

    @Test
    void reportPart_ShouldReturnNullWithoutReport() {
        assertNull(PmdReportParser.reportPart("Error: no such rule"));
        assertNull(PmdReportParser.reportPart(null));
    }
}

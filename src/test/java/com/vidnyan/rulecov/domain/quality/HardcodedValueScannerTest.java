package com.vidnyan.rulecov.domain.quality;

import com.vidnyan.rulecov.domain.quality.HardcodedValueScanner.HardcodedValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HardcodedValueScannerTest {

    @Test
    void scan_ShouldReportLongStringLiterals() {
        List<HardcodedValue> values = HardcodedValueScanner.scan("//MethodCallExpression[@FullMethodName='System.debug']");

        assertEquals(1, values.size());
        assertEquals("'System.debug'", values.get(0).value());
        assertFalse(values.get(0).number());
    }

    @Test
    void scan_ShouldIgnoreShortStrings() {
        assertTrue(HardcodedValueScanner.scan("//Method[@Name='run']").isEmpty());
    }

    @Test
    void scan_ShouldReportNumbersOtherThanZeroAndOne() {
        List<HardcodedValue> values = HardcodedValueScanner.scan("//Method[count(.//Parameter) > 10 and position() = 1]");

        assertEquals(List.of("10"), values.stream().map(HardcodedValue::value).toList());
        assertTrue(values.get(0).number());
    }

    @Test
    void scan_ShouldIgnoreDigitsInsideStrings() {
        List<HardcodedValue> values = HardcodedValueScanner.scan("//Field[@Name='MAX_25']");

        assertEquals(1, values.size());
        assertEquals("'MAX_25'", values.get(0).value());
    }

    @Test
    void scan_ShouldSkipValuesBoundInLetClause() {
        List<HardcodedValue> values = HardcodedValueScanner.scan(
                "let $name := 'System.debug' return //MethodCallExpression[@FullMethodName = $name]");

        assertTrue(values.isEmpty(), values::toString);
    }

    @Test
    void scan_ShouldReportValuesAfterLetReturn() {
        List<HardcodedValue> values = HardcodedValueScanner.scan(
                "let $limit := 50 return //Method[count(.//Statement) > 200]");

        assertEquals(List.of("200"), values.stream().map(HardcodedValue::value).toList());
    }

    @Test
    void scan_ShouldHandleEmptyQuery() {
        assertTrue(HardcodedValueScanner.scan(null).isEmpty());
        assertTrue(HardcodedValueScanner.scan("").isEmpty());
    }
}

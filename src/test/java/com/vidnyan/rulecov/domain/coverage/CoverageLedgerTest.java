package com.vidnyan.rulecov.domain.coverage;

import com.vidnyan.rulecov.domain.marker.MarkerKind;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class CoverageLedgerTest {

    @Test
    void record_ShouldReportFirstExampleOnRepeat() {
        CoverageLedger ledger = new CoverageLedger();
        BranchSignature signature = new BranchSignature(MarkerKind.VIOLATION, "MethodCallExpression", "System.debug");

        assertTrue(ledger.record(signature, 1).isEmpty());
        assertTrue(ledger.record(signature, 1).isEmpty(), "same example is not redundant");
        assertEquals(OptionalInt.of(1), ledger.record(signature, 2));
        assertEquals(1, ledger.size());
    }

    @Test
    void describe_ShouldFlagCoarseSignaturesAsHeuristic() {
        RedundantBranch precise = new RedundantBranch(2,
                new BranchSignature(MarkerKind.VIOLATION, "MethodCallExpression", "System.debug"), 1);
        RedundantBranch coarse = new RedundantBranch(3,
                new BranchSignature(MarkerKind.VALID, "IfBlockStatement", ""), 1);

        assertEquals("Example 2: Violation MethodCallExpression System.debug already covered by example 1",
                precise.describe());
        assertTrue(coarse.describe().endsWith("(heuristic)"));
    }
}

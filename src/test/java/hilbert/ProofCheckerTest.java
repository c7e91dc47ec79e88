package hilbert;

import org.junit.jupiter.api.Test;

import java.util.List;

import static hilbert.Formula.var;
import static org.junit.jupiter.api.Assertions.*;

public class ProofCheckerTest {

    private static Verdict.Failed assertFails(Verdict verdict, FailureKind kind, int line) {
        var failed = assertInstanceOf(Verdict.Failed.class, verdict);
        assertEquals(kind, failed.kind(), failed.detail());
        assertEquals(line, failed.lineNumber());
        return failed;
    }

    @Test
    public void testWeakeningProof() throws Exception {
        var verdict = ProofChecker.verify(List.of(
                "1. A Premise",
                "2. (A->(B->A)) AX1",
                "3. (B->A) MP 1,2"));

        var ok = assertInstanceOf(Verdict.Succeeded.class, verdict);
        assertEquals(List.of(1, 2, 3), List.copyOf(ok.proven().keySet()));
        assertEquals(FormulaParser.parse("(B->A)"), ok.conclusion());
    }

    @Test
    public void testModusPonensOrderIndependent() throws Exception {
        for (var citation : List.of("MP 1,2", "MP 2,1")) {
            var verdict = ProofChecker.verify(List.of("1. A Premise", "2. (A->B) Premise", "3. B " + citation));
            var ok = assertInstanceOf(Verdict.Succeeded.class, verdict, citation);
            assertEquals(var('B'), ok.conclusion());
        }
    }

    @Test
    public void testForwardReference() {
        var verdict = ProofChecker.verify(List.of(
                "1. A Premise",
                "2. B MP 2,3",
                "3. (A->B) Premise"));
        assertFails(verdict, FailureKind.FORWARD_REFERENCE, 2);
    }

    @Test
    public void testCitingCurrentLineIsForwardReference() {
        assertFails(ProofChecker.verify(List.of("1. A Premise", "2. A MP 1,2")), FailureKind.FORWARD_REFERENCE, 2);
    }

    @Test
    public void testMissingLine() {
        var verdict = ProofChecker.verify(List.of(
                "1. A Premise",
                "3. (A->B) Premise",
                "4. B MP 1,2"));
        var failed = assertFails(verdict, FailureKind.MISSING_LINE, 4);
        assertTrue(failed.detail().contains("2"));
    }

    @Test
    public void testNonConsequence() {
        var verdict = ProofChecker.verify(List.of(
                "1. A Premise",
                "2. (A->B) Premise",
                "3. C MP 1,2"));
        assertFails(verdict, FailureKind.NON_CONSEQUENCE, 3);
    }

    @Test
    public void testSchemaMismatch() {
        var verdict = ProofChecker.verify(List.of("1. (A->(B->C)) AX1"));
        var failed = assertFails(verdict, FailureKind.SCHEMA_MISMATCH, 1);
        assertTrue(failed.detail().contains("AX1"));
    }

    @Test
    public void testSyntaxError() {
        var failed = assertFails(ProofChecker.verify(List.of("1. (A->B Premise")), FailureKind.SYNTAX, 1);
        assertTrue(failed.detail().contains("(A->B"));
    }

    @Test
    public void testMalformedJustification() {
        assertFails(ProofChecker.verify(List.of("1. A ClaimsTruth")), FailureKind.LINE_FORMAT, 1);
    }

    @Test
    public void testDuplicateLineNumber() {
        assertFails(ProofChecker.verify(List.of("1. A Premise", "1. B Premise")), FailureKind.LINE_FORMAT, 1);
    }

    @Test
    public void testStopsAtFirstFailure() {
        var checker = new ProofChecker();
        assertTrue(checker.accept("1. A Premise"));
        assertFalse(checker.accept("2. B AX1"));
        assertEquals(ProofChecker.State.FAILED, checker.state());
        assertFalse(checker.accept("3. (A->A) Premise"));

        var failed = assertFails(checker.finish(), FailureKind.SCHEMA_MISMATCH, 2);
        assertSame(failed, checker.finish());
    }

    @Test
    public void testLinesProvenAfterFailureAreNotVisible() {
        // line 2 fails, so nothing after it may cite it
        var checker = new ProofChecker();
        checker.accept("1. A Premise");
        checker.accept("2. (A->B) AX3");
        checker.accept("3. B MP 1,2");
        assertFails(checker.finish(), FailureKind.SCHEMA_MISMATCH, 2);
    }

    @Test
    public void testSkipsBlankAndCommentLines() {
        var verdict = ProofChecker.verify(List.of(
                "",
                "# weakening",
                "1. A Premise",
                "   ",
                "5. (A->(B->A)) AX1",
                "  # gap in numbering is fine",
                "9. (B->A) MP 5,1"));
        var ok = assertInstanceOf(Verdict.Succeeded.class, verdict);
        assertEquals(List.of(1, 5, 9), List.copyOf(ok.proven().keySet()));
    }

    @Test
    public void testEmptyProofSucceeds() {
        var ok = assertInstanceOf(Verdict.Succeeded.class, ProofChecker.verify(List.of("# nothing here")));
        assertNull(ok.conclusion());
    }

    @Test
    public void testAcceptsSegmentedLines() {
        var checker = new ProofChecker();
        assertTrue(checker.accept(new ProofLine(1, "~~A", new Justification.Premise())));
        assertTrue(checker.accept(new ProofLine(2, "((~A->~~~A)->(~~A->A))", new Justification.Axiom(AxiomSchema.AX3))));
        assertEquals(ProofChecker.State.RUNNING, checker.state());
        assertTrue(checker.finish().valid());
        assertEquals(ProofChecker.State.SUCCEEDED, checker.state());
    }

    @Test
    public void testIdentityProof() {
        var verdict = ProofChecker.verify(List.of(
                "1. ((A->((A->A)->A))->((A->(A->A))->(A->A))) AX2",
                "2. (A->((A->A)->A)) AX1",
                "3. ((A->(A->A))->(A->A)) MP 2,1",
                "4. (A->(A->A)) AX1",
                "5. (A->A) MP 4,3"));
        assertTrue(verdict.valid(), verdict::toString);
    }

    @Test
    public void testDeeplyNestedFormulaIsSyntaxError() {
        var verdict = ProofChecker.verify(List.of("1. " + "~".repeat(20_000) + "A Premise"));
        var failed = assertFails(verdict, FailureKind.SYNTAX, 1);
        assertTrue(failed.detail().startsWith("Formula nested too deeply"));
    }

    @Test
    public void testCitationBeyondIntRangeIsForwardReference() {
        var verdict = ProofChecker.verify(List.of("1. A Premise", "2. A MP 1,99999999999"));
        assertFails(verdict, FailureKind.FORWARD_REFERENCE, 2);
    }
}

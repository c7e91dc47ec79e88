package hilbert;

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks one proof line by line.
 * <p>
 * Starts {@link State#RUNNING} with nothing proven. Each accepted line is either
 * recorded as proven or moves the checker to {@link State#FAILED}, after which
 * further lines are ignored. {@link #finish()} ends the proof. A checker holds
 * the state of exactly one proof and is not shared between threads.
 */
public final class ProofChecker {

    public enum State {RUNNING, FAILED, SUCCEEDED}

    /** Line number to proven formula; append-only. */
    private final Map<Integer, Formula> proven = new LinkedHashMap<>();
    private State state = State.RUNNING;
    @Nullable
    private Verdict.Failed failure;

    /** Checks a whole proof given as raw lines. */
    public static Verdict verify(Iterable<String> lines) {
        var checker = new ProofChecker();
        for (var line : lines) {
            if (!checker.accept(line)) break;
        }
        return checker.finish();
    }

    public State state() {
        return state;
    }

    /**
     * Feeds one raw line. Blank and comment lines are skipped.
     *
     * @return true while the proof is still running
     */
    public boolean accept(String text) {
        if (state != State.RUNNING) return false;
        if (!ProofLine.isContent(text)) return true;
        try {
            return accept(ProofLine.parse(text));
        } catch (ProofException e) {
            return fail(e);
        }
    }

    /** Feeds one already segmented line. */
    public boolean accept(ProofLine line) {
        if (state != State.RUNNING) return false;
        try {
            check(line);
            return true;
        } catch (ProofException e) {
            return fail(e);
        }
    }

    /** Ends the proof; a running checker succeeds. Idempotent. */
    public Verdict finish() {
        if (state == State.FAILED) return failure;
        state = State.SUCCEEDED;
        return new Verdict.Succeeded(proven);
    }

    private void check(ProofLine line) throws ProofException {
        var number = line.number();
        if (proven.containsKey(number))
            throw new ProofException(FailureKind.LINE_FORMAT, number, "Duplicate line number " + number);

        Formula formula;
        try {
            formula = FormulaParser.parse(line.formulaText());
        } catch (FormulaParser.SyntaxError e) {
            throw new ProofException(FailureKind.SYNTAX, number, e.getMessage());
        }

        var justification = line.justification();
        if (justification instanceof Justification.Axiom axiom) {
            if (!axiom.schema().matches(formula))
                throw new ProofException(FailureKind.SCHEMA_MISMATCH, number,
                        "Formula " + line.formulaText() + " does not match " + axiom.schema() + " schema.");
        } else if (justification instanceof Justification.ModusPonens mp) {
            checkModusPonens(number, formula, mp);
        }
        proven.put(number, formula);
    }

    private void checkModusPonens(int number, Formula formula, Justification.ModusPonens mp) throws ProofException {
        int i = mp.first(), j = mp.second();
        if (i >= number || j >= number)
            throw new ProofException(FailureKind.FORWARD_REFERENCE, number,
                    "MP refers to future lines " + i + "," + j + ".");
        var fi = proven.get(i);
        var fj = proven.get(j);
        if (fi == null || fj == null)
            throw new ProofException(FailureKind.MISSING_LINE, number,
                    "MP refers to non-existent line " + (fi == null ? i : j) + ".");
        if (!concludes(fi, fj, formula) && !concludes(fj, fi, formula))
            throw new ProofException(FailureKind.NON_CONSEQUENCE, number,
                    "Conclusion " + formula + " does not follow from lines " + i + " and " + j + " by Modus Ponens.");
    }

    /** True when {@code implication} is {@code (antecedent -> consequent)}. */
    private static boolean concludes(Formula antecedent, Formula implication, Formula consequent) {
        return implication instanceof Formula.Imp imp
                && imp.left().equals(antecedent)
                && imp.right().equals(consequent);
    }

    private boolean fail(ProofException e) {
        failure = e.toVerdict();
        state = State.FAILED;
        return false;
    }
}

package hilbert;

import java.util.Objects;

/** A rejected proof line. Converted to a {@link Verdict.Failed} by the checker. */
public class ProofException extends Exception {
    private final FailureKind kind;
    private final int lineNumber;

    public ProofException(FailureKind kind, int lineNumber, String detail) {
        super(detail);
        this.kind = Objects.requireNonNull(kind);
        this.lineNumber = lineNumber;
    }

    public FailureKind kind() {
        return kind;
    }

    /** The declared line number, or 0 when the line has none that can be read. */
    public int lineNumber() {
        return lineNumber;
    }

    public Verdict.Failed toVerdict() {
        return new Verdict.Failed(lineNumber, kind, getMessage());
    }
}

package hilbert;

/** Why a proof was rejected. */
public enum FailureKind {
    /** The line lacks a readable line number or a recognizable justification suffix. */
    LINE_FORMAT,
    /** The formula text does not conform to the grammar. */
    SYNTAX,
    /** A formula claimed as an axiom is not an instance of that schema. */
    SCHEMA_MISMATCH,
    /** Modus Ponens cites the current line or a later one. */
    FORWARD_REFERENCE,
    /** Modus Ponens cites a line that was never proven. */
    MISSING_LINE,
    /** Neither cited line is an implication from the other to the current formula. */
    NON_CONSEQUENCE
}

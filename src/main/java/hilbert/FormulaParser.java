package hilbert;

/**
 * Recursive-descent parser for formula text.
 * <pre>
 * Formula  := Variable | '~' Formula | '(' Formula '->' Formula ')'
 * Variable := [A-Z]
 * </pre>
 * Implications are always fully parenthesized, so the first {@code ->} found at
 * nesting depth zero inside a parenthesized group is its only valid split point.
 * Formulas nested deeper than {@link #MAX_DEPTH} are rejected, which bounds the
 * recursion of everything that later walks the formula.
 */
public final class FormulaParser {

    /** Deepest nesting of negations and implications accepted. */
    public static final int MAX_DEPTH = 1000;

    private final String text;

    private FormulaParser(String text) {
        this.text = text;
    }

    public static Formula parse(String text) throws SyntaxError {
        return new FormulaParser(text).parse(0, text.length(), 0);
    }

    private Formula parse(int from, int to, int depth) throws SyntaxError {
        while (from < to && Character.isWhitespace(text.charAt(from))) from++;
        while (to > from && Character.isWhitespace(text.charAt(to - 1))) to--;
        if (from == to) throw error(from, to, "Empty formula");

        var start = from;
        var negations = 0;
        while (from < to && text.charAt(from) == '~') {
            negations++;
            from++;
            while (from < to && Character.isWhitespace(text.charAt(from))) from++;
        }
        if (depth + negations > MAX_DEPTH) throw error(start, to, "Formula nested too deeply");
        if (from == to) throw error(start, to, "Negation without operand");

        var formula = parseOperand(from, to, depth + negations);
        for (var i = 0; i < negations; i++) formula = Formula.not(formula);
        return formula;
    }

    /** A variable or a parenthesized implication spanning [from, to), already trimmed. */
    private Formula parseOperand(int from, int to, int depth) throws SyntaxError {
        var c = text.charAt(from);
        if (to - from == 1 && c >= 'A' && c <= 'Z') return Formula.var(c);
        if (c == '(') {
            if (text.charAt(to - 1) != ')') throw error(from, to, "Unbalanced parentheses");
            if (depth + 1 > MAX_DEPTH) throw error(from, to, "Formula nested too deeply");
            return parseImplication(from, to, depth + 1);
        }
        throw error(from, to, "Invalid formula syntax");
    }

    /** Parses {@code (left->right)} spanning [from, to), parentheses included. */
    private Formula parseImplication(int from, int to, int depth) throws SyntaxError {
        var level = 0;
        for (var i = from + 1; i < to - 1; i++) {
            var c = text.charAt(i);
            if (c == '(') level++;
            else if (c == ')') {
                if (--level < 0) throw error(from, to, "Mismatched closing parenthesis at offset " + i);
            } else if (c == '-' && level == 0 && i + 1 < to - 1 && text.charAt(i + 1) == '>') {
                if (text.substring(from + 1, i).isBlank()) throw error(from, to, "Missing left operand of implication");
                if (text.substring(i + 2, to - 1).isBlank()) throw error(from, to, "Missing right operand of implication");
                return Formula.imp(parse(from + 1, i, depth), parse(i + 2, to - 1, depth));
            }
        }
        throw error(from, to, level != 0 ? "Unbalanced parentheses" : "Malformed implication");
    }

    private SyntaxError error(int from, int to, String reason) {
        return new SyntaxError(text.substring(from, to), from, reason);
    }

    /** Formula text that cannot be reduced to a well-formed formula. */
    public static class SyntaxError extends Exception {
        private final String input;
        private final int offset;
        private final String reason;

        SyntaxError(String input, int offset, String reason) {
            super(reason + " in '" + input + "'");
            this.input = input;
            this.offset = offset;
            this.reason = reason;
        }

        /** The offending substring. */
        public String input() {
            return input;
        }

        /** Offset of {@link #input()} within the text handed to {@link FormulaParser#parse}. */
        public int offset() {
            return offset;
        }

        public String reason() {
            return reason;
        }
    }
}

package hilbert;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One numbered, justified line of a proof, e.g. {@code 3. (B->A) MP 1,2}.
 * The formula text is kept raw; the checker parses it.
 */
public record ProofLine(int number, String formulaText, Justification justification) {

    private static final Pattern NUMBERED = Pattern.compile("^\\s*(\\d+)\\.\\s*(.+)");
    private static final Pattern JUSTIFICATION = Pattern.compile("\\s+(Premise|AX[123]|MP\\s*\\d+,\\d+)$");

    /** Comment lines start with this marker, after leading whitespace. */
    public static final String COMMENT = "#";

    public ProofLine {
        if (number <= 0) throw new IllegalArgumentException("Line number must be positive: " + number);
        Objects.requireNonNull(formulaText);
        Objects.requireNonNull(justification);
    }

    /** Blank and comment lines carry no proof content. */
    public static boolean isContent(String text) {
        var trimmed = text.trim();
        return !trimmed.isEmpty() && !trimmed.startsWith(COMMENT);
    }

    /** Splits a line into its number, formula text and justification. */
    public static ProofLine parse(String text) throws ProofException {
        var trimmed = text.trim();
        var numbered = NUMBERED.matcher(trimmed);
        if (!numbered.matches())
            throw new ProofException(FailureKind.LINE_FORMAT, 0, "Invalid line format: '" + trimmed + "'");

        var number = readNumber(numbered.group(1), trimmed);
        if (number <= 0)
            throw new ProofException(FailureKind.LINE_FORMAT, 0, "Line number must be positive: '" + trimmed + "'");

        var rest = numbered.group(2);
        var suffix = JUSTIFICATION.matcher(rest);
        if (!suffix.find())
            throw new ProofException(FailureKind.LINE_FORMAT, number, "Malformed justification: '" + trimmed + "'");

        var justification = Justification.parse(suffix.group(1)).orElseThrow(() ->
                new ProofException(FailureKind.LINE_FORMAT, number, "Malformed justification: '" + trimmed + "'"));
        return new ProofLine(number, rest.substring(0, suffix.start()).trim(), justification);
    }

    private static int readNumber(String digits, String line) throws ProofException {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ProofException(FailureKind.LINE_FORMAT, 0, "Line number out of range: '" + line + "'");
        }
    }
}

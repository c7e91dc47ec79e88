package hilbert;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/** How a proof line claims to be established. */
public sealed interface Justification permits Justification.Premise, Justification.Axiom, Justification.ModusPonens {

    Pattern MODUS_PONENS = Pattern.compile("^MP\\s*(\\d+),(\\d+)$");

    /**
     * Reads justification text such as {@code Premise}, {@code AX2} or {@code MP 1,2}.
     * Empty for anything else.
     */
    static Optional<Justification> parse(String text) {
        var trimmed = text.trim();
        return switch (trimmed) {
            case "Premise" -> Optional.of(new Premise());
            case "AX1" -> Optional.of(new Axiom(AxiomSchema.AX1));
            case "AX2" -> Optional.of(new Axiom(AxiomSchema.AX2));
            case "AX3" -> Optional.of(new Axiom(AxiomSchema.AX3));
            default -> parseModusPonens(trimmed);
        };
    }

    private static Optional<Justification> parseModusPonens(String text) {
        var m = MODUS_PONENS.matcher(text);
        if (!m.matches()) return Optional.empty();
        return Optional.of(new ModusPonens(citation(m.group(1)), citation(m.group(2))));
    }

    /** Citations beyond int range saturate; they can only ever be forward references. */
    private static int citation(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    record Premise() implements Justification {
        @Override
        public String toString() {
            return "Premise";
        }
    }

    record Axiom(AxiomSchema schema) implements Justification {
        public Axiom {
            Objects.requireNonNull(schema);
        }

        @Override
        public String toString() {
            return schema.name();
        }
    }

    /** Modus Ponens from two earlier lines, cited in either order. */
    record ModusPonens(int first, int second) implements Justification {
        @Override
        public String toString() {
            return "MP " + first + "," + second;
        }
    }
}

package hilbert;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A text document holding several proofs, each introduced by a header line
 * such as {@code --- TEST: Hypothetical syllogism ---}.
 */
public final class ProofDocument {

    public static final String DELIMITER = "--- TEST:";
    public static final String UNNAMED = "Unnamed Proof";

    private ProofDocument() {
    }

    /** A proof and the raw lines that make it up. */
    public record NamedProof(String name, List<String> lines) {
        public NamedProof {
            Objects.requireNonNull(name);
            lines = List.copyOf(lines);
        }
    }

    public static List<NamedProof> load(Path path) throws IOException {
        return split(Files.readAllLines(path));
    }

    public static List<NamedProof> split(String text) {
        return split(text.lines().toList());
    }

    /**
     * Splits on header lines. Segments without a single proof line, such as a
     * header directly followed by another, are dropped; lines ahead of the
     * first header form an unnamed proof.
     */
    public static List<NamedProof> split(List<String> lines) {
        var proofs = new ArrayList<NamedProof>();
        var name = UNNAMED;
        var current = new ArrayList<String>();
        for (var line : lines) {
            if (line.startsWith(DELIMITER)) {
                addSegment(proofs, name, current);
                name = headerName(line);
                current = new ArrayList<>();
            } else {
                current.add(line);
            }
        }
        addSegment(proofs, name, current);
        return proofs;
    }

    private static void addSegment(List<NamedProof> proofs, String name, List<String> lines) {
        if (lines.stream().anyMatch(ProofLine::isContent))
            proofs.add(new NamedProof(name, lines));
    }

    static String headerName(String header) {
        var name = header.substring(DELIMITER.length()).replace("---", "").trim();
        return name.isEmpty() ? UNNAMED : name;
    }
}

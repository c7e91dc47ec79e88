package hilbert;

import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;

/**
 * Verifies a batch of named proofs, each independently, and reports every verdict.
 * Also the command-line entry point.
 */
public final class ProofRunner {

    private final int threads;

    public ProofRunner(int threads) {
        if (threads < 1) throw new IllegalArgumentException("Thread count must be positive: " + threads);
        this.threads = threads;
    }

    public ProofRunner() {
        this(1);
    }

    // --- Main Method ---
    public static void main(String[] args) {
        Configuration config;
        try {
            config = Configuration.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error parsing args: " + e.getMessage());
            printUsageAndExit();
            return;
        }

        if (config.serve()) {
            var server = new ProofServer(config.port(), new ProofRunner(config.threads()));
            Runtime.getRuntime().addShutdownHook(new Thread(server::stopServer));
            server.start();
            System.out.println("Proof server starting on port " + config.port());
            return;
        }
        System.exit(run(config, System.out, System.err));
    }

    private static void printUsageAndExit() {
        System.err.println("Usage: java hilbert.ProofRunner [-f <proofFile>] [-t <threads>] [--json] [-p <port>] [--serve]");
        System.exit(2);
    }

    /**
     * Checks every proof in the configured file.
     *
     * @return process exit status: 0 when every proof is valid, 1 when any failed, 2 on I/O errors
     */
    static int run(Configuration config, PrintStream out, PrintStream err) {
        List<ProofDocument.NamedProof> proofs;
        try {
            proofs = ProofDocument.load(config.file());
        } catch (IOException e) {
            err.println("Error: could not read proof file '" + config.file() + "': " + e.getMessage());
            return 2;
        }

        var reports = new ProofRunner(config.threads()).run(proofs);
        if (config.json()) {
            out.println(toJson(reports).toString(2));
        } else {
            out.println("Loading all proofs from '" + config.file() + "'...");
            out.println("=".repeat(40));
            reports.forEach(r -> out.print(r.render()));
        }
        return reports.stream().allMatch(r -> r.verdict().valid()) ? 0 : 1;
    }

    /** Results come back in input order. */
    public List<Report> run(List<ProofDocument.NamedProof> proofs) {
        if (threads == 1 || proofs.size() < 2) return proofs.stream().map(ProofRunner::check).toList();

        var executor = Executors.newFixedThreadPool(Math.min(threads, proofs.size()), r -> new Thread(r, "ProofWorker"));
        try {
            var futures = executor.invokeAll(proofs.stream()
                    .<Callable<Report>>map(p -> () -> check(p))
                    .toList());
            var reports = new ArrayList<Report>(futures.size());
            for (var f : futures) reports.add(f.get());
            return reports;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while checking proofs", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Proof check failed unexpectedly: " + e.getCause(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    public static Report check(ProofDocument.NamedProof proof) {
        return new Report(proof.name(), ProofChecker.verify(proof.lines()));
    }

    public static JSONObject toJson(List<Report> reports) {
        var proofs = new JSONArray();
        reports.forEach(r -> proofs.put(r.toJson()));
        var valid = reports.stream().filter(r -> r.verdict().valid()).count();
        return new JSONObject()
                .put("proofs", proofs)
                .put("valid", valid)
                .put("failed", reports.size() - valid);
    }

    /** Verdict for one named proof. */
    public record Report(String name, Verdict verdict) {
        public Report {
            Objects.requireNonNull(name);
            Objects.requireNonNull(verdict);
        }

        public JSONObject toJson() {
            var json = new JSONObject().put("name", name).put("valid", verdict.valid());
            if (verdict instanceof Verdict.Succeeded ok) {
                var conclusion = ok.conclusion();
                if (conclusion != null) json.put("conclusion", conclusion.toString());
            } else if (verdict instanceof Verdict.Failed failed) {
                json.put("line", failed.lineNumber())
                        .put("kind", failed.kind().name())
                        .put("detail", failed.detail());
            }
            return json;
        }

        /** Console rendering, one block per proof. */
        public String render() {
            var sb = new StringBuilder("--- Verifying Proof: ").append(name).append(" ---\n");
            if (verdict instanceof Verdict.Failed failed) {
                sb.append("FAILED: ").append(describe(failed.kind())).append(" on line ").append(failed.lineNumber()).append(".\n")
                        .append("  Reason: ").append(failed.detail()).append('\n');
            } else {
                sb.append("VALID: The proof is correct.\n");
            }
            return sb.append("-".repeat(40)).append('\n').toString();
        }

        private static String describe(FailureKind kind) {
            return switch (kind) {
                case LINE_FORMAT -> "Invalid line format";
                case SYNTAX -> "Syntax Error";
                case SCHEMA_MISMATCH -> "Axiom schema mismatch";
                case FORWARD_REFERENCE -> "Forward reference";
                case MISSING_LINE -> "Missing line";
                case NON_CONSEQUENCE -> "Invalid Modus Ponens";
            };
        }
    }

    // --- Configuration Record ---
    record Configuration(Path file, int threads, boolean json, int port, boolean serve) {
        static final Configuration DEFAULT = new Configuration(
                Path.of("all_proofs.txt"),
                1,      // threads
                false,  // json
                8887,   // port
                false   // serve
        );

        static Configuration parse(String[] args) {
            var file = DEFAULT.file();
            int threads = DEFAULT.threads(), port = DEFAULT.port();
            boolean json = DEFAULT.json(), serve = DEFAULT.serve();
            for (var i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "-f", "--file" -> file = Path.of(value(args, ++i));
                    case "-t", "--threads" -> threads = Integer.parseInt(value(args, ++i));
                    case "-p", "--port" -> port = Integer.parseInt(value(args, ++i));
                    case "--json" -> json = true;
                    case "--serve" -> serve = true;
                    default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
                }
            }
            if (threads < 1) throw new IllegalArgumentException("Thread count must be positive: " + threads);
            if (port < 0 || port > 65535) throw new IllegalArgumentException("Port out of range: " + port);
            return new Configuration(file, threads, json, port, serve);
        }

        private static String value(String[] args, int i) {
            if (i >= args.length) throw new IllegalArgumentException("Missing value for " + args[i - 1]);
            return args[i];
        }
    }
}

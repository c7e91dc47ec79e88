package hilbert;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Terminal outcome of checking one proof. */
public sealed interface Verdict permits Verdict.Succeeded, Verdict.Failed {

    boolean valid();

    /**
     * Every line proved.
     *
     * @param proven line number to proven formula, in proof order
     */
    record Succeeded(Map<Integer, Formula> proven) implements Verdict {
        public Succeeded {
            proven = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(proven)));
        }

        @Override
        public boolean valid() {
            return true;
        }

        /** The formula proven by the last line; null for an empty proof. */
        @Nullable
        public Formula conclusion() {
            Formula last = null;
            for (var f : proven.values()) last = f;
            return last;
        }
    }

    /** @param lineNumber declared number of the rejected line, or 0 when it has none */
    record Failed(int lineNumber, FailureKind kind, String detail) implements Verdict {
        public Failed {
            Objects.requireNonNull(kind);
            Objects.requireNonNull(detail);
        }

        @Override
        public boolean valid() {
            return false;
        }

        @Override
        public String toString() {
            return kind + " on line " + lineNumber + ": " + detail;
        }
    }
}

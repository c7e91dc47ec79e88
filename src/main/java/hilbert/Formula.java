package hilbert;

import java.util.Objects;

/**
 * A propositional formula over negation and implication.
 * Immutable; equality is deep structural equality, so two formulas parsed from
 * different texts are equal whenever they have the same shape and variables.
 */
public sealed interface Formula permits Formula.Var, Formula.Not, Formula.Imp {

    default boolean isVariable() {
        return this instanceof Var;
    }

    default boolean isNegation() {
        return this instanceof Not;
    }

    default boolean isImplication() {
        return this instanceof Imp;
    }

    static Var var(char name) {
        return new Var(name);
    }

    static Not not(Formula inner) {
        return new Not(inner);
    }

    static Imp imp(Formula left, Formula right) {
        return new Imp(left, right);
    }

    /** A propositional variable, named by a single uppercase letter. */
    record Var(char name) implements Formula {
        public Var {
            if (name < 'A' || name > 'Z')
                throw new IllegalArgumentException("Variable name must be a single uppercase letter: '" + name + "'");
        }

        @Override
        public String toString() {
            return String.valueOf(name);
        }
    }

    record Not(Formula inner) implements Formula {
        public Not {
            Objects.requireNonNull(inner);
        }

        @Override
        public String toString() {
            return "~" + inner;
        }
    }

    record Imp(Formula left, Formula right) implements Formula {
        public Imp {
            Objects.requireNonNull(left);
            Objects.requireNonNull(right);
        }

        @Override
        public String toString() {
            return "(" + left + "->" + right + ")";
        }
    }
}

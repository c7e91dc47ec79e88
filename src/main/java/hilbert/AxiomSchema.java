package hilbert;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static hilbert.Formula.imp;
import static hilbert.Formula.not;
import static hilbert.Formula.var;

/**
 * The three axiom schemas. Each template is a formula whose variables are
 * metavariables; a formula is an instance when every metavariable can be bound
 * to a sub-formula such that all occurrences of it bind to equal sub-formulas.
 */
public enum AxiomSchema {

    /** {@code A -> (B -> A)} */
    AX1(imp(var('A'), imp(var('B'), var('A')))),

    /** {@code (A -> (B -> C)) -> ((A -> B) -> (A -> C))} */
    AX2(imp(imp(var('A'), imp(var('B'), var('C'))),
            imp(imp(var('A'), var('B')), imp(var('A'), var('C'))))),

    /** {@code (~B -> ~A) -> (A -> B)} */
    AX3(imp(imp(not(var('B')), not(var('A'))), imp(var('A'), var('B'))));

    private final Formula template;

    AxiomSchema(Formula template) {
        this.template = template;
    }

    public Formula template() {
        return template;
    }

    /**
     * Binds the schema's metavariables against {@code formula}.
     *
     * @return metavariable name to bound sub-formula, or empty when the formula is
     * not an instance of this schema
     */
    public Optional<Map<Character, Formula>> bind(Formula formula) {
        var bindings = new HashMap<Character, Formula>();
        return unify(template, formula, bindings) ? Optional.of(Map.copyOf(bindings)) : Optional.empty();
    }

    public boolean matches(Formula formula) {
        return bind(formula).isPresent();
    }

    public static boolean isAxiom1(Formula formula) {
        return AX1.matches(formula);
    }

    public static boolean isAxiom2(Formula formula) {
        return AX2.matches(formula);
    }

    public static boolean isAxiom3(Formula formula) {
        return AX3.matches(formula);
    }

    /**
     * One-way unification of a schema pattern with a concrete formula. A
     * metavariable binds on first occurrence; later occurrences must equal the
     * bound sub-formula.
     */
    static boolean unify(Formula pattern, Formula formula, Map<Character, Formula> bindings) {
        if (pattern instanceof Formula.Var meta) {
            var bound = bindings.putIfAbsent(meta.name(), formula);
            return bound == null || bound.equals(formula);
        }
        if (pattern instanceof Formula.Not p) {
            return formula.isNegation() && unify(p.inner(), ((Formula.Not) formula).inner(), bindings);
        }
        var p = (Formula.Imp) pattern;
        if (!formula.isImplication()) return false;
        var f = (Formula.Imp) formula;
        return unify(p.left(), f.left(), bindings) && unify(p.right(), f.right(), bindings);
    }
}

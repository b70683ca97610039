package org.prover.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Unificazione al primo ordine con occurs check.
 *
 * Solo i segnaposto ({@link Term.Hole} e {@link Formula.Meta}) sono legabili;
 * le variabili ordinarie si comportano come simboli rigidi. I corpi dei
 * quantificatori sono confrontati dopo aver rinominato entrambe le variabili
 * legate con lo stesso nome locale; un segnaposto non può essere legato a un
 * valore che contiene una variabile locale, che altrimenti uscirebbe dal suo
 * quantificatore.
 */
public final class Unifier {

    /** Prefisso dei nomi locali: non può comparire in un identificatore */
    private static final String LOCAL_PREFIX = "§";

    private Unifier() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static Optional<Substitution> unify(Formula f1, Formula f2) {
        return unify(f1, f2, Substitution.empty());
    }

    public static Optional<Substitution> unify(Term t1, Term t2) {
        return unify(t1, t2, Substitution.empty());
    }

    //region FORMULE

    public static Optional<Substitution> unify(Formula f1, Formula f2, Substitution theta) {
        return unify(f1, f2, theta, List.of());
    }

    /**
     * @param bound nomi locali introdotti dai quantificatori attraversati
     */
    private static Optional<Substitution> unify(Formula f1, Formula f2, Substitution theta, List<String> bound) {
        f1 = theta.walk(f1);
        f2 = theta.walk(f2);

        if (f1.equals(f2)) {
            return Optional.of(theta);
        } else if (f1 instanceof Formula.Meta meta) {
            return unifyMeta(meta, f2, theta, bound);
        } else if (f2 instanceof Formula.Meta meta) {
            return unifyMeta(meta, f1, theta, bound);
        } else if (f1.kind() != f2.kind()) {
            return Optional.empty();
        }

        switch (f1.kind()) {
            case ATOMIC: {
                Formula.Atomic a1 = (Formula.Atomic) f1;
                Formula.Atomic a2 = (Formula.Atomic) f2;
                if (!a1.predicate().equals(a2.predicate())) {
                    return Optional.empty();
                }
                return unifyTerms(a1.terms(), a2.terms(), theta, bound);
            }
            case FUNCTION_APPLICATION: {
                Formula.FunctionApplication a1 = (Formula.FunctionApplication) f1;
                Formula.FunctionApplication a2 = (Formula.FunctionApplication) f2;
                if (!a1.name().equals(a2.name())) {
                    return Optional.empty();
                }
                return unifyTerms(a1.arguments(), a2.arguments(), theta, bound);
            }
            case UNIVERSAL:
            case EXISTENTIAL:
                return unifyQuantified(f1, f2, theta, bound);
            default: {
                Optional<Substitution> afterTerms = unifyTerms(Formulas.terms(f1), Formulas.terms(f2), theta, bound);
                if (afterTerms.isEmpty()) {
                    return Optional.empty();
                }
                return unifyFormulas(Formulas.children(f1), Formulas.children(f2), afterTerms.get(), bound);
            }
        }
    }

    private static Optional<Substitution> unifyQuantified(Formula f1, Formula f2, Substitution theta,
                                                          List<String> bound) {
        Quantifier q1 = quantifierOf(f1);
        Quantifier q2 = quantifierOf(f2);
        if (!Objects.equals(q1.type(), q2.type()) || q1.hasDomain() != q2.hasDomain()) {
            return Optional.empty();
        }
        Substitution current = theta;
        if (q1.hasDomain()) {
            Optional<Substitution> res = unify(q1.domain(), q2.domain(), current, bound);
            if (res.isEmpty()) return Optional.empty();
            current = res.get();
        }

        String local = LOCAL_PREFIX + bound.size();
        Term.Variable shared = new Term.Variable(local, q1.type());
        Formula body1 = Formulas.substituteVariable(Formulas.children(f1).get(0), q1.variable(), shared);
        Formula body2 = Formulas.substituteVariable(Formulas.children(f2).get(0), q2.variable(), shared);

        List<String> inner = new ArrayList<>(bound);
        inner.add(local);
        return unify(body1, body2, current, List.copyOf(inner));
    }

    private static Optional<Substitution> unifyMeta(Formula.Meta meta, Formula formula, Substitution theta,
                                                    List<String> bound) {
        if (formula instanceof Formula.Meta other && other.name().equals(meta.name())) {
            return Optional.of(theta);
        } else if (occurs(meta, formula, theta)) {
            return Optional.empty();
        } else if (mentionsLocal(Formulas.freeVariables(theta.apply(formula)), bound)) {
            return Optional.empty();
        }
        return Optional.of(theta.bind(meta.name(), formula));
    }

    private static boolean occurs(Formula.Meta meta, Formula formula, Substitution theta) {
        Formula walked = theta.walk(formula);
        if (walked instanceof Formula.Meta other) {
            return other.name().equals(meta.name());
        }
        for (Formula child : Formulas.children(walked)) {
            if (occurs(meta, child, theta)) return true;
        }
        return false;
    }

    private static Optional<Substitution> unifyFormulas(List<Formula> l1, List<Formula> l2, Substitution theta,
                                                        List<String> bound) {
        if (l1.size() != l2.size()) {
            return Optional.empty();
        }
        Substitution current = theta;
        for (int i = 0; i < l1.size(); i++) {
            var res = unify(l1.get(i), l2.get(i), current, bound);
            if (res.isEmpty()) return Optional.empty();
            current = res.get();
        }
        return Optional.of(current);
    }

    private static Quantifier quantifierOf(Formula formula) {
        return formula instanceof Formula.Universal u ? u.quantifier() : ((Formula.Existential) formula).quantifier();
    }

    //endregion

    //region TERMINI

    public static Optional<Substitution> unify(Term t1, Term t2, Substitution theta) {
        return unify(t1, t2, theta, List.of());
    }

    private static Optional<Substitution> unify(Term t1, Term t2, Substitution theta, List<String> bound) {
        t1 = theta.walk(t1);
        t2 = theta.walk(t2);

        if (t1.equals(t2)) {
            return Optional.of(theta);
        } else if (t1 instanceof Term.Hole hole) {
            return unifyHole(hole, t2, theta, bound);
        } else if (t2 instanceof Term.Hole hole) {
            return unifyHole(hole, t1, theta, bound);
        } else if (t1 instanceof Term.Variable v1 && t2 instanceof Term.Variable v2) {
            return v1.name().equals(v2.name()) ? Optional.of(theta) : Optional.empty();
        } else if (t1.kind() != t2.kind()) {
            return Optional.empty();
        }

        switch (t1.kind()) {
            case FUNCTION: {
                Term.Function fn1 = (Term.Function) t1;
                Term.Function fn2 = (Term.Function) t2;
                if (!fn1.name().equals(fn2.name())) {
                    return Optional.empty();
                }
                return unifyTerms(fn1.arguments(), fn2.arguments(), theta, bound);
            }
            case ARITHMETIC: {
                if (((Term.Arithmetic) t1).operator() != ((Term.Arithmetic) t2).operator()) {
                    return Optional.empty();
                }
                return unifyTerms(Formulas.children(t1), Formulas.children(t2), theta, bound);
            }
            case SET:
            case ARRAY_ACCESS:
                return unifyTerms(Formulas.children(t1), Formulas.children(t2), theta, bound);
            default:
                // costanti diverse
                return Optional.empty();
        }
    }

    private static Optional<Substitution> unifyHole(Term.Hole hole, Term term, Substitution theta,
                                                    List<String> bound) {
        if (term instanceof Term.Hole other && other.name().equals(hole.name())) {
            return Optional.of(theta);
        } else if (occurs(hole, term, theta)) {
            return Optional.empty();
        } else if (mentionsLocal(Formulas.freeVariables(theta.apply(term)), bound)) {
            return Optional.empty();
        }
        return Optional.of(theta.bind(hole.name(), term));
    }

    private static boolean occurs(Term.Hole hole, Term term, Substitution theta) {
        Term walked = theta.walk(term);
        if (walked instanceof Term.Hole other) {
            return other.name().equals(hole.name());
        }
        for (Term child : Formulas.children(walked)) {
            if (occurs(hole, child, theta)) return true;
        }
        return false;
    }

    private static Optional<Substitution> unifyTerms(List<Term> l1, List<Term> l2, Substitution theta,
                                                     List<String> bound) {
        if (l1.size() != l2.size()) {
            return Optional.empty();
        }
        Substitution current = theta;
        for (int i = 0; i < l1.size(); i++) {
            var res = unify(l1.get(i), l2.get(i), current, bound);
            if (res.isEmpty()) return Optional.empty();
            current = res.get();
        }
        return Optional.of(current);
    }

    private static boolean mentionsLocal(Set<String> variables, List<String> bound) {
        for (String local : bound) {
            if (variables.contains(local)) {
                return true;
            }
        }
        return false;
    }

    //endregion
}

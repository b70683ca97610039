package org.prover.search;

import org.prover.formula.Formula;
import org.prover.formula.FormulaKey;

/**
 * Letterale di una clausola: formula atomica (per la risoluzione) con polarità.
 *
 * Sono atomi anche le formule temporali, i confronti aritmetici e le appartenenze:
 * la risoluzione li tratta come simboli opachi.
 */
public record Literal(Formula atom, boolean positive) {

    public Literal {
        if (atom == null) {
            throw new IllegalArgumentException("Atomo del letterale non può essere null");
        }
        if (atom instanceof Formula.Negation) {
            throw new IllegalArgumentException("Atomo del letterale non può essere una negazione");
        }
    }

    public static Literal positive(Formula atom) {
        return new Literal(atom, true);
    }

    public static Literal negative(Formula atom) {
        return new Literal(atom, false);
    }

    public Literal complement() {
        return new Literal(atom, !positive);
    }

    /** Letterale come formula: l'atomo o la sua negazione */
    public Formula toFormula() {
        return positive ? atom : Formula.not(atom);
    }

    public FormulaKey key() {
        return FormulaKey.of(toFormula());
    }

    /** Vero per gli atomi costanti true/false */
    boolean isTruthConstant() {
        return atom.equals(Formula.truth()) || atom.equals(Formula.falsum());
    }

    /** Valore di verità del letterale costante; da usare solo se {@link #isTruthConstant()} */
    boolean truthValue() {
        return atom.equals(Formula.truth()) == positive;
    }

    @Override
    public String toString() {
        return positive ? atom.toString() : "!" + atom;
    }
}

package org.prover.search;

import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;
import org.prover.formula.Formulas;
import org.prover.formula.Term;

import java.util.ArrayList;
import java.util.List;

/**
 * Apertura di assiomi e regole per una singola applicazione.
 *
 * Ogni applicazione usa un suffisso nuovo, così i segnaposto di due usi dello
 * stesso schema non si legano tra loro.
 */
final class Patterns {

    private Patterns() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Rinomina i segnaposto e sostituisce il prefisso universale con segnaposto
     * di termine: forall x. P(x) diventa P(?x#n).
     */
    static Formula open(Formula formula, String suffix) {
        Formula current = Formulas.renameHoles(formula, suffix);
        while (current instanceof Formula.Universal universal && !universal.quantifier().hasDomain()) {
            String variable = universal.quantifier().variable();
            current = Formulas.substituteVariable(universal.body(), variable, new Term.Hole(variable + suffix));
        }
        return current;
    }

    /** Copia della regola con segnaposto rinominati */
    static InferenceRule rename(InferenceRule rule, String suffix) {
        List<Formula> premises = new ArrayList<>();
        for (Formula premise : rule.premises()) {
            premises.add(Formulas.renameHoles(premise, suffix));
        }
        return new InferenceRule(rule.name(), premises, Formulas.renameHoles(rule.conclusion(), suffix),
                rule.type(), rule.priority());
    }

    /** Numero di segnaposto (di termine e di formula) non ancora legati */
    static int countHoles(Formula formula) {
        if (formula instanceof Formula.Meta) {
            return 1;
        }
        int count = 0;
        for (Term term : Formulas.terms(formula)) {
            count += countHoles(term);
        }
        for (Formula child : Formulas.children(formula)) {
            count += countHoles(child);
        }
        return count;
    }

    private static int countHoles(Term term) {
        if (term instanceof Term.Hole) {
            return 1;
        }
        int count = 0;
        for (Term child : Formulas.children(term)) {
            count += countHoles(child);
        }
        return count;
    }
}

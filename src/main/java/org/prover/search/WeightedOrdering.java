package org.prover.search;

import org.prover.axiom.Axiom;
import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;
import org.prover.formula.Formulas;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordinamento dei candidati per punteggio crescente:
 *
 *   punteggio = complexity * dimensione/10 + goalDistance * distanza - priority * priorità
 *
 * La distanza vale 0 se il simbolo di testa del candidato coincide con quello
 * dell'obiettivo, 0.5 se il candidato è un segnaposto, 1 altrimenti.
 * L'ordinamento è stabile: a parità di punteggio resta l'ordine di dichiarazione.
 */
public class WeightedOrdering implements CandidateOrdering {

    private final HeuristicWeights weights;

    public WeightedOrdering(HeuristicWeights weights) {
        if (weights == null) {
            throw new IllegalArgumentException("Pesi euristici non possono essere null");
        }
        this.weights = weights;
    }

    @Override
    public List<Axiom> orderAxioms(List<Axiom> axioms, Formula goal) {
        if (axioms.size() < 2) {
            return axioms;
        }
        List<Axiom> ordered = new ArrayList<>(axioms);
        ordered.sort(Comparator.comparingDouble(a -> score(a.formula(), a.priority(), weights.axiomPriority(), goal)));
        return ordered;
    }

    @Override
    public List<InferenceRule> orderRules(List<InferenceRule> rules, Formula goal) {
        if (rules.size() < 2) {
            return rules;
        }
        List<InferenceRule> ordered = new ArrayList<>(rules);
        ordered.sort(Comparator.comparingDouble(r -> score(r.conclusion(), r.priority(), weights.rulePriority(), goal)));
        return ordered;
    }

    double score(Formula candidate, int priority, double priorityWeight, Formula goal) {
        Formula head = stripUniversals(candidate);
        return weights.complexity() * Formulas.size(head) / 10.0
                + weights.goalDistance() * distance(head, goal)
                - priorityWeight * priority;
    }

    private static double distance(Formula candidate, Formula goal) {
        if (candidate instanceof Formula.Meta) {
            return 0.5;
        }
        return Formulas.headSymbol(candidate).equals(Formulas.headSymbol(goal)) ? 0.0 : 1.0;
    }

    private static Formula stripUniversals(Formula formula) {
        Formula current = formula;
        while (current instanceof Formula.Universal universal) {
            current = universal.body();
        }
        return current;
    }
}

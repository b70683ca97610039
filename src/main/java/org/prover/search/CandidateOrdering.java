package org.prover.search;

import org.prover.axiom.Axiom;
import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;

import java.util.List;

/**
 * Ordine in cui assiomi e regole vengono tentati per un obiettivo.
 *
 * Punto di estensione: il ciclo di ricerca chiede solo liste ordinate, quindi
 * euristiche alternative si sostituiscono senza modificare le strategie.
 */
public interface CandidateOrdering {

    List<Axiom> orderAxioms(List<Axiom> axioms, Formula goal);

    List<InferenceRule> orderRules(List<InferenceRule> rules, Formula goal);

    /** Ordine di dichiarazione, nessun riordino */
    static CandidateOrdering declarationOrder() {
        return new CandidateOrdering() {
            @Override
            public List<Axiom> orderAxioms(List<Axiom> axioms, Formula goal) {
                return axioms;
            }

            @Override
            public List<InferenceRule> orderRules(List<InferenceRule> rules, Formula goal) {
                return rules;
            }
        };
    }

    /** Ordinamento per punteggio pesato, vedi {@link WeightedOrdering} */
    static CandidateOrdering weighted(HeuristicWeights weights) {
        return new WeightedOrdering(weights);
    }
}

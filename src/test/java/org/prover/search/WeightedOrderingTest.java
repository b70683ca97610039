package org.prover.search;

import org.junit.jupiter.api.Test;
import org.prover.axiom.Axiom;
import org.prover.axiom.AxiomType;
import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WeightedOrderingTest {

    private static final Formula A = Formula.atom("A");
    private static final Formula B = Formula.atom("B");

    @Test
    void rulesConcludingGoalSymbolComeFirst() {
        InferenceRule other = InferenceRule.of("other", List.of(), B);
        InferenceRule matching = InferenceRule.of("matching", List.of(), A);

        List<InferenceRule> ordered = new WeightedOrdering(HeuristicWeights.defaults())
                .orderRules(List.of(other, matching), A);

        assertEquals(List.of(matching, other), ordered);
    }

    @Test
    void higherPriorityAxiomsComeFirst() {
        Axiom low = new Axiom("low", B, AxiomType.DOMAIN, 0);
        Axiom high = new Axiom("high", B, AxiomType.DOMAIN, 10);

        List<Axiom> ordered = new WeightedOrdering(new HeuristicWeights(0, 1, 1, 0))
                .orderAxioms(List.of(low, high), A);

        assertEquals(List.of(high, low), ordered);
    }

    @Test
    void equalScoresKeepDeclarationOrder() {
        Axiom first = Axiom.of("first", B);
        Axiom second = Axiom.of("second", Formula.atom("C"));

        List<Axiom> ordered = new WeightedOrdering(HeuristicWeights.defaults())
                .orderAxioms(List.of(first, second), A);

        assertEquals(List.of(first, second), ordered);
    }

    @Test
    void declarationOrderLeavesCandidatesUntouched() {
        List<InferenceRule> rules = List.of(InferenceRule.of("other", List.of(), B),
                InferenceRule.of("matching", List.of(), A));

        assertEquals(rules, CandidateOrdering.declarationOrder().orderRules(rules, A));
    }

    @Test
    void negativeWeightsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HeuristicWeights(-1, 0, 0, 0));
    }
}

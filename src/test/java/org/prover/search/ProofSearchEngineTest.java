package org.prover.search;

import org.junit.jupiter.api.Test;
import org.prover.axiom.Axiom;
import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;
import org.prover.formula.Substitution;
import org.prover.formula.Term;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProofSearchEngineTest {

    private static final Formula A = Formula.atom("A");
    private static final Formula B = Formula.atom("B");
    private static final Formula C = Formula.atom("C");
    private static final Formula D = Formula.atom("D");
    private static final Formula P = Formula.atom("P");
    private static final Formula Q = Formula.atom("Q");

    private static final InferenceRule MODUS_PONENS = InferenceRule.of("mp",
            List.of(Formula.meta("P"), Formula.implies(Formula.meta("P"), Formula.meta("Q"))), Formula.meta("Q"));

    private static ProofSearchEngine engine(List<Axiom> axioms, List<InferenceRule> rules) {
        return new ProofSearchEngine(axioms, rules, SearchConfig.defaults());
    }

    //region ASSIOMI DIRETTI

    @Test
    void directAxiomIsProvenWithoutBacktracking() {
        ProofSearchEngine engine = engine(List.of(Axiom.of("p", P)), List.of());

        for (SearchStrategyType type : List.of(SearchStrategyType.NATURAL_DEDUCTION,
                SearchStrategyType.BACKWARD_CHAINING, SearchStrategyType.FORWARD_CHAINING)) {
            ProofSearchResult result = engine.prove(P, type);
            assertTrue(result.isProven(), type.name());
            assertEquals(0, result.statistics().getBacktrackCount(), type.name());
            assertEquals(P, result.steps().get(result.steps().size() - 1).formula(), type.name());
            assertEquals(TerminationReason.PROOF_FOUND, result.statistics().getTerminationReason());
        }
    }

    @Test
    void naturalDeductionProofOfAxiomIsSingleStep() {
        ProofSearchResult result = engine(List.of(Axiom.of("p", P)), List.of()).naturalDeduction(P);

        assertEquals(1, result.steps().size());
        assertTrue(result.steps().get(0).justification() instanceof Justification.ByAxiom);
    }

    @Test
    void underivableGoalIsUnknownForEveryStrategy() {
        ProofSearchEngine engine = engine(List.of(Axiom.of("p", P)), List.of());

        for (SearchStrategyType type : SearchStrategyType.values()) {
            ProofSearchResult result = engine.prove(Q, type);
            assertTrue(result.verdict().isUnknown(), type.name());
            assertTrue(result.steps().isEmpty(), type.name());
            assertEquals("nessuna prova trovata", result.verdict().reason(), type.name());
        }
    }

    @Test
    void universalAxiomDoesNotProveCapturedInstance() {
        // da "ogni x ha un y" non segue "esiste y in relazione con se stesso"
        Formula axiom = Formula.forall("x", Formula.exists("y", Formula.atom("Q", Term.var("x"), Term.var("y"))));
        Formula goal = Formula.exists("y", Formula.atom("Q", Term.var("y"), Term.var("y")));
        ProofSearchEngine engine = engine(List.of(Axiom.of("serie", axiom)), List.of());

        for (SearchStrategyType type : List.of(SearchStrategyType.NATURAL_DEDUCTION,
                SearchStrategyType.BACKWARD_CHAINING, SearchStrategyType.FORWARD_CHAINING)) {
            assertFalse(engine.prove(goal, type).isProven(), type.name());
        }
    }

    @Test
    void universalAxiomProvesGroundInstance() {
        Formula axiom = Formula.forall("x", Formula.exists("y", Formula.atom("Q", Term.var("x"), Term.var("y"))));
        Formula goal = Formula.exists("z", Formula.atom("Q", Term.var("c"), Term.var("z")));
        ProofSearchEngine engine = engine(List.of(Axiom.of("serie", axiom)), List.of());

        for (SearchStrategyType type : List.of(SearchStrategyType.NATURAL_DEDUCTION,
                SearchStrategyType.BACKWARD_CHAINING)) {
            assertTrue(engine.prove(goal, type).isProven(), type.name());
        }
    }

    //endregion

    //region REGOLE

    @Test
    void modusPonensProvesConsequent() {
        ProofSearchEngine engine = engine(List.of(Axiom.of("a", A), Axiom.of("a_implies_b", Formula.implies(A, B))),
                List.of(MODUS_PONENS));

        for (SearchStrategyType type : List.of(SearchStrategyType.NATURAL_DEDUCTION,
                SearchStrategyType.BACKWARD_CHAINING, SearchStrategyType.FORWARD_CHAINING)) {
            ProofSearchResult result = engine.prove(B, type);
            assertTrue(result.isProven(), type.name());
            ProofStep last = result.steps().get(result.steps().size() - 1);
            assertEquals(B, last.formula(), type.name());
        }
    }

    @Test
    void naturalDeductionRecordsRuleWithPremises() {
        ProofSearchEngine engine = engine(List.of(Axiom.of("a", A), Axiom.of("a_implies_b", Formula.implies(A, B))),
                List.of(MODUS_PONENS));

        ProofSearchResult result = engine.naturalDeduction(B);

        ProofStep last = result.steps().get(result.steps().size() - 1);
        assertEquals(new Justification.ByRule("mp", Substitution.empty()), last.justification());
        assertEquals(2, last.dependencies().size());
        for (int dependency : last.dependencies()) {
            assertTrue(dependency < last.index());
        }
    }

    @Test
    void backwardChainingNeedsEnoughDepth() {
        List<InferenceRule> chain = List.of(
                InferenceRule.of("r1", List.of(A), B),
                InferenceRule.of("r2", List.of(B), C),
                InferenceRule.of("r3", List.of(C), D));
        List<Axiom> axioms = List.of(Axiom.of("a", A));

        ProofSearchResult shallow = new ProofSearchEngine(axioms, chain, SearchConfig.defaults().withMaxDepth(1))
                .backwardChaining(D);
        ProofSearchResult deep = new ProofSearchEngine(axioms, chain, SearchConfig.defaults().withMaxDepth(3))
                .backwardChaining(D);

        assertTrue(shallow.verdict().isUnknown());
        assertEquals("limite di profondità raggiunto", shallow.verdict().reason());
        assertTrue(deep.isProven());
        assertEquals(4, deep.steps().size());
    }

    @Test
    void forwardChainingTerminatesWhenGoalIsNotDerivable() {
        ProofSearchEngine engine = engine(List.of(Axiom.of("a", A)),
                List.of(InferenceRule.of("r1", List.of(A), B)));

        ProofSearchResult result = engine.forwardChaining(C);

        assertTrue(result.verdict().isUnknown());
        assertEquals(TerminationReason.EXHAUSTED, result.statistics().getTerminationReason());
    }

    @Test
    void implicationIsIntroducedByDischargingAssumption() {
        ProofSearchEngine engine = new ProofSearchEngine(List.of(), List.of(), SearchConfig.defaults(),
                CandidateOrdering.declarationOrder());

        ProofSearchResult result = engine.naturalDeduction(Formula.implies(A, A));

        assertTrue(result.isProven());
        assertTrue(result.steps().get(0).justification() instanceof Justification.Assumption);
        assertEquals(new Justification.Introduction("→I"), result.steps().get(1).justification());

        ProofComplexity complexity = result.complexity();
        assertEquals(2, complexity.stepCount());
        assertEquals(1, complexity.maxDischargeDepth());
        assertEquals(1, complexity.ruleApplications());
    }

    //endregion

    //region RISOLUZIONE

    @Test
    void resolutionRefutesNegatedGoalInFirstPass() {
        ProofSearchResult result = engine(List.of(Axiom.of("p", P)), List.of()).resolution(P);

        assertTrue(result.isProven());
        assertEquals(1, result.statistics().getIterations());
        ProofStep last = result.steps().get(result.steps().size() - 1);
        assertEquals(Formula.falsum(), last.formula());
        assertTrue(last.justification() instanceof Justification.Resolvent);
    }

    @Test
    void resolutionUsesImplicationAxioms() {
        ProofSearchEngine engine = engine(List.of(Axiom.of("a", A), Axiom.of("a_implies_b", Formula.implies(A, B))),
                List.of());

        assertTrue(engine.resolution(B).isProven());
    }

    //endregion

    //region CACHE E LIMITI

    @Test
    void secondCallIsServedFromCache() {
        ProofSearchEngine engine = engine(List.of(Axiom.of("p", P)), List.of());

        ProofSearchResult first = engine.naturalDeduction(P);
        ProofSearchResult second = engine.naturalDeduction(P);

        assertEquals(0, first.statistics().getCacheHits());
        assertEquals(1, second.statistics().getCacheHits());
        assertEquals(first.verdict(), second.verdict());
        assertEquals(first.steps(), second.steps());
        assertEquals(1, engine.getCacheSize());
    }

    @Test
    void cachingCanBeDisabled() {
        ProofSearchEngine engine = new ProofSearchEngine(List.of(Axiom.of("p", P)), List.of(),
                SearchConfig.defaults().withCaching(false));

        engine.naturalDeduction(P);
        ProofSearchResult second = engine.naturalDeduction(P);

        assertEquals(0, second.statistics().getCacheHits());
        assertEquals(0, engine.getCacheSize());
    }

    @Test
    void expiredStrategyTimeoutIsUnknown() {
        List<InferenceRule> chain = List.of(
                InferenceRule.of("r1", List.of(A), B),
                InferenceRule.of("r2", List.of(B), C),
                InferenceRule.of("r3", List.of(C), D));
        ProofSearchEngine engine = new ProofSearchEngine(List.of(Axiom.of("a", A)), chain,
                SearchConfig.defaults().withTimeout(Duration.ofNanos(1)));

        ProofSearchResult result = engine.backwardChaining(D);

        assertTrue(result.verdict().isUnknown());
        assertEquals("limite di tempo raggiunto", result.verdict().reason());
        assertEquals(TerminationReason.TIMEOUT, result.statistics().getTerminationReason());
        assertEquals(0, engine.getCacheSize());
    }

    @Test
    void exhaustedBudgetDoesNotStartSearch() {
        ProofSearchEngine engine = engine(List.of(Axiom.of("p", P)), List.of());

        ProofSearchResult result = engine.prove(P, SearchStrategyType.NATURAL_DEDUCTION, Duration.ZERO);

        assertTrue(result.verdict().isUnknown());
        assertEquals(TerminationReason.TIMEOUT, result.statistics().getTerminationReason());
        assertEquals(0, result.statistics().getStepsExplored());
        assertTrue(engine.prove(P, SearchStrategyType.NATURAL_DEDUCTION, Duration.ofSeconds(5)).isProven());
    }

    @Test
    void interruptedThreadStopsSearch() {
        ProofSearchEngine engine = engine(List.of(Axiom.of("a", A)),
                List.of(InferenceRule.of("r1", List.of(A), B)));

        ProofSearchResult result;
        Thread.currentThread().interrupt();
        try {
            result = engine.backwardChaining(B);
        } finally {
            Thread.interrupted();
        }

        assertFalse(result.isProven());
        assertEquals(TerminationReason.TIMEOUT, result.statistics().getTerminationReason());
    }

    @Test
    void cacheKeepsOnlyMostRecentlyUsedResults() {
        ProofSearchEngine engine = new ProofSearchEngine(
                List.of(Axiom.of("p", P), Axiom.of("q", Q), Axiom.of("a", A)), List.of(),
                SearchConfig.defaults(), CandidateOrdering.declarationOrder(), 2);

        engine.naturalDeduction(P);
        engine.naturalDeduction(Q);
        engine.naturalDeduction(P);
        engine.naturalDeduction(A);

        assertEquals(2, engine.getCacheSize());
        assertEquals(1, engine.naturalDeduction(P).statistics().getCacheHits());
        assertEquals(0, engine.naturalDeduction(Q).statistics().getCacheHits());
    }

    @Test
    void stepLimitStopsSearch() {
        ProofSearchEngine engine = new ProofSearchEngine(List.of(Axiom.of("a", A)),
                List.of(InferenceRule.of("r1", List.of(A), B), InferenceRule.of("r2", List.of(B), C)),
                SearchConfig.defaults().withMaxSteps(0));

        ProofSearchResult result = engine.naturalDeduction(C);

        assertFalse(result.isProven());
        assertEquals("limite di passi raggiunto", result.verdict().reason());
        assertEquals(TerminationReason.STEP_LIMIT, result.statistics().getTerminationReason());
    }

    //endregion

    //region ESTRAZIONE

    @Test
    void extractProofKeepsOnlyAncestorsAndRenumbers() {
        List<ProofStep> steps = List.of(
                new ProofStep(0, A, new Justification.ByAxiom("a", Substitution.empty()), List.of(), 0),
                new ProofStep(1, C, new Justification.ByAxiom("c", Substitution.empty()), List.of(), 0),
                new ProofStep(2, B, new Justification.ByRule("r1", Substitution.empty()), List.of(0), 0));

        List<ProofStep> proof = ProofSearchEngine.extractProof(steps, 2);

        assertEquals(2, proof.size());
        assertEquals(A, proof.get(0).formula());
        assertEquals(B, proof.get(1).formula());
        assertEquals(1, proof.get(1).index());
        assertEquals(List.of(0), proof.get(1).dependencies());
    }

    //endregion
}

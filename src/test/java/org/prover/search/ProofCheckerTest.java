package org.prover.search;

import org.junit.jupiter.api.Test;
import org.prover.axiom.Axiom;
import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;
import org.prover.formula.Substitution;
import org.prover.formula.Term;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProofCheckerTest {

    private static final Formula A = Formula.atom("A");
    private static final Formula B = Formula.atom("B");

    private final ProofChecker checker = new ProofChecker(List.of(Axiom.of("a", A)),
            List.of(InferenceRule.of("r1", List.of(A), B)));

    private static ProofStep axiom(int index, Formula formula, String name) {
        return new ProofStep(index, formula, new Justification.ByAxiom(name, Substitution.empty()), List.of(), 0);
    }

    private static ProofStep rule(int index, Formula formula, String name, List<Integer> dependencies) {
        return new ProofStep(index, formula, new Justification.ByRule(name, Substitution.empty()), dependencies, 0);
    }

    @Test
    void acceptsWellFormedProof() {
        List<ProofStep> steps = List.of(axiom(0, A, "a"), rule(1, B, "r1", List.of(0)));

        assertDoesNotThrow(() -> checker.check(B, SearchStrategyType.NATURAL_DEDUCTION, steps));
    }

    @Test
    void rejectsForwardDependency() {
        List<ProofStep> steps = List.of(rule(0, B, "r1", List.of(1)), axiom(1, A, "a"));

        ProofInconsistencyException e = assertThrows(ProofInconsistencyException.class,
                () -> checker.check(A, SearchStrategyType.NATURAL_DEDUCTION, steps));
        assertEquals(0, e.getStepIndex());
    }

    @Test
    void rejectsUnknownAxiom() {
        List<ProofStep> steps = List.of(axiom(0, A, "missing"));

        assertThrows(ProofInconsistencyException.class,
                () -> checker.check(A, SearchStrategyType.BACKWARD_CHAINING, steps));
    }

    @Test
    void rejectsUnknownRule() {
        List<ProofStep> steps = List.of(axiom(0, A, "a"), rule(1, B, "r9", List.of(0)));

        ProofInconsistencyException e = assertThrows(ProofInconsistencyException.class,
                () -> checker.check(B, SearchStrategyType.BACKWARD_CHAINING, steps));
        assertEquals(1, e.getStepIndex());
    }

    @Test
    void rejectsProofEndingElsewhere() {
        List<ProofStep> steps = List.of(axiom(0, A, "a"));

        assertThrows(ProofInconsistencyException.class,
                () -> checker.check(B, SearchStrategyType.FORWARD_CHAINING, steps));
    }

    @Test
    void rejectsAssumptionOutsideScope() {
        List<ProofStep> steps = List.of(new ProofStep(0, A, new Justification.Assumption(), List.of(), 0));

        assertThrows(ProofInconsistencyException.class,
                () -> checker.check(A, SearchStrategyType.NATURAL_DEDUCTION, steps));
    }

    @Test
    void resolutionProofMustEndWithContradiction() {
        List<ProofStep> refutation = List.of(
                axiom(0, A, "a"),
                new ProofStep(1, Formula.not(A), new Justification.NegatedGoal(), List.of(), 0),
                new ProofStep(2, Formula.falsum(), new Justification.Resolvent(Substitution.empty()), List.of(0, 1), 0));

        assertDoesNotThrow(() -> checker.check(A, SearchStrategyType.RESOLUTION, refutation));
        assertThrows(ProofInconsistencyException.class,
                () -> checker.check(A, SearchStrategyType.RESOLUTION, refutation.subList(0, 2)));
    }

    @Test
    void resolventNeedsTwoParents() {
        List<ProofStep> steps = List.of(axiom(0, A, "a"),
                new ProofStep(1, Formula.falsum(), new Justification.Resolvent(Substitution.empty()), List.of(0), 0));

        assertThrows(ProofInconsistencyException.class,
                () -> checker.check(A, SearchStrategyType.RESOLUTION, steps));
    }

    @Test
    void rejectsStepThatIsNotAnAxiomInstance() {
        Formula serial = Formula.forall("x", Formula.exists("y", Formula.atom("Q", Term.var("x"), Term.var("y"))));
        Formula reflexive = Formula.exists("y", Formula.atom("Q", Term.var("y"), Term.var("y")));
        ProofChecker quantified = new ProofChecker(List.of(Axiom.of("serie", serial)), List.of());

        assertThrows(ProofInconsistencyException.class, () -> quantified.check(reflexive,
                SearchStrategyType.NATURAL_DEDUCTION, List.of(axiom(0, reflexive, "serie"))));

        Formula instance = Formula.exists("y", Formula.atom("Q", Term.var("c"), Term.var("y")));
        assertDoesNotThrow(() -> quantified.check(instance,
                SearchStrategyType.NATURAL_DEDUCTION, List.of(axiom(0, instance, "serie"))));
    }

    @Test
    void rejectsStepThatDoesNotMatchRuleConclusion() {
        List<ProofStep> steps = List.of(axiom(0, A, "a"), rule(1, A, "r1", List.of(0)));

        ProofInconsistencyException e = assertThrows(ProofInconsistencyException.class,
                () -> checker.check(A, SearchStrategyType.FORWARD_CHAINING, steps));
        assertEquals(1, e.getStepIndex());
    }
}

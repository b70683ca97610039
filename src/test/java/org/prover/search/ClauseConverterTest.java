package org.prover.search;

import org.junit.jupiter.api.Test;
import org.prover.formula.Formula;
import org.prover.formula.Formulas;
import org.prover.formula.Quantifier;
import org.prover.formula.Term;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClauseConverterTest {

    private static final Formula P = Formula.atom("P");
    private static final Formula Q = Formula.atom("Q");
    private static final Formula R = Formula.atom("R");

    private final ClauseConverter converter = new ClauseConverter();

    @Test
    void implicationBecomesSingleClause() {
        List<Clause> clauses = converter.toClauses(Formula.implies(P, Q));

        assertEquals(1, clauses.size());
        assertEquals(new Clause(List.of(Literal.negative(P), Literal.positive(Q))).canonicalKey(),
                clauses.get(0).canonicalKey());
    }

    @Test
    void disjunctionDistributesOverConjunction() {
        List<Clause> clauses = converter.toClauses(Formula.or(P, Formula.and(Q, R)));

        assertEquals(2, clauses.size());
        assertEquals(2, clauses.get(0).size());
        assertEquals(2, clauses.get(1).size());
    }

    @Test
    void negatedConjunctionFollowsDeMorgan() {
        List<Clause> clauses = converter.toClauses(Formula.not(Formula.and(P, Q)));

        assertEquals(1, clauses.size());
        assertEquals(List.of(Literal.negative(P), Literal.negative(Q)), clauses.get(0).literals());
    }

    @Test
    void biconditionalProducesTwoClauses() {
        assertEquals(2, converter.toClauses(Formula.iff(P, Q)).size());
    }

    @Test
    void tautologiesAreDiscarded() {
        assertTrue(converter.toClauses(Formula.or(P, Formula.not(P))).isEmpty());
        assertTrue(converter.toClauses(Formula.truth()).isEmpty());
    }

    @Test
    void falsumBecomesEmptyClause() {
        List<Clause> clauses = converter.toClauses(Formula.falsum());

        assertEquals(1, clauses.size());
        assertTrue(clauses.get(0).isEmpty());
    }

    @Test
    void existentialIsSkolemized() {
        List<Clause> clauses = converter.toClauses(Formula.exists("x", Formula.atom("P", Term.var("x"))));

        assertEquals(1, clauses.size());
        assertEquals(Literal.positive(Formula.atom("P", Term.function("sk_0"))), clauses.get(0).literals().get(0));
    }

    @Test
    void existentialUnderUniversalDependsOnIt() {
        Formula formula = Formula.forall("x", Formula.exists("y",
                Formula.atom("R", Term.var("x"), Term.var("y"))));

        Clause clause = converter.toClauses(formula).get(0);
        Formula.Atomic atom = (Formula.Atomic) clause.literals().get(0).atom();

        assertTrue(atom.terms().get(0) instanceof Term.Hole);
        Term.Function skolem = (Term.Function) atom.terms().get(1);
        assertEquals(List.of(atom.terms().get(0)), skolem.arguments());
    }

    @Test
    void universalVariablesBecomeHoles() {
        List<Clause> clauses = converter.toClauses(Formula.forall("x", Formula.atom("P", Term.var("x"))));

        assertFalse(Formulas.isGround(clauses.get(0).literals().get(0).atom()));
    }

    @Test
    void negatedUniversalBecomesSkolemConstant() {
        List<Clause> clauses = converter.toClauses(Formula.not(Formula.forall("x", Formula.atom("P", Term.var("x")))));

        Literal literal = clauses.get(0).literals().get(0);
        assertFalse(literal.positive());
        assertTrue(Formulas.isGround(literal.atom()));
    }

    @Test
    void skolemSymbolsAreDistinctAcrossFormulas() {
        Formula formula = Formula.exists("x", Formula.atom("P", Term.var("x")));

        Clause first = converter.toClauses(formula).get(0);
        Clause second = converter.toClauses(formula).get(0);

        assertNotEquals(first, second);
    }

    @Test
    void temporalFormulasStayOpaque() {
        Formula always = Formula.always(P);

        List<Clause> clauses = converter.toClauses(Formula.not(always));

        assertEquals(List.of(Literal.negative(always)), clauses.get(0).literals());
    }

    @Test
    void domainRestrictedUniversalAddsMembershipGuard() {
        Formula formula = Formula.forall(new Quantifier("x", null, Term.var("S")),
                Formula.atom("P", Term.var("x")));

        Clause clause = converter.toClauses(formula).get(0);

        assertEquals(2, clause.size());
        assertTrue(clause.literals().stream()
                .anyMatch(literal -> !literal.positive() && literal.atom() instanceof Formula.SetMembership));
    }
}

package org.prover.parser;

import org.junit.jupiter.api.Test;
import org.prover.formula.Formula;
import org.prover.formula.Quantifier;
import org.prover.formula.Term;
import org.prover.verify.VerificationMethod;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.prover.formula.Formula.always;
import static org.prover.formula.Formula.and;
import static org.prover.formula.Formula.atom;
import static org.prover.formula.Formula.eventually;
import static org.prover.formula.Formula.forall;
import static org.prover.formula.Formula.implies;
import static org.prover.formula.Formula.le;
import static org.prover.formula.Formula.meta;
import static org.prover.formula.Formula.not;
import static org.prover.formula.Term.hole;
import static org.prover.formula.Term.integer;
import static org.prover.formula.Term.var;

class FormulaParserTest {

    //region FORMULE

    @Test
    void implicationIsRightAssociative() {
        assertEquals(implies(atom("p"), implies(atom("q"), atom("r"))), FormulaParser.parseFormula("p -> q -> r"));
    }

    @Test
    void conjunctionChainIsFlattened() {
        assertEquals(and(atom("a"), atom("b"), atom("c")), FormulaParser.parseFormula("a & b & c"));
    }

    @Test
    void temporalOperators() {
        assertEquals(always(implies(atom("req"), eventually(atom("ack")))),
                FormulaParser.parseFormula("[] (req -> <> ack)"));
    }

    @Test
    void typedQuantifierPropagatesSortToBoundVariable() {
        Formula expected = new Formula.Universal(Quantifier.of("x", "Int"),
                le(integer(0), new Term.Variable("x", "Int")));

        assertEquals(expected, FormulaParser.parseFormula("forall x: Int. x >= 0"));
    }

    @Test
    void unicodeNotation() {
        assertEquals(forall("x", implies(atom("P", var("x")), atom("Q", var("x")))),
                FormulaParser.parseFormula("∀x. P(x) → Q(x)"));
    }

    @Test
    void strictComparisonBecomesNegatedLessEqual() {
        assertEquals(not(le(var("y"), var("x"))), FormulaParser.parseFormula("x < y"));
        assertEquals(not(le(var("x"), var("y"))), FormulaParser.parseFormula("x > y"));
    }

    @Test
    void negativeLiteralIsFoldedIntoConstant() {
        assertEquals(new Formula.ArithmeticEqual(var("x"), new Term.Constant("-1", "Int")),
                FormulaParser.parseFormula("x = -1"));
    }

    @Test
    void membershipInSetLiteral() {
        assertEquals(new Formula.SetMembership(var("x"), Term.set(integer(1), integer(2))),
                FormulaParser.parseFormula("x in {1, 2}"));
    }

    @Test
    void patternPlaceholders() {
        assertEquals(implies(meta("P"), atom("R", hole("x"))), FormulaParser.parseFormula("?P -> R(?x)"));
    }

    @Test
    void truthConstants() {
        assertEquals(implies(Formula.falsum(), Formula.truth()), FormulaParser.parseFormula("false -> true"));
    }

    @Test
    void incompleteFormulaIsRejected() {
        FormulaParseException e = assertThrows(FormulaParseException.class, () -> FormulaParser.parseFormula("p &"));
        assertEquals(1, e.getLine());
    }

    @Test
    void arithmeticTerm() {
        Term expected = Term.arithmetic(org.prover.formula.ArithmeticOp.ADD, var("a"),
                Term.arithmetic(org.prover.formula.ArithmeticOp.MUL, integer(2), var("b")));

        assertEquals(expected, FormulaParser.parseTerm("a + 2 * b"));
    }

    //endregion

    //region FILE DI PROBLEMA

    @Test
    void problemFileWithAxiomsRulesAndGoals() {
        String text = """
                # sistema di esempio
                axiom a1: p -> q.
                axiom a2: p.
                rule r1: ?X, ?X -> ?Y |- ?Y.
                goal g1 by nd, res: q.
                goal g2: q & p.
                """;

        ProblemFile problem = FormulaParser.parseProblem(text);

        assertEquals(2, problem.axioms().size());
        assertEquals(implies(atom("p"), atom("q")), problem.axioms().get(0).formula());
        assertEquals(1, problem.rules().size());
        assertEquals(List.of(meta("X"), implies(meta("X"), meta("Y"))), problem.rules().get(0).premises());
        assertEquals(meta("Y"), problem.rules().get(0).conclusion());
        assertEquals(List.of(VerificationMethod.NATURAL_DEDUCTION, VerificationMethod.RESOLUTION),
                problem.goals().get(0).methods());
        assertTrue(problem.goals().get(1).methods().isEmpty());
        assertEquals(2, problem.toTasks().size());
    }

    @Test
    void ruleWithoutPremises() {
        ProblemFile problem = FormulaParser.parseProblem("rule top: |- true.");

        assertTrue(problem.rules().get(0).premises().isEmpty());
    }

    @Test
    void duplicateNamesAreRejected() {
        assertThrows(FormulaParseException.class, () -> FormulaParser.parseProblem("axiom a: p.\ngoal a: p."));
    }

    @Test
    void unknownMethodIsRejected() {
        FormulaParseException e = assertThrows(FormulaParseException.class,
                () -> FormulaParser.parseProblem("goal g by magic: p."));
        assertEquals(1, e.getLine());
    }

    //endregion
}

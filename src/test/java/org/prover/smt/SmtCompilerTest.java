package org.prover.smt;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.prover.formula.Formula;
import org.prover.formula.Quantifier;
import org.prover.formula.Term;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.prover.formula.Formula.always;
import static org.prover.formula.Formula.atom;
import static org.prover.formula.Formula.implies;
import static org.prover.formula.Formula.le;
import static org.prover.formula.Formula.member;
import static org.prover.formula.Formula.until;
import static org.prover.formula.Term.integer;
import static org.prover.formula.Term.set;
import static org.prover.formula.Term.var;

class SmtCompilerTest {

    private SmtCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new SmtCompiler();
    }

    @Test
    void atomWithoutTermsKeepsParentheses() {
        assertEquals("(P)", compiler.compile(atom("P")));
        assertEquals("(R x 1)", compiler.compile(atom("R", var("x"), integer(1))));
    }

    @Test
    void truthConstantsAreBare() {
        assertEquals("true", compiler.compile(Formula.truth()));
        assertEquals("(not false)", compiler.compile(Formula.not(Formula.falsum())));
    }

    @Test
    void connectives() {
        assertEquals("(=> (P) (Q))", compiler.compile(implies(atom("P"), atom("Q"))));
        assertEquals("(= (P) (Q))", compiler.compile(Formula.iff(atom("P"), atom("Q"))));
        assertEquals("(and (A) (B) (C))", compiler.compile(Formula.and(atom("A"), atom("B"), atom("C"))));
    }

    @Test
    void typedQuantifier() {
        Formula formula = new Formula.Universal(Quantifier.of("x", "Int"), le(integer(0), var("x", "Int")));

        assertEquals("(forall ((x Int)) (<= 0 x))", compiler.compile(formula));
    }

    @Test
    void untypedQuantifierDefaultsToInt() {
        assertEquals("(exists ((y Int)) (P y))", compiler.compile(Formula.exists("y", atom("P", var("y")))));
    }

    @Test
    void domainRestrictionGuardsBody() {
        Formula formula = new Formula.Universal(new Quantifier("x", null, var("S")), atom("P", var("x")));

        assertEquals("(forall ((x Int)) (=> (select S x) (P x)))", compiler.compile(formula));
    }

    @Test
    void alwaysUsesFreshTimeVariable() {
        String first = compiler.compile(always(atom("P")));
        String second = compiler.compile(always(atom("P")));

        assertEquals("(forall ((t_0 Int)) (=> (>= t_0 0) (P)))", first);
        assertEquals("(forall ((t_1 Int)) (=> (>= t_1 0) (P)))", second);
        assertNotEquals(first, second);
    }

    @Test
    void temporalNodesInOneFormulaGetDistinctVariables() {
        String compiled = compiler.compile(Formula.and(always(atom("P")), Formula.eventually(atom("Q"))));

        assertEquals("(and (forall ((t_0 Int)) (=> (>= t_0 0) (P))) "
                + "(exists ((t_1 Int)) (and (>= t_1 0) (Q))))", compiled);
    }

    @Test
    void uninterpretedConstantIsSymbol() {
        assertEquals("red", compiler.compile(Term.constant("red", "Color")));
        assertEquals("|rosso scuro|", compiler.compile(Term.constant("rosso scuro", "Color")));
    }

    @Test
    void untilEncoding() {
        assertEquals("(exists ((t_0 Int)) (and (>= t_0 0) (B) (forall ((s_0 Int)) "
                        + "(=> (and (>= s_0 0) (< s_0 t_0)) (A)))))",
                compiler.compile(until(atom("A"), atom("B"))));
    }

    @Test
    void setLiteralMembership() {
        assertEquals("(select (store (store ((as const (Array Int Bool)) false) 1 true) 2 true) x)",
                compiler.compile(member(var("x"), set(integer(1), integer(2)))));
    }

    @Test
    void stringConstantsEscapeQuotes() {
        assertEquals("\"a\"\"b\"", compiler.compile(new Term.Constant("a\"b", "String")));
    }

    @Test
    void irregularSymbolsAreQuoted() {
        assertEquals("|my var|", compiler.compile(var("my var")));
    }

    @Test
    void resetRestartsFreshCounters() {
        assertEquals("t_0", compiler.freshVariable("t"));
        assertEquals("t_1", compiler.freshVariable("t"));
        assertEquals("s_0", compiler.freshVariable("s"));
        compiler.reset();
        assertEquals("t_0", compiler.freshVariable("t"));
    }
}

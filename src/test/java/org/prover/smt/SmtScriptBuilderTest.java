package org.prover.smt;

import org.junit.jupiter.api.Test;
import org.prover.formula.ArithmeticOp;
import org.prover.formula.Formula;
import org.prover.formula.PropertyFormula;
import org.prover.formula.Quantifier;
import org.prover.formula.Term;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.prover.formula.Formula.atom;
import static org.prover.formula.Formula.forall;
import static org.prover.formula.Formula.implies;
import static org.prover.formula.Formula.member;
import static org.prover.formula.Term.var;

class SmtScriptBuilderTest {

    private final SmtSyntaxValidator validator = new SmtSyntaxValidator();

    @Test
    void declaresPredicatesAndAssertsNegation() {
        Formula formula = forall("x", implies(atom("P", var("x")), atom("Q", var("x"))));

        String script = new SmtScriptBuilder().build("monotonia", PropertyFormula.of(formula));

        assertTrue(script.startsWith(";; proprietà: monotonia\n"));
        assertTrue(script.contains("(declare-fun P (Int) Bool)\n"));
        assertTrue(script.contains("(declare-fun Q (Int) Bool)\n"));
        assertTrue(script.contains("(assert (not (forall ((x Int)) (=> (P x) (Q x)))))\n"));
        assertTrue(script.endsWith("(check-sat)\n"));
        assertTrue(validator.validate(script).valid());
    }

    @Test
    void setUsageInfersArraySort() {
        String script = new SmtScriptBuilder().build("appartenenza", PropertyFormula.of(member(var("x"), var("S"))));

        assertTrue(script.contains("(declare-const x Int)\n"));
        assertTrue(script.contains("(declare-const S (Array Int Bool))\n"));
        assertTrue(validator.validate(script).valid());
    }

    @Test
    void temporalPropertyProducesValidScript() {
        Formula formula = Formula.always(implies(atom("req"), Formula.eventually(atom("ack"))));

        String script = new SmtScriptBuilder().build("risposta", PropertyFormula.of(formula));

        assertTrue(validator.validate(script).valid());
        assertFalse(script.contains("(get-model)"));
    }

    @Test
    void modelIsRequestedOnDemand() {
        String script = new SmtScriptBuilder(new SmtCompiler(), true).build("p", PropertyFormula.of(atom("P")));

        assertTrue(script.endsWith("(check-sat)\n(get-model)\n"));
    }

    //region COPERTURA DEI NODI

    @Test
    void constantOfUninterpretedSortIsDeclared() {
        Formula formula = atom("P", Term.constant("red", "Color"));

        String script = new SmtScriptBuilder().build("colore", PropertyFormula.of(formula));

        assertTrue(script.contains("(declare-sort Color 0)\n"));
        assertTrue(script.contains("(declare-const red Color)\n"));
        assertTrue(script.contains("(declare-fun P (Color) Bool)\n"));
        assertTrue(validator.validate(script).valid(), script);
    }

    @Test
    void everyFormulaKindYieldsValidScript() {
        Map<Formula.Kind, Formula> samples = new EnumMap<>(Formula.Kind.class);
        samples.put(Formula.Kind.ATOMIC, atom("P", var("x")));
        samples.put(Formula.Kind.NEGATION, Formula.not(atom("P")));
        samples.put(Formula.Kind.CONJUNCTION, Formula.and(atom("P"), atom("Q")));
        samples.put(Formula.Kind.DISJUNCTION, Formula.or(atom("P"), atom("Q")));
        samples.put(Formula.Kind.IMPLICATION, implies(atom("P"), atom("Q")));
        samples.put(Formula.Kind.BICONDITIONAL, Formula.iff(atom("P"), atom("Q")));
        samples.put(Formula.Kind.UNIVERSAL, forall(Quantifier.of("c", "Color"), atom("R", var("c", "Color"))));
        samples.put(Formula.Kind.EXISTENTIAL,
                Formula.exists(new Quantifier("x", null, var("D")), atom("P", var("x"))));
        samples.put(Formula.Kind.ALWAYS, Formula.always(atom("P")));
        samples.put(Formula.Kind.EVENTUALLY, Formula.eventually(atom("P")));
        samples.put(Formula.Kind.UNTIL, Formula.until(atom("P"), atom("Q")));
        samples.put(Formula.Kind.EQUAL, Formula.eq(var("x"), Term.integer(3)));
        samples.put(Formula.Kind.LESS_EQUAL, Formula.le(var("y", "Real"), Term.constant("2.5", "Real")));
        samples.put(Formula.Kind.MEMBERSHIP, member(Term.integer(1), var("S")));
        samples.put(Formula.Kind.FUNCTION_APPLICATION, Formula.apply("connesso", var("a"), var("b")));
        samples.put(Formula.Kind.META, Formula.meta("A"));
        assertEquals(Formula.Kind.values().length, samples.size());

        for (Map.Entry<Formula.Kind, Formula> sample : samples.entrySet()) {
            String script = new SmtScriptBuilder().build(sample.getKey().name(), PropertyFormula.of(sample.getValue()));
            assertTrue(validator.validate(script).valid(), sample.getKey() + ":\n" + script);
        }
    }

    @Test
    void everyTermKindYieldsValidScript() {
        Map<Term.Kind, Term> samples = new EnumMap<>(Term.Kind.class);
        samples.put(Term.Kind.VARIABLE, var("n"));
        samples.put(Term.Kind.CONSTANT, Term.constant("blu", "Colore"));
        samples.put(Term.Kind.FUNCTION, Term.function("f", var("n"), Term.function("zero")));
        samples.put(Term.Kind.ARITHMETIC, Term.arithmetic(ArithmeticOp.ADD, var("n"), Term.integer(1)));
        samples.put(Term.Kind.SET, Term.set(Term.integer(1), Term.integer(2)));
        samples.put(Term.Kind.ARRAY_ACCESS, Term.select(var("A"), Term.integer(0)));
        samples.put(Term.Kind.HOLE, Term.hole("t"));
        assertEquals(Term.Kind.values().length, samples.size());

        for (Map.Entry<Term.Kind, Term> sample : samples.entrySet()) {
            Formula formula = atom("Usa", sample.getValue());
            String script = new SmtScriptBuilder().build(sample.getKey().name(), PropertyFormula.of(formula));
            assertTrue(validator.validate(script).valid(), sample.getKey() + ":\n" + script);
        }
    }

    //endregion
}

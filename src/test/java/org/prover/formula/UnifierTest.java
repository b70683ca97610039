package org.prover.formula;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.prover.formula.Formula.atom;
import static org.prover.formula.Formula.exists;
import static org.prover.formula.Formula.forall;
import static org.prover.formula.Formula.implies;
import static org.prover.formula.Formula.meta;
import static org.prover.formula.Formula.not;
import static org.prover.formula.Term.function;
import static org.prover.formula.Term.hole;
import static org.prover.formula.Term.var;

class UnifierTest {

    @Test
    void bindsTermHole() {
        Optional<Substitution> result = Unifier.unify(atom("P", hole("x")), atom("P", var("a")));

        assertTrue(result.isPresent());
        assertEquals(var("a"), result.get().termBinding("x"));
    }

    @Test
    void bindsFormulaMetaAndAppliesBinding() {
        Formula pattern = implies(meta("P"), meta("Q"));
        Formula target = implies(atom("A"), atom("B"));

        Optional<Substitution> result = Unifier.unify(pattern, target);

        assertTrue(result.isPresent());
        assertEquals(target, result.get().apply(pattern));
    }

    @Test
    void variablesAreRigid() {
        assertFalse(Unifier.unify(atom("P", var("x")), atom("P", var("y"))).isPresent());
        assertTrue(Unifier.unify(atom("P", var("x")), atom("P", var("x"))).isPresent());
    }

    @Test
    void occursCheckRejectsCyclicBinding() {
        assertFalse(Unifier.unify(hole("x"), function("f", hole("x"))).isPresent());
        assertFalse(Unifier.unify(meta("P"), Formula.not(meta("P"))).isPresent());
    }

    @Test
    void conflictingBindingsFail() {
        Formula pattern = atom("R", hole("x"), hole("x"));

        assertFalse(Unifier.unify(pattern, atom("R", var("a"), var("b"))).isPresent());
        assertTrue(Unifier.unify(pattern, atom("R", var("a"), var("a"))).isPresent());
    }

    @Test
    void quantifiedBodiesUnifyUpToRenaming() {
        Formula first = forall("x", atom("P", var("x"), hole("y")));
        Formula second = forall("z", atom("P", var("z"), var("c")));

        Optional<Substitution> result = Unifier.unify(first, second);

        assertTrue(result.isPresent());
        assertEquals(var("c"), result.get().termBinding("y"));
    }

    @Test
    void differentPredicatesDoNotUnify() {
        assertFalse(Unifier.unify(atom("P", hole("x")), atom("Q", var("a"))).isPresent());
    }

    //region VARIABILI LEGATE

    @Test
    void holeCannotBindLocallyBoundVariable() {
        Formula pattern = exists("y", atom("Q", hole("x"), var("y")));
        Formula target = exists("y", atom("Q", var("y"), var("y")));

        assertFalse(Unifier.unify(pattern, target).isPresent());
    }

    @Test
    void metaCannotBindFormulaMentioningBoundVariable() {
        Formula pattern = forall("x", implies(meta("A"), atom("P", var("x"))));
        Formula target = forall("x", implies(atom("R", var("x")), atom("P", var("x"))));

        assertFalse(Unifier.unify(pattern, target).isPresent());
    }

    @Test
    void renamingDoesNotCaptureOuterVariable() {
        // la x libera a destra non deve essere catturata dal quantificatore di sinistra
        Formula first = forall("x", atom("P", var("x"), var("x")));
        Formula second = forall("z", atom("P", var("z"), var("x")));

        assertFalse(Unifier.unify(first, second).isPresent());
    }

    @Test
    void holeMayBindFreeVariableInsideQuantifier() {
        Formula pattern = exists("y", atom("Q", hole("x"), var("y")));
        Formula target = exists("z", atom("Q", var("w"), var("z")));

        Optional<Substitution> result = Unifier.unify(pattern, target);

        assertTrue(result.isPresent());
        assertEquals(var("w"), result.get().termBinding("x"));
    }

    @Test
    void applyingBindingRenamesCapturingBinder() {
        Substitution theta = Substitution.empty().bind("x", var("y"));

        Formula applied = theta.apply(exists("y", not(atom("Q", hole("x"), var("y")))));

        assertEquals(Formulas.freeVariables(atom("Q", var("y"))), Formulas.freeVariables(applied));
        assertTrue(applied instanceof Formula.Existential);
        assertFalse(Formulas.boundVariable(applied).equals("y"));
    }

    //endregion
}

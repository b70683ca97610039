package org.prover.formula;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.prover.formula.Formula.and;
import static org.prover.formula.Formula.atom;
import static org.prover.formula.Formula.eq;
import static org.prover.formula.Formula.exists;
import static org.prover.formula.Formula.forall;
import static org.prover.formula.Term.function;
import static org.prover.formula.Term.integer;
import static org.prover.formula.Term.var;

class PropertyFormulaTest {

    @Test
    void collectsDerivedSymbolSets() {
        Formula structure = forall("x", and(atom("P", var("x")), eq(function("f", var("x")), integer(0))));

        PropertyFormula property = PropertyFormula.of(structure);

        assertEquals(Set.of("P"), property.predicates());
        assertEquals(Set.of("f"), property.functions());
        assertEquals(Set.of("0"), property.constants());
        assertEquals(Set.of(), property.freeVariables());
    }

    @Test
    void reportsFreeVariablesAndQuantifierPrefix() {
        Formula structure = forall("x", exists("y", atom("R", var("x"), var("y"), var("z"))));

        PropertyFormula property = PropertyFormula.of(structure);

        assertEquals(Set.of("z"), property.freeVariables());
        assertEquals(List.of("x", "y"), property.quantifiers().stream().map(Quantifier::variable).toList());
    }

    @Test
    void rejectsNullStructure() {
        assertThrows(IllegalArgumentException.class, () -> PropertyFormula.of(null));
    }
}

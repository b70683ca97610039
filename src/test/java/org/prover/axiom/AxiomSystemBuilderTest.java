package org.prover.axiom;

import org.junit.jupiter.api.Test;
import org.prover.formula.Formula;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AxiomSystemBuilderTest {

    @Test
    void standardSystemContainsLibrary() {
        AxiomSystem system = AxiomSystemBuilder.standard().build();

        List<String> rules = system.rules().stream().map(InferenceRule::name).toList();
        List<String> axioms = system.axioms().stream().map(Axiom::name).toList();

        assertEquals(12, rules.size());
        assertEquals("modus_ponens", rules.get(0));
        assertTrue(rules.containsAll(List.of("and_intro", "always_elim", "eventually_intro")));
        assertEquals(List.of("excluded_middle", "identity", "temporal_duality"), axioms);
    }

    @Test
    void documentDeclarationsFollowLibrary() {
        AxiomSystem document = new AxiomSystem(List.of(Axiom.of("a", Formula.atom("A"))),
                List.of(InferenceRule.of("r", List.of(Formula.atom("A")), Formula.atom("B"))));

        AxiomSystem system = new AxiomSystemBuilder().withLogicalAxioms().addAll(document).build();

        assertEquals("a", system.axioms().get(system.axioms().size() - 1).name());
        assertEquals(List.of("r"), system.rules().stream().map(InferenceRule::name).toList());
    }

    @Test
    void duplicateAxiomIsRejected() {
        AxiomSystemBuilder builder = new AxiomSystemBuilder().addAxiom(Axiom.of("a", Formula.atom("A")));

        assertThrows(IllegalArgumentException.class, () -> builder.addAxiom(Axiom.of("a", Formula.atom("B"))));
    }

    @Test
    void duplicateRuleIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> AxiomSystemBuilder.standard()
                .addRule(InferenceRule.of("modus_ponens", List.of(Formula.atom("A")), Formula.atom("A"))));
    }

    @Test
    void emptySystemHasNothing() {
        AxiomSystem system = AxiomSystem.empty();

        assertTrue(system.axioms().isEmpty());
        assertTrue(system.rules().isEmpty());
    }
}

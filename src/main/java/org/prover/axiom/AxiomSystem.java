package org.prover.axiom;

import java.util.List;

/**
 * Insieme immutabile di assiomi e regole, costruito una volta per documento
 * e condiviso in sola lettura da tutte le ricerche di prova.
 */
public record AxiomSystem(List<Axiom> axioms, List<InferenceRule> rules) {

    public AxiomSystem {
        axioms = List.copyOf(axioms);
        rules = List.copyOf(rules);
    }

    public static AxiomSystem empty() {
        return new AxiomSystem(List.of(), List.of());
    }
}

package org.prover.axiom;

import org.prover.formula.Formula;

/**
 * Assioma: formula assunta vera senza prova.
 *
 * Un prefisso universale indica uno schema: la ricerca di prove ne istanzia
 * la variabile legata con il termine richiesto dall'obiettivo.
 *
 * @param name nome univoco nel sistema assiomatico
 * @param formula formula assunta
 * @param type categoria
 * @param priority priorità (valori alti vengono tentati prima)
 */
public record Axiom(String name, Formula formula, AxiomType type, int priority) {

    public Axiom {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome dell'assioma non può essere null o vuoto");
        }
        if (formula == null) {
            throw new IllegalArgumentException("Formula dell'assioma '" + name + "' non può essere null");
        }
        if (type == null) {
            type = AxiomType.DOMAIN;
        }
    }

    /** Assioma di dominio con priorità neutra */
    public static Axiom of(String name, Formula formula) {
        return new Axiom(name, formula, AxiomType.DOMAIN, 0);
    }

    @Override
    public String toString() {
        return name + ": " + formula;
    }
}

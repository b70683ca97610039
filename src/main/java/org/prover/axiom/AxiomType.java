package org.prover.axiom;

/**
 * Categoria di un assioma, usata per reportistica e priorità di default.
 */
public enum AxiomType {
    LOGICAL,
    ARITHMETIC,
    TEMPORAL,
    DOMAIN
}

package org.prover.axiom;

/**
 * Categoria di una regola di inferenza.
 */
public enum RuleType {
    INTRODUCTION,
    ELIMINATION,
    STRUCTURAL,
    TEMPORAL,
    DOMAIN
}

package org.prover.smt;

/**
 * Categorie di errore della validazione sintattica locale.
 */
public enum SyntaxErrorKind {
    /** Profondità di parentesi negativa o diversa da zero a fine testo */
    UNBALANCED_PARENTHESES,
    /** Nessun comando (check-sat) */
    MISSING_CHECK_SAT,
    /** Identificatore usato in un assert senza dichiarazione precedente */
    UNDECLARED_SYMBOL
}

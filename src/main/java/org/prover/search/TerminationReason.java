package org.prover.search;

/**
 * Causa di terminazione di una ricerca.
 */
public enum TerminationReason {
    /** Prova trovata */
    PROOF_FOUND,
    /** Spazio di ricerca esaurito senza prova */
    EXHAUSTED,
    /** Limite di profondità raggiunto in almeno un ramo */
    DEPTH_LIMIT,
    /** Limite di passi superato */
    STEP_LIMIT,
    /** Tempo scaduto */
    TIMEOUT,
    /** Prova generata rifiutata dal controllo strutturale */
    INCONSISTENT_PROOF
}

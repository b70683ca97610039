package org.prover.smt;

/**
 * Errore del solutore durante una singola interrogazione (testo rifiutato,
 * processo terminato in modo anomalo). Riguarda solo la proprietà corrente.
 */
public class SolverException extends RuntimeException {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}

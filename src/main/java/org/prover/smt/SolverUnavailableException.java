package org.prover.smt;

/**
 * Il solutore è obbligatorio per configurazione ma non è disponibile.
 * Guasto d'ambiente: interrompe l'esecuzione di verifica e non viene mai
 * convertito in un verdetto UNKNOWN.
 */
public class SolverUnavailableException extends RuntimeException {

    public SolverUnavailableException(String message) {
        super(message);
    }
}

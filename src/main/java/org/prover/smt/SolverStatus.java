package org.prover.smt;

/**
 * Risposta nativa del solutore al comando (check-sat).
 */
public enum SolverStatus {
    SAT,
    UNSAT,
    UNKNOWN;

    /**
     * Interpreta la prima riga di risposta testuale del solutore.
     */
    public static SolverStatus fromResponse(String response) {
        if (response == null) {
            return UNKNOWN;
        }
        return switch (response.trim()) {
            case "sat" -> SAT;
            case "unsat" -> UNSAT;
            default -> UNKNOWN;
        };
    }
}

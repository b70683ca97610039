package org.prover.smt;

/**
 * Configurazione dell'interfaccia verso il solutore.
 *
 * @param timeoutMs timeout per singola interrogazione, in millisecondi
 * @param requireSolver true se l'assenza del solutore è un errore d'ambiente
 * @param verbose true per registrare gli script inviati a livello INFO
 */
public record SmtConfig(long timeoutMs, boolean requireSolver, boolean verbose) {

    public static final long DEFAULT_TIMEOUT_MS = 30_000;

    public SmtConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("Timeout del solutore deve essere positivo: " + timeoutMs);
        }
    }

    public static SmtConfig defaults() {
        return new SmtConfig(DEFAULT_TIMEOUT_MS, true, false);
    }

    /** Solutore facoltativo: in sua assenza i verdetti sono UNKNOWN */
    public static SmtConfig disabled() {
        return new SmtConfig(DEFAULT_TIMEOUT_MS, false, false);
    }

    public SmtConfig withTimeoutMs(long newTimeoutMs) {
        return new SmtConfig(newTimeoutMs, requireSolver, verbose);
    }

    public SmtConfig withRequireSolver(boolean required) {
        return new SmtConfig(timeoutMs, required, verbose);
    }
}

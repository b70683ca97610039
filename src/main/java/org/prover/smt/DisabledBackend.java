package org.prover.smt;

/**
 * Backend segnaposto quando nessun solutore è configurato.
 */
public final class DisabledBackend implements SolverBackend {

    @Override
    public String name() {
        return "disabilitato";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public SolverStatus check(String script, long timeoutMs) {
        throw new SolverUnavailableException("Nessun solutore configurato");
    }
}

package org.prover.search;

/**
 * Una prova generata non supera il controllo strutturale a posteriori.
 * Indica un difetto del motore: il verdetto non viene mai accettato.
 */
public class ProofInconsistencyException extends RuntimeException {

    private final int stepIndex;

    public ProofInconsistencyException(int stepIndex, String message) {
        super("Passo " + stepIndex + ": " + message);
        this.stepIndex = stepIndex;
    }

    public int getStepIndex() {
        return stepIndex;
    }
}

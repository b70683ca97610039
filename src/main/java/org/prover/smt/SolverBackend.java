package org.prover.smt;

/**
 * Solutore esterno raggiungibile tramite testo SMT-LIB.
 *
 * Le implementazioni devono rispettare il timeout richiesto: la chiamata è
 * sincrona e non può essere interrotta dall'esterno.
 */
public interface SolverBackend {

    /** Nome leggibile del backend */
    String name();

    /** true se il solutore può essere invocato in questo ambiente */
    boolean isAvailable();

    /**
     * Esegue lo script e restituisce la risposta a (check-sat).
     *
     * @param script testo SMT-LIB già validato
     * @param timeoutMs limite di tempo in millisecondi
     * @return risposta del solutore
     * @throws SolverException se il solutore rifiuta il testo o termina in modo anomalo
     */
    SolverStatus check(String script, long timeoutMs);
}

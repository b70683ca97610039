package org.prover.search;

/**
 * Interrompe una ricerca quando un limite globale (tempo o passi) è superato.
 * Risale l'intera ricorsione e viene convertita in verdetto UNKNOWN dal motore.
 */
class SearchAbortedException extends RuntimeException {

    private final TerminationReason reason;

    SearchAbortedException(TerminationReason reason) {
        super("Ricerca interrotta: " + reason, null, false, false);
        this.reason = reason;
    }

    TerminationReason reason() {
        return reason;
    }
}

package org.prover.verify;

import org.prover.search.ProofStep;
import org.prover.support.PropertyResult;

import java.util.List;

/**
 * Esito della verifica di una proprietà.
 *
 * @param name nome della proprietà
 * @param verdict verdetto finale
 * @param method metodo che ha deciso il verdetto, null se nessuno è stato conclusivo
 * @param proof passi della prova (o della prova della negazione), vuoti se non disponibili
 * @param timeMs tempo impiegato
 * @param fromCache verdetto letto dalla cache
 */
public record PropertyVerification(String name, PropertyResult verdict, VerificationMethod method,
                                   List<ProofStep> proof, long timeMs, boolean fromCache) {

    public PropertyVerification {
        proof = proof == null ? List.of() : List.copyOf(proof);
    }

    static PropertyVerification notExecuted(String name, String reason) {
        return new PropertyVerification(name, PropertyResult.unknown(reason), null, List.of(), 0, false);
    }
}

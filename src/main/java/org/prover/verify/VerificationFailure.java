package org.prover.verify;

import org.prover.support.PropertyResult;

import java.util.List;

/**
 * Proprietà non verificata, con il verdetto ottenuto, il motivo e i
 * suggerimenti per l'utente.
 */
public record VerificationFailure(String propertyName, PropertyResult verdict, String reason,
                                  List<String> suggestions) {

    public VerificationFailure {
        if (propertyName == null || verdict == null) {
            throw new IllegalArgumentException("Nome della proprietà e verdetto sono obbligatori");
        }
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    @Override
    public String toString() {
        return propertyName + ": " + verdict.outcome() + (reason == null ? "" : " - " + reason);
    }
}

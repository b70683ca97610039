package org.prover.verify;

import org.prover.search.SearchStrategyType;

import java.util.Locale;

/**
 * Metodo di verifica di una proprietà: una delle quattro strategie di ricerca
 * interne oppure il solutore SMT esterno.
 */
public enum VerificationMethod {
    NATURAL_DEDUCTION("nd", SearchStrategyType.NATURAL_DEDUCTION),
    BACKWARD_CHAINING("bc", SearchStrategyType.BACKWARD_CHAINING),
    FORWARD_CHAINING("fc", SearchStrategyType.FORWARD_CHAINING),
    RESOLUTION("res", SearchStrategyType.RESOLUTION),
    SMT_SOLVER("smt", null);

    private final String shortName;
    private final SearchStrategyType strategy;

    VerificationMethod(String shortName, SearchStrategyType strategy) {
        this.shortName = shortName;
        this.strategy = strategy;
    }

    public String shortName() {
        return shortName;
    }

    /** Strategia di ricerca corrispondente, null per il solutore SMT */
    public SearchStrategyType strategy() {
        return strategy;
    }

    public boolean isProofSearch() {
        return strategy != null;
    }

    /**
     * Riconosce sia il nome breve (nd, bc, fc, res, smt) sia il nome esteso
     * (natural_deduction, natural-deduction, ...), senza distinzione di maiuscole.
     *
     * @throws IllegalArgumentException se il nome non corrisponde a nessun metodo
     */
    public static VerificationMethod fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Nome del metodo non può essere null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (VerificationMethod method : values()) {
            if (method.shortName.equals(normalized) || method.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Metodo di verifica sconosciuto: " + name);
    }
}

package org.prover.search;

import org.prover.support.PropertyResult;

import java.util.List;

/**
 * Esito di una ricerca: verdetto, passi della prova (vuoti se non trovata),
 * statistiche e strategia usata.
 */
public record ProofSearchResult(SearchStrategyType strategy, PropertyResult verdict, List<ProofStep> steps,
                                ProofSearchStatistics statistics) {

    public ProofSearchResult {
        steps = List.copyOf(steps);
    }

    public boolean isProven() {
        return verdict.isProven();
    }

    public ProofComplexity complexity() {
        return ProofComplexity.of(steps);
    }

    /** Prova stampabile, un passo per riga */
    public String formatProof() {
        StringBuilder sb = new StringBuilder();
        for (ProofStep step : steps) {
            sb.append(step).append('\n');
        }
        return sb.toString();
    }
}

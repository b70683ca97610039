package org.prover.verify;

import java.util.List;

/**
 * Rapporto di un lotto: stato complessivo, esiti per proprietà nell'ordine di
 * ingresso, statistiche e avvisi non bloccanti.
 */
public record VerificationReport(VerificationStatus status, List<PropertyVerification> results,
                                 VerificationStatistics statistics, List<String> warnings) {

    public VerificationReport {
        results = List.copyOf(results);
        warnings = List.copyOf(warnings);
    }

    public boolean isVerified() {
        return status instanceof VerificationStatus.Verified;
    }
}

package org.prover.verify;

import java.util.List;

/**
 * STATO COMPLESSIVO di un lotto di verifiche
 *
 * • Verified: tutte le proprietà provate (anche un lotto vuoto)
 * • PartiallyVerified: alcune provate, con l'elenco delle altre
 * • Failed: nessuna provata
 * • Incomplete: tempo totale o memoria esauriti prima di completare il lotto
 * • Error: un guasto dell'ambiente ha impedito la verifica (es. solutore obbligatorio assente)
 */
public sealed interface VerificationStatus {

    String describe();

    record Verified() implements VerificationStatus {
        public String describe() {
            return "VERIFICATO";
        }
    }

    record PartiallyVerified(int verifiedCount, int totalCount, List<VerificationFailure> failures)
            implements VerificationStatus {
        public PartiallyVerified {
            failures = List.copyOf(failures);
        }

        public String describe() {
            return "PARZIALMENTE VERIFICATO (" + verifiedCount + "/" + totalCount + ")";
        }
    }

    record Failed(List<VerificationFailure> failures) implements VerificationStatus {
        public Failed {
            failures = List.copyOf(failures);
        }

        public String describe() {
            return "FALLITO (" + failures.size() + " proprietà non verificate)";
        }
    }

    record Incomplete(String reason) implements VerificationStatus {
        public String describe() {
            return "INCOMPLETO: " + reason;
        }
    }

    record Error(String reason) implements VerificationStatus {
        public String describe() {
            return "ERRORE: " + reason;
        }
    }
}

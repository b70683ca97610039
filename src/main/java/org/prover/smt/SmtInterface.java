package org.prover.smt;

import org.prover.support.PropertyResult;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * INTERFACCIA DEL SOLUTORE - Validazione locale, invio e classificazione dell'esito
 *
 * FLUSSO DI verify(testo):
 * 1. Conteggio dell'interrogazione
 * 2. Validazione sintattica locale: in caso di errore ERROR(motivo), il solutore non viene invocato
 * 3. Solutore disponibile: unsat della negazione -> PROVEN, sat -> DISPROVEN, unknown -> UNKNOWN
 * 4. Solutore assente e obbligatorio: {@link SolverUnavailableException}
 * 5. Solutore assente e facoltativo: UNKNOWN
 *
 * Thread-safe: i contatori sono atomici e i backend non condividono stato tra interrogazioni.
 */
public class SmtInterface {

    private static final Logger LOGGER = Logger.getLogger(SmtInterface.class.getName());

    private final SolverBackend backend;
    private final SmtConfig config;
    private final SmtSyntaxValidator validator = new SmtSyntaxValidator();
    private final SmtStatistics statistics = new SmtStatistics();

    public SmtInterface(SolverBackend backend, SmtConfig config) {
        if (backend == null || config == null) {
            throw new IllegalArgumentException("Backend e configurazione del solutore sono obbligatori");
        }
        this.backend = backend;
        this.config = config;
    }

    /** Interfaccia senza solutore: ogni testo valido produce UNKNOWN */
    public static SmtInterface disabled() {
        return new SmtInterface(new DisabledBackend(), SmtConfig.disabled());
    }

    public PropertyResult verify(String text) {
        return verify(text, config.timeoutMs());
    }

    /**
     * Verifica un testo SMT-LIB che asserisce la negazione della proprietà.
     *
     * @param text script completo
     * @param timeoutMs timeout per questa interrogazione (limitato da quello configurato)
     * @return verdetto della proprietà
     * @throws SolverUnavailableException se il solutore è obbligatorio ma non disponibile
     */
    public PropertyResult verify(String text, long timeoutMs) {
        statistics.incrementQueries();

        SmtValidationResult validation = validator.validate(text);
        if (!validation.valid()) {
            statistics.incrementSyntaxErrors();
            LOGGER.fine("Testo SMT rifiutato: " + validation.message());
            return PropertyResult.error("Errore di sintassi: " + validation.message());
        }

        if (!backend.isAvailable()) {
            if (config.requireSolver()) {
                throw new SolverUnavailableException("Solutore '" + backend.name() + "' richiesto ma non disponibile");
            }
            return PropertyResult.unknown("solutore non disponibile");
        }

        if (config.verbose()) {
            LOGGER.info("Script inviato a " + backend.name() + ":\n" + text);
        }

        long effectiveTimeout = Math.max(1, Math.min(timeoutMs, config.timeoutMs()));
        try {
            SolverStatus status = backend.check(text, effectiveTimeout);
            return switch (status) {
                case UNSAT -> {
                    statistics.incrementProven();
                    yield PropertyResult.proven();
                }
                case SAT -> {
                    statistics.incrementDisproven();
                    yield PropertyResult.disproven();
                }
                case UNKNOWN -> PropertyResult.unknown("il solutore ha risposto unknown");
            };
        } catch (SolverException e) {
            statistics.incrementSolverErrors();
            LOGGER.log(Level.WARNING, "Errore del solutore " + backend.name(), e);
            return PropertyResult.error(e.getMessage());
        }
    }

    public boolean isSolverAvailable() {
        return backend.isAvailable();
    }

    public SmtStatistics getStatistics() {
        return statistics;
    }

    public SmtConfig getConfig() {
        return config;
    }

    public String getBackendName() {
        return backend.name();
    }
}

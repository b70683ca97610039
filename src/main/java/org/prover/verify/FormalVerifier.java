package org.prover.verify;

import org.prover.axiom.Axiom;
import org.prover.axiom.AxiomSystem;
import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;
import org.prover.formula.Formulas;
import org.prover.formula.PropertyFormula;
import org.prover.search.CandidateOrdering;
import org.prover.search.ProofSearchEngine;
import org.prover.search.ProofSearchResult;
import org.prover.search.ProofStep;
import org.prover.search.SearchConfig;
import org.prover.smt.SmtInterface;
import org.prover.smt.SmtScriptBuilder;
import org.prover.smt.SolverUnavailableException;
import org.prover.support.PropertyResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * VERIFICATORE FORMALE - Orchestrazione di ricerca di prove e solutore su un lotto di proprietà
 *
 * PER OGNI PROPRIETÀ:
 * 1. Cache dei verdetti per chiave strutturale (solo verdetti definitivi)
 * 2. Metodi richiesti tentati in ordine, il primo PROVEN/DISPROVEN decide
 * 3. Nessun esito definitivo e tentativo di refutazione attivo: le strategie di ricerca
 *    vengono eseguite sulla negazione, una sua prova rende la proprietà DISPROVEN
 * 4. Altrimenti ERROR se un metodo ha segnalato un errore, UNKNOWN in tutti gli altri casi
 * Metodi e refutazione condividono un'unica scadenza per proprietà: ciascuno riceve
 * solo il tempo rimasto, e a scadenza avvenuta i metodi successivi non partono.
 *
 * PER IL LOTTO:
 * • esecuzione sequenziale o su un pool di thread di dimensione fissa
 * • timeout per proprietà, timeout totale e soglia di memoria (le ultime due rendono il lotto INCOMPLETO);
 *   in parallelo il timeout totale annulla le proprietà ancora in corso, che si fermano al
 *   successivo controllo dei limiti
 * • solutore obbligatorio non disponibile: il lotto termina con stato ERRORE
 */
public class FormalVerifier {

    private static final Logger LOGGER = Logger.getLogger(FormalVerifier.class.getName());

    private static final String PROPERTY_TIMEOUT = "timeout della proprietà";

    private final VerificationConfig config;
    private final SmtInterface smtInterface;
    private final ProofSearchEngine engine;
    private final VerdictCache cache;

    /** Esito di un singolo metodo */
    private record Attempt(PropertyResult verdict, List<ProofStep> proof) {}

    /** Il solutore obbligatorio non è disponibile: interrompe il lotto */
    private static class EnvironmentFailure extends RuntimeException {
        EnvironmentFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    //region INIZIALIZZAZIONE

    public FormalVerifier(List<Axiom> axioms, List<InferenceRule> rules, VerificationConfig config,
                          SmtInterface smtInterface) {
        if (config == null || smtInterface == null) {
            throw new IllegalArgumentException("Configurazione e interfaccia del solutore sono obbligatorie");
        }
        this.config = config;
        this.smtInterface = smtInterface;
        SearchConfig search = boundedSearch(config);
        this.engine = new ProofSearchEngine(axioms, rules, search,
                CandidateOrdering.weighted(search.heuristicWeights()), config.cacheSize());
        this.cache = config.cacheEnabled() ? new VerdictCache(config.cacheSize(), config.cacheTtl()) : null;
    }

    public FormalVerifier(AxiomSystem system, VerificationConfig config, SmtInterface smtInterface) {
        this(system.axioms(), system.rules(), config, smtInterface);
    }

    /** La singola ricerca non può durare più del timeout per proprietà */
    private static SearchConfig boundedSearch(VerificationConfig config) {
        SearchConfig search = config.searchConfig();
        if (search.timeout().compareTo(config.propertyTimeout()) > 0) {
            return search.withTimeout(config.propertyTimeout());
        }
        return search;
    }

    //endregion

    //region VERIFICA DI UNA PROPRIETÀ

    /**
     * Verifica una singola proprietà.
     *
     * @throws SolverUnavailableException se il solutore è obbligatorio ma non disponibile
     */
    public PropertyVerification verifyProperty(PropertyTask task) {
        return verifyProperty(task, new VerificationStatistics());
    }

    public PropertyVerification verifyProperty(String name, Formula formula) {
        return verifyProperty(PropertyTask.of(name, formula));
    }

    private PropertyVerification verifyProperty(PropertyTask task, VerificationStatistics statistics) {
        long start = System.nanoTime();
        long deadline = start + config.propertyTimeout().toNanos();
        PropertyFormula property = task.property();

        if (cache != null) {
            Optional<PropertyResult> cached = cache.get(property.key());
            if (cached.isPresent()) {
                statistics.incrementCacheHits();
                statistics.recordProperty(cached.get().isProven(), 0);
                LOGGER.fine(() -> "Verdetto in cache per " + task.name());
                return new PropertyVerification(task.name(), cached.get(), null, List.of(), 0, true);
            }
            statistics.incrementCacheMisses();
        }

        List<VerificationMethod> methods = task.methods().isEmpty() ? config.methods() : task.methods();
        PropertyResult verdict = null;
        VerificationMethod decidingMethod = null;
        List<ProofStep> proof = List.of();
        String errorReason = null;
        String unknownReason = null;

        for (VerificationMethod method : methods) {
            Duration remaining = remaining(deadline);
            if (remaining.isZero()) {
                unknownReason = PROPERTY_TIMEOUT;
                break;
            }
            statistics.recordAttempt(method);
            Attempt attempt = run(method, task.name(), property, remaining);
            PropertyResult result = attempt.verdict();

            if (result.isConclusive()) {
                statistics.recordSuccess(method);
                verdict = result;
                decidingMethod = method;
                proof = attempt.proof();
                break;
            }
            if (result.isError() && errorReason == null) {
                errorReason = method.shortName() + ": " + result.reason();
            } else if (result.isUnknown() && result.reason() != null) {
                unknownReason = method.shortName() + ": " + result.reason();
            }
        }

        if (verdict == null && config.attemptDisproof()) {
            Formula negation = Formulas.negate(property.structure());
            for (VerificationMethod method : methods) {
                if (!method.isProofSearch()) {
                    continue;
                }
                Duration remaining = remaining(deadline);
                if (remaining.isZero()) {
                    unknownReason = PROPERTY_TIMEOUT;
                    break;
                }
                ProofSearchResult refutation = engine.prove(negation, method.strategy(), remaining);
                if (refutation.isProven()) {
                    verdict = PropertyResult.disproven();
                    decidingMethod = method;
                    proof = refutation.steps();
                    break;
                }
            }
        }

        if (verdict == null) {
            verdict = errorReason != null ? PropertyResult.error(errorReason) : PropertyResult.unknown(unknownReason);
        } else if (cache != null) {
            cache.put(property.key(), verdict);
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        statistics.recordProperty(verdict.isProven(), elapsedMs);
        statistics.sampleMemory();
        LOGGER.fine("Proprietà " + task.name() + ": " + verdict);
        return new PropertyVerification(task.name(), verdict, decidingMethod, proof, elapsedMs, false);
    }

    private Attempt run(VerificationMethod method, String name, PropertyFormula property, Duration remaining) {
        if (method == VerificationMethod.SMT_SOLVER) {
            String script = new SmtScriptBuilder().build(name, property);
            return new Attempt(smtInterface.verify(script, Math.max(1, remaining.toMillis())), List.of());
        }
        ProofSearchResult result = engine.prove(property.structure(), method.strategy(), remaining);
        return new Attempt(result.verdict(), result.steps());
    }

    /** Tempo rimasto fino alla scadenza, zero se già passata */
    private static Duration remaining(long deadline) {
        long left = deadline - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    //endregion

    //region VERIFICA DI UN LOTTO

    /**
     * Verifica tutte le proprietà e classifica lo stato complessivo.
     * Un errore su una singola proprietà non interrompe il lotto.
     */
    public VerificationReport verifyBatch(List<PropertyTask> tasks) {
        VerificationStatistics statistics = new VerificationStatistics();
        List<String> warnings = new ArrayList<>();
        PropertyVerification[] results = new PropertyVerification[tasks.size()];
        long deadline = System.nanoTime() + config.totalTimeout().toNanos();

        if (config.requireSolver() && !smtInterface.isSolverAvailable()) {
            String reason = "Solutore '" + smtInterface.getBackendName() + "' richiesto ma non disponibile";
            LOGGER.severe(reason);
            return finish(new VerificationStatus.Error(reason), tasks, results, statistics, warnings);
        }
        if (!smtInterface.isSolverAvailable() && usesSolver(tasks)) {
            warnings.add("Solutore SMT non disponibile: il metodo smt produrrà solo verdetti UNKNOWN");
        }

        String incomplete;
        try {
            incomplete = config.parallel() && tasks.size() > 1
                    ? runParallel(tasks, results, statistics, deadline)
                    : runSequential(tasks, results, statistics, deadline);
        } catch (EnvironmentFailure e) {
            LOGGER.log(Level.SEVERE, "Verifica interrotta", e);
            return finish(new VerificationStatus.Error(e.getMessage()), tasks, results, statistics, warnings);
        }

        if (incomplete != null) {
            warnings.add("Lotto interrotto: " + incomplete);
            return finish(new VerificationStatus.Incomplete(incomplete), tasks, results, statistics, warnings);
        }
        return finish(classify(results), tasks, results, statistics, warnings);
    }

    /** @return motivo dell'interruzione, null se il lotto è stato completato */
    private String runSequential(List<PropertyTask> tasks, PropertyVerification[] results,
                                 VerificationStatistics statistics, long deadline) {
        for (int i = 0; i < tasks.size(); i++) {
            String exhausted = checkResources(statistics, deadline);
            if (exhausted != null) {
                return exhausted;
            }
            results[i] = verifySafely(tasks.get(i), statistics);
        }
        return null;
    }

    private String runParallel(List<PropertyTask> tasks, PropertyVerification[] results,
                               VerificationStatistics statistics, long deadline) {
        int threads = Math.min(config.workerThreads(), tasks.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "verifica");
            thread.setDaemon(true);
            return thread;
        });

        try {
            List<Future<PropertyVerification>> futures = new ArrayList<>();
            for (PropertyTask task : tasks) {
                futures.add(executor.submit(() -> verifySafely(task, statistics)));
            }

            for (int i = 0; i < futures.size(); i++) {
                String exhausted = checkResources(statistics, deadline);
                if (exhausted != null) {
                    cancelAll(futures);
                    return exhausted;
                }
                // ogni proprietà si ferma da sola alla propria scadenza: qui conta solo il tempo totale
                long waitMs = Math.max(1, (deadline - System.nanoTime()) / 1_000_000);
                try {
                    results[i] = futures.get(i).get(waitMs, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    cancelAll(futures);
                    return "tempo totale esaurito (" + format(config.totalTimeout()) + ")";
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof EnvironmentFailure failure) {
                        throw failure;
                    }
                    LOGGER.log(Level.WARNING, "Errore nella verifica di " + tasks.get(i).name(), e.getCause());
                    results[i] = new PropertyVerification(tasks.get(i).name(),
                            PropertyResult.error(String.valueOf(e.getCause())), null, List.of(), 0, false);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancelAll(futures);
                    return "verifica interrotta";
                }
            }
            return null;
        } finally {
            executor.shutdownNow();
        }
    }

    private static void cancelAll(List<Future<PropertyVerification>> futures) {
        for (Future<PropertyVerification> future : futures) {
            future.cancel(true);
        }
    }

    /**
     * Verifica che non solleva eccezioni per guasti della singola proprietà;
     * solo l'assenza del solutore obbligatorio risale come {@link EnvironmentFailure}.
     */
    private PropertyVerification verifySafely(PropertyTask task, VerificationStatistics statistics) {
        try {
            return verifyProperty(task, statistics);
        } catch (SolverUnavailableException e) {
            throw new EnvironmentFailure(e.getMessage(), e);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Errore nella verifica di " + task.name(), e);
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return new PropertyVerification(task.name(), PropertyResult.error(reason), null, List.of(), 0, false);
        }
    }

    private String checkResources(VerificationStatistics statistics, long deadline) {
        if (System.nanoTime() > deadline) {
            return "tempo totale esaurito (" + format(config.totalTimeout()) + ")";
        }
        if (statistics.sampleMemory() > config.maxMemoryBytes()) {
            return "limite di memoria superato (" + config.maxMemoryBytes() / (1024 * 1024) + " MB)";
        }
        return null;
    }

    private static String format(Duration duration) {
        return duration.toMillis() % 1000 == 0 ? duration.toSeconds() + " s" : duration.toMillis() + " ms";
    }

    private boolean usesSolver(List<PropertyTask> tasks) {
        for (PropertyTask task : tasks) {
            List<VerificationMethod> methods = task.methods().isEmpty() ? config.methods() : task.methods();
            if (methods.contains(VerificationMethod.SMT_SOLVER)) {
                return true;
            }
        }
        return false;
    }

    //endregion

    //region CLASSIFICAZIONE

    /**
     * Tutte provate (o lotto vuoto): VERIFICATO; nessuna provata: FALLITO;
     * altrimenti PARZIALMENTE VERIFICATO con l'elenco delle non provate.
     */
    static VerificationStatus classify(PropertyVerification[] results) {
        List<VerificationFailure> failures = new ArrayList<>();
        int verified = 0;
        for (PropertyVerification result : results) {
            if (result.verdict().isProven()) {
                verified++;
            } else {
                failures.add(toFailure(result));
            }
        }
        if (failures.isEmpty()) {
            return new VerificationStatus.Verified();
        }
        if (verified == 0) {
            return new VerificationStatus.Failed(failures);
        }
        return new VerificationStatus.PartiallyVerified(verified, results.length, failures);
    }

    private static VerificationFailure toFailure(PropertyVerification result) {
        PropertyResult verdict = result.verdict();
        List<String> suggestions = new ArrayList<>();
        switch (verdict.outcome()) {
            case DISPROVEN -> {
                suggestions.add("La proprietà è falsa rispetto agli assiomi: controllarne la formulazione");
                suggestions.add("Verificare che gli assiomi descrivano correttamente il dominio");
            }
            case ERROR -> suggestions.add("Controllare la sintassi della proprietà e la disponibilità del solutore");
            case UNKNOWN -> {
                String reason = verdict.reason() == null ? "" : verdict.reason();
                if (reason.contains("tempo") || reason.contains("timeout")) {
                    suggestions.add("Aumentare il timeout per proprietà");
                } else if (reason.contains("profondità") || reason.contains("passi")) {
                    suggestions.add("Aumentare i limiti di profondità o di passi della ricerca");
                } else if (reason.contains("solutore")) {
                    suggestions.add("Configurare un solutore SMT o aggiungere un metodo di ricerca");
                } else {
                    suggestions.add("Aggiungere assiomi o regole che colleghino la proprietà alle ipotesi");
                }
                suggestions.add("Provare metodi di verifica diversi");
            }
            default -> {
            }
        }
        return new VerificationFailure(result.name(), verdict, verdict.reason(), suggestions);
    }

    private VerificationReport finish(VerificationStatus status, List<PropertyTask> tasks,
                                      PropertyVerification[] results, VerificationStatistics statistics,
                                      List<String> warnings) {
        List<PropertyVerification> ordered = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            ordered.add(results[i] != null ? results[i]
                    : PropertyVerification.notExecuted(tasks.get(i).name(), "non eseguita"));
        }
        statistics.recordSmtStatistics(smtInterface.getStatistics());
        statistics.stopTimer();
        LOGGER.info("Verifica completata: " + status.describe());
        return new VerificationReport(status, ordered, statistics, warnings);
    }

    //endregion

    public VerificationConfig getConfig() {
        return config;
    }

    public ProofSearchEngine getEngine() {
        return engine;
    }
}

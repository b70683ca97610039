package org.prover.verify;

import org.prover.search.SearchConfig;
import org.prover.smt.SmtConfig;

import java.time.Duration;
import java.util.List;

/**
 * CONFIGURAZIONE DELLA VERIFICA - Limiti globali, metodi e parametri di esecuzione
 *
 * Immutabile; si costruisce con {@link #defaults()} o con {@link #builder()}.
 *
 * @param totalTimeout tempo massimo per l'intero lotto
 * @param propertyTimeout tempo massimo per una singola proprietà
 * @param maxMemoryBytes soglia di memoria heap oltre la quale il lotto si interrompe
 * @param methods metodi tentati in ordine quando la proprietà non ne indica
 * @param parallel verifica concorrente delle proprietà di un lotto
 * @param workerThreads numero di thread del pool
 * @param cacheEnabled riuso dei verdetti definitivi per formule strutturalmente uguali
 * @param cacheSize numero massimo di verdetti in cache
 * @param cacheTtl durata di validità di un verdetto in cache
 * @param requireSolver un solutore assente rende l'intero lotto un errore
 * @param attemptDisproof se nessun metodo prova la proprietà, si prova la sua negazione
 * @param searchConfig limiti della ricerca di prove
 * @param smtConfig parametri del solutore
 */
public record VerificationConfig(Duration totalTimeout, Duration propertyTimeout, long maxMemoryBytes,
                                 List<VerificationMethod> methods, boolean parallel, int workerThreads,
                                 boolean cacheEnabled, int cacheSize, Duration cacheTtl, boolean requireSolver,
                                 boolean attemptDisproof, SearchConfig searchConfig, SmtConfig smtConfig) {

    public static final Duration DEFAULT_TOTAL_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_PROPERTY_TIMEOUT = Duration.ofSeconds(30);
    public static final long DEFAULT_MAX_MEMORY_BYTES = 1024L * 1024 * 1024;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final int DEFAULT_CACHE_SIZE = 1024;
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(10);
    public static final List<VerificationMethod> DEFAULT_METHODS = List.of(
            VerificationMethod.NATURAL_DEDUCTION, VerificationMethod.BACKWARD_CHAINING, VerificationMethod.SMT_SOLVER);

    public VerificationConfig {
        requirePositive(totalTimeout, "Timeout totale");
        requirePositive(propertyTimeout, "Timeout per proprietà");
        requirePositive(cacheTtl, "Durata della cache");
        if (maxMemoryBytes <= 0) {
            throw new IllegalArgumentException("Limite di memoria deve essere positivo: " + maxMemoryBytes);
        }
        if (methods == null || methods.isEmpty()) {
            throw new IllegalArgumentException("Almeno un metodo di verifica è obbligatorio");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("Numero di thread deve essere positivo: " + workerThreads);
        }
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("Dimensione della cache deve essere positiva: " + cacheSize);
        }
        methods = List.copyOf(methods);
        if (searchConfig == null) {
            searchConfig = SearchConfig.defaults();
        }
        if (smtConfig == null) {
            smtConfig = SmtConfig.disabled();
        }
    }

    private static void requirePositive(Duration duration, String what) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(what + " deve essere positivo");
        }
    }

    public static VerificationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder precompilato con i valori di questa configurazione */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.totalTimeout = totalTimeout;
        builder.propertyTimeout = propertyTimeout;
        builder.maxMemoryBytes = maxMemoryBytes;
        builder.methods = methods;
        builder.parallel = parallel;
        builder.workerThreads = workerThreads;
        builder.cacheEnabled = cacheEnabled;
        builder.cacheSize = cacheSize;
        builder.cacheTtl = cacheTtl;
        builder.requireSolver = requireSolver;
        builder.attemptDisproof = attemptDisproof;
        builder.searchConfig = searchConfig;
        builder.smtConfig = smtConfig;
        return builder;
    }

    public static final class Builder {
        private Duration totalTimeout = DEFAULT_TOTAL_TIMEOUT;
        private Duration propertyTimeout = DEFAULT_PROPERTY_TIMEOUT;
        private long maxMemoryBytes = DEFAULT_MAX_MEMORY_BYTES;
        private List<VerificationMethod> methods = DEFAULT_METHODS;
        private boolean parallel = true;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private boolean cacheEnabled = true;
        private int cacheSize = DEFAULT_CACHE_SIZE;
        private Duration cacheTtl = DEFAULT_CACHE_TTL;
        private boolean requireSolver = false;
        private boolean attemptDisproof = true;
        private SearchConfig searchConfig = SearchConfig.defaults();
        private SmtConfig smtConfig = SmtConfig.disabled();

        private Builder() {
        }

        public Builder totalTimeout(Duration value) {
            this.totalTimeout = value;
            return this;
        }

        public Builder propertyTimeout(Duration value) {
            this.propertyTimeout = value;
            return this;
        }

        public Builder maxMemoryBytes(long value) {
            this.maxMemoryBytes = value;
            return this;
        }

        public Builder methods(List<VerificationMethod> value) {
            this.methods = value;
            return this;
        }

        public Builder methods(VerificationMethod... value) {
            this.methods = List.of(value);
            return this;
        }

        public Builder parallel(boolean value) {
            this.parallel = value;
            return this;
        }

        public Builder workerThreads(int value) {
            this.workerThreads = value;
            return this;
        }

        public Builder cacheEnabled(boolean value) {
            this.cacheEnabled = value;
            return this;
        }

        public Builder cacheSize(int value) {
            this.cacheSize = value;
            return this;
        }

        public Builder cacheTtl(Duration value) {
            this.cacheTtl = value;
            return this;
        }

        public Builder requireSolver(boolean value) {
            this.requireSolver = value;
            return this;
        }

        public Builder attemptDisproof(boolean value) {
            this.attemptDisproof = value;
            return this;
        }

        public Builder searchConfig(SearchConfig value) {
            this.searchConfig = value;
            return this;
        }

        public Builder smtConfig(SmtConfig value) {
            this.smtConfig = value;
            return this;
        }

        public VerificationConfig build() {
            return new VerificationConfig(totalTimeout, propertyTimeout, maxMemoryBytes, methods, parallel,
                    workerThreads, cacheEnabled, cacheSize, cacheTtl, requireSolver, attemptDisproof,
                    searchConfig, smtConfig);
        }
    }
}

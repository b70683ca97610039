package org.prover.verify;

import org.prover.smt.SmtStatistics;

import java.util.EnumMap;
import java.util.Map;

/**
 * STATISTICHE DI VERIFICA - Metriche aggregate di un lotto
 *
 * Tempo totale e medio, proprietà elaborate e verificate, picco di memoria,
 * tentativi e successi per metodo, contatori del solutore e uso della cache.
 * Aggiornate concorrentemente dai thread di verifica: ogni metodo è sincronizzato.
 */
public class VerificationStatistics {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    //region CONTATORI

    private int propertiesProcessed = 0;
    private int propertiesVerified = 0;
    private long propertyTimeTotalMs = 0;
    private long peakMemoryBytes = 0;
    private int cacheHits = 0;
    private int cacheMisses = 0;

    private final Map<VerificationMethod, Integer> attempts = new EnumMap<>(VerificationMethod.class);
    private final Map<VerificationMethod, Integer> successes = new EnumMap<>(VerificationMethod.class);

    /** Contatori del solutore letti a fine lotto */
    private int smtQueries = 0;
    private int smtSyntaxErrors = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long totalTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    public VerificationStatistics() {
        this.startTime = System.nanoTime();
    }

    //region REGISTRAZIONE

    public synchronized void recordAttempt(VerificationMethod method) {
        attempts.merge(method, 1, Integer::sum);
    }

    public synchronized void recordSuccess(VerificationMethod method) {
        successes.merge(method, 1, Integer::sum);
    }

    public synchronized void recordProperty(boolean verified, long timeMs) {
        propertiesProcessed++;
        if (verified) {
            propertiesVerified++;
        }
        propertyTimeTotalMs += timeMs;
    }

    public synchronized void incrementCacheHits() {
        cacheHits++;
    }

    public synchronized void incrementCacheMisses() {
        cacheMisses++;
    }

    /** Campiona l'uso corrente dello heap e aggiorna il picco */
    public synchronized long sampleMemory() {
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        peakMemoryBytes = Math.max(peakMemoryBytes, used);
        return used;
    }

    public synchronized void recordSmtStatistics(SmtStatistics smt) {
        smtQueries = smt.getQueriesExecuted();
        smtSyntaxErrors = smt.getSyntaxErrors();
    }

    public synchronized void stopTimer() {
        if (!timerStopped) {
            totalTimeMs = (System.nanoTime() - startTime) / 1_000_000;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSORS

    public synchronized int getPropertiesProcessed() {
        return propertiesProcessed;
    }

    public synchronized int getPropertiesVerified() {
        return propertiesVerified;
    }

    public synchronized long getTotalTimeMs() {
        return timerStopped ? totalTimeMs : (System.nanoTime() - startTime) / 1_000_000;
    }

    /** Tempo medio per proprietà elaborata, 0 se nessuna */
    public synchronized double getAverageTimeMs() {
        return propertiesProcessed == 0 ? 0.0 : (double) propertyTimeTotalMs / propertiesProcessed;
    }

    public synchronized long getPeakMemoryBytes() {
        return peakMemoryBytes;
    }

    public synchronized int getAttempts(VerificationMethod method) {
        return attempts.getOrDefault(method, 0);
    }

    public synchronized int getSuccesses(VerificationMethod method) {
        return successes.getOrDefault(method, 0);
    }

    /** Frazione di tentativi conclusivi del metodo, 0 se mai tentato */
    public synchronized double getSuccessRate(VerificationMethod method) {
        int tried = getAttempts(method);
        return tried == 0 ? 0.0 : (double) getSuccesses(method) / tried;
    }

    public synchronized int getCacheHits() {
        return cacheHits;
    }

    public synchronized int getCacheMisses() {
        return cacheMisses;
    }

    public synchronized int getSmtQueries() {
        return smtQueries;
    }

    public synchronized int getSmtSyntaxErrors() {
        return smtSyntaxErrors;
    }

    //endregion

    @Override
    public synchronized String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("===== STATISTICHE DI VERIFICA =====\n");
        sb.append("Proprietà elaborate: ").append(propertiesProcessed).append('\n');
        sb.append("Proprietà verificate: ").append(propertiesVerified).append('\n');
        sb.append("Tempo totale: ").append(getTotalTimeMs()).append(" ms\n");
        sb.append(String.format("Tempo medio: %.2f ms%n", getAverageTimeMs()));
        sb.append(String.format("Picco di memoria: %.2f MB%n", peakMemoryBytes / BYTES_PER_MB));
        for (VerificationMethod method : VerificationMethod.values()) {
            int tried = getAttempts(method);
            if (tried > 0) {
                sb.append(String.format("Metodo %s: %d/%d (%.1f%%)%n", method.shortName(), getSuccesses(method),
                        tried, getSuccessRate(method) * 100));
            }
        }
        sb.append("Interrogazioni SMT: ").append(smtQueries)
                .append(" (errori di sintassi: ").append(smtSyntaxErrors).append(")\n");
        sb.append("Cache: ").append(cacheHits).append(" successi, ").append(cacheMisses).append(" mancati\n");
        sb.append("===================================");
        return sb.toString();
    }
}

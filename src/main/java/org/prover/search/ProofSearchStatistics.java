package org.prover.search;

/**
 * STATISTICHE DI RICERCA - Metriche raccolte da una singola chiamata di prova
 *
 * Passi esplorati, regole applicate, backtracking, iterazioni, uso della cache
 * e tempo di ricerca. Il timer parte alla costruzione e si ferma con {@link #stopTimer()}.
 */
public class ProofSearchStatistics {

    //region CONTATORI

    /** Nodi della ricerca visitati (obiettivi, estrazioni dalla coda, coppie risolte) */
    private int stepsExplored = 0;

    /** Applicazioni di regole e assiomi andate a buon fine */
    private int rulesApplied = 0;

    /** Tentativi annullati dopo un fallimento del sottoalbero */
    private int backtrackCount = 0;

    /** Iterazioni esterne: livelli di approfondimento o passate di risoluzione */
    private int iterations = 0;

    private int cacheHits = 0;
    private int cacheMisses = 0;

    /** Formule o clausole generate nel corso della ricerca */
    private int generatedFormulas = 0;

    private TerminationReason terminationReason = TerminationReason.EXHAUSTED;

    //endregion

    //region TIMING

    private final long startTime;
    private long searchTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    public ProofSearchStatistics() {
        this.startTime = System.nanoTime();
    }

    //region INCREMENTI

    public synchronized void incrementStepsExplored() {
        stepsExplored++;
    }

    public synchronized void incrementRulesApplied() {
        rulesApplied++;
    }

    public synchronized void incrementBacktracks() {
        backtrackCount++;
    }

    public synchronized void incrementIterations() {
        iterations++;
    }

    public synchronized void incrementCacheHits() {
        cacheHits++;
    }

    public synchronized void incrementCacheMisses() {
        cacheMisses++;
    }

    public synchronized void incrementGeneratedFormulas() {
        generatedFormulas++;
    }

    public synchronized void setTerminationReason(TerminationReason reason) {
        this.terminationReason = reason;
    }

    /**
     * Ferma il timer; le chiamate successive non hanno effetto.
     */
    public synchronized void stopTimer() {
        if (!timerStopped) {
            searchTimeMs = (System.nanoTime() - startTime) / 1_000_000;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSORS

    public synchronized int getStepsExplored() {
        return stepsExplored;
    }

    public synchronized int getRulesApplied() {
        return rulesApplied;
    }

    public synchronized int getBacktrackCount() {
        return backtrackCount;
    }

    public synchronized int getIterations() {
        return iterations;
    }

    public synchronized int getCacheHits() {
        return cacheHits;
    }

    public synchronized int getCacheMisses() {
        return cacheMisses;
    }

    public synchronized int getGeneratedFormulas() {
        return generatedFormulas;
    }

    public synchronized TerminationReason getTerminationReason() {
        return terminationReason;
    }

    /** Tempo di ricerca in millisecondi; se il timer è attivo, tempo trascorso finora */
    public synchronized long getSearchTimeMs() {
        return timerStopped ? searchTimeMs : (System.nanoTime() - startTime) / 1_000_000;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("Passi: %d, regole applicate: %d, backtrack: %d, iterazioni: %d, generate: %d, "
                        + "cache %d/%d, tempo: %d ms, terminazione: %s",
                getStepsExplored(), getRulesApplied(), getBacktrackCount(), getIterations(), getGeneratedFormulas(),
                getCacheHits(), getCacheHits() + getCacheMisses(), getSearchTimeMs(), getTerminationReason());
    }
}

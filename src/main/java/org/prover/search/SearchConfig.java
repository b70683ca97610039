package org.prover.search;

import java.time.Duration;

/**
 * Limiti e parametri condivisi dalle quattro strategie di ricerca.
 *
 * @param maxDepth profondità massima di ricorsione
 * @param timeout tempo massimo per una singola ricerca
 * @param maxSteps numero massimo di passi esplorati (passate per la risoluzione)
 * @param enableCaching riuso dei risultati già calcolati per lo stesso obiettivo
 * @param heuristicWeights pesi dell'ordinamento dei candidati
 */
public record SearchConfig(int maxDepth, Duration timeout, int maxSteps, boolean enableCaching,
                           HeuristicWeights heuristicWeights) {

    public static final int DEFAULT_MAX_DEPTH = 50;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_STEPS = 10_000;

    public SearchConfig {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Profondità massima non può essere negativa: " + maxDepth);
        }
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("Numero massimo di passi deve essere positivo: " + maxSteps);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout di ricerca deve essere positivo");
        }
        if (heuristicWeights == null) {
            heuristicWeights = HeuristicWeights.defaults();
        }
    }

    public static SearchConfig defaults() {
        return new SearchConfig(DEFAULT_MAX_DEPTH, DEFAULT_TIMEOUT, DEFAULT_MAX_STEPS, true, HeuristicWeights.defaults());
    }

    public SearchConfig withMaxDepth(int newMaxDepth) {
        return new SearchConfig(newMaxDepth, timeout, maxSteps, enableCaching, heuristicWeights);
    }

    public SearchConfig withTimeout(Duration newTimeout) {
        return new SearchConfig(maxDepth, newTimeout, maxSteps, enableCaching, heuristicWeights);
    }

    public SearchConfig withMaxSteps(int newMaxSteps) {
        return new SearchConfig(maxDepth, timeout, newMaxSteps, enableCaching, heuristicWeights);
    }

    public SearchConfig withCaching(boolean caching) {
        return new SearchConfig(maxDepth, timeout, maxSteps, caching, heuristicWeights);
    }

    public SearchConfig withHeuristicWeights(HeuristicWeights weights) {
        return new SearchConfig(maxDepth, timeout, maxSteps, enableCaching, weights);
    }
}

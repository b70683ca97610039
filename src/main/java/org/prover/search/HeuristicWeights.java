package org.prover.search;

/**
 * Pesi delle euristiche di ordinamento di assiomi e regole candidati.
 *
 * @param complexity peso della complessità strutturale (penalizza formule grandi)
 * @param axiomPriority peso della priorità dichiarata degli assiomi
 * @param rulePriority peso della priorità dichiarata delle regole
 * @param goalDistance peso della distanza dal simbolo di testa dell'obiettivo
 */
public record HeuristicWeights(double complexity, double axiomPriority, double rulePriority, double goalDistance) {

    public HeuristicWeights {
        if (complexity < 0 || axiomPriority < 0 || rulePriority < 0 || goalDistance < 0) {
            throw new IllegalArgumentException("I pesi euristici non possono essere negativi");
        }
    }

    public static HeuristicWeights defaults() {
        return new HeuristicWeights(1.0, 1.5, 1.2, 2.0);
    }
}

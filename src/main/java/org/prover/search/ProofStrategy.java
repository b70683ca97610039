package org.prover.search;

import org.prover.formula.Formula;

/**
 * Algoritmo di ricerca di prove. Le implementazioni sono prive di stato proprio:
 * tutto lo stato di lavoro vive nel {@link SearchContext}, quindi un'istanza
 * può servire ricerche concorrenti.
 */
interface ProofStrategy {

    SearchStrategyType type();

    /**
     * Cerca una prova dell'obiettivo accumulando i passi nel contesto.
     *
     * @return indice del passo conclusivo (obiettivo o clausola vuota), -1 se nessuna prova è stata trovata
     * @throws SearchAbortedException se un limite globale viene superato
     */
    int search(Formula goal, SearchContext context);
}

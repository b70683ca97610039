package org.prover.smt;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Contatori dell'interfaccia verso il solutore, condivisi tra thread.
 */
public class SmtStatistics {

    private final AtomicInteger queriesExecuted = new AtomicInteger();
    private final AtomicInteger syntaxErrors = new AtomicInteger();
    private final AtomicInteger provenCount = new AtomicInteger();
    private final AtomicInteger disprovenCount = new AtomicInteger();
    private final AtomicInteger solverErrors = new AtomicInteger();

    void incrementQueries() {
        queriesExecuted.incrementAndGet();
    }

    void incrementSyntaxErrors() {
        syntaxErrors.incrementAndGet();
    }

    void incrementProven() {
        provenCount.incrementAndGet();
    }

    void incrementDisproven() {
        disprovenCount.incrementAndGet();
    }

    void incrementSolverErrors() {
        solverErrors.incrementAndGet();
    }

    public int getQueriesExecuted() {
        return queriesExecuted.get();
    }

    public int getSyntaxErrors() {
        return syntaxErrors.get();
    }

    public int getProvenCount() {
        return provenCount.get();
    }

    public int getDisprovenCount() {
        return disprovenCount.get();
    }

    public int getSolverErrors() {
        return solverErrors.get();
    }

    @Override
    public String toString() {
        return String.format("Interrogazioni: %d, errori di sintassi: %d, dimostrate: %d, refutate: %d, errori solutore: %d",
                getQueriesExecuted(), getSyntaxErrors(), getProvenCount(), getDisprovenCount(), getSolverErrors());
    }
}

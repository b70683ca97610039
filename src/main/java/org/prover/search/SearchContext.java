package org.prover.search;

import org.prover.formula.Formula;
import org.prover.formula.FormulaKey;
import org.prover.formula.Substitution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * STATO DI LAVORO DI UNA RICERCA
 *
 * Creato per ogni chiamata di prova di primo livello, passato per riferimento
 * attraverso la ricorsione e scartato al ritorno. Contiene obiettivo, ipotesi
 * attive, sottobiettivi pendenti, legami correnti, insieme dei visitati,
 * passi accumulati, profondità e scadenza.
 *
 * Il backtracking avviene tramite {@link #mark()} / {@link #rollback(Mark)}:
 * passi e ipotesi sono pile, annullare un tentativo significa troncarle.
 */
public final class SearchContext {

    /** Ipotesi disponibile: formula, chiave strutturale e passo che la stabilisce */
    public record Hypothesis(Formula formula, FormulaKey key, int stepIndex) {}

    /** Posizione nelle pile per il backtracking */
    record Mark(int steps, int hypotheses, int dischargeLevel) {}

    private final Formula goal;
    private final SearchConfig config;
    private final ProofSearchStatistics statistics;
    private final long deadlineNanos;

    private final List<Hypothesis> hypotheses = new ArrayList<>();
    private final Deque<Formula> subgoals = new ArrayDeque<>();
    private final Set<FormulaKey> visited = new HashSet<>();
    private final List<ProofStep> steps = new ArrayList<>();
    private Substitution bindings = Substitution.empty();
    private int depth = 0;
    private int dischargeLevel = 0;
    private int freshCounter = 0;
    private boolean depthLimitReached = false;

    SearchContext(Formula goal, SearchConfig config, ProofSearchStatistics statistics) {
        this.goal = goal;
        this.config = config;
        this.statistics = statistics;
        this.deadlineNanos = System.nanoTime() + config.timeout().toNanos();
    }

    //region LIMITI

    /**
     * Controllo cooperativo dei limiti globali, da invocare a ogni livello di
     * ricorsione e a ogni estrazione dalla coda.
     *
     * Un thread interrotto (verifica annullata) conta come tempo scaduto.
     *
     * @throws SearchAbortedException se il tempo è scaduto o i passi sono esauriti
     */
    void checkBudget() {
        if (isExpired()) {
            throw new SearchAbortedException(TerminationReason.TIMEOUT);
        }
        if (statistics.getStepsExplored() > config.maxSteps()) {
            throw new SearchAbortedException(TerminationReason.STEP_LIMIT);
        }
    }

    /** Conta un passo esplorato e verifica i limiti */
    void explore() {
        statistics.incrementStepsExplored();
        checkBudget();
    }

    boolean isExpired() {
        return System.nanoTime() > deadlineNanos || Thread.currentThread().isInterrupted();
    }

    /** Segnala che almeno un ramo è stato tagliato dal limite di profondità */
    void markDepthLimitReached() {
        depthLimitReached = true;
    }

    void clearDepthLimitReached() {
        depthLimitReached = false;
    }

    boolean isDepthLimitReached() {
        return depthLimitReached;
    }

    //endregion

    //region PASSI E IPOTESI

    int addStep(Formula formula, Justification justification, List<Integer> dependencies) {
        int index = steps.size();
        steps.add(new ProofStep(index, formula, justification, dependencies, dischargeLevel));
        return index;
    }

    void addHypothesis(Formula formula, int stepIndex) {
        hypotheses.add(new Hypothesis(formula, FormulaKey.of(formula), stepIndex));
    }

    /**
     * Cerca un'ipotesi attiva strutturalmente uguale alla formula.
     *
     * @return indice del passo che la stabilisce, -1 se assente
     */
    int findHypothesis(Formula formula) {
        FormulaKey key = FormulaKey.of(formula);
        for (int i = hypotheses.size() - 1; i >= 0; i--) {
            if (hypotheses.get(i).key().equals(key)) {
                return hypotheses.get(i).stepIndex();
            }
        }
        return -1;
    }

    Mark mark() {
        return new Mark(steps.size(), hypotheses.size(), dischargeLevel);
    }

    void rollback(Mark mark) {
        truncate(steps, mark.steps());
        truncate(hypotheses, mark.hypotheses());
        dischargeLevel = mark.dischargeLevel();
    }

    /** Chiude lo scope delle ipotesi aperto dopo il mark, mantenendo i passi */
    void closeScope(Mark mark) {
        truncate(hypotheses, mark.hypotheses());
        dischargeLevel = mark.dischargeLevel();
    }

    void openAssumptionScope() {
        dischargeLevel++;
    }

    private static <T> void truncate(List<T> list, int size) {
        while (list.size() > size) {
            list.remove(list.size() - 1);
        }
    }

    //endregion

    //region CICLI, PROFONDITÀ, LEGAMI

    /** Registra la chiave come visitata; false se era già presente */
    boolean visit(FormulaKey key) {
        return visited.add(key);
    }

    void leave(FormulaKey key) {
        visited.remove(key);
    }

    void enter() {
        depth++;
    }

    void exit() {
        depth--;
    }

    void pushSubgoal(Formula subgoal) {
        subgoals.push(subgoal);
    }

    void popSubgoal() {
        subgoals.pop();
    }

    void setBindings(Substitution bindings) {
        this.bindings = bindings;
    }

    /** Suffisso univoco per separare i segnaposto di applicazioni diverse */
    String nextSuffix() {
        return "#" + (freshCounter++);
    }

    //endregion

    //region ACCESSORS

    public Formula getGoal() {
        return goal;
    }

    public SearchConfig getConfig() {
        return config;
    }

    public ProofSearchStatistics getStatistics() {
        return statistics;
    }

    public List<Hypothesis> getHypotheses() {
        return Collections.unmodifiableList(hypotheses);
    }

    public List<Formula> getSubgoals() {
        return List.copyOf(subgoals);
    }

    public Substitution getBindings() {
        return bindings;
    }

    public Set<FormulaKey> getVisited() {
        return Collections.unmodifiableSet(visited);
    }

    public List<ProofStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public int getDepth() {
        return depth;
    }

    public int getDischargeLevel() {
        return dischargeLevel;
    }

    //endregion
}

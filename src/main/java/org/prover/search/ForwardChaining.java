package org.prover.search;

import org.prover.axiom.Axiom;
import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;
import org.prover.formula.FormulaKey;
import org.prover.formula.Formulas;
import org.prover.formula.Substitution;
import org.prover.formula.Unifier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * CONCATENAMENTO IN AVANTI - Chiusura in ampiezza dei fatti derivabili
 *
 * ALGORITMO:
 * 1. Coda e insieme dei derivati inizializzati con gli assiomi (deduplicati per chiave strutturale)
 * 2. Estrazione in ordine FIFO: se il fatto corrisponde all'obiettivo la prova è trovata
 * 3. Altrimenti ogni regola viene applicata con il fatto estratto in una delle premesse
 *    e i fatti già estratti nelle altre (semi-naive: le combinazioni di soli fatti vecchi non si ripetono)
 * 4. Le conclusioni chiuse mai viste vengono accodate
 *
 * Termina con coda vuota (nessun fatto nuovo derivabile), limite di passi o timeout.
 */
class ForwardChaining implements ProofStrategy {

    private static final Logger LOGGER = Logger.getLogger(ForwardChaining.class.getName());

    private final List<Axiom> axioms;
    private final List<InferenceRule> rules;

    ForwardChaining(List<Axiom> axioms, List<InferenceRule> rules) {
        this.axioms = axioms;
        this.rules = rules;
    }

    @Override
    public SearchStrategyType type() {
        return SearchStrategyType.FORWARD_CHAINING;
    }

    @Override
    public int search(Formula goal, SearchContext context) {
        FormulaKey goalKey = FormulaKey.of(goal);
        Map<FormulaKey, Integer> derived = new HashMap<>();
        List<Integer> facts = new ArrayList<>();
        Deque<Integer> queue = new ArrayDeque<>();

        for (Axiom axiom : axioms) {
            FormulaKey key = FormulaKey.of(axiom.formula());
            if (!derived.containsKey(key)) {
                int index = context.addStep(axiom.formula(),
                        new Justification.ByAxiom(axiom.name(), Substitution.empty()), List.of());
                derived.put(key, index);
                queue.add(index);
            }
        }

        while (!queue.isEmpty()) {
            context.explore();
            int current = queue.poll();
            Formula fact = context.getSteps().get(current).formula();

            int match = matchGoal(fact, current, goal, goalKey, context);
            if (match >= 0) {
                return match;
            }

            facts.add(current);
            for (InferenceRule rule : rules) {
                fire(rule, current, facts, derived, queue, context);
            }
        }
        LOGGER.fine(() -> "Chiusura completata senza raggiungere l'obiettivo: " + derived.size() + " fatti");
        return -1;
    }

    /**
     * Il fatto corrisponde all'obiettivo se ha la stessa chiave strutturale oppure
     * se l'obiettivo ne è un'istanza (schema universale o con segnaposto).
     */
    private static int matchGoal(Formula fact, int index, Formula goal, FormulaKey goalKey, SearchContext context) {
        if (FormulaKey.of(fact).equals(goalKey)) {
            return index;
        }
        if (Formulas.isGround(fact) && !(fact instanceof Formula.Universal)) {
            return -1;
        }
        if (Unifier.unify(Patterns.open(fact, context.nextSuffix()), goal).isPresent()) {
            context.getStatistics().incrementRulesApplied();
            return context.addStep(goal, new Justification.Introduction("∀E"), List.of(index));
        }
        return -1;
    }

    //region APPLICAZIONE DELLE REGOLE

    private void fire(InferenceRule original, int current, List<Integer> facts, Map<FormulaKey, Integer> derived,
                      Deque<Integer> queue, SearchContext context) {
        InferenceRule rule = Patterns.rename(original, context.nextSuffix());
        List<Formula> premises = rule.premises();
        Formula fact = context.getSteps().get(current).formula();

        for (int position = 0; position < premises.size(); position++) {
            Optional<Substitution> unifier = Unifier.unify(premises.get(position), Patterns.open(fact, context.nextSuffix()));
            if (unifier.isEmpty()) {
                continue;
            }
            Integer[] chosen = new Integer[premises.size()];
            chosen[position] = current;
            combine(original, rule, 0, position, chosen, unifier.get(), facts, derived, queue, context);
        }
    }

    /** Completa le premesse diverse da quella fissata con tutti i fatti compatibili */
    private void combine(InferenceRule original, InferenceRule rule, int next, int fixed, Integer[] chosen,
                         Substitution bindings, List<Integer> facts, Map<FormulaKey, Integer> derived,
                         Deque<Integer> queue, SearchContext context) {
        if (next == rule.premises().size()) {
            conclude(original, rule, chosen, bindings, derived, queue, context);
            return;
        }
        if (next == fixed) {
            combine(original, rule, next + 1, fixed, chosen, bindings, facts, derived, queue, context);
            return;
        }
        context.checkBudget();
        for (int index : facts) {
            Formula candidate = Patterns.open(context.getSteps().get(index).formula(), context.nextSuffix());
            Optional<Substitution> extended = Unifier.unify(rule.premises().get(next), candidate, bindings);
            if (extended.isPresent()) {
                chosen[next] = index;
                combine(original, rule, next + 1, fixed, chosen, extended.get(), facts, derived, queue, context);
            }
        }
        chosen[next] = null;
    }

    private static void conclude(InferenceRule original, InferenceRule rule, Integer[] chosen, Substitution bindings,
                                 Map<FormulaKey, Integer> derived, Deque<Integer> queue, SearchContext context) {
        Formula conclusion = bindings.apply(rule.conclusion());
        if (!Formulas.isGround(conclusion)) {
            return;
        }
        FormulaKey key = FormulaKey.of(conclusion);
        if (derived.containsKey(key)) {
            return;
        }
        List<Integer> dependencies = new ArrayList<>();
        for (Integer index : chosen) {
            dependencies.add(index);
        }
        int index = context.addStep(conclusion, new Justification.ByRule(original.name(), Substitution.empty()),
                dependencies);
        derived.put(key, index);
        queue.add(index);
        context.getStatistics().incrementRulesApplied();
        context.getStatistics().incrementGeneratedFormulas();
    }

    //endregion
}

package org.prover.search;

import org.prover.axiom.Axiom;
import org.prover.formula.Formula;
import org.prover.formula.Formulas;
import org.prover.formula.Substitution;
import org.prover.formula.Unifier;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * RISOLUZIONE - Prova per refutazione
 *
 * Assiomi e negazione dell'obiettivo vengono convertiti in clausole; a ogni passata
 * si risolve ogni coppia che contiene almeno una clausola nuova. La clausola vuota
 * rende l'insieme insoddisfacibile, quindi l'obiettivo è provato. Una passata senza
 * clausole nuove satura l'insieme: nessuna prova per risoluzione binaria.
 *
 * Ogni passata conta come passo esplorato, quindi maxSteps limita il numero di passate.
 */
class ResolutionProver implements ProofStrategy {

    private static final Logger LOGGER = Logger.getLogger(ResolutionProver.class.getName());

    private record Resolvent(Clause clause, Substitution unifier) {}

    private final List<Axiom> axioms;

    ResolutionProver(List<Axiom> axioms) {
        this.axioms = axioms;
    }

    @Override
    public SearchStrategyType type() {
        return SearchStrategyType.RESOLUTION;
    }

    @Override
    public int search(Formula goal, SearchContext context) {
        ClauseConverter converter = new ClauseConverter();
        List<Clause> clauses = new ArrayList<>();
        List<Integer> steps = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (Axiom axiom : axioms) {
            for (Clause clause : converter.toClauses(axiom.formula())) {
                int index = register(clause, new Justification.ByAxiom(axiom.name(), Substitution.empty()),
                        List.of(), clauses, steps, seen, context);
                if (index >= 0 && clause.isEmpty()) {
                    return index;
                }
            }
        }
        for (Clause clause : converter.toClauses(Formula.not(goal))) {
            int index = register(clause, new Justification.NegatedGoal(), List.of(), clauses, steps, seen, context);
            if (index >= 0 && clause.isEmpty()) {
                return index;
            }
        }
        LOGGER.fine(() -> "Insieme iniziale di " + clauses.size() + " clausole");

        int firstNew = 0;
        while (true) {
            context.explore();
            context.getStatistics().incrementIterations();

            int size = clauses.size();
            List<Clause> fresh = new ArrayList<>();
            List<Integer> freshSteps = new ArrayList<>();

            for (int j = firstNew; j < size; j++) {
                for (int i = 0; i < j; i++) {
                    context.checkBudget();
                    for (Resolvent resolvent : resolve(clauses.get(i), clauses.get(j), context.nextSuffix())) {
                        List<Integer> dependencies = List.of(steps.get(i), steps.get(j));
                        if (resolvent.clause().isEmpty()) {
                            return context.addStep(Formula.falsum(), new Justification.Resolvent(resolvent.unifier()),
                                    dependencies);
                        }
                        register(resolvent.clause(), new Justification.Resolvent(resolvent.unifier()), dependencies,
                                fresh, freshSteps, seen, context);
                    }
                }
            }

            if (fresh.isEmpty()) {
                LOGGER.fine(() -> "Insieme di clausole saturato: " + clauses.size() + " clausole");
                return -1;
            }
            firstNew = size;
            clauses.addAll(fresh);
            steps.addAll(freshSteps);
        }
    }

    /**
     * Aggiunge la clausola se non tautologica e mai vista (a meno dei nomi delle variabili).
     *
     * @return indice del passo creato, -1 se la clausola è stata scartata
     */
    private static int register(Clause clause, Justification justification, List<Integer> dependencies,
                                List<Clause> clauses, List<Integer> steps, Set<String> seen, SearchContext context) {
        if (clause.isTautology() || !seen.add(clause.canonicalKey())) {
            return -1;
        }
        Clause standardized = clause.standardize("c" + context.getSteps().size() + "_");
        int index = context.addStep(standardized.toFormula(), justification, dependencies);
        clauses.add(standardized);
        steps.add(index);
        context.getStatistics().incrementGeneratedFormulas();
        return index;
    }

    /** Risolventi binari delle due clausole, con le variabili della seconda separate dalla prima */
    private static List<Resolvent> resolve(Clause left, Clause right, String suffix) {
        List<Literal> renamed = new ArrayList<>();
        for (Literal literal : right.literals()) {
            renamed.add(new Literal(Formulas.renameHoles(literal.atom(), suffix), literal.positive()));
        }

        List<Resolvent> resolvents = new ArrayList<>();
        for (Literal first : left.literals()) {
            for (Literal second : renamed) {
                if (first.positive() == second.positive()) {
                    continue;
                }
                Optional<Substitution> unifier = Unifier.unify(first.atom(), second.atom());
                if (unifier.isEmpty()) {
                    continue;
                }
                Substitution sigma = unifier.get();
                List<Literal> literals = new ArrayList<>();
                for (Literal literal : left.literals()) {
                    if (literal != first) {
                        literals.add(new Literal(sigma.apply(literal.atom()), literal.positive()));
                    }
                }
                for (Literal literal : renamed) {
                    if (literal != second) {
                        literals.add(new Literal(sigma.apply(literal.atom()), literal.positive()));
                    }
                }
                Clause clause = new Clause(literals).withoutFalseLiterals();
                if (!clause.isTautology()) {
                    resolvents.add(new Resolvent(clause, sigma));
                }
            }
        }
        return resolvents;
    }
}

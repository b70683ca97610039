package org.prover.search;

import org.prover.axiom.Axiom;
import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;
import org.prover.formula.FormulaKey;
import org.prover.formula.Substitution;
import org.prover.formula.Unifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CONCATENAMENTO ALL'INDIETRO - Ricerca E/O guidata dall'obiettivo
 *
 * Un obiettivo riesce se si unifica con un assioma (nodo O sugli assiomi), oppure
 * se esiste una regola la cui conclusione si unifica con esso e tutte le premesse
 * istanziate riescono (nodo E). La sostituzione viene propagata da una premessa
 * alla successiva; il resto della prova prosegue in continuazione, così un
 * fallimento a valle riapre le alternative a monte.
 *
 * La profondità cresce per approfondimento iterativo da 0 a maxDepth: un livello
 * superiore esplora un sovrainsieme dell'albero del precedente, quindi aumentare
 * maxDepth non trasforma mai una prova trovata in un fallimento. Se un livello
 * termina senza tagli di profondità lo spazio è esaurito e i livelli successivi
 * non vengono tentati.
 */
class BackwardChaining implements ProofStrategy {

    /** Nodo dell'albero di derivazione, linearizzato in passi solo a prova trovata */
    private record Derivation(Formula pattern, Justification justification, List<Derivation> children) {}

    /** Prosecuzione della prova dopo che un obiettivo è riuscito */
    @FunctionalInterface
    private interface Continuation {
        boolean proceed(Substitution bindings, Derivation derivation);
    }

    @FunctionalInterface
    private interface PremisesContinuation {
        boolean proceed(Substitution bindings, List<Derivation> derivations);
    }

    private final List<Axiom> axioms;
    private final List<InferenceRule> rules;
    private final CandidateOrdering ordering;

    BackwardChaining(List<Axiom> axioms, List<InferenceRule> rules, CandidateOrdering ordering) {
        this.axioms = axioms;
        this.rules = rules;
        this.ordering = ordering;
    }

    @Override
    public SearchStrategyType type() {
        return SearchStrategyType.BACKWARD_CHAINING;
    }

    @Override
    public int search(Formula goal, SearchContext context) {
        int maxDepth = context.getConfig().maxDepth();
        Substitution[] solution = new Substitution[1];
        Derivation[] proof = new Derivation[1];

        for (int limit = 0; limit <= maxDepth; limit++) {
            context.getStatistics().incrementIterations();
            context.clearDepthLimitReached();

            boolean found = solve(goal, Substitution.empty(), 0, limit, context, (bindings, derivation) -> {
                solution[0] = bindings;
                proof[0] = derivation;
                return true;
            });
            if (found) {
                context.setBindings(solution[0]);
                return linearize(proof[0], solution[0], context);
            }
            if (!context.isDepthLimitReached()) {
                return -1;
            }
        }
        return -1;
    }

    //region RISOLUZIONE SLD

    private boolean solve(Formula goal, Substitution bindings, int depth, int limit, SearchContext context,
                          Continuation continuation) {
        context.explore();
        Formula instance = bindings.apply(goal);

        for (Axiom axiom : ordering.orderAxioms(axioms, instance)) {
            Optional<Substitution> match = Unifier.unify(Patterns.open(axiom.formula(), context.nextSuffix()),
                    instance, bindings);
            if (match.isEmpty()) {
                continue;
            }
            context.getStatistics().incrementRulesApplied();
            Derivation leaf = new Derivation(goal, new Justification.ByAxiom(axiom.name(), Substitution.empty()),
                    List.of());
            if (continuation.proceed(match.get(), leaf)) {
                return true;
            }
            context.getStatistics().incrementBacktracks();
        }

        if (depth >= limit) {
            if (!rules.isEmpty()) {
                context.markDepthLimitReached();
            }
            return false;
        }

        FormulaKey key = FormulaKey.of(instance);
        if (!context.visit(key)) {
            return false;
        }
        context.enter();
        try {
            for (InferenceRule original : ordering.orderRules(rules, instance)) {
                InferenceRule rule = Patterns.rename(original, context.nextSuffix());
                Optional<Substitution> unifier = Unifier.unify(rule.conclusion(), instance, bindings);
                if (unifier.isEmpty()) {
                    continue;
                }
                context.getStatistics().incrementRulesApplied();

                boolean proved = solveAll(rule.premises(), 0, unifier.get(), depth + 1, limit, context,
                        new ArrayList<>(), (solved, children) -> {
                            // il resto della prova non discende da questo obiettivo
                            context.leave(key);
                            try {
                                Justification justification = new Justification.ByRule(original.name(),
                                        Substitution.empty());
                                return continuation.proceed(solved, new Derivation(goal, justification, children));
                            } finally {
                                context.visit(key);
                            }
                        });
                if (proved) {
                    return true;
                }
                context.getStatistics().incrementBacktracks();
            }
            return false;
        } finally {
            context.exit();
            context.leave(key);
        }
    }

    private boolean solveAll(List<Formula> premises, int position, Substitution bindings, int depth, int limit,
                             SearchContext context, List<Derivation> solved, PremisesContinuation continuation) {
        if (position == premises.size()) {
            return continuation.proceed(bindings, List.copyOf(solved));
        }
        return solve(premises.get(position), bindings, depth, limit, context, (extended, derivation) -> {
            solved.add(derivation);
            try {
                return solveAll(premises, position + 1, extended, depth, limit, context, solved, continuation);
            } finally {
                solved.remove(solved.size() - 1);
            }
        });
    }

    //endregion

    //region LINEARIZZAZIONE

    /** Visita in post-ordine: ogni passo segue i passi delle sue premesse */
    private static int linearize(Derivation derivation, Substitution bindings, SearchContext context) {
        List<Integer> dependencies = new ArrayList<>();
        for (Derivation child : derivation.children()) {
            dependencies.add(linearize(child, bindings, context));
        }
        return context.addStep(bindings.apply(derivation.pattern()), derivation.justification(), dependencies);
    }

    //endregion
}

package org.prover.search;

import org.prover.axiom.Axiom;
import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;
import org.prover.formula.FormulaKey;
import org.prover.formula.Formulas;
import org.prover.formula.Substitution;
import org.prover.formula.Term;
import org.prover.formula.Unifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * DEDUZIONE NATURALE - Ricerca ricorsiva all'indietro con backtracking
 *
 * ORDINE DEI TENTATIVI PER OGNI OBIETTIVO:
 * 1. Ipotesi attiva strutturalmente uguale: successo senza passi aggiunti
 * 2. Regole di inferenza: la conclusione si unifica con l'obiettivo, le premesse vengono stabilite
 * 3. Assiomi: corrispondenza diretta o istanza di uno schema universale
 * 4. Introduzione del connettivo principale (∧I, →I, ↔I, ∨I, ∀I)
 *
 * Ogni tentativo fallito annulla passi e ipotesi aggiunti (mark/rollback) e conta
 * un backtrack. Le premesse non ancora istanziate, o che inglobano l'obiettivo
 * stesso, vengono soddisfatte solo da fatti noti (ipotesi e assiomi): una loro
 * dimostrazione ricorsiva non terminerebbe.
 */
class NaturalDeduction implements ProofStrategy {

    private static final Logger LOGGER = Logger.getLogger(NaturalDeduction.class.getName());

    private final List<Axiom> axioms;
    private final List<InferenceRule> rules;
    private final CandidateOrdering ordering;

    NaturalDeduction(List<Axiom> axioms, List<InferenceRule> rules, CandidateOrdering ordering) {
        this.axioms = axioms;
        this.rules = rules;
        this.ordering = ordering;
    }

    @Override
    public SearchStrategyType type() {
        return SearchStrategyType.NATURAL_DEDUCTION;
    }

    @Override
    public int search(Formula goal, SearchContext context) {
        return prove(goal, context, 0);
    }

    //region RICERCA RICORSIVA

    private int prove(Formula goal, SearchContext context, int depth) {
        context.explore();

        int hypothesis = context.findHypothesis(goal);
        if (hypothesis >= 0) {
            return hypothesis;
        }
        if (depth > context.getConfig().maxDepth()) {
            context.markDepthLimitReached();
            return -1;
        }

        FormulaKey key = FormulaKey.of(goal);
        if (!context.visit(key)) {
            return -1;
        }
        context.enter();
        context.pushSubgoal(goal);
        try {
            int result = tryRules(goal, context, depth);
            if (result < 0) {
                result = tryAxioms(goal, context);
            }
            if (result < 0) {
                result = tryIntroduction(goal, context, depth);
            }
            return result;
        } finally {
            context.popSubgoal();
            context.exit();
            context.leave(key);
        }
    }

    //endregion

    //region REGOLE DI INFERENZA

    private int tryRules(Formula goal, SearchContext context, int depth) {
        for (InferenceRule original : ordering.orderRules(rules, goal)) {
            InferenceRule rule = Patterns.rename(original, context.nextSuffix());
            Optional<Substitution> unifier = Unifier.unify(rule.conclusion(), goal);
            if (unifier.isEmpty()) {
                continue;
            }

            SearchContext.Mark mark = context.mark();
            List<Integer> dependencies = new ArrayList<>();
            Optional<Substitution> bindings = establishPremises(new ArrayList<>(rule.premises()), goal,
                    unifier.get(), dependencies, context, depth);

            if (bindings.isPresent()) {
                context.setBindings(bindings.get());
                int index = context.addStep(goal, new Justification.ByRule(original.name(), Substitution.empty()),
                        dependencies);
                context.addHypothesis(goal, index);
                context.getStatistics().incrementRulesApplied();
                LOGGER.finest(() -> "Regola " + original.name() + " applicata a " + goal);
                return index;
            }

            context.rollback(mark);
            context.getStatistics().incrementBacktracks();
        }
        return -1;
    }

    /**
     * Stabilisce le premesse rimanenti una alla volta, scegliendo per prima la più
     * istanziata. Le alternative sui fatti noti vengono esplorate con backtracking.
     */
    private Optional<Substitution> establishPremises(List<Formula> remaining, Formula goal, Substitution bindings,
                                                     List<Integer> dependencies, SearchContext context, int depth) {
        if (remaining.isEmpty()) {
            return Optional.of(bindings);
        }

        int chosen = selectPremise(remaining, bindings);
        Formula premise = bindings.apply(remaining.get(chosen));
        List<Formula> rest = new ArrayList<>(remaining);
        rest.remove(chosen);

        if (Formulas.isGround(premise) && !embeds(premise, goal)) {
            int index = prove(premise, context, depth + 1);
            if (index < 0) {
                return Optional.empty();
            }
            dependencies.add(index);
            return establishPremises(rest, goal, bindings, dependencies, context, depth);
        }

        for (KnownFact fact : knownFacts(context)) {
            context.checkBudget();
            Optional<Substitution> extended = Unifier.unify(premise, fact.formula(), bindings);
            if (extended.isEmpty()) {
                continue;
            }
            SearchContext.Mark mark = context.mark();
            int dependencyCount = dependencies.size();

            dependencies.add(establish(fact, extended.get().apply(premise), context));
            Optional<Substitution> result = establishPremises(rest, goal, extended.get(), dependencies, context, depth);
            if (result.isPresent()) {
                return result;
            }

            context.rollback(mark);
            while (dependencies.size() > dependencyCount) {
                dependencies.remove(dependencies.size() - 1);
            }
            context.getStatistics().incrementBacktracks();
        }
        return Optional.empty();
    }

    /** Indice della premessa con più struttura già legata (dimensione meno segnaposto liberi) */
    private static int selectPremise(List<Formula> premises, Substitution bindings) {
        int best = 0;
        int bestScore = Integer.MIN_VALUE;
        for (int i = 0; i < premises.size(); i++) {
            Formula instance = bindings.apply(premises.get(i));
            int score = Formulas.isGround(instance) ? Integer.MAX_VALUE
                    : Formulas.size(instance) - 2 * Patterns.countHoles(instance);
            if (score > bestScore) {
                best = i;
                bestScore = score;
            }
        }
        return best;
    }

    /** Vero se la premessa contiene l'obiettivo come sottoformula propria */
    private static boolean embeds(Formula premise, Formula goal) {
        FormulaKey goalKey = FormulaKey.of(goal);
        for (Formula child : Formulas.children(premise)) {
            if (FormulaKey.of(child).equals(goalKey) || embeds(child, goal)) {
                return true;
            }
        }
        return false;
    }

    /** Fatto disponibile: un'ipotesi (con il suo passo) oppure un assioma aperto */
    private record KnownFact(Formula formula, int stepIndex, Axiom axiom) {}

    /** Ipotesi attive (le più recenti prima) seguite dagli assiomi aperti con segnaposto nuovi */
    private List<KnownFact> knownFacts(SearchContext context) {
        List<KnownFact> facts = new ArrayList<>();
        List<SearchContext.Hypothesis> hypotheses = context.getHypotheses();
        for (int i = hypotheses.size() - 1; i >= 0; i--) {
            SearchContext.Hypothesis hypothesis = hypotheses.get(i);
            facts.add(new KnownFact(hypothesis.formula(), hypothesis.stepIndex(), null));
        }
        for (Axiom axiom : axioms) {
            facts.add(new KnownFact(Patterns.open(axiom.formula(), context.nextSuffix()), -1, axiom));
        }
        return facts;
    }

    /** Indice del passo che stabilisce il fatto: quello dell'ipotesi o un nuovo passo da assioma */
    private static int establish(KnownFact fact, Formula instance, SearchContext context) {
        if (fact.stepIndex() >= 0) {
            return fact.stepIndex();
        }
        int index = context.addStep(instance, new Justification.ByAxiom(fact.axiom().name(), Substitution.empty()),
                List.of());
        context.addHypothesis(instance, index);
        context.getStatistics().incrementRulesApplied();
        return index;
    }

    //endregion

    //region ASSIOMI

    private int tryAxioms(Formula goal, SearchContext context) {
        for (Axiom axiom : ordering.orderAxioms(axioms, goal)) {
            Optional<Substitution> match = Unifier.unify(Patterns.open(axiom.formula(), context.nextSuffix()), goal);
            if (match.isPresent()) {
                int index = context.addStep(goal, new Justification.ByAxiom(axiom.name(), match.get()), List.of());
                context.addHypothesis(goal, index);
                context.getStatistics().incrementRulesApplied();
                return index;
            }
        }
        return -1;
    }

    //endregion

    //region INTRODUZIONI

    private int tryIntroduction(Formula goal, SearchContext context, int depth) {
        return switch (goal.kind()) {
            case CONJUNCTION -> introduceConjunction((Formula.Conjunction) goal, context, depth);
            case IMPLICATION -> introduceImplication((Formula.Implication) goal, context, depth);
            case BICONDITIONAL -> introduceBiconditional((Formula.Biconditional) goal, context, depth);
            case DISJUNCTION -> introduceDisjunction((Formula.Disjunction) goal, context, depth);
            case UNIVERSAL -> introduceUniversal((Formula.Universal) goal, context, depth);
            default -> -1;
        };
    }

    private int introduceConjunction(Formula.Conjunction goal, SearchContext context, int depth) {
        SearchContext.Mark mark = context.mark();
        List<Integer> dependencies = new ArrayList<>();
        for (Formula operand : goal.operands()) {
            int index = prove(operand, context, depth + 1);
            if (index < 0) {
                context.rollback(mark);
                context.getStatistics().incrementBacktracks();
                return -1;
            }
            dependencies.add(index);
        }
        return conclude(goal, "∧I", dependencies, context);
    }

    /** Apre l'antecedente come assunzione, prova il conseguente e scarica l'assunzione */
    private int introduceImplication(Formula.Implication goal, SearchContext context, int depth) {
        SearchContext.Mark mark = context.mark();
        context.openAssumptionScope();
        int assumption = context.addStep(goal.antecedent(), new Justification.Assumption(), List.of());
        context.addHypothesis(goal.antecedent(), assumption);

        int consequent = prove(goal.consequent(), context, depth + 1);
        if (consequent < 0) {
            context.rollback(mark);
            context.getStatistics().incrementBacktracks();
            return -1;
        }
        context.closeScope(mark);
        return conclude(goal, "→I", List.of(assumption, consequent), context);
    }

    private int introduceBiconditional(Formula.Biconditional goal, SearchContext context, int depth) {
        SearchContext.Mark mark = context.mark();
        int forward = prove(Formula.implies(goal.left(), goal.right()), context, depth + 1);
        int backward = forward < 0 ? -1 : prove(Formula.implies(goal.right(), goal.left()), context, depth + 1);
        if (backward < 0) {
            context.rollback(mark);
            context.getStatistics().incrementBacktracks();
            return -1;
        }
        return conclude(goal, "↔I", List.of(forward, backward), context);
    }

    private int introduceDisjunction(Formula.Disjunction goal, SearchContext context, int depth) {
        for (Formula operand : goal.operands()) {
            SearchContext.Mark mark = context.mark();
            int index = prove(operand, context, depth + 1);
            if (index >= 0) {
                return conclude(goal, "∨I", List.of(index), context);
            }
            context.rollback(mark);
            context.getStatistics().incrementBacktracks();
        }
        return -1;
    }

    /** Prova il corpo per una variabile nuova (eigenvariabile) che non compare altrove */
    private int introduceUniversal(Formula.Universal goal, SearchContext context, int depth) {
        if (goal.quantifier().hasDomain()) {
            return -1;
        }
        String variable = goal.quantifier().variable();
        Term eigenvariable = new Term.Variable(variable + context.nextSuffix(), goal.quantifier().type());
        Formula body = Formulas.substituteVariable(goal.body(), variable, eigenvariable);

        SearchContext.Mark mark = context.mark();
        int index = prove(body, context, depth + 1);
        if (index < 0) {
            context.rollback(mark);
            context.getStatistics().incrementBacktracks();
            return -1;
        }
        return conclude(goal, "∀I", List.of(index), context);
    }

    private static int conclude(Formula goal, String connective, List<Integer> dependencies, SearchContext context) {
        int index = context.addStep(goal, new Justification.Introduction(connective), dependencies);
        context.addHypothesis(goal, index);
        context.getStatistics().incrementRulesApplied();
        return index;
    }

    //endregion
}

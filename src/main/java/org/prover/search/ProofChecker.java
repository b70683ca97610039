package org.prover.search;

import org.prover.axiom.Axiom;
import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;
import org.prover.formula.FormulaKey;
import org.prover.formula.Unifier;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Controllo strutturale di una prova prima che il verdetto venga accettato.
 *
 * Verifica la numerazione dei passi, che ogni dipendenza punti a un passo
 * precedente, che assiomi e regole citati esistano e che ogni passo sia davvero
 * un'istanza dell'assioma o della conclusione della regola citata, che le
 * assunzioni compaiano
 * solo dentro uno scope aperto e che la prova termini con l'obiettivo (o con la
 * clausola vuota per la risoluzione).
 */
public class ProofChecker {

    private static final Set<String> CONNECTIVES = Set.of("∧I", "→I", "∨I", "↔I", "∀I", "∀E");

    private static final String CHECK_SUFFIX = "#verifica";

    private final Map<String, Axiom> axiomsByName = new HashMap<>();
    private final Map<String, InferenceRule> rulesByName = new HashMap<>();

    public ProofChecker(List<Axiom> axioms, List<InferenceRule> rules) {
        for (Axiom axiom : axioms) {
            axiomsByName.put(axiom.name(), axiom);
        }
        for (InferenceRule rule : rules) {
            rulesByName.put(rule.name(), rule);
        }
    }

    /**
     * @param goal obiettivo della ricerca
     * @param strategy strategia che ha prodotto la prova
     * @param steps passi della prova, in ordine
     * @throws ProofInconsistencyException al primo passo non valido
     */
    public void check(Formula goal, SearchStrategyType strategy, List<ProofStep> steps) {
        for (int i = 0; i < steps.size(); i++) {
            checkStep(i, steps.get(i), strategy);
        }
        if (steps.isEmpty()) {
            return;
        }

        ProofStep last = steps.get(steps.size() - 1);
        Formula expected = strategy == SearchStrategyType.RESOLUTION ? Formula.falsum() : goal;
        if (!FormulaKey.of(last.formula()).equals(FormulaKey.of(expected))) {
            throw new ProofInconsistencyException(last.index(),
                    "la prova termina con " + last.formula() + " invece di " + expected);
        }
        if (last.dischargeLevel() != 0) {
            throw new ProofInconsistencyException(last.index(), "la conclusione dipende da assunzioni non scaricate");
        }
    }

    private void checkStep(int position, ProofStep step, SearchStrategyType strategy) {
        if (step.index() != position) {
            throw new ProofInconsistencyException(position, "numerazione non consecutiva (" + step.index() + ")");
        }
        for (int dependency : step.dependencies()) {
            if (dependency < 0 || dependency >= position) {
                throw new ProofInconsistencyException(position, "dipendenza non precedente: " + dependency);
            }
        }

        Justification justification = step.justification();
        if (justification instanceof Justification.ByAxiom byAxiom) {
            Axiom axiom = axiomsByName.get(byAxiom.axiomName());
            if (axiom == null) {
                throw new ProofInconsistencyException(position, "assioma sconosciuto: " + byAxiom.axiomName());
            }
            // per la risoluzione il passo è una clausola derivata dall'assioma, non una sua istanza
            if (strategy != SearchStrategyType.RESOLUTION && !isInstance(axiom.formula(), step.formula())) {
                throw new ProofInconsistencyException(position,
                        step.formula() + " non è un'istanza dell'assioma " + axiom.name());
            }
        } else if (justification instanceof Justification.ByRule byRule) {
            InferenceRule rule = rulesByName.get(byRule.ruleName());
            if (rule == null) {
                throw new ProofInconsistencyException(position, "regola sconosciuta: " + byRule.ruleName());
            }
            InferenceRule renamed = Patterns.rename(rule, CHECK_SUFFIX);
            if (Unifier.unify(renamed.conclusion(), step.formula()).isEmpty()) {
                throw new ProofInconsistencyException(position,
                        step.formula() + " non è una conclusione della regola " + rule.name());
            }
        } else if (justification instanceof Justification.Introduction introduction) {
            if (!CONNECTIVES.contains(introduction.connective())) {
                throw new ProofInconsistencyException(position, "connettivo sconosciuto: " + introduction.connective());
            }
            if (step.dependencies().isEmpty()) {
                throw new ProofInconsistencyException(position, "introduzione senza premesse");
            }
        } else if (justification instanceof Justification.Assumption) {
            if (step.dischargeLevel() == 0) {
                throw new ProofInconsistencyException(position, "assunzione fuori da uno scope");
            }
        } else if (justification instanceof Justification.Resolvent) {
            if (step.dependencies().size() != 2) {
                throw new ProofInconsistencyException(position, "un risolvente richiede esattamente due clausole");
            }
        }
    }

    private static boolean isInstance(Formula axiom, Formula formula) {
        if (FormulaKey.of(axiom).equals(FormulaKey.of(formula))) {
            return true;
        }
        return Unifier.unify(Patterns.open(axiom, CHECK_SUFFIX), formula).isPresent();
    }
}

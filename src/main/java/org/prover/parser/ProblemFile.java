package org.prover.parser;

import org.prover.axiom.Axiom;
import org.prover.axiom.AxiomSystem;
import org.prover.axiom.InferenceRule;
import org.prover.verify.PropertyTask;

import java.util.ArrayList;
import java.util.List;

/**
 * CONTENUTO DI UN FILE DI PROBLEMA
 *
 * Assiomi e regole di dominio nell'ordine di dichiarazione, seguiti dagli
 * obiettivi da verificare. Gli assiomi e le regole vanno uniti al sistema di
 * base scelto dal chiamante.
 */
public record ProblemFile(List<Axiom> axioms, List<InferenceRule> rules, List<GoalSpec> goals) {

    public ProblemFile {
        axioms = List.copyOf(axioms);
        rules = List.copyOf(rules);
        goals = List.copyOf(goals);
    }

    public AxiomSystem toAxiomSystem() {
        return new AxiomSystem(axioms, rules);
    }

    public List<PropertyTask> toTasks() {
        List<PropertyTask> tasks = new ArrayList<>();
        for (GoalSpec goal : goals) {
            tasks.add(goal.toTask());
        }
        return tasks;
    }

    public boolean isEmpty() {
        return axioms.isEmpty() && rules.isEmpty() && goals.isEmpty();
    }
}

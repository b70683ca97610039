package org.prover.parser;

import org.prover.formula.Formula;
import org.prover.formula.PropertyFormula;
import org.prover.verify.PropertyTask;
import org.prover.verify.VerificationMethod;

import java.util.List;

/**
 * Obiettivo dichiarato in un file di problema: nome, formula e metodi
 * richiesti con la clausola "by" (lista vuota se assente).
 */
public record GoalSpec(String name, Formula formula, List<VerificationMethod> methods) {

    public GoalSpec {
        methods = methods == null ? List.of() : List.copyOf(methods);
    }

    public PropertyTask toTask() {
        return new PropertyTask(name, PropertyFormula.of(formula), methods);
    }
}

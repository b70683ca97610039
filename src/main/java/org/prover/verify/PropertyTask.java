package org.prover.verify;

import org.prover.formula.Formula;
import org.prover.formula.PropertyFormula;

import java.util.List;

/**
 * Proprietà da verificare con i metodi richiesti; una lista vuota indica i
 * metodi di default della configurazione.
 */
public record PropertyTask(String name, PropertyFormula property, List<VerificationMethod> methods) {

    public PropertyTask {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome della proprietà non può essere null o vuoto");
        }
        if (property == null) {
            throw new IllegalArgumentException("Formula della proprietà '" + name + "' non può essere null");
        }
        methods = methods == null ? List.of() : List.copyOf(methods);
    }

    public static PropertyTask of(String name, Formula formula) {
        return new PropertyTask(name, PropertyFormula.of(formula), List.of());
    }

    public static PropertyTask of(String name, Formula formula, VerificationMethod... methods) {
        return new PropertyTask(name, PropertyFormula.of(formula), List.of(methods));
    }
}

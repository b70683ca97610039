package org.prover.axiom;

import org.prover.formula.Formula;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Regola di inferenza: premesse e conclusione sono pattern in cui i segnaposto
 * ({@code ?P} per formule, {@code ?x} per termini) vengono legati per unificazione.
 *
 * @param name nome univoco nel sistema assiomatico
 * @param premises pattern delle premesse (anche vuoto)
 * @param conclusion pattern della conclusione
 * @param type categoria
 * @param priority priorità (valori alti vengono tentati prima)
 */
public record InferenceRule(String name, List<Formula> premises, Formula conclusion, RuleType type, int priority) {

    public InferenceRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome della regola non può essere null o vuoto");
        }
        if (premises == null) {
            throw new IllegalArgumentException("Premesse della regola '" + name + "' non possono essere null");
        }
        if (conclusion == null) {
            throw new IllegalArgumentException("Conclusione della regola '" + name + "' non può essere null");
        }
        premises = List.copyOf(premises);
        if (type == null) {
            type = RuleType.DOMAIN;
        }
    }

    public static InferenceRule of(String name, List<Formula> premises, Formula conclusion) {
        return new InferenceRule(name, premises, conclusion, RuleType.DOMAIN, 0);
    }

    @Override
    public String toString() {
        return name + ": " + premises.stream().map(Formula::toString).collect(Collectors.joining(", "))
                + " |- " + conclusion;
    }
}

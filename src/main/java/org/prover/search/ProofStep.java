package org.prover.search;

import org.prover.formula.Formula;

import java.util.List;

/**
 * Passo di una prova.
 *
 * @param index numero progressivo del passo (da 0)
 * @param formula formula stabilita dal passo
 * @param justification motivazione
 * @param dependencies indici dei passi da cui dipende, tutti minori di index
 * @param dischargeLevel livello di annidamento delle assunzioni attive
 */
public record ProofStep(int index, Formula formula, Justification justification, List<Integer> dependencies,
                        int dischargeLevel) {

    public ProofStep {
        if (formula == null || justification == null) {
            throw new IllegalArgumentException("Formula e giustificazione del passo sono obbligatorie");
        }
        dependencies = List.copyOf(dependencies);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(index).append(". ").append("  ".repeat(dischargeLevel)).append(formula)
                .append("    [").append(justification.describe());
        if (!dependencies.isEmpty()) {
            sb.append(" da ").append(dependencies);
        }
        return sb.append(']').toString();
    }
}

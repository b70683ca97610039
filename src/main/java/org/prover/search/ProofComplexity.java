package org.prover.search;

import java.util.List;

/**
 * Misure di complessità di una prova trovata.
 *
 * @param stepCount numero di passi
 * @param maxDischargeDepth massimo annidamento di assunzioni
 * @param ruleApplications passi giustificati da regole, introduzioni o risoluzione
 * @param branchingFactor numero medio di dipendenze dei passi derivati
 */
public record ProofComplexity(int stepCount, int maxDischargeDepth, int ruleApplications, double branchingFactor) {

    public static ProofComplexity of(List<ProofStep> steps) {
        int maxDepth = 0;
        int applications = 0;
        int derived = 0;
        int dependencies = 0;
        for (ProofStep step : steps) {
            maxDepth = Math.max(maxDepth, step.dischargeLevel());
            Justification justification = step.justification();
            if (justification instanceof Justification.ByRule || justification instanceof Justification.Introduction
                    || justification instanceof Justification.Resolvent) {
                applications++;
            }
            if (!step.dependencies().isEmpty()) {
                derived++;
                dependencies += step.dependencies().size();
            }
        }
        return new ProofComplexity(steps.size(), maxDepth, applications,
                derived == 0 ? 0.0 : (double) dependencies / derived);
    }
}

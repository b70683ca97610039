package org.prover.search;

import org.prover.formula.Substitution;

/**
 * Giustificazione di un passo di prova.
 */
public sealed interface Justification {

    /** Descrizione leggibile per la stampa della prova */
    String describe();

    /** Ipotesi temporanea aperta da un'introduzione dell'implicazione */
    record Assumption() implements Justification {
        public String describe() {
            return "assunzione";
        }
    }

    record ByAxiom(String axiomName, Substitution bindings) implements Justification {
        public String describe() {
            return bindings.isEmpty() ? "assioma " + axiomName : "assioma " + axiomName + " con " + bindings;
        }
    }

    record ByRule(String ruleName, Substitution bindings) implements Justification {
        public String describe() {
            return bindings.isEmpty() ? "regola " + ruleName : "regola " + ruleName + " con " + bindings;
        }
    }

    /** Regola di introduzione predefinita di un connettivo (∧I, →I, ∨I, ↔I, ∀I) */
    record Introduction(String connective) implements Justification {
        public String describe() {
            return "introduzione " + connective;
        }
    }

    /** Clausola della negazione dell'obiettivo, punto di partenza della refutazione */
    record NegatedGoal() implements Justification {
        public String describe() {
            return "negazione dell'obiettivo";
        }
    }

    /** Risolvente di due clausole precedenti */
    record Resolvent(Substitution unifier) implements Justification {
        public String describe() {
            return unifier.isEmpty() ? "risoluzione" : "risoluzione con " + unifier;
        }
    }
}

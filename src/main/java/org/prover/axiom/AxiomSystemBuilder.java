package org.prover.axiom;

import org.prover.formula.Formula;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.prover.formula.Formula.always;
import static org.prover.formula.Formula.and;
import static org.prover.formula.Formula.eventually;
import static org.prover.formula.Formula.iff;
import static org.prover.formula.Formula.implies;
import static org.prover.formula.Formula.meta;
import static org.prover.formula.Formula.not;
import static org.prover.formula.Formula.or;

/**
 * COSTRUTTORE DEL SISTEMA ASSIOMATICO
 *
 * Assembla assiomi e regole di inferenza: una libreria standard (logica
 * proposizionale e temporale) più gli assiomi e le regole del documento.
 * I nomi devono essere univoci; l'ordine di inserimento è l'ordine di
 * dichiarazione visto dalla ricerca di prove a parità di punteggio.
 */
public class AxiomSystemBuilder {

    private static final Logger LOGGER = Logger.getLogger(AxiomSystemBuilder.class.getName());

    private static final Formula P = meta("P");
    private static final Formula Q = meta("Q");
    private static final Formula R = meta("R");

    private final Map<String, Axiom> axioms = new LinkedHashMap<>();
    private final Map<String, InferenceRule> rules = new LinkedHashMap<>();

    /**
     * Sistema standard completo: regole proposizionali, regole temporali e
     * schemi di assioma logici.
     */
    public static AxiomSystemBuilder standard() {
        return new AxiomSystemBuilder()
                .withPropositionalRules()
                .withTemporalRules()
                .withLogicalAxioms();
    }

    //region LIBRERIA STANDARD

    public AxiomSystemBuilder withPropositionalRules() {
        addRule(new InferenceRule("modus_ponens", List.of(P, implies(P, Q)), Q, RuleType.ELIMINATION, 10));
        addRule(new InferenceRule("and_intro", List.of(P, Q), and(P, Q), RuleType.INTRODUCTION, 8));
        addRule(new InferenceRule("modus_tollens", List.of(implies(P, Q), not(Q)), not(P), RuleType.ELIMINATION, 6));
        addRule(new InferenceRule("hypothetical_syllogism", List.of(implies(P, Q), implies(Q, R)), implies(P, R),
                RuleType.STRUCTURAL, 6));
        addRule(new InferenceRule("and_elim_left", List.of(and(P, Q)), P, RuleType.ELIMINATION, 4));
        addRule(new InferenceRule("and_elim_right", List.of(and(P, Q)), Q, RuleType.ELIMINATION, 4));
        addRule(new InferenceRule("or_intro_left", List.of(P), or(P, Q), RuleType.INTRODUCTION, 3));
        addRule(new InferenceRule("or_intro_right", List.of(Q), or(P, Q), RuleType.INTRODUCTION, 3));
        addRule(new InferenceRule("double_negation", List.of(not(not(P))), P, RuleType.ELIMINATION, 2));
        return this;
    }

    public AxiomSystemBuilder withTemporalRules() {
        addRule(new InferenceRule("always_elim", List.of(always(P)), P, RuleType.TEMPORAL, 5));
        addRule(new InferenceRule("always_distribution", List.of(always(implies(P, Q)), always(P)), always(Q),
                RuleType.TEMPORAL, 5));
        addRule(new InferenceRule("eventually_intro", List.of(P), eventually(P), RuleType.TEMPORAL, 3));
        return this;
    }

    public AxiomSystemBuilder withLogicalAxioms() {
        addAxiom(new Axiom("excluded_middle", or(P, not(P)), AxiomType.LOGICAL, 5));
        addAxiom(new Axiom("identity", implies(P, P), AxiomType.LOGICAL, 5));
        addAxiom(new Axiom("temporal_duality", iff(eventually(P), not(always(not(P)))), AxiomType.TEMPORAL, 3));
        return this;
    }

    //endregion

    //region REGISTRAZIONE

    /**
     * Aggiunge un assioma.
     *
     * @throws IllegalArgumentException se esiste già un assioma con lo stesso nome
     */
    public AxiomSystemBuilder addAxiom(Axiom axiom) {
        if (axioms.putIfAbsent(axiom.name(), axiom) != null) {
            throw new IllegalArgumentException("Assioma duplicato: " + axiom.name());
        }
        return this;
    }

    /**
     * Aggiunge una regola di inferenza.
     *
     * @throws IllegalArgumentException se esiste già una regola con lo stesso nome
     */
    public AxiomSystemBuilder addRule(InferenceRule rule) {
        if (rules.putIfAbsent(rule.name(), rule) != null) {
            throw new IllegalArgumentException("Regola duplicata: " + rule.name());
        }
        return this;
    }

    public AxiomSystemBuilder addAll(AxiomSystem system) {
        system.axioms().forEach(this::addAxiom);
        system.rules().forEach(this::addRule);
        return this;
    }

    //endregion

    public AxiomSystem build() {
        LOGGER.fine("Sistema assiomatico: " + axioms.size() + " assiomi, " + rules.size() + " regole");
        return new AxiomSystem(new ArrayList<>(axioms.values()), new ArrayList<>(rules.values()));
    }
}

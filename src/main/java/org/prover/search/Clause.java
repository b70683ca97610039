package org.prover.search;

import org.prover.formula.Formula;
import org.prover.formula.FormulaKey;
import org.prover.formula.Formulas;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * CLAUSOLA - Disgiunzione di letterali, con variabili implicitamente universali
 *
 * Le variabili di clausola sono segnaposto (?x): la risoluzione le lega per
 * unificazione. La clausola vuota rappresenta la contraddizione.
 */
public record Clause(List<Literal> literals) {

    public Clause {
        if (literals == null) {
            throw new IllegalArgumentException("Lista letterali non può essere null");
        }
        literals = List.copyOf(deduplicate(literals));
    }

    public static Clause empty() {
        return new Clause(List.of());
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    public int size() {
        return literals.size();
    }

    /** Contiene un letterale e il suo complemento, oppure il letterale costante true */
    public boolean isTautology() {
        Map<FormulaKey, Boolean> polarity = new HashMap<>();
        for (Literal literal : literals) {
            if (literal.isTruthConstant() && literal.truthValue()) {
                return true;
            }
            Boolean previous = polarity.put(FormulaKey.of(literal.atom()), literal.positive());
            if (previous != null && previous != literal.positive()) {
                return true;
            }
        }
        return false;
    }

    /** Rimuove i letterali costantemente falsi (false, !true) */
    public Clause withoutFalseLiterals() {
        List<Literal> kept = new ArrayList<>();
        for (Literal literal : literals) {
            if (!(literal.isTruthConstant() && !literal.truthValue())) {
                kept.add(literal);
            }
        }
        return kept.size() == literals.size() ? this : new Clause(kept);
    }

    /** Clausola come formula: falso se vuota, il letterale se unitaria, altrimenti disgiunzione */
    public Formula toFormula() {
        if (literals.isEmpty()) {
            return Formula.falsum();
        }
        if (literals.size() == 1) {
            return literals.get(0).toFormula();
        }
        return new Formula.Disjunction(literals.stream().map(Literal::toFormula).collect(Collectors.toList()));
    }

    /**
     * Rinomina i segnaposto nell'ordine di prima apparizione come prefisso + contatore.
     * Due clausole uguali a meno del nome delle variabili producono lo stesso risultato.
     */
    public Clause standardize(String prefix) {
        Map<String, String> names = new LinkedHashMap<>();
        List<Literal> renamed = new ArrayList<>();
        for (Literal literal : sortedLiterals()) {
            Formula atom = Formulas.renameHoles(literal.atom(),
                    name -> names.computeIfAbsent(name, n -> prefix + names.size()));
            renamed.add(new Literal(atom, literal.positive()));
        }
        return new Clause(renamed);
    }

    /**
     * Chiave canonica per la deduplicazione, indipendente dall'ordine dei
     * letterali e dai nomi delle variabili.
     */
    public String canonicalKey() {
        return standardize("_").literals.stream()
                .map(literal -> literal.key().value())
                .collect(Collectors.joining(" | "));
    }

    /** Letterali ordinati per chiave con i segnaposto anonimizzati */
    private List<Literal> sortedLiterals() {
        List<Literal> sorted = new ArrayList<>(literals);
        sorted.sort(Comparator.comparing(literal ->
                FormulaKey.of(Formulas.renameHoles(literal.toFormula(), name -> "_")).value()));
        return sorted;
    }

    private static List<Literal> deduplicate(List<Literal> literals) {
        Map<FormulaKey, Literal> unique = new LinkedHashMap<>();
        for (Literal literal : literals) {
            if (literal == null) {
                throw new IllegalArgumentException("Lista letterali non può contenere elementi null");
            }
            unique.putIfAbsent(literal.key(), literal);
        }
        return new ArrayList<>(unique.values());
    }

    @Override
    public String toString() {
        if (literals.isEmpty()) {
            return "□";
        }
        return literals.stream().map(Literal::toString).collect(Collectors.joining(" | ", "(", ")"));
    }
}

package org.prover.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * PROPRIETÀ DA VERIFICARE - Albero della formula più insiemi di simboli derivati
 *
 * Gli insiemi derivati (predicati, funzioni, costanti, variabili libere) sono
 * calcolati una sola volta alla costruzione e contengono sempre almeno i simboli
 * presenti nella struttura: compilatore e interfaccia del solutore li usano per
 * enumerare le dichiarazioni senza riattraversare l'albero.
 */
public final class PropertyFormula {

    private final Formula structure;
    private final List<Quantifier> quantifiers;
    private final Set<String> freeVariables;
    private final Set<String> predicates;
    private final Set<String> functions;
    private final Set<String> constants;

    private PropertyFormula(Formula structure) {
        this.structure = structure;
        this.quantifiers = Collections.unmodifiableList(topLevelQuantifiers(structure));
        this.freeVariables = Collections.unmodifiableSet(Formulas.freeVariables(structure));

        Set<String> predicateNames = new LinkedHashSet<>();
        Set<String> functionNames = new LinkedHashSet<>();
        Set<String> constantValues = new LinkedHashSet<>();
        collectSymbols(structure, predicateNames, functionNames, constantValues);
        this.predicates = Collections.unmodifiableSet(predicateNames);
        this.functions = Collections.unmodifiableSet(functionNames);
        this.constants = Collections.unmodifiableSet(constantValues);
    }

    /**
     * Costruisce la proprietà derivando quantificatori e insiemi di simboli.
     *
     * @param structure albero della formula (non null)
     * @throws IllegalArgumentException se structure è null
     */
    public static PropertyFormula of(Formula structure) {
        if (structure == null) {
            throw new IllegalArgumentException("Struttura della formula non può essere null");
        }
        return new PropertyFormula(structure);
    }

    //region DERIVAZIONE SIMBOLI

    // prefisso di quantificatori in testa alla formula
    private static List<Quantifier> topLevelQuantifiers(Formula formula) {
        List<Quantifier> prefix = new ArrayList<>();
        Formula current = formula;
        while (true) {
            if (current instanceof Formula.Universal universal) {
                prefix.add(universal.quantifier());
                current = universal.body();
            } else if (current instanceof Formula.Existential existential) {
                prefix.add(existential.quantifier());
                current = existential.body();
            } else {
                return prefix;
            }
        }
    }

    private static void collectSymbols(Formula formula, Set<String> predicates, Set<String> functions, Set<String> constants) {
        if (formula instanceof Formula.Atomic atomic) {
            predicates.add(atomic.predicate());
        } else if (formula instanceof Formula.FunctionApplication application) {
            functions.add(application.name());
        }
        for (Term term : Formulas.terms(formula)) {
            collectSymbols(term, functions, constants);
        }
        for (Formula child : Formulas.children(formula)) {
            collectSymbols(child, predicates, functions, constants);
        }
    }

    private static void collectSymbols(Term term, Set<String> functions, Set<String> constants) {
        if (term instanceof Term.Function function) {
            functions.add(function.name());
        } else if (term instanceof Term.Constant constant) {
            constants.add(constant.value());
        }
        for (Term child : Formulas.children(term)) {
            collectSymbols(child, functions, constants);
        }
    }

    //endregion

    //region ACCESSORS

    public Formula structure() {
        return structure;
    }

    public List<Quantifier> quantifiers() {
        return quantifiers;
    }

    public Set<String> freeVariables() {
        return freeVariables;
    }

    public Set<String> predicates() {
        return predicates;
    }

    public Set<String> functions() {
        return functions;
    }

    public Set<String> constants() {
        return constants;
    }

    public FormulaKey key() {
        return FormulaKey.of(structure);
    }

    //endregion

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyFormula other)) return false;
        return structure.equals(other.structure);
    }

    @Override
    public int hashCode() {
        return structure.hashCode();
    }

    @Override
    public String toString() {
        return structure.toString();
    }
}

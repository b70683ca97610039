package org.prover.formula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * OPERAZIONI STRUTTURALI SULLE FORMULE
 *
 * Attraversamenti e ricostruzioni generiche condivise da unificazione, compilazione
 * e ricerca di prove. Nessuna operazione modifica l'albero di partenza.
 */
public final class Formulas {

    private Formulas() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region RICOSTRUZIONE DI UN LIVELLO

    /**
     * Ricostruisce un nodo applicando le funzioni date ai soli figli diretti.
     *
     * @param formula nodo di partenza
     * @param formulaMap trasformazione delle sottoformule dirette
     * @param termMap trasformazione dei termini diretti (inclusi i domini dei quantificatori)
     * @return nodo dello stesso tipo con figli trasformati
     */
    public static Formula mapChildren(Formula formula, UnaryOperator<Formula> formulaMap, UnaryOperator<Term> termMap) {
        switch (formula.kind()) {
            case ATOMIC: {
                Formula.Atomic atomic = (Formula.Atomic) formula;
                return new Formula.Atomic(atomic.predicate(), mapTerms(atomic.terms(), termMap));
            }
            case NEGATION:
                return new Formula.Negation(formulaMap.apply(((Formula.Negation) formula).inner()));
            case CONJUNCTION:
                return new Formula.Conjunction(mapFormulas(((Formula.Conjunction) formula).operands(), formulaMap));
            case DISJUNCTION:
                return new Formula.Disjunction(mapFormulas(((Formula.Disjunction) formula).operands(), formulaMap));
            case IMPLICATION: {
                Formula.Implication implication = (Formula.Implication) formula;
                return new Formula.Implication(formulaMap.apply(implication.antecedent()),
                        formulaMap.apply(implication.consequent()));
            }
            case BICONDITIONAL: {
                Formula.Biconditional biconditional = (Formula.Biconditional) formula;
                return new Formula.Biconditional(formulaMap.apply(biconditional.left()),
                        formulaMap.apply(biconditional.right()));
            }
            case UNIVERSAL: {
                Formula.Universal universal = (Formula.Universal) formula;
                return new Formula.Universal(mapQuantifier(universal.quantifier(), termMap),
                        formulaMap.apply(universal.body()));
            }
            case EXISTENTIAL: {
                Formula.Existential existential = (Formula.Existential) formula;
                return new Formula.Existential(mapQuantifier(existential.quantifier(), termMap),
                        formulaMap.apply(existential.body()));
            }
            case ALWAYS:
                return new Formula.Always(formulaMap.apply(((Formula.Always) formula).inner()));
            case EVENTUALLY:
                return new Formula.Eventually(formulaMap.apply(((Formula.Eventually) formula).inner()));
            case UNTIL: {
                Formula.Until until = (Formula.Until) formula;
                return new Formula.Until(formulaMap.apply(until.left()), formulaMap.apply(until.right()));
            }
            case EQUAL: {
                Formula.ArithmeticEqual equal = (Formula.ArithmeticEqual) formula;
                return new Formula.ArithmeticEqual(termMap.apply(equal.left()), termMap.apply(equal.right()));
            }
            case LESS_EQUAL: {
                Formula.ArithmeticLessEqual lessEqual = (Formula.ArithmeticLessEqual) formula;
                return new Formula.ArithmeticLessEqual(termMap.apply(lessEqual.left()), termMap.apply(lessEqual.right()));
            }
            case MEMBERSHIP: {
                Formula.SetMembership membership = (Formula.SetMembership) formula;
                return new Formula.SetMembership(termMap.apply(membership.element()), termMap.apply(membership.set()));
            }
            case FUNCTION_APPLICATION: {
                Formula.FunctionApplication application = (Formula.FunctionApplication) formula;
                return new Formula.FunctionApplication(application.name(), mapTerms(application.arguments(), termMap));
            }
            case META:
                return formula;
            default:
                throw new IllegalStateException("Tipo di formula non gestito: " + formula.kind());
        }
    }

    /**
     * Ricostruisce un termine applicando la funzione ai soli sottotermini diretti.
     */
    public static Term mapChildren(Term term, UnaryOperator<Term> termMap) {
        return switch (term.kind()) {
            case VARIABLE, CONSTANT, HOLE -> term;
            case FUNCTION -> {
                Term.Function function = (Term.Function) term;
                yield new Term.Function(function.name(), mapTerms(function.arguments(), termMap));
            }
            case ARITHMETIC -> {
                Term.Arithmetic arithmetic = (Term.Arithmetic) term;
                yield new Term.Arithmetic(arithmetic.operator(), termMap.apply(arithmetic.left()),
                        termMap.apply(arithmetic.right()));
            }
            case SET -> new Term.SetLiteral(mapTerms(((Term.SetLiteral) term).elements(), termMap));
            case ARRAY_ACCESS -> {
                Term.ArrayAccess access = (Term.ArrayAccess) term;
                yield new Term.ArrayAccess(termMap.apply(access.array()), termMap.apply(access.index()));
            }
        };
    }

    /** Sottoformule dirette di un nodo, nell'ordine di dichiarazione */
    public static List<Formula> children(Formula formula) {
        List<Formula> children = new ArrayList<>();
        mapChildren(formula, child -> {
            children.add(child);
            return child;
        }, UnaryOperator.identity());
        return children;
    }

    /** Termini diretti di un nodo (argomenti, lati dei confronti, domini) */
    public static List<Term> terms(Formula formula) {
        List<Term> terms = new ArrayList<>();
        mapChildren(formula, UnaryOperator.identity(), term -> {
            terms.add(term);
            return term;
        });
        return terms;
    }

    /** Sottotermini diretti di un termine */
    public static List<Term> children(Term term) {
        List<Term> children = new ArrayList<>();
        mapChildren(term, child -> {
            children.add(child);
            return child;
        });
        return children;
    }

    //endregion

    //region VARIABILI E SOSTITUZIONI

    /**
     * Sostituisce le occorrenze libere di una variabile con un termine.
     * Le occorrenze legate da un quantificatore sullo stesso nome restano invariate.
     */
    public static Formula substituteVariable(Formula formula, String variable, Term replacement) {
        if (formula instanceof Formula.Universal universal && universal.quantifier().variable().equals(variable)) {
            return new Formula.Universal(mapQuantifier(universal.quantifier(),
                    t -> substituteVariable(t, variable, replacement)), universal.body());
        }
        if (formula instanceof Formula.Existential existential && existential.quantifier().variable().equals(variable)) {
            return new Formula.Existential(mapQuantifier(existential.quantifier(),
                    t -> substituteVariable(t, variable, replacement)), existential.body());
        }
        return mapChildren(formula,
                child -> substituteVariable(child, variable, replacement),
                term -> substituteVariable(term, variable, replacement));
    }

    public static Term substituteVariable(Term term, String variable, Term replacement) {
        if (term instanceof Term.Variable v) {
            return v.name().equals(variable) ? replacement : term;
        }
        return mapChildren(term, child -> substituteVariable(child, variable, replacement));
    }

    /** Nomi delle variabili libere in ordine di prima occorrenza */
    public static Set<String> freeVariables(Formula formula) {
        Set<String> free = new LinkedHashSet<>();
        collectFree(formula, new ArrayDeque<>(), free);
        return free;
    }

    public static Set<String> freeVariables(Term term) {
        Set<String> free = new LinkedHashSet<>();
        collectFree(term, new ArrayDeque<>(), free);
        return free;
    }

    private static void collectFree(Formula formula, Deque<String> bound, Set<String> free) {
        String binder = boundVariable(formula);
        for (Term term : terms(formula)) {
            collectFree(term, bound, free);
        }
        if (binder != null) {
            bound.push(binder);
        }
        for (Formula child : children(formula)) {
            collectFree(child, bound, free);
        }
        if (binder != null) {
            bound.pop();
        }
    }

    private static void collectFree(Term term, Deque<String> bound, Set<String> free) {
        if (term instanceof Term.Variable v) {
            if (!bound.contains(v.name())) {
                free.add(v.name());
            }
            return;
        }
        for (Term child : children(term)) {
            collectFree(child, bound, free);
        }
    }

    /** Variabile legata dal nodo, oppure null se il nodo non è un quantificatore */
    public static String boundVariable(Formula formula) {
        if (formula instanceof Formula.Universal universal) {
            return universal.quantifier().variable();
        }
        if (formula instanceof Formula.Existential existential) {
            return existential.quantifier().variable();
        }
        return null;
    }

    //endregion

    //region SEGNAPOSTO DI PATTERN

    /**
     * Verifica che la formula non contenga segnaposto (Meta o Hole).
     */
    public static boolean isGround(Formula formula) {
        if (formula instanceof Formula.Meta) {
            return false;
        }
        for (Term term : terms(formula)) {
            if (!isGround(term)) {
                return false;
            }
        }
        for (Formula child : children(formula)) {
            if (!isGround(child)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isGround(Term term) {
        if (term instanceof Term.Hole) {
            return false;
        }
        for (Term child : children(term)) {
            if (!isGround(child)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Rinomina tutti i segnaposto aggiungendo un suffisso, per separare le
     * variabili di pattern di due applicazioni distinte della stessa regola.
     */
    public static Formula renameHoles(Formula formula, String suffix) {
        return renameHoles(formula, name -> name + suffix);
    }

    public static Term renameHoles(Term term, String suffix) {
        return renameHoles(term, name -> name + suffix);
    }

    /**
     * Rinomina segnaposto di formula e di termine con la funzione data.
     */
    public static Formula renameHoles(Formula formula, UnaryOperator<String> renamer) {
        if (formula instanceof Formula.Meta meta) {
            return new Formula.Meta(renamer.apply(meta.name()));
        }
        return mapChildren(formula, child -> renameHoles(child, renamer), term -> renameHoles(term, renamer));
    }

    public static Term renameHoles(Term term, UnaryOperator<String> renamer) {
        if (term instanceof Term.Hole hole) {
            return new Term.Hole(renamer.apply(hole.name()));
        }
        return mapChildren(term, child -> renameHoles(child, renamer));
    }

    /**
     * Sostituisce le variabili libere indicate con segnaposto omonimi.
     * Usato per aprire il prefisso universale di assiomi e clausole.
     */
    public static Formula holesFor(Formula formula, Set<String> variables, String suffix) {
        Formula result = formula;
        for (String variable : variables) {
            result = substituteVariable(result, variable, new Term.Hole(variable + suffix));
        }
        return result;
    }

    //endregion

    //region MISURE E UTILITÀ

    /** Numero di nodi (formule e termini) dell'albero */
    public static int size(Formula formula) {
        int size = 1;
        for (Term term : terms(formula)) {
            size += size(term);
        }
        for (Formula child : children(formula)) {
            size += size(child);
        }
        return size;
    }

    public static int size(Term term) {
        int size = 1;
        for (Term child : children(term)) {
            size += size(child);
        }
        return size;
    }

    /** Negazione che elimina la doppia negazione invece di annidarla */
    public static Formula negate(Formula formula) {
        if (formula instanceof Formula.Negation negation) {
            return negation.inner();
        }
        return new Formula.Negation(formula);
    }

    /** Simbolo di testa usato dalle euristiche di ordinamento */
    public static String headSymbol(Formula formula) {
        if (formula instanceof Formula.Atomic atomic) {
            return atomic.predicate();
        }
        if (formula instanceof Formula.FunctionApplication application) {
            return application.name();
        }
        return formula.kind().name();
    }

    //endregion

    private static List<Term> mapTerms(List<Term> terms, UnaryOperator<Term> termMap) {
        List<Term> mapped = new ArrayList<>(terms.size());
        for (Term term : terms) {
            mapped.add(termMap.apply(term));
        }
        return mapped;
    }

    private static List<Formula> mapFormulas(List<Formula> formulas, UnaryOperator<Formula> formulaMap) {
        List<Formula> mapped = new ArrayList<>(formulas.size());
        for (Formula formula : formulas) {
            mapped.add(formulaMap.apply(formula));
        }
        return mapped;
    }

    private static Quantifier mapQuantifier(Quantifier quantifier, UnaryOperator<Term> termMap) {
        if (!quantifier.hasDomain()) {
            return quantifier;
        }
        return new Quantifier(quantifier.variable(), quantifier.type(), termMap.apply(quantifier.domain()));
    }
}

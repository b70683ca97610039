package org.prover.formula;

import java.util.List;
import java.util.stream.Collectors;

/**
 * FORMULA - Albero immutabile di operatori logici, quantificatori e predicati atomici
 *
 * Ogni nodo è un record: l'uguaglianza strutturale è quella dei record, mentre
 * l'uguaglianza a meno di ridenominazione delle variabili legate è data da
 * {@link FormulaKey}. Le trasformazioni costruiscono sempre alberi nuovi.
 *
 * NODI SUPPORTATI:
 * • Logica proposizionale: Atomic, Negation, Conjunction, Disjunction, Implication, Biconditional
 * • Primo ordine: Universal, Existential
 * • Temporale: Always, Eventually, Until
 * • Aritmetica e insiemi: ArithmeticEqual, ArithmeticLessEqual, SetMembership
 * • Applicazione di funzione booleana: FunctionApplication
 * • Pattern: Meta, segnaposto di formula legabile dall'unificazione (notazione ?P)
 */
public sealed interface Formula {

    enum Kind {
        ATOMIC, NEGATION, CONJUNCTION, DISJUNCTION, IMPLICATION, BICONDITIONAL,
        UNIVERSAL, EXISTENTIAL, ALWAYS, EVENTUALLY, UNTIL,
        EQUAL, LESS_EQUAL, MEMBERSHIP, FUNCTION_APPLICATION, META
    }

    Kind kind();

    //region NODI PROPOSIZIONALI

    record Atomic(String predicate, List<Term> terms) implements Formula {
        public Atomic {
            requireName(predicate, "predicato");
            terms = List.copyOf(terms);
        }

        public Kind kind() {
            return Kind.ATOMIC;
        }

        @Override
        public String toString() {
            return terms.isEmpty() ? predicate : predicate + "(" + joinTerms(terms) + ")";
        }
    }

    record Negation(Formula inner) implements Formula {
        public Negation {
            requireOperand(inner);
        }

        public Kind kind() {
            return Kind.NEGATION;
        }

        @Override
        public String toString() {
            return "!" + operand(inner);
        }
    }

    record Conjunction(List<Formula> operands) implements Formula {
        public Conjunction {
            operands = requireOperands(operands, "congiunzione");
        }

        public Kind kind() {
            return Kind.CONJUNCTION;
        }

        @Override
        public String toString() {
            return joinFormulas(operands, " & ");
        }
    }

    record Disjunction(List<Formula> operands) implements Formula {
        public Disjunction {
            operands = requireOperands(operands, "disgiunzione");
        }

        public Kind kind() {
            return Kind.DISJUNCTION;
        }

        @Override
        public String toString() {
            return joinFormulas(operands, " | ");
        }
    }

    record Implication(Formula antecedent, Formula consequent) implements Formula {
        public Implication {
            requireOperand(antecedent);
            requireOperand(consequent);
        }

        public Kind kind() {
            return Kind.IMPLICATION;
        }

        @Override
        public String toString() {
            return "(" + antecedent + " -> " + consequent + ")";
        }
    }

    record Biconditional(Formula left, Formula right) implements Formula {
        public Biconditional {
            requireOperand(left);
            requireOperand(right);
        }

        public Kind kind() {
            return Kind.BICONDITIONAL;
        }

        @Override
        public String toString() {
            return "(" + left + " <-> " + right + ")";
        }
    }

    //endregion

    //region QUANTIFICATORI

    record Universal(Quantifier quantifier, Formula body) implements Formula {
        public Universal {
            if (quantifier == null) {
                throw new IllegalArgumentException("Quantificatore non può essere null");
            }
            requireOperand(body);
        }

        public Kind kind() {
            return Kind.UNIVERSAL;
        }

        @Override
        public String toString() {
            return "(forall " + quantifier + ". " + body + ")";
        }
    }

    record Existential(Quantifier quantifier, Formula body) implements Formula {
        public Existential {
            if (quantifier == null) {
                throw new IllegalArgumentException("Quantificatore non può essere null");
            }
            requireOperand(body);
        }

        public Kind kind() {
            return Kind.EXISTENTIAL;
        }

        @Override
        public String toString() {
            return "(exists " + quantifier + ". " + body + ")";
        }
    }

    //endregion

    //region OPERATORI TEMPORALI

    record Always(Formula inner) implements Formula {
        public Always {
            requireOperand(inner);
        }

        public Kind kind() {
            return Kind.ALWAYS;
        }

        @Override
        public String toString() {
            return "[]" + operand(inner);
        }
    }

    record Eventually(Formula inner) implements Formula {
        public Eventually {
            requireOperand(inner);
        }

        public Kind kind() {
            return Kind.EVENTUALLY;
        }

        @Override
        public String toString() {
            return "<>" + operand(inner);
        }
    }

    /** left vale in ogni istante precedente al primo istante in cui vale right */
    record Until(Formula left, Formula right) implements Formula {
        public Until {
            requireOperand(left);
            requireOperand(right);
        }

        public Kind kind() {
            return Kind.UNTIL;
        }

        @Override
        public String toString() {
            return "(" + left + " U " + right + ")";
        }
    }

    //endregion

    //region ARITMETICA, INSIEMI E FUNZIONI

    record ArithmeticEqual(Term left, Term right) implements Formula {
        public ArithmeticEqual {
            requireTerms(left, right);
        }

        public Kind kind() {
            return Kind.EQUAL;
        }

        @Override
        public String toString() {
            return left + " = " + right;
        }
    }

    record ArithmeticLessEqual(Term left, Term right) implements Formula {
        public ArithmeticLessEqual {
            requireTerms(left, right);
        }

        public Kind kind() {
            return Kind.LESS_EQUAL;
        }

        @Override
        public String toString() {
            return left + " <= " + right;
        }
    }

    record SetMembership(Term element, Term set) implements Formula {
        public SetMembership {
            requireTerms(element, set);
        }

        public Kind kind() {
            return Kind.MEMBERSHIP;
        }

        @Override
        public String toString() {
            return element + " in " + set;
        }
    }

    record FunctionApplication(String name, List<Term> arguments) implements Formula {
        public FunctionApplication {
            requireName(name, "funzione");
            arguments = List.copyOf(arguments);
        }

        public Kind kind() {
            return Kind.FUNCTION_APPLICATION;
        }

        @Override
        public String toString() {
            return name + "(" + joinTerms(arguments) + ")";
        }
    }

    /** Segnaposto di formula nei pattern delle regole (notazione ?P) */
    record Meta(String name) implements Formula {
        public Meta {
            requireName(name, "segnaposto");
        }

        public Kind kind() {
            return Kind.META;
        }

        @Override
        public String toString() {
            return "?" + name;
        }
    }

    //endregion

    //region FACTORY

    static Atomic atom(String predicate, Term... terms) {
        return new Atomic(predicate, List.of(terms));
    }

    static Atomic truth() {
        return new Atomic("true", List.of());
    }

    static Atomic falsum() {
        return new Atomic("false", List.of());
    }

    static Negation not(Formula inner) {
        return new Negation(inner);
    }

    static Conjunction and(Formula... operands) {
        return new Conjunction(List.of(operands));
    }

    static Disjunction or(Formula... operands) {
        return new Disjunction(List.of(operands));
    }

    static Implication implies(Formula antecedent, Formula consequent) {
        return new Implication(antecedent, consequent);
    }

    static Biconditional iff(Formula left, Formula right) {
        return new Biconditional(left, right);
    }

    static Universal forall(String variable, Formula body) {
        return new Universal(Quantifier.of(variable), body);
    }

    static Universal forall(Quantifier quantifier, Formula body) {
        return new Universal(quantifier, body);
    }

    static Existential exists(String variable, Formula body) {
        return new Existential(Quantifier.of(variable), body);
    }

    static Existential exists(Quantifier quantifier, Formula body) {
        return new Existential(quantifier, body);
    }

    static Always always(Formula inner) {
        return new Always(inner);
    }

    static Eventually eventually(Formula inner) {
        return new Eventually(inner);
    }

    static Until until(Formula left, Formula right) {
        return new Until(left, right);
    }

    static ArithmeticEqual eq(Term left, Term right) {
        return new ArithmeticEqual(left, right);
    }

    static ArithmeticLessEqual le(Term left, Term right) {
        return new ArithmeticLessEqual(left, right);
    }

    static SetMembership member(Term element, Term set) {
        return new SetMembership(element, set);
    }

    static FunctionApplication apply(String name, Term... arguments) {
        return new FunctionApplication(name, List.of(arguments));
    }

    static Meta meta(String name) {
        return new Meta(name);
    }

    //endregion

    //region VALIDAZIONE E FORMATTAZIONE

    private static void requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome " + what + " non può essere null o vuoto");
        }
    }

    private static void requireOperand(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando della formula non può essere null");
        }
    }

    private static void requireTerms(Term left, Term right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Termini del confronto non possono essere null");
        }
    }

    private static List<Formula> requireOperands(List<Formula> operands, String what) {
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("Lista operandi della " + what + " non può essere null o vuota");
        }
        for (Formula operand : operands) {
            if (operand == null) {
                throw new IllegalArgumentException("Lista operandi della " + what + " non può contenere elementi null");
            }
        }
        return List.copyOf(operands);
    }

    private static String operand(Formula formula) {
        return switch (formula.kind()) {
            case EQUAL, LESS_EQUAL, MEMBERSHIP -> "(" + formula + ")";
            default -> formula.toString();
        };
    }

    private static String joinTerms(List<Term> terms) {
        return terms.stream().map(Term::toString).collect(Collectors.joining(", "));
    }

    private static String joinFormulas(List<Formula> formulas, String separator) {
        if (formulas.size() == 1) {
            return formulas.get(0).toString();
        }
        return formulas.stream().map(Formula::toString).collect(Collectors.joining(separator, "(", ")"));
    }

    //endregion
}

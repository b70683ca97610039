package org.prover.formula;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Chiave strutturale stabile di una formula.
 *
 * Le variabili legate sono sostituite dal loro indice di de Bruijn, quindi due
 * formule che differiscono solo per il nome delle variabili legate producono
 * la stessa chiave. Usata per insiemi dei visitati, deduplicazione di clausole
 * e frontiere di ricerca, cache dei verdetti.
 */
public record FormulaKey(String value) {

    public FormulaKey {
        if (value == null) {
            throw new IllegalArgumentException("Chiave strutturale non può essere null");
        }
    }

    public static FormulaKey of(Formula formula) {
        StringBuilder sb = new StringBuilder();
        write(formula, new ArrayDeque<>(), sb);
        return new FormulaKey(sb.toString());
    }

    public static FormulaKey of(Term term) {
        StringBuilder sb = new StringBuilder();
        write(term, new ArrayDeque<>(), sb);
        return new FormulaKey(sb.toString());
    }

    private static void write(Formula formula, Deque<String> bound, StringBuilder sb) {
        switch (formula.kind()) {
            case ATOMIC -> {
                Formula.Atomic atomic = (Formula.Atomic) formula;
                sb.append("P:").append(atomic.predicate());
                writeTerms(atomic.terms(), bound, sb);
            }
            case FUNCTION_APPLICATION -> {
                Formula.FunctionApplication application = (Formula.FunctionApplication) formula;
                sb.append("A:").append(application.name());
                writeTerms(application.arguments(), bound, sb);
            }
            case META -> sb.append("?F:").append(((Formula.Meta) formula).name());
            case UNIVERSAL, EXISTENTIAL -> {
                Quantifier quantifier = formula instanceof Formula.Universal u ? u.quantifier()
                        : ((Formula.Existential) formula).quantifier();
                sb.append(formula.kind() == Formula.Kind.UNIVERSAL ? "all" : "ex").append('[');
                sb.append(quantifier.hasType() ? quantifier.type() : "_").append(';');
                if (quantifier.hasDomain()) {
                    write(quantifier.domain(), bound, sb);
                }
                sb.append("](");
                bound.push(quantifier.variable());
                write(Formulas.children(formula).get(0), bound, sb);
                bound.pop();
                sb.append(')');
            }
            default -> {
                sb.append(formula.kind().name().toLowerCase());
                List<Term> terms = Formulas.terms(formula);
                if (!terms.isEmpty()) {
                    writeTerms(terms, bound, sb);
                }
                List<Formula> children = Formulas.children(formula);
                if (!children.isEmpty()) {
                    sb.append('(');
                    for (int i = 0; i < children.size(); i++) {
                        if (i > 0) {
                            sb.append(',');
                        }
                        write(children.get(i), bound, sb);
                    }
                    sb.append(')');
                }
            }
        }
    }

    private static void writeTerms(List<Term> terms, Deque<String> bound, StringBuilder sb) {
        sb.append('(');
        for (int i = 0; i < terms.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            write(terms.get(i), bound, sb);
        }
        sb.append(')');
    }

    private static void write(Term term, Deque<String> bound, StringBuilder sb) {
        switch (term.kind()) {
            case VARIABLE -> {
                String name = ((Term.Variable) term).name();
                int index = deBruijnIndex(bound, name);
                if (index >= 0) {
                    sb.append('#').append(index);
                } else {
                    sb.append("v:").append(name);
                }
            }
            case CONSTANT -> {
                Term.Constant constant = (Term.Constant) term;
                sb.append("c:").append(constant.value()).append(':').append(constant.type());
            }
            case HOLE -> sb.append("?T:").append(((Term.Hole) term).name());
            case FUNCTION -> {
                Term.Function function = (Term.Function) term;
                sb.append("f:").append(function.name());
                writeTerms(function.arguments(), bound, sb);
            }
            case ARITHMETIC -> {
                Term.Arithmetic arithmetic = (Term.Arithmetic) term;
                sb.append(arithmetic.operator().name());
                writeTerms(List.of(arithmetic.left(), arithmetic.right()), bound, sb);
            }
            case SET -> {
                sb.append("set");
                writeTerms(((Term.SetLiteral) term).elements(), bound, sb);
            }
            case ARRAY_ACCESS -> {
                Term.ArrayAccess access = (Term.ArrayAccess) term;
                sb.append("sel");
                writeTerms(List.of(access.array(), access.index()), bound, sb);
            }
        }
    }

    // distanza dal binder più vicino, -1 se la variabile è libera
    private static int deBruijnIndex(Deque<String> bound, String name) {
        int index = 0;
        Iterator<String> it = bound.iterator();
        while (it.hasNext()) {
            if (it.next().equals(name)) {
                return index;
            }
            index++;
        }
        return -1;
    }

    @Override
    public String toString() {
        return value;
    }
}

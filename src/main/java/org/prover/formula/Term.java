package org.prover.formula;

import java.util.List;
import java.util.stream.Collectors;

/**
 * TERMINE - Espressione che produce un valore, usata come argomento nelle formule.
 *
 * Unione etichettata immutabile: ogni variante è un record e restituisce
 * il proprio {@link Kind} per il dispatch tramite switch.
 *
 * VARIANTI:
 * • Variable: simbolo rigido con tipo opzionale
 * • Constant: letterale con etichetta di tipo (Int, Real, Bool, String, ℤ, ℕ, ℝ, 𝔹, 𝕊)
 * • Function: applicazione di funzione a termini
 * • Arithmetic: operazione binaria (+ - * / % ^)
 * • SetLiteral: insieme enumerato
 * • ArrayAccess: accesso indicizzato
 * • Hole: segnaposto di pattern, l'unica variante legabile dall'unificazione
 */
public sealed interface Term {

    enum Kind {
        VARIABLE, CONSTANT, FUNCTION, ARITHMETIC, SET, ARRAY_ACCESS, HOLE
    }

    Kind kind();

    //region VARIANTI

    record Variable(String name, String type) implements Term {
        public Variable {
            requireName(name, "variabile");
        }

        public Kind kind() {
            return Kind.VARIABLE;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Constant(String value, String type) implements Term {
        public Constant {
            if (value == null) {
                throw new IllegalArgumentException("Valore della costante non può essere null");
            }
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("Tipo della costante non può essere null o vuoto");
            }
        }

        public Kind kind() {
            return Kind.CONSTANT;
        }

        @Override
        public String toString() {
            return ("String".equals(type) || "𝕊".equals(type)) ? '"' + value + '"' : value;
        }
    }

    record Function(String name, List<Term> arguments) implements Term {
        public Function {
            requireName(name, "funzione");
            arguments = List.copyOf(arguments);
        }

        public Kind kind() {
            return Kind.FUNCTION;
        }

        @Override
        public String toString() {
            return name + "(" + join(arguments) + ")";
        }
    }

    record Arithmetic(ArithmeticOp operator, Term left, Term right) implements Term {
        public Arithmetic {
            if (operator == null || left == null || right == null) {
                throw new IllegalArgumentException("Operazione aritmetica incompleta");
            }
        }

        public Kind kind() {
            return Kind.ARITHMETIC;
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.symbol() + " " + right + ")";
        }
    }

    record SetLiteral(List<Term> elements) implements Term {
        public SetLiteral {
            elements = List.copyOf(elements);
        }

        public Kind kind() {
            return Kind.SET;
        }

        @Override
        public String toString() {
            return "{" + join(elements) + "}";
        }
    }

    record ArrayAccess(Term array, Term index) implements Term {
        public ArrayAccess {
            if (array == null || index == null) {
                throw new IllegalArgumentException("Accesso ad array incompleto");
            }
        }

        public Kind kind() {
            return Kind.ARRAY_ACCESS;
        }

        @Override
        public String toString() {
            return array + "[" + index + "]";
        }
    }

    /**
     * Segnaposto di pattern a livello di termine (notazione ?x).
     * Distinto da Variable: solo i segnaposto vengono legati dall'unificazione.
     */
    record Hole(String name) implements Term {
        public Hole {
            requireName(name, "segnaposto");
        }

        public Kind kind() {
            return Kind.HOLE;
        }

        @Override
        public String toString() {
            return "?" + name;
        }
    }

    //endregion

    //region FACTORY

    static Variable var(String name) {
        return new Variable(name, null);
    }

    static Variable var(String name, String type) {
        return new Variable(name, type);
    }

    static Constant integer(long value) {
        return new Constant(Long.toString(value), "Int");
    }

    static Constant constant(String value, String type) {
        return new Constant(value, type);
    }

    static Function function(String name, Term... arguments) {
        return new Function(name, List.of(arguments));
    }

    static Arithmetic arithmetic(ArithmeticOp operator, Term left, Term right) {
        return new Arithmetic(operator, left, right);
    }

    static SetLiteral set(Term... elements) {
        return new SetLiteral(List.of(elements));
    }

    static ArrayAccess select(Term array, Term index) {
        return new ArrayAccess(array, index);
    }

    static Hole hole(String name) {
        return new Hole(name);
    }

    //endregion

    private static void requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome " + what + " non può essere null o vuoto");
        }
    }

    private static String join(List<Term> terms) {
        return terms.stream().map(Term::toString).collect(Collectors.joining(", "));
    }
}

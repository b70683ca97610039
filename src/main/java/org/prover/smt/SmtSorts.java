package org.prover.smt;

import java.util.Set;

/**
 * Corrispondenza tra etichette di tipo del modello e sort SMT-LIB.
 */
final class SmtSorts {

    static final String INT = "Int";
    static final String REAL = "Real";
    static final String BOOL = "Bool";
    static final String STRING = "String";
    static final String INT_SET = "(Array Int Bool)";
    static final String INT_ARRAY = "(Array Int Int)";

    private static final Set<String> BUILTIN = Set.of(INT, REAL, BOOL, STRING, INT_SET, INT_ARRAY);

    private SmtSorts() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Sort per un'etichetta di tipo; Int se l'etichetta manca.
     * Le etichette non riconosciute diventano sort non interpretati con lo stesso nome.
     */
    static String fromTypeTag(String type) {
        if (type == null || type.isBlank()) {
            return INT;
        }
        return switch (type.trim()) {
            case "Int", "ℤ", "ℕ", "Nat", "Integer" -> INT;
            case "Real", "ℝ" -> REAL;
            case "Bool", "𝔹", "Boolean" -> BOOL;
            case "String", "𝕊" -> STRING;
            default -> SmtCompiler.symbol(type.trim());
        };
    }

    static boolean isBuiltin(String sort) {
        return BUILTIN.contains(sort);
    }
}

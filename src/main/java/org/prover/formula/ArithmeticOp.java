package org.prover.formula;

/**
 * Operatori aritmetici binari ammessi nei termini.
 * Ogni operatore conosce il proprio simbolo testuale e quello SMT-LIB.
 */
public enum ArithmeticOp {
    ADD("+", "+"),
    SUB("-", "-"),
    MUL("*", "*"),
    DIV("/", "div"),
    MOD("%", "mod"),
    POW("^", "^");

    private final String symbol;
    private final String smtSymbol;

    ArithmeticOp(String symbol, String smtSymbol) {
        this.symbol = symbol;
        this.smtSymbol = smtSymbol;
    }

    /** Simbolo infisso usato nella notazione testuale */
    public String symbol() {
        return symbol;
    }

    /** Nome dell'operatore nel linguaggio del solutore */
    public String smtSymbol() {
        return smtSymbol;
    }

    /**
     * Risolve un operatore a partire dal simbolo infisso.
     *
     * @param symbol simbolo testuale (+, -, *, /, %, ^)
     * @return operatore corrispondente
     * @throws IllegalArgumentException se il simbolo non è riconosciuto
     */
    public static ArithmeticOp fromSymbol(String symbol) {
        for (ArithmeticOp op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Operatore aritmetico sconosciuto: " + symbol);
    }
}

package org.prover.smt;

/**
 * Esito della validazione sintattica di un testo SMT-LIB.
 *
 * @param valid true se il testo può essere inviato al solutore
 * @param kind categoria dell'errore, null se valido
 * @param message diagnostica leggibile, null se valido
 * @param symbol simbolo non dichiarato, solo per {@link SyntaxErrorKind#UNDECLARED_SYMBOL}
 */
public record SmtValidationResult(boolean valid, SyntaxErrorKind kind, String message, String symbol) {

    private static final SmtValidationResult OK = new SmtValidationResult(true, null, null, null);

    public static SmtValidationResult ok() {
        return OK;
    }

    public static SmtValidationResult error(SyntaxErrorKind kind, String message) {
        return new SmtValidationResult(false, kind, message, null);
    }

    public static SmtValidationResult undeclared(String symbol) {
        return new SmtValidationResult(false, SyntaxErrorKind.UNDECLARED_SYMBOL, "Simbolo non dichiarato: " + symbol, symbol);
    }

    @Override
    public String toString() {
        return valid ? "OK" : kind + ": " + message;
    }
}

package org.prover.parser;

/**
 * Testo non conforme alla notazione delle formule o dei file di problema.
 */
public class FormulaParseException extends RuntimeException {

    private final int line;
    private final int column;

    public FormulaParseException(int line, int column, String message) {
        super("Riga " + line + ":" + column + " - " + message);
        this.line = line;
        this.column = column;
    }

    public FormulaParseException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}

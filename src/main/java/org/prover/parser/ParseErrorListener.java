package org.prover.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Converte il primo errore lessicale o sintattico in {@link FormulaParseException},
 * al posto della stampa su standard error del listener predefinito.
 */
class ParseErrorListener extends BaseErrorListener {

    static final ParseErrorListener INSTANCE = new ParseErrorListener();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        throw new FormulaParseException(line, charPositionInLine, msg);
    }
}

package org.prover.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Listener ANTLR che interrompe lexing e parsing al primo errore, trasformandolo
 * in {@link FormulaParseException}. Sostituisce il ConsoleErrorListener di default,
 * che si limiterebbe a stampare su stderr e proseguirebbe con il recupero.
 */
class ThrowingErrorListener extends BaseErrorListener {

    private final String input;

    ThrowingErrorListener(String input) {
        this.input = input;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        throw new FormulaParseException("Formula non valida: " + msg, input, line, charPositionInLine);
    }
}

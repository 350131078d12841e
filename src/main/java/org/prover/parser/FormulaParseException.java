package org.prover.parser;

import org.prover.ProverException;

/**
 * Errore sintattico nel testo di una formula.
 *
 * Riporta il testo originale e la posizione (riga, colonna) del primo simbolo
 * non accettato dalla grammatica. Il parsing non produce mai un albero parziale:
 * quando questa eccezione viene lanciata nessuna formula è restituita.
 */
public class FormulaParseException extends ProverException {

    private final String input;
    private final int line;
    private final int column;

    public FormulaParseException(String message, String input, int line, int column) {
        super(String.format("%s (riga %d, colonna %d)", message, line, column));
        this.input = input;
        this.line = line;
        this.column = column;
    }

    /** Testo sorgente che ha causato l'errore. */
    public String getInput() {
        return input;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}

package org.prover.evaluator;

import org.prover.ProverException;

/**
 * Variabile senza valore nell'assegnamento passato al valutatore.
 */
public class UndefinedVariableException extends ProverException {

    private final String variable;

    public UndefinedVariableException(String variable) {
        super("Variabile '" + variable + "' non presente nell'assegnamento");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}

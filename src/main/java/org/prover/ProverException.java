package org.prover;

/**
 * Eccezione base del dimostratore.
 *
 * Tutti gli errori "duri" (input malformato, assegnamenti incompleti, limiti di
 * risorse superati) ne sono sottoclassi. Un fallimento di dimostrazione non è un
 * errore e non viene mai segnalato con eccezioni.
 */
public class ProverException extends RuntimeException {

    public ProverException(String message) {
        super(message);
    }
}

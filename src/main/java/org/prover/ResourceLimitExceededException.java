package org.prover;

/**
 * Segnala il superamento di un limite di risorse (numero di variabili libere
 * per l'enumerazione esaustiva, iterazioni, ...).
 *
 * Il chiamante può rilassare il limite oppure accettare il fallimento.
 */
public class ResourceLimitExceededException extends ProverException {

    /** Nome del limite superato (es. "variabili") */
    private final String limitName;

    /** Valore massimo consentito */
    private final int limit;

    /** Valore effettivamente richiesto */
    private final int requested;

    public ResourceLimitExceededException(String limitName, int limit, int requested) {
        super(String.format("Limite di risorse superato [%s]: richiesti %d, massimo consentito %d",
                limitName, requested, limit));
        this.limitName = limitName;
        this.limit = limit;
        this.requested = requested;
    }

    public String getLimitName() {
        return limitName;
    }

    public int getLimit() {
        return limit;
    }

    public int getRequested() {
        return requested;
    }
}

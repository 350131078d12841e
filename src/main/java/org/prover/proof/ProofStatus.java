package org.prover.proof;

/**
 * Stato di un tentativo di prova.
 */
public enum ProofStatus {
    IN_PROGRESS("in_progress"),  // Ricerca in corso
    SUCCESS("success"),          // Obiettivo derivato al livello 0
    FAILED("failed"),            // Risorse esaurite senza successo
    TIMEOUT("timeout");          // Interrotto dal chiamante per tempo

    private final String value;

    ProofStatus(String value) {
        this.value = value;
    }

    /** Forma testuale usata nella prova formattata. */
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    @Override
    public String toString() {
        return value;
    }
}

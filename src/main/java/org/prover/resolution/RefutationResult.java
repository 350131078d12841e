package org.prover.resolution;

/**
 * RISULTATO REFUTAZIONE - Esito immutabile di una saturazione per risoluzione
 *
 * COMPONENTI:
 * - refuted: clausola vuota derivata, l'insieme di clausole è insoddisfacibile
 * - saturated: nessuna nuova clausola producibile, l'insieme è soddisfacibile
 * - né l'uno né l'altro: limite di iterazioni raggiunto, esito indeterminato
 * - proof: passi di risoluzione registrati
 * - iterations: giri di saturazione eseguiti
 */
public final class RefutationResult {

    private final boolean refuted;
    private final boolean saturated;
    private final ResolutionProof proof;
    private final int iterations;

    private RefutationResult(boolean refuted, boolean saturated, ResolutionProof proof, int iterations) {
        if (proof == null) {
            throw new IllegalArgumentException("Prova di risoluzione non può essere null");
        }
        if (refuted && saturated) {
            throw new IllegalArgumentException("Un insieme refutato non può essere anche saturo");
        }
        this.refuted = refuted;
        this.saturated = saturated;
        this.proof = proof;
        this.iterations = iterations;
    }

    public static RefutationResult refuted(ResolutionProof proof, int iterations) {
        return new RefutationResult(true, false, proof, iterations);
    }

    public static RefutationResult saturated(ResolutionProof proof, int iterations) {
        return new RefutationResult(false, true, proof, iterations);
    }

    public static RefutationResult exhausted(ResolutionProof proof, int iterations) {
        return new RefutationResult(false, false, proof, iterations);
    }

    public boolean isRefuted() {
        return refuted;
    }

    public boolean isSaturated() {
        return saturated;
    }

    public ResolutionProof getProof() {
        return proof;
    }

    public int getIterations() {
        return iterations;
    }

    @Override
    public String toString() {
        String outcome = refuted ? "REFUTATO" : saturated ? "SATURO" : "LIMITE RAGGIUNTO";
        return String.format("RefutationResult[%s, passi=%d, iterazioni=%d]",
                outcome, proof.getStepCount(), iterations);
    }
}

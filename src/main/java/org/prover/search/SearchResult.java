package org.prover.search;

import org.prover.proof.ProofState;
import org.prover.proof.ProofStatus;

import java.time.Duration;
import java.util.List;

/**
 * RISULTATO DI RICERCA - Esito immutabile di un tentativo di prova
 *
 * Contiene lo stato di prova finale, il numero di passi esplorati, il tempo
 * impiegato, le statistiche e le note sul percorso seguito dalla ricerca.
 */
public final class SearchResult {

    private final boolean success;
    private final ProofState proofState;
    private final int stepsExplored;
    private final Duration elapsed;
    private final SearchStatistics statistics;
    private final SearchStrategy strategy;
    private final List<String> searchPath;

    private SearchResult(boolean success, ProofState proofState, int stepsExplored, SearchStatistics statistics,
                         SearchStrategy strategy, List<String> searchPath) {
        this.success = success;
        this.proofState = proofState;
        this.stepsExplored = stepsExplored;
        this.elapsed = statistics.getElapsed();
        this.statistics = statistics;
        this.strategy = strategy;
        this.searchPath = List.copyOf(searchPath);
    }

    //region FACTORY METHODS

    /**
     * Prova trovata: lo stato deve essere completo.
     */
    public static SearchResult proved(ProofState state, int stepsExplored, SearchStatistics statistics,
                                      SearchStrategy strategy, List<String> searchPath) {
        if (state.getStatus() != ProofStatus.SUCCESS) {
            throw new IllegalArgumentException("Lo stato di una prova riuscita deve essere SUCCESS: "
                    + state.getStatus());
        }
        return new SearchResult(true, state, stepsExplored, statistics, strategy, searchPath);
    }

    /**
     * Prova non trovata entro i limiti.
     */
    public static SearchResult notProved(ProofState state, int stepsExplored, SearchStatistics statistics,
                                         SearchStrategy strategy, List<String> searchPath) {
        return new SearchResult(false, state, stepsExplored, statistics, strategy, searchPath);
    }

    //endregion

    //region GETTERS

    public boolean isSuccess() {
        return success;
    }

    public ProofState getProofState() {
        return proofState;
    }

    public int getStepsExplored() {
        return stepsExplored;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public SearchStatistics getStatistics() {
        return statistics;
    }

    public SearchStrategy getStrategy() {
        return strategy;
    }

    public List<String> getSearchPath() {
        return searchPath;
    }

    //endregion

    //region OUTPUT

    /**
     * Riepilogo leggibile; in caso di successo include la prova completa.
     */
    public String formatResult() {
        StringBuilder sb = new StringBuilder();
        sb.append("Ricerca ").append(success ? "riuscita" : "fallita").append("\n");
        sb.append("Strategia: ").append(strategy).append("\n");
        sb.append("Passi esplorati: ").append(stepsExplored).append("\n");
        sb.append(String.format("Tempo: %.3fs", elapsed.toNanos() / 1_000_000_000.0)).append("\n");
        if (success) {
            sb.append("\n").append(proofState.formatProof());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("SearchResult[success=%s, strategy=%s, explored=%d, status=%s, %s]",
                success, strategy, stepsExplored, proofState.getStatus(), statistics.toCompactString());
    }

    //endregion
}

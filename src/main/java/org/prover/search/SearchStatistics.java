package org.prover.search;

import java.time.Duration;

/**
 * STATISTICHE DI RICERCA - Contatori e tempi di un singolo tentativo di prova
 *
 * Il timer parte alla costruzione e si ferma con {@link #stopTimer()}; finché non
 * è fermato il tempo trascorso è calcolato dinamicamente.
 */
public class SearchStatistics {

    //region CONTATORI

    /** Iterazioni della ricerca in avanti o nodi visitati all'indietro */
    private int iterations = 0;

    /** Applicazioni di regole valutate come candidate */
    private int firingsConsidered = 0;

    /** Passi effettivamente aggiunti alla prova */
    private int stepsAdded = 0;

    /** Alternative abbandonate nella ricerca all'indietro */
    private int backtracks = 0;

    /** Passi di risoluzione eseguiti dalla refutazione di riserva */
    private int refutationSteps = 0;

    //endregion

    //region TIMING

    private final long startNanos;
    private long elapsedNanos = 0;
    private boolean timerStopped = false;

    public SearchStatistics() {
        this.startNanos = System.nanoTime();
    }

    public void stopTimer() {
        if (!timerStopped) {
            elapsedNanos = System.nanoTime() - startNanos;
            timerStopped = true;
        }
    }

    public Duration getElapsed() {
        return Duration.ofNanos(timerStopped ? elapsedNanos : System.nanoTime() - startNanos);
    }

    public long getExecutionTimeMs() {
        return getElapsed().toMillis();
    }

    public boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region INCREMENTI

    public void incrementIterations() {
        iterations++;
    }

    public void addFiringsConsidered(int count) {
        firingsConsidered += count;
    }

    public void incrementStepsAdded() {
        stepsAdded++;
    }

    public void incrementBacktracks() {
        backtracks++;
    }

    public void addRefutationSteps(int count) {
        refutationSteps += count;
    }

    //endregion

    //region LETTURA

    public int getIterations() {
        return iterations;
    }

    public int getFiringsConsidered() {
        return firingsConsidered;
    }

    public int getStepsAdded() {
        return stepsAdded;
    }

    public int getBacktracks() {
        return backtracks;
    }

    public int getRefutationSteps() {
        return refutationSteps;
    }

    //endregion

    //region OUTPUT

    public String toCompactString() {
        return String.format("Stats[Iter:%d, Cand:%d, Passi:%d, Backtrack:%d, Ris:%d, Tempo:%dms]",
                iterations, firingsConsidered, stepsAdded, backtracks, refutationSteps, getExecutionTimeMs());
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("=====================[ STATISTICHE DI RICERCA ]=====================\n");
        output.append("    Iterazioni:         ").append(iterations).append("\n");
        output.append("    Candidati valutati: ").append(firingsConsidered).append("\n");
        output.append("    Passi aggiunti:     ").append(stepsAdded).append("\n");
        if (backtracks > 0) {
            output.append("    Backtrack:          ").append(backtracks).append("\n");
        }
        if (refutationSteps > 0) {
            output.append("    Passi risoluzione:  ").append(refutationSteps).append("\n");
        }
        output.append("    Tempo:              ").append(getExecutionTimeMs()).append("ms\n");
        output.append("====================================================================\n");
        return output.toString();
    }

    //endregion
}

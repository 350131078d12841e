package org.prover.cnf;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * PRINCIPIO DI SUSSUNZIONE - Eliminazione di clausole ridondanti
 *
 * Una clausola C1 sussume una clausola C2 se tutti i letterali di C1 sono
 * contenuti in C2: in tal caso C2 può essere eliminata senza alterare il
 * significato della formula.
 *
 * ESEMPIO:
 * Formula: (P) & (~R | ~Q) & (P | Q | ~R) & (A | ~R | B | ~Q) & (R | ~Q)
 * - (P) sussume (P | Q | ~R) → elimina (P | Q | ~R)
 * - (~R | ~Q) sussume (A | ~R | B | ~Q) → elimina (A | ~R | B | ~Q)
 * Risultato: (P) & (~R | ~Q) & (R | ~Q)
 *
 * Usato dal motore di risoluzione per ridurre l'insieme di clausole iniziale.
 */
public class SubsumptionPrinciple {

    private static final Logger LOGGER = Logger.getLogger(SubsumptionPrinciple.class.getName());

    //region STATO OTTIMIZZAZIONE

    /** Registro testuale dell'ultima ottimizzazione */
    private StringBuilder optimizationLog;

    /** Clausole eliminate nell'ultima ottimizzazione */
    private int eliminatedClauses;

    /** Clausole presenti prima dell'ultima ottimizzazione */
    private int originalClauseCount;

    //endregion

    public SubsumptionPrinciple() {
        resetState();
    }

    private void resetState() {
        this.optimizationLog = new StringBuilder();
        this.eliminatedClauses = 0;
        this.originalClauseCount = 0;
    }

    //region INTERFACCIA PUBBLICA PRINCIPALE

    /**
     * Applica il principio di sussunzione alla formula CNF.
     *
     * ALGORITMO:
     * 1. Confronto di ogni coppia di clausole ancora attive
     * 2. Eliminazione della clausola sovrainsieme
     * 3. Ricostruzione della formula con le clausole superstiti, in ordine
     *
     * @param formula formula CNF da ottimizzare (non null)
     * @return formula equivalente senza clausole sussunte
     */
    public CNFFormula apply(CNFFormula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula CNF non può essere null");
        }
        resetState();
        optimizationLog.append("=== INIZIO OTTIMIZZAZIONE SUSSUNZIONE ===\n");
        optimizationLog.append("Formula originale: ").append(formula).append("\n");

        List<Clause> clauses = new ArrayList<>(formula.clauses());
        originalClauseCount = clauses.size();

        if (clauses.size() < 2) {
            optimizationLog.append("Nessuna ottimizzazione necessaria: meno di due clausole\n");
            LOGGER.fine("Ottimizzazione sussunzione non necessaria");
            return formula;
        }

        List<Clause> survivors = performSubsumptionOptimization(clauses);
        logOptimizationResults();

        return eliminatedClauses == 0 ? formula : new CNFFormula(survivors);
    }

    //endregion

    //region ALGORITMO SUSSUNZIONE

    private List<Clause> performSubsumptionOptimization(List<Clause> clauses) {
        optimizationLog.append("\n=== ANALISI SUSSUNZIONE ===\n");

        Set<Integer> clausesToEliminate = new HashSet<>();

        for (int i = 0; i < clauses.size(); i++) {
            if (clausesToEliminate.contains(i)) continue;

            Clause first = clauses.get(i);

            for (int j = i + 1; j < clauses.size(); j++) {
                if (clausesToEliminate.contains(j)) continue;

                Clause second = clauses.get(j);

                if (first.subsumes(second)) {
                    clausesToEliminate.add(j);
                    recordElimination(first, second);
                } else if (second.subsumes(first)) {
                    clausesToEliminate.add(i);
                    recordElimination(second, first);
                    break; // first eliminata, si passa alla successiva
                }
            }
        }

        List<Clause> survivors = new ArrayList<>();
        for (int i = 0; i < clauses.size(); i++) {
            if (!clausesToEliminate.contains(i)) {
                survivors.add(clauses.get(i));
            }
        }

        optimizationLog.append("Clausole eliminate: ").append(eliminatedClauses).append("\n");
        optimizationLog.append("Clausole rimanenti: ").append(survivors.size()).append("\n");
        return survivors;
    }

    private void recordElimination(Clause subsuming, Clause subsumed) {
        eliminatedClauses++;
        optimizationLog.append("SUSSUNZIONE: (").append(subsuming)
                .append(") sussume (").append(subsumed)
                .append(") → elimina (").append(subsumed).append(")\n");
        LOGGER.finest("Clausola " + subsuming + " sussume " + subsumed);
    }

    //endregion

    //region LOGGING E STATISTICHE

    private void logOptimizationResults() {
        optimizationLog.append("\n=== RISULTATI OTTIMIZZAZIONE ===\n");
        optimizationLog.append("Clausole originali: ").append(originalClauseCount).append("\n");
        optimizationLog.append("Clausole finali: ").append(originalClauseCount - eliminatedClauses).append("\n");

        if (originalClauseCount > 0) {
            double reductionPercentage = (double) eliminatedClauses / originalClauseCount * 100;
            optimizationLog.append("Riduzione: ").append(String.format("%.1f%%", reductionPercentage)).append("\n");
        }

        LOGGER.fine("Ottimizzazione sussunzione completata: " + eliminatedClauses + " clausole eliminate");
    }

    /**
     * Rapporto dettagliato sull'ultima ottimizzazione.
     */
    public String getOptimizationInfo() {
        return "=== RAPPORTO SUSSUNZIONE ===\n" + optimizationLog;
    }

    public int getEliminatedClausesCount() {
        return eliminatedClauses;
    }

    public int getOriginalClausesCount() {
        return originalClauseCount;
    }

    @Override
    public String toString() {
        return String.format("SubsumptionPrinciple[original=%d, eliminated=%d, final=%d]",
                originalClauseCount, eliminatedClauses, originalClauseCount - eliminatedClauses);
    }

    //endregion
}

package org.prover.search;

/**
 * Strategie di ricerca della prova.
 */
public enum SearchStrategy {
    FORWARD,   // Concatenazione in avanti dagli assiomi
    BACKWARD,  // Riduzione all'indietro dell'obiettivo in sotto-obiettivi
    HYBRID     // Espansione in avanti e decomposizione dell'obiettivo fino all'incontro
}

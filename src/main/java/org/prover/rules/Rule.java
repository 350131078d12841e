package org.prover.rules;

import org.prover.logic.Expr;

import java.util.List;
import java.util.Set;

/**
 * REGOLA DI INFERENZA - Contratto uniforme delle regole di deduzione naturale
 *
 * LETTURA IN AVANTI ({@link #apply}):
 * - Cerca nella base di conoscenza le premesse richieste dalla regola
 * - Con obiettivo null restituisce tutte le applicazioni possibili
 * - Con obiettivo non null restituisce solo quelle che concludono l'obiettivo
 *
 * LETTURA ALL'INDIETRO ({@link #subgoals}):
 * - Alternative di premesse che, se dimostrate, permetterebbero alla regola di
 *   concludere l'obiettivo
 *
 * Le regole sono prive di stato e non modificano mai gli insiemi ricevuti.
 */
public interface Rule {

    /** Nome univoco della regola (es. "modus_ponens"). */
    String name();

    /** Schema della regola (es. "P, P -> Q ⊢ Q"). */
    String description();

    /**
     * Tutte le applicazioni della regola alla base di conoscenza.
     *
     * @param knowledge formule note (non modificato)
     * @param goal      obiettivo per filtrare le conclusioni, oppure null
     * @return lista finita, eventualmente vuota, di applicazioni
     */
    List<RuleResult> apply(Set<Expr> knowledge, Expr goal);

    /**
     * Alternative di sotto-obiettivi da cui la regola concluderebbe l'obiettivo.
     * Ogni elemento è una lista di premesse da dimostrare tutte.
     */
    default List<List<Expr>> subgoals(Expr goal, Set<Expr> knowledge) {
        return List.of();
    }

    /**
     * Le regole di introduzione costruiscono formule più grandi delle premesse e,
     * senza un obiettivo, possono generare infinite conclusioni.
     */
    default boolean isIntroduction() {
        return false;
    }

    /** Indica se la regola ha almeno un'applicazione. */
    default boolean matches(Set<Expr> knowledge, Expr goal) {
        return !apply(knowledge, goal).isEmpty();
    }
}

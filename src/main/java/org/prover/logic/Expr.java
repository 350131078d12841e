package org.prover.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * FORMULA PROPOSIZIONALE - Nodo immutabile dell'albero sintattico
 *
 * Rappresenta una formula della logica proposizionale classica come albero
 * (nessun ciclo, nessun riferimento al padre). Le sottoclassi concrete sono
 * {@link Var}, {@link Not}, {@link And}, {@link Or}, {@link Imply} e {@link Iff}.
 *
 * UGUAGLIANZA STRUTTURALE:
 * - And, Or, Iff: insensibili all'ordine degli operandi (A & B == B & A)
 * - Not, Imply: uguaglianza esatta
 * - hashCode coerente con equals (combinazione commutativa per And/Or/Iff)
 *
 * Ogni nodo espone il proprio {@link Type} per il dispatch con switch.
 */
public abstract class Expr {

    //region TIPI DI NODO

    /**
     * Tipi di nodi supportati nella rappresentazione ad albero.
     */
    public enum Type {
        VAR,    // Variabile proposizionale: P, Q, Premise1
        NOT,    // Negazione: ~A
        AND,    // Congiunzione: A & B
        OR,     // Disgiunzione: A | B
        IMPLY,  // Implicazione: A -> B
        IFF     // Biimplicazione: A <-> B
    }

    /**
     * Tipo del nodo corrente.
     */
    public abstract Type type();

    //endregion

    //region NAVIGAZIONE ALBERO

    /**
     * Figli diretti del nodo, da sinistra a destra (vuoto per le variabili).
     */
    public abstract List<Expr> children();

    /**
     * Restituisce tutte le sottoformule in pre-ordine, inclusa la formula stessa.
     */
    public List<Expr> subformulas() {
        List<Expr> result = new ArrayList<>();
        collectSubformulas(this, result);
        return result;
    }

    private static void collectSubformulas(Expr node, List<Expr> accumulator) {
        accumulator.add(node);
        for (Expr child : node.children()) {
            collectSubformulas(child, accumulator);
        }
    }

    /**
     * Insieme ordinato dei nomi di variabile presenti nella formula.
     */
    public Set<String> variables() {
        Set<String> names = new TreeSet<>();
        for (Expr sub : subformulas()) {
            if (sub instanceof Var) {
                names.add(((Var) sub).name());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * Profondità di annidamento (una variabile ha profondità 0).
     */
    public int depth() {
        int max = -1;
        for (Expr child : children()) {
            max = Math.max(max, child.depth());
        }
        return max + 1;
    }

    /**
     * Numero totale di nodi dell'albero.
     */
    public int size() {
        int count = 1;
        for (Expr child : children()) {
            count += child.size();
        }
        return count;
    }

    //endregion

    //region TRASFORMAZIONI

    /**
     * Sostituisce le variabili secondo la mappa fornita; le variabili non
     * presenti nella mappa restano invariate.
     *
     * @param mapping nome variabile → formula sostitutiva
     * @return nuova formula con le sostituzioni applicate
     */
    public abstract Expr substitute(Map<String, Expr> mapping);

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rappresentazione infissa che, riletta dal parser, produce una formula
     * uguale a questa.
     */
    @Override
    public abstract String toString();

    /**
     * Racchiude tra parentesi la rappresentazione di un operando, salvo che sia
     * atomico o una negazione.
     */
    static String wrap(Expr operand) {
        if (operand instanceof Var || operand instanceof Not) {
            return operand.toString();
        }
        return "(" + operand + ")";
    }

    //endregion
}

package org.prover.cnf;

import org.prover.logic.Expr;
import org.prover.logic.Formulas;
import org.prover.logic.Not;
import org.prover.logic.Or;
import org.prover.logic.Var;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * FORMULA CNF - Congiunzione immutabile di clausole
 *
 * Insieme di {@link Clause} in congiunzione. Le clausole tautologiche vengono
 * scartate in costruzione; l'ordine di inserimento è preservato per ottenere
 * output e prove riproducibili.
 *
 * CASI NOTEVOLI:
 * - Nessuna clausola: formula sempre vera
 * - Presenza della clausola vuota: formula insoddisfacibile
 */
public final class CNFFormula {

    private static final Logger LOGGER = Logger.getLogger(CNFFormula.class.getName());

    /** Formula senza clausole: sempre vera */
    public static final CNFFormula TRUE = new CNFFormula(Collections.emptyList());

    /** Variabile sentinella usata per rappresentare la formula vera come espressione */
    static final String TRUE_SENTINEL = "_TRUE_";

    private final Set<Clause> clauses;

    public CNFFormula(Collection<Clause> clauses) {
        if (clauses == null || clauses.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Clausole della formula CNF non possono essere null");
        }
        Set<Clause> retained = new LinkedHashSet<>();
        int discarded = 0;
        for (Clause clause : clauses) {
            if (clause.isTautology()) {
                discarded++;
            } else {
                retained.add(clause);
            }
        }
        if (discarded > 0) {
            LOGGER.finest("Scartate " + discarded + " clausole tautologiche");
        }
        this.clauses = Collections.unmodifiableSet(retained);
    }

    //region INTERROGAZIONI

    public Set<Clause> clauses() {
        return clauses;
    }

    public int size() {
        return clauses.size();
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    public boolean hasEmptyClause() {
        return clauses.contains(Clause.EMPTY);
    }

    public List<Clause> unitClauses() {
        return clauses.stream().filter(Clause::isUnit).collect(Collectors.toList());
    }

    public Set<String> variables() {
        Set<String> names = new TreeSet<>();
        for (Clause clause : clauses) {
            names.addAll(clause.variables());
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * Congiunzione di due formule CNF: unione delle clausole.
     */
    public CNFFormula union(CNFFormula other) {
        List<Clause> merged = new ArrayList<>(clauses);
        merged.addAll(other.clauses);
        return new CNFFormula(merged);
    }

    //endregion

    //region CONVERSIONE IN FORMULA

    /**
     * Congiunzione delle clausole associata a sinistra. La formula vuota (vera) è
     * resa come {@code _TRUE_ | ~_TRUE_}.
     */
    public Expr toExpr() {
        if (clauses.isEmpty()) {
            Var sentinel = new Var(TRUE_SENTINEL);
            return new Or(sentinel, new Not(sentinel));
        }
        List<Expr> conjuncts = new ArrayList<>();
        for (Clause clause : clauses) {
            conjuncts.add(clause.toExpr());
        }
        return Formulas.and(conjuncts);
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CNFFormula)) return false;
        return clauses.equals(((CNFFormula) obj).clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode();
    }

    /**
     * Formato: "(P | Q) & (~R)", oppure "TRUE" se non ci sono clausole.
     */
    @Override
    public String toString() {
        if (clauses.isEmpty()) {
            return "TRUE";
        }
        return clauses.stream()
                .map(clause -> "(" + clause + ")")
                .collect(Collectors.joining(" & "));
    }
}

package org.prover.cnf;

import org.prover.logic.Expr;
import org.prover.logic.Not;
import org.prover.logic.Var;

import java.util.Comparator;
import java.util.Objects;

/**
 * Letterale: variabile proposizionale con polarità.
 *
 * Ordinamento naturale: prima per nome di variabile, poi positivo prima di negativo.
 */
public final class Literal implements Comparable<Literal> {

    private static final Comparator<Literal> ORDER = Comparator
            .comparing(Literal::variable)
            .thenComparing(literal -> !literal.positive);

    private final String variable;
    private final boolean positive;

    public Literal(String variable, boolean positive) {
        if (variable == null || variable.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile del letterale non può essere null o vuoto");
        }
        this.variable = variable.trim();
        this.positive = positive;
    }

    public static Literal positive(String variable) {
        return new Literal(variable, true);
    }

    public static Literal negative(String variable) {
        return new Literal(variable, false);
    }

    public String variable() {
        return variable;
    }

    public boolean isPositive() {
        return positive;
    }

    /** Stessa variabile, polarità opposta. */
    public Literal negate() {
        return new Literal(variable, !positive);
    }

    public boolean isComplementOf(Literal other) {
        return other != null && variable.equals(other.variable) && positive != other.positive;
    }

    /** Il letterale come formula: P oppure ~P. */
    public Expr toExpr() {
        Var atom = new Var(variable);
        return positive ? atom : new Not(atom);
    }

    @Override
    public int compareTo(Literal other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal other = (Literal) obj;
        return positive == other.positive && variable.equals(other.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, positive);
    }

    @Override
    public String toString() {
        return positive ? variable : "~" + variable;
    }
}

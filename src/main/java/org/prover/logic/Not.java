package org.prover.logic;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Negazione: ~A.
 */
public final class Not extends Expr {

    private final Expr operand;

    /**
     * @param operand formula negata (non null)
     * @throws IllegalArgumentException se operand è null
     */
    public Not(Expr operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        this.operand = operand;
    }

    public Expr operand() {
        return operand;
    }

    @Override
    public Type type() {
        return Type.NOT;
    }

    @Override
    public List<Expr> children() {
        return List.of(operand);
    }

    @Override
    public Expr substitute(Map<String, Expr> mapping) {
        return new Not(operand.substitute(mapping));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Not)) return false;
        return operand.equals(((Not) obj).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Type.NOT, operand);
    }

    @Override
    public String toString() {
        return operand instanceof Var ? "~" + operand : "~(" + operand + ")";
    }
}

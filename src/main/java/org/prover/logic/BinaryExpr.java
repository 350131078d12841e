package org.prover.logic;

import java.util.List;
import java.util.Objects;

/**
 * Base comune dei connettivi binari.
 *
 * Per i connettivi commutativi (And, Or, Iff) l'uguaglianza accetta entrambi gli
 * ordinamenti degli operandi e l'hash combina gli hash dei figli con una somma,
 * quindi A op B e B op A producono lo stesso valore.
 */
public abstract class BinaryExpr extends Expr {

    private final Expr left;
    private final Expr right;

    /** Hash calcolato una sola volta: il nodo è immutabile */
    private final int hash;

    protected BinaryExpr(Expr left, Expr right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi di " + getClass().getSimpleName() + " non possono essere null");
        }
        this.left = left;
        this.right = right;
        this.hash = isCommutative()
                ? Objects.hash(type(), left.hashCode() + right.hashCode())
                : Objects.hash(type(), left, right);
    }

    public Expr left() {
        return left;
    }

    public Expr right() {
        return right;
    }

    /**
     * Indica se l'ordine degli operandi è irrilevante per l'uguaglianza.
     */
    public abstract boolean isCommutative();

    /**
     * Simbolo infisso del connettivo.
     */
    protected abstract String symbol();

    @Override
    public List<Expr> children() {
        return List.of(left, right);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        BinaryExpr other = (BinaryExpr) obj;
        if (hash != other.hash) return false;
        if (left.equals(other.left) && right.equals(other.right)) return true;
        return isCommutative() && left.equals(other.right) && right.equals(other.left);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return wrap(left) + " " + symbol() + " " + wrap(right);
    }
}

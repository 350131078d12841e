package org.prover.logic;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Variabile proposizionale (P, Q, Premise1, ...).
 */
public final class Var extends Expr {

    private final String name;

    /**
     * @param name nome della variabile (non null, non vuoto)
     * @throws IllegalArgumentException se il nome è null o vuoto
     */
    public Var(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }
        this.name = name.trim();
    }

    public String name() {
        return name;
    }

    @Override
    public Type type() {
        return Type.VAR;
    }

    @Override
    public List<Expr> children() {
        return List.of();
    }

    @Override
    public Expr substitute(Map<String, Expr> mapping) {
        return mapping.getOrDefault(name, this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Var)) return false;
        return name.equals(((Var) obj).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Type.VAR, name);
    }

    @Override
    public String toString() {
        return name;
    }
}

package org.prover.logic;

import java.util.Map;

/**
 * Implicazione materiale: A -> B. Non commutativa: A -> B è diversa da B -> A.
 */
public final class Imply extends BinaryExpr {

    public Imply(Expr left, Expr right) {
        super(left, right);
    }

    @Override
    public Type type() {
        return Type.IMPLY;
    }

    @Override
    public boolean isCommutative() {
        return false;
    }

    @Override
    protected String symbol() {
        return "->";
    }

    @Override
    public Expr substitute(Map<String, Expr> mapping) {
        return new Imply(left().substitute(mapping), right().substitute(mapping));
    }
}

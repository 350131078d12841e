package org.prover.logic;

import java.util.Map;

/**
 * Disgiunzione: A | B. Uguale a B | A.
 */
public final class Or extends BinaryExpr {

    public Or(Expr left, Expr right) {
        super(left, right);
    }

    @Override
    public Type type() {
        return Type.OR;
    }

    @Override
    public boolean isCommutative() {
        return true;
    }

    @Override
    protected String symbol() {
        return "|";
    }

    @Override
    public Expr substitute(Map<String, Expr> mapping) {
        return new Or(left().substitute(mapping), right().substitute(mapping));
    }
}

package org.prover.logic;

import java.util.Map;

/**
 * Congiunzione: A & B. Uguale a B & A.
 */
public final class And extends BinaryExpr {

    public And(Expr left, Expr right) {
        super(left, right);
    }

    @Override
    public Type type() {
        return Type.AND;
    }

    @Override
    public boolean isCommutative() {
        return true;
    }

    @Override
    protected String symbol() {
        return "&";
    }

    @Override
    public Expr substitute(Map<String, Expr> mapping) {
        return new And(left().substitute(mapping), right().substitute(mapping));
    }
}

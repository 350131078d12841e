package org.prover.logic;

import java.util.Map;

/**
 * Biimplicazione: A <-> B. Uguale a B <-> A.
 */
public final class Iff extends BinaryExpr {

    public Iff(Expr left, Expr right) {
        super(left, right);
    }

    @Override
    public Type type() {
        return Type.IFF;
    }

    @Override
    public boolean isCommutative() {
        return true;
    }

    @Override
    protected String symbol() {
        return "<->";
    }

    @Override
    public Expr substitute(Map<String, Expr> mapping) {
        return new Iff(left().substitute(mapping), right().substitute(mapping));
    }
}

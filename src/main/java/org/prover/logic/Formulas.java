package org.prover.logic;

import java.util.List;

/**
 * Funzioni di supporto sulle formule: negazione con semplificazione, riconoscimento
 * dei letterali e costruzione di congiunzioni/disgiunzioni n-arie.
 */
public final class Formulas {

    private Formulas() {
        throw new UnsupportedOperationException("Classe di utilità - non istanziabile");
    }

    /**
     * Nega una formula eliminando la doppia negazione: negate(~A) = A, negate(A) = ~A.
     */
    public static Expr negate(Expr formula) {
        if (formula instanceof Not) {
            return ((Not) formula).operand();
        }
        return new Not(formula);
    }

    /**
     * Un letterale è una variabile o la negazione di una variabile.
     */
    public static boolean isLiteral(Expr formula) {
        return formula instanceof Var
                || (formula instanceof Not && ((Not) formula).operand() instanceof Var);
    }

    /**
     * Congiunzione associata a sinistra: and(A, B, C) = (A & B) & C.
     *
     * @throws IllegalArgumentException se la lista è vuota
     */
    public static Expr and(List<Expr> operands) {
        return fold(operands, true);
    }

    public static Expr and(Expr... operands) {
        return and(List.of(operands));
    }

    /**
     * Disgiunzione associata a sinistra: or(A, B, C) = (A | B) | C.
     *
     * @throws IllegalArgumentException se la lista è vuota
     */
    public static Expr or(List<Expr> operands) {
        return fold(operands, false);
    }

    public static Expr or(Expr... operands) {
        return or(List.of(operands));
    }

    private static Expr fold(List<Expr> operands, boolean conjunction) {
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("Serve almeno un operando");
        }
        Expr result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = conjunction ? new And(result, operands.get(i)) : new Or(result, operands.get(i));
        }
        return result;
    }
}

package org.prover.rules;

import org.prover.logic.Expr;
import org.prover.logic.Not;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Eliminazione della doppia negazione: ~~P ⊢ P.
 */
public class DoubleNegationElimination extends AbstractRule {

    public DoubleNegationElimination() {
        super("double_neg_elim", "~~P ⊢ P");
    }

    @Override
    public List<RuleResult> apply(Set<Expr> knowledge, Expr goal) {
        List<RuleResult> results = new ArrayList<>();
        for (Expr formula : knowledge) {
            if (formula instanceof Not && ((Not) formula).operand() instanceof Not) {
                Expr conclusion = ((Not) ((Not) formula).operand()).operand();
                if (accepts(goal, conclusion)) {
                    results.add(result(conclusion, List.of(formula), "Da " + formula + " si ottiene " + conclusion));
                }
            }
        }
        return results;
    }

    /**
     * ~~obiettivo è proposto solo se compare già come sottoformula di una formula
     * nota, altrimenti la riduzione all'indietro non terminerebbe.
     */
    @Override
    public List<List<Expr>> subgoals(Expr goal, Set<Expr> knowledge) {
        Expr doubleNegation = new Not(new Not(goal));
        for (Expr formula : knowledge) {
            if (formula.subformulas().contains(doubleNegation)) {
                return List.of(List.of(doubleNegation));
            }
        }
        return List.of();
    }
}

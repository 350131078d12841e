package org.prover.rules;

import org.prover.logic.And;
import org.prover.logic.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Eliminazione della congiunzione, a sinistra (P & Q ⊢ P) o a destra (P & Q ⊢ Q).
 */
public class AndElimination extends AbstractRule {

    private final boolean left;

    private AndElimination(boolean left) {
        super(left ? "and_elim_left" : "and_elim_right", left ? "P & Q ⊢ P" : "P & Q ⊢ Q");
        this.left = left;
    }

    public static AndElimination left() {
        return new AndElimination(true);
    }

    public static AndElimination right() {
        return new AndElimination(false);
    }

    private Expr extract(And conjunction) {
        return left ? conjunction.left() : conjunction.right();
    }

    @Override
    public List<RuleResult> apply(Set<Expr> knowledge, Expr goal) {
        List<RuleResult> results = new ArrayList<>();
        for (Expr formula : knowledge) {
            if (formula instanceof And) {
                Expr conclusion = extract((And) formula);
                if (accepts(goal, conclusion)) {
                    results.add(result(conclusion, List.of(formula), "Da " + formula + " si ottiene " + conclusion));
                }
            }
        }
        return results;
    }

    @Override
    public List<List<Expr>> subgoals(Expr goal, Set<Expr> knowledge) {
        List<List<Expr>> alternatives = new ArrayList<>();
        for (Expr formula : knowledge) {
            if (formula instanceof And && extract((And) formula).equals(goal)) {
                alternatives.add(List.of(formula));
            }
        }
        return alternatives;
    }
}

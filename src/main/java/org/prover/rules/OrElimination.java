package org.prover.rules;

import org.prover.logic.Expr;
import org.prover.logic.Formulas;
import org.prover.logic.Not;
import org.prover.logic.Or;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Eliminazione della disgiunzione nella forma del sillogismo disgiuntivo:
 * P | Q, ~P ⊢ Q e P | Q, ~Q ⊢ P.
 */
public class OrElimination extends AbstractRule {

    public OrElimination() {
        super("or_elim", "P | Q, ~P ⊢ Q");
    }

    @Override
    public List<RuleResult> apply(Set<Expr> knowledge, Expr goal) {
        List<RuleResult> results = new ArrayList<>();
        for (Expr formula : knowledge) {
            if (formula instanceof Or) {
                Or disjunction = (Or) formula;
                addIfRefuted(disjunction, disjunction.left(), disjunction.right(), knowledge, goal, results);
                addIfRefuted(disjunction, disjunction.right(), disjunction.left(), knowledge, goal, results);
            }
        }
        return results;
    }

    private void addIfRefuted(Or disjunction, Expr refuted, Expr conclusion,
                              Set<Expr> knowledge, Expr goal, List<RuleResult> results) {
        if (!accepts(goal, conclusion)) {
            return;
        }
        Expr negation = Formulas.negate(refuted);
        if (!knowledge.contains(negation)) {
            negation = new Not(refuted);
            if (!knowledge.contains(negation)) {
                return;
            }
        }
        results.add(result(conclusion, List.of(disjunction, negation),
                "Da " + disjunction + " e " + negation + " si ottiene " + conclusion));
    }

    @Override
    public List<List<Expr>> subgoals(Expr goal, Set<Expr> knowledge) {
        List<List<Expr>> alternatives = new ArrayList<>();
        for (Expr formula : knowledge) {
            if (formula instanceof Or) {
                Or disjunction = (Or) formula;
                if (disjunction.right().equals(goal)) {
                    alternatives.add(List.of(formula, Formulas.negate(disjunction.left())));
                }
                if (disjunction.left().equals(goal)) {
                    alternatives.add(List.of(formula, Formulas.negate(disjunction.right())));
                }
            }
        }
        return alternatives;
    }
}

package org.prover.rules;

import org.prover.logic.Expr;
import org.prover.logic.Imply;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Modus Ponens: P, P -> Q ⊢ Q.
 */
public class ModusPonens extends AbstractRule {

    public ModusPonens() {
        super("modus_ponens", "P, P -> Q ⊢ Q");
    }

    @Override
    public List<RuleResult> apply(Set<Expr> knowledge, Expr goal) {
        List<RuleResult> results = new ArrayList<>();
        for (Expr formula : knowledge) {
            if (formula instanceof Imply) {
                Imply implication = (Imply) formula;
                if (knowledge.contains(implication.left()) && accepts(goal, implication.right())) {
                    results.add(result(implication.right(), List.of(implication.left(), implication),
                            "Da " + implication.left() + " e " + implication + ", per MP si ottiene " + implication.right()));
                }
            }
        }
        return results;
    }

    /**
     * Per ogni implicazione nota X -> obiettivo basta dimostrare X.
     */
    @Override
    public List<List<Expr>> subgoals(Expr goal, Set<Expr> knowledge) {
        List<List<Expr>> alternatives = new ArrayList<>();
        for (Expr formula : knowledge) {
            if (formula instanceof Imply && ((Imply) formula).right().equals(goal)) {
                alternatives.add(List.of(((Imply) formula).left(), formula));
            }
        }
        return alternatives;
    }
}

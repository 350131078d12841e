package org.prover.rules;

import org.prover.logic.Expr;
import org.prover.logic.Or;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Introduzione della disgiunzione, a sinistra (P ⊢ P | Q) o a destra (Q ⊢ P | Q).
 *
 * Si applica solo verso un obiettivo disgiuntivo: senza obiettivo il disgiunto
 * aggiunto potrebbe essere una formula qualsiasi.
 */
public class OrIntroduction extends AbstractRule {

    private final boolean left;

    private OrIntroduction(boolean left) {
        super(left ? "or_intro_left" : "or_intro_right", left ? "P ⊢ P | Q" : "Q ⊢ P | Q");
        this.left = left;
    }

    public static OrIntroduction left() {
        return new OrIntroduction(true);
    }

    public static OrIntroduction right() {
        return new OrIntroduction(false);
    }

    private Expr extract(Or disjunction) {
        return left ? disjunction.left() : disjunction.right();
    }

    @Override
    public boolean isIntroduction() {
        return true;
    }

    @Override
    public List<RuleResult> apply(Set<Expr> knowledge, Expr goal) {
        List<RuleResult> results = new ArrayList<>();
        if (goal instanceof Or) {
            Expr disjunct = extract((Or) goal);
            if (knowledge.contains(disjunct)) {
                results.add(result(goal, List.of(disjunct), "Da " + disjunct + " si ottiene " + goal));
            }
        }
        return results;
    }

    @Override
    public List<List<Expr>> subgoals(Expr goal, Set<Expr> knowledge) {
        if (goal instanceof Or) {
            return List.of(List.of(extract((Or) goal)));
        }
        return List.of();
    }
}

package org.prover.rules;

import org.prover.logic.And;
import org.prover.logic.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Introduzione della congiunzione: P, Q ⊢ P & Q.
 *
 * Senza obiettivo produce la congiunzione di ogni coppia non ordinata di formule
 * distinte della base di conoscenza; con un obiettivo congiuntivo verifica solo
 * che entrambi i congiunti siano noti.
 */
public class AndIntro extends AbstractRule {

    public AndIntro() {
        super("and_intro", "P, Q ⊢ P & Q");
    }

    @Override
    public boolean isIntroduction() {
        return true;
    }

    @Override
    public List<RuleResult> apply(Set<Expr> knowledge, Expr goal) {
        List<RuleResult> results = new ArrayList<>();

        if (goal instanceof And) {
            And conjunction = (And) goal;
            if (knowledge.contains(conjunction.left()) && knowledge.contains(conjunction.right())) {
                results.add(describe(conjunction.left(), conjunction.right(), conjunction));
            }
            return results;
        }
        if (goal != null) {
            return results;
        }

        List<Expr> known = new ArrayList<>(knowledge);
        for (int i = 0; i < known.size(); i++) {
            for (int j = i + 1; j < known.size(); j++) {
                Expr first = known.get(i);
                Expr second = known.get(j);
                results.add(describe(first, second, new And(first, second)));
            }
        }
        return results;
    }

    private RuleResult describe(Expr first, Expr second, Expr conclusion) {
        return result(conclusion, List.of(first, second),
                "Da " + first + " e " + second + " si ottiene " + conclusion);
    }

    @Override
    public List<List<Expr>> subgoals(Expr goal, Set<Expr> knowledge) {
        if (goal instanceof And) {
            return List.of(List.of(((And) goal).left(), ((And) goal).right()));
        }
        return List.of();
    }
}

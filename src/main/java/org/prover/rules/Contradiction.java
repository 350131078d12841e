package org.prover.rules;

import org.prover.logic.Expr;
import org.prover.logic.Not;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Ex falso quodlibet: P, ~P ⊢ obiettivo.
 *
 * Si applica solo verso un obiettivo esplicito e produce al più un risultato,
 * usando la prima coppia contraddittoria trovata.
 */
public class Contradiction extends AbstractRule {

    public Contradiction() {
        super("contradiction", "P, ~P ⊢ Q");
    }

    @Override
    public boolean isIntroduction() {
        return true;
    }

    @Override
    public List<RuleResult> apply(Set<Expr> knowledge, Expr goal) {
        List<RuleResult> results = new ArrayList<>();
        if (goal == null) {
            return results;
        }
        for (Expr formula : knowledge) {
            if (formula instanceof Not && knowledge.contains(((Not) formula).operand())) {
                Expr positive = ((Not) formula).operand();
                results.add(result(goal, List.of(positive, formula),
                        "Da " + positive + " e " + formula + " (contraddizione) si ottiene " + goal));
                break;
            }
        }
        return results;
    }
}

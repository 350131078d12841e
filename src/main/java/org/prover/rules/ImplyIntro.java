package org.prover.rules;

import org.prover.logic.Expr;
import org.prover.logic.Imply;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Introduzione dell'implicazione nella forma senza ipotesi: Q ⊢ P -> Q.
 *
 * La forma con ipotesi scaricata ([P] ... Q ⊢ P -> Q) è realizzata dalla ricerca
 * all'indietro tramite {@link org.prover.proof.ProofState#conditionalProof}.
 */
public class ImplyIntro extends AbstractRule {

    public ImplyIntro() {
        super("imply_intro", "Q ⊢ P -> Q");
    }

    @Override
    public boolean isIntroduction() {
        return true;
    }

    @Override
    public List<RuleResult> apply(Set<Expr> knowledge, Expr goal) {
        List<RuleResult> results = new ArrayList<>();
        if (goal instanceof Imply && knowledge.contains(((Imply) goal).right())) {
            Expr consequent = ((Imply) goal).right();
            results.add(result(goal, List.of(consequent), "Da " + consequent + " si ottiene " + goal));
        }
        return results;
    }

    @Override
    public List<List<Expr>> subgoals(Expr goal, Set<Expr> knowledge) {
        if (goal instanceof Imply) {
            return List.of(List.of(((Imply) goal).right()));
        }
        return List.of();
    }
}

package org.prover.rules;

import org.prover.logic.Expr;
import org.prover.logic.Formulas;
import org.prover.logic.Imply;
import org.prover.logic.Not;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Modus Tollens: P -> Q, ~Q ⊢ ~P.
 *
 * Le doppie negazioni vengono semplificate: da ~P -> Q e ~Q si conclude P.
 * La negazione del conseguente è cercata sia semplificata sia letterale
 * (per Q = ~R si accettano R e ~~R).
 */
public class ModusTollens extends AbstractRule {

    public ModusTollens() {
        super("modus_tollens", "P -> Q, ~Q ⊢ ~P");
    }

    @Override
    public List<RuleResult> apply(Set<Expr> knowledge, Expr goal) {
        List<RuleResult> results = new ArrayList<>();
        for (Expr formula : knowledge) {
            if (!(formula instanceof Imply)) {
                continue;
            }
            Imply implication = (Imply) formula;
            Expr negatedConsequent = knownNegation(implication.right(), knowledge);
            if (negatedConsequent == null) {
                continue;
            }
            Expr conclusion = Formulas.negate(implication.left());
            if (accepts(goal, conclusion)) {
                results.add(result(conclusion, List.of(implication, negatedConsequent),
                        "Da " + implication + " e " + negatedConsequent + ", per MT si ottiene " + conclusion));
            }
        }
        return results;
    }

    private static Expr knownNegation(Expr formula, Set<Expr> knowledge) {
        Expr simplified = Formulas.negate(formula);
        if (knowledge.contains(simplified)) {
            return simplified;
        }
        Expr literal = new Not(formula);
        return knowledge.contains(literal) ? literal : null;
    }

    /**
     * Per ogni implicazione nota P -> Q con ~P uguale all'obiettivo basta dimostrare ~Q.
     */
    @Override
    public List<List<Expr>> subgoals(Expr goal, Set<Expr> knowledge) {
        List<List<Expr>> alternatives = new ArrayList<>();
        for (Expr formula : knowledge) {
            if (formula instanceof Imply && Formulas.negate(((Imply) formula).left()).equals(goal)) {
                alternatives.add(List.of(formula, Formulas.negate(((Imply) formula).right())));
            }
        }
        return alternatives;
    }
}

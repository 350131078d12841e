package org.prover.rules;

import org.prover.cnf.Clause;
import org.prover.logic.Expr;
import org.prover.resolution.ResolutionEngine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Risoluzione come regola di inferenza: A | P, B | ~P ⊢ A | B.
 *
 * Considera solo le formule "a forma di clausola" (letterali o disgiunzioni di
 * letterali). I risolventi vuoti o tautologici non vengono prodotti. Quando
 * l'obiettivo è una clausola uguale al risolvente, la conclusione è l'obiettivo
 * stesso, così l'ordine dei disgiunti non impedisce il riconoscimento.
 */
public class ResolutionRule extends AbstractRule {

    private final ResolutionEngine engine = new ResolutionEngine();

    public ResolutionRule() {
        super("resolution", "A | P, B | ~P ⊢ A | B");
    }

    @Override
    public List<RuleResult> apply(Set<Expr> knowledge, Expr goal) {
        Map<Expr, Clause> clauses = new LinkedHashMap<>();
        for (Expr formula : knowledge) {
            Clause.fromExpr(formula).ifPresent(clause -> clauses.put(formula, clause));
        }
        Optional<Clause> goalClause = goal == null ? Optional.empty() : Clause.fromExpr(goal);

        List<RuleResult> results = new ArrayList<>();
        List<Map.Entry<Expr, Clause>> entries = new ArrayList<>(clauses.entrySet());
        for (int i = 0; i < entries.size(); i++) {
            for (int j = i + 1; j < entries.size(); j++) {
                Map.Entry<Expr, Clause> first = entries.get(i);
                Map.Entry<Expr, Clause> second = entries.get(j);

                for (String variable : first.getValue().variables()) {
                    Optional<Clause> resolvent = engine.resolve(first.getValue(), second.getValue(), variable);
                    if (resolvent.isEmpty() || resolvent.get().isEmpty() || resolvent.get().isTautology()) {
                        continue;
                    }
                    Expr conclusion = goalClause.filter(resolvent.get()::equals).isPresent()
                            ? goal
                            : resolvent.get().toExpr();
                    if (accepts(goal, conclusion)) {
                        results.add(result(conclusion, List.of(first.getKey(), second.getKey()),
                                "Risoluzione di " + first.getKey() + " e " + second.getKey()
                                        + " su " + variable + ": " + conclusion));
                    }
                }
            }
        }
        return results;
    }
}

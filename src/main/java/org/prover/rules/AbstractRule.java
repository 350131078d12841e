package org.prover.rules;

import org.prover.logic.Expr;

import java.util.List;

/**
 * Base comune delle regole standard: nome, schema e costruzione dei risultati.
 */
abstract class AbstractRule implements Rule {

    private final String name;
    private final String description;

    protected AbstractRule(String name, String description) {
        this.name = name;
        this.description = description;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    /** Una conclusione è accettata se non c'è obiettivo o se coincide con esso. */
    protected static boolean accepts(Expr goal, Expr conclusion) {
        return goal == null || goal.equals(conclusion);
    }

    protected RuleResult result(Expr conclusion, List<Expr> premises, String description) {
        return new RuleResult(name, conclusion, premises, description);
    }

    @Override
    public String toString() {
        return name + " (" + description + ")";
    }
}

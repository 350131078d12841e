package org.prover.rules;

import org.prover.logic.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Singola applicazione di una regola: premesse usate e conclusione ottenuta.
 */
public final class RuleResult {

    /** Nome della regola applicata */
    private final String ruleName;

    /** Formula derivata */
    private final Expr conclusion;

    /** Formule della base di conoscenza usate, nell'ordine della regola (immutabile) */
    private final List<Expr> premises;

    /** Spiegazione leggibile dell'applicazione, può essere null */
    private final String description;

    /**
     * @throws IllegalArgumentException se nome, conclusione o premesse sono null
     */
    public RuleResult(String ruleName, Expr conclusion, List<Expr> premises, String description) {
        if (ruleName == null || conclusion == null || premises == null) {
            throw new IllegalArgumentException("Nome regola, conclusione e premesse non possono essere null");
        }
        if (premises.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Le premesse non possono contenere null");
        }
        this.ruleName = ruleName;
        this.conclusion = conclusion;
        this.premises = Collections.unmodifiableList(new ArrayList<>(premises));
        this.description = description;
    }

    //region ACCESSO

    public String getRuleName() {
        return ruleName;
    }

    public Expr getConclusion() {
        return conclusion;
    }

    public List<Expr> getPremises() {
        return premises;
    }

    public String getDescription() {
        return description;
    }

    //endregion

    //region OVERRIDE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RuleResult)) return false;
        RuleResult other = (RuleResult) obj;
        return ruleName.equals(other.ruleName)
                && conclusion.equals(other.conclusion)
                && premises.equals(other.premises)
                && Objects.equals(description, other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleName, conclusion, premises, description);
    }

    @Override
    public String toString() {
        String premisesText = premises.stream().map(Expr::toString).collect(Collectors.joining(", "));
        return ruleName + ": " + premisesText + " ⊢ " + conclusion;
    }

    //endregion
}

package org.prover.proof;

import org.prover.logic.Expr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * PASSO DI PROVA - Registrazione immutabile di una formula derivata
 *
 * Contiene numero progressivo, formula, regola usata, numeri dei passi premessa,
 * giustificazione testuale e livello di ipotesi in cui il passo è stato aggiunto.
 *
 * FORMATO: "  n. formula  [regola, p1, p2]", rientrato di due spazi per livello;
 * senza premesse "n. formula  [regola]".
 */
public final class ProofStep {

    private final int stepNumber;
    private final Expr formula;
    private final String ruleName;
    private final List<Integer> premiseSteps;
    private final String justification;
    private final int assumptionLevel;

    public ProofStep(int stepNumber, Expr formula, String ruleName, List<Integer> premiseSteps,
                     String justification, int assumptionLevel) {
        if (stepNumber <= 0) {
            throw new IllegalArgumentException("Numero di passo non valido: " + stepNumber);
        }
        if (formula == null || ruleName == null || premiseSteps == null) {
            throw new IllegalArgumentException("Formula, regola e premesse del passo non possono essere null");
        }
        if (assumptionLevel < 0) {
            throw new IllegalArgumentException("Livello di ipotesi negativo: " + assumptionLevel);
        }
        this.stepNumber = stepNumber;
        this.formula = formula;
        this.ruleName = ruleName;
        this.premiseSteps = List.copyOf(premiseSteps);
        this.justification = justification == null ? "" : justification;
        this.assumptionLevel = assumptionLevel;
    }

    public int getStepNumber() {
        return stepNumber;
    }

    public Expr getFormula() {
        return formula;
    }

    public String getRuleName() {
        return ruleName;
    }

    public List<Integer> getPremiseSteps() {
        return premiseSteps;
    }

    public String getJustification() {
        return justification;
    }

    public int getAssumptionLevel() {
        return assumptionLevel;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ProofStep)) return false;
        ProofStep other = (ProofStep) obj;
        return stepNumber == other.stepNumber
                && assumptionLevel == other.assumptionLevel
                && formula.equals(other.formula)
                && ruleName.equals(other.ruleName)
                && premiseSteps.equals(other.premiseSteps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepNumber, formula, ruleName, premiseSteps, assumptionLevel);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("  ".repeat(assumptionLevel));
        sb.append(stepNumber).append(". ").append(formula).append("  [").append(ruleName);
        if (!premiseSteps.isEmpty()) {
            sb.append(", ").append(premiseSteps.stream().map(String::valueOf).collect(Collectors.joining(", ")));
        }
        sb.append("]");
        return sb.toString();
    }
}

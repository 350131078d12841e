package org.prover.proof;

import org.prover.logic.Expr;

import java.util.Objects;

/**
 * Ipotesi aperta nella prova.
 */
public final class Assumption {

    /** Formula assunta */
    private final Expr formula;

    /** Numero del passo che l'ha introdotta (>= 1) */
    private final int stepNumber;

    /** Livello di annidamento, 1 per la prima ipotesi */
    private final int level;

    /** Formula che si vuole derivare sotto l'ipotesi, oppure null */
    private final Expr target;

    /**
     * @throws IllegalArgumentException se la formula è null o numero di passo e livello non sono positivi
     */
    public Assumption(Expr formula, int stepNumber, int level, Expr target) {
        if (formula == null) {
            throw new IllegalArgumentException("La formula assunta non può essere null");
        }
        if (stepNumber < 1 || level < 1) {
            throw new IllegalArgumentException("Passo e livello devono essere positivi: " + stepNumber + ", " + level);
        }
        this.formula = formula;
        this.stepNumber = stepNumber;
        this.level = level;
        this.target = target;
    }

    public Expr getFormula() {
        return formula;
    }

    public int getStepNumber() {
        return stepNumber;
    }

    public int getLevel() {
        return level;
    }

    public Expr getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Assumption)) return false;
        Assumption other = (Assumption) obj;
        return stepNumber == other.stepNumber && level == other.level
                && formula.equals(other.formula) && Objects.equals(target, other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(formula, stepNumber, level, target);
    }

    @Override
    public String toString() {
        return "Assumption[" + formula + ", passo " + stepNumber + ", livello " + level + "]";
    }
}

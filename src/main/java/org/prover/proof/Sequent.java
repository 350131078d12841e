package org.prover.proof;

import org.prover.cnf.Clause;
import org.prover.logic.Expr;
import org.prover.logic.Formulas;
import org.prover.logic.Imply;
import org.prover.logic.Not;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SEQUENTE - Struttura Γ ⊢ Δ del calcolo dei sequenti
 *
 * SEMANTICA: se tutte le formule dell'antecedente Γ sono vere, almeno una
 * formula del conseguente Δ è vera. Entrambi i lati sono insiemi: l'ordine e
 * le ripetizioni non contano per l'uguaglianza.
 *
 * FORMATO: formule di ciascun lato ordinate per testo e separate da virgola,
 * es. "P, P -> Q ⊢ Q". Un lato vuoto non stampa nulla: "⊢ P | ~P".
 */
public final class Sequent {

    private static final Comparator<Expr> BY_TEXT = Comparator.comparing(Expr::toString);

    /** Antecedente Γ (immutabile) */
    private final Set<Expr> antecedents;

    /** Conseguente Δ (immutabile) */
    private final Set<Expr> consequents;

    /**
     * @throws IllegalArgumentException se un lato è null o contiene null
     */
    public Sequent(Collection<Expr> antecedents, Collection<Expr> consequents) {
        if (antecedents == null || consequents == null) {
            throw new IllegalArgumentException("I lati del sequente non possono essere null");
        }
        if (antecedents.stream().anyMatch(Objects::isNull) || consequents.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Il sequente non può contenere formule null");
        }
        this.antecedents = Collections.unmodifiableSet(new LinkedHashSet<>(antecedents));
        this.consequents = Collections.unmodifiableSet(new LinkedHashSet<>(consequents));
    }

    /** Sequente premesse ⊢ conclusione. */
    public static Sequent of(List<Expr> premises, Expr conclusion) {
        if (conclusion == null) {
            throw new IllegalArgumentException("La conclusione non può essere null");
        }
        return new Sequent(premises, List.of(conclusion));
    }

    /** Sequente senza premesse: ⊢ goal. */
    public static Sequent goal(Expr goal) {
        return of(List.of(), goal);
    }

    //region INTERROGAZIONI

    public Set<Expr> getAntecedents() {
        return antecedents;
    }

    public Set<Expr> getConsequents() {
        return consequents;
    }

    /**
     * Sequente assioma: una stessa formula compare su entrambi i lati (Γ, A ⊢ A, Δ).
     */
    public boolean isAxiom() {
        return antecedents.stream().anyMatch(consequents::contains);
    }

    /**
     * Vero se entrambi i lati contengono solo variabili: nessuna regola è applicabile.
     */
    public boolean isAtomic() {
        return antecedents.stream().allMatch(f -> f.type() == Expr.Type.VAR)
                && consequents.stream().allMatch(f -> f.type() == Expr.Type.VAR);
    }

    //endregion

    //region COSTRUZIONE DI NUOVI SEQUENTI

    public Sequent withAntecedent(Expr formula) {
        Set<Expr> extended = new LinkedHashSet<>(antecedents);
        extended.add(formula);
        return new Sequent(extended, consequents);
    }

    public Sequent withConsequent(Expr formula) {
        Set<Expr> extended = new LinkedHashSet<>(consequents);
        extended.add(formula);
        return new Sequent(antecedents, extended);
    }

    public Sequent withoutAntecedent(Expr formula) {
        Set<Expr> reduced = new LinkedHashSet<>(antecedents);
        reduced.remove(formula);
        return new Sequent(reduced, consequents);
    }

    public Sequent withoutConsequent(Expr formula) {
        Set<Expr> reduced = new LinkedHashSet<>(consequents);
        reduced.remove(formula);
        return new Sequent(antecedents, reduced);
    }

    //endregion

    //region CONVERSIONE

    /**
     * Formula equivalente: (∧Γ) -> (∨Δ).
     *
     * CASI LIMITE:
     * - Γ vuoto: solo la disgiunzione di Δ
     * - Δ vuoto: la negazione della congiunzione di Γ
     * - entrambi vuoti: la contraddizione della clausola vuota
     *
     * Le formule sono combinate nell'ordine di stampa, così il risultato non
     * dipende dall'ordine di inserimento.
     */
    public Expr toFormula() {
        List<Expr> left = sorted(antecedents);
        List<Expr> right = sorted(consequents);

        if (left.isEmpty()) {
            return right.isEmpty() ? Clause.EMPTY.toExpr() : Formulas.or(right);
        }
        if (right.isEmpty()) {
            return new Not(Formulas.and(left));
        }
        return new Imply(Formulas.and(left), Formulas.or(right));
    }

    private static List<Expr> sorted(Set<Expr> formulas) {
        List<Expr> ordered = new ArrayList<>(formulas);
        ordered.sort(BY_TEXT);
        return ordered;
    }

    //endregion

    //region OVERRIDE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Sequent)) return false;
        Sequent other = (Sequent) obj;
        return antecedents.equals(other.antecedents) && consequents.equals(other.consequents);
    }

    @Override
    public int hashCode() {
        return Objects.hash(antecedents, consequents);
    }

    @Override
    public String toString() {
        String left = sorted(antecedents).stream().map(Expr::toString).collect(Collectors.joining(", "));
        String right = sorted(consequents).stream().map(Expr::toString).collect(Collectors.joining(", "));
        return (left.isEmpty() ? "" : left + " ") + "⊢" + (right.isEmpty() ? "" : " " + right);
    }

    //endregion
}

package org.prover.cnf;

import org.prover.logic.And;
import org.prover.logic.Expr;
import org.prover.logic.Formulas;
import org.prover.logic.Not;
import org.prover.logic.Or;
import org.prover.logic.Var;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * CLAUSOLA - Insieme immutabile di letterali in disgiunzione
 *
 * CASI NOTEVOLI:
 * - Clausola vuota [] = contraddizione
 * - Clausola unitaria = un solo letterale
 * - Clausola tautologica = contiene P e ~P (ignorata da tutti i consumatori)
 *
 * I letterali sono mantenuti ordinati, così rappresentazione testuale e
 * conversione in formula sono deterministiche.
 */
public final class Clause {

    /** Clausola vuota: contraddizione */
    public static final Clause EMPTY = new Clause(Collections.emptySet());

    /** Variabile sentinella usata per rappresentare la clausola vuota come formula */
    static final String FALSE_SENTINEL = "_FALSE_";

    private final SortedSet<Literal> literals;

    public Clause(Collection<Literal> literals) {
        if (literals == null || literals.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Letterali della clausola non possono essere null");
        }
        this.literals = Collections.unmodifiableSortedSet(new TreeSet<>(literals));
    }

    public static Clause of(Literal... literals) {
        return new Clause(Arrays.asList(literals));
    }

    //region INTERROGAZIONI

    public SortedSet<Literal> literals() {
        return literals;
    }

    public int size() {
        return literals.size();
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    public boolean isUnit() {
        return literals.size() == 1;
    }

    /**
     * Una clausola è tautologica se contiene una variabile con entrambe le polarità.
     */
    public boolean isTautology() {
        for (Literal literal : literals) {
            if (literal.isPositive() && literals.contains(literal.negate())) {
                return true;
            }
        }
        return false;
    }

    public boolean contains(Literal literal) {
        return literals.contains(literal);
    }

    public Set<String> variables() {
        return literals.stream()
                .map(Literal::variable)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Unione insiemistica dei letterali (può produrre una tautologia).
     */
    public Clause union(Clause other) {
        List<Literal> merged = new ArrayList<>(literals);
        merged.addAll(other.literals);
        return new Clause(merged);
    }

    /**
     * Verifica se questa clausola sussume l'altra (i suoi letterali sono un
     * sottoinsieme di quelli dell'altra).
     */
    public boolean subsumes(Clause other) {
        return other.literals.containsAll(literals);
    }

    //endregion

    //region CONVERSIONI DA/VERSO FORMULE

    /**
     * Disgiunzione dei letterali in ordine, associata a sinistra. La clausola vuota
     * è resa come {@code _FALSE_ & ~_FALSE_}.
     */
    public Expr toExpr() {
        if (literals.isEmpty()) {
            Var sentinel = new Var(FALSE_SENTINEL);
            return new And(sentinel, new Not(sentinel));
        }
        List<Expr> disjuncts = new ArrayList<>();
        for (Literal literal : literals) {
            disjuncts.add(literal.toExpr());
        }
        return Formulas.or(disjuncts);
    }

    /**
     * Clausola corrispondente a una formula "a forma di clausola": un letterale o
     * una disgiunzione (comunque annidata) di letterali.
     *
     * @return la clausola, oppure vuoto se la formula contiene altri connettivi
     */
    public static Optional<Clause> fromExpr(Expr formula) {
        List<Literal> collected = new ArrayList<>();
        if (!collectDisjuncts(formula, collected)) {
            return Optional.empty();
        }
        return Optional.of(new Clause(collected));
    }

    private static boolean collectDisjuncts(Expr formula, List<Literal> accumulator) {
        if (formula instanceof Or) {
            Or disjunction = (Or) formula;
            return collectDisjuncts(disjunction.left(), accumulator)
                    && collectDisjuncts(disjunction.right(), accumulator);
        }
        if (formula instanceof Var) {
            accumulator.add(Literal.positive(((Var) formula).name()));
            return true;
        }
        if (Formulas.isLiteral(formula)) {
            accumulator.add(Literal.negative(((Var) ((Not) formula).operand()).name()));
            return true;
        }
        return false;
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Clause)) return false;
        return literals.equals(((Clause) obj).literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }

    /**
     * Formato: "P | ~Q | R", oppure "[]" per la clausola vuota.
     */
    @Override
    public String toString() {
        if (literals.isEmpty()) {
            return "[]";
        }
        return literals.stream().map(Literal::toString).collect(Collectors.joining(" | "));
    }
}

package org.prover.cnf;

import org.prover.logic.And;
import org.prover.logic.BinaryExpr;
import org.prover.logic.Expr;
import org.prover.logic.Not;
import org.prover.logic.Or;
import org.prover.logic.Var;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * CONVERTITORE CNF - Trasformazione di formule in Forma Normale Congiuntiva
 *
 * PIPELINE TRASFORMAZIONE:
 * 1. Eliminazione biimplicazioni: A <-> B ⇒ (A -> B) & (B -> A)
 * 2. Eliminazione implicazioni: A -> B ⇒ ~A | B
 * 3. Normalizzazione negazioni (De Morgan, doppia negazione) ⇒ NNF
 * 4. Distribuzione OR su AND come prodotto cartesiano di insiemi di clausole
 *
 * Le fasi 1-3 sono eseguite in un'unica visita che porta con sé la polarità
 * corrente, così le negazioni arrivano direttamente sulle variabili.
 *
 * LIMITE NOTO: la distribuzione può far crescere esponenzialmente il numero di
 * clausole; non viene introdotta alcuna variabile ausiliaria.
 */
public class CNFConverter {

    private static final Logger LOGGER = Logger.getLogger(CNFConverter.class.getName());

    //region INTERFACCIA PUBBLICA

    /**
     * Converte la formula in Forma Normale Congiuntiva.
     *
     * @param formula formula di partenza (non null)
     * @return insieme di clausole logicamente equivalente alla formula
     */
    public CNFFormula toCNF(Expr formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da convertire non può essere null");
        }
        LOGGER.fine("Inizio conversione CNF per: " + formula);

        // Fase 1: eliminazione connettivi derivati e normalizzazione negazioni
        Expr nnf = toNNF(formula);
        LOGGER.finest("Dopo normalizzazione negazioni: " + nnf);

        // Fase 2: distribuzione OR su AND
        CNFFormula result = new CNFFormula(distribute(nnf));
        LOGGER.fine("Conversione CNF completata: " + result);

        return result;
    }

    /**
     * Clausole di più formule in congiunzione, nell'ordine delle formule.
     */
    public CNFFormula toCNF(List<Expr> formulas) {
        List<Clause> clauses = new ArrayList<>();
        for (Expr formula : formulas) {
            clauses.addAll(toCNF(formula).clauses());
        }
        return new CNFFormula(clauses);
    }

    /**
     * Forma Normale Negata: solo And, Or e negazioni applicate a variabili.
     * Applicata a una formula già in NNF restituisce una formula uguale.
     */
    public Expr toNNF(Expr formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da normalizzare non può essere null");
        }
        return positive(formula);
    }

    //endregion

    //region NORMALIZZAZIONE NEGAZIONI (LEGGI DI DE MORGAN)

    /**
     * NNF di una formula in contesto positivo.
     */
    private Expr positive(Expr formula) {
        return switch (formula.type()) {
            case VAR -> formula;
            case NOT -> negative(((Not) formula).operand());
            case AND -> new And(positive(left(formula)), positive(right(formula)));
            case OR -> new Or(positive(left(formula)), positive(right(formula)));
            // A -> B ⇒ ~A | B
            case IMPLY -> new Or(negative(left(formula)), positive(right(formula)));
            // A <-> B ⇒ (~A | B) & (~B | A)
            case IFF -> new And(
                    new Or(negative(left(formula)), positive(right(formula))),
                    new Or(negative(right(formula)), positive(left(formula))));
        };
    }

    /**
     * NNF della negazione di una formula.
     */
    private Expr negative(Expr formula) {
        return switch (formula.type()) {
            case VAR -> new Not(formula);
            // ~~A ⇒ A
            case NOT -> positive(((Not) formula).operand());
            // ~(A & B) ⇒ ~A | ~B
            case AND -> new Or(negative(left(formula)), negative(right(formula)));
            // ~(A | B) ⇒ ~A & ~B
            case OR -> new And(negative(left(formula)), negative(right(formula)));
            // ~(A -> B) ⇒ A & ~B
            case IMPLY -> new And(positive(left(formula)), negative(right(formula)));
            // ~(A <-> B) ⇒ (A & ~B) | (B & ~A)
            case IFF -> new Or(
                    new And(positive(left(formula)), negative(right(formula))),
                    new And(positive(right(formula)), negative(left(formula))));
        };
    }

    private static Expr left(Expr formula) {
        return ((BinaryExpr) formula).left();
    }

    private static Expr right(Expr formula) {
        return ((BinaryExpr) formula).right();
    }

    //endregion

    //region DISTRIBUZIONE OR SU AND

    /**
     * Insieme di clausole di una formula in NNF.
     *
     * - Letterale: una clausola unitaria
     * - A & B: unione delle clausole
     * - A | B: {c1 ∪ c2 : c1 ∈ CNF(A), c2 ∈ CNF(B)}, scartando le unioni tautologiche
     */
    private Set<Clause> distribute(Expr nnf) {
        return switch (nnf.type()) {
            case VAR -> singleton(Clause.of(Literal.positive(((Var) nnf).name())));
            case NOT -> singleton(Clause.of(Literal.negative(((Var) ((Not) nnf).operand()).name())));
            case AND -> {
                Set<Clause> merged = new LinkedHashSet<>(distribute(left(nnf)));
                merged.addAll(distribute(right(nnf)));
                yield merged;
            }
            case OR -> crossProduct(distribute(left(nnf)), distribute(right(nnf)));
            default -> throw new IllegalStateException("Formula non in NNF: " + nnf);
        };
    }

    private Set<Clause> crossProduct(Set<Clause> leftClauses, Set<Clause> rightClauses) {
        Set<Clause> product = new LinkedHashSet<>();
        for (Clause first : leftClauses) {
            for (Clause second : rightClauses) {
                Clause combined = first.union(second);
                if (!combined.isTautology()) {
                    product.add(combined);
                }
            }
        }
        LOGGER.finest("Distribuzione: " + leftClauses.size() + " x " + rightClauses.size()
                + " clausole → " + product.size());
        return product;
    }

    private static Set<Clause> singleton(Clause clause) {
        Set<Clause> result = new LinkedHashSet<>();
        result.add(clause);
        return result;
    }

    //endregion
}

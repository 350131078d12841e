package org.prover.resolution;

import org.prover.cnf.CNFConverter;
import org.prover.cnf.CNFFormula;
import org.prover.cnf.Clause;
import org.prover.cnf.Literal;
import org.prover.cnf.SubsumptionPrinciple;
import org.prover.logic.Expr;
import org.prover.logic.Not;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * MOTORE DI RISOLUZIONE - Refutazione per saturazione di un insieme di clausole
 *
 * Regola di risoluzione: da (A | P) e (B | ~P) si deriva (A | B).
 *
 * ALGORITMO DI REFUTAZIONE:
 * 1. Se l'insieme contiene già la clausola vuota la refutazione è immediata
 * 2. Ad ogni iterazione si risolvono tutte le coppie non ordinate di clausole
 * 3. Si conservano solo i risolventi nuovi e non tautologici
 * 4. Ci si ferma appena si deriva [] (insoddisfacibile), quando un'iterazione
 *    non produce nulla di nuovo (saturazione, soddisfacibile) o al limite di
 *    iterazioni (esito indeterminato)
 *
 * Per la logica proposizionale la risoluzione è completa per refutazione: senza
 * limite di iterazioni un insieme insoddisfacibile porta sempre a [].
 */
public class ResolutionEngine {

    private static final Logger LOGGER = Logger.getLogger(ResolutionEngine.class.getName());

    /** Limite di iterazioni di default */
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private final boolean useSubsumption;
    private final CNFConverter converter = new CNFConverter();

    public ResolutionEngine() {
        this(false);
    }

    /**
     * @param useSubsumption se true elimina le clausole sussunte prima della saturazione
     */
    public ResolutionEngine(boolean useSubsumption) {
        this.useSubsumption = useSubsumption;
    }

    //region RISOLUZIONE TRA DUE CLAUSOLE

    /**
     * Risolve due clausole sulla variabile indicata.
     *
     * @return il risolvente (unione delle clausole senza i due letterali
     *         complementari), oppure vuoto se la variabile non compare con
     *         polarità opposte nelle due clausole
     */
    public Optional<Clause> resolve(Clause first, Clause second, String variable) {
        Literal positive = Literal.positive(variable);
        Literal negative = Literal.negative(variable);

        if (first.contains(positive) && second.contains(negative)) {
            return Optional.of(merge(first, positive, second, negative));
        }
        if (first.contains(negative) && second.contains(positive)) {
            return Optional.of(merge(first, negative, second, positive));
        }
        return Optional.empty();
    }

    private static Clause merge(Clause first, Literal removedFromFirst, Clause second, Literal removedFromSecond) {
        List<Literal> literals = new ArrayList<>();
        for (Literal literal : first.literals()) {
            if (!literal.equals(removedFromFirst)) {
                literals.add(literal);
            }
        }
        for (Literal literal : second.literals()) {
            if (!literal.equals(removedFromSecond)) {
                literals.add(literal);
            }
        }
        return new Clause(literals);
    }

    /**
     * Variabile su cui le due clausole sono risolvibili. Tra più candidate si
     * sceglie quella con il nome minore.
     */
    public Optional<String> findResolvableVariable(Clause first, Clause second) {
        // I letterali sono ordinati per variabile: il primo complementare è il minore
        for (Literal literal : first.literals()) {
            if (second.contains(literal.negate())) {
                return Optional.of(literal.variable());
            }
        }
        return Optional.empty();
    }

    //endregion

    //region REFUTAZIONE

    /**
     * Saturazione per risoluzione dell'insieme di clausole.
     *
     * @param formula       insieme di clausole da refutare
     * @param maxIterations numero massimo di giri di saturazione (> 0)
     * @return esito con i passi registrati
     */
    public RefutationResult refute(CNFFormula formula, int maxIterations) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula CNF non può essere null");
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("Il numero massimo di iterazioni deve essere positivo: " + maxIterations);
        }

        ResolutionProof proof = new ResolutionProof();

        if (formula.hasEmptyClause()) {
            LOGGER.info("Refutazione immediata: la formula contiene la clausola vuota");
            return RefutationResult.refuted(proof, 0);
        }

        CNFFormula working = useSubsumption ? new SubsumptionPrinciple().apply(formula) : formula;
        Set<Clause> clauses = new LinkedHashSet<>(working.clauses());
        LOGGER.fine("Inizio refutazione su " + clauses.size() + " clausole");

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            List<Clause> snapshot = new ArrayList<>(clauses);
            Set<Clause> produced = new LinkedHashSet<>();

            for (int i = 0; i < snapshot.size(); i++) {
                for (int j = i + 1; j < snapshot.size(); j++) {
                    Clause first = snapshot.get(i);
                    Clause second = snapshot.get(j);

                    Optional<String> variable = findResolvableVariable(first, second);
                    if (variable.isEmpty()) {
                        continue;
                    }
                    Clause resolvent = resolve(first, second, variable.get()).orElseThrow();
                    if (resolvent.isTautology() || clauses.contains(resolvent) || produced.contains(resolvent)) {
                        continue;
                    }

                    proof.recordResolutionStep(first, second, resolvent);
                    produced.add(resolvent);

                    if (resolvent.isEmpty()) {
                        LOGGER.info("Refutazione riuscita all'iterazione " + iteration
                                + " dopo " + proof.getStepCount() + " passi");
                        return RefutationResult.refuted(proof, iteration);
                    }
                }
            }

            if (produced.isEmpty()) {
                LOGGER.info("Saturazione raggiunta all'iterazione " + iteration + ": nessuna refutazione");
                return RefutationResult.saturated(proof, iteration);
            }

            clauses.addAll(produced);
            LOGGER.fine("Iterazione " + iteration + ": " + produced.size() + " nuove clausole, totale " + clauses.size());
        }

        LOGGER.warning("Limite di " + maxIterations + " iterazioni raggiunto senza esito");
        return RefutationResult.exhausted(proof, maxIterations);
    }

    /**
     * Verifica la conseguenza logica assiomi ⊨ obiettivo refutando
     * CNF(assiomi ∧ ¬obiettivo).
     */
    public RefutationResult proveEntailment(List<Expr> axioms, Expr goal, int maxIterations) {
        CNFFormula axiomClauses = converter.toCNF(axioms);
        CNFFormula negatedGoal = converter.toCNF(new Not(goal));
        return refute(axiomClauses.union(negatedGoal), maxIterations);
    }

    //endregion
}

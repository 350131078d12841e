package org.prover.evaluator;

import org.prover.ResourceLimitExceededException;
import org.prover.logic.BinaryExpr;
import org.prover.logic.Expr;
import org.prover.logic.Not;
import org.prover.logic.Var;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * VALUTATORE SEMANTICO - Tavole di verità e implicazione logica per enumerazione
 *
 * Calcola il valore di verità di una formula sotto un assegnamento e, enumerando
 * tutti i 2^n assegnamenti delle variabili (in ordine alfabetico), decide
 * tautologia, soddisfacibilità, equivalenza e conseguenza logica.
 *
 * È l'oracolo di riferimento con cui si verificano i risultati della ricerca di
 * prove; non è usato come meccanismo di ricerca.
 *
 * LIMITE DI RISORSE:
 * - Il numero di variabili libere è limitato (default {@value #DEFAULT_MAX_VARIABLES})
 * - Oltre il limite viene lanciata {@link ResourceLimitExceededException} prima di
 *   iniziare l'enumerazione
 *
 * Gli assegnamenti ricevuti dal chiamante sono trattati in sola lettura.
 */
public class Evaluator {

    private static final Logger LOGGER = Logger.getLogger(Evaluator.class.getName());

    /** Numero massimo di variabili libere accettate di default */
    public static final int DEFAULT_MAX_VARIABLES = 20;

    /** Limite superiore del contatore a 64 bit usato per enumerare 2^n assegnamenti */
    public static final int MAX_SUPPORTED_VARIABLES = 62;

    private final int maxVariables;

    public Evaluator() {
        this(DEFAULT_MAX_VARIABLES);
    }

    /**
     * @param maxVariables numero massimo di variabili per le enumerazioni (1..62)
     * @throws IllegalArgumentException se maxVariables non è positivo o supera {@link #MAX_SUPPORTED_VARIABLES}
     */
    public Evaluator(int maxVariables) {
        if (maxVariables <= 0) {
            throw new IllegalArgumentException("Il limite di variabili deve essere positivo: " + maxVariables);
        }
        if (maxVariables > MAX_SUPPORTED_VARIABLES) {
            throw new IllegalArgumentException("Il limite di variabili non può superare "
                    + MAX_SUPPORTED_VARIABLES + ": " + maxVariables);
        }
        this.maxVariables = maxVariables;
    }

    public int getMaxVariables() {
        return maxVariables;
    }

    //region VALUTAZIONE PUNTUALE

    /**
     * Valuta la formula sotto l'assegnamento dato.
     *
     * @throws UndefinedVariableException se una variabile della formula non ha valore
     */
    public boolean evaluate(Expr formula, Map<String, Boolean> assignment) {
        return switch (formula.type()) {
            case VAR -> {
                Boolean value = assignment.get(((Var) formula).name());
                if (value == null) {
                    throw new UndefinedVariableException(((Var) formula).name());
                }
                yield value;
            }
            case NOT -> !evaluate(((Not) formula).operand(), assignment);
            case AND -> evaluate(left(formula), assignment) && evaluate(right(formula), assignment);
            case OR -> evaluate(left(formula), assignment) || evaluate(right(formula), assignment);
            case IMPLY -> !evaluate(left(formula), assignment) || evaluate(right(formula), assignment);
            case IFF -> evaluate(left(formula), assignment) == evaluate(right(formula), assignment);
        };
    }

    private static Expr left(Expr formula) {
        return ((BinaryExpr) formula).left();
    }

    private static Expr right(Expr formula) {
        return ((BinaryExpr) formula).right();
    }

    //endregion

    //region PROPRIETÀ DI UNA FORMULA

    public boolean isTautology(Expr formula) {
        return findCountermodel(formula).isEmpty();
    }

    public boolean isContradiction(Expr formula) {
        return findModel(formula).isEmpty();
    }

    public boolean isSatisfiable(Expr formula) {
        return findModel(formula).isPresent();
    }

    /**
     * Primo assegnamento (in ordine di enumerazione) che rende vera la formula.
     */
    public Optional<Map<String, Boolean>> findModel(Expr formula) {
        return firstAssignment(formula.variables(), a -> evaluate(formula, a));
    }

    /**
     * Tutti gli assegnamenti che rendono vera la formula, in ordine di enumerazione.
     */
    public List<Map<String, Boolean>> findAllModels(Expr formula) {
        List<Map<String, Boolean>> models = new ArrayList<>();
        for (Map<String, Boolean> assignment : allAssignments(formula.variables())) {
            if (evaluate(formula, assignment)) {
                models.add(assignment);
            }
        }
        return models;
    }

    /**
     * Primo assegnamento che rende falsa la formula (vuoto se è una tautologia).
     */
    public Optional<Map<String, Boolean>> findCountermodel(Expr formula) {
        return firstAssignment(formula.variables(), a -> !evaluate(formula, a));
    }

    /**
     * Due formule sono equivalenti se hanno lo stesso valore sotto ogni
     * assegnamento dell'unione delle loro variabili.
     */
    public boolean isEquivalent(Expr first, Expr second) {
        Set<String> variables = new TreeSet<>(first.variables());
        variables.addAll(second.variables());
        return firstAssignment(variables, a -> evaluate(first, a) != evaluate(second, a)).isEmpty();
    }

    //endregion

    //region CONSEGUENZA LOGICA

    /**
     * Verifica se le premesse implicano semanticamente la conclusione: ogni
     * assegnamento che soddisfa tutte le premesse soddisfa anche la conclusione.
     * Con premesse vuote equivale a {@link #isTautology(Expr)}.
     */
    public boolean entails(List<Expr> premises, Expr conclusion) {
        boolean result = findEntailmentCountermodel(premises, conclusion).isEmpty();
        LOGGER.fine("Verifica conseguenza logica " + premises + " |= " + conclusion + ": " + result);
        return result;
    }

    /**
     * Assegnamento che soddisfa tutte le premesse ma non la conclusione.
     */
    public Optional<Map<String, Boolean>> findEntailmentCountermodel(List<Expr> premises, Expr conclusion) {
        if (premises.isEmpty()) {
            return findCountermodel(conclusion);
        }

        Set<String> variables = new TreeSet<>(conclusion.variables());
        for (Expr premise : premises) {
            variables.addAll(premise.variables());
        }

        return firstAssignment(variables, a -> {
            for (Expr premise : premises) {
                if (!evaluate(premise, a)) {
                    return false;
                }
            }
            return !evaluate(conclusion, a);
        });
    }

    //endregion

    //region TAVOLA DI VERITÀ

    /**
     * Riga della tavola di verità: assegnamento e valore risultante.
     */
    public static final class Row {

        /** Assegnamento della riga, nell'ordine delle variabili (immutabile) */
        private final Map<String, Boolean> assignment;

        /** Valore della formula sotto l'assegnamento */
        private final boolean value;

        public Row(Map<String, Boolean> assignment, boolean value) {
            if (assignment == null) {
                throw new IllegalArgumentException("L'assegnamento non può essere null");
            }
            this.assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
            this.value = value;
        }

        public Map<String, Boolean> getAssignment() {
            return assignment;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public String toString() {
            return assignment + " -> " + value;
        }
    }

    public List<Row> truthTable(Expr formula) {
        List<Row> rows = new ArrayList<>();
        for (Map<String, Boolean> assignment : allAssignments(formula.variables())) {
            rows.add(new Row(assignment, evaluate(formula, assignment)));
        }
        return rows;
    }

    /**
     * Tavola di verità testuale: intestazione con variabili e formula, una riga
     * per assegnamento con valori 0/1.
     */
    public String formatTruthTable(Expr formula) {
        List<String> variables = new ArrayList<>(formula.variables());

        String header = String.join(" | ", variables) + " | " + formula;
        StringBuilder sb = new StringBuilder();
        sb.append(header).append("\n");
        sb.append("-".repeat(header.length()));

        for (Row row : truthTable(formula)) {
            sb.append("\n");
            String values = variables.stream()
                    .map(v -> row.getAssignment().get(v) ? "1" : "0")
                    .collect(Collectors.joining(" | "));
            if (!values.isEmpty()) {
                sb.append(values).append(" | ");
            }
            sb.append(row.getValue() ? "1" : "0");
        }
        return sb.toString();
    }

    //endregion

    //region ENUMERAZIONE ASSEGNAMENTI

    private Optional<Map<String, Boolean>> firstAssignment(Set<String> variables,
                                                           Predicate<Map<String, Boolean>> condition) {
        for (Map<String, Boolean> assignment : allAssignments(variables)) {
            if (condition.test(assignment)) {
                return Optional.of(assignment);
            }
        }
        return Optional.empty();
    }

    /**
     * Tutti i 2^n assegnamenti delle variabili ordinate alfabeticamente, generati
     * uno alla volta. La prima variabile è la più significativa: si parte da tutte
     * false e si termina con tutte vere.
     *
     * @throws ResourceLimitExceededException se le variabili superano il limite
     */
    private Iterable<Map<String, Boolean>> allAssignments(Set<String> variables) {
        checkVariableLimit(variables.size());

        List<String> ordered = new ArrayList<>(new TreeSet<>(variables));
        int n = ordered.size();
        long total = 1L << n;

        return () -> new Iterator<>() {
            private long mask = 0;

            @Override
            public boolean hasNext() {
                return mask < total;
            }

            @Override
            public Map<String, Boolean> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Map<String, Boolean> assignment = new LinkedHashMap<>();
                for (int i = 0; i < n; i++) {
                    assignment.put(ordered.get(i), ((mask >> (n - 1 - i)) & 1L) == 1L);
                }
                mask++;
                return Collections.unmodifiableMap(assignment);
            }
        };
    }

    private void checkVariableLimit(int variableCount) {
        if (variableCount > maxVariables) {
            LOGGER.warning("Enumerazione rifiutata: " + variableCount + " variabili, limite " + maxVariables);
            throw new ResourceLimitExceededException("variabili", maxVariables, variableCount);
        }
    }

    //endregion
}

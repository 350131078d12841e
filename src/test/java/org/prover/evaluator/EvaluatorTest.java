package org.prover.evaluator;

import org.junit.jupiter.api.Test;
import org.prover.ResourceLimitExceededException;
import org.prover.logic.Expr;
import org.prover.logic.Formulas;
import org.prover.logic.Var;
import org.prover.parser.FormulaParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Verifica la valutazione per tavole di verità e la conseguenza semantica. */
public class EvaluatorTest {

    private final Evaluator evaluator = new Evaluator();

    private static Expr parse(String text) {
        return FormulaParser.parse(text);
    }

    private static List<Expr> parseAll(String... texts) {
        return FormulaParser.parseAll(List.of(texts));
    }

    @Test void testEvaluateConnectives() {
        Map<String, Boolean> assignment = Map.of("P", true, "Q", false);
        assertThat(evaluator.evaluate(parse("P & Q"), assignment), is(false));
        assertThat(evaluator.evaluate(parse("P | Q"), assignment), is(true));
        assertThat(evaluator.evaluate(parse("P -> Q"), assignment), is(false));
        assertThat(evaluator.evaluate(parse("Q -> P"), assignment), is(true));
        assertThat(evaluator.evaluate(parse("P <-> Q"), assignment), is(false));
        assertThat(evaluator.evaluate(parse("~Q"), assignment), is(true));
    }

    @Test void testUndefinedVariable() {
        UndefinedVariableException e = assertThrows(UndefinedVariableException.class,
                () -> evaluator.evaluate(parse("P & R"), Map.of("P", true)));
        assertThat(e.getVariable(), is("R"));
    }

    @Test void testFormulaProperties() {
        assertThat(evaluator.isTautology(parse("P | ~P")), is(true));
        assertThat(evaluator.isTautology(parse("P | Q")), is(false));
        assertThat(evaluator.isContradiction(parse("P & ~P")), is(true));
        assertThat(evaluator.isSatisfiable(parse("P & ~Q")), is(true));
        assertThat(evaluator.isEquivalent(parse("P -> Q"), parse("~P | Q")), is(true));
        assertThat(evaluator.isEquivalent(parse("P -> Q"), parse("Q -> P")), is(false));
        assertThat(evaluator.isEquivalent(parse("P"), parse("P & (Q | ~Q)")), is(true));
    }

    @Test void testModels() {
        Optional<Map<String, Boolean>> model = evaluator.findModel(parse("P & ~Q"));
        assertThat(model.isPresent(), is(true));
        assertThat(model.get(), is(Map.of("P", true, "Q", false)));
        assertThat(evaluator.findAllModels(parse("P | Q")).size(), is(3));
        assertThat(evaluator.findCountermodel(parse("P -> Q")).get(), is(Map.of("P", true, "Q", false)));
        assertThat(evaluator.findCountermodel(parse("P | ~P")).isPresent(), is(false));
    }

    @Test void testEntailment() {
        assertThat(evaluator.entails(parseAll("P", "P -> Q"), parse("Q")), is(true));
        assertThat(evaluator.entails(parseAll("P -> Q", "~Q"), parse("~P")), is(true));
        assertThat(evaluator.entails(parseAll("P"), parse("Q")), is(false));
        assertThat(evaluator.entails(parseAll("P | Q", "P -> R", "Q -> R"), parse("R")), is(true));
        assertThat(evaluator.entails(parseAll("P", "~P"), parse("Q")), is(true));
        assertThat(evaluator.entails(List.of(), parse("P -> P")), is(true));
        assertThat(evaluator.entails(List.of(), parse("P")), is(false));
    }

    @Test void testEntailmentCountermodel() {
        Optional<Map<String, Boolean>> countermodel =
                evaluator.findEntailmentCountermodel(parseAll("P | Q"), parse("P"));
        assertThat(countermodel.get(), is(Map.of("P", false, "Q", true)));
    }

    /** La prima variabile in ordine alfabetico è il bit più significativo. */
    @Test void testTruthTableOrder() {
        List<Evaluator.Row> rows = evaluator.truthTable(parse("Q & P"));
        assertThat(rows.size(), is(4));
        assertThat(new ArrayList<>(rows.get(0).getAssignment().keySet()), contains("P", "Q"));
        assertThat(rows.get(1).getAssignment(), is(Map.of("P", false, "Q", true)));
        assertThat(rows.get(2).getAssignment(), is(Map.of("P", true, "Q", false)));
        assertThat(rows.get(3).getValue(), is(true));
    }

    @Test void testFormatTruthTable() {
        String table = evaluator.formatTruthTable(parse("P -> Q"));
        String[] lines = table.split("\n");
        assertThat(lines[0], is("P | Q | P -> Q"));
        assertThat(lines[1], startsWith("---"));
        assertThat(lines.length, is(6));
        assertThat(lines[2], is("0 | 0 | 1"));
        assertThat(lines[4], is("1 | 0 | 0"));
    }

    @Test void testVariableLimit() {
        List<Expr> atoms = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            atoms.add(new Var("X" + i));
        }
        Evaluator small = new Evaluator(4);
        ResourceLimitExceededException e = assertThrows(ResourceLimitExceededException.class,
                () -> small.isSatisfiable(Formulas.and(atoms)));
        assertThat(e.getLimit(), is(4));
        assertThat(e.getRequested(), is(5));
        assertThat(new Evaluator(5).isSatisfiable(Formulas.and(atoms)), is(true));
        assertThrows(IllegalArgumentException.class, () -> new Evaluator(0));
        assertThrows(IllegalArgumentException.class, () -> new Evaluator(63));
        assertThat(new Evaluator(Evaluator.MAX_SUPPORTED_VARIABLES).getMaxVariables(), is(62));
    }
}

package org.prover.cnf;

import org.junit.jupiter.api.Test;
import org.prover.evaluator.Evaluator;
import org.prover.logic.Expr;
import org.prover.parser.FormulaParser;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Verifica forma normale negativa, forma a clausole e sussunzione. */
public class CNFConverterTest {

    private static final List<String> BATTERY = List.of(
            "P", "~P", "P -> Q", "P <-> Q", "~(P <-> Q)", "~(P & (Q | ~R))",
            "(P -> Q) -> R", "(P & Q) | (R & S)", "~~(P | ~Q)", "(A <-> B) <-> C",
            "P | ~P", "P & ~P", "((P -> Q) & (Q -> R)) -> (P -> R)");

    private final CNFConverter converter = new CNFConverter();
    private final Evaluator evaluator = new Evaluator();

    private static Expr parse(String text) {
        return FormulaParser.parse(text);
    }

    @Test void testSimpleConversions() {
        assertThat(converter.toCNF(parse("P -> Q")), hasToString("(~P | Q)"));
        assertThat(converter.toCNF(parse("~(P | Q)")), hasToString("(~P) & (~Q)"));
        assertThat(converter.toCNF(parse("P | (Q & R)")), hasToString("(P | Q) & (P | R)"));
        assertThat(converter.toCNF(parse("~~P")), hasToString("(P)"));
    }

    @Test void testTautologyHasNoClauses() {
        CNFFormula formula = converter.toCNF(parse("P | ~P"));
        assertThat(formula.isEmpty(), is(true));
        assertThat(formula, hasToString("TRUE"));
    }

    @Test void testContradictionKeepsUnitClauses() {
        CNFFormula formula = converter.toCNF(parse("P & ~P"));
        assertThat(formula.size(), is(2));
        assertThat(formula.unitClauses().size(), is(2));
        assertThat(formula.variables().contains("P"), is(true));
    }

    @Test void testNnfHasOnlyLiteralNegations() {
        for (String source : BATTERY) {
            Expr nnf = converter.toNNF(parse(source));
            for (Expr sub : nnf.subformulas()) {
                assertThat(source, sub.type() == Expr.Type.IMPLY || sub.type() == Expr.Type.IFF, is(false));
                if (sub.type() == Expr.Type.NOT) {
                    assertThat(source, sub.children().get(0).type(), is(Expr.Type.VAR));
                }
            }
        }
    }

    @Test void testNnfIsIdempotent() {
        for (String source : BATTERY) {
            Expr nnf = converter.toNNF(parse(source));
            assertThat(source, converter.toNNF(nnf), is(nnf));
        }
    }

    /** Le variabili sentinella compaiono solo nelle formule vuote: l'equivalenza sull'unione delle variabili vale. */
    @Test void testCnfPreservesMeaning() {
        for (String source : BATTERY) {
            Expr formula = parse(source);
            Expr cnf = converter.toCNF(formula).toExpr();
            assertThat(source, evaluator.isEquivalent(formula, cnf), is(true));
            assertThat(source, evaluator.isEquivalent(formula, converter.toNNF(formula)), is(true));
        }
    }

    @Test void testCnfTwiceIsEquivalent() {
        for (String source : BATTERY) {
            Expr once = converter.toCNF(parse(source)).toExpr();
            Expr twice = converter.toCNF(once).toExpr();
            assertThat(source, evaluator.isEquivalent(once, twice), is(true));
        }
    }

    @Test void testCnfOfList() {
        CNFFormula formula = converter.toCNF(List.of(parse("P"), parse("P -> Q")));
        assertThat(formula, hasToString("(P) & (~P | Q)"));
        assertThrows(IllegalArgumentException.class, () -> converter.toCNF((Expr) null));
    }

    @Test void testClauseAlgebra() {
        Clause first = Clause.of(Literal.negative("Q"), Literal.positive("P"));
        assertThat(first, hasToString("P | ~Q"));
        assertThat(first.isTautology(), is(false));
        assertThat(first.union(Clause.of(Literal.positive("Q"))).isTautology(), is(true));
        assertThat(Clause.of(Literal.positive("P")).subsumes(first), is(true));
        assertThat(first.subsumes(Clause.of(Literal.positive("P"))), is(false));
        assertThat(Clause.EMPTY, hasToString("[]"));
        assertThat(Clause.EMPTY.toExpr().variables().contains(Clause.FALSE_SENTINEL), is(true));
        assertThat(evaluator.isContradiction(Clause.EMPTY.toExpr()), is(true));
        assertThat(evaluator.isTautology(CNFFormula.TRUE.toExpr()), is(true));
    }

    @Test void testClauseFromExpr() {
        assertThat(Clause.fromExpr(parse("P | (~Q | R)")).get(),
                is(Clause.of(Literal.positive("P"), Literal.negative("Q"), Literal.positive("R"))));
        assertThat(Clause.fromExpr(parse("P & Q")).isPresent(), is(false));
        assertThat(Clause.fromExpr(parse("~~P")).isPresent(), is(false));
    }

    @Test void testSubsumption() {
        CNFFormula formula = converter.toCNF(parse("P & (~R | ~Q) & (P | Q | ~R) & (A | ~R | B | ~Q) & (R | ~Q)"));
        SubsumptionPrinciple subsumption = new SubsumptionPrinciple();
        CNFFormula optimized = subsumption.apply(formula);

        assertThat(optimized, hasToString("(P) & (~Q | ~R) & (~Q | R)"));
        assertThat(subsumption.getEliminatedClausesCount(), is(2));
        assertThat(subsumption.getOriginalClausesCount(), is(5));
        assertThat(evaluator.isEquivalent(formula.toExpr(), optimized.toExpr()), is(true));

        String report = subsumption.getOptimizationInfo();
        assertThat(report, startsWith("=== RAPPORTO SUSSUNZIONE ==="));
        assertThat(report, containsString("Clausole eliminate: 2"));
        assertThat(report, containsString("Clausole originali: 5"));
        assertThat(report, containsString("SUSSUNZIONE: ("));
    }

    @Test void testImmutableCollectionsAccepted() {
        CNFFormula formula = new CNFFormula(List.of(Clause.of(Literal.positive("P"))));
        assertThat(formula.size(), is(1));
        assertThat(new Clause(Set.of(Literal.positive("P"), Literal.negative("Q"))), hasToString("P | ~Q"));
        assertThrows(IllegalArgumentException.class, () -> new CNFFormula(Arrays.asList(Clause.EMPTY, null)));
        assertThrows(IllegalArgumentException.class,
                () -> new Clause(Arrays.asList(Literal.positive("P"), null)));
    }
}

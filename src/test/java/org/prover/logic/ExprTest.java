package org.prover.logic;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Verifica l'albero delle formule: uguaglianza, hashing, visita e stampa. */
public class ExprTest {

    private static final Var P = new Var("P");
    private static final Var Q = new Var("Q");
    private static final Var R = new Var("R");

    @Test void testCommutativeConnectives() {
        assertThat(new And(P, Q), is(new And(Q, P)));
        assertThat(new And(P, Q).hashCode(), is(new And(Q, P).hashCode()));
        assertThat(new Or(P, Q), is(new Or(Q, P)));
        assertThat(new Or(P, Q).hashCode(), is(new Or(Q, P).hashCode()));
        assertThat(new Iff(P, Q), is(new Iff(Q, P)));
        assertThat(new Iff(P, Q).hashCode(), is(new Iff(Q, P).hashCode()));
    }

    @Test void testImplicationIsOrdered() {
        assertThat(new Imply(P, Q), not(new Imply(Q, P)));
        assertThat(new Imply(P, Q), is(new Imply(P, Q)));
    }

    @Test void testDifferentConnectivesAreDistinct() {
        assertThat(new And(P, Q), not(new Or(P, Q)));
        assertThat(new Iff(P, Q), not(new Imply(P, Q)));
        assertThat(new Not(P), not((Expr) P));
    }

    /** Scambi commutativi annidati risultano uguali a ogni livello. */
    @Test void testNestedCommutativeEquality() {
        Expr first = new And(new Or(P, Q), new Not(R));
        Expr second = new And(new Not(R), new Or(Q, P));
        assertThat(first, is(second));
        assertThat(first.hashCode(), is(second.hashCode()));
        assertThat(Set.of(first).contains(second), is(true));
    }

    @Test void testToString() {
        assertThat(P, hasToString("P"));
        assertThat(new Not(P), hasToString("~P"));
        assertThat(new Not(new And(P, Q)), hasToString("~(P & Q)"));
        assertThat(new Imply(new And(P, Q), R), hasToString("(P & Q) -> R"));
        assertThat(new Iff(new Not(P), new Or(Q, R)), hasToString("~P <-> (Q | R)"));
    }

    @Test void testVariablesDepthAndSize() {
        Expr formula = new Imply(new And(P, Q), new Or(Q, new Not(R)));
        assertThat(formula.variables(), contains("P", "Q", "R"));
        assertThat(P.depth(), is(0));
        assertThat(formula.depth(), is(3));
        assertThat(formula.size(), is(8));
        assertThat(formula.subformulas().get(0), is(formula));
        assertThat(formula.subformulas().size(), is(8));
    }

    @Test void testSubstitute() {
        Expr formula = new Imply(P, new And(P, Q));
        Expr replaced = formula.substitute(Map.of("P", new Not(R)));
        assertThat(replaced, is(new Imply(new Not(R), new And(new Not(R), Q))));
        assertThat(formula.substitute(Map.of()), is(formula));
    }

    @Test void testVariableNameValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Var(null));
        assertThrows(IllegalArgumentException.class, () -> new Var("   "));
        assertThat(new Var(" P "), is(P));
        assertThrows(IllegalArgumentException.class, () -> new And(P, null));
        assertThrows(IllegalArgumentException.class, () -> new Not(null));
    }

    @Test void testNegateRemovesDoubleNegation() {
        assertThat(Formulas.negate(P), is(new Not(P)));
        assertThat(Formulas.negate(new Not(P)), is(P));
        assertThat(Formulas.isLiteral(new Not(P)), is(true));
        assertThat(Formulas.isLiteral(new Not(new Not(P))), is(false));
    }

    @Test void testNaryConstructorsFoldLeft() {
        assertThat(Formulas.and(P, Q, R), is(new And(new And(P, Q), R)));
        assertThat(Formulas.or(List.of(P)), is(P));
        assertThrows(IllegalArgumentException.class, () -> Formulas.or(List.of()));
    }
}

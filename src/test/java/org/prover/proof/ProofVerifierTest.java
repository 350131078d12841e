package org.prover.proof;

import org.junit.jupiter.api.Test;
import org.prover.logic.Expr;
import org.prover.parser.FormulaParser;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Verifica il controllo strutturale dei passi di prova. */
public class ProofVerifierTest {

    private final ProofVerifier verifier = new ProofVerifier();

    private static Expr parse(String text) {
        return FormulaParser.parse(text);
    }

    private static List<Expr> parseAll(String... texts) {
        return FormulaParser.parseAll(List.of(texts));
    }

    @Test void testValidChain() {
        ProofState state = new ProofState(parseAll("P", "P -> Q", "Q -> R"), parse("R"));
        state.addStep(parse("Q"), "modus_ponens", List.of(1, 2), "MP");
        state.addStep(parse("R"), "modus_ponens", List.of(4, 3), "MP");
        ProofVerifier.VerificationResult result = verifier.verify(state);
        assertThat(result.getStatus(), is(ProofVerifier.Status.VALID));
        assertThat(result.isValid(), is(true));
        assertThat(result.getErrors().isEmpty(), is(true));
    }

    @Test void testGoalMissingIsIncomplete() {
        ProofState state = new ProofState(parseAll("P", "P -> Q"), parse("R"));
        state.addStep(parse("Q"), "modus_ponens", List.of(1, 2), "MP");
        assertThat(verifier.verify(state).getStatus(), is(ProofVerifier.Status.INCOMPLETE));
    }

    @Test void testGoalOnlyUnderAssumptionIsIncomplete() {
        ProofState state = new ProofState(parseAll("P -> Q"), parse("Q"));
        state.introduceAssumption(parse("P"), parse("Q"));
        state.addStep(parse("Q"), "modus_ponens", List.of(2, 1), "MP");
        assertThat(verifier.verify(state).getStatus(), is(ProofVerifier.Status.INCOMPLETE));
    }

    @Test void testPremiseMustPrecedeStep() {
        ProofState state = new ProofState(parseAll("P", "P -> Q"), parse("Q"));
        state.addStep(parse("Q"), "modus_ponens", List.of(1, 3), "MP");
        state.addStep(parse("R"), "test", List.of(0), "");
        ProofVerifier.VerificationResult result = verifier.verify(state);
        assertThat(result.getStatus(), is(ProofVerifier.Status.INVALID));
        assertThat(result.getErrors(), hasSize(2));
        assertThat(result.getErrors().get(0), containsString("Passo 3: la premessa 3"));
        assertThat(result.getErrors().get(1), containsString("Passo 4: la premessa 0"));
    }

    @Test void testAxiomStepsAreChecked() {
        ProofState state = new ProofState(parseAll("P"), parse("Q"));
        state.addStep(parse("Q"), "axiom", List.of(), "");
        state.addStep(parse("P"), "axiom", List.of(1), "");
        ProofVerifier.VerificationResult result = verifier.verify(state);
        assertThat(result.getStatus(), is(ProofVerifier.Status.INVALID));
        assertThat(result.getErrors(), contains(
                "Passo 2: Q non è un assioma",
                "Passo 3: un assioma non ha premesse"));
    }

    @Test void testConditionalProofMayCiteDischargedScope() {
        ProofState state = new ProofState(parseAll("P -> Q", "Q -> R"), parse("P -> R"));
        state.introduceAssumption(parse("P"), parse("R"));
        state.addStep(parse("Q"), "modus_ponens", List.of(3, 1), "MP");
        state.addStep(parse("R"), "modus_ponens", List.of(4, 2), "MP");
        state.conditionalProof(parse("P"), parse("R"));
        assertThat(verifier.verify(state).getStatus(), is(ProofVerifier.Status.VALID));
    }

    @Test void testClosedScopeCannotBeCited() {
        ProofState state = new ProofState(parseAll("P -> Q"), parse("Q"));
        state.introduceAssumption(parse("P"), null);
        state.addStep(parse("Q"), "modus_ponens", List.of(2, 1), "MP");
        state.dischargeAssumption();
        state.addStep(parse("Q"), "repeat", List.of(3), "");
        ProofVerifier.VerificationResult result = verifier.verify(state);
        assertThat(result.getStatus(), is(ProofVerifier.Status.INVALID));
        assertThat(result.getErrors().get(0), containsString("ipotesi chiusa (livello 1)"));
    }

    @Test void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> verifier.verify(null));
        assertThrows(IllegalArgumentException.class,
                () -> new ProofVerifier.VerificationResult(ProofVerifier.Status.INVALID, List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new ProofVerifier.VerificationResult(ProofVerifier.Status.VALID, List.of("x")));
    }
}

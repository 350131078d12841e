package org.prover.search;

import org.junit.jupiter.api.Test;
import org.prover.evaluator.Evaluator;
import org.prover.logic.Expr;
import org.prover.parser.FormulaParser;
import org.prover.proof.ProofState;
import org.prover.proof.ProofStatus;
import org.prover.proof.ProofStep;
import org.prover.proof.ProofVerifier;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.core.Is.is;

/** Verifica la ricerca di prove con ogni strategia. */
public class ProofSearcherTest {

    /** Assiomi, goal e se gli assiomi implicano il goal. */
    private static final List<String[]> BATTERY = List.of(
            new String[]{"P; P -> Q", "Q"},
            new String[]{"P -> Q; ~Q", "~P"},
            new String[]{"P & Q", "P"},
            new String[]{"~~P", "P"},
            new String[]{"P", "Q"},
            new String[]{"P; P -> Q; Q -> R", "R"},
            new String[]{"P | Q; ~P", "Q"},
            new String[]{"P | Q; P -> R; Q -> R", "R"},
            new String[]{"P -> Q; Q -> R", "P -> R"},
            new String[]{"P", "P | Q"},
            new String[]{"P; Q", "P & Q"},
            new String[]{"P | Q", "P"},
            new String[]{"P -> Q", "Q -> P"},
            new String[]{"", "P | ~P"},
            new String[]{"P; ~P", "Q"},
            new String[]{"P <-> Q; P", "Q"},
            new String[]{"~(P & Q); P", "~Q"},
            new String[]{"P & Q -> R; P; Q", "R"},
            new String[]{"P -> Q", "~Q -> ~P"},
            new String[]{"A -> B; B -> C; C -> D; A", "D"},
            new String[]{"P -> Q; P -> ~Q", "~P"},
            new String[]{"P & Q", "R"},
            new String[]{"P -> Q; Q", "P"});

    private static Expr parse(String text) {
        return FormulaParser.parse(text);
    }

    private static List<Expr> axioms(String text) {
        return FormulaParser.parseAxioms(text, ";");
    }

    private static SearchResult search(SearchConfig config, String axioms, String goal) {
        return new ProofSearcher(config).search(axioms(axioms), parse(goal));
    }

    private static SearchResult forward(String axioms, String goal) {
        return search(SearchConfig.defaults(), axioms, goal);
    }

    private static SearchConfig strategy(SearchStrategy strategy) {
        return SearchConfig.builder().strategy(strategy).build();
    }

    private static List<String> ruleNames(SearchResult result) {
        return result.getProofState().getSteps().stream()
                .map(ProofStep::getRuleName)
                .collect(Collectors.toList());
    }

    //region SCENARI

    @Test void testModusPonensScenario() {
        SearchResult result = forward("P; P -> Q", "Q");
        assertThat(result.isSuccess(), is(true));
        assertThat(result.getProofState().getStatus(), is(ProofStatus.SUCCESS));
        assertThat(result.getProofState().getDerivedStepCount(), lessThanOrEqualTo(2));
        assertThat(ruleNames(result), hasItem("modus_ponens"));
    }

    @Test void testModusTollensScenario() {
        SearchResult result = forward("P -> Q; ~Q", "~P");
        assertThat(result.isSuccess(), is(true));
        assertThat(ruleNames(result), contains("axiom", "axiom", "modus_tollens"));
    }

    @Test void testAndEliminationScenario() {
        SearchResult result = forward("P & Q", "P");
        assertThat(result.isSuccess(), is(true));
        assertThat(ruleNames(result), contains("axiom", "and_elim_left"));
    }

    @Test void testDoubleNegationScenario() {
        SearchResult result = forward("~~P", "P");
        assertThat(result.isSuccess(), is(true));
        assertThat(ruleNames(result), contains("axiom", "double_neg_elim"));
    }

    @Test void testUnprovableGoalFails() {
        SearchResult result = forward("P", "Q");
        assertThat(result.isSuccess(), is(false));
        assertThat(result.getProofState().getStatus(), is(ProofStatus.FAILED));
        assertThat(result.getStepsExplored(), is(0));
        assertThat(result.getSearchPath().get(0), containsString("non è conseguenza logica"));
    }

    /** Senza controllo semantico preliminare la ricerca deve comunque terminare e fallire. */
    @Test void testUnprovableGoalFailsWithoutSemanticCheck() {
        for (SearchStrategy strategy : SearchStrategy.values()) {
            SearchConfig config = SearchConfig.builder().strategy(strategy).useSemanticCheck(false).build();
            SearchResult result = search(config, "P", "Q");
            assertThat(strategy.name(), result.isSuccess(), is(false));
            assertThat(strategy.name(), result.getProofState().getStatus(), is(ProofStatus.FAILED));
        }
    }

    @Test void testChainedModusPonensScenario() {
        SearchResult result = forward("P; P -> Q; Q -> R", "R");
        ProofState state = result.getProofState();
        assertThat(result.isSuccess(), is(true));
        assertThat(state.getStepCount(), is(5));
        assertThat(ruleNames(result), contains("axiom", "axiom", "axiom", "modus_ponens", "modus_ponens"));
        assertThat(state.getSteps().get(3).getFormula(), is(parse("Q")));
        assertThat(state.getSteps().get(4).getPremiseSteps(), contains(4, 3));
    }

    //endregion

    //region STRATEGIE

    @Test void testGoalAmongAxioms() {
        for (SearchStrategy strategy : SearchStrategy.values()) {
            SearchResult result = search(strategy(strategy), "P; Q", "Q");
            assertThat(result.isSuccess(), is(true));
            assertThat(result.getStepsExplored(), is(0));
        }
    }

    @Test void testBackwardChaining() {
        SearchResult result = search(strategy(SearchStrategy.BACKWARD), "P; P -> Q; Q -> R", "R");
        assertThat(result.isSuccess(), is(true));
        assertThat(result.getStrategy(), is(SearchStrategy.BACKWARD));
        assertThat(result.getProofState().getStepCount(), is(5));
        assertThat(ruleNames(result), contains("axiom", "axiom", "axiom", "modus_ponens", "modus_ponens"));
    }

    @Test void testBackwardConditionalProof() {
        SearchConfig config = SearchConfig.builder()
                .strategy(SearchStrategy.BACKWARD)
                .refutationFallback(false)
                .build();
        SearchResult result = search(config, "P -> Q; Q -> R", "P -> R");
        ProofState state = result.getProofState();
        assertThat(result.isSuccess(), is(true));
        assertThat(ruleNames(result), hasItem("assumption"));

        ProofStep last = state.getSteps().get(state.getStepCount() - 1);
        assertThat(last.getFormula(), is(parse("P -> R")));
        assertThat(last.getRuleName(), is("imply_intro"));
        assertThat(last.getAssumptionLevel(), is(0));
        assertThat(state.getAssumptionLevel(), is(0));
        assertThat(state.formatProof(), containsString("  4. Q  [modus_ponens, 3, 1]"));
    }

    @Test void testBackwardProvesTautologyWithoutAxioms() {
        SearchConfig config = SearchConfig.builder()
                .strategy(SearchStrategy.BACKWARD)
                .refutationFallback(false)
                .build();
        SearchResult result = search(config, "", "P -> P");
        assertThat(result.isSuccess(), is(true));
        assertThat(ruleNames(result), contains("assumption", "imply_intro"));
    }

    @Test void testHybridSearch() {
        SearchResult result = search(strategy(SearchStrategy.HYBRID), "P; P -> Q; Q -> R", "R");
        assertThat(result.isSuccess(), is(true));
        assertThat(result.getProofState().getStepCount(), is(5));
        assertThat(result.getSearchPath(), hasItem("Frontiere incontrate al giro 2"));
    }

    @Test void testHybridDecomposesConjunctiveGoal() {
        SearchConfig config = SearchConfig.builder()
                .strategy(SearchStrategy.HYBRID)
                .refutationFallback(false)
                .build();
        SearchResult result = search(config, "P; P -> Q", "P & Q");
        assertThat(result.isSuccess(), is(true));
        assertThat(ruleNames(result), contains("axiom", "axiom", "modus_ponens", "and_intro"));
    }

    @Test void testDecompose() {
        assertThat(ProofSearcher.decompose(parse("P & Q")), contains(parse("P"), parse("Q")));
        assertThat(ProofSearcher.decompose(parse("P -> Q")), contains(parse("Q")));
        assertThat(ProofSearcher.decompose(parse("P | Q")).isEmpty(), is(true));
    }

    //endregion

    //region ORACOLO SEMANTICO

    /** Ogni strategia concorda con la conseguenza per tavole di verità su tutta la batteria. */
    @Test void testSearchAgreesWithEntailment() {
        Evaluator evaluator = new Evaluator();
        for (SearchStrategy strategy : SearchStrategy.values()) {
            for (String[] problem : BATTERY) {
                boolean expected = evaluator.entails(axioms(problem[0]), parse(problem[1]));
                SearchResult result = search(strategy(strategy), problem[0], problem[1]);
                assertThat(strategy + " " + problem[0] + " ⊢ " + problem[1], result.isSuccess(), is(expected));
            }
        }
    }

    /** Senza controllo preliminare non viene mai prodotta una prova scorretta. */
    @Test void testSearchIsSoundWithoutSemanticCheck() {
        Evaluator evaluator = new Evaluator();
        for (SearchStrategy strategy : SearchStrategy.values()) {
            SearchConfig config = SearchConfig.builder().strategy(strategy).useSemanticCheck(false).build();
            for (String[] problem : BATTERY) {
                boolean expected = evaluator.entails(axioms(problem[0]), parse(problem[1]));
                SearchResult result = search(config, problem[0], problem[1]);
                assertThat(strategy + " " + problem[0] + " ⊢ " + problem[1], result.isSuccess(), is(expected));
            }
        }
    }

    /** Ogni prova trovata supera il controllo strutturale dei passi. */
    @Test void testFoundProofsPassVerification() {
        ProofVerifier verifier = new ProofVerifier();
        for (SearchStrategy strategy : SearchStrategy.values()) {
            for (String[] problem : BATTERY) {
                SearchResult result = search(strategy(strategy), problem[0], problem[1]);
                ProofVerifier.VerificationResult verification = verifier.verify(result.getProofState());
                String label = strategy + " " + problem[0] + " ⊢ " + problem[1] + " " + verification;
                assertThat(label, verification.getErrors().isEmpty(), is(true));
                assertThat(label, verification.isValid(), is(result.isSuccess()));
            }
        }
    }

    @Test void testProofByCasesUsesRefutation() {
        SearchResult result = forward("P | Q; P -> R; Q -> R", "R");
        assertThat(result.isSuccess(), is(true));
        ProofStep last = result.getProofState().getSteps().get(result.getProofState().getStepCount() - 1);
        assertThat(last.getRuleName(), is(ProofSearcher.REFUTATION_RULE));
        assertThat(last.getPremiseSteps(), contains(1, 2, 3));
        assertThat(result.getStatistics().getRefutationSteps() > 0, is(true));
    }

    /** La prova per casi richiede un'ipotesi scaricata per ogni disgiunto: il concatenamento in avanti da solo non la trova. */
    @Test void testProofByCasesNotDerivableByForwardChainingAlone() {
        SearchConfig config = SearchConfig.builder()
                .strategy(SearchStrategy.FORWARD)
                .refutationFallback(false)
                .build();
        SearchResult result = search(config, "P | Q; P -> R; Q -> R", "R");
        assertThat(result.isSuccess(), is(false));
        assertThat(result.getProofState().getStatus(), is(ProofStatus.FAILED));
        assertThat(result.getProofState().isKnown(parse("R")), is(false));
    }

    //endregion

    //region CONFIGURAZIONE

    @Test void testExcludedRules() {
        SearchConfig config = SearchConfig.builder()
                .excludeRule("modus_ponens")
                .refutationFallback(false)
                .build();
        SearchResult result = search(config, "P; P -> Q", "Q");
        assertThat(result.isSuccess(), is(false));
        assertThat(result.getProofState().getStatus(), is(ProofStatus.FAILED));

        SearchConfig withFallback = config.toBuilder().refutationFallback(true).build();
        SearchResult rescued = search(withFallback, "P; P -> Q", "Q");
        assertThat(rescued.isSuccess(), is(true));
        assertThat(ruleNames(rescued), contains("axiom", "axiom", ProofSearcher.REFUTATION_RULE));
    }

    @Test void testRulePriorityOrdersCandidates() {
        SearchConfig plain = SearchConfig.builder().maxBranching(1).build();
        SearchResult result = search(plain, "A & B; B -> C", "C");
        assertThat(ruleNames(result), contains("axiom", "axiom", "and_elim_left", "and_elim_right", "modus_ponens"));

        SearchConfig prioritized = plain.toBuilder().rulePriority("and_elim_right", 5.0).build();
        SearchResult faster = search(prioritized, "A & B; B -> C", "C");
        assertThat(ruleNames(faster), contains("axiom", "axiom", "and_elim_right", "modus_ponens"));
        assertThat(faster.getStepsExplored(), is(2));
    }

    @Test void testSemanticCheckSkippedOverVariableLimit() {
        SearchConfig config = SearchConfig.builder().maxVariables(1).build();
        SearchResult result = search(config, "P; P -> Q", "Q");
        assertThat(result.isSuccess(), is(true));
        assertThat(result.getSearchPath().get(0), containsString("Verifica semantica saltata"));
    }

    @Test void testStatisticsAndFormatting() {
        SearchResult result = forward("P; P -> Q; Q -> R", "R");
        SearchStatistics statistics = result.getStatistics();
        assertThat(statistics.getIterations(), is(2));
        assertThat(statistics.getStepsAdded(), is(2));
        assertThat(statistics.isTimerStopped(), is(true));
        assertThat(result.getStepsExplored(), is(2));
        assertThat(result.getElapsed(), is(statistics.getElapsed()));

        String text = result.formatResult();
        assertThat(text, containsString("Ricerca riuscita"));
        assertThat(text, containsString("Passi esplorati: 2"));
        assertThat(text, containsString("5. R  [modus_ponens, 4, 3]"));
        assertThat(forward("P", "Q").formatResult(), containsString("Ricerca fallita"));
    }

    @Test void testSearcherIsReusable() {
        ProofSearcher searcher = new ProofSearcher();
        SearchResult first = searcher.search(axioms("P; P -> Q"), parse("Q"));
        SearchResult second = searcher.search(axioms("P; P -> Q"), parse("Q"));
        assertThat(first.getProofState() == second.getProofState(), is(false));
        assertThat(second.getProofState().getStepCount(), is(3));
    }

    //endregion
}

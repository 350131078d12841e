package org.prover.search;

import org.prover.ResourceLimitExceededException;
import org.prover.evaluator.Evaluator;
import org.prover.logic.And;
import org.prover.logic.Expr;
import org.prover.logic.Imply;
import org.prover.proof.ProofState;
import org.prover.proof.ProofStatus;
import org.prover.resolution.RefutationResult;
import org.prover.resolution.ResolutionEngine;
import org.prover.rules.Rule;
import org.prover.rules.RuleRegistry;
import org.prover.rules.RuleResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * RICERCATORE DI PROVE - Costruzione automatica di dimostrazioni
 *
 * FLUSSO DI UNA RICERCA:
 * 1. Obiettivo già tra gli assiomi: successo immediato
 * 2. Verifica semantica (opzionale): se gli assiomi non implicano l'obiettivo
 *    la ricerca fallisce subito, senza esplorare
 * 3. Strategia configurata (avanti, indietro o ibrida)
 * 4. Refutazione per risoluzione di riserva (opzionale)
 * 5. Altrimenti stato FAILED
 *
 * RICERCA IN AVANTI:
 * Ad ogni iterazione raccoglie le applicazioni libere e quelle dirette
 * all'obiettivo, le ordina per priorità della regola (più un bonus se la
 * conclusione è l'obiettivo) e accetta al più maxBranching conclusioni nuove.
 * Le conclusioni delle regole di introduzione sono ammesse solo se sono
 * sottoformule dell'obiettivo o di una formula nota.
 *
 * RICERCA ALL'INDIETRO:
 * Riduce ricorsivamente l'obiettivo ai sotto-obiettivi proposti dalle regole;
 * per gli obiettivi P -> Q prova anche Q sotto l'ipotesi P. I passi sono
 * registrati dal basso verso l'alto.
 *
 * RICERCA IBRIDA:
 * Espande in avanti un insieme di lavoro e decompone l'obiettivo finché le due
 * frontiere si incontrano, poi costruisce la prova con la ricerca in avanti.
 *
 * Il ricercatore è privo di stato tra una ricerca e l'altra: ogni invocazione
 * crea il proprio {@link ProofState}.
 */
public class ProofSearcher {

    private static final Logger LOGGER = Logger.getLogger(ProofSearcher.class.getName());

    /** Iterazioni consecutive senza conclusioni nuove prima di arrendersi */
    static final int NO_PROGRESS_LIMIT = 3;

    /** Bonus di punteggio per le applicazioni che concludono l'obiettivo */
    static final double GOAL_BONUS = 10.0;

    /** Regola registrata quando l'obiettivo è ottenuto dalla refutazione di riserva */
    public static final String REFUTATION_RULE = "resolution_refutation";

    private static final String CONDITIONAL_PROOF_RULE = "imply_intro";

    private final SearchConfig config;
    private final RuleRegistry registry;
    private final Set<String> introductionRules;
    private final ResolutionEngine resolutionEngine = new ResolutionEngine();

    public ProofSearcher() {
        this(SearchConfig.defaults());
    }

    public ProofSearcher(SearchConfig config) {
        this(config, RuleRegistry.standard());
    }

    /**
     * @param config   parametri di ricerca
     * @param registry regole disponibili; quelle escluse dalla configurazione vengono rimosse
     */
    public ProofSearcher(SearchConfig config, RuleRegistry registry) {
        if (config == null || registry == null) {
            throw new IllegalArgumentException("Configurazione e registro regole non possono essere null");
        }
        this.config = config;
        this.registry = registry.without(config.getExcludedRules());
        this.introductionRules = this.registry.rules().stream()
                .filter(Rule::isIntroduction)
                .map(Rule::name)
                .collect(Collectors.toSet());
    }

    public SearchConfig getConfig() {
        return config;
    }

    public RuleRegistry getRegistry() {
        return registry;
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Cerca una prova dell'obiettivo a partire dagli assiomi.
     *
     * @param axioms assiomi in ordine
     * @param goal   formula da dimostrare
     * @return esito con lo stato di prova finale
     */
    public SearchResult search(List<Expr> axioms, Expr goal) {
        if (axioms == null || goal == null) {
            throw new IllegalArgumentException("Assiomi e obiettivo non possono essere null");
        }
        SearchRun run = new SearchRun(new ProofState(axioms, goal));
        LOGGER.info("Inizio ricerca " + config.getStrategy() + " di " + goal
                + " da " + run.state.getAxioms().size() + " assiomi");

        if (run.state.isComplete()) {
            run.note("Obiettivo già presente tra gli assiomi");
            return finish(run);
        }

        if (config.isUseSemanticCheck() && !semanticallyEntailed(run)) {
            run.state.markFailed();
            return finish(run);
        }

        boolean found = switch (config.getStrategy()) {
            case FORWARD -> forwardSearch(run);
            case BACKWARD -> backwardSearch(run);
            case HYBRID -> hybridSearch(run);
        };

        if (!found && config.isRefutationFallback()) {
            found = refutationFallback(run);
        }
        if (!found) {
            run.state.markFailed();
        }
        return finish(run);
    }

    //endregion

    //region VERIFICA SEMANTICA

    private boolean semanticallyEntailed(SearchRun run) {
        try {
            Evaluator evaluator = new Evaluator(config.getMaxVariables());
            if (evaluator.entails(run.state.getAxioms(), run.state.getGoal())) {
                run.note("Verifica semantica superata");
                return true;
            }
            run.note("Verifica semantica: l'obiettivo non è conseguenza logica degli assiomi");
            LOGGER.info("Obiettivo " + run.state.getGoal() + " non implicato dagli assiomi");
            return false;
        } catch (ResourceLimitExceededException e) {
            LOGGER.warning("Verifica semantica saltata: " + e.getMessage());
            run.note("Verifica semantica saltata: troppe variabili");
            return true;
        }
    }

    //endregion

    //region RICERCA IN AVANTI

    private boolean forwardSearch(SearchRun run) {
        ProofState state = run.state;
        Expr goal = state.getGoal();
        int noProgress = 0;

        for (int iteration = 1; iteration <= config.getMaxSteps(); iteration++) {
            run.explore();
            int added = 0;

            for (RuleResult candidate : rankedCandidates(state.getKnowledge(), goal, run.statistics)) {
                if (added >= config.getMaxBranching()) {
                    break;
                }
                if (state.isKnown(candidate.getConclusion())) {
                    continue;
                }
                record(run, candidate);
                added++;
                if (state.isComplete()) {
                    run.note("Obiettivo derivato in avanti all'iterazione " + iteration);
                    return true;
                }
            }

            if (added == 0) {
                noProgress++;
                if (noProgress >= NO_PROGRESS_LIMIT) {
                    run.note("Ricerca in avanti ferma dopo " + iteration + " iterazioni senza progressi");
                    return false;
                }
            } else {
                noProgress = 0;
            }
        }

        run.note("Ricerca in avanti: limite di " + config.getMaxSteps() + " iterazioni raggiunto");
        return state.isComplete();
    }

    /**
     * Applicazioni candidate ordinate per punteggio decrescente. L'ordinamento è
     * stabile: a parità di punteggio vale l'ordine delle regole nel registro.
     */
    private List<RuleResult> rankedCandidates(Set<Expr> knowledge, Expr goal, SearchStatistics statistics) {
        List<RuleResult> candidates = new ArrayList<>(registry.applyAll(knowledge, null, Set.of()));
        candidates.addAll(registry.applyAll(knowledge, goal, Set.of()));

        Set<Expr> relevant = relevantFormulas(knowledge, goal);
        candidates.removeIf(candidate -> knowledge.contains(candidate.getConclusion())
                || (introductionRules.contains(candidate.getRuleName()) && !relevant.contains(candidate.getConclusion())));

        statistics.addFiringsConsidered(candidates.size());
        candidates.sort(Comparator.comparingDouble((RuleResult candidate) -> score(candidate, goal)).reversed());
        return candidates;
    }

    private Set<Expr> relevantFormulas(Set<Expr> knowledge, Expr goal) {
        Set<Expr> relevant = new HashSet<>(goal.subformulas());
        for (Expr formula : knowledge) {
            relevant.addAll(formula.subformulas());
        }
        return relevant;
    }

    private double score(RuleResult candidate, Expr goal) {
        double score = config.getRulePriority(candidate.getRuleName());
        if (candidate.getConclusion().equals(goal)) {
            score += GOAL_BONUS;
        }
        return score;
    }

    //endregion

    //region RICERCA ALL'INDIETRO

    private boolean backwardSearch(SearchRun run) {
        boolean proved = proveGoal(run, run.state.getGoal(), new HashSet<>(), 0);
        while (run.state.getAssumptionLevel() > 0) {
            run.state.dischargeAssumption();
        }
        if (proved && run.state.isComplete()) {
            run.note("Obiettivo ridotto all'indietro in " + run.stepsExplored + " passi");
            return true;
        }
        run.note("Ricerca all'indietro senza esito");
        return false;
    }

    /**
     * Dimostra l'obiettivo nel contesto di ipotesi corrente.
     *
     * @param path obiettivi sul cammino corrente, per evitare cicli
     * @return true se l'obiettivo è noto al ritorno
     */
    private boolean proveGoal(SearchRun run, Expr goal, Set<Expr> path, int depth) {
        ProofState state = run.state;
        if (state.isKnown(goal)) {
            return true;
        }
        if (depth > config.getMaxDepth() || path.contains(goal) || run.backwardBudgetExhausted()) {
            return false;
        }
        run.explore();
        path.add(goal);
        try {
            if (fireTowards(run, goal)) {
                return true;
            }

            for (Rule rule : registry.rules()) {
                for (List<Expr> alternative : rule.subgoals(goal, state.getKnowledge())) {
                    if (proveAll(run, alternative, path, depth + 1)
                            && (fireRule(run, rule, goal) || state.isKnown(goal))) {
                        return true;
                    }
                    run.statistics.incrementBacktracks();
                }
            }

            if (goal instanceof Imply && !config.isExcluded(CONDITIONAL_PROOF_RULE)) {
                return proveUnderAssumption(run, (Imply) goal, path, depth);
            }
            return false;
        } finally {
            path.remove(goal);
        }
    }

    private boolean proveAll(SearchRun run, List<Expr> goals, Set<Expr> path, int depth) {
        for (Expr subgoal : goals) {
            if (!proveGoal(run, subgoal, path, depth)) {
                return false;
            }
        }
        return true;
    }

    /** Applica la migliore regola che conclude direttamente l'obiettivo. */
    private boolean fireTowards(SearchRun run, Expr goal) {
        List<RuleResult> firings = new ArrayList<>(registry.applyAll(run.state.getKnowledge(), goal, Set.of()));
        if (firings.isEmpty()) {
            return false;
        }
        run.statistics.addFiringsConsidered(firings.size());
        firings.sort(Comparator.comparingDouble((RuleResult firing) -> score(firing, goal)).reversed());
        record(run, firings.get(0));
        return true;
    }

    private boolean fireRule(SearchRun run, Rule rule, Expr goal) {
        List<RuleResult> firings = rule.apply(run.state.getKnowledge(), goal);
        if (firings.isEmpty()) {
            return false;
        }
        run.statistics.addFiringsConsidered(firings.size());
        record(run, firings.get(0));
        return true;
    }

    /**
     * Prova condizionale: assume l'antecedente, dimostra il conseguente e scarica
     * l'ipotesi. In caso di fallimento l'ipotesi viene comunque scaricata.
     */
    private boolean proveUnderAssumption(SearchRun run, Imply goal, Set<Expr> path, int depth) {
        ProofState state = run.state;
        state.introduceAssumption(goal.left(), goal.right());
        run.statistics.incrementStepsAdded();

        if (proveGoal(run, goal.right(), path, depth + 1)
                && state.conditionalProof(goal.left(), goal.right()).isPresent()) {
            run.statistics.incrementStepsAdded();
            return true;
        }

        state.dischargeAssumption();
        run.statistics.incrementBacktracks();
        return false;
    }

    //endregion

    //region RICERCA IBRIDA

    private boolean hybridSearch(SearchRun run) {
        Expr goal = run.state.getGoal();
        Set<Expr> reached = new LinkedHashSet<>(run.state.getKnowledge());
        Set<Expr> targets = new LinkedHashSet<>();
        targets.add(goal);

        int rounds = Math.max(1, config.getMaxSteps() / 2);
        for (int round = 1; round <= rounds; round++) {
            run.explore();

            int grown = 0;
            for (RuleResult candidate : rankedCandidates(reached, goal, run.statistics)) {
                if (grown >= config.getMaxBranching()) {
                    break;
                }
                if (reached.add(candidate.getConclusion())) {
                    grown++;
                }
            }

            List<Expr> decomposed = new ArrayList<>();
            for (Expr target : targets) {
                decomposed.addAll(decompose(target));
            }
            int newTargets = 0;
            for (Expr subgoal : decomposed) {
                if (targets.add(subgoal)) {
                    newTargets++;
                }
            }

            if (targets.stream().anyMatch(reached::contains)) {
                run.note("Frontiere incontrate al giro " + round);
                break;
            }
            if (grown == 0 && newTargets == 0) {
                run.note("Frontiere ferme al giro " + round + " senza incontrarsi");
                break;
            }
        }

        return forwardSearch(run);
    }

    /**
     * Sotto-obiettivi strutturali: A & B → A, B; A -> B → B.
     */
    static List<Expr> decompose(Expr goal) {
        if (goal instanceof And) {
            return List.of(((And) goal).left(), ((And) goal).right());
        }
        if (goal instanceof Imply) {
            return List.of(((Imply) goal).right());
        }
        return List.of();
    }

    //endregion

    //region REFUTAZIONE DI RISERVA

    private boolean refutationFallback(SearchRun run) {
        ProofState state = run.state;
        while (state.getAssumptionLevel() > 0) {
            state.dischargeAssumption();
        }

        RefutationResult refutation = resolutionEngine.proveEntailment(
                state.getAxioms(), state.getGoal(), config.getMaxResolutionIterations());
        int resolutionSteps = refutation.getProof().getStepCount();
        run.statistics.addRefutationSteps(resolutionSteps);

        if (!refutation.isRefuted()) {
            run.note("Refutazione per risoluzione senza esito");
            return false;
        }

        List<Integer> axiomSteps = IntStream.rangeClosed(1, state.getAxioms().size())
                .boxed()
                .collect(Collectors.toList());
        state.addStep(state.getGoal(), REFUTATION_RULE, axiomSteps,
                "Assiomi e negazione dell'obiettivo insoddisfacibili: clausola vuota in "
                        + resolutionSteps + " passi di risoluzione");
        run.statistics.incrementStepsAdded();
        run.note("Obiettivo ottenuto per refutazione");
        return true;
    }

    //endregion

    //region SUPPORTO

    private void record(SearchRun run, RuleResult firing) {
        List<Integer> premiseSteps = new ArrayList<>();
        for (Expr premise : firing.getPremises()) {
            run.state.stepFor(premise).ifPresent(step -> premiseSteps.add(step.getStepNumber()));
        }
        run.state.addStep(firing.getConclusion(), firing.getRuleName(), premiseSteps, firing.getDescription());
        run.statistics.incrementStepsAdded();
    }

    private SearchResult finish(SearchRun run) {
        run.statistics.stopTimer();
        boolean success = run.state.getStatus() == ProofStatus.SUCCESS;
        LOGGER.info("Ricerca " + (success ? "riuscita" : "fallita") + " per " + run.state.getGoal()
                + ": " + run.statistics.toCompactString());

        if (success) {
            return SearchResult.proved(run.state, run.stepsExplored, run.statistics,
                    config.getStrategy(), run.searchPath);
        }
        return SearchResult.notProved(run.state, run.stepsExplored, run.statistics,
                config.getStrategy(), run.searchPath);
    }

    /**
     * Stato di una singola invocazione di {@link #search}.
     */
    private final class SearchRun {

        private final ProofState state;
        private final SearchStatistics statistics = new SearchStatistics();
        private final List<String> searchPath = new ArrayList<>();
        private int stepsExplored = 0;

        private SearchRun(ProofState state) {
            this.state = state;
        }

        private void explore() {
            stepsExplored++;
            statistics.incrementIterations();
        }

        /** La ricerca all'indietro visita al più maxSteps * maxBranching nodi. */
        private boolean backwardBudgetExhausted() {
            return stepsExplored >= config.getMaxSteps() * config.getMaxBranching();
        }

        private void note(String message) {
            searchPath.add(message);
            LOGGER.fine(message);
        }
    }

    //endregion
}

package org.prover.proof;

import org.prover.logic.Expr;
import org.prover.logic.Imply;
import org.prover.logic.Not;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * STATO DI PROVA - Costruzione incrementale di una dimostrazione
 *
 * Possiede gli assiomi (congelati alla creazione), l'obiettivo, la lista dei
 * passi (solo in aggiunta), la base di conoscenza viva e la pila delle ipotesi.
 *
 * CICLO DI VITA:
 * - Creazione: ogni assioma diventa un passo 1..n con regola "axiom"
 * - Mutazioni: solo tramite {@link #addStep}, {@link #introduceAssumption},
 *   {@link #dischargeAssumption} e {@link #conditionalProof}
 * - Successo: l'obiettivo entra nella base di conoscenza senza ipotesi aperte
 *
 * BASE DI CONOSCENZA:
 * Ogni formula nota ricorda il livello di ipotesi a cui è stata acquisita. Lo
 * scarico di un'ipotesi di livello L ritira tutte le formule acquisite a livello
 * L o superiore; i passi corrispondenti restano registrati.
 *
 * Uno stato appartiene a un solo tentativo di prova e non è thread-safe.
 */
public class ProofState {

    private static final Logger LOGGER = Logger.getLogger(ProofState.class.getName());

    static final String AXIOM_RULE = "axiom";
    static final String ASSUMPTION_RULE = "assumption";
    static final String CONDITIONAL_PROOF_RULE = "imply_intro";

    private final List<Expr> axioms;
    private final Expr goal;
    private final List<ProofStep> steps = new ArrayList<>();

    /** Formula nota → livello di ipotesi a cui è stata acquisita (ordine di inserimento) */
    private final Map<Expr, Integer> knowledge = new LinkedHashMap<>();

    private final Deque<Assumption> assumptions = new ArrayDeque<>();
    private ProofStatus status = ProofStatus.IN_PROGRESS;

    //region CREAZIONE

    /**
     * @param axioms assiomi in ordine; i duplicati vengono ignorati
     * @param goal   formula da dimostrare
     * @throws IllegalArgumentException se assiomi o obiettivo sono null
     */
    public ProofState(List<Expr> axioms, Expr goal) {
        if (axioms == null || axioms.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Assiomi non possono essere null");
        }
        if (goal == null) {
            throw new IllegalArgumentException("Obiettivo non può essere null");
        }
        this.axioms = List.copyOf(new LinkedHashSet<>(axioms));
        this.goal = goal;

        for (int i = 0; i < this.axioms.size(); i++) {
            Expr axiom = this.axioms.get(i);
            steps.add(new ProofStep(i + 1, axiom, AXIOM_RULE, List.of(), "Assioma " + (i + 1), 0));
            knowledge.put(axiom, 0);
        }

        if (knowledge.containsKey(goal)) {
            status = ProofStatus.SUCCESS;
            LOGGER.fine("Obiettivo già presente tra gli assiomi: " + goal);
        }
    }

    //endregion

    //region MUTAZIONI

    /**
     * Aggiunge un passo derivato al livello di ipotesi corrente.
     *
     * @param formula       formula derivata
     * @param ruleName      regola applicata
     * @param premiseSteps  numeri dei passi premessa
     * @param justification spiegazione leggibile
     * @return il passo registrato
     */
    public ProofStep addStep(Expr formula, String ruleName, List<Integer> premiseSteps, String justification) {
        ProofStep step = new ProofStep(steps.size() + 1, formula, ruleName, premiseSteps,
                justification, getAssumptionLevel());
        steps.add(step);
        knowledge.putIfAbsent(formula, getAssumptionLevel());
        LOGGER.finest("Passo aggiunto: " + step);

        if (status == ProofStatus.IN_PROGRESS && isComplete()) {
            status = ProofStatus.SUCCESS;
            LOGGER.fine("Obiettivo " + goal + " derivato al passo " + step.getStepNumber());
        }
        return step;
    }

    /**
     * Apre una nuova ipotesi: la formula diventa nota al nuovo livello.
     *
     * @param formula formula assunta
     * @param target  formula che si intende derivare sotto l'ipotesi, oppure null
     * @return il passo "assumption"
     */
    public ProofStep introduceAssumption(Expr formula, Expr target) {
        if (formula == null) {
            throw new IllegalArgumentException("Ipotesi non può essere null");
        }
        int level = getAssumptionLevel() + 1;
        Assumption assumption = new Assumption(formula, steps.size() + 1, level, target);
        assumptions.push(assumption);

        ProofStep step = new ProofStep(assumption.getStepNumber(), formula, ASSUMPTION_RULE, List.of(),
                "Ipotesi", level);
        steps.add(step);
        knowledge.putIfAbsent(formula, level);

        LOGGER.finest("Ipotesi introdotta al livello " + level + ": " + formula);
        return step;
    }

    /**
     * Chiude l'ipotesi più recente ritirando dalla base di conoscenza tutto ciò che
     * è stato acquisito al suo livello o a livelli più profondi.
     *
     * @return l'ipotesi scaricata, oppure vuoto se non ci sono ipotesi aperte
     */
    public Optional<Assumption> dischargeAssumption() {
        if (assumptions.isEmpty()) {
            return Optional.empty();
        }
        Assumption assumption = assumptions.pop();
        int before = knowledge.size();
        knowledge.values().removeIf(level -> level >= assumption.getLevel());
        LOGGER.finest("Ipotesi " + assumption.getFormula() + " scaricata: ritirate "
                + (before - knowledge.size()) + " formule");
        return Optional.of(assumption);
    }

    /**
     * Completa una prova condizionale: dall'ipotesi aperta P e dalla conclusione Q
     * derivata sotto di essa si ottiene P -> Q al livello inferiore.
     *
     * @param assumption formula dell'ipotesi più recente
     * @param conclusion formula nota sotto l'ipotesi
     * @return il passo "imply_intro", oppure vuoto se l'ipotesi non è quella aperta
     *         più recente o la conclusione non è nota
     */
    public Optional<ProofStep> conditionalProof(Expr assumption, Expr conclusion) {
        Assumption current = currentAssumption().orElse(null);
        if (current == null || !current.getFormula().equals(assumption) || !knowledge.containsKey(conclusion)) {
            return Optional.empty();
        }
        int conclusionStep = stepFor(conclusion).map(ProofStep::getStepNumber).orElseThrow();

        dischargeAssumption();

        Expr implication = new Imply(assumption, conclusion);
        return Optional.of(addStep(implication, CONDITIONAL_PROOF_RULE,
                List.of(current.getStepNumber(), conclusionStep),
                "Prova condizionale: assumendo " + assumption + " si ottiene " + conclusion
                        + ", quindi " + implication));
    }

    /**
     * Segna il tentativo come fallito (solo se ancora in corso).
     */
    public void markFailed() {
        if (status == ProofStatus.IN_PROGRESS) {
            status = ProofStatus.FAILED;
        }
    }

    /**
     * Segna il tentativo come interrotto per tempo; riservato ai chiamanti che
     * impongono un limite di tempo esterno.
     */
    public void markTimeout() {
        if (status == ProofStatus.IN_PROGRESS) {
            status = ProofStatus.TIMEOUT;
        }
    }

    //endregion

    //region INTERROGAZIONI

    /**
     * Passo più recente ancora valido che ha derivato la formula. I passi interni a
     * ipotesi già scaricate non sono considerati.
     */
    public Optional<ProofStep> stepFor(Expr formula) {
        Integer knownLevel = knowledge.get(formula);
        if (knownLevel == null) {
            return Optional.empty();
        }
        for (int i = steps.size() - 1; i >= 0; i--) {
            ProofStep step = steps.get(i);
            if (step.getAssumptionLevel() <= knownLevel && step.getFormula().equals(formula)) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    public boolean isKnown(Expr formula) {
        return knowledge.containsKey(formula);
    }

    /** Vero se l'obiettivo è noto senza ipotesi aperte a sostenerlo. */
    public boolean isComplete() {
        Integer level = knowledge.get(goal);
        return level != null && level == 0;
    }

    /** Vero se la base di conoscenza contiene una formula e la sua negazione. */
    public boolean hasContradiction() {
        for (Expr formula : knowledge.keySet()) {
            if (formula instanceof Not && knowledge.containsKey(((Not) formula).operand())) {
                return true;
            }
        }
        return false;
    }

    public List<Expr> getAxioms() {
        return axioms;
    }

    public Expr getGoal() {
        return goal;
    }

    public List<ProofStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public int getStepCount() {
        return steps.size();
    }

    /** Numero di passi oltre agli assiomi. */
    public int getDerivedStepCount() {
        return steps.size() - axioms.size();
    }

    /** Vista in sola lettura della base di conoscenza, in ordine di acquisizione. */
    public Set<Expr> getKnowledge() {
        return Collections.unmodifiableSet(knowledge.keySet());
    }

    public int getAssumptionLevel() {
        return assumptions.size();
    }

    public Optional<Assumption> currentAssumption() {
        return Optional.ofNullable(assumptions.peek());
    }

    public ProofStatus getStatus() {
        return status;
    }

    //endregion

    //region OUTPUT

    /**
     * Prova testuale: assiomi, obiettivo, passi numerati e riga di stato finale.
     */
    public String formatProof() {
        String rule = "=".repeat(60);
        String thin = "-".repeat(60);

        StringBuilder sb = new StringBuilder();
        sb.append(rule).append("\n");
        sb.append("PROVA\n");
        sb.append(rule).append("\n\n");

        sb.append("Assiomi:\n");
        for (Expr axiom : axioms) {
            sb.append("  ").append(axiom).append("\n");
        }
        sb.append("\n");
        sb.append("Obiettivo: ").append(goal).append("\n\n");

        sb.append("Passi di prova:\n");
        sb.append(thin).append("\n");
        for (ProofStep step : steps) {
            sb.append(step).append("\n");
        }
        sb.append(thin).append("\n\n");

        sb.append("Stato: ").append(status.value()).append("\n");
        if (status == ProofStatus.SUCCESS) {
            sb.append("✓ Prova completata\n");
        } else if (status == ProofStatus.FAILED) {
            sb.append("✗ Prova fallita\n");
        }
        sb.append(rule);
        return sb.toString();
    }

    /**
     * Riepilogo sintetico della prova.
     */
    public static final class ProofSummary {

        /** Numero di assiomi */
        private final int axiomCount;

        /** Numero di passi registrati, ipotesi comprese */
        private final int stepCount;

        /** Goal in forma testuale */
        private final String goal;

        /** Stato della prova al momento del riepilogo */
        private final ProofStatus status;

        /** Nomi delle regole usate, ordinati (immutabile) */
        private final Set<String> rulesUsed;

        /** True se il goal è noto a livello 0 */
        private final boolean complete;

        public ProofSummary(int axiomCount, int stepCount, String goal, ProofStatus status,
                            Set<String> rulesUsed, boolean complete) {
            if (goal == null || status == null || rulesUsed == null) {
                throw new IllegalArgumentException("Goal, stato e regole non possono essere null");
            }
            this.axiomCount = axiomCount;
            this.stepCount = stepCount;
            this.goal = goal;
            this.status = status;
            this.rulesUsed = Collections.unmodifiableSet(new TreeSet<>(rulesUsed));
            this.complete = complete;
        }

        public int getAxiomCount() {
            return axiomCount;
        }

        public int getStepCount() {
            return stepCount;
        }

        public String getGoal() {
            return goal;
        }

        public ProofStatus getStatus() {
            return status;
        }

        public Set<String> getRulesUsed() {
            return rulesUsed;
        }

        public boolean isComplete() {
            return complete;
        }

        @Override
        public String toString() {
            return String.format("ProofSummary[assiomi=%d, passi=%d, goal=%s, stato=%s, regole=%s, completa=%s]",
                    axiomCount, stepCount, goal, status, rulesUsed, complete);
        }
    }

    public ProofSummary summary() {
        Set<String> rulesUsed = new TreeSet<>();
        for (ProofStep step : steps) {
            rulesUsed.add(step.getRuleName());
        }
        return new ProofSummary(axioms.size(), steps.size(), goal.toString(), status, rulesUsed, isComplete());
    }

    @Override
    public String toString() {
        return String.format("ProofState[goal=%s, steps=%d, status=%s, level=%d]",
                goal, steps.size(), status, getAssumptionLevel());
    }

    //endregion
}

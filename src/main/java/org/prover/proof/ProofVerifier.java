package org.prover.proof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * VERIFICATORE DI PROVE - Controllo strutturale dei passi registrati
 *
 * Ripercorre i passi di un {@link ProofState} in ordine e controlla che la
 * catena delle giustificazioni sia ben formata. Le regole applicate non vengono
 * ricalcolate: si verifica la struttura, non la correttezza logica di ogni passo.
 *
 * CONTROLLI:
 * - numerazione consecutiva dei passi a partire da 1
 * - ogni premessa cita un passo precedente esistente
 * - i passi "axiom" non hanno premesse e riportano un assioma
 * - un passo non cita premesse acquisite sotto un'ipotesi più profonda,
 *   tranne "imply_intro" che scarica l'ipotesi citata
 *
 * ESITO: VALID se la struttura è corretta e l'obiettivo è derivato al livello 0,
 * INCOMPLETE se la struttura è corretta ma l'obiettivo manca, INVALID altrimenti.
 */
public class ProofVerifier {

    private static final Logger LOGGER = Logger.getLogger(ProofVerifier.class.getName());

    /**
     * Esito della verifica.
     */
    public enum Status {
        VALID,
        INCOMPLETE,
        INVALID
    }

    /**
     * Risultato della verifica: esito ed elenco degli errori trovati.
     */
    public static final class VerificationResult {

        private final Status status;

        /** Errori in ordine di passo, vuoto per VALID e INCOMPLETE (immutabile) */
        private final List<String> errors;

        public VerificationResult(Status status, List<String> errors) {
            if (status == null || errors == null) {
                throw new IllegalArgumentException("Esito ed errori non possono essere null");
            }
            if ((status == Status.INVALID) == errors.isEmpty()) {
                throw new IllegalArgumentException("Solo un esito INVALID riporta errori: " + status);
            }
            this.status = status;
            this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        }

        public Status getStatus() {
            return status;
        }

        public List<String> getErrors() {
            return errors;
        }

        public boolean isValid() {
            return status == Status.VALID;
        }

        @Override
        public String toString() {
            return errors.isEmpty() ? status.toString() : status + " " + errors;
        }
    }

    /**
     * Verifica i passi dello stato di prova.
     *
     * @throws IllegalArgumentException se lo stato è null
     */
    public VerificationResult verify(ProofState state) {
        if (state == null) {
            throw new IllegalArgumentException("Lo stato di prova non può essere null");
        }
        List<ProofStep> steps = state.getSteps();
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < steps.size(); i++) {
            ProofStep step = steps.get(i);
            int expected = i + 1;
            if (step.getStepNumber() != expected) {
                errors.add("Passo " + step.getStepNumber() + ": numerazione attesa " + expected);
            }
            checkPremises(step, steps, errors);
            if (ProofState.AXIOM_RULE.equals(step.getRuleName())) {
                checkAxiom(step, state, errors);
            }
        }

        VerificationResult result;
        if (!errors.isEmpty()) {
            result = new VerificationResult(Status.INVALID, errors);
        } else if (goalDerived(state)) {
            result = new VerificationResult(Status.VALID, List.of());
        } else {
            result = new VerificationResult(Status.INCOMPLETE, List.of());
        }
        LOGGER.fine("Verifica di " + steps.size() + " passi: " + result);
        return result;
    }

    private void checkPremises(ProofStep step, List<ProofStep> steps, List<String> errors) {
        boolean discharges = ProofState.CONDITIONAL_PROOF_RULE.equals(step.getRuleName());
        for (int premise : step.getPremiseSteps()) {
            if (premise < 1 || premise >= step.getStepNumber() || premise > steps.size()) {
                errors.add("Passo " + step.getStepNumber() + ": la premessa " + premise
                        + " non è un passo precedente");
                continue;
            }
            int premiseLevel = steps.get(premise - 1).getAssumptionLevel();
            int allowed = discharges ? step.getAssumptionLevel() + 1 : step.getAssumptionLevel();
            if (premiseLevel > allowed) {
                errors.add("Passo " + step.getStepNumber() + ": la premessa " + premise
                        + " appartiene a un'ipotesi chiusa (livello " + premiseLevel + ")");
            }
        }
    }

    private void checkAxiom(ProofStep step, ProofState state, List<String> errors) {
        if (!step.getPremiseSteps().isEmpty()) {
            errors.add("Passo " + step.getStepNumber() + ": un assioma non ha premesse");
        }
        if (!state.getAxioms().contains(step.getFormula())) {
            errors.add("Passo " + step.getStepNumber() + ": " + step.getFormula() + " non è un assioma");
        }
    }

    private boolean goalDerived(ProofState state) {
        return state.getSteps().stream()
                .anyMatch(step -> step.getAssumptionLevel() == 0 && step.getFormula().equals(state.getGoal()));
    }
}

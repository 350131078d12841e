package org.prover.resolution;

import org.prover.cnf.Clause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * PROVA PER RISOLUZIONE - Sequenza di passi di risoluzione registrati
 *
 * Ogni passo deriva una nuova clausola da due clausole esistenti; una prova di
 * insoddisfacibilità termina con la clausola vuota [].
 *
 * FORMATO OUTPUT:
 * (clausola1) e (clausola2) genera (risolvente1)
 * ...
 * (clausolaN) e (clausolaM) genera ([])
 */
public class ResolutionProof {

    private static final Logger LOGGER = Logger.getLogger(ResolutionProof.class.getName());

    /** Passi in ordine cronologico */
    private final List<ResolutionStep> steps = new ArrayList<>();

    /** Indica se la clausola vuota è stata derivata */
    private boolean emptyClauseDerived;

    //region REGISTRAZIONE PASSI

    /**
     * Registra un passo: {@code first} e {@code second} generano {@code resolvent}.
     *
     * @throws IllegalArgumentException se una delle clausole è null
     */
    public void recordResolutionStep(Clause first, Clause second, Clause resolvent) {
        if (first == null || second == null || resolvent == null) {
            throw new IllegalArgumentException("Clausole del passo di risoluzione non possono essere null");
        }
        ResolutionStep step = new ResolutionStep(first, second, resolvent);
        steps.add(step);

        if (resolvent.isEmpty()) {
            emptyClauseDerived = true;
            LOGGER.fine("Clausola vuota [] derivata al passo " + steps.size());
        }
        LOGGER.finest("Passo registrato: " + step);
    }

    //endregion

    //region GENERAZIONE PROVA

    /**
     * Prova testuale: una riga per passo, fino alla prima clausola vuota.
     *
     * @throws IllegalStateException se non è stato registrato alcun passo
     */
    public String generateProof() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("Impossibile generare prova: nessun passo registrato");
        }
        if (!emptyClauseDerived) {
            LOGGER.warning("Clausola vuota non derivata - prova incompleta");
        }

        StringBuilder proofBuilder = new StringBuilder();
        for (ResolutionStep step : steps) {
            if (proofBuilder.length() > 0) {
                proofBuilder.append("\n");
            }
            proofBuilder.append(step);
            if (step.getResolvent().isEmpty()) {
                break;
            }
        }
        return proofBuilder.toString();
    }

    //endregion

    //region STATO

    public boolean hasEmptyClause() {
        return emptyClauseDerived;
    }

    public int getStepCount() {
        return steps.size();
    }

    public List<ResolutionStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    @Override
    public String toString() {
        return String.format("ResolutionProof[steps=%d, empty_derived=%s]", steps.size(), emptyClauseDerived);
    }

    //endregion

    /**
     * Singolo passo di risoluzione: due clausole e il loro risolvente.
     */
    public static final class ResolutionStep {

        /** Prima clausola genitrice */
        private final Clause first;

        /** Seconda clausola genitrice */
        private final Clause second;

        /** Risolvente ottenuto */
        private final Clause resolvent;

        public ResolutionStep(Clause first, Clause second, Clause resolvent) {
            if (first == null || second == null || resolvent == null) {
                throw new IllegalArgumentException("Clausole del passo di risoluzione non possono essere null");
            }
            this.first = first;
            this.second = second;
            this.resolvent = resolvent;
        }

        public Clause getFirst() {
            return first;
        }

        public Clause getSecond() {
            return second;
        }

        public Clause getResolvent() {
            return resolvent;
        }

        @Override
        public String toString() {
            return String.format("(%s) e (%s) genera (%s)", first, second, resolvent);
        }
    }
}

package org.prover.proof;

import org.prover.logic.Expr;
import org.prover.logic.Var;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Esito della ricerca di una derivazione per sequenti.
 *
 * Una prova riuscita contiene la derivazione; una fallita contiene la foglia
 * aperta (se la ricerca ne ha raggiunta una) e l'indicazione del limite di
 * profondità.
 */
public final class SequentProof {

    /** Sequente radice */
    private final Sequent sequent;

    /** True se ogni foglia della derivazione è un assioma */
    private final boolean proved;

    /** Righe della derivazione in pre-ordine, rientrate per profondità (immutabile) */
    private final List<String> lines;

    /** Foglia atomica non assioma, null per le prove riuscite */
    private final Sequent openLeaf;

    /** True se la ricerca si è fermata per il limite di profondità */
    private final boolean depthLimitReached;

    private SequentProof(Sequent sequent, boolean proved, List<String> lines,
                         Sequent openLeaf, boolean depthLimitReached) {
        if (sequent == null || lines == null) {
            throw new IllegalArgumentException("Sequente e derivazione non possono essere null");
        }
        if (proved && (openLeaf != null || depthLimitReached)) {
            throw new IllegalArgumentException("Una prova riuscita non ha foglie aperte");
        }
        this.sequent = sequent;
        this.proved = proved;
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        this.openLeaf = openLeaf;
        this.depthLimitReached = depthLimitReached;
    }

    static SequentProof proved(Sequent sequent, List<String> lines) {
        return new SequentProof(sequent, true, lines, null, false);
    }

    static SequentProof failed(Sequent sequent, List<String> lines, Sequent openLeaf, boolean depthLimitReached) {
        return new SequentProof(sequent, false, lines, openLeaf, depthLimitReached);
    }

    //region ACCESSO

    public Sequent getSequent() {
        return sequent;
    }

    public boolean isProved() {
        return proved;
    }

    public List<String> getLines() {
        return lines;
    }

    public Optional<Sequent> getOpenLeaf() {
        return Optional.ofNullable(openLeaf);
    }

    public boolean isDepthLimitReached() {
        return depthLimitReached;
    }

    /**
     * Contromodello letto dalla foglia aperta: variabili dell'antecedente vere,
     * variabili del conseguente false. Le variabili del sequente radice assenti
     * dalla foglia valgono false.
     */
    public Optional<Map<String, Boolean>> getCountermodel() {
        if (openLeaf == null) {
            return Optional.empty();
        }
        Map<String, Boolean> model = new TreeMap<>();
        for (Expr formula : sequent.getAntecedents()) {
            formula.variables().forEach(variable -> model.put(variable, false));
        }
        for (Expr formula : sequent.getConsequents()) {
            formula.variables().forEach(variable -> model.put(variable, false));
        }
        for (Expr formula : openLeaf.getAntecedents()) {
            model.put(((Var) formula).name(), true);
        }
        return Optional.of(Collections.unmodifiableMap(model));
    }

    //endregion

    /**
     * Derivazione testuale: il sequente, l'esito e le righe della derivazione.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Sequente: ").append(sequent).append("\n");
        sb.append(proved ? "✓ Dimostrato" : "✗ Non dimostrato");
        if (depthLimitReached) {
            sb.append(" (limite di profondità raggiunto)");
        }
        for (String line : lines) {
            sb.append("\n").append(line);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("SequentProof[sequent=%s, proved=%s, lines=%d]", sequent, proved, lines.size());
    }
}

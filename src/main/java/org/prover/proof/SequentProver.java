package org.prover.proof;

import org.prover.logic.BinaryExpr;
import org.prover.logic.Expr;
import org.prover.logic.Not;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * DIMOSTRATORE PER SEQUENTI - Ricerca all'indietro nel calcolo dei sequenti classico
 *
 * Parte dal sequente da dimostrare e lo scompone con le regole destre e sinistre
 * di ciascun connettivo finché ogni foglia è un assioma (Γ, A ⊢ A, Δ).
 *
 * REGOLE:
 * - destre: not_right, and_right, or_right, imply_right, iff_right
 * - sinistre: not_left, and_left, or_left, imply_left, iff_left
 *
 * Tutte le regole sono invertibili: se un sequente è dimostrabile lo sono le
 * premesse di qualunque sua scomposizione. Basta quindi una scomposizione per
 * nodo, scelta preferendo le regole a una sola premessa. Ogni regola elimina un
 * connettivo, per cui la profondità non supera il numero di connettivi; il
 * limite maxDepth resta come guardia esplicita.
 */
public class SequentProver {

    private static final Logger LOGGER = Logger.getLogger(SequentProver.class.getName());

    /** Profondità massima predefinita */
    public static final int DEFAULT_MAX_DEPTH = 100;

    static final String AXIOM_RULE = "axiom";

    private final int maxDepth;

    public SequentProver() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * @throws IllegalArgumentException se maxDepth non è positivo
     */
    public SequentProver(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("La profondità massima deve essere positiva: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    //region SCOMPOSIZIONE

    /**
     * Applicazione di una regola all'indietro: per dimostrare il sequente basta
     * dimostrare tutte le premesse.
     */
    public static final class Decomposition {

        /** Nome della regola, es. "imply_right" */
        private final String ruleName;

        /** Formula scomposta */
        private final Expr principal;

        /** Sequenti da dimostrare (vuoto solo per gli assiomi) */
        private final List<Sequent> premises;

        public Decomposition(String ruleName, Expr principal, List<Sequent> premises) {
            if (ruleName == null || premises == null) {
                throw new IllegalArgumentException("Regola e premesse non possono essere null");
            }
            this.ruleName = ruleName;
            this.principal = principal;
            this.premises = Collections.unmodifiableList(new ArrayList<>(premises));
        }

        public String getRuleName() {
            return ruleName;
        }

        public Expr getPrincipal() {
            return principal;
        }

        public List<Sequent> getPremises() {
            return premises;
        }

        public boolean isBranching() {
            return premises.size() > 1;
        }

        @Override
        public String toString() {
            return ruleName + (principal == null ? "" : " su " + principal) + ": " + premises;
        }
    }

    /**
     * Tutte le scomposizioni applicabili: prima le regole destre, poi le sinistre,
     * nell'ordine delle formule. Un assioma ha la sola scomposizione "axiom" senza premesse.
     */
    public List<Decomposition> decompose(Sequent sequent) {
        if (sequent == null) {
            throw new IllegalArgumentException("Il sequente non può essere null");
        }
        List<Decomposition> results = new ArrayList<>();
        if (sequent.isAxiom()) {
            results.add(new Decomposition(AXIOM_RULE, null, List.of()));
            return results;
        }

        for (Expr formula : sequent.getConsequents()) {
            Sequent rest = sequent.withoutConsequent(formula);
            switch (formula.type()) {
                // Γ, A ⊢ Δ  /  Γ ⊢ ~A, Δ
                case NOT -> results.add(new Decomposition("not_right", formula,
                        List.of(rest.withAntecedent(operand(formula)))));
                case AND -> results.add(new Decomposition("and_right", formula,
                        List.of(rest.withConsequent(left(formula)), rest.withConsequent(right(formula)))));
                case OR -> results.add(new Decomposition("or_right", formula,
                        List.of(rest.withConsequent(left(formula)).withConsequent(right(formula)))));
                case IMPLY -> results.add(new Decomposition("imply_right", formula,
                        List.of(rest.withAntecedent(left(formula)).withConsequent(right(formula)))));
                case IFF -> results.add(new Decomposition("iff_right", formula, List.of(
                        rest.withAntecedent(left(formula)).withConsequent(right(formula)),
                        rest.withAntecedent(right(formula)).withConsequent(left(formula)))));
                case VAR -> { }
            }
        }

        for (Expr formula : sequent.getAntecedents()) {
            Sequent rest = sequent.withoutAntecedent(formula);
            switch (formula.type()) {
                case NOT -> results.add(new Decomposition("not_left", formula,
                        List.of(rest.withConsequent(operand(formula)))));
                case AND -> results.add(new Decomposition("and_left", formula,
                        List.of(rest.withAntecedent(left(formula)).withAntecedent(right(formula)))));
                case OR -> results.add(new Decomposition("or_left", formula,
                        List.of(rest.withAntecedent(left(formula)), rest.withAntecedent(right(formula)))));
                // Γ ⊢ A, Δ  e  Γ, B ⊢ Δ  /  Γ, A -> B ⊢ Δ
                case IMPLY -> results.add(new Decomposition("imply_left", formula,
                        List.of(rest.withConsequent(left(formula)), rest.withAntecedent(right(formula)))));
                case IFF -> results.add(new Decomposition("iff_left", formula, List.of(
                        rest.withAntecedent(left(formula)).withAntecedent(right(formula)),
                        rest.withConsequent(left(formula)).withConsequent(right(formula)))));
                case VAR -> { }
            }
        }
        return results;
    }

    private static Expr operand(Expr formula) {
        return ((Not) formula).operand();
    }

    private static Expr left(Expr formula) {
        return ((BinaryExpr) formula).left();
    }

    private static Expr right(Expr formula) {
        return ((BinaryExpr) formula).right();
    }

    //endregion

    //region DIMOSTRAZIONE

    public SequentProof prove(List<Expr> premises, Expr conclusion) {
        return prove(Sequent.of(premises, conclusion));
    }

    /**
     * Cerca una derivazione del sequente.
     *
     * @return derivazione in pre-ordine con rientro per profondità; in caso di
     *         fallimento la prima foglia aperta, da cui si legge un contromodello
     */
    public SequentProof prove(Sequent sequent) {
        if (sequent == null) {
            throw new IllegalArgumentException("Il sequente non può essere null");
        }
        LOGGER.fine("Dimostrazione del sequente " + sequent + " (profondità massima " + maxDepth + ")");

        Search search = new Search();
        boolean proved = search.derive(sequent, 0);

        SequentProof proof = proved
                ? SequentProof.proved(sequent, search.lines)
                : SequentProof.failed(sequent, search.lines, search.openLeaf, search.depthLimitReached);
        LOGGER.fine("Sequente " + sequent + (proved ? " dimostrato in " : " non dimostrato dopo ")
                + search.lines.size() + " passi");
        return proof;
    }

    /** Stato di una singola ricerca. */
    private final class Search {

        private final List<String> lines = new ArrayList<>();
        private Sequent openLeaf;
        private boolean depthLimitReached;

        boolean derive(Sequent sequent, int depth) {
            if (depth > maxDepth) {
                depthLimitReached = true;
                LOGGER.finest("Profondità massima superata su " + sequent);
                return false;
            }
            List<Decomposition> decompositions = decompose(sequent);
            if (decompositions.isEmpty()) {
                openLeaf = sequent;
                lines.add("  ".repeat(depth) + "aperto: " + sequent);
                return false;
            }

            Decomposition chosen = decompositions.stream()
                    .filter(d -> !d.isBranching())
                    .findFirst()
                    .orElse(decompositions.get(0));
            lines.add("  ".repeat(depth) + chosen.getRuleName() + ": " + sequent);

            for (Sequent premise : chosen.getPremises()) {
                if (!derive(premise, depth + 1)) {
                    return false;
                }
            }
            return true;
        }
    }

    //endregion
}

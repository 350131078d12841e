package org.prover.search;

import org.prover.evaluator.Evaluator;
import org.prover.logic.Expr;
import org.prover.parser.FormulaParser;

import java.util.List;
import java.util.logging.Logger;

/**
 * Punto di ingresso testuale: analisi delle formule e ricerca della prova.
 */
public final class Prover {

    private static final Logger LOGGER = Logger.getLogger(Prover.class.getName());

    private Prover() {
        throw new UnsupportedOperationException("Classe di utilità - non istanziabile");
    }

    /**
     * Analizza assiomi e obiettivo ed esegue la ricerca con la configurazione data.
     *
     * @throws org.prover.parser.FormulaParseException se una formula non è valida
     */
    public static SearchResult prove(List<String> axioms, String goal, SearchConfig config) {
        if (axioms == null) {
            throw new IllegalArgumentException("Lista di assiomi non può essere null");
        }
        List<Expr> parsedAxioms = FormulaParser.parseAll(axioms);
        Expr parsedGoal = FormulaParser.parse(goal);
        LOGGER.fine("Formule analizzate: " + parsedAxioms.size() + " assiomi, obiettivo " + parsedGoal);
        return prove(parsedAxioms, parsedGoal, config);
    }

    public static SearchResult prove(List<String> axioms, String goal) {
        return prove(axioms, goal, SearchConfig.defaults());
    }

    public static SearchResult prove(List<Expr> axioms, Expr goal, SearchConfig config) {
        return new ProofSearcher(config).search(axioms, goal);
    }

    /**
     * Conseguenza logica verificata con tavola di verità.
     */
    public static boolean entails(List<String> axioms, String goal) {
        if (axioms == null) {
            throw new IllegalArgumentException("Lista di assiomi non può essere null");
        }
        return new Evaluator().entails(FormulaParser.parseAll(axioms), FormulaParser.parse(goal));
    }
}

package org.prover.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.prover.antlr.LogicFormulaLexer;
import org.prover.antlr.LogicFormulaParser;
import org.prover.logic.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * PARSER FORMULE - Testo infisso → albero sintattico {@link Expr}
 *
 * Pipeline: Lexing ANTLR → Parsing ANTLR → {@link ExprBuildingVisitor}.
 *
 * SINTASSI (precedenza crescente):
 * - Biimplicazione: A <-> B
 * - Implicazione:   A -> B
 * - Disgiunzione:   A | B
 * - Congiunzione:   A & B
 * - Negazione:      ~A
 * - Parentesi e identificatori [A-Za-z_][A-Za-z0-9_]*
 *
 * Tutti i connettivi binari associano a sinistra; gli spazi sono ignorati.
 * Qualsiasi errore lessicale o sintattico produce una {@link FormulaParseException}.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe di utilità - non istanziabile");
    }

    /**
     * Analizza una singola formula.
     *
     * @param text formula in notazione infissa
     * @return albero sintattico della formula
     * @throws FormulaParseException se il testo è vuoto o non rispetta la grammatica
     */
    public static Expr parse(String text) {
        if (text == null || text.isBlank()) {
            throw new FormulaParseException("Formula vuota", text == null ? "" : text, 1, 0);
        }

        ThrowingErrorListener errorListener = new ThrowingErrorListener(text);

        CharStream input = CharStreams.fromString(text);
        LogicFormulaLexer lexer = new LogicFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        LogicFormulaParser parser = new LogicFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = parser.formula();
        Expr formula = new ExprBuildingVisitor().visit(tree);

        LOGGER.finest("Formula analizzata: " + formula);
        return formula;
    }

    /**
     * Analizza una lista di formule mantenendone l'ordine.
     *
     * @throws FormulaParseException alla prima formula non valida
     */
    public static List<Expr> parseAll(List<String> texts) {
        List<Expr> formulas = new ArrayList<>(texts.size());
        for (String text : texts) {
            formulas.add(parse(text));
        }
        return formulas;
    }

    /**
     * Analizza un elenco di assiomi separati da un delimitatore ("P; P -> Q").
     * I frammenti vuoti sono ignorati.
     *
     * @param text      assiomi concatenati
     * @param delimiter separatore letterale (non espressione regolare)
     * @return formule nell'ordine in cui compaiono
     */
    public static List<Expr> parseAxioms(String text, String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("Delimitatore non può essere null o vuoto");
        }
        List<Expr> axioms = new ArrayList<>();
        if (text == null) {
            return axioms;
        }
        for (String fragment : text.split(Pattern.quote(delimiter))) {
            if (!fragment.isBlank()) {
                axioms.add(parse(fragment));
            }
        }
        LOGGER.fine("Assiomi analizzati: " + axioms.size());
        return axioms;
    }
}

package org.prover.parser;

import org.antlr.v4.runtime.tree.ParseTree;
import org.prover.antlr.LogicFormulaBaseVisitor;
import org.prover.antlr.LogicFormulaParser.ConjContext;
import org.prover.antlr.LogicFormulaParser.DisjContext;
import org.prover.antlr.LogicFormulaParser.FormulaContext;
import org.prover.antlr.LogicFormulaParser.IffContext;
import org.prover.antlr.LogicFormulaParser.ImplyContext;
import org.prover.antlr.LogicFormulaParser.NegationContext;
import org.prover.antlr.LogicFormulaParser.ParenthesisContext;
import org.prover.antlr.LogicFormulaParser.VariableContext;
import org.prover.logic.And;
import org.prover.logic.Expr;
import org.prover.logic.Iff;
import org.prover.logic.Imply;
import org.prover.logic.Not;
import org.prover.logic.Or;
import org.prover.logic.Var;

import java.util.List;
import java.util.function.BinaryOperator;

/**
 * VISITOR ALBERO SINTATTICO - Costruzione dell'AST a partire dal parse tree ANTLR
 *
 * A differenza di una conversione diretta in CNF, il visitor conserva i connettivi
 * originali: implicazioni e biimplicazioni restano nodi {@link Imply} e {@link Iff},
 * così le regole di deduzione naturale possono riconoscerli.
 *
 * ASSOCIATIVITÀ:
 * - Ogni livello della grammatica produce una lista di operandi
 * - Gli operandi sono combinati da sinistra: A op B op C = (A op B) op C
 * - Vale anche per "->" e "<->": P -> Q -> R = (P -> Q) -> R
 */
class ExprBuildingVisitor extends LogicFormulaBaseVisitor<Expr> {

    //region PUNTO DI INGRESSO

    @Override
    public Expr visitFormula(FormulaContext ctx) {
        return visit(ctx.iff());
    }

    //endregion

    //region CONNETTIVI BINARI (PRECEDENZA CRESCENTE)

    @Override
    public Expr visitIff(IffContext ctx) {
        return foldLeft(ctx.imply(), Iff::new);
    }

    @Override
    public Expr visitImply(ImplyContext ctx) {
        return foldLeft(ctx.disj(), Imply::new);
    }

    @Override
    public Expr visitDisj(DisjContext ctx) {
        return foldLeft(ctx.conj(), Or::new);
    }

    @Override
    public Expr visitConj(ConjContext ctx) {
        return foldLeft(ctx.unary(), And::new);
    }

    /**
     * Combina gli operandi di un livello associando a sinistra.
     */
    private Expr foldLeft(List<? extends ParseTree> operands, BinaryOperator<Expr> connective) {
        Expr result = visit(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            result = connective.apply(result, visit(operands.get(i)));
        }
        return result;
    }

    //endregion

    //region OPERANDI UNARI E ATOMICI

    @Override
    public Expr visitNegation(NegationContext ctx) {
        return new Not(visit(ctx.unary()));
    }

    @Override
    public Expr visitParenthesis(ParenthesisContext ctx) {
        return visit(ctx.iff());
    }

    @Override
    public Expr visitVariable(VariableContext ctx) {
        return new Var(ctx.IDENTIFIER().getText());
    }

    //endregion
}

package org.prover.parser;

import org.prover.antlr.LogicFormulaBaseVisitor;
import org.prover.antlr.LogicFormulaParser;
import org.prover.formula.ArithmeticOp;
import org.prover.formula.Term;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converte i sottoalberi {@code term} in {@link Term}.
 *
 * Le variabili legate da un quantificatore ricevono il tipo dichiarato nel
 * binder; quelle libere restano senza tipo.
 */
class TermBuilder extends LogicFormulaBaseVisitor<Term> {

    /** Tipi delle variabili legate nello scope corrente (null se non dichiarato) */
    private final Map<String, String> boundTypes = new HashMap<>();

    //region SCOPE DEI QUANTIFICATORI

    /**
     * Apre lo scope di una variabile legata.
     *
     * @return binding precedente da ripristinare con {@link #unbind}
     */
    BoundVariable bind(String variable, String type) {
        BoundVariable previous = new BoundVariable(variable, boundTypes.containsKey(variable),
                boundTypes.get(variable));
        boundTypes.put(variable, type);
        return previous;
    }

    void unbind(BoundVariable previous) {
        if (previous.shadowed()) {
            boundTypes.put(previous.name(), previous.type());
        } else {
            boundTypes.remove(previous.name());
        }
    }

    record BoundVariable(String name, boolean shadowed, String type) {}

    //endregion

    //region TERMINI COMPOSTI

    @Override
    public Term visitSingleTerm(LogicFormulaParser.SingleTermContext ctx) {
        return visit(ctx.term());
    }

    @Override
    public Term visitIndexTerm(LogicFormulaParser.IndexTermContext ctx) {
        return new Term.ArrayAccess(visit(ctx.array), visit(ctx.index));
    }

    @Override
    public Term visitPowerTerm(LogicFormulaParser.PowerTermContext ctx) {
        return new Term.Arithmetic(ArithmeticOp.POW, visit(ctx.left), visit(ctx.right));
    }

    /** -t diventa 0 - t */
    @Override
    public Term visitNegatedTerm(LogicFormulaParser.NegatedTermContext ctx) {
        Term operand = visit(ctx.term());
        if (operand instanceof Term.Constant constant && !constant.value().startsWith("-")
                && ("Int".equals(constant.type()) || "Real".equals(constant.type()))) {
            return new Term.Constant("-" + constant.value(), constant.type());
        }
        return new Term.Arithmetic(ArithmeticOp.SUB, Term.integer(0), operand);
    }

    @Override
    public Term visitMultiplicativeTerm(LogicFormulaParser.MultiplicativeTermContext ctx) {
        return new Term.Arithmetic(ArithmeticOp.fromSymbol(ctx.op.getText()), visit(ctx.left), visit(ctx.right));
    }

    @Override
    public Term visitAdditiveTerm(LogicFormulaParser.AdditiveTermContext ctx) {
        return new Term.Arithmetic(ArithmeticOp.fromSymbol(ctx.op.getText()), visit(ctx.left), visit(ctx.right));
    }

    @Override
    public Term visitParenTerm(LogicFormulaParser.ParenTermContext ctx) {
        return visit(ctx.term());
    }

    @Override
    public Term visitSetTerm(LogicFormulaParser.SetTermContext ctx) {
        return new Term.SetLiteral(terms(ctx.termList()));
    }

    @Override
    public Term visitFunctionTerm(LogicFormulaParser.FunctionTermContext ctx) {
        return new Term.Function(ctx.IDENTIFIER().getText(), terms(ctx.termList()));
    }

    //endregion

    //region TERMINI ATOMICI

    @Override
    public Term visitNumberTerm(LogicFormulaParser.NumberTermContext ctx) {
        String text = ctx.NUMBER().getText();
        return new Term.Constant(text, text.contains(".") ? "Real" : "Int");
    }

    @Override
    public Term visitStringTerm(LogicFormulaParser.StringTermContext ctx) {
        String text = ctx.STRING().getText();
        return new Term.Constant(text.substring(1, text.length() - 1), "String");
    }

    @Override
    public Term visitHoleTerm(LogicFormulaParser.HoleTermContext ctx) {
        return new Term.Hole(ctx.HOLE().getText().substring(1));
    }

    @Override
    public Term visitVariableTerm(LogicFormulaParser.VariableTermContext ctx) {
        String name = ctx.IDENTIFIER().getText();
        return new Term.Variable(name, boundTypes.get(name));
    }

    //endregion

    /** Termini di una lista opzionale, vuota se assente */
    List<Term> terms(LogicFormulaParser.TermListContext ctx) {
        List<Term> terms = new ArrayList<>();
        if (ctx != null) {
            for (LogicFormulaParser.TermContext term : ctx.term()) {
                terms.add(visit(term));
            }
        }
        return terms;
    }
}

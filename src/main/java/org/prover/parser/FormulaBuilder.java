package org.prover.parser;

import org.prover.antlr.LogicFormulaBaseVisitor;
import org.prover.antlr.LogicFormulaParser;
import org.prover.formula.Formula;
import org.prover.formula.Quantifier;
import org.prover.formula.Term;

import java.util.ArrayList;
import java.util.List;

/**
 * CONVERTITORE DA ALBERO SINTATTICO A FORMULA
 *
 * Visitor sull'albero prodotto dalla grammatica LogicFormula. Ogni livello di
 * precedenza costruisce il nodo corrispondente del modello:
 * - Bicondizionale: catena A <-> B <-> C associata a sinistra
 * - Implicazione e Until: associativi a destra
 * - Disgiunzione e congiunzione: nodi n-ari appiattiti
 * - Quantificatori con più variabili: annidati nell'ordine di dichiarazione
 *
 * I confronti derivati sono ridotti ai due confronti del modello:
 * a < b diventa !(b <= a), a >= b diventa b <= a, a != b diventa !(a = b).
 */
class FormulaBuilder extends LogicFormulaBaseVisitor<Formula> {

    private final TermBuilder terms = new TermBuilder();

    @Override
    public Formula visitSingleFormula(LogicFormulaParser.SingleFormulaContext ctx) {
        return visit(ctx.formula());
    }

    @Override
    public Formula visitFormula(LogicFormulaParser.FormulaContext ctx) {
        return visit(ctx.biconditional());
    }

    //region CONNETTIVI BINARI

    @Override
    public Formula visitBiconditional(LogicFormulaParser.BiconditionalContext ctx) {
        Formula result = visit(ctx.implication(0));
        for (int i = 1; i < ctx.implication().size(); i++) {
            result = new Formula.Biconditional(result, visit(ctx.implication(i)));
        }
        return result;
    }

    @Override
    public Formula visitImplication(LogicFormulaParser.ImplicationContext ctx) {
        Formula antecedent = visit(ctx.until());
        if (ctx.implication() == null) {
            return antecedent;
        }
        return new Formula.Implication(antecedent, visit(ctx.implication()));
    }

    @Override
    public Formula visitUntil(LogicFormulaParser.UntilContext ctx) {
        Formula left = visit(ctx.disjunction());
        if (ctx.until() == null) {
            return left;
        }
        return new Formula.Until(left, visit(ctx.until()));
    }

    @Override
    public Formula visitDisjunction(LogicFormulaParser.DisjunctionContext ctx) {
        if (ctx.conjunction().size() == 1) {
            return visit(ctx.conjunction(0));
        }
        List<Formula> operands = new ArrayList<>();
        for (LogicFormulaParser.ConjunctionContext operand : ctx.conjunction()) {
            operands.add(visit(operand));
        }
        return new Formula.Disjunction(operands);
    }

    @Override
    public Formula visitConjunction(LogicFormulaParser.ConjunctionContext ctx) {
        if (ctx.unary().size() == 1) {
            return visit(ctx.unary(0));
        }
        List<Formula> operands = new ArrayList<>();
        for (LogicFormulaParser.UnaryContext operand : ctx.unary()) {
            operands.add(visit(operand));
        }
        return new Formula.Conjunction(operands);
    }

    //endregion

    //region OPERATORI UNARI E QUANTIFICATORI

    @Override
    public Formula visitNotFormula(LogicFormulaParser.NotFormulaContext ctx) {
        return new Formula.Negation(visit(ctx.unary()));
    }

    @Override
    public Formula visitAlwaysFormula(LogicFormulaParser.AlwaysFormulaContext ctx) {
        return new Formula.Always(visit(ctx.unary()));
    }

    @Override
    public Formula visitEventuallyFormula(LogicFormulaParser.EventuallyFormulaContext ctx) {
        return new Formula.Eventually(visit(ctx.unary()));
    }

    /**
     * forall x:T, y in S. φ diventa forall x:T. forall y in S. φ; il dominio di un
     * binder è letto prima di legarne la variabile.
     */
    @Override
    public Formula visitQuantifiedFormula(LogicFormulaParser.QuantifiedFormulaContext ctx) {
        boolean universal = ctx.quantifier.getType() == LogicFormulaParser.FORALL;
        List<Quantifier> quantifiers = new ArrayList<>();
        List<TermBuilder.BoundVariable> scopes = new ArrayList<>();

        for (LogicFormulaParser.BinderContext binder : ctx.binder()) {
            String variable = binder.variable.getText();
            String type = binder.sort == null ? null : binder.sort.getText();
            Term domain = binder.domain == null ? null : terms.visit(binder.domain);
            quantifiers.add(new Quantifier(variable, type, domain));
            scopes.add(terms.bind(variable, type));
        }

        Formula body;
        try {
            body = visit(ctx.formula());
        } finally {
            for (int i = scopes.size() - 1; i >= 0; i--) {
                terms.unbind(scopes.get(i));
            }
        }

        for (int i = quantifiers.size() - 1; i >= 0; i--) {
            body = universal ? new Formula.Universal(quantifiers.get(i), body)
                    : new Formula.Existential(quantifiers.get(i), body);
        }
        return body;
    }

    @Override
    public Formula visitPrimaryFormula(LogicFormulaParser.PrimaryFormulaContext ctx) {
        return visit(ctx.primary());
    }

    //endregion

    //region FORMULE PRIMARIE

    @Override
    public Formula visitParenFormula(LogicFormulaParser.ParenFormulaContext ctx) {
        return visit(ctx.formula());
    }

    @Override
    public Formula visitTrueFormula(LogicFormulaParser.TrueFormulaContext ctx) {
        return Formula.truth();
    }

    @Override
    public Formula visitFalseFormula(LogicFormulaParser.FalseFormulaContext ctx) {
        return Formula.falsum();
    }

    @Override
    public Formula visitMetaFormula(LogicFormulaParser.MetaFormulaContext ctx) {
        return new Formula.Meta(ctx.META().getText().substring(1));
    }

    @Override
    public Formula visitComparisonFormula(LogicFormulaParser.ComparisonFormulaContext ctx) {
        Term left = terms.visit(ctx.left);
        Term right = terms.visit(ctx.right);
        int operator = ctx.op.getStart().getType();

        if (operator == LogicFormulaParser.EQ) {
            return new Formula.ArithmeticEqual(left, right);
        } else if (operator == LogicFormulaParser.NEQ) {
            return new Formula.Negation(new Formula.ArithmeticEqual(left, right));
        } else if (operator == LogicFormulaParser.LE) {
            return new Formula.ArithmeticLessEqual(left, right);
        } else if (operator == LogicFormulaParser.GE) {
            return new Formula.ArithmeticLessEqual(right, left);
        } else if (operator == LogicFormulaParser.LT) {
            return new Formula.Negation(new Formula.ArithmeticLessEqual(right, left));
        } else {
            return new Formula.Negation(new Formula.ArithmeticLessEqual(left, right));
        }
    }

    @Override
    public Formula visitMembershipFormula(LogicFormulaParser.MembershipFormulaContext ctx) {
        return new Formula.SetMembership(terms.visit(ctx.element), terms.visit(ctx.container));
    }

    @Override
    public Formula visitAtomFormula(LogicFormulaParser.AtomFormulaContext ctx) {
        return new Formula.Atomic(ctx.IDENTIFIER().getText(), terms.terms(ctx.termList()));
    }

    //endregion
}

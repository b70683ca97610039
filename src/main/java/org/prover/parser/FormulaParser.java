package org.prover.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.prover.antlr.LogicFormulaLexer;
import org.prover.antlr.LogicFormulaParser;
import org.prover.axiom.Axiom;
import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;
import org.prover.formula.Term;
import org.prover.verify.VerificationMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER DELLA NOTAZIONE TESTUALE - Punto di ingresso per formule, termini e file di problema
 *
 * PIPELINE:
 * 1. Testo -> lexer LogicFormula -> flusso di token
 * 2. Parser LogicFormula -> albero sintattico (il primo errore interrompe con {@link FormulaParseException})
 * 3. Visitor -> {@link Formula}, {@link Term} o {@link ProblemFile}
 *
 * SINTASSI DEL FILE DI PROBLEMA:
 *   axiom nome: formula.
 *   rule nome: premessa1, premessa2 |- conclusione.
 *   goal nome [by metodo1, metodo2]: formula.
 *
 * Gli identificatori in posizione di termine diventano variabili; ?x è un
 * segnaposto di termine, ?P un segnaposto di formula.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
    }

    public static Formula parseFormula(String text) {
        LogicFormulaParser parser = parserFor(text);
        Formula formula = new FormulaBuilder().visit(parser.singleFormula());
        LOGGER.fine("Formula analizzata: " + formula);
        return formula;
    }

    public static Term parseTerm(String text) {
        LogicFormulaParser parser = parserFor(text);
        return new TermBuilder().visit(parser.singleTerm());
    }

    /**
     * Analizza un file di problema completo.
     *
     * @throws FormulaParseException per errori di sintassi, nomi duplicati o metodi sconosciuti
     */
    public static ProblemFile parseProblem(String text) {
        LogicFormulaParser parser = parserFor(text);
        LogicFormulaParser.ProblemContext problem = parser.problem();

        List<Axiom> axioms = new ArrayList<>();
        List<InferenceRule> rules = new ArrayList<>();
        List<GoalSpec> goals = new ArrayList<>();
        List<String> names = new ArrayList<>();

        for (LogicFormulaParser.StatementContext statement : problem.statement()) {
            FormulaBuilder builder = new FormulaBuilder();

            if (statement instanceof LogicFormulaParser.AxiomStatementContext axiom) {
                String name = declare(names, axiom.name);
                axioms.add(Axiom.of(name, builder.visit(axiom.formula())));

            } else if (statement instanceof LogicFormulaParser.RuleStatementContext rule) {
                String name = declare(names, rule.name);
                List<Formula> premises = new ArrayList<>();
                if (rule.premises() != null) {
                    for (LogicFormulaParser.FormulaContext premise : rule.premises().formula()) {
                        premises.add(builder.visit(premise));
                    }
                }
                rules.add(InferenceRule.of(name, premises, builder.visit(rule.formula())));

            } else if (statement instanceof LogicFormulaParser.GoalStatementContext goal) {
                String name = declare(names, goal.name);
                goals.add(new GoalSpec(name, builder.visit(goal.formula()), methods(goal.methodList())));
            }
        }

        LOGGER.fine(String.format("Problema analizzato: %d assiomi, %d regole, %d obiettivi",
                axioms.size(), rules.size(), goals.size()));
        return new ProblemFile(axioms, rules, goals);
    }

    //region SUPPORTO

    private static LogicFormulaParser parserFor(String text) {
        if (text == null) {
            throw new FormulaParseException("Testo da analizzare non può essere null");
        }
        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ParseErrorListener.INSTANCE);

        LogicFormulaParser parser = new LogicFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ParseErrorListener.INSTANCE);
        return parser;
    }

    private static String declare(List<String> names, Token token) {
        String name = token.getText();
        if (names.contains(name)) {
            throw new FormulaParseException(token.getLine(), token.getCharPositionInLine(),
                    "nome '" + name + "' già dichiarato");
        }
        names.add(name);
        return name;
    }

    private static List<VerificationMethod> methods(LogicFormulaParser.MethodListContext ctx) {
        List<VerificationMethod> methods = new ArrayList<>();
        if (ctx == null) {
            return methods;
        }
        for (TerminalNode identifier : ctx.IDENTIFIER()) {
            try {
                methods.add(VerificationMethod.fromName(identifier.getText()));
            } catch (IllegalArgumentException e) {
                Token token = identifier.getSymbol();
                throw new FormulaParseException(token.getLine(), token.getCharPositionInLine(), e.getMessage());
            }
        }
        return methods;
    }

    //endregion
}

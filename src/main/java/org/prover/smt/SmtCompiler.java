package org.prover.smt;

import org.prover.formula.Formula;
import org.prover.formula.Quantifier;
import org.prover.formula.Term;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * COMPILATORE LOGICO - Traduzione del modello di formule in S-espressioni SMT-LIB
 *
 * Funzione totale: ogni forma di formula e di termine ha una traduzione.
 *
 * TRADUZIONI PRINCIPALI:
 * • Atomic -> (P t1 ... tn), senza spazio finale se non ci sono termini: (P)
 * • ¬ ∧ ∨ → ↔ -> not and or => =
 * • ∀ ∃ -> forall / exists con binder singolo ((x Sort)), Int se il tipo manca
 * • □φ -> (forall ((t Int)) (=> (>= t 0) φ))
 * • ◇φ -> (exists ((t Int)) (and (>= t 0) φ))
 * • ψ U φ -> (exists ((t Int)) (and (>= t 0) φ (forall ((s Int)) (=> (and (>= s 0) (< s t)) ψ))))
 *
 * Le variabili temporali sono generate fresche da un contatore per prefisso,
 * mai riusato all'interno della stessa istanza finché non si chiama {@link #reset()}.
 * Un'istanza non è thread-safe: il chiamante ne usa una per compilazione.
 */
public class SmtCompiler {

    private static final Logger LOGGER = Logger.getLogger(SmtCompiler.class.getName());

    private static final Pattern SIMPLE_SYMBOL = Pattern.compile("[A-Za-z~!@$%^&*_+=<>.?/\\-][A-Za-z0-9~!@$%^&*_+=<>.?/\\-]*");

    /** Insieme vuoto di interi: array costante a false */
    static final String EMPTY_SET = "((as const (Array Int Bool)) false)";

    private final Map<String, Integer> freshCounters = new HashMap<>();

    //region VARIABILI FRESCHE

    /**
     * Genera un nome di variabile mai restituito prima per lo stesso prefisso.
     *
     * @param prefix prefisso del nome (es. "t", "s")
     * @return nome nella forma prefix_n
     */
    public String freshVariable(String prefix) {
        int next = freshCounters.merge(prefix, 1, Integer::sum) - 1;
        return prefix + "_" + next;
    }

    /** Azzera i contatori delle variabili fresche */
    public void reset() {
        freshCounters.clear();
    }

    //endregion

    //region FORMULE

    /**
     * Compila una formula in testo SMT-LIB.
     *
     * @param formula formula da tradurre (non null)
     * @return S-espressione equivalente
     */
    public String compile(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da compilare non può essere null");
        }
        switch (formula.kind()) {
            case ATOMIC: {
                Formula.Atomic atomic = (Formula.Atomic) formula;
                if (atomic.terms().isEmpty() && isBooleanLiteral(atomic.predicate())) {
                    return atomic.predicate();
                }
                return application(atomic.predicate(), atomic.terms());
            }
            case NEGATION:
                return "(not " + compile(((Formula.Negation) formula).inner()) + ")";
            case CONJUNCTION:
                return nary("and", ((Formula.Conjunction) formula).operands());
            case DISJUNCTION:
                return nary("or", ((Formula.Disjunction) formula).operands());
            case IMPLICATION: {
                Formula.Implication implication = (Formula.Implication) formula;
                return "(=> " + compile(implication.antecedent()) + " " + compile(implication.consequent()) + ")";
            }
            case BICONDITIONAL: {
                Formula.Biconditional biconditional = (Formula.Biconditional) formula;
                return "(= " + compile(biconditional.left()) + " " + compile(biconditional.right()) + ")";
            }
            case UNIVERSAL: {
                Formula.Universal universal = (Formula.Universal) formula;
                return quantified("forall", universal.quantifier(), universal.body());
            }
            case EXISTENTIAL: {
                Formula.Existential existential = (Formula.Existential) formula;
                return quantified("exists", existential.quantifier(), existential.body());
            }
            case ALWAYS:
                return compileAlways(((Formula.Always) formula).inner());
            case EVENTUALLY:
                return compileEventually(((Formula.Eventually) formula).inner());
            case UNTIL: {
                Formula.Until until = (Formula.Until) formula;
                return compileUntil(until.left(), until.right());
            }
            case EQUAL: {
                Formula.ArithmeticEqual equal = (Formula.ArithmeticEqual) formula;
                return "(= " + compile(equal.left()) + " " + compile(equal.right()) + ")";
            }
            case LESS_EQUAL: {
                Formula.ArithmeticLessEqual lessEqual = (Formula.ArithmeticLessEqual) formula;
                return "(<= " + compile(lessEqual.left()) + " " + compile(lessEqual.right()) + ")";
            }
            case MEMBERSHIP: {
                Formula.SetMembership membership = (Formula.SetMembership) formula;
                return "(select " + compile(membership.set()) + " " + compile(membership.element()) + ")";
            }
            case FUNCTION_APPLICATION: {
                Formula.FunctionApplication application = (Formula.FunctionApplication) formula;
                return application(application.name(), application.arguments());
            }
            case META:
                return symbol("?" + ((Formula.Meta) formula).name());
            default:
                throw new IllegalStateException("Tipo di formula non gestito: " + formula.kind());
        }
    }

    private String compileAlways(Formula inner) {
        String t = freshVariable("t");
        return "(forall ((" + t + " Int)) (=> (>= " + t + " 0) " + compile(inner) + "))";
    }

    private String compileEventually(Formula inner) {
        String t = freshVariable("t");
        return "(exists ((" + t + " Int)) (and (>= " + t + " 0) " + compile(inner) + "))";
    }

    private String compileUntil(Formula left, Formula right) {
        String t = freshVariable("t");
        String s = freshVariable("s");
        String rightText = compile(right);
        String leftText = compile(left);
        LOGGER.finest("Codifica until con variabili " + t + ", " + s);
        return "(exists ((" + t + " Int)) (and (>= " + t + " 0) " + rightText
                + " (forall ((" + s + " Int)) (=> (and (>= " + s + " 0) (< " + s + " " + t + ")) " + leftText + "))))";
    }

    private String quantified(String binder, Quantifier quantifier, Formula body) {
        String variable = symbol(quantifier.variable());
        String sort = SmtSorts.fromTypeTag(quantifier.type());
        String bodyText = compile(body);
        if (quantifier.hasDomain()) {
            // restrizione di dominio: (select D x) come guardia del corpo
            String guard = "(select " + compile(quantifier.domain()) + " " + variable + ")";
            bodyText = binder.equals("forall") ? "(=> " + guard + " " + bodyText + ")" : "(and " + guard + " " + bodyText + ")";
        }
        return "(" + binder + " ((" + variable + " " + sort + ")) " + bodyText + ")";
    }

    private String nary(String operator, List<Formula> operands) {
        StringBuilder sb = new StringBuilder("(").append(operator);
        for (Formula operand : operands) {
            sb.append(' ').append(compile(operand));
        }
        return sb.append(')').toString();
    }

    //endregion

    //region TERMINI

    /**
     * Compila un termine in testo SMT-LIB.
     *
     * @param term termine da tradurre (non null)
     * @return S-espressione equivalente
     */
    public String compile(Term term) {
        if (term == null) {
            throw new IllegalArgumentException("Termine da compilare non può essere null");
        }
        return switch (term.kind()) {
            case VARIABLE -> symbol(((Term.Variable) term).name());
            case CONSTANT -> compileConstant((Term.Constant) term);
            case FUNCTION -> {
                Term.Function function = (Term.Function) term;
                yield function.arguments().isEmpty() ? symbol(function.name()) : application(function.name(), function.arguments());
            }
            case ARITHMETIC -> {
                Term.Arithmetic arithmetic = (Term.Arithmetic) term;
                yield "(" + arithmetic.operator().smtSymbol() + " " + compile(arithmetic.left()) + " " + compile(arithmetic.right()) + ")";
            }
            case SET -> compileSet((Term.SetLiteral) term);
            case ARRAY_ACCESS -> {
                Term.ArrayAccess access = (Term.ArrayAccess) term;
                yield "(select " + compile(access.array()) + " " + compile(access.index()) + ")";
            }
            case HOLE -> symbol("?" + ((Term.Hole) term).name());
        };
    }

    /**
     * Traduce una costante secondo il sort della sua etichetta di tipo; le
     * costanti di sort non interpretati diventano simboli dichiarati nello script.
     */
    private String compileConstant(Term.Constant constant) {
        String value = constant.value();
        switch (SmtSorts.fromTypeTag(constant.type())) {
            case SmtSorts.INT:
            case SmtSorts.REAL:
                return value;
            case SmtSorts.BOOL:
                return Boolean.parseBoolean(value.trim()) ? "true" : "false";
            case SmtSorts.STRING:
                return '"' + value.replace("\"", "\"\"") + '"';
            default:
                return symbol(value);
        }
    }

    private String compileSet(Term.SetLiteral set) {
        String result = EMPTY_SET;
        for (Term element : set.elements()) {
            result = "(store " + result + " " + compile(element) + " true)";
        }
        return result;
    }

    //endregion

    //region SUPPORTO

    private String application(String name, List<Term> arguments) {
        StringBuilder sb = new StringBuilder("(").append(symbol(name));
        for (Term argument : arguments) {
            sb.append(' ').append(compile(argument));
        }
        return sb.append(')').toString();
    }

    private static boolean isBooleanLiteral(String name) {
        return "true".equals(name) || "false".equals(name);
    }

    /**
     * Nome come simbolo SMT-LIB: invariato se semplice, altrimenti racchiuso tra barre.
     */
    static String symbol(String name) {
        if (SIMPLE_SYMBOL.matcher(name).matches()) {
            return name;
        }
        return "|" + name.replace("|", "") + "|";
    }

    //endregion
}

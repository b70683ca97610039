package org.prover.smt;

import org.prover.formula.Formula;
import org.prover.formula.Formulas;
import org.prover.formula.PropertyFormula;
import org.prover.formula.Quantifier;
import org.prover.formula.Term;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * COSTRUTTORE DI SCRIPT SMT-LIB
 *
 * Produce lo script completo inviato al solutore per una proprietà:
 * 1. commento di intestazione (;;)
 * 2. dichiarazioni di sort, costanti e funzioni dedotte dall'albero
 * 3. (assert (not φ)): la proprietà vale se la sua negazione è insoddisfacibile
 * 4. (check-sat) e, su richiesta, (get-model)
 *
 * Le costanti con un tipo non predefinito sono dichiarate come simboli di un
 * sort non interpretato con lo stesso nome.
 *
 * I sort dei simboli sono dedotti dall'uso: tipo dichiarato se presente,
 * insieme se il simbolo compare a destra di un'appartenenza, array se indicizzato,
 * Int altrimenti.
 */
public class SmtScriptBuilder {

    private static final Logger LOGGER = Logger.getLogger(SmtScriptBuilder.class.getName());

    private final SmtCompiler compiler;
    private final boolean requestModel;

    public SmtScriptBuilder(SmtCompiler compiler, boolean requestModel) {
        if (compiler == null) {
            throw new IllegalArgumentException("Compilatore non può essere null");
        }
        this.compiler = compiler;
        this.requestModel = requestModel;
    }

    public SmtScriptBuilder() {
        this(new SmtCompiler(), false);
    }

    /**
     * Costruisce lo script di verifica di una proprietà.
     *
     * @param name nome della proprietà, riportato nel commento di intestazione
     * @param property proprietà da verificare
     * @return testo SMT-LIB pronto per la validazione e l'invio al solutore
     */
    public String build(String name, PropertyFormula property) {
        compiler.reset();
        Declarations declarations = new Declarations();
        declarations.collect(property.structure(), new ArrayDeque<>());

        StringBuilder script = new StringBuilder();
        script.append(";; proprietà: ").append(name == null ? "anonima" : name.replace('\n', ' ')).append('\n');
        for (String sort : declarations.sorts) {
            script.append("(declare-sort ").append(sort).append(" 0)\n");
        }
        for (Map.Entry<String, String> constant : declarations.constants.entrySet()) {
            script.append("(declare-const ").append(SmtCompiler.symbol(constant.getKey())).append(' ')
                    .append(constant.getValue()).append(")\n");
        }
        for (Map.Entry<String, Signature> function : declarations.functions.entrySet()) {
            Signature signature = function.getValue();
            script.append("(declare-fun ").append(SmtCompiler.symbol(function.getKey())).append(" (")
                    .append(String.join(" ", signature.arguments)).append(") ").append(signature.result).append(")\n");
        }
        script.append("(assert (not ").append(compiler.compile(property.structure())).append("))\n");
        script.append("(check-sat)\n");
        if (requestModel) {
            script.append("(get-model)\n");
        }

        LOGGER.fine("Script SMT generato per " + name + ": " + declarations.constants.size() + " costanti, "
                + declarations.functions.size() + " funzioni");
        return script.toString();
    }

    //region DEDUZIONE DELLE DICHIARAZIONI

    private record Signature(List<String> arguments, String result) {}

    /**
     * Raccolta delle dichiarazioni con deduzione dei sort dall'uso.
     */
    private static final class Declarations {
        private final Set<String> sorts = new LinkedHashSet<>();
        private final Map<String, String> constants = new LinkedHashMap<>();
        private final Map<String, Signature> functions = new LinkedHashMap<>();
        private final Map<String, String> boundSorts = new LinkedHashMap<>();

        void collect(Formula formula, Deque<String> bound) {
            switch (formula.kind()) {
                case ATOMIC -> {
                    Formula.Atomic atomic = (Formula.Atomic) formula;
                    boolean literal = atomic.terms().isEmpty()
                            && ("true".equals(atomic.predicate()) || "false".equals(atomic.predicate()));
                    if (!literal) {
                        declareFunction(atomic.predicate(), atomic.terms(), SmtSorts.BOOL, bound);
                    }
                    collectTerms(atomic.terms(), bound);
                }
                case FUNCTION_APPLICATION -> {
                    Formula.FunctionApplication application = (Formula.FunctionApplication) formula;
                    declareFunction(application.name(), application.arguments(), SmtSorts.BOOL, bound);
                    collectTerms(application.arguments(), bound);
                }
                case META -> constants.putIfAbsent("?" + ((Formula.Meta) formula).name(), SmtSorts.BOOL);
                case MEMBERSHIP -> {
                    Formula.SetMembership membership = (Formula.SetMembership) formula;
                    hint(membership.set(), SmtSorts.INT_SET, bound);
                    collectTerms(List.of(membership.element(), membership.set()), bound);
                }
                case UNIVERSAL, EXISTENTIAL -> {
                    Quantifier quantifier = formula instanceof Formula.Universal u ? u.quantifier()
                            : ((Formula.Existential) formula).quantifier();
                    String sort = SmtSorts.fromTypeTag(quantifier.type());
                    if (!SmtSorts.isBuiltin(sort)) {
                        sorts.add(sort);
                    }
                    if (quantifier.hasDomain()) {
                        hint(quantifier.domain(), SmtSorts.INT_SET, bound);
                        collectTerm(quantifier.domain(), bound);
                    }
                    String previous = boundSorts.put(quantifier.variable(), sort);
                    bound.push(quantifier.variable());
                    collect(Formulas.children(formula).get(0), bound);
                    bound.pop();
                    if (previous != null) {
                        boundSorts.put(quantifier.variable(), previous);
                    } else {
                        boundSorts.remove(quantifier.variable());
                    }
                }
                default -> {
                    collectTerms(Formulas.terms(formula), bound);
                    for (Formula child : Formulas.children(formula)) {
                        collect(child, bound);
                    }
                }
            }
        }

        private void collectTerms(List<Term> terms, Deque<String> bound) {
            for (Term term : terms) {
                collectTerm(term, bound);
            }
        }

        private void collectTerm(Term term, Deque<String> bound) {
            switch (term.kind()) {
                case VARIABLE -> {
                    Term.Variable variable = (Term.Variable) term;
                    if (!bound.contains(variable.name())) {
                        String sort = SmtSorts.fromTypeTag(variable.type());
                        if (!SmtSorts.isBuiltin(sort)) {
                            sorts.add(sort);
                        }
                        constants.putIfAbsent(variable.name(), sort);
                    }
                }
                case HOLE -> constants.putIfAbsent("?" + ((Term.Hole) term).name(), SmtSorts.INT);
                case CONSTANT -> {
                    // i valori dei sort predefiniti sono letterali, gli altri simboli del loro sort
                    Term.Constant constant = (Term.Constant) term;
                    String sort = SmtSorts.fromTypeTag(constant.type());
                    if (!SmtSorts.isBuiltin(sort)) {
                        sorts.add(sort);
                        constants.putIfAbsent(constant.value(), sort);
                    }
                }
                case FUNCTION -> {
                    Term.Function function = (Term.Function) term;
                    if (function.arguments().isEmpty()) {
                        constants.putIfAbsent(function.name(), SmtSorts.INT);
                    } else {
                        declareFunction(function.name(), function.arguments(), SmtSorts.INT, bound);
                    }
                    collectTerms(function.arguments(), bound);
                }
                case ARRAY_ACCESS -> {
                    Term.ArrayAccess access = (Term.ArrayAccess) term;
                    hint(access.array(), SmtSorts.INT_ARRAY, bound);
                    collectTerm(access.array(), bound);
                    collectTerm(access.index(), bound);
                }
                default -> collectTerms(Formulas.children(term), bound);
            }
        }

        // l'uso come insieme o array prevale sul sort di default
        private void hint(Term term, String sort, Deque<String> bound) {
            if (term instanceof Term.Variable variable && !bound.contains(variable.name())
                    && (variable.type() == null || variable.type().isBlank())) {
                constants.put(variable.name(), sort);
            }
        }

        private void declareFunction(String name, List<Term> arguments, String result, Deque<String> bound) {
            if (functions.containsKey(name)) {
                return;
            }
            List<String> argumentSorts = new ArrayList<>();
            for (Term argument : arguments) {
                argumentSorts.add(sortOf(argument, bound));
            }
            functions.put(name, new Signature(argumentSorts, result));
        }

        private String sortOf(Term term, Deque<String> bound) {
            return switch (term.kind()) {
                case VARIABLE -> {
                    Term.Variable variable = (Term.Variable) term;
                    if (bound.contains(variable.name())) {
                        yield boundSorts.getOrDefault(variable.name(), SmtSorts.INT);
                    }
                    yield variable.type() != null ? SmtSorts.fromTypeTag(variable.type())
                            : constants.getOrDefault(variable.name(), SmtSorts.INT);
                }
                case CONSTANT -> SmtSorts.fromTypeTag(((Term.Constant) term).type());
                case ARITHMETIC -> {
                    Term.Arithmetic arithmetic = (Term.Arithmetic) term;
                    boolean real = SmtSorts.REAL.equals(sortOf(arithmetic.left(), bound))
                            || SmtSorts.REAL.equals(sortOf(arithmetic.right(), bound));
                    yield real ? SmtSorts.REAL : SmtSorts.INT;
                }
                case SET -> SmtSorts.INT_SET;
                case FUNCTION, ARRAY_ACCESS, HOLE -> SmtSorts.INT;
            };
        }
    }

    //endregion
}

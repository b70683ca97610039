package org.prover.search;

import org.prover.formula.Formula;
import org.prover.formula.Formulas;
import org.prover.formula.Quantifier;
import org.prover.formula.Term;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * CONVERSIONE IN FORMA CLAUSALE per la risoluzione al primo ordine
 *
 * PIPELINE TRASFORMAZIONE:
 * 1. Eliminazione di implicazioni, bicondizionali e restrizioni di dominio
 * 2. Forma normale negativa: negazioni spinte sugli atomi (De Morgan, dualità dei quantificatori)
 * 3. Skolemizzazione: le esistenziali diventano funzioni sk_n delle universali che le dominano,
 *    le universali diventano variabili di clausola (segnaposto)
 * 4. Distribuzione OR su AND e costruzione delle clausole
 * 5. Semplificazione: rimozione dei letterali falsi, scarto delle tautologie
 *
 * Un'istanza mantiene i contatori di Skolem e di rinomina: convertire più formule
 * con la stessa istanza garantisce simboli e variabili distinti tra le formule.
 */
public class ClauseConverter {

    private static final Logger LOGGER = Logger.getLogger(ClauseConverter.class.getName());

    private int skolemCounter = 0;
    private int variableCounter = 0;

    //region INTERFACCIA PUBBLICA

    /**
     * Converte la formula in un insieme di clausole equisoddisfacibile.
     *
     * @param formula formula di partenza (variabili libere trattate come costanti)
     * @return clausole non tautologiche, senza duplicati, nell'ordine di generazione
     */
    public List<Clause> toClauses(Formula formula) {
        Formula result = eliminateConnectives(formula);
        result = toNegationNormalForm(result, false);
        result = skolemize(result, new ArrayList<>());
        LOGGER.finest("Forma skolemizzata: " + result);

        Map<String, Clause> unique = new LinkedHashMap<>();
        for (List<Literal> literals : distribute(result)) {
            Clause clause = new Clause(literals).withoutFalseLiterals();
            if (!clause.isTautology()) {
                unique.putIfAbsent(clause.canonicalKey(), clause);
            }
        }
        LOGGER.fine("Clausole generate per " + formula + ": " + unique.size());
        return new ArrayList<>(unique.values());
    }

    //endregion

    //region ELIMINAZIONE CONNETTIVI

    /**
     * TRASFORMAZIONI APPLICATE:
     * • A -> B  diventa  !A | B
     * • A <-> B  diventa  (!A | B) & (A | !B)
     * • forall x in S. A  diventa  forall x. !(x in S) | A
     * • exists x in S. A  diventa  exists x. (x in S) & A
     */
    private Formula eliminateConnectives(Formula formula) {
        switch (formula.kind()) {
            case IMPLICATION: {
                Formula.Implication implication = (Formula.Implication) formula;
                return Formula.or(Formula.not(eliminateConnectives(implication.antecedent())),
                        eliminateConnectives(implication.consequent()));
            }
            case BICONDITIONAL: {
                Formula.Biconditional biconditional = (Formula.Biconditional) formula;
                Formula left = eliminateConnectives(biconditional.left());
                Formula right = eliminateConnectives(biconditional.right());
                return Formula.and(Formula.or(Formula.not(left), right), Formula.or(left, Formula.not(right)));
            }
            case UNIVERSAL: {
                Formula.Universal universal = (Formula.Universal) formula;
                Quantifier quantifier = universal.quantifier();
                Formula body = eliminateConnectives(universal.body());
                if (quantifier.hasDomain()) {
                    Formula guard = Formula.member(new Term.Variable(quantifier.variable(), quantifier.type()),
                            quantifier.domain());
                    body = Formula.or(Formula.not(guard), body);
                }
                return new Formula.Universal(withoutDomain(quantifier), body);
            }
            case EXISTENTIAL: {
                Formula.Existential existential = (Formula.Existential) formula;
                Quantifier quantifier = existential.quantifier();
                Formula body = eliminateConnectives(existential.body());
                if (quantifier.hasDomain()) {
                    Formula guard = Formula.member(new Term.Variable(quantifier.variable(), quantifier.type()),
                            quantifier.domain());
                    body = Formula.and(guard, body);
                }
                return new Formula.Existential(withoutDomain(quantifier), body);
            }
            default:
                return Formulas.mapChildren(formula, this::eliminateConnectives, term -> term);
        }
    }

    private static Quantifier withoutDomain(Quantifier quantifier) {
        return new Quantifier(quantifier.variable(), quantifier.type(), null);
    }

    //endregion

    //region FORMA NORMALE NEGATIVA

    /**
     * Spinge le negazioni verso gli atomi. Il flag indica se il nodo corrente
     * si trova sotto un numero dispari di negazioni.
     *
     * Formule temporali, confronti e appartenenze sono atomi opachi: la negazione
     * resta sopra di esse.
     */
    private Formula toNegationNormalForm(Formula formula, boolean negated) {
        return switch (formula.kind()) {
            case NEGATION -> toNegationNormalForm(((Formula.Negation) formula).inner(), !negated);

            case CONJUNCTION -> {
                List<Formula> operands = new ArrayList<>();
                for (Formula operand : ((Formula.Conjunction) formula).operands()) {
                    operands.add(toNegationNormalForm(operand, negated));
                }
                yield negated ? new Formula.Disjunction(operands) : new Formula.Conjunction(operands);
            }

            case DISJUNCTION -> {
                List<Formula> operands = new ArrayList<>();
                for (Formula operand : ((Formula.Disjunction) formula).operands()) {
                    operands.add(toNegationNormalForm(operand, negated));
                }
                yield negated ? new Formula.Conjunction(operands) : new Formula.Disjunction(operands);
            }

            case UNIVERSAL -> {
                Formula.Universal universal = (Formula.Universal) formula;
                Formula body = toNegationNormalForm(universal.body(), negated);
                yield negated ? new Formula.Existential(universal.quantifier(), body)
                        : new Formula.Universal(universal.quantifier(), body);
            }

            case EXISTENTIAL -> {
                Formula.Existential existential = (Formula.Existential) formula;
                Formula body = toNegationNormalForm(existential.body(), negated);
                yield negated ? new Formula.Universal(existential.quantifier(), body)
                        : new Formula.Existential(existential.quantifier(), body);
            }

            default -> negated ? new Formula.Negation(formula) : formula;
        };
    }

    //endregion

    //region SKOLEMIZZAZIONE

    /**
     * @param formula formula in forma normale negativa
     * @param universals variabili di clausola delle universali che dominano il nodo
     */
    private Formula skolemize(Formula formula, List<Term> universals) {
        switch (formula.kind()) {
            case UNIVERSAL: {
                Formula.Universal universal = (Formula.Universal) formula;
                String variable = universal.quantifier().variable();
                Term.Hole hole = new Term.Hole(variable + "'" + (variableCounter++));
                List<Term> extended = new ArrayList<>(universals);
                extended.add(hole);
                return skolemize(Formulas.substituteVariable(universal.body(), variable, hole), extended);
            }
            case EXISTENTIAL: {
                Formula.Existential existential = (Formula.Existential) formula;
                Term skolem = new Term.Function("sk_" + (skolemCounter++), universals);
                return skolemize(Formulas.substituteVariable(existential.body(),
                        existential.quantifier().variable(), skolem), universals);
            }
            case CONJUNCTION, DISJUNCTION:
                return Formulas.mapChildren(formula, child -> skolemize(child, universals), term -> term);
            default:
                return formula;
        }
    }

    //endregion

    //region DISTRIBUZIONE

    /**
     * Distribuisce OR su AND restituendo direttamente le liste di letterali.
     *
     * PROPRIETÀ DISTRIBUTIVA APPLICATA:
     * • A | (B & C) diventa (A | B) & (A | C)
     * • (A & B) | (C & D) diventa (A | C) & (A | D) & (B | C) & (B | D)
     */
    private List<List<Literal>> distribute(Formula formula) {
        switch (formula.kind()) {
            case CONJUNCTION: {
                List<List<Literal>> clauses = new ArrayList<>();
                for (Formula operand : ((Formula.Conjunction) formula).operands()) {
                    clauses.addAll(distribute(operand));
                }
                return clauses;
            }
            case DISJUNCTION: {
                List<List<Literal>> product = new ArrayList<>();
                product.add(new ArrayList<>());
                for (Formula operand : ((Formula.Disjunction) formula).operands()) {
                    List<List<Literal>> operandClauses = distribute(operand);
                    List<List<Literal>> next = new ArrayList<>();
                    for (List<Literal> partial : product) {
                        for (List<Literal> clause : operandClauses) {
                            List<Literal> combined = new ArrayList<>(partial);
                            combined.addAll(clause);
                            next.add(combined);
                        }
                    }
                    product = next;
                }
                return product;
            }
            case NEGATION: {
                List<List<Literal>> clauses = new ArrayList<>();
                clauses.add(List.of(Literal.negative(((Formula.Negation) formula).inner())));
                return clauses;
            }
            default: {
                List<List<Literal>> clauses = new ArrayList<>();
                clauses.add(List.of(Literal.positive(formula)));
                return clauses;
            }
        }
    }

    //endregion
}

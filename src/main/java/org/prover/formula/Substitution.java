package org.prover.formula;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Sostituzione immutabile dai segnaposto di pattern ai loro valori.
 *
 * I segnaposto di termine ({@link Term.Hole}) sono legati a termini, quelli di
 * formula ({@link Formula.Meta}) a formule. I due spazi di nomi sono separati.
 * L'applicazione segue le catene di legami fino a un valore non legato e
 * rinomina le variabili legate che catturerebbero una variabile libera di un
 * valore sostituito.
 */
public final class Substitution {

    private static final Substitution EMPTY = new Substitution(Map.of(), Map.of());

    private final Map<String, Term> terms;
    private final Map<String, Formula> formulas;

    private Substitution(Map<String, Term> terms, Map<String, Formula> formulas) {
        this.terms = terms;
        this.formulas = formulas;
    }

    public static Substitution empty() {
        return EMPTY;
    }

    //region ESTENSIONE

    /**
     * Restituisce una nuova sostituzione con il legame aggiuntivo hole -> term.
     */
    public Substitution bind(String hole, Term term) {
        Map<String, Term> extended = new LinkedHashMap<>(terms);
        extended.put(hole, term);
        return new Substitution(Collections.unmodifiableMap(extended), formulas);
    }

    /**
     * Restituisce una nuova sostituzione con il legame aggiuntivo meta -> formula.
     */
    public Substitution bind(String meta, Formula formula) {
        Map<String, Formula> extended = new LinkedHashMap<>(formulas);
        extended.put(meta, formula);
        return new Substitution(terms, Collections.unmodifiableMap(extended));
    }

    //endregion

    //region INTERROGAZIONE

    public boolean isEmpty() {
        return terms.isEmpty() && formulas.isEmpty();
    }

    public int size() {
        return terms.size() + formulas.size();
    }

    public Term termBinding(String hole) {
        return terms.get(hole);
    }

    public Formula formulaBinding(String meta) {
        return formulas.get(meta);
    }

    /**
     * Segue la catena di legami di un termine finché non incontra un valore
     * che non è un segnaposto legato.
     */
    public Term walk(Term term) {
        Term current = term;
        while (current instanceof Term.Hole hole && terms.containsKey(hole.name())) {
            current = terms.get(hole.name());
        }
        return current;
    }

    public Formula walk(Formula formula) {
        Formula current = formula;
        while (current instanceof Formula.Meta meta && formulas.containsKey(meta.name())) {
            current = formulas.get(meta.name());
        }
        return current;
    }

    //endregion

    //region APPLICAZIONE

    public Term apply(Term term) {
        Term walked = walk(term);
        if (walked instanceof Term.Hole) {
            return walked;
        }
        return Formulas.mapChildren(walked, this::apply);
    }

    public Formula apply(Formula formula) {
        if (isEmpty()) {
            return formula;
        }
        Formula walked = walk(formula);
        if (walked instanceof Formula.Meta) {
            return walked;
        }
        if (walked instanceof Formula.Universal universal) {
            String fresh = freshBinder(universal.quantifier().variable(), universal.body());
            if (fresh != null) {
                walked = new Formula.Universal(universal.quantifier().withVariable(fresh),
                        rebind(universal.body(), universal.quantifier(), fresh));
            }
        } else if (walked instanceof Formula.Existential existential) {
            String fresh = freshBinder(existential.quantifier().variable(), existential.body());
            if (fresh != null) {
                walked = new Formula.Existential(existential.quantifier().withVariable(fresh),
                        rebind(existential.body(), existential.quantifier(), fresh));
            }
        }
        return Formulas.mapChildren(walked, this::apply, this::apply);
    }

    /**
     * Nuovo nome per la variabile legata quando un valore sostituito nel corpo
     * la contiene libera, altrimenti null.
     */
    private String freshBinder(String variable, Formula body) {
        Set<String> introduced = new HashSet<>();
        collectIntroduced(body, introduced);
        if (!introduced.contains(variable)) {
            return null;
        }
        Set<String> taken = new HashSet<>(introduced);
        taken.addAll(Formulas.freeVariables(body));
        int index = 1;
        String candidate = variable + "_" + index;
        while (taken.contains(candidate)) {
            candidate = variable + "_" + (++index);
        }
        return candidate;
    }

    private static Formula rebind(Formula body, Quantifier quantifier, String fresh) {
        return Formulas.substituteVariable(body, quantifier.variable(), new Term.Variable(fresh, quantifier.type()));
    }

    private void collectIntroduced(Formula formula, Set<String> out) {
        if (formula instanceof Formula.Meta meta && formulas.containsKey(meta.name())) {
            out.addAll(Formulas.freeVariables(apply(formula)));
            return;
        }
        for (Term term : Formulas.terms(formula)) {
            collectIntroduced(term, out);
        }
        for (Formula child : Formulas.children(formula)) {
            collectIntroduced(child, out);
        }
    }

    private void collectIntroduced(Term term, Set<String> out) {
        if (term instanceof Term.Hole hole && terms.containsKey(hole.name())) {
            out.addAll(Formulas.freeVariables(apply(term)));
            return;
        }
        for (Term child : Formulas.children(term)) {
            collectIntroduced(child, out);
        }
    }

    //endregion

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Substitution other)) return false;
        return terms.equals(other.terms) && formulas.equals(other.formulas);
    }

    @Override
    public int hashCode() {
        return 31 * terms.hashCode() + formulas.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        terms.forEach((k, v) -> sb.append(sb.length() > 1 ? ", " : "").append('?').append(k).append(" := ").append(v));
        formulas.forEach((k, v) -> sb.append(sb.length() > 1 ? ", " : "").append('?').append(k).append(" := ").append(v));
        return sb.append('}').toString();
    }
}

package org.prover.formula;

/**
 * Quantificatore: variabile legata, annotazione di tipo opzionale e
 * restrizione di dominio opzionale (un termine insieme).
 *
 * @param variable nome della variabile legata (non vuoto)
 * @param type tipo dichiarato oppure null
 * @param domain dominio di variazione oppure null
 */
public record Quantifier(String variable, String type, Term domain) {

    public Quantifier {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("Variabile quantificata non può essere null o vuota");
        }
        variable = variable.trim();
    }

    /** Quantificatore senza tipo né dominio */
    public static Quantifier of(String variable) {
        return new Quantifier(variable, null, null);
    }

    /** Quantificatore con annotazione di tipo */
    public static Quantifier of(String variable, String type) {
        return new Quantifier(variable, type, null);
    }

    public boolean hasType() {
        return type != null && !type.isBlank();
    }

    public boolean hasDomain() {
        return domain != null;
    }

    /** Stesso quantificatore con variabile rinominata */
    public Quantifier withVariable(String newVariable) {
        return new Quantifier(newVariable, type, domain);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(variable);
        if (hasType()) {
            sb.append(':').append(type);
        }
        if (hasDomain()) {
            sb.append(" in ").append(domain);
        }
        return sb.toString();
    }
}

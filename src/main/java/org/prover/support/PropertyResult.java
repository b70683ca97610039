package org.prover.support;

import java.util.Objects;

/**
 * VERDETTO - Classificazione terminale di una singola proprietà
 *
 * • PROVEN: la proprietà vale (prova trovata o negazione insoddisfacibile)
 * • DISPROVEN: la proprietà è refutata
 * • UNKNOWN: risorse esaurite o nessuna regola applicabile
 * • ERROR: input malformato o guasto che ha impedito la decisione
 *
 * Immutabile, costruito solo tramite factory method.
 */
public final class PropertyResult {

    public enum Outcome {
        PROVEN, DISPROVEN, UNKNOWN, ERROR
    }

    private static final PropertyResult PROVEN = new PropertyResult(Outcome.PROVEN, null);
    private static final PropertyResult DISPROVEN = new PropertyResult(Outcome.DISPROVEN, null);
    private static final PropertyResult UNKNOWN = new PropertyResult(Outcome.UNKNOWN, null);

    private final Outcome outcome;

    /** Motivazione: obbligatoria per ERROR, facoltativa per UNKNOWN, assente altrimenti */
    private final String reason;

    private PropertyResult(Outcome outcome, String reason) {
        this.outcome = outcome;
        this.reason = reason;
    }

    //region FACTORY METHODS

    public static PropertyResult proven() {
        return PROVEN;
    }

    public static PropertyResult disproven() {
        return DISPROVEN;
    }

    public static PropertyResult unknown() {
        return UNKNOWN;
    }

    /**
     * Verdetto indeterminato con la causa (timeout, limite di passi, ...).
     */
    public static PropertyResult unknown(String reason) {
        return reason == null ? UNKNOWN : new PropertyResult(Outcome.UNKNOWN, reason);
    }

    /**
     * Verdetto di errore.
     *
     * @param reason descrizione del problema (non null, non vuota)
     * @throws IllegalArgumentException se reason è null o vuota
     */
    public static PropertyResult error(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Un verdetto di errore richiede una motivazione");
        }
        return new PropertyResult(Outcome.ERROR, reason);
    }

    //endregion

    //region QUERY

    public Outcome outcome() {
        return outcome;
    }

    public String reason() {
        return reason;
    }

    public boolean isProven() {
        return outcome == Outcome.PROVEN;
    }

    public boolean isDisproven() {
        return outcome == Outcome.DISPROVEN;
    }

    public boolean isUnknown() {
        return outcome == Outcome.UNKNOWN;
    }

    public boolean isError() {
        return outcome == Outcome.ERROR;
    }

    /** PROVEN e DISPROVEN sono gli unici esiti definitivi */
    public boolean isConclusive() {
        return outcome == Outcome.PROVEN || outcome == Outcome.DISPROVEN;
    }

    //endregion

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyResult other)) return false;
        return outcome == other.outcome && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outcome, reason);
    }

    @Override
    public String toString() {
        return reason == null ? outcome.name() : outcome.name() + " (" + reason + ")";
    }
}

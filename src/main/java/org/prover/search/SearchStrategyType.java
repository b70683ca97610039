package org.prover.search;

/**
 * Strategie di ricerca di prove disponibili.
 */
public enum SearchStrategyType {
    NATURAL_DEDUCTION,
    BACKWARD_CHAINING,
    FORWARD_CHAINING,
    RESOLUTION
}

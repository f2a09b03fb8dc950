package com.minimax.core;

import java.util.Comparator;

/**
 * Total order over payoff values together with its extremal values.
 *
 * @param <P> the payoff type
 */
public interface PayoffScale<P> extends Comparator<P> {

    /**
     * Returns the least payoff of the scale. No evaluation may score below it.
     */
    P min();

    /**
     * Returns the greatest payoff of the scale. No evaluation may score above it.
     */
    P max();

    default boolean isBetter(P candidate, P incumbent) {
        return compare(candidate, incumbent) > 0;
    }

    default boolean isWorse(P candidate, P incumbent) {
        return compare(candidate, incumbent) < 0;
    }

    default P higher(P left, P right) {
        return compare(left, right) >= 0 ? left : right;
    }

    default P lower(P left, P right) {
        return compare(left, right) <= 0 ? left : right;
    }
}

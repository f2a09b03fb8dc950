package com.minimax.core;

/**
 * Payoff scale that also provides an additive inverse, as required by negamax.
 *
 * <p>{@link #negate} must be an involution that reverses the order of the scale and maps
 * {@link #min()} onto {@link #max()}.
 *
 * @param <P> the payoff type
 */
public interface NegatingPayoffScale<P> extends PayoffScale<P> {

    /**
     * Returns the payoff of the same outcome seen from the opponent's side.
     */
    P negate(P payoff);
}

package com.minimax.core;

/**
 * Static evaluation of game positions.
 *
 * @param <S> the position type
 * @param <P> the payoff type
 */
public interface Evaluator<S, P> {

    /**
     * Scores the position from the point of view of the given actor. Searchers call this only on
     * terminal positions and on positions where the depth budget is exhausted.
     */
    P scoreFor(Actor actor, S state);

    /**
     * Returns the scale the produced payoffs belong to.
     */
    PayoffScale<P> scale();
}

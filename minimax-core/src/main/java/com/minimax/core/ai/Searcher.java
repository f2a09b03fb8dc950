package com.minimax.core.ai;

import com.minimax.core.Action;
import com.minimax.core.Actor;

/**
 * Generic interface for game tree search implementations.
 *
 * <p>A searcher is bound to a rule and an evaluator when it is built and keeps no state between
 * calls.
 *
 * @param <S> the position type
 * @param <A> the action type
 * @param <P> the payoff type
 */
public interface Searcher<S, A extends Action, P> {

    /**
     * Searches for the best action of {@code actor} in {@code state} under the supplied
     * {@link SearchConstraints}.
     *
     * @param state the starting position to analyse; never modified
     * @param actor the actor to choose an action for
     * @param constraints the limits guiding the search execution
     * @return the result of the search
     */
    SearchResult<A, P> search(S state, Actor actor, SearchConstraints constraints);
}

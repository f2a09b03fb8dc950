package com.minimax.core;

import java.util.List;

/**
 * Describes the state transitions of a game.
 *
 * <p>Implementations must be stateless or immutable so that a single instance can be shared by
 * any number of searches. {@link #apply} must never mutate the position it is given: searchers
 * hand the caller's own position to it at the root.
 *
 * @param <S> the position type
 * @param <A> the action type
 */
public interface GameRule<S, A extends Action> {

    /**
     * Returns {@code true} if the provided position already satisfies the end-of-game condition.
     */
    boolean isTerminal(S state);

    /**
     * Enumerates the actions the actor may take in the provided position. The order of the
     * returned list is the order in which searchers explore them, and therefore decides ties.
     * The list may be empty.
     */
    List<A> legalActions(S state, Actor actor);

    /**
     * Returns the position reached by applying the action. The action must be one of
     * {@code legalActions(state, action.actor())}; anything else is a contract violation.
     */
    S apply(S state, A action);
}

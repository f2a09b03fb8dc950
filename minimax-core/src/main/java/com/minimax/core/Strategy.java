package com.minimax.core;

import java.util.Optional;

/**
 * Chooses actions for an actor.
 *
 * @param <S> the position type
 * @param <A> the action type
 */
public interface Strategy<S, A extends Action> {

    /**
     * Selects the action the actor should take in the provided position, or returns an empty
     * result when the actor has no legal action.
     */
    Optional<A> selectAction(S state, Actor actor);
}

package com.minimax.core;

/**
 * A move in a game, tagged with the actor that performs it.
 */
public interface Action {

    /**
     * Returns the actor performing this action.
     */
    Actor actor();
}

package com.minimax.core;

/**
 * One of the two players of a turn-based adversarial game.
 */
public enum Actor {
    FIRST,
    SECOND;

    /**
     * Returns the actor playing against this one.
     */
    public Actor opponent() {
        return this == FIRST ? SECOND : FIRST;
    }
}

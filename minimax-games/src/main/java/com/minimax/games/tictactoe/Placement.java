package com.minimax.games.tictactoe;

import com.minimax.core.Action;
import com.minimax.core.Actor;
import java.util.Objects;

/**
 * Puts the actor's mark on the cell at {@code (column, row)}.
 */
public record Placement(int column, int row, Actor actor) implements Action {

    public Placement {
        Objects.requireNonNull(actor, "actor");
        TicTacToeBoard.checkCell(column, row);
    }

    @Override
    public String toString() {
        return "Player " + actor + " placed at (" + column + ", " + row + ").";
    }
}

package com.minimax.games.tictactoe;

import com.minimax.core.Actor;
import com.minimax.core.GameRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tic-tac-toe rules: any empty cell may be marked until a line is completed or the board is full.
 */
public final class TicTacToeRule implements GameRule<TicTacToeBoard, Placement> {

    private static final TicTacToeRule INSTANCE = new TicTacToeRule();

    private TicTacToeRule() {
    }

    public static TicTacToeRule instance() {
        return INSTANCE;
    }

    @Override
    public boolean isTerminal(TicTacToeBoard state) {
        return state.result().isPresent();
    }

    /**
     * Lists the empty cells in row-major order; nothing once the match is over.
     */
    @Override
    public List<Placement> legalActions(TicTacToeBoard state, Actor actor) {
        Objects.requireNonNull(actor, "actor");
        if (isTerminal(state)) {
            return List.of();
        }
        List<Placement> actions = new ArrayList<>(TicTacToeBoard.CELL_COUNT - state.countMarks());
        for (int row = 0; row < TicTacToeBoard.SIZE; row++) {
            for (int column = 0; column < TicTacToeBoard.SIZE; column++) {
                if (state.isEmpty(column, row)) {
                    actions.add(new Placement(column, row, actor));
                }
            }
        }
        return actions;
    }

    /**
     * @throws IllegalArgumentException if the cell is occupied or the match is already over
     */
    @Override
    public TicTacToeBoard apply(TicTacToeBoard state, Placement action) {
        Objects.requireNonNull(action, "action");
        if (isTerminal(state)) {
            throw new IllegalArgumentException("Match is over, cannot play " + action);
        }
        return state.with(action.column(), action.row(), action.actor());
    }
}

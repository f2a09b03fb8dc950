package com.minimax.games.tictactoe;

import com.minimax.core.Actor;
import com.minimax.core.NegatingPayoffScale;
import com.minimax.core.OrdinalPayoffScale;
import com.minimax.core.ZeroSumEvaluator;
import java.util.Optional;

/**
 * Scores finished boards by their outcome and open boards by who holds the centre cell.
 */
public final class CenterMassEvaluator implements ZeroSumEvaluator<TicTacToeBoard, BoardEvaluation> {

    private static final OrdinalPayoffScale<BoardEvaluation> SCALE = OrdinalPayoffScale.mirrored(BoardEvaluation.class);
    private static final int CENTER = TicTacToeBoard.SIZE / 2;

    @Override
    public BoardEvaluation scoreFor(Actor actor, TicTacToeBoard state) {
        Optional<GameResult> result = state.result();
        if (result.isPresent()) {
            GameResult outcome = result.get();
            if (outcome.isDraw()) {
                return BoardEvaluation.EQUAL;
            }
            return outcome.isWinFor(actor) ? BoardEvaluation.WIN : BoardEvaluation.LOSE;
        }
        return state.at(CENTER, CENTER)
                .map(owner -> owner == actor
                        ? BoardEvaluation.OCCUPY_CENTER_MASS
                        : BoardEvaluation.OCCUPIED_CENTER_MASS)
                .orElse(BoardEvaluation.EQUAL);
    }

    @Override
    public NegatingPayoffScale<BoardEvaluation> scale() {
        return SCALE;
    }
}

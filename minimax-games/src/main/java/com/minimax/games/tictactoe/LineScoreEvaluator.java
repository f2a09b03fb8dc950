package com.minimax.games.tictactoe;

import com.minimax.core.Actor;
import com.minimax.core.IntPayoffScale;
import com.minimax.core.NegatingPayoffScale;
import com.minimax.core.ZeroSumEvaluator;
import java.util.Optional;

/**
 * Numeric evaluator: a decided match is worth {@link #WIN_SCORE}, an open board is worth the
 * actor's open lines minus the opponent's, each weighted by the marks already on it.
 */
public final class LineScoreEvaluator implements ZeroSumEvaluator<TicTacToeBoard, Integer> {

    public static final int WIN_SCORE = 1000;

    private static final int[] LINE_WEIGHTS = {0, 1, 10, 0};

    @Override
    public Integer scoreFor(Actor actor, TicTacToeBoard state) {
        Optional<GameResult> result = state.result();
        if (result.isPresent()) {
            GameResult outcome = result.get();
            if (outcome.isDraw()) {
                return 0;
            }
            return outcome.isWinFor(actor) ? WIN_SCORE : -WIN_SCORE;
        }
        return openLineScore(state.bits(actor), state.bits(actor.opponent()))
                - openLineScore(state.bits(actor.opponent()), state.bits(actor));
    }

    private static int openLineScore(int own, int other) {
        int score = 0;
        for (int line : TicTacToeBoard.LINES) {
            if ((other & line) == 0) {
                score += LINE_WEIGHTS[Integer.bitCount(own & line)];
            }
        }
        return score;
    }

    @Override
    public NegatingPayoffScale<Integer> scale() {
        return IntPayoffScale.instance();
    }
}
